/*
 * Inkless
 * Copyright (C) 2024 - 2025 Aiven OY
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package io.aiven.pipeline.consume;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Criteria to discover topics. Every field is optional.
 *
 * @param createdAfter topics created at or after this timestamp, in epoch seconds
 * @param filterFunction custom filter applied to the topics already matching the other criteria
 */
public record TopicFilter(
    String namespace,
    String source,
    Long createdAfter,
    UnaryOperator<List<TopicDescriptor>> filterFunction
) {
    public static TopicFilter forNamespace(final String namespace) {
        return new TopicFilter(namespace, null, null, null);
    }

    public List<TopicDescriptor> apply(final TopicDiscovery discovery) {
        final List<TopicDescriptor> topics = discovery.topicsByCriteria(namespace, source, createdAfter);
        return filterFunction == null ? topics : filterFunction.apply(topics);
    }
}
