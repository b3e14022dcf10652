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
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Provides the names of the topics a consumer should be tailing.
 */
@FunctionalInterface
public interface TopicSource {
    List<String> topics();

    static TopicSource of(final String... topics) {
        final List<String> names = List.of(topics);
        return () -> names;
    }

    static TopicSource matching(final TopicDiscovery discovery, final TopicFilter filter) {
        Objects.requireNonNull(discovery, "discovery cannot be null");
        Objects.requireNonNull(filter, "filter cannot be null");
        return () -> filter.apply(discovery).stream()
            .map(TopicDescriptor::name)
            .collect(Collectors.toList());
    }
}
