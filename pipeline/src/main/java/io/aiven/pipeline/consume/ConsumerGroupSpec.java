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

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * What a consumer asks the group-coordination layer to join.
 *
 * @param autoOffsetReset {@code earliest} or {@code latest}, used for partitions without committed offset
 */
public record ConsumerGroupSpec(String groupId, Set<String> topics, String autoOffsetReset, Duration partitionerCooldown) {
    public ConsumerGroupSpec {
        Objects.requireNonNull(groupId, "groupId cannot be null");
        topics = Set.copyOf(Objects.requireNonNull(topics, "topics cannot be null"));
        Objects.requireNonNull(autoOffsetReset, "autoOffsetReset cannot be null");
        Objects.requireNonNull(partitionerCooldown, "partitionerCooldown cannot be null");
    }
}
