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

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Last committed offset per topic-partition, used to skip commits that would not change anything.
 *
 * <p>The cache is optimistic: it is updated when a commit is requested, not when the broker
 * acknowledges it. It must be reset on every start, stop and rebalance.
 */
public class OffsetCommitCache {
    private final Map<String, Map<Integer, Long>> topicToPartitionOffsets = new HashMap<>();

    /**
     * Return the offsets that differ from the cached ones, or are not cached, and cache them.
     */
    public synchronized Map<String, Map<Integer, Long>> filterChanged(final Map<String, Map<Integer, Long>> topicToPartitionOffsetMap) {
        Objects.requireNonNull(topicToPartitionOffsetMap, "topicToPartitionOffsetMap cannot be null");

        final Map<String, Map<Integer, Long>> changed = new HashMap<>();
        for (final var topicEntry : topicToPartitionOffsetMap.entrySet()) {
            final String topic = topicEntry.getKey();
            final Map<Integer, Long> cached = topicToPartitionOffsets.computeIfAbsent(topic, ignore -> new HashMap<>());
            for (final var partitionEntry : topicEntry.getValue().entrySet()) {
                final Integer partition = partitionEntry.getKey();
                final Long offset = Objects.requireNonNull(partitionEntry.getValue(),
                    () -> "offset of " + topic + "-" + partition + " cannot be null");
                if (!offset.equals(cached.get(partition))) {
                    cached.put(partition, offset);
                    changed.computeIfAbsent(topic, ignore -> new HashMap<>()).put(partition, offset);
                }
            }
        }
        return changed;
    }

    public synchronized Optional<Long> cachedOffset(final String topic, final int partition) {
        final Map<Integer, Long> partitions = topicToPartitionOffsets.get(topic);
        return partitions == null ? Optional.empty() : Optional.ofNullable(partitions.get(partition));
    }

    public synchronized boolean isEmpty() {
        return topicToPartitionOffsets.values().stream().allMatch(Map::isEmpty);
    }

    public synchronized void reset() {
        topicToPartitionOffsets.clear();
    }
}
