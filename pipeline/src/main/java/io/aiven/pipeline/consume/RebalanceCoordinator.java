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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Owns the topic to partitions map of a consumer and keeps it, and the offset state derived
 * from it, consistent with the assignment delivered by the group-coordination layer.
 *
 * <p>The map is always replaced as a whole, never patched. Partitions of a topic
 * that is tracked but not assigned yet are represented by an empty set.
 */
public class RebalanceCoordinator implements RebalanceListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(RebalanceCoordinator.class);

    private final OffsetCommitCache offsetCommitCache;
    private final OffsetCommitMetrics metrics;
    private final RebalanceCallback preRebalanceCallback;
    private final RebalanceCallback postRebalanceCallback;
    private final Consumer<Map<String, Set<Integer>>> assignmentApplied;

    private volatile Map<String, Set<Integer>> topicToPartitionMap = Map.of();

    /**
     * @param preRebalanceCallback optional user callback, may be {@code null}
     * @param postRebalanceCallback optional user callback, may be {@code null}
     * @param assignmentApplied invoked with each new assignment after the offset cache is reset
     */
    public RebalanceCoordinator(final OffsetCommitCache offsetCommitCache,
                                final OffsetCommitMetrics metrics,
                                final RebalanceCallback preRebalanceCallback,
                                final RebalanceCallback postRebalanceCallback,
                                final Consumer<Map<String, Set<Integer>>> assignmentApplied) {
        this.offsetCommitCache = Objects.requireNonNull(offsetCommitCache, "offsetCommitCache cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.preRebalanceCallback = preRebalanceCallback;
        this.postRebalanceCallback = postRebalanceCallback;
        this.assignmentApplied = Objects.requireNonNull(assignmentApplied, "assignmentApplied cannot be null");
    }

    @Override
    public void onPartitionsRevoked(final Map<String, Set<Integer>> assignment) {
        LOGGER.debug("Partitions revoked: {}", assignment);
        if (preRebalanceCallback != null) {
            preRebalanceCallback.onRebalance(snapshot(assignment));
        }
    }

    @Override
    public void onPartitionsAssigned(final Map<String, Set<Integer>> assignment) {
        final Map<String, Set<Integer>> newAssignment = snapshot(assignment);
        LOGGER.info("Partitions assigned: {}", newAssignment);

        topicToPartitionMap = newAssignment;
        offsetCommitCache.reset();
        assignmentApplied.accept(newAssignment);
        metrics.rebalanced();

        if (postRebalanceCallback != null) {
            postRebalanceCallback.onRebalance(newAssignment);
        }
    }

    public Map<String, Set<Integer>> topicToPartitionMap() {
        return topicToPartitionMap;
    }

    /**
     * Replace the tracked topics, e.g. before restarting with a new topic set.
     */
    public void replaceTopics(final Map<String, Set<Integer>> topicToPartitions) {
        topicToPartitionMap = snapshot(topicToPartitions);
    }

    /**
     * Track additional topics whose partitions are not known yet.
     */
    public void addTopics(final Iterable<String> topics) {
        final Map<String, Set<Integer>> extended = new HashMap<>(topicToPartitionMap);
        for (final String topic : topics) {
            extended.putIfAbsent(topic, Set.of());
        }
        topicToPartitionMap = Collections.unmodifiableMap(extended);
    }

    public boolean isTracked(final String topic) {
        return topicToPartitionMap.containsKey(topic);
    }

    private static Map<String, Set<Integer>> snapshot(final Map<String, Set<Integer>> assignment) {
        Objects.requireNonNull(assignment, "assignment cannot be null");
        final Map<String, Set<Integer>> copy = new HashMap<>();
        for (final var entry : assignment.entrySet()) {
            copy.put(entry.getKey(), entry.getValue() == null ? Set.of() : Set.copyOf(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }
}
