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

import org.apache.kafka.common.TopicPartition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import io.aiven.pipeline.broker.BrokerClient;
import io.aiven.pipeline.broker.OffsetCommitRequest;
import io.aiven.pipeline.config.PipelineClientConfig;

/**
 * Consumer of a set of topics in a consumer group, with explicit offset commits.
 *
 * <p>Commits go through an {@link OffsetCommitCache} so that unchanged offsets are not sent again.
 * The cache, the topic to partitions map and the per-topic states are rebuilt on every start, stop
 * and rebalance; they are never patched across an assignment change.
 *
 * <p>Changing the tailed topics requires the group membership to be renegotiated, so it is done
 * by a full stop and start.
 *
 * <p>Use with try-with-resources: {@link #close()} stops the consumer, and a failure while
 * stopping never masks an exception thrown by the enclosed code.
 */
public class ConsumerTopicController implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConsumerTopicController.class);

    private final String groupId;
    private final BrokerClient brokerClient;
    private final GroupMembership groupMembership;
    private final TopicDiscovery topicDiscovery;
    private final String autoOffsetReset;
    private final Duration partitionerCooldown;
    private final Duration getMessagesTimeout;
    private final OffsetCommitCache offsetCommitCache;
    private final OffsetCommitMetrics metrics;
    private final RebalanceCoordinator rebalanceCoordinator;

    private Map<String, ConsumerTopicState> initialTopicStates;
    private volatile Map<String, ConsumerTopicState> topicStates = new ConcurrentHashMap<>();
    private volatile boolean running = false;

    /**
     * @param topicToConsumerTopicState offsets to start from per topic; a {@code null} state resumes
     *                                  from the committed offset, or from the auto offset reset position
     * @param topicDiscovery used by {@link #refreshNewTopics}, may be {@code null}
     * @param preRebalanceCallback may be {@code null}
     * @param postRebalanceCallback may be {@code null}
     */
    public ConsumerTopicController(final String groupId,
                                   final Map<String, ConsumerTopicState> topicToConsumerTopicState,
                                   final BrokerClient brokerClient,
                                   final GroupMembership groupMembership,
                                   final TopicDiscovery topicDiscovery,
                                   final PipelineClientConfig config,
                                   final RebalanceCallback preRebalanceCallback,
                                   final RebalanceCallback postRebalanceCallback,
                                   final OffsetCommitMetrics metrics) {
        this.groupId = Objects.requireNonNull(groupId, "groupId cannot be null");
        this.brokerClient = Objects.requireNonNull(brokerClient, "brokerClient cannot be null");
        this.groupMembership = Objects.requireNonNull(groupMembership, "groupMembership cannot be null");
        this.topicDiscovery = topicDiscovery;
        Objects.requireNonNull(config, "config cannot be null");
        this.autoOffsetReset = config.autoOffsetReset();
        this.partitionerCooldown = config.partitionerCooldown();
        this.getMessagesTimeout = config.getMessagesTimeout();
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.offsetCommitCache = new OffsetCommitCache();
        this.rebalanceCoordinator = new RebalanceCoordinator(
            offsetCommitCache,
            metrics,
            preRebalanceCallback,
            postRebalanceCallback,
            this::resetTopicStates
        );

        final Map<String, ConsumerTopicState> initial = copyOf(topicToConsumerTopicState);
        this.initialTopicStates = initial;
        rebalanceCoordinator.replaceTopics(partitionsOf(initial));
    }

    /**
     * Commit the offsets of the initial topic states and join the group.
     */
    public void start() {
        LOGGER.info("Committing offsets for consumer {}", groupId);
        offsetCommitCache.reset();
        commitTopicStateOffsets(initialTopicStates);
        LOGGER.info("Offsets committed for consumer {}", groupId);
        startConsumer();
    }

    private void startConsumer() {
        LOGGER.info("Starting consumer {}", groupId);
        if (running) {
            throw new IllegalStateException("Consumer " + groupId + " is already running");
        }
        final ConsumerGroupSpec spec = new ConsumerGroupSpec(
            groupId,
            rebalanceCoordinator.topicToPartitionMap().keySet(),
            autoOffsetReset,
            partitionerCooldown
        );
        groupMembership.start(spec, rebalanceCoordinator);
        running = true;
        LOGGER.info("Consumer {} started", groupId);
    }

    /**
     * Leave the group and close the broker connection. Safe to call when not running,
     * and the consumer can be started again afterwards.
     */
    public void stop() {
        LOGGER.info("Stopping consumer {}", groupId);
        try {
            if (running) {
                groupMembership.stop();
            }
        } finally {
            running = false;
            offsetCommitCache.reset();
            brokerClient.close();
        }
        LOGGER.info("Consumer {} stopped", groupId);
    }

    @Override
    public void close() {
        try {
            stop();
        } catch (final RuntimeException e) {
            LOGGER.error("Failed to stop consumer {}", groupId, e);
            throw e;
        }
    }

    public List<ConsumedMessage> getMessages(final int count, final Duration timeout) {
        final List<ConsumedMessage> messages = groupMembership.poll(count, timeout);
        for (final ConsumedMessage message : messages) {
            topicStates.computeIfAbsent(message.topic(), ignore -> ConsumerTopicState.empty()).update(message);
        }
        return messages;
    }

    public List<ConsumedMessage> getMessages(final int count) {
        return getMessages(count, getMessagesTimeout);
    }

    public Optional<ConsumedMessage> getMessage() {
        return getMessages(1).stream().findFirst();
    }

    public void commitMessage(final ConsumedMessage message) {
        commitMessages(List.of(message));
    }

    /**
     * Commit the position after the highest offset of each topic-partition among the messages.
     */
    public void commitMessages(final List<ConsumedMessage> messages) {
        final Map<String, Map<Integer, Long>> topicToPartitionOffsetMap = new HashMap<>();
        for (final ConsumedMessage message : messages) {
            topicToPartitionOffsetMap
                .computeIfAbsent(message.topic(), ignore -> new HashMap<>())
                .merge(message.partition(), message.offset() + 1, Math::max);
        }
        commitOffsets(topicToPartitionOffsetMap);
    }

    /**
     * Commit the given next-read offsets, skipping those equal to the last committed ones.
     *
     * @param topicToPartitionOffsetMap e.g. {@code {topic1: {0: 83854, 1: 8943892}, topic2: {0: 190898}}}
     */
    public void commitOffsets(final Map<String, Map<Integer, Long>> topicToPartitionOffsetMap) {
        final Map<String, Map<Integer, Long>> changed = offsetCommitCache.filterChanged(topicToPartitionOffsetMap);

        final List<OffsetCommitRequest> requests = new ArrayList<>();
        for (final var topicEntry : changed.entrySet()) {
            for (final var partitionEntry : topicEntry.getValue().entrySet()) {
                requests.add(new OffsetCommitRequest(
                    new TopicPartition(topicEntry.getKey(), partitionEntry.getKey()),
                    partitionEntry.getValue()
                ));
            }
        }
        final int requested = topicToPartitionOffsetMap.values().stream().mapToInt(Map::size).sum();
        metrics.offsetsCommitted(requests.size(), requested - requests.size());

        if (!requests.isEmpty()) {
            LOGGER.debug("Committing {} offsets for consumer {}", requests.size(), groupId);
            brokerClient.commitOffsets(groupId, requests);
        }
    }

    /**
     * Run the work and commit the messages afterwards, also when the work fails.
     */
    public <T> T ensureCommitted(final List<ConsumedMessage> messages, final Callable<T> work) throws Exception {
        final T result;
        try {
            result = work.call();
        } catch (final Exception e) {
            try {
                commitMessages(messages);
            } catch (final RuntimeException commitError) {
                e.addSuppressed(commitError);
            }
            throw e;
        }
        commitMessages(messages);
        return result;
    }

    /**
     * Restart the consumer with a new set of topics and starting offsets.
     *
     * <p>Messages consumed but not committed before this call may be consumed again.
     */
    public void resetTopics(final Map<String, ConsumerTopicState> topicToConsumerTopicState) {
        final Map<String, ConsumerTopicState> newStates = copyOf(topicToConsumerTopicState);
        stop();
        initialTopicStates = newStates;
        commitTopicStateOffsets(newStates);
        rebalanceCoordinator.replaceTopics(partitionsOf(newStates));
        startConsumer();
    }

    /**
     * Start tailing the topics of the source that are not tracked yet.
     *
     * @return the new topics that are part of the assignment after the restart; topics that
     *         do not exist are dropped from the assignment and are not returned
     */
    public List<String> refreshTopics(final TopicSource topicSource) {
        Objects.requireNonNull(topicSource, "topicSource cannot be null");
        List<String> newTopics = untracked(topicSource.topics());
        if (newTopics.isEmpty()) {
            return newTopics;
        }

        LOGGER.info("Consumer {} refreshing topics, adding {}", groupId, newTopics);
        restartWith(newTopics);
        newTopics = newTopics.stream()
            .filter(rebalanceCoordinator::isTracked)
            .collect(Collectors.toList());
        return newTopics;
    }

    /**
     * Discover the topics matching the filter and start tailing the ones not tracked yet.
     *
     * @param preTopicRefreshCallback invoked with the old and the new topic names before the restart, may be {@code null}
     * @return the newly discovered topics
     */
    public List<TopicDescriptor> refreshNewTopics(final TopicFilter topicFilter,
                                                  final PreTopicRefreshCallback preTopicRefreshCallback) {
        Objects.requireNonNull(topicFilter, "topicFilter cannot be null");
        if (topicDiscovery == null) {
            throw new IllegalStateException("Consumer " + groupId + " has no topic discovery");
        }
        final List<TopicDescriptor> newTopics = topicFilter.apply(topicDiscovery).stream()
            .filter(topic -> !rebalanceCoordinator.isTracked(topic.name()))
            .collect(Collectors.toList());

        if (!newTopics.isEmpty()) {
            final List<String> newTopicNames = newTopics.stream().map(TopicDescriptor::name).collect(Collectors.toList());
            final List<String> oldTopicNames = new ArrayList<>(rebalanceCoordinator.topicToPartitionMap().keySet());
            if (preTopicRefreshCallback != null) {
                preTopicRefreshCallback.beforeRefresh(oldTopicNames, newTopicNames);
            }
            LOGGER.info("Consumer {} refreshing topics, adding {}", groupId, newTopicNames);
            restartWith(newTopicNames);
        }
        return newTopics;
    }

    private void restartWith(final List<String> newTopics) {
        stop();
        rebalanceCoordinator.addTopics(newTopics);
        startConsumer();
    }

    private List<String> untracked(final List<String> topics) {
        return topics.stream()
            .distinct()
            .filter(topic -> !rebalanceCoordinator.isTracked(topic))
            .collect(Collectors.toList());
    }

    private void commitTopicStateOffsets(final Map<String, ConsumerTopicState> topicToConsumerTopicState) {
        final Map<String, Map<Integer, Long>> topicToPartitionOffsetMap = new HashMap<>();
        for (final var entry : topicToConsumerTopicState.entrySet()) {
            if (entry.getValue() != null) {
                topicToPartitionOffsetMap.put(entry.getKey(), entry.getValue().partitionOffsetMap());
            }
        }
        commitOffsets(topicToPartitionOffsetMap);
    }

    private void resetTopicStates(final Map<String, Set<Integer>> assignment) {
        final Map<String, ConsumerTopicState> states = new ConcurrentHashMap<>();
        for (final String topic : assignment.keySet()) {
            states.put(topic, ConsumerTopicState.empty());
        }
        topicStates = states;
    }

    private static Map<String, ConsumerTopicState> copyOf(final Map<String, ConsumerTopicState> topicToConsumerTopicState) {
        Objects.requireNonNull(topicToConsumerTopicState, "topicToConsumerTopicState cannot be null");
        // Null states are allowed, so no Map.copyOf.
        final Map<String, ConsumerTopicState> copy = new HashMap<>();
        topicToConsumerTopicState.forEach((topic, state) -> copy.put(topic, state == null ? null : state.copy()));
        return copy;
    }

    private static Map<String, Set<Integer>> partitionsOf(final Map<String, ConsumerTopicState> topicToConsumerTopicState) {
        final Map<String, Set<Integer>> partitions = new HashMap<>();
        topicToConsumerTopicState.forEach((topic, state) ->
            partitions.put(topic, state == null ? Set.of() : state.partitionOffsetMap().keySet()));
        return partitions;
    }

    public Map<String, Set<Integer>> topicToPartitionMap() {
        return rebalanceCoordinator.topicToPartitionMap();
    }

    /**
     * Copy of the read position per topic since the last assignment.
     */
    public Map<String, ConsumerTopicState> topicStates() {
        final Map<String, ConsumerTopicState> copy = new HashMap<>();
        topicStates.forEach((topic, state) -> copy.put(topic, state.copy()));
        return Collections.unmodifiableMap(copy);
    }

    public boolean isRunning() {
        return running;
    }

    public String groupId() {
        return groupId;
    }

    // Visible for testing
    OffsetCommitCache offsetCommitCache() {
        return offsetCommitCache;
    }

    // Visible for testing
    RebalanceCoordinator rebalanceCoordinator() {
        return rebalanceCoordinator;
    }
}
