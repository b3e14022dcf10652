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

import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.aiven.pipeline.broker.BrokerClient;
import io.aiven.pipeline.broker.OffsetCommitRequest;
import io.aiven.pipeline.config.PipelineClientConfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.STRICT_STUBS)
class ConsumerTopicControllerTest {
    static final String GROUP = "group";

    @Mock
    BrokerClient brokerClient;
    @Mock
    RebalanceCallback preRebalanceCallback;
    @Mock
    RebalanceCallback postRebalanceCallback;
    @Captor
    ArgumentCaptor<List<OffsetCommitRequest>> commitCaptor;

    FakeGroupMembership membership;
    OffsetCommitMetrics metrics;

    @BeforeEach
    void setUp() {
        membership = new FakeGroupMembership(Set.of("t1", "t2"));
        metrics = new OffsetCommitMetrics();
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    ConsumerTopicController controller(final Map<String, ConsumerTopicState> initial, final TopicDiscovery discovery) {
        return new ConsumerTopicController(
            GROUP,
            initial,
            brokerClient,
            membership,
            discovery,
            new PipelineClientConfig(Map.of()),
            preRebalanceCallback,
            postRebalanceCallback,
            metrics
        );
    }

    ConsumerTopicController controller(final String... topics) {
        final Map<String, ConsumerTopicState> initial = new HashMap<>();
        for (final String topic : topics) {
            initial.put(topic, null);
        }
        return controller(initial, null);
    }

    static OffsetCommitRequest commit(final String topic, final int partition, final long offset) {
        return new OffsetCommitRequest(new TopicPartition(topic, partition), offset);
    }

    @Test
    void startCommitsInitialOffsetsAndJoinsGroup() {
        final Map<String, ConsumerTopicState> initial = new HashMap<>();
        initial.put("t1", new ConsumerTopicState(Map.of(0, 10L), null));
        initial.put("t2", null);
        final ConsumerTopicController controller = controller(initial, null);

        assertThat(controller.topicToPartitionMap()).isEqualTo(Map.of("t1", Set.of(0), "t2", Set.of()));

        controller.start();

        verify(brokerClient).commitOffsets(GROUP, List.of(commit("t1", 0, 10)));
        assertThat(controller.isRunning()).isTrue();
        assertThat(membership.starts).containsExactly(
            new ConsumerGroupSpec(GROUP, Set.of("t1", "t2"), "earliest", Duration.ofMillis(500)));
        assertThat(controller.topicToPartitionMap()).isEqualTo(Map.of("t1", Set.of(0), "t2", Set.of(0)));
        verify(postRebalanceCallback).onRebalance(Map.of("t1", Set.of(0), "t2", Set.of(0)));
    }

    @Test
    void startTwiceFails() {
        final ConsumerTopicController controller = controller("t1");
        controller.start();

        assertThatThrownBy(controller::start)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Consumer group is already running");
    }

    @Test
    void unchangedOffsetsAreCommittedOnce() {
        final ConsumerTopicController controller = controller("t1");
        controller.start();

        controller.commitOffsets(Map.of("t1", Map.of(0, 5L)));
        controller.commitOffsets(Map.of("t1", Map.of(0, 5L)));
        verify(brokerClient, times(1)).commitOffsets(anyString(), anyList());

        controller.commitOffsets(Map.of("t1", Map.of(0, 6L)));
        verify(brokerClient).commitOffsets(GROUP, List.of(commit("t1", 0, 6)));
        verify(brokerClient, times(2)).commitOffsets(anyString(), anyList());
    }

    @Test
    void commitMessagesCommitsPositionAfterHighestOffset() {
        final ConsumerTopicController controller = controller("t1");

        controller.commitMessages(List.of(
            ConsumedMessage.of("t1", 0, 3),
            ConsumedMessage.of("t1", 0, 7),
            ConsumedMessage.of("t1", 0, 5),
            ConsumedMessage.of("t1", 1, 2)
        ));

        verify(brokerClient).commitOffsets(eq(GROUP), commitCaptor.capture());
        assertThat(commitCaptor.getValue()).containsExactlyInAnyOrder(commit("t1", 0, 8), commit("t1", 1, 3));
        assertThat(controller.offsetCommitCache().cachedOffset("t1", 0)).hasValue(8L);
    }

    @Test
    void commitMessage() {
        final ConsumerTopicController controller = controller("t1");

        controller.commitMessage(ConsumedMessage.of("t1", 2, 99));

        verify(brokerClient).commitOffsets(GROUP, List.of(commit("t1", 2, 100)));
    }

    @Test
    void getMessagesUpdatesTopicStates() {
        final ConsumerTopicController controller = controller("t1");
        controller.start();
        membership.messages.add(new ConsumedMessage("t1", 0, 4, 12, new byte[0]));
        membership.messages.add(ConsumedMessage.of("t1", 0, 5));

        assertThat(controller.getMessages(5)).hasSize(2);

        final ConsumerTopicState state = controller.topicStates().get("t1");
        assertThat(state.partitionOffsetMap()).isEqualTo(Map.of(0, 6L));
        assertThat(state.lastSeenSchemaId()).isEqualTo(12);
        assertThat(membership.lastTimeout).isEqualTo(Duration.ofMillis(100));
        assertThat(controller.getMessage()).isEmpty();
    }

    @Test
    void rebalanceResetsCacheAndTopicStates() {
        final ConsumerTopicController controller = controller("t1", "t2");
        controller.start();
        membership.messages.add(ConsumedMessage.of("t1", 0, 4));
        controller.commitMessages(controller.getMessages(1));
        assertThat(controller.offsetCommitCache().isEmpty()).isFalse();

        membership.rebalance(Map.of("t2", Set.of(0, 1)));

        verify(preRebalanceCallback).onRebalance(Map.of("t1", Set.of(0), "t2", Set.of(0)));
        assertThat(controller.topicToPartitionMap()).isEqualTo(Map.of("t2", Set.of(0, 1)));
        assertThat(controller.offsetCommitCache().isEmpty()).isTrue();
        assertThat(controller.topicStates()).containsOnlyKeys("t2");
        assertThat(controller.topicStates().get("t2").partitionOffsetMap()).isEmpty();

        // The cache no longer knows the offset, so it is committed again.
        controller.commitOffsets(Map.of("t1", Map.of(0, 5L)));
        verify(brokerClient, times(2)).commitOffsets(GROUP, List.of(commit("t1", 0, 5)));
    }

    @Test
    void stopLeavesGroupAndClosesBroker() {
        final ConsumerTopicController controller = controller("t1");
        controller.start();
        controller.commitOffsets(Map.of("t1", Map.of(0, 5L)));

        controller.stop();

        assertThat(membership.stops).isEqualTo(1);
        assertThat(controller.isRunning()).isFalse();
        assertThat(controller.offsetCommitCache().isEmpty()).isTrue();
        verify(brokerClient).close();
    }

    @Test
    void stopWhenNotRunning() {
        final ConsumerTopicController controller = controller("t1");

        controller.stop();

        assertThat(membership.stops).isZero();
        verify(brokerClient).close();
    }

    @Test
    void canRestartAfterStop() {
        final ConsumerTopicController controller = controller("t1");
        controller.start();
        controller.stop();

        controller.start();

        assertThat(controller.isRunning()).isTrue();
        assertThat(membership.starts).hasSize(2);
    }

    @Test
    void closeRethrowsStopFailure() {
        final ConsumerTopicController controller = controller("t1");
        controller.start();
        membership.stopError = new KafkaException("leave group failed");

        assertThatThrownBy(controller::close)
            .isInstanceOf(KafkaException.class)
            .hasMessage("leave group failed");
        assertThat(controller.isRunning()).isFalse();
        verify(brokerClient).close();
    }

    @Test
    void closeFailureDoesNotMaskBodyException() {
        final ConsumerTopicController controller = controller("t1");
        membership.stopError = new KafkaException("leave group failed");

        assertThatThrownBy(() -> {
            try (controller) {
                controller.start();
                throw new IllegalArgumentException("processing failed");
            }
        })
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("processing failed")
            .satisfies(e -> assertThat(e.getSuppressed()).singleElement()
                .isInstanceOf(KafkaException.class));
    }

    @Nested
    class RefreshTopics {
        @Test
        void addsNewExistingTopics() {
            final ConsumerTopicController controller = controller("t1");
            controller.start();

            final List<String> added = controller.refreshTopics(TopicSource.of("t1", "t2", "t3", "t2"));

            assertThat(added).containsExactly("t2");
            assertThat(membership.stops).isEqualTo(1);
            assertThat(membership.starts).hasSize(2);
            assertThat(membership.starts.get(1).topics()).containsExactlyInAnyOrder("t1", "t2", "t3");
            assertThat(controller.topicToPartitionMap()).isEqualTo(Map.of("t1", Set.of(0), "t2", Set.of(0)));
            assertThat(controller.isRunning()).isTrue();
        }

        @Test
        void noRestartWithoutNewTopics() {
            final ConsumerTopicController controller = controller("t1");
            controller.start();

            assertThat(controller.refreshTopics(TopicSource.of("t1"))).isEmpty();
            assertThat(membership.starts).hasSize(1);
            assertThat(membership.stops).isZero();
        }

        @Test
        void refreshNewTopicsFromDiscovery() {
            final TopicDescriptor t1 = new TopicDescriptor("t1", "ns", "src", 1L);
            final TopicDescriptor t2 = new TopicDescriptor("t2", "ns", "src", 2L);
            final List<List<String>> callbackArgs = new ArrayList<>();
            final ConsumerTopicController controller = controller(
                new HashMap<>(Map.of("t1", ConsumerTopicState.empty())),
                (namespace, source, createdAfter) -> "ns".equals(namespace) ? List.of(t1, t2) : List.of()
            );
            controller.start();

            final List<TopicDescriptor> added = controller.refreshNewTopics(
                TopicFilter.forNamespace("ns"),
                (oldTopics, newTopics) -> {
                    callbackArgs.add(oldTopics);
                    callbackArgs.add(newTopics);
                }
            );

            assertThat(added).containsExactly(t2);
            assertThat(callbackArgs).containsExactly(List.of("t1"), List.of("t2"));
            assertThat(controller.topicToPartitionMap()).containsOnlyKeys("t1", "t2");
        }

        @Test
        void refreshNewTopicsAppliesFilterFunction() {
            final TopicDescriptor t2 = new TopicDescriptor("t2", "ns", "src", 2L);
            final ConsumerTopicController controller = controller(
                new HashMap<>(Map.of("t1", ConsumerTopicState.empty())),
                (namespace, source, createdAfter) -> List.of(t2)
            );
            controller.start();

            final List<TopicDescriptor> added = controller.refreshNewTopics(
                new TopicFilter("ns", null, null, topics -> List.of()), null);

            assertThat(added).isEmpty();
            assertThat(membership.starts).hasSize(1);
        }

        @Test
        void refreshNewTopicsRequiresDiscovery() {
            final ConsumerTopicController controller = controller("t1");

            assertThatThrownBy(() -> controller.refreshNewTopics(TopicFilter.forNamespace("ns"), null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Consumer group has no topic discovery");
        }
    }

    @Test
    void resetTopicsRestartsWithNewStates() {
        final ConsumerTopicController controller = controller("t1");
        controller.start();

        controller.resetTopics(Map.of("t2", new ConsumerTopicState(Map.of(0, 4L), null)));

        verify(brokerClient).commitOffsets(GROUP, List.of(commit("t2", 0, 4)));
        assertThat(membership.stops).isEqualTo(1);
        assertThat(membership.starts.get(1).topics()).containsExactly("t2");
        assertThat(controller.topicToPartitionMap()).isEqualTo(Map.of("t2", Set.of(0)));
    }

    @Nested
    class EnsureCommitted {
        final List<ConsumedMessage> messages = List.of(ConsumedMessage.of("t1", 0, 9));

        @Test
        void commitsAfterWork() throws Exception {
            final ConsumerTopicController controller = controller("t1");

            assertThat(controller.ensureCommitted(messages, () -> "done")).isEqualTo("done");

            verify(brokerClient).commitOffsets(GROUP, List.of(commit("t1", 0, 10)));
        }

        @Test
        void commitsWhenWorkFails() {
            final ConsumerTopicController controller = controller("t1");

            assertThatThrownBy(() -> controller.ensureCommitted(messages, () -> {
                throw new IllegalStateException("work failed");
            }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("work failed")
                .hasNoSuppressedExceptions();

            verify(brokerClient).commitOffsets(GROUP, List.of(commit("t1", 0, 10)));
        }

        @Test
        void commitFailureIsSuppressed() {
            doThrow(new KafkaException("commit failed")).when(brokerClient).commitOffsets(eq(GROUP), anyList());
            final ConsumerTopicController controller = controller("t1");

            assertThatThrownBy(() -> controller.ensureCommitted(messages, () -> {
                throw new IllegalStateException("work failed");
            }))
                .isInstanceOf(IllegalStateException.class)
                .satisfies(e -> assertThat(e.getSuppressed()).singleElement()
                    .isInstanceOf(KafkaException.class));
        }

        @Test
        void noCommitWhenWorkSucceedsWithoutMessages() throws Exception {
            final ConsumerTopicController controller = controller("t1");

            controller.ensureCommitted(List.of(), () -> 1);

            verify(brokerClient, never()).commitOffsets(anyString(), anyList());
        }
    }

    /**
     * Assigns partition 0 of every requested topic that exists, synchronously on start.
     */
    static class FakeGroupMembership implements GroupMembership {
        final Set<String> existingTopics;
        final List<ConsumerGroupSpec> starts = new ArrayList<>();
        final Deque<ConsumedMessage> messages = new ArrayDeque<>();
        int stops = 0;
        RuntimeException stopError;
        Duration lastTimeout;
        RebalanceListener listener;
        Map<String, Set<Integer>> assignment = Map.of();

        FakeGroupMembership(final Set<String> existingTopics) {
            this.existingTopics = existingTopics;
        }

        @Override
        public void start(final ConsumerGroupSpec spec, final RebalanceListener listener) {
            starts.add(spec);
            this.listener = listener;
            assign(spec.topics());
        }

        private void assign(final Collection<String> topics) {
            final Map<String, Set<Integer>> newAssignment = new HashMap<>();
            for (final String topic : topics) {
                if (existingTopics.contains(topic)) {
                    newAssignment.put(topic, Set.of(0));
                }
            }
            assignment = newAssignment;
            listener.onPartitionsAssigned(newAssignment);
        }

        void rebalance(final Map<String, Set<Integer>> newAssignment) {
            listener.onPartitionsRevoked(assignment);
            assignment = newAssignment;
            listener.onPartitionsAssigned(newAssignment);
        }

        @Override
        public void stop() {
            stops++;
            if (stopError != null) {
                throw stopError;
            }
        }

        @Override
        public List<ConsumedMessage> poll(final int count, final Duration timeout) {
            lastTimeout = timeout;
            final List<ConsumedMessage> polled = new ArrayList<>();
            while (polled.size() < count && !messages.isEmpty()) {
                polled.add(messages.poll());
            }
            return polled;
        }
    }
}
