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
package io.aiven.pipeline.produce;

import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.utils.Time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.aiven.pipeline.broker.BrokerClient;
import io.aiven.pipeline.config.PipelineClientConfig;

/**
 * Publishes a batch in bounded rounds, letting a fresh {@link RetryHandler} decide after
 * each round what has to be sent again.
 */
public class RetryingPublisher {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingPublisher.class);

    private final BrokerClient brokerClient;
    private final PublishGuarantee guarantee;
    private final WatermarkReconciler reconciler;
    private final int maxRounds;
    private final Duration retryBackoff;
    private final Time time;
    private final PublishRetryMetrics metrics;

    public RetryingPublisher(final BrokerClient brokerClient,
                             final PipelineClientConfig config,
                             final Time time,
                             final PublishRetryMetrics metrics) {
        this(
            brokerClient,
            config.publishGuarantee(),
            new WatermarkReconciler(brokerClient, config.unverifiedRequestPolicy()),
            config.maxPublishRounds(),
            config.publishRetryBackoff(),
            time,
            metrics
        );
    }

    public RetryingPublisher(final BrokerClient brokerClient,
                             final PublishGuarantee guarantee,
                             final WatermarkReconciler reconciler,
                             final int maxRounds,
                             final Duration retryBackoff,
                             final Time time,
                             final PublishRetryMetrics metrics) {
        this.brokerClient = Objects.requireNonNull(brokerClient, "brokerClient cannot be null");
        this.guarantee = Objects.requireNonNull(guarantee, "guarantee cannot be null");
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler cannot be null");
        if (maxRounds <= 0) {
            throw new IllegalArgumentException("maxRounds must be positive");
        }
        this.maxRounds = maxRounds;
        this.retryBackoff = Objects.requireNonNull(retryBackoff, "retryBackoff cannot be null");
        this.time = Objects.requireNonNull(time, "time cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    }

    /**
     * @param requests the batch to publish
     * @param trackedOffsets offset of each topic before the batch, used to verify disputed requests
     */
    public PublishResult publish(final List<PublishRequest> requests, final Map<String, Long> trackedOffsets) {
        Objects.requireNonNull(requests, "requests cannot be null");
        Objects.requireNonNull(trackedOffsets, "trackedOffsets cannot be null");

        final long start = time.milliseconds();
        final RetryHandler handler = new RetryHandler(requests, guarantee, reconciler);
        final Map<String, Long> offsets = new HashMap<>(trackedOffsets);

        int round = 0;
        while (!handler.requestsToBeSent().isEmpty() && round < maxRounds) {
            if (round > 0) {
                time.sleep(retryBackoff.toMillis());
            }
            round++;

            final List<PublishRequest> toSend = handler.requestsToBeSent();
            LOGGER.debug("Publish round {} with {} requests", round, toSend.size());
            handler.updateUnpublishedRequests(send(toSend), offsets);
            advanceTrackedOffsets(offsets, handler.successStatsThisRound());

            metrics.roundCompleted(
                handler.requestsToBeSent().size(),
                handler.hiddenSuccessesLastRound(),
                handler.droppedLastRound()
            );
        }

        final boolean unpublished = handler.hasUnpublishedRequest();
        if (!handler.requestsToBeSent().isEmpty()) {
            LOGGER.warn("Giving up after {} rounds with {} requests unsent", round, handler.requestsToBeSent().size());
        } else if (unpublished) {
            LOGGER.warn("Some requests of the batch could not be published or verified");
        }
        metrics.publishCompleted(time.milliseconds() - start, handler.totalPublishedMessageCount());

        return new PublishResult(
            handler.totalPublishedMessageCount(),
            round,
            handler.requestsToBeSent(),
            unpublished,
            handler.successStatsCumulative(),
            offsets
        );
    }

    private List<PublishResponse> send(final List<PublishRequest> requests) {
        try {
            return brokerClient.publish(requests);
        } catch (final Exception e) {
            // No response at all for this round, every request is disputed.
            LOGGER.warn("Publish round failed", e);
            return List.of();
        }
    }

    private static void advanceTrackedOffsets(final Map<String, Long> offsets,
                                              final Map<TopicPartition, Stats> statsThisRound) {
        for (final Map.Entry<TopicPartition, Stats> entry : statsThisRound.entrySet()) {
            final long published = entry.getValue().messageCount();
            offsets.computeIfPresent(entry.getKey().topic(), (topic, offset) -> offset + published);
        }
    }
}
