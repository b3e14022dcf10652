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

import org.apache.kafka.common.errors.LeaderNotAvailableException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

import io.aiven.pipeline.broker.BrokerClient;

/**
 * Infers whether a publish request without a success response actually landed,
 * by comparing the broker high watermark with the offset tracked before the round.
 *
 * <p>The watermark is queried per topic, as a failing partition leader makes
 * a multi-topic query fail for every topic in it.
 */
public class WatermarkReconciler {
    private static final Logger LOGGER = LoggerFactory.getLogger(WatermarkReconciler.class);

    private static final ReconciliationResult RETRY = new ReconciliationResult.Retry();

    private final BrokerClient brokerClient;
    private final UnverifiedRequestPolicy unverifiedRequestPolicy;

    public WatermarkReconciler(final BrokerClient brokerClient, final UnverifiedRequestPolicy unverifiedRequestPolicy) {
        this.brokerClient = Objects.requireNonNull(brokerClient, "brokerClient cannot be null");
        this.unverifiedRequestPolicy = Objects.requireNonNull(unverifiedRequestPolicy, "unverifiedRequestPolicy cannot be null");
    }

    public ReconciliationResult reconcile(final PublishRequest request, final Map<String, Long> trackedOffsets) {
        Objects.requireNonNull(request, "request cannot be null");
        Objects.requireNonNull(trackedOffsets, "trackedOffsets cannot be null");

        final String topic = request.topic();
        final Long trackedOffset = trackedOffsets.get(topic);
        if (trackedOffset == null) {
            return unverified(request, "no tracked offset for topic " + topic, null);
        }

        final long publishedCount;
        try {
            publishedCount = brokerClient.publishedMessageCount(topic, trackedOffset);
        } catch (final UnknownTopicOrPartitionException e) {
            // The topic may not exist yet or the metadata is stale.
            return tryLoadTopicMetadata(request);
        } catch (final Exception e) {
            return unverified(request, "watermark query failed", e);
        }

        if (publishedCount != request.messageCount()) {
            LOGGER.debug("{} not published, broker holds {} messages past offset {}",
                request, publishedCount, trackedOffset);
            return RETRY;
        }
        LOGGER.debug("{} published according to the watermark of {}", request, topic);
        return new ReconciliationResult.Published(new Stats(trackedOffset + publishedCount, publishedCount));
    }

    private ReconciliationResult tryLoadTopicMetadata(final PublishRequest request) {
        try {
            brokerClient.loadMetadataForTopic(request.topic());
            return RETRY;
        } catch (final LeaderNotAvailableException e) {
            // The broker is creating the topic.
            LOGGER.debug("Leader not yet available for {}, retrying {}", request.topic(), request);
            return RETRY;
        } catch (final Exception e) {
            LOGGER.warn("Cannot load metadata of topic {}, dropping {}", request.topic(), request, e);
            return new ReconciliationResult.Drop("metadata load failed: " + e.getMessage());
        }
    }

    private ReconciliationResult unverified(final PublishRequest request, final String reason, final Exception cause) {
        switch (unverifiedRequestPolicy) {
            case RETRY:
                LOGGER.warn("Cannot verify {} ({}), retrying", request, reason, cause);
                return RETRY;
            case DROP:
            default:
                LOGGER.warn("Cannot verify {} ({}), dropping", request, reason, cause);
                return new ReconciliationResult.Drop(reason);
        }
    }
}
