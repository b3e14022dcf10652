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

import org.apache.kafka.server.metrics.KafkaMetricsGroup;

import com.yammer.metrics.core.Histogram;
import com.yammer.metrics.core.Meter;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public class PublishRetryMetrics implements Closeable {
    static final String PUBLISH_TOTAL_TIME = "PublishTotalTime";
    static final String PUBLISH_ROUND_RATE = "PublishRoundRate";
    static final String RETRIED_REQUEST_RATE = "RetriedRequestRate";
    static final String HIDDEN_SUCCESS_RATE = "HiddenSuccessRate";
    static final String DROPPED_REQUEST_RATE = "DroppedRequestRate";
    static final String PUBLISHED_MESSAGE_RATE = "PublishedMessageRate";

    private final KafkaMetricsGroup metricsGroup = new KafkaMetricsGroup(PublishRetryMetrics.class);

    private final Histogram publishTimeHistogram;
    private final Meter publishRoundRate;
    private final Meter retriedRequestRate;
    private final Meter hiddenSuccessRate;
    private final Meter droppedRequestRate;
    private final Meter publishedMessageRate;

    public PublishRetryMetrics() {
        publishTimeHistogram = metricsGroup.newHistogram(PUBLISH_TOTAL_TIME, true, Map.of());
        publishRoundRate = metricsGroup.newMeter(PUBLISH_ROUND_RATE, "rounds", TimeUnit.SECONDS, Map.of());
        retriedRequestRate = metricsGroup.newMeter(RETRIED_REQUEST_RATE, "requests", TimeUnit.SECONDS, Map.of());
        hiddenSuccessRate = metricsGroup.newMeter(HIDDEN_SUCCESS_RATE, "requests", TimeUnit.SECONDS, Map.of());
        droppedRequestRate = metricsGroup.newMeter(DROPPED_REQUEST_RATE, "requests", TimeUnit.SECONDS, Map.of());
        publishedMessageRate = metricsGroup.newMeter(PUBLISHED_MESSAGE_RATE, "messages", TimeUnit.SECONDS, Map.of());
    }

    public void roundCompleted(final int retried, final int hiddenSuccesses, final int dropped) {
        publishRoundRate.mark();
        retriedRequestRate.mark(retried);
        hiddenSuccessRate.mark(hiddenSuccesses);
        droppedRequestRate.mark(dropped);
    }

    public void publishCompleted(final long durationMs, final long publishedMessages) {
        publishTimeHistogram.update(durationMs);
        publishedMessageRate.mark(publishedMessages);
    }

    @Override
    public void close() {
        List.of(
            PUBLISH_TOTAL_TIME,
            PUBLISH_ROUND_RATE,
            RETRIED_REQUEST_RATE,
            HIDDEN_SUCCESS_RATE,
            DROPPED_REQUEST_RATE,
            PUBLISHED_MESSAGE_RATE
        ).forEach(metricsGroup::removeMetric);
    }
}
