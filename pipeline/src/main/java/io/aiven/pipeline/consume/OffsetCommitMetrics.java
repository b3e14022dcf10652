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

import org.apache.kafka.server.metrics.KafkaMetricsGroup;

import com.yammer.metrics.core.Meter;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public class OffsetCommitMetrics implements Closeable {
    static final String OFFSET_COMMIT_REQUEST_RATE = "OffsetCommitRequestRate";
    static final String OFFSET_COMMIT_SKIPPED_RATE = "OffsetCommitSkippedRate";
    static final String REBALANCE_RATE = "RebalanceRate";

    private final KafkaMetricsGroup metricsGroup = new KafkaMetricsGroup(OffsetCommitMetrics.class);

    private final Meter offsetCommitRequestRate;
    private final Meter offsetCommitSkippedRate;
    private final Meter rebalanceRate;

    public OffsetCommitMetrics() {
        offsetCommitRequestRate = metricsGroup.newMeter(OFFSET_COMMIT_REQUEST_RATE, "offsets", TimeUnit.SECONDS, Map.of());
        offsetCommitSkippedRate = metricsGroup.newMeter(OFFSET_COMMIT_SKIPPED_RATE, "offsets", TimeUnit.SECONDS, Map.of());
        rebalanceRate = metricsGroup.newMeter(REBALANCE_RATE, "rebalances", TimeUnit.SECONDS, Map.of());
    }

    public void offsetsCommitted(final int committed, final int skipped) {
        offsetCommitRequestRate.mark(committed);
        offsetCommitSkippedRate.mark(skipped);
    }

    public void rebalanced() {
        rebalanceRate.mark();
    }

    @Override
    public void close() {
        List.of(OFFSET_COMMIT_REQUEST_RATE, OFFSET_COMMIT_SKIPPED_RATE, REBALANCE_RATE)
            .forEach(metricsGroup::removeMetric);
    }
}
