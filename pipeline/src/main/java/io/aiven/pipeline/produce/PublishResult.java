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

import java.util.List;
import java.util.Map;

/**
 * @param publishedMessageCount messages confirmed published, directly or through the watermark
 * @param rounds number of publish rounds performed
 * @param unsentRequests requests still to be retried when the round budget ran out
 * @param hasUnpublishedRequest whether some requested topic-partition has no confirmed publish
 * @param stats cumulative stats per topic-partition
 * @param trackedOffsets topic offsets after the last round
 */
public record PublishResult(
    long publishedMessageCount,
    int rounds,
    List<PublishRequest> unsentRequests,
    boolean hasUnpublishedRequest,
    Map<TopicPartition, Stats> stats,
    Map<String, Long> trackedOffsets
) {
    public PublishResult {
        unsentRequests = List.copyOf(unsentRequests);
        stats = Map.copyOf(stats);
        trackedOffsets = Map.copyOf(trackedOffsets);
    }
}
