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
package io.aiven.pipeline.broker;

import org.apache.kafka.common.TopicPartition;

import java.util.Objects;

/**
 * @param offset the next offset to read, i.e. one past the last processed message
 */
public record OffsetCommitRequest(TopicPartition topicPartition, long offset) {
    public OffsetCommitRequest {
        Objects.requireNonNull(topicPartition, "topicPartition cannot be null");
    }

    public static OffsetCommitRequest of(final String topic, final int partition, final long offset) {
        return new OffsetCommitRequest(new TopicPartition(topic, partition), offset);
    }
}
