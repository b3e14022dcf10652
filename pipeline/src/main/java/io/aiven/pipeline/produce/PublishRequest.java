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
import java.util.Objects;

/**
 * A batch of opaque payloads to be published to one topic-partition.
 */
public record PublishRequest(TopicPartition topicPartition, List<byte[]> messages) {
    public PublishRequest {
        Objects.requireNonNull(topicPartition, "topicPartition cannot be null");
        messages = List.copyOf(Objects.requireNonNull(messages, "messages cannot be null"));
    }

    public static PublishRequest of(final String topic, final int partition, final List<byte[]> messages) {
        return new PublishRequest(new TopicPartition(topic, partition), messages);
    }

    public String topic() {
        return topicPartition.topic();
    }

    public int partition() {
        return topicPartition.partition();
    }

    public int messageCount() {
        return messages.size();
    }

    @Override
    public String toString() {
        return "PublishRequest["
            + "topicPartition=" + topicPartition
            + ", messageCount=" + messages.size()
            + "]";
    }
}
