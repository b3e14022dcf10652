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
import org.apache.kafka.common.protocol.Errors;

/**
 * Interpreted result of a publish attempt for one topic-partition.
 *
 * <p>Produced by {@link PublishOutcomeClassifier} from a {@link PublishResponse}.
 */
public sealed interface PublishOutcome {

    TopicPartition topicPartition();

    /**
     * The broker acknowledged the batch.
     *
     * @param offset the offset reported by the broker
     */
    record Success(TopicPartition topicPartition, long offset) implements PublishOutcome {}

    /**
     * The batch is not known to be published.
     *
     * @param kind whether the broker answered with an error or never answered
     * @param errors the broker error code, {@link Errors#NETWORK_EXCEPTION} for transport failures
     * @param cause the transport failure, {@code null} for broker errors
     */
    record Failure(TopicPartition topicPartition, FailureKind kind, Errors errors, Throwable cause) implements PublishOutcome {}

    enum FailureKind {
        TRANSPORT,
        BROKER
    }
}
