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

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

public class PublishOutcomeClassifier {

    public PublishOutcome classify(final PublishResponse response) {
        Objects.requireNonNull(response, "response cannot be null");
        if (response.transportError() != null) {
            return new PublishOutcome.Failure(
                response.topicPartition(),
                PublishOutcome.FailureKind.TRANSPORT,
                response.errors(),
                response.transportError()
            );
        }
        if (response.errors() != Errors.NONE) {
            return new PublishOutcome.Failure(
                response.topicPartition(),
                PublishOutcome.FailureKind.BROKER,
                response.errors(),
                null
            );
        }
        return new PublishOutcome.Success(response.topicPartition(), response.baseOffset());
    }

    /**
     * Success outcomes keyed by topic-partition. Missing or failed responses have no entry.
     */
    public Map<TopicPartition, PublishOutcome.Success> successesByPartition(final Collection<PublishResponse> responses) {
        final Map<TopicPartition, PublishOutcome.Success> result = new HashMap<>();
        if (responses == null) {
            return result;
        }
        for (final PublishResponse response : responses) {
            if (response == null) {
                continue;
            }
            if (classify(response) instanceof PublishOutcome.Success success) {
                result.put(success.topicPartition(), success);
            }
        }
        return result;
    }
}
