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

import java.util.Objects;

/**
 * Raw per-partition answer of the broker to a publish request.
 *
 * <p>Either the broker replied ({@code transportError == null}), in which case {@code errors}
 * carries its error code, or the request never got a reply and {@code transportError} holds the cause.
 */
public record PublishResponse(
    TopicPartition topicPartition,
    Errors errors,
    long baseOffset,
    Throwable transportError
) {
    public PublishResponse {
        Objects.requireNonNull(topicPartition, "topicPartition cannot be null");
        Objects.requireNonNull(errors, "errors cannot be null");
    }

    public static PublishResponse success(final TopicPartition topicPartition, final long baseOffset) {
        return new PublishResponse(topicPartition, Errors.NONE, baseOffset, null);
    }

    public static PublishResponse error(final TopicPartition topicPartition, final Errors errors) {
        return new PublishResponse(topicPartition, errors, -1, null);
    }

    public static PublishResponse transportFailure(final TopicPartition topicPartition, final Throwable cause) {
        Objects.requireNonNull(cause, "cause cannot be null");
        return new PublishResponse(topicPartition, Errors.NETWORK_EXCEPTION, -1, cause);
    }
}
