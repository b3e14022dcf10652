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

import java.util.Objects;

/**
 * A message received from the broker with its position.
 *
 * @param schemaId id of the schema the payload is encoded with, {@code null} if unknown
 */
public record ConsumedMessage(String topic, int partition, long offset, Integer schemaId, byte[] payload) {
    public ConsumedMessage {
        Objects.requireNonNull(topic, "topic cannot be null");
    }

    public static ConsumedMessage of(final String topic, final int partition, final long offset) {
        return new ConsumedMessage(topic, partition, offset, null, new byte[0]);
    }

    @Override
    public String toString() {
        return "ConsumedMessage["
            + "topic=" + topic
            + ", partition=" + partition
            + ", offset=" + offset
            + ", schemaId=" + schemaId
            + "]";
    }
}
