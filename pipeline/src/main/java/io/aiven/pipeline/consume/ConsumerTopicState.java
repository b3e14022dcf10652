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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read position of a consumer in one topic: the next offset to read per partition
 * and the schema id of the last message seen.
 */
public final class ConsumerTopicState {
    private final Map<Integer, Long> partitionOffsetMap;
    private Integer lastSeenSchemaId;

    public ConsumerTopicState(final Map<Integer, Long> partitionOffsetMap, final Integer lastSeenSchemaId) {
        this.partitionOffsetMap = new HashMap<>(Objects.requireNonNull(partitionOffsetMap, "partitionOffsetMap cannot be null"));
        this.lastSeenSchemaId = lastSeenSchemaId;
    }

    public static ConsumerTopicState empty() {
        return new ConsumerTopicState(Map.of(), null);
    }

    public synchronized void update(final ConsumedMessage message) {
        Objects.requireNonNull(message, "message cannot be null");
        partitionOffsetMap.put(message.partition(), message.offset() + 1);
        if (message.schemaId() != null) {
            lastSeenSchemaId = message.schemaId();
        }
    }

    public synchronized Map<Integer, Long> partitionOffsetMap() {
        return Collections.unmodifiableMap(new HashMap<>(partitionOffsetMap));
    }

    public synchronized Integer lastSeenSchemaId() {
        return lastSeenSchemaId;
    }

    public synchronized ConsumerTopicState copy() {
        return new ConsumerTopicState(partitionOffsetMap, lastSeenSchemaId);
    }

    @Override
    public synchronized String toString() {
        return "ConsumerTopicState["
            + "lastSeenSchemaId=" + lastSeenSchemaId
            + ", partitionOffsetMap=" + partitionOffsetMap
            + "]";
    }
}
