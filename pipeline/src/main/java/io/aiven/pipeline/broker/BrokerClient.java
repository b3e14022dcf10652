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

import org.apache.kafka.common.errors.LeaderNotAvailableException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;

import java.io.Closeable;
import java.util.List;

import io.aiven.pipeline.produce.PublishRequest;
import io.aiven.pipeline.produce.PublishResponse;

/**
 * Blocking view of the broker used by the producer and consumer cores.
 *
 * <p>Implementations wrap the wire-level client. All calls are synchronous and failures
 * are reported as unchecked Kafka exceptions.
 */
public interface BrokerClient extends Closeable {

    /**
     * Publish the requests. At most one response is returned per request; a request may get none.
     * Throws if the whole round failed at the transport level.
     */
    List<PublishResponse> publish(List<PublishRequest> requests);

    /**
     * Number of messages the broker holds for the topic past the tracked offset,
     * derived from its high watermark.
     *
     * @throws UnknownTopicOrPartitionException if the broker has no metadata for the topic or one of its partitions
     */
    long publishedMessageCount(String topic, long trackedOffset);

    /**
     * Reload the cluster metadata for the topic.
     *
     * @throws LeaderNotAvailableException if the topic is still being auto-created
     */
    void loadMetadataForTopic(String topic);

    void commitOffsets(String groupId, List<OffsetCommitRequest> requests);

    /**
     * Close the connection. The client must be usable again after a later call.
     */
    @Override
    void close();
}
