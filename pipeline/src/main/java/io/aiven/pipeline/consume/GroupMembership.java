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

import java.time.Duration;
import java.util.List;

/**
 * Membership of a consumer in its group, as provided by the group-coordination layer.
 *
 * <p>Offsets are never committed automatically; the consumer commits them explicitly.
 */
public interface GroupMembership {

    /**
     * Join the group and start fetching. The listener is called synchronously from the
     * coordination layer whenever the assignment changes, including the first assignment.
     */
    void start(ConsumerGroupSpec spec, RebalanceListener listener);

    void stop();

    /**
     * @return up to {@code count} messages, fewer if the timeout expires
     */
    List<ConsumedMessage> poll(int count, Duration timeout);
}
