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

import java.util.Map;
import java.util.Set;

/**
 * Notifications delivered by the group-coordination layer around a partition reassignment.
 *
 * <p>No message is delivered between {@link #onPartitionsRevoked} and {@link #onPartitionsAssigned}
 * of one rebalance. {@link #onPartitionsRevoked} may be called several times before the assignment.
 */
public interface RebalanceListener {

    /**
     * @param assignment the topic to partitions assignment about to be given up
     */
    void onPartitionsRevoked(Map<String, Set<Integer>> assignment);

    /**
     * @param assignment the complete new assignment, not a delta
     */
    void onPartitionsAssigned(Map<String, Set<Integer>> assignment);
}
