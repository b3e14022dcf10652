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

import java.util.Objects;

/**
 * Published progress of one topic-partition, accumulated across retry rounds.
 *
 * <p>Stats form a monoid under component-wise addition with {@link #ZERO} as identity.
 */
public record Stats(long offset, long messageCount) {
    public static final Stats ZERO = new Stats(0, 0);

    public Stats add(final Stats other) {
        Objects.requireNonNull(other, "other cannot be null");
        return new Stats(offset + other.offset, messageCount + other.messageCount);
    }
}
