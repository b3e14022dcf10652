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

import java.util.Locale;

public enum PublishGuarantee {
    /**
     * Requests without a success response are retried unconditionally.
     */
    AT_LEAST_ONCE("at_least_once"),
    /**
     * Requests without a success response are checked against the broker watermarks before retrying.
     */
    EXACTLY_ONCE("exactly_once");

    public final String configValue;

    PublishGuarantee(final String configValue) {
        this.configValue = configValue;
    }

    public static PublishGuarantee fromConfigValue(final String value) {
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (final PublishGuarantee guarantee : values()) {
            if (guarantee.configValue.equals(normalized)) {
                return guarantee;
            }
        }
        throw new IllegalArgumentException("Unknown publish guarantee " + value);
    }
}
