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

/**
 * Decides the fate of a disputed request whose watermark query failed for a reason
 * other than missing topic metadata, i.e. when it is unknown whether the messages landed.
 */
public enum UnverifiedRequestPolicy {
    /**
     * Do not retry. Possible message loss is accepted over a duplicate publish that
     * cannot be deduplicated downstream.
     */
    DROP("drop"),
    /**
     * Retry. Possible duplicates are accepted over message loss.
     */
    RETRY("retry");

    public final String configValue;

    UnverifiedRequestPolicy(final String configValue) {
        this.configValue = configValue;
    }

    public static UnverifiedRequestPolicy fromConfigValue(final String value) {
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (final UnverifiedRequestPolicy policy : values()) {
            if (policy.configValue.equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown unverified request policy " + value);
    }
}
