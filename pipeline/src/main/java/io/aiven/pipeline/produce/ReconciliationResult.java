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

/**
 * Decision taken by {@link WatermarkReconciler} for a request without a success response.
 */
public sealed interface ReconciliationResult {

    /**
     * The broker watermark shows the batch landed although no success response was received.
     */
    record Published(Stats stats) implements ReconciliationResult {}

    record Retry() implements ReconciliationResult {}

    /**
     * The request must not be sent again.
     */
    record Drop(String reason) implements ReconciliationResult {}
}
