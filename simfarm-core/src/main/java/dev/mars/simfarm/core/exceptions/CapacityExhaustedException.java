/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.simfarm.core.exceptions;

/**
 * Thrown when the inventory does not have enough slots left for what the plan
 * needs to place on it. Assignments are never silently truncated.
 */
public class CapacityExhaustedException extends SimFarmException {

    private final int unassigned;
    private final int available;

    public CapacityExhaustedException(String message, int unassigned, int available) {
        super(String.format("%s (unassigned=%d, available=%d)", message, unassigned, available));
        this.unassigned = unassigned;
        this.available = available;
    }

    public int getUnassigned() {
        return unassigned;
    }

    public int getAvailable() {
        return available;
    }
}
