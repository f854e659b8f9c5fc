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
 * Thrown when an operation dispatched across the fleet fails on one of its hosts.
 * No retry happens at the dispatch layer.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class DispatchException extends SimFarmException {

    private final String operation;
    private final String hostId;

    public DispatchException(String operation, String hostId, String message) {
        super(String.format("Operation '%s' failed on host '%s': %s", operation, hostId, message));
        this.operation = operation;
        this.hostId = hostId;
    }

    public DispatchException(String operation, String hostId, Throwable cause) {
        super(String.format("Operation '%s' failed on host '%s': %s", operation, hostId, cause.getMessage()), cause);
        this.operation = operation;
        this.hostId = hostId;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * @return the failing host, or {@code null} when the failure was not tied to one host
     */
    public String getHostId() {
        return hostId;
    }
}
