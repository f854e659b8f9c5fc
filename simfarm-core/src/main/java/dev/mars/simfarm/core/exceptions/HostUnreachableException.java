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
 * Thrown when a host fails its liveness check. The whole batch is abandoned
 * before any work is attempted on any host.
 */
public class HostUnreachableException extends SimFarmException {

    private final String hostId;

    public HostUnreachableException(String hostId, String message) {
        super(String.format("Host '%s' is unreachable: %s", hostId, message));
        this.hostId = hostId;
    }

    public HostUnreachableException(String hostId, Throwable cause) {
        super(String.format("Host '%s' is unreachable: %s", hostId, cause.getMessage()), cause);
        this.hostId = hostId;
    }

    public String getHostId() {
        return hostId;
    }
}
