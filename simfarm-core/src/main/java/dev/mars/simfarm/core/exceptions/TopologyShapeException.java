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
 * Thrown when a topology has a shape the compiler cannot deploy, such as a switch
 * whose downlinks mix switches and machines, or a node given a second uplink.
 *
 * <p>The offending node is carried so that the error message can point at it.</p>
 */
public class TopologyShapeException extends SimFarmException {

    private final String nodeId;

    public TopologyShapeException(String nodeId, String message) {
        super(String.format("Unsupported topology at '%s': %s", nodeId, message));
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
