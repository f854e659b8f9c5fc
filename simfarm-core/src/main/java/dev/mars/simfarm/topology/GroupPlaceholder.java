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

package dev.mars.simfarm.topology;

import dev.mars.simfarm.inventory.HostSlot;

import java.util.Objects;

/**
 * Stand-in for a simulated machine that runs inside the accelerator slot of a
 * primary {@link MachineNode}. It is addressed, routed to and given a job like any
 * endpoint, but host mapping ignores it: it follows its primary.
 */
public final class GroupPlaceholder extends EndpointNode {

    private final MachineNode primary;

    public GroupPlaceholder(MachineNode primary) {
        this.primary = Objects.requireNonNull(primary, "Primary machine cannot be null");
        primary.addCoResident(this);
    }

    @Override
    public MachineNode getPrimary() {
        return primary;
    }

    @Override
    public HostSlot getHost() {
        return primary.getHost();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitPlaceholder(this);
    }

    @Override
    public String describe() {
        return getId() + " | mac: " + getAddress() + " | job: " + getJobName() + " | in: " + primary.getId();
    }
}
