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

package dev.mars.simfarm.compiler.passes;

import dev.mars.simfarm.compiler.CompilationContext;
import dev.mars.simfarm.compiler.CompilationStage;
import dev.mars.simfarm.core.exceptions.SimFarmException;
import dev.mars.simfarm.core.exceptions.TopologyShapeException;
import dev.mars.simfarm.inventory.HostSlot;
import dev.mars.simfarm.topology.EndpointNode;
import dev.mars.simfarm.topology.MachineNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Allocates a network block device on the machine's host for every copy-on-write
 * disk image used by the machine or its co-resident placeholders. Allocations are
 * kept for the whole run, so running the pass again allocates nothing new.
 */
public class AllocateBlockDevicesPass extends AbstractPass {

    public AllocateBlockDevicesPass() {
        super("allocate-block-devices", CompilationStage.BLOCK_DEVICES,
                CompilationStage.HOST_MAPPING, CompilationStage.JOBS_ASSIGNED);
    }

    @Override
    public void apply(CompilationContext context) throws SimFarmException {
        for (MachineNode machine : context.getGraph().dfsOrderMachines()) {
            if (machine.getBlockDevices() != null) {
                continue;
            }
            HostSlot host = machine.getHost();
            if (host == null) {
                throw new TopologyShapeException(machine.getId(), "machine has no host to allocate block devices on");
            }
            List<String> devices = new ArrayList<>();
            for (EndpointNode endpoint : machine.getSlotEndpoints()) {
                int needed = endpoint.getJob().getCopyOnWriteImages().size();
                for (int i = 0; i < needed; i++) {
                    devices.add(host.getBlockDevices().allocate());
                }
            }
            machine.setBlockDevices(devices);
        }
    }
}
