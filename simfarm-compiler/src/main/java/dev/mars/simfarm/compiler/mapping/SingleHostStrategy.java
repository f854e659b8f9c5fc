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

package dev.mars.simfarm.compiler.mapping;

import dev.mars.simfarm.core.exceptions.CapacityExhaustedException;
import dev.mars.simfarm.core.exceptions.TopologyShapeException;
import dev.mars.simfarm.inventory.HostMappingStrategy;
import dev.mars.simfarm.inventory.HostSlot;
import dev.mars.simfarm.inventory.Inventory;
import dev.mars.simfarm.topology.MachineNode;
import dev.mars.simfarm.topology.SwitchNode;
import dev.mars.simfarm.topology.TopologyGraph;

import java.util.List;

/**
 * Puts the whole topology on the first accelerator host of the inventory.
 * The host's simulation slot count is still enforced.
 */
public class SingleHostStrategy implements HostMappingStrategy {

    @Override
    public void map(TopologyGraph graph, Inventory inventory)
            throws TopologyShapeException, CapacityExhaustedException {
        List<HostSlot> hosts = inventory.getAcceleratorHosts();
        if (hosts.isEmpty()) {
            throw new CapacityExhaustedException("Single-host mapping needs an accelerator host",
                    graph.dfsOrderMachines().size(), 0);
        }
        HostSlot host = hosts.get(0);
        List<MachineNode> machines = graph.dfsOrderMachines();
        if (machines.size() > host.getRemainingSimulationSlots()) {
            throw new CapacityExhaustedException(String.format("%s has %d simulation slots but the topology has %d machines",
                    host.getHostId(), host.getRemainingSimulationSlots(), machines.size()),
                    machines.size(), host.getRemainingSimulationSlots());
        }
        for (SwitchNode switchNode : graph.dfsOrderSwitches()) {
            MappingSupport.classify(switchNode, MappingSupport.mappableDownlinks(switchNode));
        }
        for (SwitchNode switchNode : graph.dfsOrderSwitches()) {
            host.addSwitch(switchNode);
        }
        for (MachineNode machine : machines) {
            host.addMachine(machine);
        }
    }

    @Override
    public String toString() {
        return HostMappingStrategies.SINGLE_HOST;
    }
}
