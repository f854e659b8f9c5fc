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
import dev.mars.simfarm.topology.TopologyNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps each switch of switches to its own switch-only host, and each top-of-rack
 * switch together with its machines to the smallest accelerator host that fits them.
 */
public class SimpleNetworkedStrategy implements HostMappingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(SimpleNetworkedStrategy.class);

    @Override
    public void map(TopologyGraph graph, Inventory inventory)
            throws TopologyShapeException, CapacityExhaustedException {
        List<HostSlot> acceleratorHosts = new ArrayList<>(inventory.getAcceleratorHosts());
        acceleratorHosts.sort(Comparator.comparingInt(HostSlot::getMaxSimulationSlots));
        List<HostSlot> switchHosts = inventory.getSwitchOnlyHosts();

        for (SwitchNode switchNode : graph.dfsOrderSwitches()) {
            List<TopologyNode> downlinks = MappingSupport.mappableDownlinks(switchNode);
            switch (MappingSupport.classify(switchNode, downlinks)) {
                case SWITCHES:
                    HostSlot switchHost = switchHosts.stream()
                            .filter(HostSlot::hasSwitchSlot)
                            .findFirst()
                            .orElseThrow(() -> new CapacityExhaustedException(
                                    "No switch-only host left for " + switchNode.getId(), 1, 0));
                    switchHost.addSwitch(switchNode);
                    logger.debug("{} -> {}", switchNode.getId(), switchHost.getHostId());
                    break;
                case MACHINES:
                    List<MachineNode> machines = MappingSupport.asMachines(downlinks);
                    HostSlot host = acceleratorHosts.stream()
                            .filter(candidate -> candidate.getRemainingSimulationSlots() >= machines.size())
                            .findFirst()
                            .orElseThrow(() -> new CapacityExhaustedException(String.format(
                                    "No accelerator host has %d free slots for %s and its machines",
                                    machines.size(), switchNode.getId()),
                                    machines.size(), largestRemaining(acceleratorHosts)));
                    host.addSwitch(switchNode);
                    for (MachineNode machine : machines) {
                        host.addMachine(machine);
                    }
                    logger.debug("{} and {} machines -> {}", switchNode.getId(), machines.size(), host.getHostId());
                    break;
            }
        }
    }

    private static int largestRemaining(List<HostSlot> hosts) {
        return hosts.stream().mapToInt(HostSlot::getRemainingSimulationSlots).max().orElse(0);
    }

    @Override
    public String toString() {
        return HostMappingStrategies.SIMPLE_NETWORKED;
    }
}
