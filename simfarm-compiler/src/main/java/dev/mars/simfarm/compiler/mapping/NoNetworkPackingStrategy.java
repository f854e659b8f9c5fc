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
 * Packs independent machines onto accelerator hosts, largest host first, filling
 * each host before spilling onto the next.
 */
public class NoNetworkPackingStrategy implements HostMappingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(NoNetworkPackingStrategy.class);

    @Override
    public void map(TopologyGraph graph, Inventory inventory)
            throws TopologyShapeException, CapacityExhaustedException {
        for (TopologyNode root : graph.getRoots()) {
            if (root instanceof SwitchNode) {
                throw new TopologyShapeException(root.getId(),
                        "no-network packing only handles topologies whose roots are all machines");
            }
        }
        List<HostSlot> hosts = new ArrayList<>(inventory.getAcceleratorHosts());
        hosts.sort(Comparator.comparingInt(HostSlot::getMaxSimulationSlots).reversed());

        List<MachineNode> machines = graph.dfsOrderMachines();
        int next = 0;
        for (HostSlot host : hosts) {
            while (next < machines.size() && host.getRemainingSimulationSlots() > 0) {
                host.addMachine(machines.get(next++));
            }
            if (next == machines.size()) {
                break;
            }
        }
        if (next < machines.size()) {
            int available = hosts.stream().mapToInt(HostSlot::getMaxSimulationSlots).sum();
            throw new CapacityExhaustedException(String.format(
                    "%d machines could not be placed; the inventory has %d simulation slots for %d machines",
                    machines.size() - next, available, machines.size()),
                    machines.size() - next, available);
        }
        logger.info("Packed {} machines onto {} accelerator hosts", machines.size(), inventory.getUsedHosts().size());
    }

    @Override
    public String toString() {
        return HostMappingStrategies.NO_NET;
    }
}
