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

import dev.mars.simfarm.compiler.CompilerFixtures;
import dev.mars.simfarm.core.exceptions.CapacityExhaustedException;
import dev.mars.simfarm.core.exceptions.SimFarmException;
import dev.mars.simfarm.core.exceptions.TopologyShapeException;
import dev.mars.simfarm.inventory.Inventory;
import dev.mars.simfarm.topology.Topologies;
import dev.mars.simfarm.topology.TopologyGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NoNetworkPackingStrategyTest {

    private final NoNetworkPackingStrategy strategy = new NoNetworkPackingStrategy();

    @Test
    @DisplayName("Largest hosts are filled first")
    void testPacksLargestHostsFirst() throws SimFarmException {
        Inventory inventory = CompilerFixtures.inventory(0, 4, 2, 8);
        TopologyGraph graph = new TopologyGraph(Topologies.noNetwork(10).getRoots());

        strategy.map(graph, inventory);

        assertEquals(2, inventory.getHosts().get(0).getMachines().size());
        assertEquals(0, inventory.getHosts().get(1).getMachines().size());
        assertEquals(8, inventory.getHosts().get(2).getMachines().size());
        assertSame(inventory.getHosts().get(2), graph.dfsOrderMachines().get(0).getHost());
        assertSame(inventory.getHosts().get(0), graph.dfsOrderMachines().get(9).getHost());
    }

    @Test
    void testExactFit() throws SimFarmException {
        Inventory inventory = CompilerFixtures.inventory(0, 4, 2, 8);

        strategy.map(new TopologyGraph(Topologies.noNetwork(14).getRoots()), inventory);

        assertEquals(3, inventory.getUsedHosts().size());
        assertEquals(0, inventory.getHosts().get(1).getRemainingSimulationSlots());
    }

    @Test
    void testTooManyMachines() throws TopologyShapeException {
        Inventory inventory = CompilerFixtures.inventory(0, 4, 2, 8);

        CapacityExhaustedException e = assertThrows(CapacityExhaustedException.class,
                () -> strategy.map(new TopologyGraph(Topologies.noNetwork(15).getRoots()), inventory));
        assertEquals(1, e.getUnassigned());
        assertEquals(14, e.getAvailable());
    }

    @Test
    void testSwitchRootRejected() {
        assertThrows(TopologyShapeException.class, () -> strategy.map(
                new TopologyGraph(Topologies.singleSwitch(2).getRoots()), CompilerFixtures.inventory(0, 8)));
    }

    @Test
    void testSwitchOnlyHostsAreIgnored() throws SimFarmException {
        Inventory inventory = CompilerFixtures.inventory(2, 1);

        strategy.map(new TopologyGraph(Topologies.noNetwork(1).getRoots()), inventory);

        assertEquals(1, inventory.getUsedHosts().size());
        assertEquals("f1-0", inventory.getUsedHosts().get(0).getHostId());
    }
}
