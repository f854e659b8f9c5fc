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
import dev.mars.simfarm.inventory.HostSlot;
import dev.mars.simfarm.inventory.Inventory;
import dev.mars.simfarm.topology.MachineNode;
import dev.mars.simfarm.topology.SwitchNode;
import dev.mars.simfarm.topology.Topologies;
import dev.mars.simfarm.topology.TopologyGraph;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimpleNetworkedStrategyTest {

    private final SimpleNetworkedStrategy strategy = new SimpleNetworkedStrategy();

    @Test
    void testRackFitsExactly() throws SimFarmException {
        Inventory inventory = CompilerFixtures.inventory(0, 3);
        TopologyGraph graph = new TopologyGraph(Topologies.singleSwitch(3).getRoots());

        strategy.map(graph, inventory);

        HostSlot host = inventory.getHosts().get(0);
        assertEquals(graph.dfsOrderSwitches(), host.getSwitches());
        assertEquals(graph.dfsOrderMachines(), host.getMachines());
        assertEquals(0, host.getRemainingSimulationSlots());
    }

    @Test
    void testSmallestSufficientHostIsPreferred() throws SimFarmException {
        Inventory inventory = CompilerFixtures.inventory(0, 8, 4);

        strategy.map(new TopologyGraph(Topologies.singleSwitch(3).getRoots()), inventory);

        assertEquals(List.of(inventory.getHosts().get(1)), inventory.getUsedHosts());
    }

    @Test
    void testTwoLevelUsesSwitchOnlyHostForRoot() throws SimFarmException {
        Inventory inventory = CompilerFixtures.inventory(1, 4, 4);
        TopologyGraph graph = new TopologyGraph(Topologies.twoLevel(2, 4).getRoots());

        strategy.map(graph, inventory);

        SwitchNode root = (SwitchNode) graph.getRoots().get(0);
        assertEquals("m4-0", root.getHost().getHostId());
        assertEquals("f1-0", graph.dfsOrderSwitches().get(0).getHost().getHostId());
        assertEquals("f1-1", graph.dfsOrderSwitches().get(1).getHost().getHostId());
    }

    @Test
    void testNoSwitchOnlyHostLeft() throws TopologyShapeException {
        Inventory inventory = CompilerFixtures.inventory(0, 4, 4);

        assertThrows(CapacityExhaustedException.class,
                () -> strategy.map(new TopologyGraph(Topologies.twoLevel(2, 4).getRoots()), inventory));
    }

    @Test
    void testRackLargerThanAnyHost() throws TopologyShapeException {
        Inventory inventory = CompilerFixtures.inventory(0, 2, 2);

        CapacityExhaustedException e = assertThrows(CapacityExhaustedException.class,
                () -> strategy.map(new TopologyGraph(Topologies.singleSwitch(3).getRoots()), inventory));
        assertEquals(3, e.getUnassigned());
        assertEquals(2, e.getAvailable());
    }

    @Test
    void testMixedDownlinksRejected() throws TopologyShapeException {
        SwitchNode root = new SwitchNode();
        SwitchNode rack = new SwitchNode();
        rack.addDownlink(new MachineNode());
        root.addDownlinks(new MachineNode(), rack);
        TopologyGraph graph = new TopologyGraph(List.of(root));

        TopologyShapeException e = assertThrows(TopologyShapeException.class,
                () -> strategy.map(graph, CompilerFixtures.inventory(1, 8)));
        assertEquals("switch0", e.getNodeId());
    }

    @Test
    void testPlaceholdersDoNotUseSlots() throws SimFarmException {
        Inventory inventory = CompilerFixtures.inventory(0, 2);
        TopologyGraph graph = new TopologyGraph(Topologies.supernodeSingleSwitch(2, 4).getRoots());

        strategy.map(graph, inventory);

        assertEquals(2, inventory.getHosts().get(0).getMachines().size());
        assertSame(inventory.getHosts().get(0), graph.dfsOrderEndpoints().get(3).getHost());
    }
}
