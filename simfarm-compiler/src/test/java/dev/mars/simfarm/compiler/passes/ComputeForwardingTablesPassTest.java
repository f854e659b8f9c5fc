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

import dev.mars.simfarm.compiler.CompilationStage;
import dev.mars.simfarm.compiler.CompilerFixtures;
import dev.mars.simfarm.compiler.PassPipeline;
import dev.mars.simfarm.core.exceptions.SimFarmException;
import dev.mars.simfarm.core.exceptions.TopologyShapeException;
import dev.mars.simfarm.topology.EndpointNode;
import dev.mars.simfarm.topology.ForwardingTable;
import dev.mars.simfarm.topology.SwitchNode;
import dev.mars.simfarm.topology.Topologies;
import dev.mars.simfarm.topology.TopologyDescription;
import dev.mars.simfarm.topology.TopologyGraph;
import dev.mars.simfarm.topology.TopologyNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComputeForwardingTablesPassTest {

    @Test
    void testEveryTableRoutesTowardsItsDestination() throws SimFarmException {
        TopologyGraph graph = run(Topologies.twoLevel(3, 3));

        List<EndpointNode> endpoints = graph.dfsOrderEndpoints();
        for (SwitchNode switchNode : graph.dfsOrderSwitches()) {
            ForwardingTable table = switchNode.getForwardingTable();
            assertEquals(endpoints.size(), table.size());
            for (EndpointNode endpoint : endpoints) {
                int expected = portTowards(switchNode, endpoint);
                assertEquals(expected, table.portFor(endpoint.getAddress()),
                        switchNode.getId() + " routes " + endpoint.getId());
            }
        }
    }

    @Test
    void testRootAndRackTables() throws SimFarmException {
        TopologyGraph graph = run(Topologies.twoLevel(2, 3));
        SwitchNode root = graph.dfsOrderSwitches().get(2);
        SwitchNode firstRack = graph.dfsOrderSwitches().get(0);

        assertEquals("switch0", root.getId());
        assertEquals(List.of(0, 0, 0, 1, 1, 1), root.getForwardingTable().asList());
        assertEquals(2, root.getForwardingTable().getUplinkPort());
        assertEquals(List.of(0, 1, 2, 3, 3, 3), firstRack.getForwardingTable().asList());
        assertEquals(6, root.getDownlinkAddresses().size());
    }

    @Test
    void testPlaceholdersHaveTheirOwnPorts() throws SimFarmException {
        TopologyGraph graph = run(Topologies.supernodeSingleSwitch(1, 4));

        assertEquals(List.of(0, 1, 2, 3), graph.dfsOrderSwitches().get(0).getForwardingTable().asList());
    }

    @Test
    void testEndpointWithoutAddressFails() throws SimFarmException {
        PassPipeline pipeline = new PassPipeline(CompilerFixtures.context(Topologies.singleSwitch(2),
                CompilerFixtures.inventory(0, 2)));
        pipeline.markReached(CompilationStage.ADDRESSES_ASSIGNED);

        TopologyShapeException e = assertThrows(TopologyShapeException.class,
                () -> pipeline.run(new ComputeForwardingTablesPass()));
        assertEquals("node0", e.getNodeId());
    }

    private static TopologyGraph run(TopologyDescription description) throws SimFarmException {
        PassPipeline pipeline = new PassPipeline(CompilerFixtures.context(description,
                CompilerFixtures.inventory(0, 64)));
        pipeline.run(new AssignAddressesPass());
        pipeline.run(new ComputeForwardingTablesPass());
        return pipeline.getContext().getGraph();
    }

    private static int portTowards(SwitchNode switchNode, EndpointNode endpoint) {
        TopologyNode child = endpoint;
        for (SwitchNode parent = endpoint.getUplink(); parent != null; parent = parent.getUplink()) {
            if (parent == switchNode) {
                return switchNode.getDownlinks().indexOf(child);
            }
            child = parent;
        }
        return switchNode.getUplinkPort();
    }
}
