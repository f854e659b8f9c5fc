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

import dev.mars.simfarm.core.exceptions.TopologyShapeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for graph construction, node naming and the DFS orders.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
class TopologyGraphTest {

    private SwitchNode root;
    private SwitchNode rackA;
    private SwitchNode rackB;
    private MachineNode a0;
    private MachineNode a1;
    private MachineNode b0;

    @BeforeEach
    void setUp() throws TopologyShapeException {
        root = new SwitchNode();
        rackA = new SwitchNode();
        rackB = new SwitchNode();
        a0 = new MachineNode();
        a1 = new MachineNode();
        b0 = new MachineNode();
        rackA.addDownlinks(a0, a1);
        rackB.addDownlink(b0);
        root.addDownlinks(rackA, rackB);
    }

    @Test
    void testDfsOrderIsPostOrder() throws TopologyShapeException {
        TopologyGraph graph = new TopologyGraph(List.of(root));

        assertEquals(List.of(a0, a1, rackA, b0, rackB, root), graph.dfsOrder());
        assertEquals(List.of(rackA, rackB, root), graph.dfsOrderSwitches());
        assertEquals(List.of(a0, a1, b0), graph.dfsOrderMachines());
        assertEquals(6, graph.size());
    }

    @Test
    void testIdsFollowTopologyOrder() throws TopologyShapeException {
        new TopologyGraph(List.of(root));

        assertEquals("switch0", root.getId());
        assertEquals("switch1", rackA.getId());
        assertEquals("switch2", rackB.getId());
        assertEquals(List.of("node0", "node1", "node2"),
                List.of(a0, a1, b0).stream().map(TopologyNode::getId).collect(Collectors.toList()));
    }

    @Test
    void testNetworkedDetection() throws TopologyShapeException {
        assertTrue(new TopologyGraph(List.of(root)).isNetworked());
        TopologyGraph flat = new TopologyGraph(List.of(new MachineNode(), new MachineNode()));
        assertFalse(flat.isNetworked());
        assertTrue(flat.rootsAreEndpoints());
    }

    @Test
    void testPlaceholdersAppearInEndpointOrder() throws TopologyShapeException {
        SwitchNode tor = new SwitchNode();
        MachineNode primary = new MachineNode();
        GroupPlaceholder p1 = new GroupPlaceholder(primary);
        GroupPlaceholder p2 = new GroupPlaceholder(primary);
        tor.addDownlinks(primary, p1, p2);

        TopologyGraph graph = new TopologyGraph(List.of(tor));

        assertEquals(List.of(primary, p1, p2), graph.dfsOrderEndpoints());
        assertEquals(List.of(primary), graph.dfsOrderMachines());
        assertEquals(List.of(primary, p1, p2), primary.getSlotEndpoints());
        assertSame(primary, p2.getPrimary());
    }

    @Nested
    class ShapeValidation {

        @Test
        void testSecondUplinkRejected() {
            SwitchNode other = new SwitchNode();
            TopologyShapeException e = assertThrows(TopologyShapeException.class, () -> other.addDownlink(a0));
            assertNotNull(e.getNodeId());
        }

        @Test
        void testLoopRejected() {
            assertThrows(TopologyShapeException.class, () -> rackA.addDownlink(root));
            assertThrows(TopologyShapeException.class, () -> root.addDownlink(root));
        }

        @Test
        void testRootWithUplinkRejected() {
            assertThrows(TopologyShapeException.class, () -> new TopologyGraph(List.of(rackA)));
        }

        @Test
        void testEmptyRootsRejected() {
            assertThrows(TopologyShapeException.class, () -> new TopologyGraph(List.of()));
        }
    }

    @Test
    void testUplinkPortIsDownlinkCount() {
        assertEquals(2, root.getUplinkPort());
        assertEquals(1, rackB.getUplinkPort());
        assertSame(root, rackA.getUplink());
        assertFalse(root.hasUplink());
    }
}
