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

package dev.mars.simfarm.compiler;

import dev.mars.simfarm.core.exceptions.InventoryBindingException;
import dev.mars.simfarm.core.exceptions.SimFarmException;
import dev.mars.simfarm.inventory.Inventory;
import dev.mars.simfarm.inventory.StaticInventoryProvider;
import dev.mars.simfarm.topology.MachineNode;
import dev.mars.simfarm.topology.SwitchNode;
import dev.mars.simfarm.topology.Topologies;
import dev.mars.simfarm.topology.TopologyDescription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeploymentPlanTest {

    private RecordingArtifactBuilder builder;
    private Inventory inventory;
    private DeploymentPlan plan;

    @BeforeEach
    void setUp() throws SimFarmException {
        builder = new RecordingArtifactBuilder();
        inventory = CompilerFixtures.inventory(0, 8, 8);
        plan = CompilerFixtures.compile(Topologies.singleSwitch(3), inventory, builder);
    }

    @Test
    void testArtifactsNeedBoundInventory() {
        PassOrderException e = assertThrows(PassOrderException.class, plan::buildArtifacts);

        assertTrue(e.getMissingStages().contains(CompilationStage.INVENTORY_BOUND));
        assertTrue(builder.getDriverBuilds().isEmpty());
    }

    @Test
    void testBuildArtifactsOnce() throws SimFarmException {
        plan.bind(StaticInventoryProvider.mockOnly(), true);
        plan.buildArtifacts();
        plan.buildArtifacts();

        assertEquals(List.of("default"), builder.getDriverBuilds());
        assertEquals(1, builder.getSwitchSources().size());
        SwitchNode root = plan.getGraph().dfsOrderSwitches().get(0);
        assertEquals(Path.of("builds", "switches", "switch0", "switch"), root.getBuiltBinary());
        assertEquals(Path.of("builds", "drivers", "default"),
                plan.getGraph().dfsOrderMachines().get(0).getResolvedHardwareConfig().getDriverDirectory());
        List<String> executed = plan.getExecutedPasses();
        assertEquals(List.of("build-drivers", "build-switches"), executed.subList(executed.size() - 2, executed.size()));
    }

    @Test
    void testOneDriverBuildPerDistinctConfig() throws SimFarmException {
        SwitchNode root = new SwitchNode();
        root.addDownlinks(new MachineNode("rocket-quad"), new MachineNode(), new MachineNode("rocket-quad"));
        RecordingArtifactBuilder recording = new RecordingArtifactBuilder();
        DeploymentPlan mixed = CompilerFixtures.compile(TopologyDescription.builder().name("mixed").root(root).build(),
                CompilerFixtures.inventory(0, 4), recording);

        mixed.bind(StaticInventoryProvider.mockOnly(), true);
        mixed.buildArtifacts();

        assertEquals(2, recording.getDriverBuilds().size());
        assertTrue(recording.getDriverBuilds().containsAll(List.of("default", "rocket-quad")));
    }

    @Test
    void testBindingModeIsFixedForTheRun() throws InventoryBindingException {
        plan.bind(StaticInventoryProvider.mockOnly(), true);

        assertTrue(plan.hasRun(CompilationStage.INVENTORY_BOUND));
        assertThrows(InventoryBindingException.class, () -> plan.bind(
                new StaticInventoryProvider(Map.of("f1-0", "192.168.0.1", "f1-1", "192.168.0.2")), false));
    }

    @Test
    void testIdleHostsStayInThePlan() {
        assertEquals(2, plan.getHosts().size());
        assertEquals(1, plan.getInventory().getUsedHosts().size());
        assertTrue(plan.isNetworked());
        assertEquals("single_switch_3", plan.getDescription().getName());
        assertEquals("linux", plan.getWorkload().getName());
    }
}
