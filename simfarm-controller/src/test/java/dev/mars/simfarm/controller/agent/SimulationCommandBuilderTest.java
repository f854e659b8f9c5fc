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

package dev.mars.simfarm.controller.agent;

import dev.mars.simfarm.compiler.DeploymentPlan;
import dev.mars.simfarm.controller.ControllerFixtures;
import dev.mars.simfarm.core.exceptions.SimFarmException;
import dev.mars.simfarm.inventory.HostSlot;
import dev.mars.simfarm.inventory.Inventory;
import dev.mars.simfarm.inventory.StaticInventoryProvider;
import dev.mars.simfarm.topology.MachineNode;
import dev.mars.simfarm.topology.SwitchNode;
import dev.mars.simfarm.topology.Topologies;
import dev.mars.simfarm.topology.TopologyDescription;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SimulationCommandBuilderTest {

    @TempDir
    Path tempDir;

    private final SimulationCommandBuilder builder = new SimulationCommandBuilder();

    @Test
    void testSharedMemoryEndpoint() throws SimFarmException {
        DeploymentPlan plan = compile(Topologies.singleSwitch(2),
                ControllerFixtures.inventory(HostSlot.accelerator("f1-0", 4)), "/work/linux.img");

        String command = builder.build(plan.getGraph().dfsOrderMachines().get(1), 1);

        assertEquals("sudo ./FireSim-Rocket-Single-driver +permissive +slotid=1 +profile-interval=-1"
                + " +autocounter-readrate=0 +autocounter-filename=AUTOCOUNTERFILE +print-start=0 +print-end=-1"
                + " +macaddr0=00:12:6D:00:00:01 +niclog0=niclog0 +linklatency0=6405 +netbw0=200"
                + " +shmemportname0=switch0_node1 +blkdev0=linux.img +prog0=linux-bin +permissive-off", command);
    }

    @Test
    void testRemoteSwitchUsesSocketAddress() throws SimFarmException {
        SwitchNode root = new SwitchNode();
        MachineNode machine = new MachineNode();
        root.addDownlink(machine);
        TopologyDescription description = TopologyDescription.builder()
                .root(root)
                .customMapper((graph, inventory) -> {
                    inventory.getSwitchOnlyHosts().get(0).addSwitch(root);
                    inventory.getAcceleratorHosts().get(0).addMachine(machine);
                })
                .build();
        DeploymentPlan plan = compile(description, ControllerFixtures.inventory(
                HostSlot.accelerator("f1-0", 1), HostSlot.switchOnly("m4-0")));

        String command = builder.build(machine, 0);

        assertTrue(command.contains(" +switchaddr0=10.0.0.2:10000 "));
        assertFalse(command.contains("shmemportname"));
        assertFalse(command.contains("blkdev"));
    }

    @Test
    void testStandaloneMachineHasNoNetworkPort() throws SimFarmException {
        DeploymentPlan plan = compile(Topologies.noNetwork(1),
                ControllerFixtures.inventory(HostSlot.accelerator("f1-0", 1)));

        String command = builder.build(plan.getGraph().dfsOrderMachines().get(0), 0);

        assertTrue(command.contains("+macaddr0=00:12:6D:00:00:00 +niclog0=niclog0 +linklatency0=6405 +netbw0=200 +prog0=linux-bin"));
    }

    @Test
    void testOptionalFlags() throws SimFarmException {
        MachineNode machine = new MachineNode();
        machine.getSettings()
                .setTraceEnable(true)
                .setTraceSelect("1")
                .setTraceStart("100")
                .setZeroOutDram(true)
                .setDisableAsserts(true)
                .setPrintCyclePrefix(false);
        compile(TopologyDescription.builder().root(machine).build(),
                ControllerFixtures.inventory(HostSlot.accelerator("f1-0", 1)));

        String command = builder.build(machine, 0);

        assertTrue(command.contains("+profile-interval=-1 +zero-out-dram +disable-asserts +tracefile=TRACEFILE"
                + " +trace-select=1 +trace-start=100 +trace-end=-1 +trace-output-format=0 +autocounter-readrate=0"));
        assertTrue(command.contains("+print-end=-1 +print-no-cycle-prefix +macaddr0="));
    }

    @Test
    void testSupernodeSlotCarriesEveryEndpoint() throws SimFarmException {
        DeploymentPlan plan = compile(Topologies.supernodeSingleSwitch(1, 2),
                ControllerFixtures.inventory(HostSlot.accelerator("f1-0", 1)), "/work/disk.qcow2");

        String command = builder.build(plan.getGraph().dfsOrderMachines().get(0), 0);

        assertTrue(command.contains("+shmemportname0=switch0_node0 +blkdev0=/dev/nbd0 +prog0=linux-bin"));
        assertTrue(command.contains("+macaddr1=00:12:6D:00:00:01 +niclog1=niclog1"));
        assertTrue(command.contains("+shmemportname1=switch0_node1 +blkdev1=/dev/nbd1 +prog1=linux-bin +permissive-off"));
    }

    @Test
    void testDriverExecutableName() throws SimFarmException {
        DeploymentPlan plan = compile(Topologies.noNetwork(1),
                ControllerFixtures.inventory(HostSlot.accelerator("f1-0", 1)));

        assertEquals("FireSim-Rocket-Single-driver", SimulationCommandBuilder.driverExecutable(
                plan.getGraph().dfsOrderMachines().get(0).getResolvedHardwareConfig()));
        assertEquals("linux.img", SimulationCommandBuilder.fileName("/work/images/linux.img"));
    }

    private DeploymentPlan compile(TopologyDescription description, Inventory inventory, String... images)
            throws SimFarmException {
        DeploymentPlan plan = ControllerFixtures.compile(description, inventory,
                ControllerFixtures.workload(tempDir.resolve("results"), images), tempDir.resolve("build"));
        plan.bind(StaticInventoryProvider.mockOnly(), true);
        return plan;
    }
}
