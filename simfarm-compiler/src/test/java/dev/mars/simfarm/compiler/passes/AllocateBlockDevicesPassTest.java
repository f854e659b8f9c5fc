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

import dev.mars.simfarm.compiler.CompilerFixtures;
import dev.mars.simfarm.compiler.PassPipeline;
import dev.mars.simfarm.compiler.RecordingArtifactBuilder;
import dev.mars.simfarm.core.exceptions.SimFarmException;
import dev.mars.simfarm.inventory.HostSlot;
import dev.mars.simfarm.inventory.Inventory;
import dev.mars.simfarm.topology.MachineNode;
import dev.mars.simfarm.topology.Topologies;
import dev.mars.simfarm.topology.TopologyDescription;
import dev.mars.simfarm.workload.Workload;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AllocateBlockDevicesPassTest {

    @Test
    void testOneDevicePerCopyOnWriteImageAcrossTheSlot() throws SimFarmException {
        Workload workload = Workload.builder("cow")
                .uniform("bin", List.of("rootfs.img", "scratch.qcow2"), List.of())
                .build();
        Inventory inventory = CompilerFixtures.inventory(0, 4);
        PassPipeline pipeline = plan(Topologies.supernodeSingleSwitch(2, 2), inventory, workload);

        pipeline.run(new AllocateBlockDevicesPass());

        List<MachineNode> machines = pipeline.getContext().getGraph().dfsOrderMachines();
        assertEquals(List.of("/dev/nbd0", "/dev/nbd1"), machines.get(0).getBlockDevices());
        assertEquals(List.of("/dev/nbd2", "/dev/nbd3"), machines.get(1).getBlockDevices());
        HostSlot host = inventory.getHosts().get(0);
        assertEquals(4, host.getBlockDevices().getAllocated().size());
    }

    @Test
    void testRerunKeepsExistingAllocations() throws SimFarmException {
        Workload workload = Workload.builder("cow")
                .uniform("bin", List.of("disk.qcow2"), List.of())
                .build();
        Inventory inventory = CompilerFixtures.inventory(0, 2);
        PassPipeline pipeline = plan(Topologies.noNetwork(2), inventory, workload);
        AllocateBlockDevicesPass pass = new AllocateBlockDevicesPass();

        pipeline.run(pass);
        pipeline.run(pass);

        assertEquals(2, inventory.getHosts().get(0).getBlockDevices().getAllocated().size());
        assertEquals(List.of("/dev/nbd1"), pipeline.getContext().getGraph().dfsOrderMachines().get(1).getBlockDevices());
    }

    @Test
    void testNoCopyOnWriteImagesAllocatesNothing() throws SimFarmException {
        Inventory inventory = CompilerFixtures.inventory(0, 2);
        PassPipeline pipeline = plan(Topologies.noNetwork(2), inventory, CompilerFixtures.uniformWorkload());

        pipeline.run(new AllocateBlockDevicesPass());

        assertEquals(List.of(), pipeline.getContext().getGraph().dfsOrderMachines().get(0).getBlockDevices());
        assertTrue(inventory.getHosts().get(0).getBlockDevices().getAllocated().isEmpty());
    }

    private static PassPipeline plan(TopologyDescription description, Inventory inventory, Workload workload)
            throws SimFarmException {
        PassPipeline pipeline = new PassPipeline(CompilerFixtures.context(description, inventory, workload,
                CompilerFixtures.registry(), new RecordingArtifactBuilder()));
        pipeline.run(new AssignAddressesPass());
        pipeline.run(new HostMappingPass());
        pipeline.run(new AssignJobsPass());
        return pipeline;
    }
}
