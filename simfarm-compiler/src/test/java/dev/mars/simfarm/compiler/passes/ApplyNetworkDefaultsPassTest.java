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

import dev.mars.simfarm.compiler.CompilationContext;
import dev.mars.simfarm.compiler.CompilerFixtures;
import dev.mars.simfarm.compiler.RecordingArtifactBuilder;
import dev.mars.simfarm.config.RuntimeDefaults;
import dev.mars.simfarm.core.exceptions.TopologyShapeException;
import dev.mars.simfarm.topology.MachineNode;
import dev.mars.simfarm.topology.SwitchNode;
import dev.mars.simfarm.topology.TopologyDescription;
import dev.mars.simfarm.topology.TopologyGraph;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApplyNetworkDefaultsPassTest {

    @Test
    void testExplicitValuesSurviveDefaults() throws TopologyShapeException {
        SwitchNode root = new SwitchNode().setBandwidth(100);
        MachineNode tuned = new MachineNode();
        tuned.getSettings().setLinkLatency(3200).setZeroOutDram(true);
        MachineNode plain = new MachineNode();
        root.addDownlinks(tuned, plain);
        TopologyDescription description = TopologyDescription.builder().root(root).build();
        RuntimeDefaults defaults = RuntimeDefaults.builder()
                .linkLatency(7000)
                .switchingLatency(20)
                .bandwidth(400)
                .printCyclePrefix(false)
                .build();
        CompilationContext context = new CompilationContext(description, new TopologyGraph(description.getRoots()),
                CompilerFixtures.inventory(0, 2), CompilerFixtures.uniformWorkload(), CompilerFixtures.registry(),
                defaults, new RecordingArtifactBuilder(), null, null);

        new ApplyNetworkDefaultsPass().apply(context);

        assertEquals(100, root.getBandwidth());
        assertEquals(7000, root.getLinkLatency());
        assertEquals(20, root.getSwitchingLatency());
        assertEquals(3200, tuned.getSettings().getLinkLatency());
        assertTrue(tuned.getSettings().getZeroOutDram());
        assertEquals(7000, plain.getSettings().getLinkLatency());
        assertEquals(400, plain.getSettings().getBandwidthMax());
        assertFalse(plain.getSettings().getPrintCyclePrefix());
        assertTrue(plain.getSettings().isComplete());
        assertTrue(tuned.getSettings().isComplete());
    }
}
