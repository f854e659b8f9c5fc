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

import dev.mars.simfarm.compiler.passes.BuildDriversPass;
import dev.mars.simfarm.compiler.passes.BuildSwitchesPass;
import dev.mars.simfarm.core.exceptions.InventoryBindingException;
import dev.mars.simfarm.core.exceptions.SimFarmException;
import dev.mars.simfarm.inventory.HostSlot;
import dev.mars.simfarm.inventory.Inventory;
import dev.mars.simfarm.inventory.InventoryProvider;
import dev.mars.simfarm.topology.TopologyDescription;
import dev.mars.simfarm.topology.TopologyGraph;
import dev.mars.simfarm.workload.Workload;

import java.util.List;

/**
 * A compiled topology: the mutated graph, the mapped inventory and the workload, plus
 * the pipeline that remembers which stages have been reached.
 */
public class DeploymentPlan {

    private final PassPipeline pipeline;

    DeploymentPlan(PassPipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * Binds the inventory to network addresses. Binding again with the same mode is a
     * no-op; with the other mode it fails.
     */
    public void bind(InventoryProvider provider, boolean useMock) throws InventoryBindingException {
        getInventory().bind(provider, useMock);
        pipeline.markReached(CompilationStage.INVENTORY_BOUND);
    }

    /**
     * Builds drivers and switch binaries. Requires a bound inventory; a second call
     * does nothing.
     */
    public synchronized void buildArtifacts() throws SimFarmException {
        if (!pipeline.hasRun(CompilationStage.DRIVERS_BUILT)) {
            pipeline.run(new BuildDriversPass());
        }
        if (!pipeline.hasRun(CompilationStage.SWITCHES_BUILT)) {
            pipeline.run(new BuildSwitchesPass());
        }
    }

    public boolean hasRun(CompilationStage stage) {
        return pipeline.hasRun(stage);
    }

    public List<String> getExecutedPasses() {
        return pipeline.getExecutedPasses();
    }

    public PassPipeline getPipeline() {
        return pipeline;
    }

    public TopologyDescription getDescription() {
        return pipeline.getContext().getDescription();
    }

    public TopologyGraph getGraph() {
        return pipeline.getContext().getGraph();
    }

    public Inventory getInventory() {
        return pipeline.getContext().getInventory();
    }

    /**
     * Every host of the inventory; idle hosts take part in liveness checks and teardown.
     */
    public List<HostSlot> getHosts() {
        return getInventory().getHosts();
    }

    public Workload getWorkload() {
        return pipeline.getContext().getWorkload();
    }

    /**
     * True when the endpoints share a simulated network and must be torn down together.
     */
    public boolean isNetworked() {
        return getGraph().isNetworked();
    }
}
