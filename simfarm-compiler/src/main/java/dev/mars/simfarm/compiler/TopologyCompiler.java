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

import dev.mars.simfarm.build.ArtifactBuilder;
import dev.mars.simfarm.compiler.passes.AllocateBlockDevicesPass;
import dev.mars.simfarm.compiler.passes.ApplyNetworkDefaultsPass;
import dev.mars.simfarm.compiler.passes.AssignAddressesPass;
import dev.mars.simfarm.compiler.passes.AssignJobsPass;
import dev.mars.simfarm.compiler.passes.ComputeForwardingTablesPass;
import dev.mars.simfarm.compiler.passes.HostMappingPass;
import dev.mars.simfarm.compiler.passes.RenderDiagramPass;
import dev.mars.simfarm.compiler.passes.ResolveHardwareConfigPass;
import dev.mars.simfarm.compiler.render.DotTopologyRenderer;
import dev.mars.simfarm.compiler.render.TopologyRenderer;
import dev.mars.simfarm.config.RuntimeDefaults;
import dev.mars.simfarm.config.SimFarmConfiguration;
import dev.mars.simfarm.core.exceptions.SimFarmException;
import dev.mars.simfarm.hwconfig.HardwareConfigRegistry;
import dev.mars.simfarm.inventory.Inventory;
import dev.mars.simfarm.topology.TopologyDescription;
import dev.mars.simfarm.topology.TopologyGraph;
import dev.mars.simfarm.workload.Workload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Compiles a topology description against an inventory and a workload into a
 * {@link DeploymentPlan}.
 *
 * <p>Compilation runs the passes that need no contact with any host: address
 * assignment, forwarding tables, host mapping, hardware config resolution, network
 * defaults, job binding, block device allocation and the diagram. Build passes run
 * later, once the plan's inventory is bound.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class TopologyCompiler {

    private static final Logger logger = LoggerFactory.getLogger(TopologyCompiler.class);

    private final HardwareConfigRegistry hardwareConfigs;
    private final RuntimeDefaults defaults;
    private final ArtifactBuilder artifactBuilder;
    private final TopologyRenderer renderer;
    private final Path diagramDirectory;

    private TopologyCompiler(Builder builder) {
        this.hardwareConfigs = Objects.requireNonNull(builder.hardwareConfigs, "Hardware config registry cannot be null");
        this.defaults = builder.defaults;
        this.artifactBuilder = Objects.requireNonNull(builder.artifactBuilder, "Artifact builder cannot be null");
        this.renderer = builder.renderer;
        this.diagramDirectory = builder.diagramDirectory;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Compiler with defaults and diagram settings taken from the configuration.
     */
    public static TopologyCompiler fromConfiguration(SimFarmConfiguration configuration,
                                                     HardwareConfigRegistry hardwareConfigs,
                                                     ArtifactBuilder artifactBuilder) {
        Builder builder = builder()
                .hardwareConfigs(hardwareConfigs)
                .artifactBuilder(artifactBuilder)
                .defaults(RuntimeDefaults.fromConfiguration(configuration));
        if (configuration.isDiagramEnabled()) {
            builder.renderer(new DotTopologyRenderer()).diagramDirectory(configuration.getDiagramOutputDir());
        }
        return builder.build();
    }

    public DeploymentPlan compile(TopologyDescription description, Inventory inventory, Workload workload)
            throws SimFarmException {
        Objects.requireNonNull(description, "Topology description cannot be null");
        Objects.requireNonNull(inventory, "Inventory cannot be null");
        Objects.requireNonNull(workload, "Workload cannot be null");

        logger.info("Compiling topology '{}' for workload '{}'", description.getName(), workload.getName());
        TopologyGraph graph = new TopologyGraph(description.getRoots());
        Path diagramPath = renderer != null && diagramDirectory != null
                ? diagramDirectory.resolve(description.getName() + ".dot")
                : null;
        CompilationContext context = new CompilationContext(description, graph, inventory, workload,
                hardwareConfigs, defaults, artifactBuilder, renderer, diagramPath);
        PassPipeline pipeline = new PassPipeline(context);
        for (Pass pass : phaseOnePasses()) {
            pipeline.run(pass);
        }
        logger.info("Compiled {}: {} switches, {} endpoints on {} hosts", description.getName(),
                graph.dfsOrderSwitches().size(), graph.dfsOrderEndpoints().size(), inventory.getUsedHosts().size());
        return new DeploymentPlan(pipeline);
    }

    static List<Pass> phaseOnePasses() {
        return List.of(
                new AssignAddressesPass(),
                new ComputeForwardingTablesPass(),
                new HostMappingPass(),
                new ResolveHardwareConfigPass(),
                new ApplyNetworkDefaultsPass(),
                new AssignJobsPass(),
                new AllocateBlockDevicesPass(),
                new RenderDiagramPass());
    }

    public static final class Builder {
        private HardwareConfigRegistry hardwareConfigs;
        private RuntimeDefaults defaults = RuntimeDefaults.defaults();
        private ArtifactBuilder artifactBuilder;
        private TopologyRenderer renderer;
        private Path diagramDirectory;

        private Builder() {
        }

        public Builder hardwareConfigs(HardwareConfigRegistry hardwareConfigs) {
            this.hardwareConfigs = hardwareConfigs;
            return this;
        }

        public Builder defaults(RuntimeDefaults defaults) {
            this.defaults = Objects.requireNonNull(defaults, "Runtime defaults cannot be null");
            return this;
        }

        public Builder artifactBuilder(ArtifactBuilder artifactBuilder) {
            this.artifactBuilder = artifactBuilder;
            return this;
        }

        public Builder renderer(TopologyRenderer renderer) {
            this.renderer = renderer;
            return this;
        }

        public Builder diagramDirectory(Path diagramDirectory) {
            this.diagramDirectory = diagramDirectory;
            return this;
        }

        public TopologyCompiler build() {
            return new TopologyCompiler(this);
        }
    }
}
