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
import dev.mars.simfarm.compiler.render.TopologyRenderer;
import dev.mars.simfarm.config.RuntimeDefaults;
import dev.mars.simfarm.hwconfig.HardwareConfigRegistry;
import dev.mars.simfarm.inventory.Inventory;
import dev.mars.simfarm.topology.AddressAllocator;
import dev.mars.simfarm.topology.TopologyDescription;
import dev.mars.simfarm.topology.TopologyGraph;
import dev.mars.simfarm.workload.Workload;

import java.nio.file.Path;

/**
 * Everything the passes of one compilation read and mutate. The address allocator
 * belongs to this context alone.
 */
public class CompilationContext {

    private final TopologyDescription description;
    private final TopologyGraph graph;
    private final Inventory inventory;
    private final Workload workload;
    private final HardwareConfigRegistry hardwareConfigs;
    private final RuntimeDefaults defaults;
    private final ArtifactBuilder artifactBuilder;
    private final TopologyRenderer renderer;
    private final Path diagramPath;
    private final AddressAllocator addressAllocator = new AddressAllocator();

    public CompilationContext(TopologyDescription description, TopologyGraph graph, Inventory inventory,
                              Workload workload, HardwareConfigRegistry hardwareConfigs, RuntimeDefaults defaults,
                              ArtifactBuilder artifactBuilder, TopologyRenderer renderer, Path diagramPath) {
        this.description = description;
        this.graph = graph;
        this.inventory = inventory;
        this.workload = workload;
        this.hardwareConfigs = hardwareConfigs;
        this.defaults = defaults;
        this.artifactBuilder = artifactBuilder;
        this.renderer = renderer;
        this.diagramPath = diagramPath;
    }

    public TopologyDescription getDescription() {
        return description;
    }

    public TopologyGraph getGraph() {
        return graph;
    }

    public Inventory getInventory() {
        return inventory;
    }

    public Workload getWorkload() {
        return workload;
    }

    public HardwareConfigRegistry getHardwareConfigs() {
        return hardwareConfigs;
    }

    public RuntimeDefaults getDefaults() {
        return defaults;
    }

    public ArtifactBuilder getArtifactBuilder() {
        return artifactBuilder;
    }

    /**
     * @return the diagram renderer, or null when diagrams are disabled
     */
    public TopologyRenderer getRenderer() {
        return renderer;
    }

    public Path getDiagramPath() {
        return diagramPath;
    }

    public AddressAllocator getAddressAllocator() {
        return addressAllocator;
    }
}
