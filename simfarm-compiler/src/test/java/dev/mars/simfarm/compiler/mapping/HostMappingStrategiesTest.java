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

import dev.mars.simfarm.core.exceptions.TopologyShapeException;
import dev.mars.simfarm.inventory.HostMappingStrategy;
import dev.mars.simfarm.topology.Topologies;
import dev.mars.simfarm.topology.TopologyDescription;
import dev.mars.simfarm.topology.TopologyGraph;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HostMappingStrategiesTest {

    @Test
    void testByName() throws TopologyShapeException {
        assertInstanceOf(NoNetworkPackingStrategy.class, HostMappingStrategies.byName("no-net"));
        assertInstanceOf(SimpleNetworkedStrategy.class, HostMappingStrategies.byName("simple-networked"));
        assertInstanceOf(SingleHostStrategy.class, HostMappingStrategies.byName("single-host"));
        assertThrows(TopologyShapeException.class, () -> HostMappingStrategies.byName("round-robin"));
    }

    @Test
    void testDefaultSelectionFollowsShape() throws TopologyShapeException {
        TopologyDescription flat = Topologies.noNetwork(2);
        TopologyDescription networked = Topologies.singleSwitch(2);

        assertEquals("no-net", select(flat).toString());
        assertEquals("simple-networked", select(networked).toString());
    }

    @Test
    void testNamedMapperOverridesShape() throws TopologyShapeException {
        TopologyDescription description = TopologyDescription.builder()
                .roots(Topologies.singleSwitch(2).getRoots())
                .mapperName("single-host")
                .build();

        assertInstanceOf(SingleHostStrategy.class, select(description));
    }

    @Test
    void testCustomMapperWins() throws TopologyShapeException {
        HostMappingStrategy custom = (graph, inventory) -> { };
        TopologyDescription description = TopologyDescription.builder()
                .roots(Topologies.noNetwork(1).getRoots())
                .customMapper(custom)
                .build();

        assertSame(custom, select(description));
    }

    private static HostMappingStrategy select(TopologyDescription description) throws TopologyShapeException {
        return HostMappingStrategies.select(description, new TopologyGraph(description.getRoots()));
    }
}
