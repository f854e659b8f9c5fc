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
import dev.mars.simfarm.topology.TopologyDescription;
import dev.mars.simfarm.topology.TopologyGraph;

/**
 * Chooses the host mapping strategy for a topology.
 *
 * <p>A strategy instance attached to the description wins, then a strategy name,
 * then the structural default: no-network packing when every root is an endpoint,
 * simple networked mapping otherwise.</p>
 */
public final class HostMappingStrategies {

    public static final String NO_NET = "no-net";
    public static final String SIMPLE_NETWORKED = "simple-networked";
    public static final String SINGLE_HOST = "single-host";

    private HostMappingStrategies() {
    }

    public static HostMappingStrategy byName(String name) throws TopologyShapeException {
        switch (name) {
            case NO_NET:
                return new NoNetworkPackingStrategy();
            case SIMPLE_NETWORKED:
                return new SimpleNetworkedStrategy();
            case SINGLE_HOST:
                return new SingleHostStrategy();
            default:
                throw new TopologyShapeException("<mapper>", "unknown host mapping strategy '" + name
                        + "'; expected one of " + NO_NET + ", " + SIMPLE_NETWORKED + ", " + SINGLE_HOST);
        }
    }

    public static HostMappingStrategy select(TopologyDescription description, TopologyGraph graph)
            throws TopologyShapeException {
        if (description.getCustomMapper() != null) {
            return description.getCustomMapper();
        }
        if (description.getMapperName() != null) {
            return byName(description.getMapperName());
        }
        return graph.rootsAreEndpoints() ? new NoNetworkPackingStrategy() : new SimpleNetworkedStrategy();
    }
}
