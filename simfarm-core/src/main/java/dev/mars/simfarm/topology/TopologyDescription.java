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

import dev.mars.simfarm.inventory.HostMappingStrategy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Declarative description of a topology: its root nodes plus an optional choice
 * of host mapping strategy.
 *
 * <p>A strategy may be given as an instance ({@link Builder#customMapper}) or by
 * name ({@link Builder#mapperName}), not both. With neither, the compiler picks a
 * strategy from the topology's shape.</p>
 */
public final class TopologyDescription {

    private final String name;
    private final List<TopologyNode> roots;
    private final HostMappingStrategy customMapper;
    private final String mapperName;

    private TopologyDescription(Builder builder) {
        this.name = builder.name;
        this.roots = List.copyOf(builder.roots);
        this.customMapper = builder.customMapper;
        this.mapperName = builder.mapperName;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() {
        return name;
    }

    public List<TopologyNode> getRoots() {
        return roots;
    }

    public HostMappingStrategy getCustomMapper() {
        return customMapper;
    }

    public String getMapperName() {
        return mapperName;
    }

    @Override
    public String toString() {
        return "TopologyDescription{name='" + name + "', roots=" + roots.size()
                + ", mapper=" + (customMapper != null ? "custom" : mapperName) + '}';
    }

    public static final class Builder {
        private String name = "topology";
        private final List<TopologyNode> roots = new ArrayList<>();
        private HostMappingStrategy customMapper;
        private String mapperName;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "Topology name cannot be null");
            return this;
        }

        public Builder root(TopologyNode root) {
            roots.add(Objects.requireNonNull(root, "Root node cannot be null"));
            return this;
        }

        public Builder roots(TopologyNode... roots) {
            Arrays.stream(roots).forEach(this::root);
            return this;
        }

        public Builder roots(List<? extends TopologyNode> roots) {
            roots.forEach(this::root);
            return this;
        }

        public Builder customMapper(HostMappingStrategy customMapper) {
            this.customMapper = customMapper;
            return this;
        }

        public Builder mapperName(String mapperName) {
            this.mapperName = mapperName;
            return this;
        }

        public TopologyDescription build() {
            if (roots.isEmpty()) {
                throw new IllegalStateException("Topology '" + name + "' has no root nodes");
            }
            if (customMapper != null && mapperName != null) {
                throw new IllegalStateException("Topology '" + name
                        + "' sets both a custom mapper and a mapper name");
            }
            return new TopologyDescription(this);
        }
    }
}
