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

import dev.mars.simfarm.core.exceptions.TopologyShapeException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Catalog of the standard topologies, addressable by name.
 *
 * <ul>
 *   <li>{@code no_net_config}: independent machines, no switches</li>
 *   <li>{@code example_<n>config}: one switch with {@code n} machines for
 *       {@code n <= 8}; a root switch over {@code n / 8} racks of eight otherwise</li>
 *   <li>{@code supernode_example_<n>config}: one switch over {@code n / 4}
 *       four-machine supernodes</li>
 * </ul>
 */
public final class Topologies {

    public static final String NO_NET_CONFIG = "no_net_config";

    private static final int RACK_SIZE = 8;
    private static final int SUPERNODE_SIZE = 4;
    private static final Pattern EXAMPLE = Pattern.compile("example_(\\d+)config");
    private static final Pattern SUPERNODE_EXAMPLE = Pattern.compile("supernode_example_(\\d+)config");

    private Topologies() {
    }

    /**
     * Resolves a named topology.
     *
     * @param name              topology name
     * @param noNetMachineCount machine count used by {@code no_net_config}
     * @throws TopologyShapeException for an unknown name or an unsupported size
     */
    public static TopologyDescription byName(String name, int noNetMachineCount) throws TopologyShapeException {
        if (NO_NET_CONFIG.equals(name)) {
            return noNetwork(noNetMachineCount);
        }
        Matcher supernode = SUPERNODE_EXAMPLE.matcher(name);
        if (supernode.matches()) {
            int count = Integer.parseInt(supernode.group(1));
            if (count % SUPERNODE_SIZE != 0) {
                throw new TopologyShapeException(name, "supernode topologies need a multiple of " + SUPERNODE_SIZE);
            }
            return rename(supernodeSingleSwitch(count / SUPERNODE_SIZE, SUPERNODE_SIZE), name);
        }
        Matcher example = EXAMPLE.matcher(name);
        if (example.matches()) {
            int count = Integer.parseInt(example.group(1));
            if (count <= RACK_SIZE) {
                return rename(singleSwitch(count), name);
            }
            if (count % RACK_SIZE != 0) {
                throw new TopologyShapeException(name, "multi-rack topologies need a multiple of " + RACK_SIZE);
            }
            return rename(twoLevel(count / RACK_SIZE, RACK_SIZE), name);
        }
        throw new TopologyShapeException(name, "unknown topology name");
    }

    public static TopologyDescription noNetwork(int machines) {
        if (machines < 1) {
            throw new IllegalArgumentException("A topology needs at least one machine");
        }
        List<TopologyNode> roots = new ArrayList<>();
        for (int i = 0; i < machines; i++) {
            roots.add(new MachineNode());
        }
        return TopologyDescription.builder().name(NO_NET_CONFIG).roots(roots).build();
    }

    public static TopologyDescription singleSwitch(int machines) throws TopologyShapeException {
        return TopologyDescription.builder()
                .name("single_switch_" + machines)
                .root(rack(machines))
                .build();
    }

    public static TopologyDescription twoLevel(int racks, int machinesPerRack) throws TopologyShapeException {
        SwitchNode root = new SwitchNode();
        for (int i = 0; i < racks; i++) {
            root.addDownlink(rack(machinesPerRack));
        }
        return TopologyDescription.builder()
                .name("two_level_" + racks + "x" + machinesPerRack)
                .root(root)
                .build();
    }

    public static TopologyDescription supernodeSingleSwitch(int supernodes, int endpointsPerSupernode)
            throws TopologyShapeException {
        SwitchNode root = new SwitchNode();
        for (int i = 0; i < supernodes; i++) {
            MachineNode primary = new MachineNode();
            root.addDownlink(primary);
            for (int j = 1; j < endpointsPerSupernode; j++) {
                root.addDownlink(new GroupPlaceholder(primary));
            }
        }
        return TopologyDescription.builder()
                .name("supernode_" + supernodes + "x" + endpointsPerSupernode)
                .root(root)
                .build();
    }

    private static SwitchNode rack(int machines) throws TopologyShapeException {
        SwitchNode tor = new SwitchNode();
        for (int i = 0; i < machines; i++) {
            tor.addDownlink(new MachineNode());
        }
        return tor;
    }

    private static TopologyDescription rename(TopologyDescription description, String name) {
        return TopologyDescription.builder()
                .name(name)
                .roots(description.getRoots())
                .build();
    }
}
