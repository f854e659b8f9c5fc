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
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * The simulated network: a forest of {@link TopologyNode}s rooted at
 * {@link #getRoots()}.
 *
 * <p>DFS order is post-order: every node appears after all of its downlinks,
 * siblings in port order, roots in the order given. Bottom-up passes rely on
 * that. Construction assigns node ids: switches are numbered top-down
 * ({@code switch0} is the first root switch), endpoints in DFS order
 * ({@code node0} is the first leaf).</p>
 */
public class TopologyGraph {

    private final List<TopologyNode> roots;

    public TopologyGraph(List<? extends TopologyNode> roots) throws TopologyShapeException {
        Objects.requireNonNull(roots, "Roots cannot be null");
        if (roots.isEmpty()) {
            throw new TopologyShapeException("<root>", "topology has no root nodes");
        }
        for (TopologyNode root : roots) {
            if (root.hasUplink()) {
                throw new TopologyShapeException(root.getId(), "a root node cannot have an uplink");
            }
        }
        this.roots = List.copyOf(roots);
        assignIds();
    }

    public List<TopologyNode> getRoots() {
        return roots;
    }

    /**
     * @return true when at least one root is a switch, i.e. the endpoints share one
     *         networked simulation
     */
    public boolean isNetworked() {
        return roots.stream().anyMatch(root -> root instanceof SwitchNode);
    }

    public boolean rootsAreEndpoints() {
        return roots.stream().allMatch(root -> root instanceof EndpointNode);
    }

    public List<TopologyNode> dfsOrder() {
        List<TopologyNode> order = new ArrayList<>();
        for (TopologyNode root : roots) {
            postOrder(root, order::add);
        }
        return Collections.unmodifiableList(order);
    }

    public List<SwitchNode> dfsOrderSwitches() {
        return filter(SwitchNode.class);
    }

    public List<EndpointNode> dfsOrderEndpoints() {
        return filter(EndpointNode.class);
    }

    public List<MachineNode> dfsOrderMachines() {
        return filter(MachineNode.class);
    }

    public int size() {
        return dfsOrder().size();
    }

    private <T extends TopologyNode> List<T> filter(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (TopologyNode node : dfsOrder()) {
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static void postOrder(TopologyNode node, Consumer<TopologyNode> visitor) {
        if (node instanceof SwitchNode switchNode) {
            for (TopologyNode child : switchNode.getDownlinks()) {
                postOrder(child, visitor);
            }
        }
        visitor.accept(node);
    }

    private static void preOrder(TopologyNode node, Consumer<TopologyNode> visitor) {
        visitor.accept(node);
        if (node instanceof SwitchNode switchNode) {
            for (TopologyNode child : switchNode.getDownlinks()) {
                preOrder(child, visitor);
            }
        }
    }

    private void assignIds() {
        int[] switchCount = {0};
        for (TopologyNode root : roots) {
            preOrder(root, node -> {
                if (node instanceof SwitchNode) {
                    node.assignId("switch" + switchCount[0]++);
                }
            });
        }
        int endpointCount = 0;
        for (TopologyNode node : dfsOrder()) {
            if (node instanceof EndpointNode) {
                node.assignId("node" + endpointCount++);
            }
        }
    }

    @Override
    public String toString() {
        return "TopologyGraph{roots=" + roots + ", switches=" + dfsOrderSwitches().size()
                + ", endpoints=" + dfsOrderEndpoints().size() + '}';
    }
}
