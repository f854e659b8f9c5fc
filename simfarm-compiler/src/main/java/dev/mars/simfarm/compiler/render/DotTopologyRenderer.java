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

package dev.mars.simfarm.compiler.render;

import dev.mars.simfarm.inventory.HostSlot;
import dev.mars.simfarm.topology.SwitchNode;
import dev.mars.simfarm.topology.TopologyGraph;
import dev.mars.simfarm.topology.TopologyNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the topology as Graphviz DOT text, one cluster per host. Nodes that are
 * not mapped yet are drawn outside any cluster.
 */
public class DotTopologyRenderer implements TopologyRenderer {

    @Override
    public void render(TopologyGraph graph, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, toDot(graph), StandardCharsets.UTF_8);
    }

    public String toDot(TopologyGraph graph) {
        Map<String, List<TopologyNode>> byHost = new LinkedHashMap<>();
        List<TopologyNode> unmapped = new ArrayList<>();
        for (TopologyNode node : graph.dfsOrder()) {
            HostSlot host = node.getHost();
            if (host == null) {
                unmapped.add(node);
            } else {
                byHost.computeIfAbsent(host.getHostId(), key -> new ArrayList<>()).add(node);
            }
        }

        StringBuilder dot = new StringBuilder("digraph topology {\n");
        int cluster = 0;
        for (Map.Entry<String, List<TopologyNode>> entry : byHost.entrySet()) {
            dot.append("  subgraph cluster_").append(cluster++).append(" {\n");
            dot.append("    label=").append(quote(entry.getKey())).append(";\n");
            dot.append("    node [shape=box];\n");
            for (TopologyNode node : entry.getValue()) {
                dot.append("    ").append(nodeLine(node)).append('\n');
            }
            dot.append("  }\n");
        }
        for (TopologyNode node : unmapped) {
            dot.append("  ").append(nodeLine(node)).append('\n');
        }
        for (SwitchNode switchNode : graph.dfsOrderSwitches()) {
            for (TopologyNode child : switchNode.getDownlinks()) {
                dot.append("  ").append(quote(switchNode.getId())).append(" -> ")
                        .append(quote(child.getId())).append(";\n");
            }
        }
        return dot.append("}\n").toString();
    }

    private static String nodeLine(TopologyNode node) {
        return quote(node.getId()) + " [label=" + quote(node.describe()) + "];";
    }

    private static String quote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
