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
import dev.mars.simfarm.topology.ForwardingTable;
import dev.mars.simfarm.topology.SwitchNode;
import dev.mars.simfarm.topology.TopologyNode;

import java.util.List;
import java.util.StringJoiner;

/**
 * Generates the configuration header a switch model is compiled with: port counts,
 * port wiring, the MAC to port table and the link parameters.
 *
 * <p>Neighbours on the same host are wired through shared memory; neighbours on
 * other hosts through TCP. A switch listens for each remote downlink on
 * {@link #BASE_PORT} {@code + 64 * switchNumber + downlinkIndex}, and a remote uplink
 * connects to the matching port on its parent's host.</p>
 */
public class SwitchConfigGenerator {

    static final int BASE_PORT = 10000;
    static final int PORTS_PER_SWITCH = 64;

    public String generate(SwitchNode switchNode) {
        ForwardingTable table = switchNode.getForwardingTable();
        if (table == null) {
            throw new IllegalStateException("Switch " + switchNode.getId() + " has no forwarding table");
        }
        List<TopologyNode> downlinks = switchNode.getDownlinks();
        int uplinks = switchNode.hasUplink() ? 1 : 0;

        StringBuilder out = new StringBuilder();
        out.append("// switch configuration for ").append(switchNode.getId()).append('\n');
        out.append("#ifdef NUMCLIENTSCONFIG\n");
        out.append("#define NUMPORTS ").append(downlinks.size() + uplinks).append('\n');
        out.append("#define NUMDOWNLINKS ").append(downlinks.size()).append('\n');
        out.append("#define NUMUPLINKS ").append(uplinks).append('\n');
        out.append("#endif\n");

        out.append("#ifdef PORTSETUPCONFIG\n");
        for (int port = 0; port < downlinks.size(); port++) {
            TopologyNode child = downlinks.get(port);
            if (sameHost(switchNode, child)) {
                out.append(String.format("ports[%d] = new ShmemPort(%d, \"%s\", false);%n",
                        port, port, linkName(switchNode, child)));
            } else {
                out.append(String.format("ports[%d] = new SocketServerPort(%d, %d);%n",
                        port, port, listenPort(switchNode, port)));
            }
        }
        if (switchNode.hasUplink()) {
            SwitchNode parent = switchNode.getUplink();
            int uplinkPort = downlinks.size();
            if (sameHost(switchNode, parent)) {
                out.append(String.format("ports[%d] = new ShmemPort(%d, \"%s\", true);%n",
                        uplinkPort, uplinkPort, linkName(parent, switchNode)));
            } else {
                int parentPort = parent.getDownlinks().indexOf(switchNode);
                out.append(String.format("ports[%d] = new SocketClientPort(%d, \"%s\", %d);%n",
                        uplinkPort, uplinkPort, parent.getHost().getAddress(), listenPort(parent, parentPort)));
            }
        }
        out.append("#endif\n");

        out.append("#ifdef MACPORTSCONFIG\n");
        StringJoiner entries = new StringJoiner(", ", "{", "}");
        for (int port : table.asList()) {
            entries.add(String.valueOf(port));
        }
        out.append("uint16_t mac2port[").append(table.size()).append("] ").append(entries).append(";\n");
        out.append("#endif\n");

        out.append("#ifdef NETPARAMSCONFIG\n");
        out.append("#define LINKLATENCY ").append(switchNode.getLinkLatency()).append('\n');
        out.append("#define SWITCHLATENCY ").append(switchNode.getSwitchingLatency()).append('\n');
        out.append("#define BANDWIDTH ").append(switchNode.getBandwidth()).append('\n');
        out.append("#endif\n");
        return out.toString();
    }

    public static String linkName(SwitchNode parent, TopologyNode child) {
        return parent.getId() + "_" + child.getId();
    }

    public static int listenPort(SwitchNode switchNode, int downlinkIndex) {
        return BASE_PORT + PORTS_PER_SWITCH * switchNumber(switchNode) + downlinkIndex;
    }

    private static int switchNumber(SwitchNode switchNode) {
        String id = switchNode.getId();
        return Integer.parseInt(id.substring("switch".length()));
    }

    private static boolean sameHost(TopologyNode a, TopologyNode b) {
        HostSlot hostA = a.getHost();
        HostSlot hostB = b.getHost();
        return hostA != null && hostA == hostB;
    }
}
