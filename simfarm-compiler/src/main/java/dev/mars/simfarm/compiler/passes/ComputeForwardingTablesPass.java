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

package dev.mars.simfarm.compiler.passes;

import dev.mars.simfarm.compiler.CompilationContext;
import dev.mars.simfarm.compiler.CompilationStage;
import dev.mars.simfarm.core.exceptions.TopologyShapeException;
import dev.mars.simfarm.topology.EndpointNode;
import dev.mars.simfarm.topology.ForwardingTable;
import dev.mars.simfarm.topology.MacAddress;
import dev.mars.simfarm.topology.SwitchNode;
import dev.mars.simfarm.topology.TopologyNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a forwarding table for every switch.
 *
 * <p>First the set of addresses reachable below each node is propagated bottom-up,
 * relying on DFS post-order visiting children before parents. Then each switch gets
 * a table sized by the number of addresses allocated in the run, defaulting to its
 * uplink port, with every address reachable through downlink {@code i} sent to port
 * {@code i}.</p>
 */
public class ComputeForwardingTablesPass extends AbstractPass {

    private static final Logger logger = LoggerFactory.getLogger(ComputeForwardingTablesPass.class);

    public ComputeForwardingTablesPass() {
        super("compute-forwarding-tables", CompilationStage.FORWARDING_TABLES, CompilationStage.ADDRESSES_ASSIGNED);
    }

    @Override
    public void apply(CompilationContext context) throws TopologyShapeException {
        for (TopologyNode node : context.getGraph().dfsOrder()) {
            if (node instanceof EndpointNode endpoint) {
                if (endpoint.getAddress() == null) {
                    throw new TopologyShapeException(endpoint.getId(), "endpoint has no MAC address");
                }
                endpoint.setDownlinkAddresses(List.of(endpoint.getAddress()));
            } else if (node instanceof SwitchNode switchNode) {
                List<MacAddress> reachable = new ArrayList<>();
                for (TopologyNode child : switchNode.getDownlinks()) {
                    reachable.addAll(child.getDownlinkAddresses());
                }
                switchNode.setDownlinkAddresses(reachable);
            }
        }

        int tableSize = context.getAddressAllocator().peekNext();
        for (SwitchNode switchNode : context.getGraph().dfsOrderSwitches()) {
            ForwardingTable table = new ForwardingTable(tableSize, switchNode.getUplinkPort());
            List<TopologyNode> downlinks = switchNode.getDownlinks();
            for (int port = 0; port < downlinks.size(); port++) {
                for (MacAddress address : downlinks.get(port).getDownlinkAddresses()) {
                    table.setPort(address, port);
                }
            }
            switchNode.setForwardingTable(table);
            logger.debug("{} forwarding table: {}", switchNode.getId(), table);
        }
    }
}
