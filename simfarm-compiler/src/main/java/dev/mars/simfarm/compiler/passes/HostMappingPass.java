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
import dev.mars.simfarm.compiler.mapping.HostMappingStrategies;
import dev.mars.simfarm.core.exceptions.SimFarmException;
import dev.mars.simfarm.core.exceptions.TopologyShapeException;
import dev.mars.simfarm.inventory.HostMappingStrategy;
import dev.mars.simfarm.inventory.HostSlot;
import dev.mars.simfarm.topology.MachineNode;
import dev.mars.simfarm.topology.SwitchNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places switches and machines on hosts with the strategy the topology selects, then
 * checks that nothing was left unplaced.
 */
public class HostMappingPass extends AbstractPass {

    private static final Logger logger = LoggerFactory.getLogger(HostMappingPass.class);

    public HostMappingPass() {
        super("host-mapping", CompilationStage.HOST_MAPPING);
    }

    @Override
    public void apply(CompilationContext context) throws SimFarmException {
        HostMappingStrategy strategy = HostMappingStrategies.select(context.getDescription(), context.getGraph());
        logger.info("Mapping topology '{}' with strategy {}", context.getDescription().getName(), strategy);
        strategy.map(context.getGraph(), context.getInventory());

        for (SwitchNode switchNode : context.getGraph().dfsOrderSwitches()) {
            if (switchNode.getHost() == null) {
                throw new TopologyShapeException(switchNode.getId(), "switch was not mapped to any host by " + strategy);
            }
        }
        for (MachineNode machine : context.getGraph().dfsOrderMachines()) {
            if (machine.getHost() == null) {
                throw new TopologyShapeException(machine.getId(), "machine was not mapped to any host by " + strategy);
            }
        }
        for (HostSlot host : context.getInventory().getUsedHosts()) {
            logger.info("Host {}: {} switches, {} machines", host.getHostId(),
                    host.getSwitches().size(), host.getMachines().size());
        }
    }
}
