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
import dev.mars.simfarm.compiler.render.SwitchConfigGenerator;
import dev.mars.simfarm.core.exceptions.SimFarmException;
import dev.mars.simfarm.topology.SwitchNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates each switch's configuration source and builds its binary once.
 * Port wiring depends on where neighbours run, so hosts must be bound first.
 */
public class BuildSwitchesPass extends AbstractPass {

    private static final Logger logger = LoggerFactory.getLogger(BuildSwitchesPass.class);

    private final SwitchConfigGenerator generator = new SwitchConfigGenerator();

    public BuildSwitchesPass() {
        super("build-switches", CompilationStage.SWITCHES_BUILT,
                CompilationStage.FORWARDING_TABLES, CompilationStage.HOST_MAPPING,
                CompilationStage.NETWORK_DEFAULTS, CompilationStage.INVENTORY_BOUND);
    }

    @Override
    public void apply(CompilationContext context) throws SimFarmException {
        for (SwitchNode switchNode : context.getGraph().dfsOrderSwitches()) {
            if (switchNode.getBuiltBinary() != null) {
                continue;
            }
            String source = generator.generate(switchNode);
            switchNode.setBuiltBinary(context.getArtifactBuilder().buildSwitch(switchNode, source));
            logger.info("Built switch {} -> {}", switchNode.getId(), switchNode.getBuiltBinary());
        }
    }
}
