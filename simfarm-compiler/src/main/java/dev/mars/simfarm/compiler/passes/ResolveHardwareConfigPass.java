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
import dev.mars.simfarm.core.exceptions.HardwareConfigException;
import dev.mars.simfarm.hwconfig.HardwareConfig;
import dev.mars.simfarm.topology.HardwareConfigRef;
import dev.mars.simfarm.topology.MachineNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces every machine's hardware config reference with a resolved config. Machines
 * without one get the run default. Running it again changes nothing.
 */
public class ResolveHardwareConfigPass extends AbstractPass {

    private static final Logger logger = LoggerFactory.getLogger(ResolveHardwareConfigPass.class);

    public ResolveHardwareConfigPass() {
        super("resolve-hardware-config", CompilationStage.HARDWARE_CONFIG);
    }

    @Override
    public void apply(CompilationContext context) throws HardwareConfigException {
        for (MachineNode machine : context.getGraph().dfsOrderMachines()) {
            HardwareConfigRef ref = machine.getHardwareConfig();
            HardwareConfig config;
            if (ref == null) {
                config = context.getHardwareConfigs().resolve(context.getDefaults().getDefaultHardwareConfig());
            } else if (ref instanceof HardwareConfigRef.Unresolved unresolved) {
                config = context.getHardwareConfigs().resolve(unresolved.name());
            } else {
                config = ((HardwareConfigRef.Resolved) ref).config();
            }
            config.getDeployTriplet();
            machine.setHardwareConfig(new HardwareConfigRef.Resolved(config));
            logger.debug("{} uses hardware config {}", machine.getId(), config.getName());
        }
    }
}
