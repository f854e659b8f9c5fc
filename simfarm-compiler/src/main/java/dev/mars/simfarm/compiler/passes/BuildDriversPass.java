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
import dev.mars.simfarm.core.exceptions.SimFarmException;
import dev.mars.simfarm.hwconfig.HardwareConfig;
import dev.mars.simfarm.topology.MachineNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Builds the driver of every hardware config in use. Each config caches its build,
 * so a driver is built at most once per process.
 */
public class BuildDriversPass extends AbstractPass {

    private static final Logger logger = LoggerFactory.getLogger(BuildDriversPass.class);

    public BuildDriversPass() {
        super("build-drivers", CompilationStage.DRIVERS_BUILT,
                CompilationStage.HARDWARE_CONFIG, CompilationStage.INVENTORY_BOUND);
    }

    @Override
    public void apply(CompilationContext context) throws SimFarmException {
        Set<HardwareConfig> configs = Collections.newSetFromMap(new IdentityHashMap<>());
        for (MachineNode machine : context.getGraph().dfsOrderMachines()) {
            configs.add(machine.getResolvedHardwareConfig());
        }
        for (HardwareConfig config : configs) {
            config.buildDriver(context.getArtifactBuilder());
        }
        logger.info("{} drivers ready", configs.size());
    }
}
