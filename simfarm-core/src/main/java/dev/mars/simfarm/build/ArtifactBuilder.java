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

package dev.mars.simfarm.build;

import dev.mars.simfarm.core.exceptions.SimFarmException;
import dev.mars.simfarm.hwconfig.HardwareConfig;
import dev.mars.simfarm.topology.SwitchNode;

import java.nio.file.Path;

/**
 * Builds the host-side binaries a deployment needs. The real build systems live
 * outside this project; implementations shell out to them or, in tests, record calls.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public interface ArtifactBuilder {

    /**
     * Builds the simulation driver for a hardware configuration.
     *
     * @return directory holding the built driver
     */
    Path buildDriver(HardwareConfig config) throws SimFarmException;

    /**
     * Builds the switch model binary from its generated configuration source.
     *
     * @return path of the built switch binary
     */
    Path buildSwitch(SwitchNode switchNode, String configSource) throws SimFarmException;
}
