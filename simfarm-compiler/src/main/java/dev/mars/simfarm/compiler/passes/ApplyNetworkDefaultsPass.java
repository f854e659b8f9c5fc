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
import dev.mars.simfarm.config.RuntimeDefaults;
import dev.mars.simfarm.topology.EndpointNode;
import dev.mars.simfarm.topology.SwitchNode;

/**
 * Fills every unset switch and endpoint parameter from the run defaults. Values set
 * in the topology are never overwritten.
 */
public class ApplyNetworkDefaultsPass extends AbstractPass {

    public ApplyNetworkDefaultsPass() {
        super("apply-network-defaults", CompilationStage.NETWORK_DEFAULTS);
    }

    @Override
    public void apply(CompilationContext context) {
        RuntimeDefaults defaults = context.getDefaults();
        for (SwitchNode switchNode : context.getGraph().dfsOrderSwitches()) {
            if (switchNode.getLinkLatency() == null) {
                switchNode.setLinkLatency(defaults.getSwitchLinkLatency());
            }
            if (switchNode.getSwitchingLatency() == null) {
                switchNode.setSwitchingLatency(defaults.getSwitchingLatency());
            }
            if (switchNode.getBandwidth() == null) {
                switchNode.setBandwidth(defaults.getSwitchBandwidth());
            }
        }
        for (EndpointNode endpoint : context.getGraph().dfsOrderEndpoints()) {
            endpoint.getSettings().fillUnset(defaults.getMachineSettings());
        }
    }
}
