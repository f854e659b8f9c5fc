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

package dev.mars.simfarm.compiler.mapping;

import dev.mars.simfarm.core.exceptions.TopologyShapeException;
import dev.mars.simfarm.topology.GroupPlaceholder;
import dev.mars.simfarm.topology.MachineNode;
import dev.mars.simfarm.topology.SwitchNode;
import dev.mars.simfarm.topology.TopologyNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies the downlinks of a switch for the networked strategies. Placeholders
 * travel with their primary machine and are ignored here.
 */
final class MappingSupport {

    enum DownlinkKind { SWITCHES, MACHINES }

    private MappingSupport() {
    }

    static List<TopologyNode> mappableDownlinks(SwitchNode switchNode) {
        List<TopologyNode> result = new ArrayList<>();
        for (TopologyNode child : switchNode.getDownlinks()) {
            if (!(child instanceof GroupPlaceholder)) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * A switch with no mappable downlinks counts as a switch of switches.
     *
     * @throws TopologyShapeException when switches and machines are mixed
     */
    static DownlinkKind classify(SwitchNode switchNode, List<TopologyNode> downlinks) throws TopologyShapeException {
        boolean allSwitches = downlinks.stream().allMatch(child -> child instanceof SwitchNode);
        if (allSwitches) {
            return DownlinkKind.SWITCHES;
        }
        boolean allMachines = downlinks.stream().allMatch(child -> child instanceof MachineNode);
        if (allMachines) {
            return DownlinkKind.MACHINES;
        }
        throw new TopologyShapeException(switchNode.getId(),
                "switch mixes switch and machine downlinks, which this mapping strategy does not support");
    }

    static List<MachineNode> asMachines(List<TopologyNode> downlinks) {
        List<MachineNode> machines = new ArrayList<>(downlinks.size());
        for (TopologyNode node : downlinks) {
            machines.add((MachineNode) node);
        }
        return machines;
    }
}
