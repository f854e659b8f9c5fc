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

package dev.mars.simfarm.controller.agent;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One host's answer to a monitor poll.
 *
 * @param hostId      host that answered
 * @param switches    switch id to "process has exited"
 * @param simulations job name to "job complete and results collected"
 * @param terminated  the host shut itself down after finishing its work
 */
public record HostStatus(String hostId, Map<String, Boolean> switches, Map<String, Boolean> simulations,
                         boolean terminated) {

    public HostStatus {
        switches = Collections.unmodifiableMap(new LinkedHashMap<>(switches));
        simulations = Collections.unmodifiableMap(new LinkedHashMap<>(simulations));
    }

    /**
     * Status of a host whose jobs have all been collected, answered without contacting it.
     */
    public static HostStatus collected(String hostId, Collection<String> jobNames, boolean terminated) {
        Map<String, Boolean> simulations = new LinkedHashMap<>();
        jobNames.forEach(jobName -> simulations.put(jobName, true));
        return new HostStatus(hostId, Map.of(), simulations, terminated);
    }

    public boolean allSimulationsComplete() {
        return simulations.values().stream().allMatch(Boolean::booleanValue);
    }

    public boolean anySimulationComplete() {
        return simulations.values().stream().anyMatch(Boolean::booleanValue);
    }
}
