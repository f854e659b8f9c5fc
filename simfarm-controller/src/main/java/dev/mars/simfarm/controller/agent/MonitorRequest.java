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

import java.nio.file.Path;
import java.util.Collection;
import java.util.Set;

/**
 * Arguments of one monitor poll sent to every host.
 *
 * @param completedJobs         jobs whose results are already on the local machine
 * @param teardown              the simulation has been killed; collect everything left
 * @param terminateOnCompletion hosts shut down once their work is done
 * @param resultsDir            local directory results are copied into
 */
public record MonitorRequest(Set<String> completedJobs, boolean teardown, boolean terminateOnCompletion,
                             Path resultsDir) {

    public MonitorRequest {
        completedJobs = Set.copyOf(completedJobs);
    }

    /**
     * Whether the given jobs' results are all on the local machine already, so their
     * host has nothing left to report. Never true on teardown.
     */
    public boolean alreadyCollected(Collection<String> jobNames) {
        return !teardown && !jobNames.isEmpty() && completedJobs.containsAll(jobNames);
    }
}
