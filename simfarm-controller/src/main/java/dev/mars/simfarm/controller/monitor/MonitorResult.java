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

package dev.mars.simfarm.controller.monitor;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a monitored workload run.
 */
public final class MonitorResult {

    private final MonitorState state;
    private final Map<String, Boolean> simulations;
    private final int ticks;
    private final boolean tornDown;
    private final Integer hookExitCode;
    private final Path resultsDir;

    public MonitorResult(MonitorState state, Map<String, Boolean> simulations, int ticks, boolean tornDown,
                         Integer hookExitCode, Path resultsDir) {
        this.state = state;
        this.simulations = Collections.unmodifiableMap(new LinkedHashMap<>(simulations));
        this.ticks = ticks;
        this.tornDown = tornDown;
        this.hookExitCode = hookExitCode;
        this.resultsDir = resultsDir;
    }

    public MonitorState getState() {
        return state;
    }

    /**
     * Job name to completion flag, as reported by the final poll.
     */
    public Map<String, Boolean> getSimulations() {
        return simulations;
    }

    public int getTicks() {
        return ticks;
    }

    public boolean isTornDown() {
        return tornDown;
    }

    /**
     * Exit code of the post-run hook, or null when there was no hook or it could not start.
     */
    public Integer getHookExitCode() {
        return hookExitCode;
    }

    public Path getResultsDir() {
        return resultsDir;
    }

    public boolean allJobsCompleted() {
        return simulations.values().stream().allMatch(Boolean::booleanValue);
    }

    /**
     * 0 when every simulation reported complete in the final poll, 1 otherwise.
     */
    public int exitCode() {
        return allJobsCompleted() ? 0 : 1;
    }

    @Override
    public String toString() {
        return "MonitorResult{state=" + state + ", jobs=" + simulations.size()
                + ", allCompleted=" + allJobsCompleted() + ", ticks=" + ticks + '}';
    }
}
