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

/**
 * Lifecycle of a workload monitor run.
 *
 * RUNNING -> DONE when every job of a non-networked topology has completed.
 * RUNNING -> TEARDOWN_REQUESTED -> DONE when a networked topology has to be killed
 * as a whole after its first job completes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public enum MonitorState {

    /**
     * Polling hosts on every tick.
     */
    RUNNING("Polling hosts", false),

    /**
     * Switches and simulations are being killed; one final poll collects results.
     */
    TEARDOWN_REQUESTED("Tearing down simulation", false),

    /**
     * The run is over. This is a terminal state.
     */
    DONE("Run finished", true);

    private final String description;
    private final boolean terminal;

    MonitorState(String description, boolean terminal) {
        this.description = description;
        this.terminal = terminal;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean canTransitionTo(MonitorState target) {
        switch (this) {
            case RUNNING:
                return target == TEARDOWN_REQUESTED || target == DONE;
            case TEARDOWN_REQUESTED:
                return target == DONE;
            default:
                return false;
        }
    }

    public MonitorState[] getValidTransitions() {
        switch (this) {
            case RUNNING:
                return new MonitorState[]{TEARDOWN_REQUESTED, DONE};
            case TEARDOWN_REQUESTED:
                return new MonitorState[]{DONE};
            default:
                return new MonitorState[0];
        }
    }
}
