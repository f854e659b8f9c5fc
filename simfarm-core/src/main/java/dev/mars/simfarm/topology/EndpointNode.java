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

package dev.mars.simfarm.topology;

import dev.mars.simfarm.workload.JobDescriptor;

/**
 * An addressable leaf of the topology: a simulated machine, or a placeholder for
 * a machine that shares an accelerator slot with another one.
 */
public abstract sealed class EndpointNode extends TopologyNode permits MachineNode, GroupPlaceholder {

    private MacAddress address;
    private JobDescriptor job;
    private final RuntimeSettings settings = new RuntimeSettings();

    public MacAddress getAddress() {
        return address;
    }

    public void assignAddress(MacAddress address) {
        this.address = address;
    }

    public JobDescriptor getJob() {
        return job;
    }

    public void assignJob(JobDescriptor job) {
        this.job = job;
    }

    /**
     * Per-endpoint runtime parameters. Fields left {@code null} are filled with the
     * run defaults during compilation.
     */
    public RuntimeSettings getSettings() {
        return settings;
    }

    /**
     * The machine that owns the accelerator slot this endpoint runs in.
     */
    public abstract MachineNode getPrimary();

    public String getJobName() {
        return job != null ? job.getName() : null;
    }
}
