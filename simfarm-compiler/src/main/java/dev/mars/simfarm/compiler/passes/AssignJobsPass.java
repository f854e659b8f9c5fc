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
import dev.mars.simfarm.core.exceptions.WorkloadException;
import dev.mars.simfarm.topology.EndpointNode;

import java.util.List;

/**
 * Binds endpoint {@code i} in DFS order to job {@code i} of the workload.
 */
public class AssignJobsPass extends AbstractPass {

    public AssignJobsPass() {
        super("assign-jobs", CompilationStage.JOBS_ASSIGNED);
    }

    @Override
    public void apply(CompilationContext context) throws WorkloadException {
        List<EndpointNode> endpoints = context.getGraph().dfsOrderEndpoints();
        for (int i = 0; i < endpoints.size(); i++) {
            endpoints.get(i).assignJob(context.getWorkload().getJob(i));
        }
    }
}
