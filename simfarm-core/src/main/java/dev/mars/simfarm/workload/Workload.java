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

package dev.mars.simfarm.workload;

import dev.mars.simfarm.core.exceptions.WorkloadException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The jobs of one run and where their results go.
 *
 * <p>A workload either lists its jobs explicitly, one per endpoint in topology order,
 * or is uniform: every endpoint runs the same boot binary and images under the
 * derived name {@code <name><index>}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class Workload {

    private final String name;
    private final List<JobDescriptor> jobs;
    private final JobDescriptor uniformTemplate;
    private final Path inputBaseDir;
    private final Path resultsDir;
    private final String postRunHook;

    private Workload(Builder builder) {
        this.name = builder.name;
        this.jobs = List.copyOf(builder.jobs);
        this.uniformTemplate = builder.uniformTemplate;
        this.inputBaseDir = builder.inputBaseDir;
        this.resultsDir = builder.resultsDir;
        this.postRunHook = builder.postRunHook;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public boolean isUniform() {
        return uniformTemplate != null;
    }

    public JobDescriptor getJob(int index) throws WorkloadException {
        if (index < 0) {
            throw new WorkloadException("Job index cannot be negative: " + index);
        }
        if (isUniform()) {
            return new JobDescriptor(name + index, uniformTemplate.getBootBinary(),
                    uniformTemplate.getDiskImages(), uniformTemplate.getOutputFiles());
        }
        if (index >= jobs.size()) {
            throw new WorkloadException("Workload '" + name + "' defines " + jobs.size()
                    + " jobs but job " + index + " was requested");
        }
        return jobs.get(index);
    }

    public List<JobDescriptor> getJobs() {
        return jobs;
    }

    public Path getInputBaseDir() {
        return inputBaseDir;
    }

    public Path getResultsDir() {
        return resultsDir;
    }

    /**
     * Command run locally after the workload finishes, or null.
     */
    public String getPostRunHook() {
        return postRunHook;
    }

    @Override
    public String toString() {
        return "Workload{name='" + name + "', " + (isUniform() ? "uniform" : jobs.size() + " jobs")
                + ", resultsDir=" + resultsDir + '}';
    }

    public static final class Builder {
        private final String name;
        private final List<JobDescriptor> jobs = new ArrayList<>();
        private JobDescriptor uniformTemplate;
        private Path inputBaseDir = Path.of(".");
        private Path resultsDir;
        private String postRunHook;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Workload name cannot be null");
        }

        public Builder job(JobDescriptor job) {
            jobs.add(Objects.requireNonNull(job, "Job cannot be null"));
            return this;
        }

        public Builder jobs(List<JobDescriptor> jobs) {
            jobs.forEach(this::job);
            return this;
        }

        public Builder uniform(String bootBinary, List<String> diskImages, List<String> outputFiles) {
            this.uniformTemplate = new JobDescriptor(name, bootBinary, diskImages, outputFiles);
            return this;
        }

        public Builder inputBaseDir(Path inputBaseDir) {
            this.inputBaseDir = Objects.requireNonNull(inputBaseDir, "Input directory cannot be null");
            return this;
        }

        public Builder resultsDir(Path resultsDir) {
            this.resultsDir = resultsDir;
            return this;
        }

        public Builder postRunHook(String postRunHook) {
            this.postRunHook = postRunHook;
            return this;
        }

        public Workload build() {
            if (uniformTemplate != null && !jobs.isEmpty()) {
                throw new IllegalStateException("Workload '" + name + "' is both uniform and explicit");
            }
            if (uniformTemplate == null && jobs.isEmpty()) {
                throw new IllegalStateException("Workload '" + name + "' defines no jobs");
            }
            if (resultsDir == null) {
                resultsDir = Path.of("results-workload", name);
            }
            return new Workload(this);
        }
    }
}
