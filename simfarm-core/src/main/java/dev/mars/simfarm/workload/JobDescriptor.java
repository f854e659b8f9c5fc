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

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One job to run on one simulated machine: what it boots, which disk images it
 * attaches and which files are collected from the simulation directory afterwards.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class JobDescriptor {

    private static final String COPY_ON_WRITE_SUFFIX = ".qcow2";

    private final String name;
    private final String bootBinary;
    private final List<String> diskImages;
    private final List<String> outputFiles;

    public JobDescriptor(String name, String bootBinary, List<String> diskImages, List<String> outputFiles) {
        this.name = Objects.requireNonNull(name, "Job name cannot be null");
        this.bootBinary = Objects.requireNonNull(bootBinary, "Boot binary cannot be null for job " + name);
        this.diskImages = diskImages == null ? List.of() : List.copyOf(diskImages);
        this.outputFiles = outputFiles == null ? List.of() : List.copyOf(outputFiles);
    }

    public String getName() {
        return name;
    }

    public String getBootBinary() {
        return bootBinary;
    }

    public List<String> getDiskImages() {
        return diskImages;
    }

    /**
     * Disk images that are served through a network block device on the host.
     */
    public List<String> getCopyOnWriteImages() {
        return diskImages.stream()
                .filter(image -> image.endsWith(COPY_ON_WRITE_SUFFIX))
                .collect(Collectors.toList());
    }

    public List<String> getOutputFiles() {
        return outputFiles;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobDescriptor)) return false;
        JobDescriptor that = (JobDescriptor) o;
        return name.equals(that.name) && bootBinary.equals(that.bootBinary)
                && diskImages.equals(that.diskImages) && outputFiles.equals(that.outputFiles);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, bootBinary, diskImages, outputFiles);
    }

    @Override
    public String toString() {
        return "JobDescriptor{name='" + name + "', bootBinary='" + bootBinary + "', diskImages=" + diskImages + '}';
    }
}
