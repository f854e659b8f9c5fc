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
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkloadTest {

    @Test
    void testUniformWorkloadNamesJobsByIndex() throws WorkloadException {
        Workload workload = Workload.builder("linux-uniform")
                .uniform("br-base-bin", List.of("br-base.img"), List.of("/etc/os-release"))
                .build();

        JobDescriptor job = workload.getJob(5);

        assertTrue(workload.isUniform());
        assertEquals("linux-uniform5", job.getName());
        assertEquals("br-base-bin", job.getBootBinary());
        assertEquals(List.of("/etc/os-release"), job.getOutputFiles());
        assertEquals(Path.of("results-workload", "linux-uniform"), workload.getResultsDir());
    }

    @Test
    void testExplicitWorkloadIndexesJobs() throws WorkloadException {
        JobDescriptor server = new JobDescriptor("mc-server", "server-bin", List.of(), List.of());
        JobDescriptor client = new JobDescriptor("mc-client", "client-bin", List.of(), List.of());
        Workload workload = Workload.builder("memcached").jobs(List.of(server, client)).build();

        assertFalse(workload.isUniform());
        assertSame(server, workload.getJob(0));
        assertSame(client, workload.getJob(1));
        assertThrows(WorkloadException.class, () -> workload.getJob(2));
        assertThrows(WorkloadException.class, () -> workload.getJob(-1));
    }

    @Test
    void testUniformAndExplicitAreExclusive() {
        JobDescriptor job = new JobDescriptor("j", "bin", List.of(), List.of());

        assertThrows(IllegalStateException.class,
                () -> Workload.builder("w").uniform("bin", List.of(), List.of()).job(job).build());
        assertThrows(IllegalStateException.class, () -> Workload.builder("w").build());
    }

    @Test
    void testCopyOnWriteImages() {
        JobDescriptor job = new JobDescriptor("j", "bin",
                List.of("rootfs.img", "scratch.qcow2", "data.qcow2"), null);

        assertEquals(List.of("scratch.qcow2", "data.qcow2"), job.getCopyOnWriteImages());
        assertEquals(List.of(), job.getOutputFiles());
        assertEquals(new JobDescriptor("j", "bin", List.of("rootfs.img", "scratch.qcow2", "data.qcow2"), List.of()), job);
    }
}
