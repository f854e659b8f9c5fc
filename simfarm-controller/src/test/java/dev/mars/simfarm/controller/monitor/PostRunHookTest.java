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

import dev.mars.simfarm.workload.Workload;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class PostRunHookTest {

    @TempDir
    Path tempDir;

    private final PostRunHook hook = new PostRunHook();

    private Workload workload(String postRunHook) {
        return Workload.builder("linux")
                .uniform("linux-bin", List.of(), List.of())
                .inputBaseDir(tempDir)
                .resultsDir(tempDir.resolve("results"))
                .postRunHook(postRunHook)
                .build();
    }

    @Test
    void testNoHook() {
        assertNull(hook.run(workload(null)));
        assertNull(hook.run(workload("  ")));
    }

    @Test
    void testExitCodeIsReturned() {
        assertEquals(0, hook.run(workload("true")));
        assertEquals(3, hook.run(workload("sh -c 'exit 3'")));
    }

    @Test
    void testRunsInInputDirectoryWithResultsArgument() throws IOException {
        Integer exitCode = hook.run(workload("sh -c 'echo \"$0\" > hook-ran.txt'"));

        assertEquals(0, exitCode);
        Path marker = tempDir.resolve("hook-ran.txt");
        assertTrue(Files.exists(marker));
        assertEquals(tempDir.resolve("results").toAbsolutePath().toString(), Files.readString(marker).trim());
    }
}
