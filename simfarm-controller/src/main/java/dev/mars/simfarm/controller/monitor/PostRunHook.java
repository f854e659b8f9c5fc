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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Runs a workload's post-run hook on the local machine as
 * {@code cd <input dir> && <hook> <results dir>}. Failures are logged and reported
 * through the return value; they never fail the run.
 */
public class PostRunHook {

    private static final Logger logger = LoggerFactory.getLogger(PostRunHook.class);

    /**
     * @return the hook's exit code, or null when the workload has no hook or the hook
     *         could not be run
     */
    public Integer run(Workload workload) {
        String hook = workload.getPostRunHook();
        if (hook == null || hook.isBlank()) {
            return null;
        }
        String command = String.format("cd %s && %s %s", workload.getInputBaseDir(), hook,
                workload.getResultsDir().toAbsolutePath());
        logger.info("Running post-run hook: {}", command);
        try {
            Process process = new ProcessBuilder("sh", "-c", command).redirectErrorStream(true).start();
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            try (InputStream input = process.getInputStream()) {
                input.transferTo(output);
            }
            int exitCode = process.waitFor();
            logger.debug("[localhost] {}", output.toString(StandardCharsets.UTF_8));
            if (exitCode != 0) {
                logger.warn("Post-run hook exited with {}", exitCode);
            }
            return exitCode;
        } catch (IOException e) {
            logger.warn("Post-run hook could not be run: {}", e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for the post-run hook");
            return null;
        }
    }
}
