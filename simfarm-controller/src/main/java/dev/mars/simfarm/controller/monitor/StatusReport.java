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

import dev.mars.simfarm.controller.agent.HostStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

/**
 * Formats the per-tick status table: hosts, switches, simulations and a summary.
 */
public class StatusReport {

    private static final Logger logger = LoggerFactory.getLogger(StatusReport.class);
    private static final String RULE = "-".repeat(80);

    public void log(Map<String, HostStatus> statuses, boolean terminateOnCompletion, Path resultsDir) {
        for (String line : render(statuses, terminateOnCompletion, resultsDir, Instant.now()).split("\n")) {
            logger.info(line);
        }
    }

    public String render(Map<String, HostStatus> statuses, boolean terminateOnCompletion, Path resultsDir,
                         Instant now) {
        StringBuilder out = new StringBuilder();
        line(out, "Simulation status @ " + now);
        line(out, RULE);
        line(out, "Results directory: " + resultsDir);
        line(out, RULE);
        line(out, "Hosts");
        line(out, RULE);
        int runningHosts = 0;
        for (HostStatus status : statuses.values()) {
            boolean terminated = terminateOnCompletion && status.terminated();
            if (!terminated) {
                runningHosts++;
            }
            line(out, String.format("Host: %15s | Terminated: %s", status.hostId(), terminated));
        }
        line(out, RULE);
        line(out, "Switches");
        line(out, RULE);
        for (HostStatus status : statuses.values()) {
            for (Map.Entry<String, Boolean> entry : status.switches().entrySet()) {
                line(out, String.format("Host: %15s | Switch: %s | Running: %s",
                        status.hostId(), entry.getKey(), !entry.getValue()));
            }
        }
        line(out, RULE);
        line(out, "Simulations");
        line(out, RULE);
        int totalSims = 0;
        int runningSims = 0;
        for (HostStatus status : statuses.values()) {
            for (Map.Entry<String, Boolean> entry : status.simulations().entrySet()) {
                totalSims++;
                if (!entry.getValue()) {
                    runningSims++;
                }
                line(out, String.format("Host: %15s | Job: %s | Running: %s",
                        status.hostId(), entry.getKey(), !entry.getValue()));
            }
        }
        line(out, RULE);
        line(out, "Summary");
        line(out, RULE);
        line(out, String.format("%d/%d hosts are still running.", runningHosts, statuses.size()));
        line(out, String.format("%d/%d simulations are still running.", runningSims, totalSims));
        line(out, RULE);
        return out.toString();
    }

    private static void line(StringBuilder out, String text) {
        out.append(text).append('\n');
    }
}
