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

import dev.mars.simfarm.controller.agent.HostAgent;
import dev.mars.simfarm.controller.agent.HostStatus;
import dev.mars.simfarm.controller.agent.MonitorRequest;
import dev.mars.simfarm.controller.dispatch.FleetDispatcher;
import dev.mars.simfarm.core.exceptions.DispatchException;
import dev.mars.simfarm.core.exceptions.InvalidTransitionException;
import dev.mars.simfarm.core.exceptions.SimFarmException;
import dev.mars.simfarm.core.exceptions.WorkloadException;
import dev.mars.simfarm.workload.Workload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Polls the fleet until a workload is finished.
 *
 * <p>Every tick lists the jobs whose results already sit in the local results
 * directory, asks every host for its status and logs the status report. A networked
 * topology is torn down as soon as any simulation completes, because its simulations
 * share one network and cannot make progress independently; one last poll with
 * teardown set collects the remaining results. A non-networked topology is done when
 * every simulation has completed. The post-run hook runs once the monitor is done.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class JobMonitor {

    private static final Logger logger = LoggerFactory.getLogger(JobMonitor.class);

    private final FleetDispatcher dispatcher;
    private final List<HostAgent> agents;
    private final Workload workload;
    private final boolean networked;
    private final boolean terminateOnCompletion;
    private final Duration interval;
    private final TeardownAction teardownAction;
    private final PostRunHook postRunHook;
    private final StatusReport statusReport = new StatusReport();

    private MonitorState state = MonitorState.RUNNING;

    public JobMonitor(FleetDispatcher dispatcher, List<HostAgent> agents, Workload workload, boolean networked,
                      boolean terminateOnCompletion, Duration interval, TeardownAction teardownAction,
                      PostRunHook postRunHook) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "Dispatcher cannot be null");
        this.agents = List.copyOf(agents);
        this.workload = Objects.requireNonNull(workload, "Workload cannot be null");
        this.networked = networked;
        this.terminateOnCompletion = terminateOnCompletion;
        this.interval = Objects.requireNonNull(interval, "Monitor interval cannot be null");
        this.teardownAction = Objects.requireNonNull(teardownAction, "Teardown action cannot be null");
        this.postRunHook = Objects.requireNonNull(postRunHook, "Post-run hook cannot be null");
    }

    public MonitorResult run() throws SimFarmException {
        Path resultsDir = workload.getResultsDir();
        int ticks = 0;
        boolean tornDown = false;
        Map<String, Boolean> simulations;

        while (true) {
            ticks++;
            Map<String, HostStatus> statuses = poll(listCompletedJobs(resultsDir), false);
            statusReport.log(statuses, terminateOnCompletion, resultsDir);
            simulations = aggregate(statuses);
            logger.debug("Jobs complete: {}", simulations);

            if (networked && simulations.containsValue(Boolean.TRUE)) {
                logger.info("Teardown required, tearing down the simulation");
                transitionTo(MonitorState.TEARDOWN_REQUESTED);
                teardownAction.teardown();
                tornDown = true;
                simulations = aggregate(poll(listCompletedJobs(resultsDir), true));
                transitionTo(MonitorState.DONE);
                break;
            }
            if (!networked && !simulations.containsValue(Boolean.FALSE)) {
                transitionTo(MonitorState.DONE);
                break;
            }
            sleep();
        }

        Integer hookExitCode = postRunHook.run(workload);
        MonitorResult result = new MonitorResult(state, simulations, ticks, tornDown, hookExitCode, resultsDir);
        if (result.allJobsCompleted()) {
            logger.info("Workload {} finished, all jobs completed. Results in {}", workload.getName(), resultsDir);
        } else {
            logger.warn("Workload {} finished, not all jobs completed. Results in {}", workload.getName(), resultsDir);
        }
        return result;
    }

    public MonitorState getState() {
        return state;
    }

    private Map<String, HostStatus> poll(Set<String> completedJobs, boolean teardown) throws SimFarmException {
        MonitorRequest request = new MonitorRequest(completedJobs, teardown, terminateOnCompletion,
                workload.getResultsDir());
        return dispatcher.dispatch("monitorJobs", agents, agent -> agent.monitorJobs(request));
    }

    private static Map<String, Boolean> aggregate(Map<String, HostStatus> statuses) {
        Map<String, Boolean> simulations = new LinkedHashMap<>();
        for (HostStatus status : statuses.values()) {
            simulations.putAll(status.simulations());
        }
        return simulations;
    }

    static Set<String> listCompletedJobs(Path resultsDir) throws WorkloadException {
        if (!Files.isDirectory(resultsDir)) {
            return Set.of();
        }
        try (Stream<Path> entries = Files.list(resultsDir)) {
            return entries.map(path -> path.getFileName().toString()).collect(Collectors.toSet());
        } catch (IOException e) {
            throw new WorkloadException("Cannot list results directory " + resultsDir, e);
        }
    }

    private void transitionTo(MonitorState target) throws InvalidTransitionException {
        if (!state.canTransitionTo(target)) {
            throw new InvalidTransitionException(state, target, state.getValidTransitions());
        }
        logger.debug("Monitor {} -> {}", state, target);
        state = target;
    }

    private void sleep() throws DispatchException {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("monitorJobs", "*", e);
        }
    }
}
