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

import dev.mars.simfarm.controller.ControllerFixtures;
import dev.mars.simfarm.controller.FakeHostAgent;
import dev.mars.simfarm.controller.agent.HostAgent;
import dev.mars.simfarm.controller.agent.MonitorRequest;
import dev.mars.simfarm.controller.dispatch.FleetDispatcher;
import dev.mars.simfarm.core.exceptions.DispatchException;
import dev.mars.simfarm.core.exceptions.SimFarmException;
import dev.mars.simfarm.inventory.HostSlot;
import dev.mars.simfarm.workload.Workload;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
@DisplayName("Job monitor")
class JobMonitorTest {

    @TempDir
    Path tempDir;

    private FleetDispatcher dispatcher;
    private Workload workload;
    private FakeHostAgent first;
    private FakeHostAgent second;
    private final AtomicInteger teardowns = new AtomicInteger();

    @BeforeEach
    void setUp(Vertx vertx) {
        dispatcher = new FleetDispatcher(vertx, 2);
        workload = ControllerFixtures.workload(tempDir.resolve("results"));
        first = new FakeHostAgent(HostSlot.accelerator("f1-0", 2));
        second = new FakeHostAgent(HostSlot.accelerator("f1-1", 1));
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    private JobMonitor monitor(boolean networked, PostRunHook hook) {
        return new JobMonitor(dispatcher, List.<HostAgent>of(first, second), workload, networked, false,
                Duration.ZERO, teardowns::incrementAndGet, hook);
    }

    @Test
    void testNetworkedRunIsTornDownOnFirstCompletion() throws SimFarmException {
        first.withJob("linux0", 2).withJob("linux1", -1);
        second.withJob("linux2", -1);
        JobMonitor monitor = monitor(true, new PostRunHook());

        MonitorResult result = monitor.run();

        assertEquals(MonitorState.DONE, result.getState());
        assertEquals(MonitorState.DONE, monitor.getState());
        assertTrue(result.isTornDown());
        assertEquals(1, teardowns.get());
        assertEquals(2, result.getTicks());
        assertTrue(result.allJobsCompleted());
        assertEquals(0, result.exitCode());

        List<MonitorRequest> requests = first.getMonitorRequests();
        assertEquals(3, requests.size());
        assertFalse(requests.get(1).teardown());
        assertTrue(requests.get(2).teardown());
        assertTrue(second.getMonitorRequests().get(2).teardown());
    }

    @Test
    void testNonNetworkedRunWaitsForEveryJob() throws SimFarmException {
        first.withJob("linux0", 1).withJob("linux1", 3);
        second.withJob("linux2", 2);

        MonitorResult result = monitor(false, new PostRunHook()).run();

        assertEquals(MonitorState.DONE, result.getState());
        assertFalse(result.isTornDown());
        assertEquals(0, teardowns.get());
        assertEquals(3, result.getTicks());
        assertEquals(Set.of("linux0", "linux1", "linux2"), result.getSimulations().keySet());
        assertTrue(first.getMonitorRequests().stream().noneMatch(MonitorRequest::teardown));
        assertNull(result.getHookExitCode());
    }

    @Test
    @DisplayName("A host that shut down early does not stop a non-networked run")
    void testEarlyTerminatedHostDoesNotStopTheRun() throws SimFarmException {
        first.withJob("linux0", 1).withJob("linux1", 1).selfTerminating();
        second.withJob("linux2", 3).selfTerminating();
        JobMonitor monitor = new JobMonitor(dispatcher, List.<HostAgent>of(first, second), workload, false, true,
                Duration.ZERO, teardowns::incrementAndGet, new PostRunHook());

        MonitorResult result = monitor.run();

        assertEquals(MonitorState.DONE, result.getState());
        assertEquals(3, result.getTicks());
        assertTrue(result.allJobsCompleted());
        assertEquals(0, result.exitCode());
        assertFalse(result.isTornDown());
        assertTrue(first.isShutDown());
        assertTrue(second.isShutDown());
        assertEquals(3, first.getMonitorRequests().size());
        assertEquals(Set.of("linux0", "linux1"), first.getMonitorRequests().get(2).completedJobs());
        assertTrue(first.getMonitorRequests().stream().allMatch(MonitorRequest::terminateOnCompletion));
    }

    @Test
    void testCollectedResultsAreReportedAsCompleted() throws SimFarmException, IOException {
        Files.createDirectories(workload.getResultsDir().resolve("linux2"));
        first.withJob("linux0", 1);
        second.withJob("linux2", -1);

        MonitorResult result = monitor(false, new PostRunHook()).run();

        assertEquals(1, result.getTicks());
        assertEquals(Set.of("linux2"), second.getMonitorRequests().get(0).completedJobs());
        assertEquals(workload.getResultsDir(), second.getMonitorRequests().get(0).resultsDir());
        assertTrue(result.allJobsCompleted());
    }

    @Test
    void testHookExitCodeIsReturned() throws SimFarmException {
        first.withJob("linux0", 1);
        second.withJob("linux1", 1);
        List<Workload> hookRuns = new ArrayList<>();
        PostRunHook hook = new PostRunHook() {
            @Override
            public Integer run(Workload ran) {
                hookRuns.add(ran);
                return 7;
            }
        };

        MonitorResult result = monitor(false, hook).run();

        assertEquals(7, result.getHookExitCode());
        assertEquals(List.of(workload), hookRuns);
    }

    @Test
    void testHostFailureStopsTheMonitor() {
        first.withJob("linux0", -1);
        second.withJob("linux1", -1)
                .failOn("monitorJobs", FakeHostAgent.failure("monitorJobs", "f1-1"));
        JobMonitor monitor = monitor(true, new PostRunHook());

        DispatchException e = assertThrows(DispatchException.class, monitor::run);

        assertEquals("f1-1", e.getHostId());
        assertEquals(MonitorState.RUNNING, monitor.getState());
        assertEquals(0, teardowns.get());
    }

    @Test
    void testTeardownFailureLeavesTheMonitorTearingDown() {
        first.withJob("linux0", 1);
        second.withJob("linux1", -1);
        JobMonitor monitor = new JobMonitor(dispatcher, List.<HostAgent>of(first, second), workload, true, false,
                Duration.ZERO, () -> {
                    throw FakeHostAgent.failure("killSimulations", "f1-0");
                }, new PostRunHook());

        assertThrows(DispatchException.class, monitor::run);
        assertEquals(MonitorState.TEARDOWN_REQUESTED, monitor.getState());
    }

    @Test
    void testMissingResultsDirectoryHasNoCompletedJobs() throws SimFarmException {
        assertEquals(Set.of(), JobMonitor.listCompletedJobs(tempDir.resolve("absent")));
    }
}
