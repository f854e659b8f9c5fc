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

package dev.mars.simfarm.controller.dispatch;

import dev.mars.simfarm.controller.agent.HostAgent;
import dev.mars.simfarm.core.exceptions.DispatchException;
import dev.mars.simfarm.core.exceptions.SimFarmException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one operation on many hosts at once.
 *
 * <p>Each host gets its own blocking task on a shared Vert.x worker pool; tasks run
 * in no particular order. On success the caller blocks until every task has finished
 * and gets the results keyed by host id in the order the agents were given. The first
 * failure fails the whole batch and returns at once: tasks that had not started by
 * then are skipped, and tasks already running finish but their results are discarded.
 * Must not be called from an event loop thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class FleetDispatcher implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FleetDispatcher.class);

    private final WorkerExecutor workerExecutor;

    public FleetDispatcher(Vertx vertx, int poolSize) {
        Objects.requireNonNull(vertx, "Vertx cannot be null");
        if (poolSize < 1) {
            throw new IllegalArgumentException("Dispatcher pool size must be positive: " + poolSize);
        }
        this.workerExecutor = vertx.createSharedWorkerExecutor("simfarm-dispatch", poolSize);
    }

    public <T> Map<String, T> dispatch(String operation, List<HostAgent> agents, HostTask<T> task)
            throws SimFarmException {
        logger.info("Dispatching {} to {} hosts", operation, agents.size());
        AtomicReference<SimFarmException> firstFailure = new AtomicReference<>();
        List<Future<T>> futures = new ArrayList<>(agents.size());
        for (HostAgent agent : agents) {
            String hostId = agent.getHost().getHostId();
            futures.add(workerExecutor.executeBlocking(() -> {
                if (firstFailure.get() != null) {
                    throw new DispatchException(operation, hostId, "skipped after an earlier failure");
                }
                try {
                    return task.execute(agent);
                } catch (SimFarmException e) {
                    firstFailure.compareAndSet(null, e);
                    throw e;
                } catch (RuntimeException e) {
                    DispatchException wrapped = new DispatchException(operation, hostId, e);
                    firstFailure.compareAndSet(null, wrapped);
                    throw wrapped;
                }
            }, false));
        }

        try {
            Future.all(futures).toCompletionStage().toCompletableFuture().get();
        } catch (ExecutionException e) {
            SimFarmException failure = firstFailure.get();
            if (failure != null) {
                logger.error("{} failed: {}", operation, failure.getMessage());
                throw failure;
            }
            throw new DispatchException(operation, "*", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            firstFailure.compareAndSet(null, new DispatchException(operation, "*", e));
            throw new DispatchException(operation, "*", e);
        }

        Map<String, T> results = new LinkedHashMap<>();
        for (int i = 0; i < agents.size(); i++) {
            results.put(agents.get(i).getHost().getHostId(), futures.get(i).result());
        }
        logger.debug("{} completed on {} hosts", operation, results.size());
        return results;
    }

    /**
     * Dispatches an operation with no per-host result.
     */
    public void run(String operation, List<HostAgent> agents, HostAction action) throws SimFarmException {
        dispatch(operation, agents, agent -> {
            action.execute(agent);
            return null;
        });
    }

    @Override
    public void close() {
        workerExecutor.close();
    }

    /**
     * Host work with no result.
     */
    @FunctionalInterface
    public interface HostAction {
        void execute(HostAgent agent) throws SimFarmException;
    }
}
