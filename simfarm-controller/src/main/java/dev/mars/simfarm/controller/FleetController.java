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

package dev.mars.simfarm.controller;

import dev.mars.simfarm.compiler.DeploymentPlan;
import dev.mars.simfarm.config.SimFarmConfiguration;
import dev.mars.simfarm.controller.agent.HostAgent;
import dev.mars.simfarm.controller.agent.HostAgentFactory;
import dev.mars.simfarm.controller.dispatch.FleetDispatcher;
import dev.mars.simfarm.controller.monitor.JobMonitor;
import dev.mars.simfarm.controller.monitor.MonitorResult;
import dev.mars.simfarm.controller.monitor.PostRunHook;
import dev.mars.simfarm.core.exceptions.SimFarmException;
import dev.mars.simfarm.core.exceptions.WorkloadException;
import dev.mars.simfarm.inventory.HostSlot;
import dev.mars.simfarm.inventory.InventoryProvider;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drives a compiled deployment plan through its fleet: setup, boot, monitored runs
 * and teardown.
 *
 * <p>Every operation first binds the plan's inventory with the requested mock-or-real
 * choice; binding happens once per run, so later operations reuse it. Every host is
 * checked for liveness before setup, boot and kill work is dispatched.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class FleetController implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FleetController.class);

    private final DeploymentPlan plan;
    private final InventoryProvider inventoryProvider;
    private final SimFarmConfiguration configuration;
    private final FleetDispatcher dispatcher;
    private final PostRunHook postRunHook;
    private final List<HostAgent> agents;

    public FleetController(Vertx vertx, DeploymentPlan plan, InventoryProvider inventoryProvider,
                           HostAgentFactory agentFactory, SimFarmConfiguration configuration) {
        this(plan, inventoryProvider, agentFactory, configuration,
                new FleetDispatcher(vertx, configuration.getDispatchPoolSize()), new PostRunHook());
    }

    FleetController(DeploymentPlan plan, InventoryProvider inventoryProvider, HostAgentFactory agentFactory,
                    SimFarmConfiguration configuration, FleetDispatcher dispatcher, PostRunHook postRunHook) {
        this.plan = Objects.requireNonNull(plan, "Deployment plan cannot be null");
        this.inventoryProvider = Objects.requireNonNull(inventoryProvider, "Inventory provider cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.dispatcher = dispatcher;
        this.postRunHook = postRunHook;
        List<HostAgent> created = new ArrayList<>();
        for (HostSlot host : plan.getHosts()) {
            created.add(agentFactory.create(host));
        }
        this.agents = List.copyOf(created);
    }

    /**
     * Builds drivers and switches, then installs them on every host.
     */
    public void infrasetup(boolean useMock) throws SimFarmException {
        plan.bind(inventoryProvider, useMock);
        plan.buildArtifacts();
        checkLiveness();
        dispatcher.run("infrasetup", agents, HostAgent::infrasetup);
        logger.info("Infrastructure set up on {} hosts", agents.size());
    }

    /**
     * Starts all switches, then all simulations.
     */
    public void boot(boolean useMock) throws SimFarmException {
        plan.bind(inventoryProvider, useMock);
        checkLiveness();
        dispatcher.run("bootSwitches", agents, HostAgent::startSwitches);
        dispatcher.run("bootSimulations", agents, HostAgent::startSimulations);
    }

    /**
     * Kills all switches, then all simulations, and waits until every host reports no
     * sessions left.
     *
     * @param releaseBlockDevices also disconnect network block devices
     */
    public void kill(boolean useMock, boolean releaseBlockDevices) throws SimFarmException {
        plan.bind(inventoryProvider, useMock);
        checkLiveness();
        dispatcher.run("killSwitches", agents, HostAgent::killSwitches);
        dispatcher.run("killSimulations", agents, agent -> agent.killSimulations(releaseBlockDevices));
        dispatcher.run("confirmExit", agents, HostAgent::confirmExit);
        logger.info("Simulation killed on {} hosts", agents.size());
    }

    /**
     * Boots the workload and monitors it until it finishes.
     */
    public MonitorResult runWorkload(boolean useMock) throws SimFarmException {
        plan.bind(inventoryProvider, useMock);
        Path resultsDir = plan.getWorkload().getResultsDir();
        logger.info("Creating the directory: {}", resultsDir);
        try {
            Files.createDirectories(resultsDir);
        } catch (IOException e) {
            throw new WorkloadException("Cannot create results directory " + resultsDir, e);
        }

        boot(useMock);

        JobMonitor monitor = new JobMonitor(dispatcher, agents, plan.getWorkload(), plan.isNetworked(),
                configuration.isTerminateOnCompletion(),
                Duration.ofMillis(configuration.getMonitorIntervalMs()),
                () -> kill(useMock, false),
                postRunHook);
        MonitorResult result = monitor.run();
        logger.info("Run finished: {}", result);
        return result;
    }

    public List<HostAgent> getAgents() {
        return agents;
    }

    private void checkLiveness() throws SimFarmException {
        dispatcher.run("checkLiveness", agents, HostAgent::checkLiveness);
    }

    @Override
    public void close() {
        dispatcher.close();
    }
}
