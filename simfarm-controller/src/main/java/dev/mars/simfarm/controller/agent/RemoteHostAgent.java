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

package dev.mars.simfarm.controller.agent;

import dev.mars.simfarm.core.exceptions.DispatchException;
import dev.mars.simfarm.core.exceptions.HostUnreachableException;
import dev.mars.simfarm.core.exceptions.SimFarmException;
import dev.mars.simfarm.controller.exec.CommandResult;
import dev.mars.simfarm.controller.exec.RemoteExecutor;
import dev.mars.simfarm.hwconfig.HardwareConfig;
import dev.mars.simfarm.inventory.BlockDeviceTracker;
import dev.mars.simfarm.inventory.HostSlot;
import dev.mars.simfarm.topology.EndpointNode;
import dev.mars.simfarm.topology.MachineNode;
import dev.mars.simfarm.topology.SwitchNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Drives one host over a {@link RemoteExecutor}.
 *
 * <p>Accelerator slot {@code i} works in {@code sim_slot_i/} of the remote home
 * directory and runs in screen session {@code fsim<i>}; switch {@code j} of the host
 * works in {@code switch_slot_j/} and runs in a session named after the switch.
 * Console output goes to {@code uartlog} and {@code switchlog} in those directories.
 * Results of a job are copied into {@code <resultsDir>/<jobName>/}; the existence of
 * that directory is what marks the job complete on the next poll.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class RemoteHostAgent implements HostAgent {

    private static final Logger logger = LoggerFactory.getLogger(RemoteHostAgent.class);

    private final HostSlot host;
    private final RemoteExecutor executor;
    private final SimulationCommandBuilder commandBuilder = new SimulationCommandBuilder();
    private final Duration exitPollInterval;
    private final int exitPollAttempts;

    public RemoteHostAgent(HostSlot host, RemoteExecutor executor, Duration exitPollInterval, int exitPollAttempts) {
        this.host = Objects.requireNonNull(host, "Host cannot be null");
        this.executor = Objects.requireNonNull(executor, "Remote executor cannot be null");
        this.exitPollInterval = Objects.requireNonNull(exitPollInterval, "Poll interval cannot be null");
        this.exitPollAttempts = exitPollAttempts;
    }

    public static HostAgentFactory factory(RemoteExecutor executor, Duration exitPollInterval, int exitPollAttempts) {
        return host -> new RemoteHostAgent(host, executor, exitPollInterval, exitPollAttempts);
    }

    @Override
    public HostSlot getHost() {
        return host;
    }

    @Override
    public void checkLiveness() throws HostUnreachableException {
        try {
            CommandResult result = executor.run(host.getAddress(), "uname -a");
            if (!result.succeeded()) {
                throw new HostUnreachableException(host.getHostId(), "liveness probe exited with " + result.exitCode());
            }
            logger.debug("[{}] alive: {}", host.getHostId(), result.output().trim());
        } catch (IOException e) {
            throw new HostUnreachableException(host.getHostId(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HostUnreachableException(host.getHostId(), e);
        }
    }

    @Override
    public void infrasetup() throws SimFarmException {
        String operation = "infrasetup";
        List<MachineNode> machines = host.getMachines();
        boolean needsBlockDevices = machines.stream()
                .anyMatch(machine -> machine.getBlockDevices() != null && !machine.getBlockDevices().isEmpty());
        if (needsBlockDevices) {
            runChecked(operation, "sudo modprobe nbd max_part=4 nbds_max=" + BlockDeviceTracker.DEFAULT_MAX_DEVICES);
        }
        for (int slot = 0; slot < machines.size(); slot++) {
            MachineNode machine = machines.get(slot);
            HardwareConfig config = machine.getResolvedHardwareConfig();
            Path driverDirectory = config.getDriverDirectory();
            if (driverDirectory == null) {
                throw new DispatchException(operation, host.getHostId(),
                        "driver for hardware config " + config.getName() + " has not been built");
            }
            String slotDir = simSlotDir(slot);
            runChecked(operation, "mkdir -p " + slotDir);
            for (Path file : listFiles(operation, driverDirectory)) {
                upload(operation, file, slotDir + "/");
            }
            runChecked(operation, "sudo fpga-clear-local-image -S " + slot + " -A");
            runChecked(operation, "sudo fpga-load-local-image -S " + slot + " -I " + config.getImageId() + " -A");
            logger.info("[{}] slot {} flashed with {}", host.getHostId(), slot, config.getName());
        }
        List<SwitchNode> switches = host.getSwitches();
        for (int slot = 0; slot < switches.size(); slot++) {
            SwitchNode switchNode = switches.get(slot);
            if (switchNode.getBuiltBinary() == null) {
                throw new DispatchException(operation, host.getHostId(),
                        "switch " + switchNode.getId() + " has not been built");
            }
            runChecked(operation, "mkdir -p " + switchSlotDir(slot));
            upload(operation, switchNode.getBuiltBinary(), switchSlotDir(slot) + "/");
        }
    }

    @Override
    public void startSwitches() throws SimFarmException {
        List<SwitchNode> switches = host.getSwitches();
        for (int slot = 0; slot < switches.size(); slot++) {
            SwitchNode switchNode = switches.get(slot);
            String run = String.format("sudo ./%s %d %d %d", switchNode.getBuiltBinary().getFileName(),
                    switchNode.getLinkLatency(), switchNode.getSwitchingLatency(), switchNode.getBandwidth());
            runChecked("bootSwitches", String.format(
                    "cd %s && screen -S %s -d -m bash -c \"script -f -c '%s' switchlog\"; sleep 1",
                    switchSlotDir(slot), switchNode.getId(), run));
            logger.info("[{}] started {}", host.getHostId(), switchNode.getId());
        }
    }

    @Override
    public void startSimulations() throws SimFarmException {
        String operation = "bootSimulations";
        List<MachineNode> machines = host.getMachines();
        for (int slot = 0; slot < machines.size(); slot++) {
            MachineNode machine = machines.get(slot);
            String slotDir = simSlotDir(slot);
            List<String> devices = machine.getBlockDevices() == null ? List.of() : machine.getBlockDevices();
            int deviceIndex = 0;
            for (EndpointNode endpoint : machine.getSlotEndpoints()) {
                upload(operation, Path.of(endpoint.getJob().getBootBinary()), slotDir + "/");
                for (String image : endpoint.getJob().getDiskImages()) {
                    upload(operation, Path.of(image), slotDir + "/");
                }
                for (String image : endpoint.getJob().getCopyOnWriteImages()) {
                    runChecked(operation, "sudo qemu-nbd -c " + devices.get(deviceIndex++) + " "
                            + slotDir + "/" + SimulationCommandBuilder.fileName(image));
                }
            }
            String command = commandBuilder.build(machine, slot);
            runChecked(operation, String.format(
                    "cd %s && screen -S %s -d -m bash -c \"script -f -c '%s' uartlog\"; sleep 1",
                    slotDir, ScreenSessions.simulationSession(slot), command));
            logger.info("[{}] started slot {} ({})", host.getHostId(), slot, machine.getJobName());
        }
    }

    @Override
    public void killSwitches() throws SimFarmException {
        for (SwitchNode switchNode : host.getSwitches()) {
            run("killSwitches", "screen -X -S " + switchNode.getId() + " quit");
            if (switchNode.getBuiltBinary() != null) {
                run("killSwitches", "sudo pkill -SIGKILL -f " + switchNode.getBuiltBinary().getFileName());
            }
        }
    }

    @Override
    public void killSimulations(boolean releaseBlockDevices) throws SimFarmException {
        String operation = "killSimulations";
        List<MachineNode> machines = host.getMachines();
        for (int slot = 0; slot < machines.size(); slot++) {
            run(operation, "screen -X -S " + ScreenSessions.simulationSession(slot) + " quit");
            run(operation, "sudo pkill -SIGKILL -f "
                    + SimulationCommandBuilder.driverExecutable(machines.get(slot).getResolvedHardwareConfig()));
        }
        if (releaseBlockDevices) {
            for (String device : host.getBlockDevices().getAllocated()) {
                run(operation, "sudo qemu-nbd -d " + device);
            }
        }
    }

    @Override
    public void confirmExit() throws SimFarmException {
        for (int attempt = 0; attempt < exitPollAttempts; attempt++) {
            Set<String> sessions = sessions("confirmExit");
            if (sessions.isEmpty()) {
                return;
            }
            logger.debug("[{}] waiting for sessions to exit: {}", host.getHostId(), sessions);
            sleep("confirmExit", exitPollInterval);
        }
        throw new DispatchException("confirmExit", host.getHostId(),
                "sessions still running after " + exitPollAttempts + " checks");
    }

    @Override
    public HostStatus monitorJobs(MonitorRequest request) throws SimFarmException {
        String operation = "monitorJobs";
        List<String> jobNames = jobNames();
        if (host.getSwitches().isEmpty() && request.alreadyCollected(jobNames)) {
            // may already have shut itself down
            logger.debug("[{}] all jobs collected, not polling", host.getHostId());
            return HostStatus.collected(host.getHostId(), jobNames, request.terminateOnCompletion());
        }
        Set<String> running = sessions(operation);

        Map<String, Boolean> switches = new LinkedHashMap<>();
        List<SwitchNode> hostSwitches = host.getSwitches();
        for (int slot = 0; slot < hostSwitches.size(); slot++) {
            SwitchNode switchNode = hostSwitches.get(slot);
            switches.put(switchNode.getId(), !running.contains(switchNode.getId()));
            if (request.teardown()) {
                download(operation, switchSlotDir(slot) + "/switchlog",
                        request.resultsDir().resolve(switchNode.getId()).resolve("switchlog"));
            }
        }

        Map<String, Boolean> simulations = new LinkedHashMap<>();
        List<MachineNode> machines = host.getMachines();
        for (int slot = 0; slot < machines.size(); slot++) {
            boolean slotRunning = running.contains(ScreenSessions.simulationSession(slot));
            for (EndpointNode endpoint : machines.get(slot).getSlotEndpoints()) {
                String jobName = endpoint.getJobName();
                if (request.completedJobs().contains(jobName)) {
                    simulations.put(jobName, true);
                } else if (!slotRunning || request.teardown()) {
                    copyResults(slot, endpoint, request.resultsDir());
                    simulations.put(jobName, true);
                } else {
                    simulations.put(jobName, false);
                }
            }
        }

        boolean terminated = false;
        if (request.terminateOnCompletion()) {
            boolean done = machines.isEmpty()
                    ? request.teardown() || switches.values().stream().allMatch(Boolean::booleanValue)
                    : simulations.values().stream().allMatch(Boolean::booleanValue);
            if (done && (!switches.isEmpty() || !simulations.isEmpty())) {
                logger.info("[{}] work finished, shutting host down", host.getHostId());
                run(operation, "sudo shutdown -h +1");
                terminated = true;
            }
        }
        return new HostStatus(host.getHostId(), switches, simulations, terminated);
    }

    private List<String> jobNames() {
        List<String> jobNames = new ArrayList<>();
        for (MachineNode machine : host.getMachines()) {
            for (EndpointNode endpoint : machine.getSlotEndpoints()) {
                jobNames.add(endpoint.getJobName());
            }
        }
        return jobNames;
    }

    private void copyResults(int slot, EndpointNode endpoint, Path resultsDir) throws DispatchException {
        String operation = "monitorJobs";
        Path jobDir = resultsDir.resolve(endpoint.getJobName());
        try {
            Files.createDirectories(jobDir);
        } catch (IOException e) {
            throw new DispatchException(operation, host.getHostId(), e);
        }
        String slotDir = simSlotDir(slot);
        if (endpoint instanceof MachineNode) {
            download(operation, slotDir + "/uartlog", jobDir.resolve("uartlog"));
        }
        for (String output : endpoint.getJob().getOutputFiles()) {
            String remote = slotDir + "/" + SimulationCommandBuilder.fileName(output);
            try {
                executor.download(host.getAddress(), remote, jobDir.resolve(SimulationCommandBuilder.fileName(output)));
            } catch (IOException e) {
                logger.warn("[{}] output {} of {} not collected: {}", host.getHostId(), output,
                        endpoint.getJobName(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DispatchException(operation, host.getHostId(), e);
            }
        }
        logger.info("[{}] collected results of {}", host.getHostId(), endpoint.getJobName());
    }

    private Set<String> sessions(String operation) throws DispatchException {
        return ScreenSessions.parse(run(operation, "screen -ls").output());
    }

    private CommandResult run(String operation, String command) throws DispatchException {
        try {
            return executor.run(host.getAddress(), command);
        } catch (IOException e) {
            throw new DispatchException(operation, host.getHostId(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException(operation, host.getHostId(), e);
        }
    }

    private void runChecked(String operation, String command) throws DispatchException {
        CommandResult result = run(operation, command);
        if (!result.succeeded()) {
            throw new DispatchException(operation, host.getHostId(),
                    "'" + command + "' exited with " + result.exitCode() + ": " + result.output().trim());
        }
    }

    private void upload(String operation, Path local, String remote) throws DispatchException {
        try {
            executor.upload(host.getAddress(), local, remote);
        } catch (IOException e) {
            throw new DispatchException(operation, host.getHostId(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException(operation, host.getHostId(), e);
        }
    }

    private void download(String operation, String remote, Path local) throws DispatchException {
        try {
            executor.download(host.getAddress(), remote, local);
        } catch (IOException e) {
            throw new DispatchException(operation, host.getHostId(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException(operation, host.getHostId(), e);
        }
    }

    private List<Path> listFiles(String operation, Path directory) throws DispatchException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.sorted().collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            throw new DispatchException(operation, host.getHostId(), e);
        }
    }

    private void sleep(String operation, Duration duration) throws DispatchException {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException(operation, host.getHostId(), e);
        }
    }

    static String simSlotDir(int slot) {
        return "sim_slot_" + slot;
    }

    static String switchSlotDir(int slot) {
        return "switch_slot_" + slot;
    }
}
