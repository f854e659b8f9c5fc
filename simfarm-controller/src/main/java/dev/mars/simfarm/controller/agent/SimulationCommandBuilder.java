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

import dev.mars.simfarm.compiler.render.SwitchConfigGenerator;
import dev.mars.simfarm.core.exceptions.HardwareConfigException;
import dev.mars.simfarm.hwconfig.HardwareConfig;
import dev.mars.simfarm.topology.EndpointNode;
import dev.mars.simfarm.topology.MachineNode;
import dev.mars.simfarm.topology.RuntimeSettings;
import dev.mars.simfarm.topology.SwitchNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Builds the driver command line for one accelerator slot. Settings that apply to the
 * whole slot come from the primary machine; network and program arguments are
 * numbered per endpoint, so a supernode passes {@code +macaddr0}, {@code +macaddr1}, ...
 */
public class SimulationCommandBuilder {

    public static String driverExecutable(HardwareConfig config) throws HardwareConfigException {
        return config.getDeployTriplet() + "-driver";
    }

    public String build(MachineNode machine, int slot) throws HardwareConfigException {
        RuntimeSettings settings = machine.getSettings();
        StringJoiner command = new StringJoiner(" ");
        command.add("sudo").add("./" + driverExecutable(machine.getResolvedHardwareConfig()));
        command.add("+permissive");
        command.add("+slotid=" + slot);
        command.add("+profile-interval=" + settings.getProfileInterval());
        if (Boolean.TRUE.equals(settings.getZeroOutDram())) {
            command.add("+zero-out-dram");
        }
        if (Boolean.TRUE.equals(settings.getDisableAsserts())) {
            command.add("+disable-asserts");
        }
        if (Boolean.TRUE.equals(settings.getTraceEnable())) {
            command.add("+tracefile=TRACEFILE");
            command.add("+trace-select=" + settings.getTraceSelect());
            command.add("+trace-start=" + settings.getTraceStart());
            command.add("+trace-end=" + settings.getTraceEnd());
            command.add("+trace-output-format=" + settings.getTraceOutputFormat());
        }
        command.add("+autocounter-readrate=" + settings.getAutocounterReadRate());
        command.add("+autocounter-filename=AUTOCOUNTERFILE");
        command.add("+print-start=" + settings.getPrintStart());
        command.add("+print-end=" + settings.getPrintEnd());
        if (Boolean.FALSE.equals(settings.getPrintCyclePrefix())) {
            command.add("+print-no-cycle-prefix");
        }

        List<String> devices = machine.getBlockDevices() == null ? List.of() : machine.getBlockDevices();
        int deviceIndex = 0;
        List<EndpointNode> endpoints = machine.getSlotEndpoints();
        for (int k = 0; k < endpoints.size(); k++) {
            EndpointNode endpoint = endpoints.get(k);
            RuntimeSettings endpointSettings = endpoint.getSettings();
            command.add("+macaddr" + k + "=" + endpoint.getAddress());
            command.add("+niclog" + k + "=niclog" + k);
            command.add("+linklatency" + k + "=" + endpointSettings.getLinkLatency());
            command.add("+netbw" + k + "=" + endpointSettings.getBandwidthMax());
            for (String port : uplinkArguments(endpoint, k)) {
                command.add(port);
            }
            List<String> images = endpoint.getJob().getDiskImages();
            int copyOnWrite = endpoint.getJob().getCopyOnWriteImages().size();
            if (copyOnWrite > 0 && deviceIndex < devices.size()) {
                command.add("+blkdev" + k + "=" + devices.get(deviceIndex));
                deviceIndex += copyOnWrite;
            } else if (!images.isEmpty()) {
                command.add("+blkdev" + k + "=" + fileName(images.get(0)));
            }
            command.add("+prog" + k + "=" + fileName(endpoint.getJob().getBootBinary()));
        }
        command.add("+permissive-off");
        return command.toString();
    }

    private static List<String> uplinkArguments(EndpointNode endpoint, int k) {
        List<String> args = new ArrayList<>();
        SwitchNode uplink = endpoint.getUplink();
        if (uplink == null) {
            return args;
        }
        if (uplink.getHost() != null && uplink.getHost() == endpoint.getHost()) {
            args.add("+shmemportname" + k + "=" + SwitchConfigGenerator.linkName(uplink, endpoint));
        } else {
            int port = uplink.getDownlinks().indexOf(endpoint);
            args.add("+switchaddr" + k + "=" + uplink.getHost().getAddress() + ":"
                    + SwitchConfigGenerator.listenPort(uplink, port));
        }
        return args;
    }

    static String fileName(String path) {
        return Path.of(path).getFileName().toString();
    }
}
