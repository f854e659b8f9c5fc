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

package dev.mars.simfarm.topology;

import dev.mars.simfarm.hwconfig.HardwareConfig;
import dev.mars.simfarm.inventory.HostSlot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A simulated target machine that occupies one accelerator slot on its host.
 */
public final class MachineNode extends EndpointNode {

    private HardwareConfigRef hardwareConfig;
    private HostSlot host;
    private final List<GroupPlaceholder> coResidents = new ArrayList<>();
    private List<String> blockDevices;

    public MachineNode() {
    }

    public MachineNode(String hardwareConfigName) {
        this.hardwareConfig = new HardwareConfigRef.Unresolved(hardwareConfigName);
    }

    public MachineNode(HardwareConfig hardwareConfig) {
        this.hardwareConfig = new HardwareConfigRef.Resolved(hardwareConfig);
    }

    /**
     * @return the configured reference, or {@code null} when the run default applies
     */
    public HardwareConfigRef getHardwareConfig() {
        return hardwareConfig;
    }

    public void setHardwareConfig(HardwareConfigRef hardwareConfig) {
        this.hardwareConfig = hardwareConfig;
    }

    /**
     * @throws IllegalStateException if hardware configs have not been resolved yet
     */
    public HardwareConfig getResolvedHardwareConfig() {
        if (hardwareConfig instanceof HardwareConfigRef.Resolved resolved) {
            return resolved.config();
        }
        throw new IllegalStateException("Hardware config of " + getId() + " has not been resolved");
    }

    @Override
    public HostSlot getHost() {
        return host;
    }

    public void assignHost(HostSlot host) {
        this.host = host;
    }

    @Override
    public MachineNode getPrimary() {
        return this;
    }

    public List<GroupPlaceholder> getCoResidents() {
        return Collections.unmodifiableList(coResidents);
    }

    void addCoResident(GroupPlaceholder placeholder) {
        coResidents.add(placeholder);
    }

    /**
     * Every endpoint simulated in this machine's slot, this machine first.
     */
    public List<EndpointNode> getSlotEndpoints() {
        List<EndpointNode> endpoints = new ArrayList<>(1 + coResidents.size());
        endpoints.add(this);
        endpoints.addAll(coResidents);
        return endpoints;
    }

    /**
     * @return allocated block devices, or {@code null} before allocation
     */
    public List<String> getBlockDevices() {
        return blockDevices;
    }

    public void setBlockDevices(List<String> blockDevices) {
        this.blockDevices = List.copyOf(blockDevices);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMachine(this);
    }

    @Override
    public String describe() {
        String config = hardwareConfig == null ? "default" : hardwareConfig.name();
        return getId() + " | mac: " + getAddress() + " | job: " + getJobName() + " | hw: " + config;
    }
}
