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

package dev.mars.simfarm.inventory;

import dev.mars.simfarm.core.exceptions.CapacityExhaustedException;
import dev.mars.simfarm.topology.MachineNode;
import dev.mars.simfarm.topology.SwitchNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One physical host of the fleet and what the plan has placed on it.
 *
 * <p>Accelerator hosts hold up to {@link #getMaxSimulationSlots()} machines, one per
 * slot, in assignment order, and any number of switches. Switch-only hosts hold no
 * machines and {@link #getMaxSwitchSlots()} switches. The network address is unknown
 * until the owning {@link Inventory} is bound.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class HostSlot {

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final String hostId;
    private final HostKind kind;
    private final String instanceType;
    private final int maxSimulationSlots;
    private final int maxSwitchSlots;

    private final List<SwitchNode> switches = new ArrayList<>();
    private final List<MachineNode> machines = new ArrayList<>();
    private final BlockDeviceTracker blockDevices = new BlockDeviceTracker();

    private volatile String address;

    public HostSlot(String hostId, HostKind kind, String instanceType, int maxSimulationSlots, int maxSwitchSlots) {
        this.hostId = Objects.requireNonNull(hostId, "Host id cannot be null");
        this.kind = Objects.requireNonNull(kind, "Host kind cannot be null");
        this.instanceType = instanceType;
        if (kind == HostKind.SWITCH_ONLY && maxSimulationSlots != 0) {
            throw new IllegalArgumentException("Switch-only host " + hostId + " cannot have simulation slots");
        }
        if (maxSimulationSlots < 0 || maxSwitchSlots < 0) {
            throw new IllegalArgumentException("Slot counts cannot be negative for host " + hostId);
        }
        this.maxSimulationSlots = maxSimulationSlots;
        this.maxSwitchSlots = maxSwitchSlots;
    }

    public static HostSlot accelerator(String hostId, int simulationSlots) {
        return new HostSlot(hostId, HostKind.ACCELERATOR, null, simulationSlots, UNBOUNDED);
    }

    public static HostSlot switchOnly(String hostId) {
        return new HostSlot(hostId, HostKind.SWITCH_ONLY, null, 0, 1);
    }

    public void addSwitch(SwitchNode switchNode) throws CapacityExhaustedException {
        if (switches.size() >= maxSwitchSlots) {
            throw new CapacityExhaustedException("Host " + hostId + " has no switch slot left for "
                    + switchNode.getId(), 1, 0);
        }
        switches.add(switchNode);
        switchNode.assignHost(this);
    }

    public void addMachine(MachineNode machine) throws CapacityExhaustedException {
        if (machines.size() >= maxSimulationSlots) {
            throw new CapacityExhaustedException("Host " + hostId + " has no simulation slot left for "
                    + machine.getId(), 1, 0);
        }
        machines.add(machine);
        machine.assignHost(this);
    }

    public String getHostId() {
        return hostId;
    }

    public HostKind getKind() {
        return kind;
    }

    public boolean isAccelerator() {
        return kind == HostKind.ACCELERATOR;
    }

    public String getInstanceType() {
        return instanceType;
    }

    public int getMaxSimulationSlots() {
        return maxSimulationSlots;
    }

    public int getMaxSwitchSlots() {
        return maxSwitchSlots;
    }

    public int getRemainingSimulationSlots() {
        return maxSimulationSlots - machines.size();
    }

    public boolean hasSwitchSlot() {
        return switches.size() < maxSwitchSlots;
    }

    public List<SwitchNode> getSwitches() {
        return Collections.unmodifiableList(switches);
    }

    /**
     * Machines on this host; a machine's index is its accelerator slot number.
     */
    public List<MachineNode> getMachines() {
        return Collections.unmodifiableList(machines);
    }

    public int slotOf(MachineNode machine) {
        return machines.indexOf(machine);
    }

    public BlockDeviceTracker getBlockDevices() {
        return blockDevices;
    }

    public boolean isBound() {
        return address != null;
    }

    /**
     * @throws IllegalStateException if the inventory has not been bound yet
     */
    public String getAddress() {
        if (address == null) {
            throw new IllegalStateException("Host " + hostId + " has not been bound to an address");
        }
        return address;
    }

    void bindAddress(String address) {
        this.address = address;
    }

    @Override
    public String toString() {
        return hostId + (address != null ? "(" + address + ")" : "");
    }
}
