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

import dev.mars.simfarm.core.exceptions.InventoryBindingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The fleet of hosts available to one run.
 *
 * <p>Hosts keep their input order. Binding to network addresses happens once per
 * run with an explicit mock-or-real choice: binding again with the same choice is a
 * no-op, with the other choice it fails, so the fleet is never queried twice with
 * possibly inconsistent answers.</p>
 */
public class Inventory {

    private static final Logger logger = LoggerFactory.getLogger(Inventory.class);

    private final List<HostSlot> hosts;
    private Boolean boundWithMock;

    public Inventory(List<HostSlot> hosts) {
        Set<String> ids = new HashSet<>();
        for (HostSlot host : hosts) {
            if (!ids.add(host.getHostId())) {
                throw new IllegalArgumentException("Duplicate host id in inventory: " + host.getHostId());
            }
        }
        this.hosts = List.copyOf(hosts);
    }

    public List<HostSlot> getHosts() {
        return hosts;
    }

    public List<HostSlot> getAcceleratorHosts() {
        return hosts.stream().filter(HostSlot::isAccelerator).collect(Collectors.toList());
    }

    public List<HostSlot> getSwitchOnlyHosts() {
        return hosts.stream().filter(host -> !host.isAccelerator()).collect(Collectors.toList());
    }

    /**
     * Hosts that received at least one switch or machine.
     */
    public List<HostSlot> getUsedHosts() {
        List<HostSlot> used = new ArrayList<>();
        for (HostSlot host : hosts) {
            if (!host.getSwitches().isEmpty() || !host.getMachines().isEmpty()) {
                used.add(host);
            }
        }
        return Collections.unmodifiableList(used);
    }

    public int getTotalSimulationSlots() {
        return hosts.stream().mapToInt(HostSlot::getMaxSimulationSlots).sum();
    }

    public synchronized void bind(InventoryProvider provider, boolean useMock) throws InventoryBindingException {
        if (boundWithMock != null) {
            if (boundWithMock == useMock) {
                logger.debug("Inventory already bound ({}), skipping", useMock ? "mock" : "real");
                return;
            }
            throw new InventoryBindingException("Inventory already bound with "
                    + (boundWithMock ? "mock" : "real") + " hosts; cannot rebind with "
                    + (useMock ? "mock" : "real") + " hosts in the same run");
        }
        Map<String, String> addresses = provider.resolveAddresses(hosts, useMock);
        for (HostSlot host : hosts) {
            String address = addresses.get(host.getHostId());
            if (address == null) {
                throw new InventoryBindingException("Provider returned no address for host " + host.getHostId());
            }
        }
        for (HostSlot host : hosts) {
            host.bindAddress(addresses.get(host.getHostId()));
        }
        boundWithMock = useMock;
        logger.info("Bound {} hosts to {} addresses", hosts.size(), useMock ? "mock" : "real");
    }

    public synchronized boolean isBound() {
        return boundWithMock != null;
    }

    public synchronized boolean isMock() {
        return Boolean.TRUE.equals(boundWithMock);
    }

    public Optional<HostSlot> lookupByAddress(String address) {
        return hosts.stream()
                .filter(host -> host.isBound() && host.getAddress().equals(address))
                .findFirst();
    }

    public Optional<HostSlot> lookupById(String hostId) {
        return hosts.stream().filter(host -> host.getHostId().equals(hostId)).findFirst();
    }
}
