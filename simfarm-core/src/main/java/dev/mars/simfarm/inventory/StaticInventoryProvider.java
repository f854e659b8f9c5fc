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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inventory provider backed by a fixed host id to address map. In mock mode it
 * hands out {@code 10.0.0.1}, {@code 10.0.0.2}, ... in inventory order.
 */
public class StaticInventoryProvider implements InventoryProvider {

    private final Map<String, String> addresses;

    public StaticInventoryProvider(Map<String, String> addresses) {
        this.addresses = Map.copyOf(addresses);
    }

    public static StaticInventoryProvider mockOnly() {
        return new StaticInventoryProvider(Map.of());
    }

    @Override
    public Map<String, String> resolveAddresses(List<HostSlot> hosts, boolean useMock)
            throws InventoryBindingException {
        Map<String, String> resolved = new LinkedHashMap<>();
        for (int i = 0; i < hosts.size(); i++) {
            HostSlot host = hosts.get(i);
            if (useMock) {
                resolved.put(host.getHostId(), "10.0." + ((i + 1) / 256) + "." + ((i + 1) % 256));
            } else {
                String address = addresses.get(host.getHostId());
                if (address == null) {
                    throw new InventoryBindingException("No address known for host " + host.getHostId());
                }
                resolved.put(host.getHostId(), address);
            }
        }
        return resolved;
    }
}
