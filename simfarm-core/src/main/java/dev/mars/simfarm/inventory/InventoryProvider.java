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

import java.util.List;
import java.util.Map;

/**
 * Source of the network addresses of the fleet's hosts.
 */
public interface InventoryProvider {

    /**
     * Resolves an address for every host.
     *
     * @param hosts   hosts in inventory order
     * @param useMock resolve synthetic addresses instead of querying the fleet
     * @return host id to address, one entry per host
     */
    Map<String, String> resolveAddresses(List<HostSlot> hosts, boolean useMock) throws InventoryBindingException;
}
