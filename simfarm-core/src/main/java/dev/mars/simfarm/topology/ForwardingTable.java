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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Destination address to output port table of one switch.
 *
 * <p>Downlinks use ports {@code [0, downlinks)} and the single uplink uses port
 * {@code downlinks}. Every entry starts at the uplink port; the table is sized by
 * the total number of addresses allocated in the run, not by the addresses
 * reachable below the switch.</p>
 */
public class ForwardingTable {

    private final int[] ports;
    private final int uplinkPort;

    public ForwardingTable(int size, int uplinkPort) {
        if (size < 0) {
            throw new IllegalArgumentException("Table size cannot be negative: " + size);
        }
        this.ports = new int[size];
        this.uplinkPort = uplinkPort;
        Arrays.fill(ports, uplinkPort);
    }

    public void setPort(MacAddress destination, int port) {
        ports[destination.asIntNoPrefix()] = port;
    }

    public int portFor(MacAddress destination) {
        return ports[destination.asIntNoPrefix()];
    }

    public int portFor(int destination) {
        return ports[destination];
    }

    public int size() {
        return ports.length;
    }

    public int getUplinkPort() {
        return uplinkPort;
    }

    public List<Integer> asList() {
        List<Integer> result = new ArrayList<>(ports.length);
        for (int port : ports) {
            result.add(port);
        }
        return result;
    }

    @Override
    public String toString() {
        return "ForwardingTable{uplinkPort=" + uplinkPort + ", ports=" + Arrays.toString(ports) + '}';
    }
}
