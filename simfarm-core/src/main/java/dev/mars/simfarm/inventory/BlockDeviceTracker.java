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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Hands out the network block devices of one host in order: {@code /dev/nbd0},
 * {@code /dev/nbd1}, ... Allocations are never reused within a run, so teardown can
 * release exactly what was handed out.
 */
public class BlockDeviceTracker {

    public static final int DEFAULT_MAX_DEVICES = 128;

    private final int maxDevices;
    private final List<String> allocated = new ArrayList<>();

    public BlockDeviceTracker() {
        this(DEFAULT_MAX_DEVICES);
    }

    public BlockDeviceTracker(int maxDevices) {
        this.maxDevices = maxDevices;
    }

    public synchronized String allocate() throws CapacityExhaustedException {
        if (allocated.size() >= maxDevices) {
            throw new CapacityExhaustedException("No block devices left on host", 1, 0);
        }
        String device = "/dev/nbd" + allocated.size();
        allocated.add(device);
        return device;
    }

    public synchronized List<String> getAllocated() {
        return Collections.unmodifiableList(new ArrayList<>(allocated));
    }
}
