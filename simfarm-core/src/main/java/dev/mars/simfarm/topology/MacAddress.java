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

/**
 * Hardware address of a simulated endpoint.
 *
 * <p>All addresses share the {@code 00:12:6D} prefix; the low 24 bits hold the
 * sequential value issued by an {@link AddressAllocator}. The value doubles as the
 * index into every switch's {@link ForwardingTable}.</p>
 *
 * @param value the address without its prefix, in {@code [0, 2^24)}
 */
public record MacAddress(int value) implements Comparable<MacAddress> {

    public static final int MAX_VALUE = (1 << 24) - 1;

    private static final String PREFIX = "00:12:6D";

    public MacAddress {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("MAC address value out of range: " + value);
        }
    }

    public int asIntNoPrefix() {
        return value;
    }

    @Override
    public int compareTo(MacAddress other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return String.format("%s:%02X:%02X:%02X", PREFIX,
                (value >> 16) & 0xFF, (value >> 8) & 0xFF, value & 0xFF);
    }
}
