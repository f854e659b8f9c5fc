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
 * Issues sequential {@link MacAddress} values for one compilation run.
 *
 * <p>An allocator belongs to a single compilation context and is not thread-safe.
 * It must be {@link #reset()} at the start of every run; using it before that
 * is an {@link IllegalStateException} so that state never leaks between runs.</p>
 */
public class AddressAllocator {

    private int next = -1;

    /**
     * Starts a new run. The next address issued is {@code 0}.
     */
    public void reset() {
        next = 0;
    }

    public MacAddress allocate() {
        ensureReset();
        if (next > MacAddress.MAX_VALUE) {
            throw new IllegalStateException("MAC address space exhausted after " + next + " allocations");
        }
        return new MacAddress(next++);
    }

    /**
     * Returns the value the next call to {@link #allocate()} would issue, which is
     * also the number of addresses allocated so far in this run.
     */
    public int peekNext() {
        ensureReset();
        return next;
    }

    public boolean isReset() {
        return next >= 0;
    }

    private void ensureReset() {
        if (next < 0) {
            throw new IllegalStateException("Address allocator used before reset()");
        }
    }
}
