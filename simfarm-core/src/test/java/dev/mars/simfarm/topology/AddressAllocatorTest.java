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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AddressAllocatorTest {

    @Test
    void testAllocatesSequentiallyFromZero() {
        AddressAllocator allocator = new AddressAllocator();
        allocator.reset();

        assertEquals(0, allocator.allocate().asIntNoPrefix());
        assertEquals(1, allocator.allocate().asIntNoPrefix());
        assertEquals(2, allocator.peekNext());
        assertEquals(2, allocator.allocate().asIntNoPrefix());
    }

    @Test
    void testPeekDoesNotConsume() {
        AddressAllocator allocator = new AddressAllocator();
        allocator.reset();

        assertEquals(0, allocator.peekNext());
        assertEquals(0, allocator.peekNext());
        assertEquals(0, allocator.allocate().asIntNoPrefix());
    }

    @Test
    void testResetStartsOver() {
        AddressAllocator allocator = new AddressAllocator();
        allocator.reset();
        allocator.allocate();
        allocator.allocate();

        allocator.reset();

        assertEquals(0, allocator.allocate().asIntNoPrefix());
    }

    @Test
    @DisplayName("Using the allocator before reset is a programming error")
    void testUseBeforeResetFails() {
        AddressAllocator allocator = new AddressAllocator();

        assertFalse(allocator.isReset());
        assertThrows(IllegalStateException.class, allocator::allocate);
        assertThrows(IllegalStateException.class, allocator::peekNext);
    }

    @Test
    void testMacAddressRendering() {
        assertEquals("00:12:6D:00:00:00", new MacAddress(0).toString());
        assertEquals("00:12:6D:00:01:0A", new MacAddress(266).toString());
        assertEquals("00:12:6D:FF:FF:FF", new MacAddress(MacAddress.MAX_VALUE).toString());
    }

    @Test
    void testMacAddressRange() {
        assertThrows(IllegalArgumentException.class, () -> new MacAddress(-1));
        assertThrows(IllegalArgumentException.class, () -> new MacAddress(MacAddress.MAX_VALUE + 1));
        assertTrue(new MacAddress(3).compareTo(new MacAddress(7)) < 0);
    }
}
