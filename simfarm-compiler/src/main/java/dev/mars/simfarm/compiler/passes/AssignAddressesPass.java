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

package dev.mars.simfarm.compiler.passes;

import dev.mars.simfarm.compiler.CompilationContext;
import dev.mars.simfarm.compiler.CompilationStage;
import dev.mars.simfarm.topology.AddressAllocator;
import dev.mars.simfarm.topology.EndpointNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gives every endpoint, placeholders included, the next MAC address in DFS order.
 */
public class AssignAddressesPass extends AbstractPass {

    private static final Logger logger = LoggerFactory.getLogger(AssignAddressesPass.class);

    public AssignAddressesPass() {
        super("assign-addresses", CompilationStage.ADDRESSES_ASSIGNED);
    }

    @Override
    public void apply(CompilationContext context) {
        AddressAllocator allocator = context.getAddressAllocator();
        allocator.reset();
        for (EndpointNode endpoint : context.getGraph().dfsOrderEndpoints()) {
            endpoint.assignAddress(allocator.allocate());
            logger.debug("{} -> {}", endpoint.getId(), endpoint.getAddress());
        }
        logger.info("Assigned {} MAC addresses", allocator.peekNext());
    }
}
