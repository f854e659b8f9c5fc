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

package dev.mars.simfarm.compiler;

/**
 * Milestones of a compilation run. Each pass produces one stage and may require
 * others; {@link #INVENTORY_BOUND} is reached by binding the inventory, not by a pass.
 */
public enum CompilationStage {
    ADDRESSES_ASSIGNED,
    FORWARDING_TABLES,
    HOST_MAPPING,
    HARDWARE_CONFIG,
    NETWORK_DEFAULTS,
    JOBS_ASSIGNED,
    BLOCK_DEVICES,
    DIAGRAM,
    INVENTORY_BOUND,
    DRIVERS_BUILT,
    SWITCHES_BUILT
}
