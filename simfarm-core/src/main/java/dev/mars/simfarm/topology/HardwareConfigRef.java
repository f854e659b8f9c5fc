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

import dev.mars.simfarm.hwconfig.HardwareConfig;

import java.util.Objects;

/**
 * Hardware configuration of a machine, either still a name from the topology
 * description or a config object resolved from the registry.
 */
public sealed interface HardwareConfigRef {

    String name();

    record Unresolved(String name) implements HardwareConfigRef {
        public Unresolved {
            Objects.requireNonNull(name, "Hardware config name cannot be null");
        }
    }

    record Resolved(HardwareConfig config) implements HardwareConfigRef {
        public Resolved {
            Objects.requireNonNull(config, "Hardware config cannot be null");
        }

        @Override
        public String name() {
            return config.getName();
        }
    }
}
