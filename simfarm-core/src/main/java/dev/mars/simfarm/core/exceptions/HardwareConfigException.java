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

package dev.mars.simfarm.core.exceptions;

/**
 * Thrown when a hardware configuration cannot be resolved or its driver cannot be built.
 */
public class HardwareConfigException extends SimFarmException {

    private final String configName;

    public HardwareConfigException(String configName, String message) {
        super(String.format("Hardware config '%s': %s", configName, message));
        this.configName = configName;
    }

    public HardwareConfigException(String configName, String message, Throwable cause) {
        super(String.format("Hardware config '%s': %s", configName, message), cause);
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }
}
