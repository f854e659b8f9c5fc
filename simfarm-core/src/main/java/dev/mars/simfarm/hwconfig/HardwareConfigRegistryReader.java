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

package dev.mars.simfarm.hwconfig;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.simfarm.core.exceptions.HardwareConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads a hardware config database: a JSON object keyed by config name, each value
 * carrying {@code imageId} and {@code deployTriplet}.
 */
public class HardwareConfigRegistryReader {

    private static final Logger logger = LoggerFactory.getLogger(HardwareConfigRegistryReader.class);

    private final ObjectMapper objectMapper;

    public HardwareConfigRegistryReader() {
        this(new ObjectMapper());
    }

    public HardwareConfigRegistryReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public InMemoryHardwareConfigRegistry read(Path path) throws IOException, HardwareConfigException {
        try (InputStream input = Files.newInputStream(path)) {
            InMemoryHardwareConfigRegistry registry = read(input);
            logger.info("Loaded {} hardware configs from {}", registry.names().size(), path);
            return registry;
        }
    }

    public InMemoryHardwareConfigRegistry read(InputStream input) throws IOException, HardwareConfigException {
        JsonNode root = objectMapper.readTree(input);
        if (root == null || !root.isObject()) {
            throw new HardwareConfigException("<document>", "hardware config database must be a JSON object");
        }
        InMemoryHardwareConfigRegistry registry = new InMemoryHardwareConfigRegistry();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            if (!value.isObject()) {
                throw new HardwareConfigException(entry.getKey(), "entry must be a JSON object");
            }
            registry.register(HardwareConfig.builder(entry.getKey())
                    .imageId(value.hasNonNull("imageId") ? value.get("imageId").asText() : null)
                    .deployTriplet(value.hasNonNull("deployTriplet") ? value.get("deployTriplet").asText() : null)
                    .build());
        }
        return registry;
    }
}
