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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.simfarm.core.exceptions.TopologyShapeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a {@link TopologyDescription} from JSON.
 *
 * <pre>{@code
 * {
 *   "name": "rack_of_four",
 *   "mapper": "simple-networked",
 *   "roots": [
 *     { "type": "switch", "linkLatency": 6405, "downlinks": [
 *         { "type": "machine", "hardwareConfig": "rocket-quadcore" },
 *         { "type": "machine", "placeholders": 3, "settings": { "traceEnable": true } }
 *     ] }
 *   ]
 * }
 * }</pre>
 *
 * A machine's {@code placeholders} count adds that many {@link GroupPlaceholder}s
 * sharing its slot, attached right after it.
 */
public class TopologyDescriptionReader {

    private static final Logger logger = LoggerFactory.getLogger(TopologyDescriptionReader.class);

    private final ObjectMapper objectMapper;

    public TopologyDescriptionReader() {
        this(new ObjectMapper());
    }

    public TopologyDescriptionReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TopologyDescription read(Path path) throws IOException, TopologyShapeException {
        try (InputStream input = Files.newInputStream(path)) {
            TopologyDescription description = read(input);
            logger.info("Loaded topology '{}' from {}", description.getName(), path);
            return description;
        }
    }

    public TopologyDescription read(InputStream input) throws IOException, TopologyShapeException {
        JsonNode root = objectMapper.readTree(input);
        if (root == null || !root.isObject()) {
            throw new TopologyShapeException("<document>", "topology document must be a JSON object");
        }
        TopologyDescription.Builder builder = TopologyDescription.builder();
        if (root.hasNonNull("name")) {
            builder.name(root.get("name").asText());
        }
        if (root.hasNonNull("mapper")) {
            builder.mapperName(root.get("mapper").asText());
        }
        JsonNode roots = root.path("roots");
        if (!roots.isArray() || roots.isEmpty()) {
            throw new TopologyShapeException("<document>", "topology must declare at least one root");
        }
        for (JsonNode node : roots) {
            builder.roots(parseNode(node, "roots"));
        }
        return builder.build();
    }

    /**
     * Parses one node; a machine with placeholders yields several nodes.
     */
    private List<TopologyNode> parseNode(JsonNode json, String location) throws TopologyShapeException {
        String type = json.path("type").asText("");
        List<TopologyNode> result = new ArrayList<>();
        switch (type) {
            case "switch": {
                SwitchNode switchNode = new SwitchNode()
                        .setLinkLatency(optInt(json, "linkLatency"))
                        .setSwitchingLatency(optInt(json, "switchingLatency"))
                        .setBandwidth(optInt(json, "bandwidth"));
                int index = 0;
                for (JsonNode child : json.path("downlinks")) {
                    for (TopologyNode node : parseNode(child, location + ".downlinks[" + index + "]")) {
                        switchNode.addDownlink(node);
                    }
                    index++;
                }
                result.add(switchNode);
                break;
            }
            case "machine": {
                MachineNode machine = json.hasNonNull("hardwareConfig")
                        ? new MachineNode(json.get("hardwareConfig").asText())
                        : new MachineNode();
                readSettings(json.path("settings"), machine.getSettings());
                result.add(machine);
                int placeholders = json.path("placeholders").asInt(0);
                for (int i = 0; i < placeholders; i++) {
                    result.add(new GroupPlaceholder(machine));
                }
                break;
            }
            default:
                throw new TopologyShapeException(location, "unknown node type '" + type + "'");
        }
        return result;
    }

    private void readSettings(JsonNode json, RuntimeSettings settings) {
        if (json.isMissingNode() || json.isNull()) {
            return;
        }
        settings.setLinkLatency(optInt(json, "linkLatency"))
                .setBandwidthMax(optInt(json, "bandwidthMax"))
                .setProfileInterval(optInt(json, "profileInterval"))
                .setTraceEnable(optBoolean(json, "traceEnable"))
                .setTraceSelect(optText(json, "traceSelect"))
                .setTraceStart(optText(json, "traceStart"))
                .setTraceEnd(optText(json, "traceEnd"))
                .setTraceOutputFormat(optText(json, "traceOutputFormat"))
                .setAutocounterReadRate(optInt(json, "autocounterReadRate"))
                .setZeroOutDram(optBoolean(json, "zeroOutDram"))
                .setDisableAsserts(optBoolean(json, "disableAsserts"))
                .setPrintStart(optText(json, "printStart"))
                .setPrintEnd(optText(json, "printEnd"))
                .setPrintCyclePrefix(optBoolean(json, "printCyclePrefix"));
    }

    private static Integer optInt(JsonNode json, String field) {
        return json.hasNonNull(field) ? json.get(field).asInt() : null;
    }

    private static Boolean optBoolean(JsonNode json, String field) {
        return json.hasNonNull(field) ? json.get(field).asBoolean() : null;
    }

    private static String optText(JsonNode json, String field) {
        return json.hasNonNull(field) ? json.get(field).asText() : null;
    }
}
