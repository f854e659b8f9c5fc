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

package dev.mars.simfarm.workload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.simfarm.core.exceptions.WorkloadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a workload definition file.
 *
 * <pre>{@code
 * {
 *   "name": "linux-uniform",
 *   "commonBootBinary": "br-base-bin",
 *   "commonDiskImages": ["br-base.img"],
 *   "commonOutputs": ["/etc/os-release"],
 *   "jobs": [ { "name": "client", "bootBinary": "...", "diskImages": [...], "outputs": [...] } ],
 *   "postRunHook": "python3 summarize.py"
 * }
 * }</pre>
 *
 * A document without {@code jobs} is a uniform workload. Relative paths resolve
 * against the directory holding the file, which also becomes the input directory.
 * The results directory is {@code <resultsBase>/<timestamp>-<name>}.
 */
public class WorkloadReader {

    private static final Logger logger = LoggerFactory.getLogger(WorkloadReader.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd--HH-mm-ss");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WorkloadReader() {
        this(new ObjectMapper(), Clock.systemDefaultZone());
    }

    public WorkloadReader(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Workload read(Path path, Path resultsBase) throws IOException, WorkloadException {
        Path inputDir = path.toAbsolutePath().getParent();
        try (InputStream input = Files.newInputStream(path)) {
            Workload workload = read(input, inputDir, resultsBase);
            logger.info("Loaded workload '{}' from {}", workload.getName(), path);
            return workload;
        }
    }

    public Workload read(InputStream input, Path inputDir, Path resultsBase) throws IOException, WorkloadException {
        JsonNode root = objectMapper.readTree(input);
        if (root == null || !root.isObject()) {
            throw new WorkloadException("Workload document must be a JSON object");
        }
        String name = root.path("name").asText(null);
        if (name == null || name.isBlank()) {
            throw new WorkloadException("Workload document has no name");
        }
        String stamp = LocalDateTime.now(clock).format(TIMESTAMP);
        Workload.Builder builder = Workload.builder(name)
                .inputBaseDir(inputDir)
                .resultsDir(resultsBase.resolve(stamp + "-" + name));
        if (root.hasNonNull("postRunHook")) {
            builder.postRunHook(root.get("postRunHook").asText());
        }

        String commonBoot = root.hasNonNull("commonBootBinary")
                ? resolve(inputDir, root.get("commonBootBinary").asText()) : null;
        List<String> commonImages = paths(inputDir, root.path("commonDiskImages"));
        List<String> commonOutputs = texts(root.path("commonOutputs"));

        JsonNode jobs = root.path("jobs");
        if (jobs.isArray() && !jobs.isEmpty()) {
            for (JsonNode job : jobs) {
                String jobName = job.path("name").asText(null);
                if (jobName == null) {
                    throw new WorkloadException("Job without a name in workload '" + name + "'");
                }
                String boot = job.hasNonNull("bootBinary") ? resolve(inputDir, job.get("bootBinary").asText()) : commonBoot;
                if (boot == null) {
                    throw new WorkloadException("Job '" + jobName + "' has no boot binary");
                }
                List<String> images = job.has("diskImages") ? paths(inputDir, job.get("diskImages")) : commonImages;
                List<String> outputs = job.has("outputs") ? texts(job.get("outputs")) : commonOutputs;
                builder.job(new JobDescriptor(name + "-" + jobName, boot, images, outputs));
            }
        } else {
            if (commonBoot == null) {
                throw new WorkloadException("Uniform workload '" + name + "' has no commonBootBinary");
            }
            builder.uniform(commonBoot, commonImages, commonOutputs);
        }
        return builder.build();
    }

    private static String resolve(Path inputDir, String file) {
        return inputDir.resolve(file).toString();
    }

    private static List<String> paths(Path inputDir, JsonNode array) {
        List<String> result = new ArrayList<>();
        for (JsonNode item : array) {
            result.add(resolve(inputDir, item.asText()));
        }
        return result;
    }

    private static List<String> texts(JsonNode array) {
        List<String> result = new ArrayList<>();
        for (JsonNode item : array) {
            result.add(item.asText());
        }
        return result;
    }
}
