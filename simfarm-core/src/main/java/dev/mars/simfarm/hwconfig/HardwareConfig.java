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

import dev.mars.simfarm.build.ArtifactBuilder;
import dev.mars.simfarm.core.exceptions.HardwareConfigException;
import dev.mars.simfarm.core.exceptions.SimFarmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A named accelerator image plus the driver that runs it.
 *
 * <p>The deploy triplet is resolved on first use and cached, and the driver is built
 * at most once per process. Both are safe to call from several passes or threads;
 * the first caller does the work.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class HardwareConfig {

    private static final Logger logger = LoggerFactory.getLogger(HardwareConfig.class);

    private final String name;
    private final String imageId;
    private final String declaredTriplet;
    private final DeployTripletResolver tripletResolver;

    private String deployTriplet;
    private Path driverDirectory;

    private HardwareConfig(Builder builder) {
        this.name = builder.name;
        this.imageId = builder.imageId;
        this.declaredTriplet = builder.deployTriplet;
        this.tripletResolver = builder.tripletResolver;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getImageId() {
        return imageId;
    }

    public synchronized boolean isDeployTripletResolved() {
        return deployTriplet != null;
    }

    public synchronized String getDeployTriplet() throws HardwareConfigException {
        if (deployTriplet == null) {
            String resolved = tripletResolver != null ? tripletResolver.resolve(this) : declaredTriplet;
            if (resolved == null || resolved.isBlank()) {
                throw new HardwareConfigException(name, "no deploy triplet could be determined");
            }
            logger.debug("Resolved deploy triplet for {}: {}", name, resolved);
            deployTriplet = resolved;
        }
        return deployTriplet;
    }

    public synchronized Path buildDriver(ArtifactBuilder builder) throws SimFarmException {
        if (driverDirectory == null) {
            logger.info("Building driver for hardware config {}", name);
            driverDirectory = Objects.requireNonNull(builder.buildDriver(this),
                    "Artifact builder returned no driver directory for " + name);
        }
        return driverDirectory;
    }

    public synchronized Path getDriverDirectory() {
        return driverDirectory;
    }

    @Override
    public String toString() {
        return "HardwareConfig{name='" + name + "', imageId='" + imageId + "'}";
    }

    public static final class Builder {
        private final String name;
        private String imageId;
        private String deployTriplet;
        private DeployTripletResolver tripletResolver;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Hardware config name cannot be null");
        }

        public Builder imageId(String imageId) {
            this.imageId = imageId;
            return this;
        }

        public Builder deployTriplet(String deployTriplet) {
            this.deployTriplet = deployTriplet;
            return this;
        }

        public Builder tripletResolver(DeployTripletResolver tripletResolver) {
            this.tripletResolver = tripletResolver;
            return this;
        }

        public HardwareConfig build() {
            return new HardwareConfig(this);
        }
    }
}
