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

package dev.mars.simfarm.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration management for SimFarm.
 * Built-in defaults are overridden by the first {@code simfarm.properties} found on
 * disk or the classpath, which is in turn overridden by {@code simfarm.*} system
 * properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public class SimFarmConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(SimFarmConfiguration.class);

    public static final String DEFAULT_HARDWARE_CONFIG = "simfarm.hwconfig.default";
    public static final String LINK_LATENCY = "simfarm.network.link.latency";
    public static final String SWITCHING_LATENCY = "simfarm.network.switching.latency";
    public static final String BANDWIDTH = "simfarm.network.bandwidth";
    public static final String PROFILE_INTERVAL = "simfarm.sim.profile.interval";
    public static final String TRACE_ENABLE = "simfarm.trace.enable";
    public static final String TRACE_SELECT = "simfarm.trace.select";
    public static final String TRACE_START = "simfarm.trace.start";
    public static final String TRACE_END = "simfarm.trace.end";
    public static final String TRACE_OUTPUT_FORMAT = "simfarm.trace.output.format";
    public static final String AUTOCOUNTER_READ_RATE = "simfarm.autocounter.read.rate";
    public static final String ZERO_OUT_DRAM = "simfarm.sim.zero.out.dram";
    public static final String DISABLE_ASSERTS = "simfarm.sim.disable.asserts";
    public static final String PRINT_START = "simfarm.print.start";
    public static final String PRINT_END = "simfarm.print.end";
    public static final String PRINT_CYCLE_PREFIX = "simfarm.print.cycle.prefix";
    public static final String TERMINATE_ON_COMPLETION = "simfarm.workload.terminate.on.completion";
    public static final String MONITOR_INTERVAL_MS = "simfarm.monitor.interval.ms";
    public static final String DISPATCH_POOL_SIZE = "simfarm.dispatch.pool.size";
    public static final String DIAGRAM_ENABLED = "simfarm.diagram.enabled";
    public static final String DIAGRAM_OUTPUT_DIR = "simfarm.diagram.output.dir";

    private static final String DEFAULT_HARDWARE_CONFIG_NAME = "default";
    private static final int DEFAULT_LINK_LATENCY = 6405;
    private static final int DEFAULT_SWITCHING_LATENCY = 10;
    private static final int DEFAULT_BANDWIDTH = 200;
    private static final int DEFAULT_PROFILE_INTERVAL = -1;
    private static final long DEFAULT_MONITOR_INTERVAL_MS = 10_000;
    private static final int DEFAULT_DISPATCH_POOL_SIZE = 16;

    private final Properties properties;

    public SimFarmConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public SimFarmConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Simulation defaults
    public String getDefaultHardwareConfig() {
        return getStringProperty(DEFAULT_HARDWARE_CONFIG, DEFAULT_HARDWARE_CONFIG_NAME);
    }

    public int getLinkLatency() {
        return getIntProperty(LINK_LATENCY, DEFAULT_LINK_LATENCY);
    }

    public int getSwitchingLatency() {
        return getIntProperty(SWITCHING_LATENCY, DEFAULT_SWITCHING_LATENCY);
    }

    public int getBandwidth() {
        return getIntProperty(BANDWIDTH, DEFAULT_BANDWIDTH);
    }

    public int getProfileInterval() {
        return getIntProperty(PROFILE_INTERVAL, DEFAULT_PROFILE_INTERVAL);
    }

    public boolean isTraceEnabled() {
        return getBooleanProperty(TRACE_ENABLE, false);
    }

    public String getTraceSelect() {
        return getStringProperty(TRACE_SELECT, "0");
    }

    public String getTraceStart() {
        return getStringProperty(TRACE_START, "0");
    }

    public String getTraceEnd() {
        return getStringProperty(TRACE_END, "-1");
    }

    public String getTraceOutputFormat() {
        return getStringProperty(TRACE_OUTPUT_FORMAT, "0");
    }

    public int getAutocounterReadRate() {
        return getIntProperty(AUTOCOUNTER_READ_RATE, 0);
    }

    public boolean isZeroOutDram() {
        return getBooleanProperty(ZERO_OUT_DRAM, false);
    }

    public boolean isDisableAsserts() {
        return getBooleanProperty(DISABLE_ASSERTS, false);
    }

    public String getPrintStart() {
        return getStringProperty(PRINT_START, "0");
    }

    public String getPrintEnd() {
        return getStringProperty(PRINT_END, "-1");
    }

    public boolean isPrintCyclePrefix() {
        return getBooleanProperty(PRINT_CYCLE_PREFIX, true);
    }

    // Run control
    public boolean isTerminateOnCompletion() {
        return getBooleanProperty(TERMINATE_ON_COMPLETION, false);
    }

    public long getMonitorIntervalMs() {
        return getLongProperty(MONITOR_INTERVAL_MS, DEFAULT_MONITOR_INTERVAL_MS);
    }

    public int getDispatchPoolSize() {
        return getIntProperty(DISPATCH_POOL_SIZE, DEFAULT_DISPATCH_POOL_SIZE);
    }

    // Diagram output
    public boolean isDiagramEnabled() {
        return getBooleanProperty(DIAGRAM_ENABLED, true);
    }

    public Path getDiagramOutputDir() {
        return Paths.get(getStringProperty(DIAGRAM_OUTPUT_DIR, "."));
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(DEFAULT_HARDWARE_CONFIG, DEFAULT_HARDWARE_CONFIG_NAME);
        properties.setProperty(LINK_LATENCY, String.valueOf(DEFAULT_LINK_LATENCY));
        properties.setProperty(SWITCHING_LATENCY, String.valueOf(DEFAULT_SWITCHING_LATENCY));
        properties.setProperty(BANDWIDTH, String.valueOf(DEFAULT_BANDWIDTH));
        properties.setProperty(PROFILE_INTERVAL, String.valueOf(DEFAULT_PROFILE_INTERVAL));
        properties.setProperty(MONITOR_INTERVAL_MS, String.valueOf(DEFAULT_MONITOR_INTERVAL_MS));
        properties.setProperty(DISPATCH_POOL_SIZE, String.valueOf(DEFAULT_DISPATCH_POOL_SIZE));
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "simfarm.properties",
                "config/simfarm.properties",
                System.getProperty("user.home") + "/.simfarm/simfarm.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("simfarm.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("simfarm."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "SimFarmConfiguration{" +
                "defaultHardwareConfig='" + getDefaultHardwareConfig() + '\'' +
                ", linkLatency=" + getLinkLatency() +
                ", bandwidth=" + getBandwidth() +
                ", monitorIntervalMs=" + getMonitorIntervalMs() +
                ", terminateOnCompletion=" + isTerminateOnCompletion() +
                '}';
    }
}
