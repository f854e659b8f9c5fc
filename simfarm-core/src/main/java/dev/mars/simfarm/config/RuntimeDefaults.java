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

import dev.mars.simfarm.topology.RuntimeSettings;

import java.util.Objects;

/**
 * Run-wide values used for any switch or machine parameter a topology leaves unset.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 * @version 1.0
 */
public final class RuntimeDefaults {

    private final String defaultHardwareConfig;
    private final int switchLinkLatency;
    private final int switchingLatency;
    private final int switchBandwidth;
    private final RuntimeSettings machineSettings;

    private RuntimeDefaults(Builder builder) {
        this.defaultHardwareConfig = builder.defaultHardwareConfig;
        this.switchLinkLatency = builder.linkLatency;
        this.switchingLatency = builder.switchingLatency;
        this.switchBandwidth = builder.bandwidth;
        this.machineSettings = new RuntimeSettings()
                .setLinkLatency(builder.linkLatency)
                .setBandwidthMax(builder.bandwidth)
                .setProfileInterval(builder.profileInterval)
                .setTraceEnable(builder.traceEnable)
                .setTraceSelect(builder.traceSelect)
                .setTraceStart(builder.traceStart)
                .setTraceEnd(builder.traceEnd)
                .setTraceOutputFormat(builder.traceOutputFormat)
                .setAutocounterReadRate(builder.autocounterReadRate)
                .setZeroOutDram(builder.zeroOutDram)
                .setDisableAsserts(builder.disableAsserts)
                .setPrintStart(builder.printStart)
                .setPrintEnd(builder.printEnd)
                .setPrintCyclePrefix(builder.printCyclePrefix);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RuntimeDefaults defaults() {
        return builder().build();
    }

    public static RuntimeDefaults fromConfiguration(SimFarmConfiguration config) {
        return builder()
                .defaultHardwareConfig(config.getDefaultHardwareConfig())
                .linkLatency(config.getLinkLatency())
                .switchingLatency(config.getSwitchingLatency())
                .bandwidth(config.getBandwidth())
                .profileInterval(config.getProfileInterval())
                .traceEnable(config.isTraceEnabled())
                .traceSelect(config.getTraceSelect())
                .traceStart(config.getTraceStart())
                .traceEnd(config.getTraceEnd())
                .traceOutputFormat(config.getTraceOutputFormat())
                .autocounterReadRate(config.getAutocounterReadRate())
                .zeroOutDram(config.isZeroOutDram())
                .disableAsserts(config.isDisableAsserts())
                .printStart(config.getPrintStart())
                .printEnd(config.getPrintEnd())
                .printCyclePrefix(config.isPrintCyclePrefix())
                .build();
    }

    public String getDefaultHardwareConfig() {
        return defaultHardwareConfig;
    }

    public int getSwitchLinkLatency() {
        return switchLinkLatency;
    }

    public int getSwitchingLatency() {
        return switchingLatency;
    }

    public int getSwitchBandwidth() {
        return switchBandwidth;
    }

    /**
     * A complete settings block for machines. Callers must not modify it.
     */
    public RuntimeSettings getMachineSettings() {
        return machineSettings;
    }

    public static final class Builder {
        private String defaultHardwareConfig = "default";
        private int linkLatency = 6405;
        private int switchingLatency = 10;
        private int bandwidth = 200;
        private int profileInterval = -1;
        private boolean traceEnable = false;
        private String traceSelect = "0";
        private String traceStart = "0";
        private String traceEnd = "-1";
        private String traceOutputFormat = "0";
        private int autocounterReadRate = 0;
        private boolean zeroOutDram = false;
        private boolean disableAsserts = false;
        private String printStart = "0";
        private String printEnd = "-1";
        private boolean printCyclePrefix = true;

        private Builder() {
        }

        public Builder defaultHardwareConfig(String defaultHardwareConfig) {
            this.defaultHardwareConfig = Objects.requireNonNull(defaultHardwareConfig,
                    "Default hardware config cannot be null");
            return this;
        }

        public Builder linkLatency(int linkLatency) {
            this.linkLatency = linkLatency;
            return this;
        }

        public Builder switchingLatency(int switchingLatency) {
            this.switchingLatency = switchingLatency;
            return this;
        }

        public Builder bandwidth(int bandwidth) {
            this.bandwidth = bandwidth;
            return this;
        }

        public Builder profileInterval(int profileInterval) {
            this.profileInterval = profileInterval;
            return this;
        }

        public Builder traceEnable(boolean traceEnable) {
            this.traceEnable = traceEnable;
            return this;
        }

        public Builder traceSelect(String traceSelect) {
            this.traceSelect = traceSelect;
            return this;
        }

        public Builder traceStart(String traceStart) {
            this.traceStart = traceStart;
            return this;
        }

        public Builder traceEnd(String traceEnd) {
            this.traceEnd = traceEnd;
            return this;
        }

        public Builder traceOutputFormat(String traceOutputFormat) {
            this.traceOutputFormat = traceOutputFormat;
            return this;
        }

        public Builder autocounterReadRate(int autocounterReadRate) {
            this.autocounterReadRate = autocounterReadRate;
            return this;
        }

        public Builder zeroOutDram(boolean zeroOutDram) {
            this.zeroOutDram = zeroOutDram;
            return this;
        }

        public Builder disableAsserts(boolean disableAsserts) {
            this.disableAsserts = disableAsserts;
            return this;
        }

        public Builder printStart(String printStart) {
            this.printStart = printStart;
            return this;
        }

        public Builder printEnd(String printEnd) {
            this.printEnd = printEnd;
            return this;
        }

        public Builder printCyclePrefix(boolean printCyclePrefix) {
            this.printCyclePrefix = printCyclePrefix;
            return this;
        }

        public RuntimeDefaults build() {
            return new RuntimeDefaults(this);
        }
    }
}
