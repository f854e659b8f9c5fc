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

/**
 * Runtime parameters of a simulated endpoint: its network link plus the
 * tracing, profiling and debug switches passed to the simulation driver.
 *
 * <p>Every field is nullable. {@code null} means "not set by the topology" and is
 * replaced by the run default in {@link #fillUnset(RuntimeSettings)}; values the
 * topology did set are never overwritten.</p>
 */
public class RuntimeSettings {

    private Integer linkLatency;
    private Integer bandwidthMax;
    private Integer profileInterval;
    private Boolean traceEnable;
    private String traceSelect;
    private String traceStart;
    private String traceEnd;
    private String traceOutputFormat;
    private Integer autocounterReadRate;
    private Boolean zeroOutDram;
    private Boolean disableAsserts;
    private String printStart;
    private String printEnd;
    private Boolean printCyclePrefix;

    /**
     * Copies every field of {@code defaults} into this object where this object's
     * field is still {@code null}.
     */
    public void fillUnset(RuntimeSettings defaults) {
        if (linkLatency == null) linkLatency = defaults.linkLatency;
        if (bandwidthMax == null) bandwidthMax = defaults.bandwidthMax;
        if (profileInterval == null) profileInterval = defaults.profileInterval;
        if (traceEnable == null) traceEnable = defaults.traceEnable;
        if (traceSelect == null) traceSelect = defaults.traceSelect;
        if (traceStart == null) traceStart = defaults.traceStart;
        if (traceEnd == null) traceEnd = defaults.traceEnd;
        if (traceOutputFormat == null) traceOutputFormat = defaults.traceOutputFormat;
        if (autocounterReadRate == null) autocounterReadRate = defaults.autocounterReadRate;
        if (zeroOutDram == null) zeroOutDram = defaults.zeroOutDram;
        if (disableAsserts == null) disableAsserts = defaults.disableAsserts;
        if (printStart == null) printStart = defaults.printStart;
        if (printEnd == null) printEnd = defaults.printEnd;
        if (printCyclePrefix == null) printCyclePrefix = defaults.printCyclePrefix;
    }

    /**
     * @return true when no field is left {@code null}
     */
    public boolean isComplete() {
        return linkLatency != null && bandwidthMax != null && profileInterval != null
                && traceEnable != null && traceSelect != null && traceStart != null
                && traceEnd != null && traceOutputFormat != null && autocounterReadRate != null
                && zeroOutDram != null && disableAsserts != null && printStart != null
                && printEnd != null && printCyclePrefix != null;
    }

    public Integer getLinkLatency() { return linkLatency; }
    public RuntimeSettings setLinkLatency(Integer linkLatency) { this.linkLatency = linkLatency; return this; }

    public Integer getBandwidthMax() { return bandwidthMax; }
    public RuntimeSettings setBandwidthMax(Integer bandwidthMax) { this.bandwidthMax = bandwidthMax; return this; }

    public Integer getProfileInterval() { return profileInterval; }
    public RuntimeSettings setProfileInterval(Integer profileInterval) { this.profileInterval = profileInterval; return this; }

    public Boolean getTraceEnable() { return traceEnable; }
    public RuntimeSettings setTraceEnable(Boolean traceEnable) { this.traceEnable = traceEnable; return this; }

    public String getTraceSelect() { return traceSelect; }
    public RuntimeSettings setTraceSelect(String traceSelect) { this.traceSelect = traceSelect; return this; }

    public String getTraceStart() { return traceStart; }
    public RuntimeSettings setTraceStart(String traceStart) { this.traceStart = traceStart; return this; }

    public String getTraceEnd() { return traceEnd; }
    public RuntimeSettings setTraceEnd(String traceEnd) { this.traceEnd = traceEnd; return this; }

    public String getTraceOutputFormat() { return traceOutputFormat; }
    public RuntimeSettings setTraceOutputFormat(String traceOutputFormat) { this.traceOutputFormat = traceOutputFormat; return this; }

    public Integer getAutocounterReadRate() { return autocounterReadRate; }
    public RuntimeSettings setAutocounterReadRate(Integer autocounterReadRate) { this.autocounterReadRate = autocounterReadRate; return this; }

    public Boolean getZeroOutDram() { return zeroOutDram; }
    public RuntimeSettings setZeroOutDram(Boolean zeroOutDram) { this.zeroOutDram = zeroOutDram; return this; }

    public Boolean getDisableAsserts() { return disableAsserts; }
    public RuntimeSettings setDisableAsserts(Boolean disableAsserts) { this.disableAsserts = disableAsserts; return this; }

    public String getPrintStart() { return printStart; }
    public RuntimeSettings setPrintStart(String printStart) { this.printStart = printStart; return this; }

    public String getPrintEnd() { return printEnd; }
    public RuntimeSettings setPrintEnd(String printEnd) { this.printEnd = printEnd; return this; }

    public Boolean getPrintCyclePrefix() { return printCyclePrefix; }
    public RuntimeSettings setPrintCyclePrefix(Boolean printCyclePrefix) { this.printCyclePrefix = printCyclePrefix; return this; }
}
