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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeSettingsTest {

    @Test
    void testFillUnsetKeepsExplicitValues() {
        RuntimeSettings defaults = complete();
        RuntimeSettings settings = new RuntimeSettings().setLinkLatency(100).setTraceEnable(true);

        settings.fillUnset(defaults);

        assertEquals(100, settings.getLinkLatency());
        assertTrue(settings.getTraceEnable());
        assertEquals(200, settings.getBandwidthMax());
        assertEquals("-1", settings.getPrintEnd());
        assertTrue(settings.isComplete());
    }

    @Test
    void testNewSettingsAreIncomplete() {
        assertFalse(new RuntimeSettings().isComplete());
        assertTrue(complete().isComplete());
    }

    private static RuntimeSettings complete() {
        return new RuntimeSettings()
                .setLinkLatency(6405).setBandwidthMax(200).setProfileInterval(-1)
                .setTraceEnable(false).setTraceSelect("0").setTraceStart("0").setTraceEnd("-1")
                .setTraceOutputFormat("0").setAutocounterReadRate(0).setZeroOutDram(false)
                .setDisableAsserts(false).setPrintStart("0").setPrintEnd("-1").setPrintCyclePrefix(true);
    }
}
