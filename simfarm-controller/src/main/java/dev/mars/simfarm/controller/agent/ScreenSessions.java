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

package dev.mars.simfarm.controller.agent;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code screen -ls} output. Switches run in sessions named after the switch,
 * simulations in {@code fsim<slot>}.
 */
final class ScreenSessions {

    static final String NO_SESSIONS = "No Sockets found";

    private static final Pattern SESSION = Pattern.compile("^\\s*\\d+\\.(\\S+)\\s", Pattern.MULTILINE);

    private ScreenSessions() {
    }

    static Set<String> parse(String output) {
        Set<String> sessions = new LinkedHashSet<>();
        if (output == null || output.contains(NO_SESSIONS)) {
            return sessions;
        }
        Matcher matcher = SESSION.matcher(output);
        while (matcher.find()) {
            sessions.add(matcher.group(1));
        }
        return sessions;
    }

    static String simulationSession(int slot) {
        return "fsim" + slot;
    }
}
