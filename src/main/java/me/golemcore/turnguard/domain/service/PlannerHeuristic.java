package me.golemcore.turnguard.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.List;
import java.util.Locale;

/**
 * Decides from the raw user message whether a turn looks like a multi-step
 * task worth routing through the planner. An optimization only; the tool loop
 * handles every turn the planner does not.
 */
public final class PlannerHeuristic {

    private static final List<String> NUMBERED_MARKERS = List.of("1.", "2.", "3.", "1)", "2)", "3)");
    private static final List<String> CONNECTORS = List.of(" then ", " next ", " after ", " finally ");

    private PlannerHeuristic() {
    }

    public static boolean looksMultiStep(String userMessage) {
        if (userMessage == null || userMessage.isBlank()) {
            return false;
        }
        String lowercase = userMessage.toLowerCase(Locale.ROOT);

        long numberedHits = NUMBERED_MARKERS.stream().filter(lowercase::contains).count();
        if (numberedHits >= 3) {
            return true;
        }

        long bulletLines = userMessage.lines()
                .map(PlannerHeuristic::stripLeading)
                .filter(line -> line.startsWith("- ") || line.startsWith("* "))
                .count();
        if (bulletLines >= 3) {
            return true;
        }

        long connectorHits = CONNECTORS.stream().filter(lowercase::contains).count();
        return connectorHits >= 2;
    }

    private static String stripLeading(String line) {
        return line.stripLeading();
    }
}
