package me.golemcore.turnguard.domain.model;

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

import java.util.Locale;

/**
 * Configured trust tier governing temperature bands and action permissions.
 * Declaration order is the trust order: {@code READ_ONLY < SUPERVISED < FULL}.
 */
public enum AutonomyLevel {

    READ_ONLY("read_only"), SUPERVISED("supervised"), FULL("full");

    private final String configKey;

    AutonomyLevel(String configKey) {
        this.configKey = configKey;
    }

    public String getConfigKey() {
        return configKey;
    }

    /**
     * Parses a configured level. Accepts {@code read_only}, {@code readonly},
     * {@code read-only}, {@code supervised} and {@code full}; blank values map to
     * {@link #SUPERVISED}.
     */
    public static AutonomyLevel fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return SUPERVISED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
        case "read_only", "readonly" -> READ_ONLY;
        case "supervised" -> SUPERVISED;
        case "full" -> FULL;
        default -> throw new IllegalArgumentException("Unknown autonomy level: " + value);
        };
    }

    /**
     * Returns the less trusted of the two levels.
     */
    public static AutonomyLevel min(AutonomyLevel first, AutonomyLevel second) {
        return first.ordinal() <= second.ordinal() ? first : second;
    }
}
