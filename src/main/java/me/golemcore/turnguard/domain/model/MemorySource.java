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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin classification of a memory event, with the default confidence the
 * memory store assigns to each origin.
 */
public enum MemorySource {

    EXPLICIT_USER("explicit_user", 0.95),
    TOOL_VERIFIED("tool_verified", 0.9),
    SYSTEM("system", 0.8),
    INFERRED("inferred", 0.7),
    EXTERNAL_PRIMARY("external_primary", 0.75),
    EXTERNAL_SECONDARY("external_secondary", 0.5);

    private final String value;
    private final double defaultConfidence;

    MemorySource(String value, double defaultConfidence) {
        this.value = value;
        this.defaultConfidence = defaultConfidence;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double getDefaultConfidence() {
        return defaultConfidence;
    }
}
