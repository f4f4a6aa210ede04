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
 * Kind of change a memory event records.
 */
public enum MemoryEventType {

    FACT_ADDED("fact_added"),
    FACT_UPDATED("fact_updated"),
    PREFERENCE_SET("preference_set"),
    PREFERENCE_UNSET("preference_unset"),
    INFERRED_CLAIM("inferred_claim"),
    CONTRADICTION_MARKED("contradiction_marked"),
    SOFT_DELETED("soft_deleted"),
    HARD_DELETED("hard_deleted"),
    TOMBSTONE_WRITTEN("tombstone_written"),
    SUMMARY_COMPACTED("summary_compacted");

    private final String value;

    MemoryEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
