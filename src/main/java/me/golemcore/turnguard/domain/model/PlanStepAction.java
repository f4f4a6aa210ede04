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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a plan step does: call a tool, run a prompt, or mark a checkpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanStepAction {

    private Kind kind;

    @JsonProperty("tool_name")
    private String toolName;

    @Builder.Default
    private Map<String, Object> args = new LinkedHashMap<>();

    private String text;
    private String label;

    public enum Kind {
        TOOL_CALL("tool_call"), PROMPT("prompt"), CHECKPOINT("checkpoint");

        private final String value;

        Kind(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
