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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical persona state header as persisted by the persona state store.
 * Combines the immutable identity fields with the mutable working state that
 * reflect/writeback may update.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PersonaStateHeader {

    @JsonProperty("schema_version")
    private long schemaVersion;

    @JsonProperty("identity_principles_hash")
    private String identityPrinciplesHash;

    @JsonProperty("safety_posture")
    private String safetyPosture;

    @JsonProperty("current_objective")
    private String currentObjective;

    @JsonProperty("open_loops")
    @Builder.Default
    private List<String> openLoops = new ArrayList<>();

    @JsonProperty("next_actions")
    @Builder.Default
    private List<String> nextActions = new ArrayList<>();

    @Builder.Default
    private List<String> commitments = new ArrayList<>();

    @JsonProperty("recent_context_summary")
    private String recentContextSummary;

    @JsonProperty("last_updated_at")
    private String lastUpdatedAt;

    /**
     * Builds the candidate state that results from applying an accepted
     * writeback on top of the given immutable fields.
     */
    public static PersonaStateHeader fromWriteback(ImmutableStateHeader immutable, StateHeaderWriteback writeback) {
        return PersonaStateHeader.builder()
                .schemaVersion(immutable.schemaVersion())
                .identityPrinciplesHash(immutable.identityPrinciplesHash())
                .safetyPosture(immutable.safetyPosture())
                .currentObjective(writeback.currentObjective())
                .openLoops(new ArrayList<>(writeback.openLoops()))
                .nextActions(new ArrayList<>(writeback.nextActions()))
                .commitments(new ArrayList<>(writeback.commitments()))
                .recentContextSummary(writeback.recentContextSummary())
                .lastUpdatedAt(writeback.lastUpdatedAt())
                .build();
    }
}
