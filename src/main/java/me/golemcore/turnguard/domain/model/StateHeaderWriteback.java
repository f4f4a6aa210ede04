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

import java.util.List;

/**
 * Mutable projection of the persona state header that a guarded writeback may
 * update. Instances are only built from validated, trimmed values.
 */
public record StateHeaderWriteback(
        String currentObjective,
        List<String> openLoops,
        List<String> nextActions,
        List<String> commitments,
        String recentContextSummary,
        String lastUpdatedAt) {

    public StateHeaderWriteback {
        openLoops = List.copyOf(openLoops);
        nextActions = List.copyOf(nextActions);
        commitments = List.copyOf(commitments);
    }
}
