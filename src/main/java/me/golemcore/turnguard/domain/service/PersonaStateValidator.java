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

import me.golemcore.turnguard.domain.model.ImmutableStateHeader;
import me.golemcore.turnguard.domain.model.PersonaStateHeader;
import me.golemcore.turnguard.security.Rfc3339Timestamps;
import me.golemcore.turnguard.security.WritebackGuard;

import java.util.List;
import java.util.Objects;

/**
 * Validates a complete persona state header before it is persisted.
 */
public final class PersonaStateValidator {

    private PersonaStateValidator() {
    }

    /**
     * @throws IllegalArgumentException
     *             describing the first violated constraint
     */
    public static void validate(PersonaStateHeader header) {
        if (header.getSchemaVersion() != ImmutableStateHeader.CURRENT_SCHEMA_VERSION) {
            throw new IllegalArgumentException("invalid schema_version: expected "
                    + ImmutableStateHeader.CURRENT_SCHEMA_VERSION + ", got " + header.getSchemaVersion());
        }
        requireNonEmpty("identity_principles_hash", header.getIdentityPrinciplesHash());
        requireNonEmpty("safety_posture", header.getSafetyPosture());
        requireText("current_objective", header.getCurrentObjective(),
                WritebackGuard.MAX_CURRENT_OBJECTIVE_CHARS);
        requireText("recent_context_summary", header.getRecentContextSummary(),
                WritebackGuard.MAX_RECENT_CONTEXT_SUMMARY_CHARS);
        requireItems("open_loops", header.getOpenLoops(), WritebackGuard.MAX_OPEN_LOOPS);
        requireItems("next_actions", header.getNextActions(), WritebackGuard.MAX_NEXT_ACTIONS);
        requireItems("commitments", header.getCommitments(), WritebackGuard.MAX_COMMITMENTS);

        if (!Rfc3339Timestamps.isValid(header.getLastUpdatedAt())) {
            throw new IllegalArgumentException("last_updated_at must be RFC3339");
        }
    }

    /**
     * Validates {@code candidate} and checks that none of its immutable fields
     * differ from {@code previous}.
     */
    public static void validateWritebackCandidate(PersonaStateHeader previous, PersonaStateHeader candidate) {
        validate(candidate);
        if (candidate.getSchemaVersion() != previous.getSchemaVersion()) {
            throw new IllegalArgumentException("immutable field changed: schema_version");
        }
        if (!Objects.equals(candidate.getIdentityPrinciplesHash(), previous.getIdentityPrinciplesHash())) {
            throw new IllegalArgumentException("immutable field changed: identity_principles_hash");
        }
        if (!Objects.equals(candidate.getSafetyPosture(), previous.getSafetyPosture())) {
            throw new IllegalArgumentException("immutable field changed: safety_posture");
        }
    }

    private static void requireNonEmpty(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be empty");
        }
    }

    private static void requireText(String field, String value, int maxChars) {
        requireNonEmpty(field, value);
        if (value.codePointCount(0, value.length()) > maxChars) {
            throw new IllegalArgumentException(field + " exceeds max length of " + maxChars);
        }
    }

    private static void requireItems(String field, List<String> items, int maxItems) {
        if (items == null) {
            throw new IllegalArgumentException(field + " must not be null");
        }
        if (items.size() > maxItems) {
            throw new IllegalArgumentException(field + " exceeds max items of " + maxItems);
        }
        for (String item : items) {
            if (item == null || item.isBlank()) {
                throw new IllegalArgumentException(field + " contains empty item");
            }
            if (item.codePointCount(0, item.length()) > WritebackGuard.MAX_LIST_ITEM_CHARS) {
                throw new IllegalArgumentException(
                        field + " item exceeds max length of " + WritebackGuard.MAX_LIST_ITEM_CHARS);
            }
        }
    }
}
