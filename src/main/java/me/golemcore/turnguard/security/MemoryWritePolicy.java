package me.golemcore.turnguard.security;

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

import me.golemcore.turnguard.domain.model.MemoryEvent;
import me.golemcore.turnguard.domain.model.MemoryEventType;
import me.golemcore.turnguard.domain.model.MemoryProvenance;
import me.golemcore.turnguard.domain.model.MemorySource;
import me.golemcore.turnguard.domain.model.MemoryWritePolicyException;
import me.golemcore.turnguard.domain.model.PrivacyLevel;
import me.golemcore.turnguard.domain.model.SourceKind;

/**
 * Accept/reject gate applied to every memory write on the turn path.
 *
 * <p>
 * Each {@code enforce*} method throws {@link MemoryWritePolicyException} when
 * the event does not match the shape its write path is allowed to produce.
 * Callers treat the gate as authoritative: a rejected event is never written.
 */
public final class MemoryWritePolicy {

    public static final String SLOT_USER_MESSAGE = "conversation.user_msg";
    public static final String SLOT_ASSISTANT_RESPONSE = "conversation.assistant_resp";
    public static final String SLOT_VERIFY_REPAIR_ESCALATION = "autonomy.verify_repair.escalation";
    public static final String SLOT_PERSONA_WRITEBACK_PREFIX = "persona.writeback.";

    private MemoryWritePolicy() {
    }

    public static String personEntityId(String personId) {
        return "person:" + personId;
    }

    /**
     * Autosave of the inbound user message and the assistant response.
     */
    public static void enforceAgentAutosave(MemoryEvent event) {
        if (event.getPrivacyLevel() != PrivacyLevel.PRIVATE) {
            throw reject("agent autosave policy requires privacy_level=private");
        }
        if (event.getSourceKind() != SourceKind.CONVERSATION) {
            throw reject("agent autosave policy requires source_kind=conversation");
        }
        if (event.getEventType() != MemoryEventType.FACT_ADDED) {
            throw reject("agent autosave policy requires event_type=fact_added");
        }
        if (!SLOT_USER_MESSAGE.equals(event.getSlotKey()) && !SLOT_ASSISTANT_RESPONSE.equals(event.getSlotKey())) {
            throw reject("agent autosave policy rejected slot_key");
        }
        if (event.getSource() != MemorySource.EXPLICIT_USER && event.getSource() != MemorySource.SYSTEM) {
            throw reject("agent autosave policy rejected source");
        }
        requireCommonMetadata(event);
    }

    /**
     * Post-turn inference events parsed from the assistant response.
     */
    public static void enforceInference(MemoryEvent event) {
        if (event.getPrivacyLevel() != PrivacyLevel.PRIVATE) {
            throw reject("inference write policy requires privacy_level=private");
        }
        if (event.getSourceKind() != SourceKind.CONVERSATION) {
            throw reject("inference write policy requires source_kind=conversation");
        }
        if (event.getSource() != MemorySource.INFERRED && event.getSource() != MemorySource.SYSTEM) {
            throw reject("inference write policy rejected source");
        }
        if (event.getEventType() != MemoryEventType.INFERRED_CLAIM
                && event.getEventType() != MemoryEventType.CONTRADICTION_MARKED) {
            throw reject("inference write policy rejected event_type");
        }
        requireCommonMetadata(event);
    }

    /**
     * Audit event recorded when verify/repair escalates.
     */
    public static void enforceVerifyRepairEscalation(MemoryEvent event) {
        if (event.getSource() != MemorySource.SYSTEM) {
            throw reject("verify-repair write policy requires source=system");
        }
        if (event.getPrivacyLevel() != PrivacyLevel.PRIVATE) {
            throw reject("verify-repair write policy requires privacy_level=private");
        }
        if (event.getSourceKind() != SourceKind.MANUAL) {
            throw reject("verify-repair write policy requires source_kind=manual");
        }
        if (!SLOT_VERIFY_REPAIR_ESCALATION.equals(event.getSlotKey())) {
            throw reject("verify-repair write policy rejected slot_key");
        }
        if (event.getEventType() != MemoryEventType.SUMMARY_COMPACTED) {
            throw reject("verify-repair write policy requires event_type=summary_compacted");
        }
        requireCommonMetadata(event);
    }

    /**
     * Long-term persona writes: {@code memory_append} entries and canonical
     * state header slots.
     */
    public static void enforcePersonaWriteback(MemoryEvent event, String personId) {
        if (event.getSource() != MemorySource.SYSTEM) {
            throw reject("persona writeback policy requires source=system");
        }
        if (event.getPrivacyLevel() != PrivacyLevel.PRIVATE) {
            throw reject("persona writeback policy requires privacy_level=private");
        }
        if (event.getSourceKind() != SourceKind.MANUAL) {
            throw reject("persona writeback policy requires source_kind=manual");
        }
        requireCommonMetadata(event);
        if (!personEntityId(personId).equals(event.getEntityId())) {
            throw reject("persona writeback policy entity_id mismatch");
        }

        String slotKey = event.getSlotKey() == null ? "" : event.getSlotKey();
        if (slotKey.startsWith(SLOT_PERSONA_WRITEBACK_PREFIX)) {
            if (event.getEventType() != MemoryEventType.SUMMARY_COMPACTED) {
                throw reject("persona writeback entries must use event_type=summary_compacted");
            }
            return;
        }
        if (slotKey.startsWith("persona/" + personId + "/state_header/")) {
            if (event.getEventType() != MemoryEventType.FACT_UPDATED) {
                throw reject("persona canonical state writes must use event_type=fact_updated");
            }
            return;
        }
        throw reject("persona writeback policy rejected slot_key");
    }

    private static void requireCommonMetadata(MemoryEvent event) {
        if (event.getSourceRef() == null) {
            throw reject("write policy requires source_ref");
        }
        if (event.getSourceRef().isBlank()) {
            throw reject("write policy source_ref must not be empty");
        }
        MemoryProvenance provenance = event.getProvenance();
        if (provenance == null) {
            throw reject("write policy requires provenance");
        }
        if (provenance.sourceClass() != event.getSource()) {
            throw reject("write policy requires provenance.source_class to match source");
        }
        if (provenance.reference() == null || provenance.reference().isBlank()) {
            throw reject("write policy requires provenance.reference");
        }
    }

    private static MemoryWritePolicyException reject(String message) {
        return new MemoryWritePolicyException(message);
    }
}
