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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.turnguard.domain.model.MemoryEvent;
import me.golemcore.turnguard.domain.model.MemoryEventType;
import me.golemcore.turnguard.domain.model.MemoryLayer;
import me.golemcore.turnguard.domain.model.MemoryProvenance;
import me.golemcore.turnguard.domain.model.MemorySource;
import me.golemcore.turnguard.domain.model.PrivacyLevel;
import me.golemcore.turnguard.domain.model.SourceKind;
import me.golemcore.turnguard.infrastructure.config.TurnGuardProperties;
import me.golemcore.turnguard.port.outbound.MemoryPort;
import me.golemcore.turnguard.security.MemoryWriteContext;
import me.golemcore.turnguard.security.MemoryWritePolicy;
import me.golemcore.turnguard.security.SecretScrubber;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Best-effort memory writes around a turn: autosave of the inbound message and
 * the response summary, plus the post-turn inference pass.
 *
 * <p>
 * Every event goes through {@link MemoryWritePolicy} first. A rejected or
 * failed write is logged and the turn continues.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MemoryWriteService {

    static final String USER_MESSAGE_REF = "agent.autosave.user_msg";
    static final String ASSISTANT_RESPONSE_REF = "agent.autosave.assistant_resp";
    static final String INFERRED_CLAIM_REF = "inference.post_turn.inferred_claim";
    static final String CONTRADICTION_REF = "inference.post_turn.contradiction_event";
    static final String INFERRED_CLAIM_PREFIX = "INFERRED_CLAIM ";
    static final String CONTRADICTION_PREFIX = "CONTRADICTION_EVENT ";
    private static final String PAYLOAD_SEPARATOR = "=>";
    private static final String ELLIPSIS = "...";

    private final TurnGuardProperties properties;
    private final MemoryPort memoryPort;
    private final Clock clock;

    public boolean isAutoSaveEnabled() {
        return properties.getMemory().isAutoSave();
    }

    public void saveUserMessage(MemoryWriteContext writeContext, String userMessage) {
        if (!isAutoSaveEnabled()) {
            return;
        }
        MemoryEvent event = conversationEvent(writeContext, MemoryWritePolicy.SLOT_USER_MESSAGE, userMessage,
                MemorySource.EXPLICIT_USER, 0.95, 0.6, USER_MESSAGE_REF);
        appendAutosave(event, "user message");
    }

    public void saveAssistantResponse(MemoryWriteContext writeContext, String response) {
        if (!isAutoSaveEnabled()) {
            return;
        }
        String summary = truncateWithEllipsis(response, properties.getMemory().getResponseSummaryChars());
        MemoryEvent event = conversationEvent(writeContext, MemoryWritePolicy.SLOT_ASSISTANT_RESPONSE, summary,
                MemorySource.SYSTEM, 0.9, 0.4, ASSISTANT_RESPONSE_REF);
        appendAutosave(event, "assistant response");
    }

    /**
     * Appends one event per {@code INFERRED_CLAIM slot => value} or
     * {@code CONTRADICTION_EVENT slot => value} line of the response.
     *
     * @return number of events appended
     */
    public int runInferencePass(MemoryWriteContext writeContext, String response) {
        writeContext.enforceWriteScope();
        List<MemoryEvent> events = parseInferenceEvents(writeContext.entityId(), response);
        int appended = 0;
        for (MemoryEvent event : events) {
            if (event.getEventType() == MemoryEventType.CONTRADICTION_MARKED) {
                log.info("[Memory] Contradiction detected: entity={}, slot={}", event.getEntityId(),
                        event.getSlotKey());
            }
            MemoryWritePolicy.enforceInference(event);
            memoryPort.appendEvent(event).join();
            appended++;
        }
        return appended;
    }

    List<MemoryEvent> parseInferenceEvents(String entityId, String response) {
        List<MemoryEvent> events = new ArrayList<>();
        if (response == null) {
            return events;
        }
        for (String rawLine : response.lines().toList()) {
            String line = rawLine.strip();
            if (line.startsWith(INFERRED_CLAIM_PREFIX)) {
                String[] payload = splitPayload(line.substring(INFERRED_CLAIM_PREFIX.length()));
                if (payload != null) {
                    events.add(inferenceEvent(entityId, payload, MemoryEventType.INFERRED_CLAIM,
                            MemorySource.INFERRED, MemoryLayer.SEMANTIC, INFERRED_CLAIM_REF));
                }
            } else if (line.startsWith(CONTRADICTION_PREFIX)) {
                String[] payload = splitPayload(line.substring(CONTRADICTION_PREFIX.length()));
                if (payload != null) {
                    events.add(inferenceEvent(entityId, payload, MemoryEventType.CONTRADICTION_MARKED,
                            MemorySource.SYSTEM, MemoryLayer.EPISODIC, CONTRADICTION_REF));
                }
            }
        }
        return events;
    }

    static String truncateWithEllipsis(String value, int maxChars) {
        if (value == null) {
            return "";
        }
        if (value.codePointCount(0, value.length()) <= maxChars) {
            return value;
        }
        int end = value.offsetByCodePoints(0, maxChars);
        return value.substring(0, end) + ELLIPSIS;
    }

    private MemoryEvent conversationEvent(MemoryWriteContext writeContext, String slotKey, String value,
            MemorySource source, double confidence, double importance, String sourceRef) {
        return MemoryEvent.builder()
                .entityId(writeContext.entityId())
                .slotKey(slotKey)
                .eventType(MemoryEventType.FACT_ADDED)
                .value(value)
                .source(source)
                .privacyLevel(PrivacyLevel.PRIVATE)
                .layer(MemoryLayer.WORKING)
                .confidence(confidence)
                .importance(importance)
                .sourceKind(SourceKind.CONVERSATION)
                .sourceRef(sourceRef)
                .provenance(MemoryProvenance.sourceReference(source, sourceRef))
                .occurredAt(clock.instant().toString())
                .build();
    }

    private MemoryEvent inferenceEvent(String entityId, String[] payload, MemoryEventType type,
            MemorySource source, MemoryLayer layer, String sourceRef) {
        return MemoryEvent.builder()
                .entityId(entityId)
                .slotKey(payload[0])
                .eventType(type)
                .value(payload[1])
                .source(source)
                .privacyLevel(PrivacyLevel.PRIVATE)
                .layer(layer)
                .confidence(source.getDefaultConfidence())
                .importance(0.5)
                .sourceKind(SourceKind.CONVERSATION)
                .sourceRef(sourceRef)
                .provenance(MemoryProvenance.sourceReference(source, sourceRef))
                .occurredAt(clock.instant().toString())
                .build();
    }

    private void appendAutosave(MemoryEvent event, String label) {
        try {
            MemoryWritePolicy.enforceAgentAutosave(event);
        } catch (RuntimeException e) {
            log.warn("[Memory] Autosave of {} rejected by write policy: {}", label, e.getMessage());
            return;
        }
        try {
            memoryPort.appendEvent(event).join();
        } catch (RuntimeException e) {
            log.warn("[Memory] Autosave of {} failed: {}", label,
                    SecretScrubber.sanitizeError(VerifyFailureAnalyzer.describe(e)));
        }
    }

    private static String[] splitPayload(String payload) {
        int separator = payload.indexOf(PAYLOAD_SEPARATOR);
        if (separator < 0) {
            return null;
        }
        String slotKey = payload.substring(0, separator).strip();
        String value = payload.substring(separator + PAYLOAD_SEPARATOR.length()).strip();
        if (slotKey.isEmpty() || value.isEmpty()) {
            return null;
        }
        return new String[] { slotKey, value };
    }
}
