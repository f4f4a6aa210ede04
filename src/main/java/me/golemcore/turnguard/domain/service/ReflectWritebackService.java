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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.turnguard.domain.model.ImmutableStateHeader;
import me.golemcore.turnguard.domain.model.MemoryEvent;
import me.golemcore.turnguard.domain.model.MemoryEventType;
import me.golemcore.turnguard.domain.model.MemoryProvenance;
import me.golemcore.turnguard.domain.model.MemorySource;
import me.golemcore.turnguard.domain.model.PersonaStateHeader;
import me.golemcore.turnguard.domain.model.PrivacyLevel;
import me.golemcore.turnguard.domain.model.SourceKind;
import me.golemcore.turnguard.domain.model.TurnGuardException;
import me.golemcore.turnguard.domain.model.WritebackGuardVerdict;
import me.golemcore.turnguard.domain.model.WritebackPayload;
import me.golemcore.turnguard.infrastructure.config.TurnGuardProperties;
import me.golemcore.turnguard.port.outbound.ChatProviderPort;
import me.golemcore.turnguard.port.outbound.MemoryPort;
import me.golemcore.turnguard.port.outbound.PersonaStatePort;
import me.golemcore.turnguard.port.outbound.SelfTaskSchedulerPort;
import me.golemcore.turnguard.security.MemoryWritePolicy;
import me.golemcore.turnguard.security.WritebackGuard;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Reflect/writeback stage run after the answer is produced.
 *
 * <p>
 * Asks the reflect provider for a strict JSON writeback payload, validates it
 * with {@link WritebackGuard} against the immutable fields of the current
 * canonical state, then persists the merged state header and appends
 * {@code memory_append} entries. Any exception thrown here is a reflect
 * failure; the caller logs it and keeps the answer.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReflectWritebackService {

    static final double REFLECT_TEMPERATURE = 0.0;
    static final String MEMORY_APPEND_PROVENANCE = "persona.reflect.memory_append";
    static final String MEMORY_APPEND_SOURCE_REF_PREFIX = "persona-reflect-memory-append:";

    static final String SYSTEM_PROMPT = """
            You are a deterministic reflection/writeback stage.
            Output must be a single strict JSON object, with no markdown and no extra text.

            Required top-level shape:
            {
              "state_header": {
                "identity_principles_hash": string,
                "safety_posture": string,
                "current_objective": string,
                "open_loops": string[],
                "next_actions": string[],
                "commitments": string[],
                "recent_context_summary": string,
                "last_updated_at": string (RFC3339)
              },
              "memory_append": string[]
            }

            Do not include unknown keys.
            Do not change immutable fields.
            If uncertain, keep mutable values close to current state.""";

    private final TurnGuardProperties properties;
    private final ChatProviderPort chatProviderPort;
    private final PersonaStatePort personaStatePort;
    private final MemoryPort memoryPort;
    private final SelfTaskSchedulerPort selfTaskSchedulerPort;
    private final WritebackGuard writebackGuard;
    private final ObjectMapper objectMapper;

    /**
     * Runs reflect/writeback for one turn.
     *
     * @return {@code true} if a new canonical state was persisted
     */
    public boolean reflect(String userMessage, String answer, String model) {
        String personId = properties.getPersona().getPersonId();
        Optional<PersonaStateHeader> canonical = personaStatePort.loadCanonical(personId).join();

        String raw = chatProviderPort
                .chatWithSystem(SYSTEM_PROMPT, buildReflectMessage(canonical.orElse(null), userMessage, answer),
                        model, REFLECT_TEMPERATURE)
                .join();
        JsonNode payload = parsePayload(raw);

        if (canonical.isEmpty()) {
            log.warn("[Persona] Reflect produced a payload but no canonical state header exists");
            return false;
        }
        PersonaStateHeader previous = canonical.get();
        ImmutableStateHeader immutable = ImmutableStateHeader.from(previous);

        WritebackGuardVerdict verdict = writebackGuard.validate(payload, immutable, extensions());
        if (verdict instanceof WritebackGuardVerdict.Rejected rejected) {
            log.warn("[Persona] Writeback rejected by guard: {}", rejected.reason());
            return false;
        }
        WritebackPayload accepted = ((WritebackGuardVerdict.Accepted) verdict).payload();

        PersonaStateHeader candidate = PersonaStateHeader.fromWriteback(immutable, accepted.stateHeader());
        PersonaStateValidator.validateWritebackCandidate(previous, candidate);
        personaStatePort.persistAndSync(personId, candidate).join();
        log.info("[Persona] Canonical state header updated for person {}", personId);

        appendMemoryEntries(personId, accepted.memoryAppend(), candidate.getLastUpdatedAt());

        if (!accepted.selfTasks().isEmpty()) {
            selfTaskSchedulerPort.schedule(personId, accepted.selfTasks()).join();
        }
        if (accepted.styleProfile() != null) {
            log.info("[Persona] Style profile accepted: {}", accepted.styleProfile());
        }
        return true;
    }

    String buildReflectMessage(PersonaStateHeader canonical, String userMessage, String answer) {
        String canonicalJson;
        if (canonical == null) {
            canonicalJson = "null";
        } else {
            try {
                canonicalJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(canonical);
            } catch (JsonProcessingException e) {
                throw new TurnGuardException("Failed to serialize canonical state header", e);
            }
        }
        return "Current canonical state header (JSON):\n" + canonicalJson
                + "\n\nLatest user message:\n" + userMessage
                + "\n\nLatest assistant answer:\n" + answer
                + "\n\nReturn only the strict JSON payload.";
    }

    private JsonNode parsePayload(String raw) {
        JsonNode payload;
        try {
            payload = objectMapper.readTree(raw == null ? "" : raw.trim());
        } catch (JsonProcessingException e) {
            throw new TurnGuardException("Failed to parse reflect payload JSON", e);
        }
        if (payload == null || !payload.isObject()) {
            throw new TurnGuardException("reflect output must be a JSON object");
        }
        return payload;
    }

    private void appendMemoryEntries(String personId, List<String> entries, String occurredAt) {
        for (int i = 0; i < entries.size(); i++) {
            MemoryEvent event = MemoryEvent.builder()
                    .entityId(MemoryWritePolicy.personEntityId(personId))
                    .slotKey(MemoryWritePolicy.SLOT_PERSONA_WRITEBACK_PREFIX + i)
                    .eventType(MemoryEventType.SUMMARY_COMPACTED)
                    .value(entries.get(i))
                    .source(MemorySource.SYSTEM)
                    .privacyLevel(PrivacyLevel.PRIVATE)
                    .confidence(0.9)
                    .importance(0.8)
                    .sourceKind(SourceKind.MANUAL)
                    .sourceRef(MEMORY_APPEND_SOURCE_REF_PREFIX + i)
                    .provenance(MemoryProvenance.sourceReference(MemorySource.SYSTEM, MEMORY_APPEND_PROVENANCE))
                    .occurredAt(occurredAt)
                    .build();
            MemoryWritePolicy.enforcePersonaWriteback(event, personId);
            memoryPort.appendEvent(event).join();
        }
    }

    private WritebackGuard.Extensions extensions() {
        TurnGuardProperties.PersonaProperties persona = properties.getPersona();
        return new WritebackGuard.Extensions(persona.isSelfTasksEnabled(), persona.isStyleProfileEnabled());
    }
}
