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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.turnguard.domain.model.CallBudgetExceededException;
import me.golemcore.turnguard.domain.model.EscalationReason;
import me.golemcore.turnguard.domain.model.FailureClass;
import me.golemcore.turnguard.domain.model.MemoryEvent;
import me.golemcore.turnguard.domain.model.MemoryEventType;
import me.golemcore.turnguard.domain.model.MemoryProvenance;
import me.golemcore.turnguard.domain.model.MemorySource;
import me.golemcore.turnguard.domain.model.PrivacyLevel;
import me.golemcore.turnguard.domain.model.SourceKind;
import me.golemcore.turnguard.domain.model.TurnPolicyDeniedException;
import me.golemcore.turnguard.domain.model.VerifyFailureAnalysis;
import me.golemcore.turnguard.domain.model.VerifyRepairCaps;
import me.golemcore.turnguard.domain.model.VerifyRepairEscalatedException;
import me.golemcore.turnguard.domain.model.VerifyRepairEscalation;
import me.golemcore.turnguard.infrastructure.config.TurnGuardProperties;
import me.golemcore.turnguard.port.outbound.MemoryPort;
import me.golemcore.turnguard.security.MemoryWriteContext;
import me.golemcore.turnguard.security.MemoryWritePolicy;
import me.golemcore.turnguard.security.SecretScrubber;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs a whole turn under the verify/repair policy.
 *
 * <p>
 * Attempts are strictly sequential. Write-scope denials and call budget
 * overruns are fatal and propagate unchanged from the attempt that raised
 * them. Any other failure is classified by {@link VerifyFailureAnalyzer} and
 * the loop either retries the whole turn or escalates. Action and cost limit
 * denials classify as non-retryable policy limits, so they escalate on the
 * attempt that hit them. Escalation checks, in order: attempts exhausted,
 * repair depth exhausted, failure not retryable. On escalation an audit event
 * is appended to memory on a best-effort basis, then
 * {@link VerifyRepairEscalatedException} is thrown.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class VerifyRepairController {

    static final String ESCALATION_SOURCE_REF = "verify-repair.escalation";

    private final TurnGuardProperties properties;
    private final MemoryPort memoryPort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Run {@code attempt} until it succeeds or the loop escalates. Caps are read
     * from configuration once per call.
     */
    public <T> T run(MemoryWriteContext writeContext, Supplier<T> attempt) {
        TurnGuardProperties.AutonomyProperties autonomy = properties.getAutonomy();
        VerifyRepairCaps caps = new VerifyRepairCaps(autonomy.getVerifyRepairMaxAttempts(),
                autonomy.getVerifyRepairMaxRepairDepth());
        return run(writeContext, caps, attempt);
    }

    public <T> T run(MemoryWriteContext writeContext, VerifyRepairCaps caps, Supplier<T> attempt) {
        int attempts = 0;
        int repairDepth = 0;

        while (true) {
            attempts++;
            try {
                return attempt.get();
            } catch (CallBudgetExceededException e) {
                throw fatal(attempts, e);
            } catch (RuntimeException e) {
                VerifyFailureAnalysis analysis = VerifyFailureAnalyzer.analyze(e);
                if (e instanceof TurnPolicyDeniedException && analysis.failureClass() != FailureClass.POLICY_LIMIT) {
                    throw fatal(attempts, e);
                }
                Optional<VerifyRepairEscalation> escalation = decide(caps, attempts, repairDepth, analysis, e);
                if (escalation.isPresent()) {
                    VerifyRepairEscalation escalated = escalation.get();
                    log.warn("[VerifyRepair] Escalating turn: {}", escalated.toContractMessage());
                    emitEscalationEvent(writeContext, escalated);
                    throw new VerifyRepairEscalatedException(escalated, e);
                }

                repairDepth++;
                log.warn("[VerifyRepair] Retrying turn: attempt={}/{}, repair_depth={}/{}, failure_class={}, error={}",
                        attempts, caps.maxAttempts(), repairDepth, caps.maxRepairDepth(),
                        analysis.failureClass().getCode(),
                        SecretScrubber.sanitizeError(VerifyFailureAnalyzer.describe(e)));
            }
        }
    }

    private static RuntimeException fatal(int attempts, RuntimeException error) {
        log.warn("[VerifyRepair] Fatal turn failure on attempt {}: {}", attempts,
                SecretScrubber.sanitizeError(error.getMessage()));
        return error;
    }

    /**
     * Escalation decision for one failed attempt, or empty to retry.
     */
    public static Optional<VerifyRepairEscalation> decide(VerifyRepairCaps caps, int attempts, int repairDepth,
            VerifyFailureAnalysis analysis, Throwable lastError) {
        EscalationReason reason;
        if (attempts >= caps.maxAttempts()) {
            reason = EscalationReason.MAX_ATTEMPTS_REACHED;
        } else if (repairDepth >= caps.maxRepairDepth()) {
            reason = EscalationReason.MAX_REPAIR_DEPTH_REACHED;
        } else if (!analysis.retryable()) {
            reason = EscalationReason.NON_RETRYABLE_FAILURE;
        } else {
            return Optional.empty();
        }

        return Optional.of(new VerifyRepairEscalation(
                reason,
                attempts,
                repairDepth,
                caps.maxAttempts(),
                caps.maxRepairDepth(),
                analysis.failureClass(),
                SecretScrubber.sanitizeError(VerifyFailureAnalyzer.describe(lastError))));
    }

    private void emitEscalationEvent(MemoryWriteContext writeContext, VerifyRepairEscalation escalation) {
        if (!writeContext.policyContext().allows(writeContext.entityId())) {
            log.warn("[VerifyRepair] Escalation audit skipped: entity outside tenant write scope");
            return;
        }

        String content;
        try {
            content = objectMapper.writeValueAsString(escalation.toAuditFields());
        } catch (JsonProcessingException e) {
            log.warn("[VerifyRepair] Failed to serialize escalation audit event: {}", e.getMessage());
            return;
        }

        MemoryEvent event = MemoryEvent.builder()
                .entityId(writeContext.entityId())
                .slotKey(MemoryWritePolicy.SLOT_VERIFY_REPAIR_ESCALATION)
                .eventType(MemoryEventType.SUMMARY_COMPACTED)
                .value(content)
                .source(MemorySource.SYSTEM)
                .privacyLevel(PrivacyLevel.PRIVATE)
                .confidence(1.0)
                .importance(0.9)
                .sourceKind(SourceKind.MANUAL)
                .sourceRef(ESCALATION_SOURCE_REF)
                .provenance(MemoryProvenance.sourceReference(MemorySource.SYSTEM, ESCALATION_SOURCE_REF))
                .occurredAt(clock.instant().toString())
                .build();

        try {
            MemoryWritePolicy.enforceVerifyRepairEscalation(event);
            memoryPort.appendEvent(event).join();
        } catch (RuntimeException e) {
            log.warn("[VerifyRepair] Failed to emit escalation audit event: {}",
                    SecretScrubber.sanitizeError(VerifyFailureAnalyzer.describe(e)));
        }
    }
}
