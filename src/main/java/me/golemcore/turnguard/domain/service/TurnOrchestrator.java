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
import me.golemcore.turnguard.domain.model.AutonomyLevel;
import me.golemcore.turnguard.domain.model.CallBudgetExceededException;
import me.golemcore.turnguard.domain.model.ToolExecutionContext;
import me.golemcore.turnguard.domain.model.ToolLoopResult;
import me.golemcore.turnguard.domain.model.ToolLoopStopReason;
import me.golemcore.turnguard.domain.model.TurnCallAccounting;
import me.golemcore.turnguard.domain.model.TurnExecutionException;
import me.golemcore.turnguard.domain.model.TurnOutcome;
import me.golemcore.turnguard.domain.model.TurnPolicyDeniedException;
import me.golemcore.turnguard.domain.model.TurnRequest;
import me.golemcore.turnguard.infrastructure.config.TurnGuardProperties;
import me.golemcore.turnguard.port.outbound.ContextBuilderPort;
import me.golemcore.turnguard.port.outbound.ToolLoopPort;
import me.golemcore.turnguard.ratelimit.EntityRateLimiter;
import me.golemcore.turnguard.security.MemoryWriteContext;
import me.golemcore.turnguard.security.SecretScrubber;
import me.golemcore.turnguard.security.SecurityPolicy;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Executes a single turn attempt.
 *
 * <p>
 * Order of operations:
 * <ol>
 * <li>enforce write scope (fails before any memory write or model call)</li>
 * <li>autosave the inbound message</li>
 * <li>build the enriched prompt (context failure degrades to no context)</li>
 * <li>enforce intent policy and consume the answer call</li>
 * <li>clamp temperature to the autonomy band</li>
 * <li>answer via the planner or the tool loop</li>
 * <li>optional reflect/writeback</li>
 * <li>autosave the response, run inference and dispatch consolidation</li>
 * </ol>
 *
 * <p>
 * Each call gets fresh {@link TurnCallAccounting}. Retries are the job of
 * {@link VerifyRepairController}; nothing here is retried.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TurnOrchestrator {

    private final TurnGuardProperties properties;
    private final SecurityPolicy securityPolicy;
    private final EntityRateLimiter entityRateLimiter;
    private final ContextBuilderPort contextBuilderPort;
    private final ToolLoopPort toolLoopPort;
    private final PlannerService plannerService;
    private final ReflectWritebackService reflectWritebackService;
    private final MemoryWriteService memoryWriteService;
    private final ConsolidationDispatcher consolidationDispatcher;

    public TurnOutcome executeTurn(TurnRequest request, MemoryWriteContext writeContext) {
        boolean reflectEnabled = properties.getPersona().isEnabledMainSession();
        TurnCallAccounting accounting = TurnCallAccounting.forTurn(reflectEnabled);
        writeContext.enforceWriteScope();

        String userMessage = request.getUserMessage();
        memoryWriteService.saveUserMessage(writeContext, userMessage);

        String enriched = buildEnrichedMessage(writeContext, userMessage);

        securityPolicy.consumeActionAndCost(0);
        accounting.consumeAnswerCall();

        AutonomyLevel level = securityPolicy.effectiveAutonomyLevel();
        double temperature = securityPolicy.clampTemperature(requestedTemperature(request));
        String model = resolveModel(request);
        String systemPrompt = request.getSystemPrompt() != null ? request.getSystemPrompt() : "";
        ToolExecutionContext context = new ToolExecutionContext(
                writeContext.entityId(),
                level,
                properties.getAutonomy().getMaxToolLoopIterations(),
                securityPolicy,
                entityRateLimiter,
                writeContext.policyContext());

        Optional<String> planned = Optional.empty();
        if (plannerService.shouldAttempt(userMessage)) {
            planned = plannerService.tryPlan(systemPrompt, enriched, model, temperature, context);
        }

        String response;
        if (planned.isPresent()) {
            log.info("[Planner] Planner path selected for entity {}", writeContext.entityId());
            response = planned.get();
        } else {
            response = runToolLoop(systemPrompt, enriched, model, temperature, context);
        }

        if (reflectEnabled) {
            runReflect(accounting, userMessage, response, model);
        }

        if (memoryWriteService.isAutoSaveEnabled()) {
            saveResponseAndConsolidate(writeContext, userMessage, response);
        }

        if (log.isDebugEnabled()) {
            log.debug("[Turn] Finished: entity={}, planner={}, calls={}/{}, rate_limited={}, spent_today_cents={}",
                    writeContext.entityId(), planned.isPresent(),
                    accounting.getAnswerCalls() + accounting.getReflectCalls(), accounting.getBudgetLimit(),
                    securityPolicy.isRateLimited(), securityPolicy.spentTodayCents());
        }
        return new TurnOutcome(response, planned.isPresent(), accounting);
    }

    private String buildEnrichedMessage(MemoryWriteContext writeContext, String userMessage) {
        String memoryContext;
        try {
            memoryContext = contextBuilderPort
                    .buildContext(writeContext.entityId(), userMessage, writeContext.policyContext())
                    .join();
        } catch (RuntimeException e) {
            log.warn("[Memory] Context build failed, continuing without context: {}",
                    SecretScrubber.sanitizeError(VerifyFailureAnalyzer.describe(e)));
            memoryContext = "";
        }
        if (memoryContext == null || memoryContext.isEmpty()) {
            return userMessage;
        }
        return memoryContext + userMessage;
    }

    private String runToolLoop(String systemPrompt, String enriched, String model, double temperature,
            ToolExecutionContext context) {
        ToolLoopResult result;
        try {
            result = toolLoopPort.run(systemPrompt, enriched, model, temperature, context).join();
        } catch (CompletionException e) {
            throw asTurnFailure(e.getCause() != null ? e.getCause() : e);
        } catch (RuntimeException e) {
            throw asTurnFailure(e);
        }
        log.debug("[Turn] Tool loop finished: entity={}, iterations={}, stop={}", context.entityId(),
                result.iterations(), result.stopReason().kind());
        handleStopReason(result);
        return result.finalText();
    }

    private static RuntimeException asTurnFailure(Throwable error) {
        if (error instanceof TurnPolicyDeniedException || error instanceof CallBudgetExceededException) {
            return (RuntimeException) error;
        }
        return new TurnExecutionException("tool loop failed: " + VerifyFailureAnalyzer.describe(error), error);
    }

    private void handleStopReason(ToolLoopResult result) {
        ToolLoopStopReason stop = result.stopReason();
        switch (stop.kind()) {
        case COMPLETED -> log.debug("[Turn] Tool loop completed");
        case MAX_ITERATIONS -> log.warn("[Turn] Tool loop hit max iterations ({})", result.iterations());
        case RATE_LIMITED -> log.warn("[Turn] Tool loop halted by rate limiter");
        case APPROVAL_DENIED -> log.warn("[Turn] Tool loop halted by approval requirement");
        case HOOK_BLOCKED -> log.warn("[Turn] Tool loop halted by hook: {}", stop.detail());
        case ERROR -> throw new TurnExecutionException("tool loop failed: " + stop.detail());
        default -> throw new IllegalStateException("Unknown stop reason: " + stop.kind());
        }
    }

    private void runReflect(TurnCallAccounting accounting, String userMessage, String response, String model) {
        securityPolicy.consumeActionAndCost(0);
        accounting.consumeReflectCall();
        try {
            reflectWritebackService.reflect(userMessage, response, model);
        } catch (RuntimeException e) {
            log.warn("[Persona] Reflect/writeback failed; answer path preserved: {}",
                    SecretScrubber.sanitizeError(VerifyFailureAnalyzer.describe(e)));
        }
    }

    private void saveResponseAndConsolidate(MemoryWriteContext writeContext, String userMessage,
            String response) {
        memoryWriteService.saveAssistantResponse(writeContext, response);
        try {
            memoryWriteService.runInferencePass(writeContext, response);
        } catch (RuntimeException e) {
            log.warn("[Memory] Post-turn inference pass failed: {}",
                    SecretScrubber.sanitizeError(VerifyFailureAnalyzer.describe(e)));
        }
        consolidationDispatcher.dispatch(writeContext.entityId(), userMessage, response);
    }

    private double requestedTemperature(TurnRequest request) {
        return request.getTemperature() != null ? request.getTemperature() : properties.getModel().getTemperature();
    }

    private String resolveModel(TurnRequest request) {
        String model = request.getModel();
        return model != null && !model.isBlank() ? model : properties.getModel().getName();
    }
}
