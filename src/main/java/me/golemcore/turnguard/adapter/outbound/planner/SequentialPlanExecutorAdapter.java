package me.golemcore.turnguard.adapter.outbound.planner;

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
import me.golemcore.turnguard.domain.model.Plan;
import me.golemcore.turnguard.domain.model.PlanExecutionReport;
import me.golemcore.turnguard.domain.model.PlanStep;
import me.golemcore.turnguard.domain.model.PlanStepAction;
import me.golemcore.turnguard.domain.model.PlanStepStatus;
import me.golemcore.turnguard.domain.model.ToolExecutionContext;
import me.golemcore.turnguard.domain.service.VerifyFailureAnalyzer;
import me.golemcore.turnguard.port.outbound.ChatProviderPort;
import me.golemcore.turnguard.port.outbound.PlanExecutorPort;
import me.golemcore.turnguard.ratelimit.RateLimitResult;
import me.golemcore.turnguard.security.SecretScrubber;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Executes plan steps one at a time in dependency order.
 *
 * <p>
 * Prompt steps call the chat provider with the outputs of their prerequisites.
 * Checkpoint steps complete with their label. Tool calls fail because no tools
 * are registered. A step whose prerequisite failed or was skipped is skipped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SequentialPlanExecutorAdapter implements PlanExecutorPort {

    private final ChatProviderPort chatProviderPort;

    @Override
    public CompletableFuture<PlanExecutionReport> execute(Plan plan, String model, double temperature,
            ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> executeSync(plan, model, temperature, context));
    }

    private PlanExecutionReport executeSync(Plan plan, String model, double temperature,
            ToolExecutionContext context) {
        List<String> completed = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (String stepId : plan.executionOrder()) {
            PlanStep step = plan.findStep(stepId).orElseThrow();
            if (hasUnmetDependency(plan, step)) {
                step.setStatus(PlanStepStatus.SKIPPED);
                skipped.add(stepId);
                continue;
            }

            step.setStatus(PlanStepStatus.RUNNING);
            try {
                step.setOutput(runStep(plan, step, model, temperature, context));
                step.setStatus(PlanStepStatus.COMPLETED);
                completed.add(stepId);
            } catch (RuntimeException e) {
                step.setError(SecretScrubber.sanitizeError(VerifyFailureAnalyzer.describe(e)));
                step.setStatus(PlanStepStatus.FAILED);
                failed.add(stepId);
            }
            log.debug("[Planner] Step {} -> {}", stepId, step.getStatus());
        }

        return new PlanExecutionReport(failed.isEmpty() && skipped.isEmpty(), completed, failed, skipped);
    }

    private String runStep(Plan plan, PlanStep step, String model, double temperature,
            ToolExecutionContext context) {
        PlanStepAction action = step.getAction();
        return switch (action.getKind()) {
        case CHECKPOINT -> action.getLabel() != null ? action.getLabel() : step.getId();
        case TOOL_CALL -> throw new IllegalStateException("no tool registered: " + action.getToolName());
        case PROMPT -> {
            RateLimitResult rate = context.rateLimiter().tryRecord(context.entityId());
            if (!rate.isAllowed()) {
                throw new IllegalStateException("rate limited: " + rate.getReason());
            }
            yield chatProviderPort.chatWithSystem("", buildStepPrompt(plan, step), model, temperature).join();
        }
        };
    }

    static String buildStepPrompt(Plan plan, PlanStep step) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Step: ").append(step.getDescription()).append("\n\n");
        prompt.append("Instruction:\n").append(step.getAction().getText());
        if (!step.getDependsOn().isEmpty()) {
            prompt.append("\n\nResults of prerequisite steps:");
            for (String dependency : step.getDependsOn()) {
                plan.findStep(dependency).ifPresent(prior -> prompt.append("\n- ").append(prior.getId())
                        .append(": ").append(prior.getOutput()));
            }
        }
        return prompt.toString();
    }

    private static boolean hasUnmetDependency(Plan plan, PlanStep step) {
        for (String dependency : step.getDependsOn()) {
            PlanStepStatus status = plan.findStep(dependency).map(PlanStep::getStatus).orElse(PlanStepStatus.FAILED);
            if (status != PlanStepStatus.COMPLETED) {
                return true;
            }
        }
        return false;
    }
}
