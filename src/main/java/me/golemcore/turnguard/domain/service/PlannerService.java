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
import me.golemcore.turnguard.domain.model.Plan;
import me.golemcore.turnguard.domain.model.PlanExecutionReport;
import me.golemcore.turnguard.domain.model.PlanStep;
import me.golemcore.turnguard.domain.model.PlanStepStatus;
import me.golemcore.turnguard.domain.model.ToolExecutionContext;
import me.golemcore.turnguard.infrastructure.config.TurnGuardProperties;
import me.golemcore.turnguard.port.outbound.ChatProviderPort;
import me.golemcore.turnguard.port.outbound.PlanExecutorPort;
import me.golemcore.turnguard.port.outbound.ToolLoopPort;
import me.golemcore.turnguard.security.SecretScrubber;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Planner path for multi-step requests. Every failure returns empty so the
 * caller falls back to the tool loop.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PlannerService {

    static final String PLAN_COMPLETED = "Plan completed.";
    private static final String NO_TOOLS = "(no tools available)";

    private final TurnGuardProperties properties;
    private final ChatProviderPort chatProviderPort;
    private final ToolLoopPort toolLoopPort;
    private final PlanExecutorPort planExecutorPort;
    private final PlanParser planParser;

    public boolean shouldAttempt(String userMessage) {
        return properties.getPlanner().isEnabled() && PlannerHeuristic.looksMultiStep(userMessage);
    }

    /**
     * Generates, parses and executes a plan for the enriched prompt.
     *
     * @return the rendered plan outcome, or empty to fall back
     */
    public Optional<String> tryPlan(String systemPrompt, String enrichedPrompt, String model, double temperature,
            ToolExecutionContext context) {
        String request = buildPlannerRequest(enrichedPrompt, toolLoopPort.availableToolNames(context));

        String raw;
        try {
            raw = chatProviderPort.chatWithSystem(systemPrompt, request, model, temperature).join();
        } catch (RuntimeException e) {
            log.warn("[Planner] Generation failed, falling back to tool loop: {}", describe(e));
            return Optional.empty();
        }

        Plan plan;
        try {
            Optional<String> json = planParser.extractJson(raw);
            if (json.isEmpty()) {
                log.warn("[Planner] No JSON in planner output, falling back to tool loop");
                return Optional.empty();
            }
            plan = planParser.parse(json.get());
        } catch (RuntimeException e) {
            log.warn("[Planner] Plan parse failed, falling back to tool loop: {}", describe(e));
            return Optional.empty();
        }

        int minSteps = properties.getPlanner().getMinSteps();
        if (plan.getSteps().size() < minSteps) {
            log.info("[Planner] Plan has {} steps (< {}), using tool loop", plan.getSteps().size(), minSteps);
            return Optional.empty();
        }

        PlanExecutionReport report;
        try {
            report = planExecutorPort.execute(plan, model, temperature, context).join();
        } catch (RuntimeException e) {
            log.warn("[Planner] Plan execution failed, falling back to tool loop: {}", describe(e));
            return Optional.empty();
        }

        if (report.success()) {
            return Optional.of(plan.finalStepOutput().orElse(PLAN_COMPLETED));
        }
        return Optional.of(renderFailure(plan, report));
    }

    static String buildPlannerRequest(String enrichedPrompt, List<String> toolNames) {
        String tools = toolNames == null || toolNames.isEmpty() ? NO_TOOLS : String.join(", ", toolNames);
        return "You are the planning controller for an autonomous agent. "
                + "Build a DAG plan with at least 3 steps for this task.\n\n"
                + "Available tools: " + tools + "\n\n"
                + PlanParser.SCHEMA_PROMPT + "\n\n"
                + "Task:\n" + enrichedPrompt;
    }

    static String renderFailure(Plan plan, PlanExecutionReport report) {
        List<String> lines = new ArrayList<>();
        lines.add(String.format("Plan execution incomplete (completed=%d, failed=%d, skipped=%d).",
                report.completedSteps().size(), report.failedSteps().size(), report.skippedSteps().size()));
        for (PlanStep step : plan.getSteps()) {
            if (step.getStatus() == PlanStepStatus.FAILED) {
                String error = step.getError() != null ? step.getError() : "unknown failure";
                lines.add("Failed step " + step.getId() + ": " + error);
            }
        }
        return String.join("\n", lines);
    }

    private static String describe(Throwable e) {
        return SecretScrubber.sanitizeError(VerifyFailureAnalyzer.describe(e));
    }
}
