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
import me.golemcore.turnguard.domain.model.Plan;
import me.golemcore.turnguard.domain.model.PlanStep;
import me.golemcore.turnguard.domain.model.PlanStepStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts and parses the plan JSON returned by the planner model call.
 */
@Component
@RequiredArgsConstructor
public class PlanParser {

    public static final String SCHEMA_PROMPT = """
            When creating a plan, respond with a JSON object in this exact format:
            {
              "id": "<unique-id>",
              "description": "<plan description>",
              "steps": [
                {
                  "id": "<step-id>",
                  "description": "<what this step does>",
                  "action": <action>,
                  "depends_on": ["<step-ids this depends on>"]
                }
              ]
            }

            Action types:
            - Tool call: { "kind": "tool_call", "tool_name": "<name>", "args": { ... } }
            - Prompt: { "kind": "prompt", "text": "<instruction>" }
            - Checkpoint: { "kind": "checkpoint", "label": "<label>" }

            Steps with no dependencies use "depends_on": [].
            Wrap the JSON in a ```json code fence.""";

    private static final String JSON_FENCE = "```json";
    private static final String PLAIN_FENCE = "```\n{";
    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    /**
     * Locates the plan JSON in raw model output: a {@code ```json} fence, a
     * bare fence opening an object, or else the span from the first
     * {@code '{'} to the last {@code '}'}.
     */
    public Optional<String> extractJson(String text) {
        if (text == null) {
            return Optional.empty();
        }

        int jsonFence = text.indexOf(JSON_FENCE);
        if (jsonFence >= 0) {
            Optional<String> fenced = fencedBody(text, jsonFence + JSON_FENCE.length());
            if (fenced.isPresent()) {
                return fenced;
            }
        }

        int plainFence = text.indexOf(PLAIN_FENCE);
        if (plainFence >= 0) {
            Optional<String> fenced = fencedBody(text, plainFence + FENCE.length() + 1);
            if (fenced.isPresent()) {
                return fenced;
            }
        }

        int open = text.indexOf('{');
        int close = text.lastIndexOf('}');
        if (open >= 0 && close > open) {
            return Optional.of(text.substring(open, close + 1));
        }
        return Optional.empty();
    }

    /**
     * Parses and validates a plan. Every step starts {@code PENDING}.
     *
     * @throws IllegalArgumentException
     *             if the JSON is malformed or the steps do not form a valid DAG
     */
    public Plan parse(String json) {
        Plan plan;
        try {
            plan = objectMapper.readValue(json, Plan.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid plan JSON: " + e.getOriginalMessage(), e);
        }
        if (plan == null || plan.getSteps() == null || plan.getSteps().isEmpty()) {
            throw new IllegalArgumentException("plan must have at least one step");
        }

        Set<String> ids = new HashSet<>();
        for (PlanStep step : plan.getSteps()) {
            if (step == null) {
                throw new IllegalArgumentException("plan step cannot be null");
            }
            if (step.getId() == null || step.getId().isBlank()) {
                throw new IllegalArgumentException("plan step id cannot be empty");
            }
            if (!ids.add(step.getId())) {
                throw new IllegalArgumentException("duplicate plan step id: " + step.getId());
            }
            if (step.getAction() == null || step.getAction().getKind() == null) {
                throw new IllegalArgumentException("plan step " + step.getId() + " has no action");
            }
            if (step.getDependsOn() == null) {
                step.setDependsOn(new ArrayList<>());
            } else if (step.getDependsOn().stream().anyMatch(dependency -> dependency == null)) {
                throw new IllegalArgumentException("plan step " + step.getId() + " has a null dependency");
            }
            step.setStatus(PlanStepStatus.PENDING);
            step.setOutput(null);
            step.setError(null);
        }
        plan.executionOrder();
        return plan;
    }

    private Optional<String> fencedBody(String text, int bodyStart) {
        int end = text.indexOf(FENCE, bodyStart);
        if (end < 0) {
            return Optional.empty();
        }
        String candidate = text.substring(bodyStart, end).trim();
        return candidate.isEmpty() ? Optional.empty() : Optional.of(candidate);
    }
}
