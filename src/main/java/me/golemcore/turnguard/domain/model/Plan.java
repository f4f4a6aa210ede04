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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Multi-step plan produced by the planner. Step statuses and outputs are
 * updated in place by the plan executor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Plan {

    private String id;
    private String description;

    @Builder.Default
    private List<PlanStep> steps = new ArrayList<>();

    /**
     * Output of the last step that completed, if any.
     */
    public Optional<String> finalStepOutput() {
        for (int i = steps.size() - 1; i >= 0; i--) {
            PlanStep step = steps.get(i);
            if (step.getStatus() == PlanStepStatus.COMPLETED && step.getOutput() != null) {
                return Optional.of(step.getOutput());
            }
        }
        return Optional.empty();
    }

    /**
     * Step ids in dependency order. Ties keep declaration order.
     *
     * @throws IllegalArgumentException
     *             if a dependency is unknown or the steps form a cycle
     */
    public List<String> executionOrder() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (PlanStep step : steps) {
            inDegree.put(step.getId(), 0);
            dependents.put(step.getId(), new ArrayList<>());
        }
        for (PlanStep step : steps) {
            for (String dependency : step.getDependsOn()) {
                if (!inDegree.containsKey(dependency)) {
                    throw new IllegalArgumentException(
                            "plan step " + step.getId() + " depends on unknown step " + dependency);
                }
                dependents.get(dependency).add(step.getId());
                inDegree.merge(step.getId(), 1, Integer::sum);
            }
        }

        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });

        List<String> order = new ArrayList<>(steps.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String dependent : dependents.get(id)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (order.size() != steps.size()) {
            throw new IllegalArgumentException("cycle detected in plan steps");
        }
        return order;
    }

    public Optional<PlanStep> findStep(String stepId) {
        return steps.stream().filter(step -> step.getId().equals(stepId)).findFirst();
    }
}
