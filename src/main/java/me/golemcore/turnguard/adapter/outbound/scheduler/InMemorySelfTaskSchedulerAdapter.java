package me.golemcore.turnguard.adapter.outbound.scheduler;

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
import me.golemcore.turnguard.domain.model.PlanStep;
import me.golemcore.turnguard.domain.model.PlanStepAction;
import me.golemcore.turnguard.domain.model.SelfTaskWriteback;
import me.golemcore.turnguard.infrastructure.config.TurnGuardProperties;
import me.golemcore.turnguard.port.outbound.SelfTaskSchedulerPort;
import me.golemcore.turnguard.security.Rfc3339Timestamps;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Queues persona self tasks as two-step plans (record intent, then
 * checkpoint) until they expire.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InMemorySelfTaskSchedulerAdapter implements SelfTaskSchedulerPort {

    static final String CHECKPOINT_LABEL = "persona-self-task-queued";

    private final TurnGuardProperties properties;
    private final Clock clock;

    private final List<ScheduledSelfTask> queue = new CopyOnWriteArrayList<>();

    /**
     * A queued self task.
     */
    public record ScheduledSelfTask(String personId, String title, Instant expiresAt, int maxAttempts, Plan plan) {
    }

    @Override
    public CompletableFuture<Void> schedule(String personId, List<SelfTaskWriteback> tasks) {
        int maxAttempts = Math.max(1, properties.getAutonomy().getVerifyRepairMaxAttempts());
        for (SelfTaskWriteback task : tasks) {
            Optional<OffsetDateTime> parsed = Rfc3339Timestamps.parse(task.expiresAt());
            if (parsed.isEmpty()) {
                log.warn("[Persona] Skipping self task with invalid expires_at: {}", task.expiresAt());
                continue;
            }
            Instant expiresAt = parsed.get().toInstant();
            queue.add(new ScheduledSelfTask(personId, task.title(), expiresAt, maxAttempts, buildPlan(task)));
            log.info("[Persona] Self task queued: {}", task.title());
        }
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Queued tasks that have not expired yet.
     */
    public List<ScheduledSelfTask> pending() {
        Instant now = clock.instant();
        List<ScheduledSelfTask> pending = new ArrayList<>();
        for (ScheduledSelfTask task : queue) {
            if (task.expiresAt().isAfter(now)) {
                pending.add(task);
            }
        }
        return pending;
    }

    static Plan buildPlan(SelfTaskWriteback task) {
        PlanStep intent = PlanStep.builder()
                .id("step_1")
                .description("record self task intent")
                .action(PlanStepAction.builder()
                        .kind(PlanStepAction.Kind.PROMPT)
                        .text("self-task title=" + task.title() + " instructions=" + task.instructions())
                        .build())
                .build();
        PlanStep checkpoint = PlanStep.builder()
                .id("step_2")
                .description("self task checkpoint")
                .action(PlanStepAction.builder()
                        .kind(PlanStepAction.Kind.CHECKPOINT)
                        .label(CHECKPOINT_LABEL)
                        .build())
                .dependsOn(new ArrayList<>(List.of("step_1")))
                .build();
        return Plan.builder()
                .id("persona-self-task-plan")
                .description("Execute persona-generated self task through planner path")
                .steps(new ArrayList<>(List.of(intent, checkpoint)))
                .build();
    }
}
