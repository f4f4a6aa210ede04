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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.turnguard.domain.model.AutonomyLevel;
import me.golemcore.turnguard.domain.model.TemperatureBand;
import me.golemcore.turnguard.domain.model.TurnPolicyDeniedException;
import me.golemcore.turnguard.domain.service.TemperatureClamp;
import me.golemcore.turnguard.infrastructure.config.TurnGuardProperties;
import me.golemcore.turnguard.ratelimit.ActionTracker;
import me.golemcore.turnguard.ratelimit.CostTracker;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Shared security policy consulted by every turn.
 *
 * <p>
 * Enforces the hourly action limit and the daily cost limit, and exposes the
 * effective autonomy level together with its temperature band. One instance is
 * shared by all concurrent turns; the trackers are internally synchronized.
 *
 * <p>
 * When {@code turnguard.autonomy.rollout.enabled} is set, the effective
 * autonomy level is the less trusted of the configured level and the rollout
 * stage.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class SecurityPolicy {

    public static final String ACTION_LIMIT_EXCEEDED = "blocked by security policy: action limit exceeded";
    public static final String COST_LIMIT_EXCEEDED = "blocked by security policy: daily cost limit exceeded";

    private final TemperatureClamp temperatureClamp;
    private final AutonomyLevel effectiveAutonomyLevel;
    private final int maxActionsPerHour;
    private final long maxCostPerDayCents;
    private final ActionTracker actionTracker;
    private final CostTracker costTracker;

    public SecurityPolicy(TurnGuardProperties properties, TemperatureClamp temperatureClamp, Clock clock) {
        TurnGuardProperties.AutonomyProperties autonomy = properties.getAutonomy();
        this.temperatureClamp = temperatureClamp;
        this.effectiveAutonomyLevel = resolveEffectiveLevel(autonomy);
        this.maxActionsPerHour = autonomy.getMaxActionsPerHour();
        this.maxCostPerDayCents = autonomy.getMaxCostPerDayCents();
        this.actionTracker = new ActionTracker(clock, Duration.ofHours(1));
        this.costTracker = new CostTracker(clock);
    }

    /**
     * Record one action and its estimated cost.
     *
     * @throws TurnPolicyDeniedException
     *             if the hourly action limit or the daily cost limit is exceeded
     */
    public void consumeActionAndCost(long estimatedCostCents) {
        int count = actionTracker.record();
        if (count > maxActionsPerHour) {
            log.warn("[Security] Action limit exceeded: {}/{} per hour", count, maxActionsPerHour);
            throw new TurnPolicyDeniedException(ACTION_LIMIT_EXCEEDED);
        }
        if (!costTracker.record(estimatedCostCents, maxCostPerDayCents)) {
            log.warn("[Security] Daily cost limit exceeded: spent={} cap={} cents", costTracker.spentToday(),
                    maxCostPerDayCents);
            throw new TurnPolicyDeniedException(COST_LIMIT_EXCEEDED);
        }
    }

    public AutonomyLevel effectiveAutonomyLevel() {
        return effectiveAutonomyLevel;
    }

    public TemperatureBand selectedTemperatureBand() {
        return temperatureClamp.bandFor(effectiveAutonomyLevel);
    }

    public double clampTemperature(double requested) {
        return temperatureClamp.clamp(requested, effectiveAutonomyLevel);
    }

    public boolean isRateLimited() {
        return actionTracker.count() >= maxActionsPerHour;
    }

    public long spentTodayCents() {
        return costTracker.spentToday();
    }

    private static AutonomyLevel resolveEffectiveLevel(TurnGuardProperties.AutonomyProperties autonomy) {
        AutonomyLevel level = AutonomyLevel.fromConfig(autonomy.getLevel());
        TurnGuardProperties.RolloutProperties rollout = autonomy.getRollout();
        if (rollout.isEnabled() && rollout.getStage() != null && !rollout.getStage().isBlank()) {
            return AutonomyLevel.min(level, AutonomyLevel.fromConfig(rollout.getStage()));
        }
        return level;
    }
}
