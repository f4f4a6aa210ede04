package me.golemcore.turnguard.ratelimit;

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
import me.golemcore.turnguard.infrastructure.config.TurnGuardProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hourly action limiter with two tiers:
 * <ul>
 * <li><b>Global</b> - all actions across entities
 * ({@code turnguard.autonomy.max-actions-per-hour})</li>
 * <li><b>Entity</b> - actions per entity id
 * ({@code turnguard.autonomy.max-actions-per-entity-per-hour})</li>
 * </ul>
 *
 * <p>
 * Shared by every concurrent turn and handed to the tool loop through the
 * execution context. Maintains one {@link ActionTracker} per entity in a
 * concurrent map.
 *
 * @since 1.0
 * @see ActionTracker
 */
@Component
@Slf4j
public class EntityRateLimiter {

    private static final Duration WINDOW = Duration.ofHours(1);

    private final Clock clock;
    private final int maxActionsPerHour;
    private final int maxActionsPerEntityPerHour;
    private final ActionTracker globalTracker;
    private final Map<String, ActionTracker> entityTrackers = new ConcurrentHashMap<>();

    @Autowired
    public EntityRateLimiter(TurnGuardProperties properties, Clock clock) {
        this(clock, properties.getAutonomy().getMaxActionsPerHour(),
                properties.getAutonomy().getMaxActionsPerEntityPerHour());
    }

    public EntityRateLimiter(Clock clock, int maxActionsPerHour, int maxActionsPerEntityPerHour) {
        this.clock = clock;
        this.maxActionsPerHour = maxActionsPerHour;
        this.maxActionsPerEntityPerHour = maxActionsPerEntityPerHour;
        this.globalTracker = new ActionTracker(clock, WINDOW);
    }

    /**
     * Record one action for the entity. The global tier is checked first; a
     * globally denied action is not charged to the entity.
     */
    public RateLimitResult tryRecord(String entityId) {
        int globalCount = globalTracker.record();
        if (globalCount > maxActionsPerHour) {
            log.debug("[RateLimit] Global action limit exceeded: {}/{}", globalCount, maxActionsPerHour);
            return RateLimitResult.denied(RateLimitResult.Scope.GLOBAL, "global action limit exceeded");
        }

        ActionTracker entityTracker = entityTrackers.computeIfAbsent(entityId,
                key -> new ActionTracker(clock, WINDOW));
        int entityCount = entityTracker.record();
        if (entityCount > maxActionsPerEntityPerHour) {
            log.debug("[RateLimit] Entity action limit exceeded for {}: {}/{}", entityId, entityCount,
                    maxActionsPerEntityPerHour);
            return RateLimitResult.denied(RateLimitResult.Scope.ENTITY, "entity action limit exceeded");
        }

        int remaining = Math.min(maxActionsPerHour - globalCount, maxActionsPerEntityPerHour - entityCount);
        return RateLimitResult.allowed(remaining);
    }

    public int globalCount() {
        return globalTracker.count();
    }

    public int entityCount(String entityId) {
        ActionTracker tracker = entityTrackers.get(entityId);
        return tracker == null ? 0 : tracker.count();
    }
}
