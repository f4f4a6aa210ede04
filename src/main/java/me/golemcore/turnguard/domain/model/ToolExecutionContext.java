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

import me.golemcore.turnguard.ratelimit.EntityRateLimiter;
import me.golemcore.turnguard.security.SecurityPolicy;
import me.golemcore.turnguard.security.TenantPolicyContext;

/**
 * Execution context handed to the tool loop and the plan executor for one turn.
 * The security policy and rate limiter are shared across concurrent turns and
 * are passed explicitly rather than looked up globally.
 */
public record ToolExecutionContext(
        String entityId,
        AutonomyLevel autonomyLevel,
        int maxToolLoopIterations,
        SecurityPolicy securityPolicy,
        EntityRateLimiter rateLimiter,
        TenantPolicyContext tenantPolicyContext) {
}
