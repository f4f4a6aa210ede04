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

import lombok.Builder;
import lombok.Data;

/**
 * Result of a rate limit check.
 *
 * <p>
 * Factory methods {@link #allowed(int)} and {@link #denied(Scope, String)}
 * provide convenient result construction.
 *
 * @since 1.0
 */
@Data
@Builder
public class RateLimitResult {

    private boolean allowed;
    private int remainingActions;
    private Scope deniedScope;
    private String reason;

    public enum Scope {
        GLOBAL, ENTITY
    }

    public static RateLimitResult allowed(int remaining) {
        return RateLimitResult.builder()
                .allowed(true)
                .remainingActions(remaining)
                .build();
    }

    public static RateLimitResult denied(Scope scope, String reason) {
        return RateLimitResult.builder()
                .allowed(false)
                .remainingActions(0)
                .deniedScope(scope)
                .reason(reason)
                .build();
    }
}
