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

/**
 * Retry caps for one verify/repair loop. Immutable for the loop's lifetime.
 */
public record VerifyRepairCaps(int maxAttempts, int maxRepairDepth) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_MAX_REPAIR_DEPTH = 2;

    public VerifyRepairCaps {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("verify-repair-max-attempts must be >= 1");
        }
        if (maxRepairDepth < 0 || maxRepairDepth >= maxAttempts) {
            throw new IllegalArgumentException(
                    "verify-repair-max-repair-depth must be >= 0 and < verify-repair-max-attempts");
        }
    }

    public static VerifyRepairCaps defaults() {
        return new VerifyRepairCaps(DEFAULT_MAX_ATTEMPTS, DEFAULT_MAX_REPAIR_DEPTH);
    }
}
