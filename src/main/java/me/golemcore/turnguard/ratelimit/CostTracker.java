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

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Thread-safe per-day spend tracker in cents. The running total resets when
 * the UTC day changes.
 *
 * @since 1.0
 */
public class CostTracker {

    private final Clock clock;
    private LocalDate day;
    private long spentCents;

    public CostTracker(Clock clock) {
        this.clock = clock;
        this.day = today();
    }

    /**
     * Try to record additional spend against the daily cap.
     *
     * <p>
     * A zero-cost record is allowed while today's spend is within the cap. A
     * positive cost is allowed only if the new total stays within the cap, and
     * is not recorded otherwise.
     *
     * @return whether the spend fits in today's budget
     */
    public synchronized boolean record(long additionalCents, long maxCentsPerDay) {
        rolloverIfNeeded();
        if (additionalCents == 0) {
            return spentCents <= maxCentsPerDay;
        }
        if (spentCents + additionalCents > maxCentsPerDay) {
            return false;
        }
        spentCents += additionalCents;
        return true;
    }

    public synchronized long spentToday() {
        rolloverIfNeeded();
        return spentCents;
    }

    private void rolloverIfNeeded() {
        LocalDate current = today();
        if (!current.equals(day)) {
            day = current;
            spentCents = 0;
        }
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
