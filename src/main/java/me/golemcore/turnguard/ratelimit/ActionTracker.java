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
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Thread-safe sliding-window action counter.
 *
 * <p>
 * Keeps the timestamps of recorded actions and evicts those older than the
 * window on every access. Methods are synchronized so concurrent turns see a
 * consistent count.
 *
 * @since 1.0
 */
public class ActionTracker {

    private final Clock clock;
    private final Duration window;
    private final Deque<Instant> actions = new ArrayDeque<>();

    public ActionTracker(Clock clock, Duration window) {
        this.clock = clock;
        this.window = window;
    }

    /**
     * Record an action and return the number of actions in the current window,
     * including this one.
     */
    public synchronized int record() {
        Instant now = clock.instant();
        evictExpired(now);
        actions.addLast(now);
        return actions.size();
    }

    /**
     * Number of actions in the current window, without recording.
     */
    public synchronized int count() {
        evictExpired(clock.instant());
        return actions.size();
    }

    private void evictExpired(Instant now) {
        Instant cutoff = now.minus(window);
        while (!actions.isEmpty() && !actions.peekFirst().isAfter(cutoff)) {
            actions.pollFirst();
        }
    }
}
