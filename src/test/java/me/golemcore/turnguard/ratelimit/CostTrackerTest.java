package me.golemcore.turnguard.ratelimit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import static org.junit.jupiter.api.Assertions.*;

class CostTrackerTest {

    private AtomicReference<Instant> now;
    private CostTracker tracker;

    @BeforeEach
    void setUp() {
        now = new AtomicReference<>(Instant.parse("2026-03-01T23:00:00Z"));
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenAnswer(invocation -> now.get());
        tracker = new CostTracker(clock);
    }

    @Test
    void shouldRecordSpendWithinCap() {
        assertTrue(tracker.record(300, 500));
        assertTrue(tracker.record(200, 500));
        assertEquals(500, tracker.spentToday());
    }

    @Test
    void shouldRejectSpendOverCapWithoutRecording() {
        tracker.record(400, 500);

        assertFalse(tracker.record(101, 500));
        assertEquals(400, tracker.spentToday());
    }

    @Test
    void shouldAllowZeroCostWithinCap() {
        tracker.record(500, 500);

        assertTrue(tracker.record(0, 500));
        assertFalse(tracker.record(0, 400));
    }

    @Test
    void shouldResetOnNewUtcDay() {
        tracker.record(500, 500);

        now.set(now.get().plus(Duration.ofHours(2)));

        assertEquals(0, tracker.spentToday());
        assertTrue(tracker.record(100, 500));
    }
}
