package me.golemcore.turnguard.ratelimit;

import me.golemcore.turnguard.infrastructure.config.TurnGuardProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import static org.junit.jupiter.api.Assertions.*;

class EntityRateLimiterTest {

    private AtomicReference<Instant> now;
    private Clock clock;

    @BeforeEach
    void setUp() {
        now = new AtomicReference<>(Instant.parse("2026-03-01T10:00:00Z"));
        clock = mock(Clock.class);
        when(clock.instant()).thenAnswer(invocation -> now.get());
    }

    // ===== Entity limit =====

    @Test
    void shouldDenyEntityOverLimit() {
        EntityRateLimiter limiter = new EntityRateLimiter(clock, 100, 2);

        assertTrue(limiter.tryRecord("alice").isAllowed());
        assertTrue(limiter.tryRecord("alice").isAllowed());
        RateLimitResult denied = limiter.tryRecord("alice");

        assertFalse(denied.isAllowed());
        assertEquals(RateLimitResult.Scope.ENTITY, denied.getDeniedScope());
        assertEquals("entity action limit exceeded", denied.getReason());
    }

    @Test
    void shouldTrackEntitiesIndependently() {
        EntityRateLimiter limiter = new EntityRateLimiter(clock, 100, 1);

        assertTrue(limiter.tryRecord("alice").isAllowed());
        assertTrue(limiter.tryRecord("bob").isAllowed());
        assertFalse(limiter.tryRecord("alice").isAllowed());
        assertEquals(2, limiter.entityCount("alice"));
        assertEquals(1, limiter.entityCount("bob"));
        assertEquals(0, limiter.entityCount("carol"));
    }

    @Test
    void shouldReportRemainingActions() {
        EntityRateLimiter limiter = new EntityRateLimiter(clock, 10, 3);

        assertEquals(2, limiter.tryRecord("alice").getRemainingActions());
    }

    // ===== Global limit =====

    @Test
    void shouldDenyGlobalLimitBeforeChargingEntity() {
        EntityRateLimiter limiter = new EntityRateLimiter(clock, 1, 10);
        limiter.tryRecord("alice");

        RateLimitResult denied = limiter.tryRecord("bob");

        assertFalse(denied.isAllowed());
        assertEquals(RateLimitResult.Scope.GLOBAL, denied.getDeniedScope());
        assertEquals(0, limiter.entityCount("bob"));
    }

    @Test
    void shouldReadLimitsFromProperties() {
        TurnGuardProperties properties = new TurnGuardProperties();
        properties.getAutonomy().setMaxActionsPerHour(5);
        properties.getAutonomy().setMaxActionsPerEntityPerHour(1);
        EntityRateLimiter limiter = new EntityRateLimiter(properties, clock);

        limiter.tryRecord("alice");

        assertFalse(limiter.tryRecord("alice").isAllowed());
    }

    @Test
    void shouldAllowAgainAfterWindow() {
        EntityRateLimiter limiter = new EntityRateLimiter(clock, 100, 1);
        limiter.tryRecord("alice");

        now.set(now.get().plus(Duration.ofMinutes(61)));

        assertTrue(limiter.tryRecord("alice").isAllowed());
    }

    // ===== Concurrency =====

    @Test
    void shouldNeverAllowMoreThanLimitUnderConcurrency() throws Exception {
        EntityRateLimiter limiter = new EntityRateLimiter(clock, 1000, 50);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 200; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return limiter.tryRecord("shared").isAllowed();
                }));
            }
            start.countDown();

            int allowed = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    allowed++;
                }
            }
            assertEquals(50, allowed);
        } finally {
            executor.shutdownNow();
        }
    }
}
