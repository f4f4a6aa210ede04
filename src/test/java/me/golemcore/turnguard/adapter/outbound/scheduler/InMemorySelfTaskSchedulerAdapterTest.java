package me.golemcore.turnguard.adapter.outbound.scheduler;

import me.golemcore.turnguard.domain.model.Plan;
import me.golemcore.turnguard.domain.model.PlanStepAction;
import me.golemcore.turnguard.domain.model.SelfTaskWriteback;
import me.golemcore.turnguard.infrastructure.config.TurnGuardProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.junit.jupiter.api.Assertions.*;

class InMemorySelfTaskSchedulerAdapterTest {

    private final AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2026-03-01T10:00:00Z"));
    private TurnGuardProperties properties;
    private InMemorySelfTaskSchedulerAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new TurnGuardProperties();
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenAnswer(invocation -> now.get());
        adapter = new InMemorySelfTaskSchedulerAdapter(properties, clock);
    }

    @Test
    void shouldQueueTasksWithVerifyRepairAttempts() {
        properties.getAutonomy().setVerifyRepairMaxAttempts(4);

        adapter.schedule("ada", List.of(new SelfTaskWriteback("Check", "Recheck Q3", "2026-03-01T12:00:00Z"))).join();

        List<InMemorySelfTaskSchedulerAdapter.ScheduledSelfTask> pending = adapter.pending();
        assertEquals(1, pending.size());
        assertEquals("ada", pending.get(0).personId());
        assertEquals(4, pending.get(0).maxAttempts());
        assertEquals(Instant.parse("2026-03-01T12:00:00Z"), pending.get(0).expiresAt());
    }

    @Test
    void shouldDropExpiredTasksFromPending() {
        adapter.schedule("ada", List.of(new SelfTaskWriteback("Soon", "x", "2026-03-01T11:00:00Z"),
                new SelfTaskWriteback("Later", "y", "2026-03-02T11:00:00Z"))).join();

        now.set(Instant.parse("2026-03-01T11:30:00Z"));

        assertEquals(List.of("Later"), adapter.pending().stream().map(task -> task.title()).toList());
    }

    @Test
    void shouldQueueSpaceSeparatedExpiry() {
        adapter.schedule("ada", List.of(new SelfTaskWriteback("Check", "x", "2026-03-01 12:00:00+01:00"))).join();

        assertEquals(Instant.parse("2026-03-01T11:00:00Z"), adapter.pending().get(0).expiresAt());
    }

    @Test
    void shouldSkipTaskWithInvalidExpiry() {
        adapter.schedule("ada", List.of(new SelfTaskWriteback("Bad", "x", "tomorrow"))).join();

        assertTrue(adapter.pending().isEmpty());
    }

    @Test
    void shouldBuildTwoStepPlan() {
        Plan plan = InMemorySelfTaskSchedulerAdapter.buildPlan(new SelfTaskWriteback("Check", "Recheck Q3", "x"));

        assertEquals(List.of("step_1", "step_2"), plan.executionOrder());
        assertEquals("self-task title=Check instructions=Recheck Q3",
                plan.getSteps().get(0).getAction().getText());
        assertEquals(PlanStepAction.Kind.CHECKPOINT, plan.getSteps().get(1).getAction().getKind());
        assertEquals(InMemorySelfTaskSchedulerAdapter.CHECKPOINT_LABEL, plan.getSteps().get(1).getAction().getLabel());
    }
}
