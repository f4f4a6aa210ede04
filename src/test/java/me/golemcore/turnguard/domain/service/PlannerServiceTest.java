package me.golemcore.turnguard.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.turnguard.domain.model.AutonomyLevel;
import me.golemcore.turnguard.domain.model.Plan;
import me.golemcore.turnguard.domain.model.PlanExecutionReport;
import me.golemcore.turnguard.domain.model.PlanStepStatus;
import me.golemcore.turnguard.domain.model.ToolExecutionContext;
import me.golemcore.turnguard.infrastructure.config.TurnGuardProperties;
import me.golemcore.turnguard.port.outbound.ChatProviderPort;
import me.golemcore.turnguard.port.outbound.PlanExecutorPort;
import me.golemcore.turnguard.port.outbound.ToolLoopPort;
import me.golemcore.turnguard.security.TenantPolicyContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.junit.jupiter.api.Assertions.*;

class PlannerServiceTest {

    private static final String THREE_STEP_PLAN = """
            ```json
            {"id":"p","steps":[
              {"id":"a","action":{"kind":"prompt","text":"gather"}},
              {"id":"b","action":{"kind":"prompt","text":"draft"},"depends_on":["a"]},
              {"id":"c","action":{"kind":"checkpoint","label":"done"},"depends_on":["b"]}]}
            ```
            """;

    private TurnGuardProperties properties;
    private ChatProviderPort chatProvider;
    private ToolLoopPort toolLoopPort;
    private PlanExecutorPort planExecutor;
    private PlannerService service;
    private ToolExecutionContext context;

    @BeforeEach
    void setUp() {
        properties = new TurnGuardProperties();
        chatProvider = mock(ChatProviderPort.class);
        toolLoopPort = mock(ToolLoopPort.class);
        planExecutor = mock(PlanExecutorPort.class);
        when(toolLoopPort.availableToolNames(any())).thenReturn(List.of());
        service = new PlannerService(properties, chatProvider, toolLoopPort, planExecutor,
                new PlanParser(new ObjectMapper()));
        context = new ToolExecutionContext("default", AutonomyLevel.SUPERVISED, 10, null, null,
                TenantPolicyContext.disabled());
    }

    private void plannerReturns(String raw) {
        when(chatProvider.chatWithSystem(anyString(), anyString(), anyString(), anyDouble()))
                .thenReturn(CompletableFuture.completedFuture(raw));
    }

    private void executorCompletesAll() {
        when(planExecutor.execute(any(), anyString(), anyDouble(), any())).thenAnswer(invocation -> {
            Plan plan = invocation.getArgument(0);
            plan.getSteps().forEach(step -> {
                step.setStatus(PlanStepStatus.COMPLETED);
                step.setOutput("output of " + step.getId());
            });
            return CompletableFuture.completedFuture(
                    new PlanExecutionReport(true, List.of("a", "b", "c"), List.of(), List.of()));
        });
    }

    // ===== Gate =====

    @Test
    void shouldAttemptOnlyWhenEnabledAndMultiStep() {
        assertTrue(service.shouldAttempt("1. a 2. b 3. c"));
        assertFalse(service.shouldAttempt("hello"));

        properties.getPlanner().setEnabled(false);
        assertFalse(service.shouldAttempt("1. a 2. b 3. c"));
    }

    // ===== Planning =====

    @Test
    void shouldReturnFinalStepOutputOnSuccess() {
        plannerReturns(THREE_STEP_PLAN);
        executorCompletesAll();

        Optional<String> result = service.tryPlan("sys", "task", "m", 0.5, context);

        assertEquals(Optional.of("output of c"), result);
    }

    @Test
    void shouldFallBackWhenGenerationFails() {
        when(chatProvider.chatWithSystem(anyString(), anyString(), anyString(), anyDouble()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("provider down")));

        assertTrue(service.tryPlan("sys", "task", "m", 0.5, context).isEmpty());
    }

    @Test
    void shouldFallBackWithoutJson() {
        plannerReturns("I cannot make a plan.");

        assertTrue(service.tryPlan("sys", "task", "m", 0.5, context).isEmpty());
        verify(planExecutor, never()).execute(any(), anyString(), anyDouble(), any());
    }

    @Test
    void shouldFallBackOnInvalidPlan() {
        plannerReturns("{\"id\":\"p\",\"steps\":[]}");

        assertTrue(service.tryPlan("sys", "task", "m", 0.5, context).isEmpty());
    }

    @Test
    void shouldFallBackOnNullSteps() {
        plannerReturns("{\"id\":\"p\",\"steps\":[null,null,null]}");

        assertEquals(Optional.empty(), service.tryPlan("sys", "task", "m", 0.5, context));
        verify(planExecutor, never()).execute(any(), anyString(), anyDouble(), any());
    }

    @Test
    void shouldFallBackOnNullDependency() {
        plannerReturns("{\"id\":\"p\",\"steps\":["
                + "{\"id\":\"a\",\"action\":{\"kind\":\"prompt\",\"text\":\"t\"},\"depends_on\":[null]},"
                + "{\"id\":\"b\",\"action\":{\"kind\":\"prompt\",\"text\":\"u\"}},"
                + "{\"id\":\"c\",\"action\":{\"kind\":\"prompt\",\"text\":\"v\"}}]}");

        assertEquals(Optional.empty(), service.tryPlan("sys", "task", "m", 0.5, context));
        verify(planExecutor, never()).execute(any(), anyString(), anyDouble(), any());
    }

    @Test
    void shouldFallBackWhenPlanTooShort() {
        plannerReturns("{\"id\":\"p\",\"steps\":[{\"id\":\"a\",\"action\":{\"kind\":\"prompt\",\"text\":\"t\"}}]}");

        assertTrue(service.tryPlan("sys", "task", "m", 0.5, context).isEmpty());
        verify(planExecutor, never()).execute(any(), anyString(), anyDouble(), any());
    }

    @Test
    void shouldFallBackWhenExecutionThrows() {
        plannerReturns(THREE_STEP_PLAN);
        when(planExecutor.execute(any(), anyString(), anyDouble(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("executor crashed")));

        assertTrue(service.tryPlan("sys", "task", "m", 0.5, context).isEmpty());
    }

    @Test
    void shouldRenderIncompletePlan() {
        plannerReturns(THREE_STEP_PLAN);
        when(planExecutor.execute(any(), anyString(), anyDouble(), any())).thenAnswer(invocation -> {
            Plan plan = invocation.getArgument(0);
            plan.getSteps().get(0).setStatus(PlanStepStatus.COMPLETED);
            plan.getSteps().get(1).setStatus(PlanStepStatus.FAILED);
            plan.getSteps().get(1).setError("rate limited: global limit");
            plan.getSteps().get(2).setStatus(PlanStepStatus.SKIPPED);
            return CompletableFuture.completedFuture(
                    new PlanExecutionReport(false, List.of("a"), List.of("b"), List.of("c")));
        });

        Optional<String> result = service.tryPlan("sys", "task", "m", 0.5, context);

        assertEquals(Optional.of("Plan execution incomplete (completed=1, failed=1, skipped=1).\n"
                + "Failed step b: rate limited: global limit"), result);
    }

    // ===== Request =====

    @Test
    void shouldListToolsInRequest() {
        String request = PlannerService.buildPlannerRequest("Task body", List.of("search", "fetch"));

        assertTrue(request.contains("Available tools: search, fetch"));
        assertTrue(request.contains(PlanParser.SCHEMA_PROMPT));
        assertTrue(request.endsWith("Task:\nTask body"));
    }

    @Test
    void shouldMarkMissingTools() {
        assertTrue(PlannerService.buildPlannerRequest("t", List.of()).contains("Available tools: (no tools available)"));
    }
}
