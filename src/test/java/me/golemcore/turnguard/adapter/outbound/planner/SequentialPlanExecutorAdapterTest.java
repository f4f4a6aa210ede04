package me.golemcore.turnguard.adapter.outbound.planner;

import me.golemcore.turnguard.domain.model.AutonomyLevel;
import me.golemcore.turnguard.domain.model.Plan;
import me.golemcore.turnguard.domain.model.PlanExecutionReport;
import me.golemcore.turnguard.domain.model.PlanStep;
import me.golemcore.turnguard.domain.model.PlanStepAction;
import me.golemcore.turnguard.domain.model.PlanStepStatus;
import me.golemcore.turnguard.domain.model.ToolExecutionContext;
import me.golemcore.turnguard.port.outbound.ChatProviderPort;
import me.golemcore.turnguard.ratelimit.EntityRateLimiter;
import me.golemcore.turnguard.ratelimit.RateLimitResult;
import me.golemcore.turnguard.security.TenantPolicyContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.junit.jupiter.api.Assertions.*;

class SequentialPlanExecutorAdapterTest {

    private ChatProviderPort chatProvider;
    private EntityRateLimiter rateLimiter;
    private SequentialPlanExecutorAdapter adapter;
    private ToolExecutionContext context;

    @BeforeEach
    void setUp() {
        chatProvider = mock(ChatProviderPort.class);
        rateLimiter = mock(EntityRateLimiter.class);
        when(rateLimiter.tryRecord("default")).thenReturn(RateLimitResult.allowed(5));
        adapter = new SequentialPlanExecutorAdapter(chatProvider);
        context = new ToolExecutionContext("default", AutonomyLevel.SUPERVISED, 5, null, rateLimiter,
                TenantPolicyContext.disabled());
    }

    private static PlanStep prompt(String id, String text, String... dependsOn) {
        return PlanStep.builder()
                .id(id)
                .description(id)
                .action(PlanStepAction.builder().kind(PlanStepAction.Kind.PROMPT).text(text).build())
                .dependsOn(new ArrayList<>(List.of(dependsOn)))
                .build();
    }

    private static PlanStep checkpoint(String id, String label, String... dependsOn) {
        return PlanStep.builder()
                .id(id)
                .action(PlanStepAction.builder().kind(PlanStepAction.Kind.CHECKPOINT).label(label).build())
                .dependsOn(new ArrayList<>(List.of(dependsOn)))
                .build();
    }

    private static PlanStep toolCall(String id, String toolName) {
        return PlanStep.builder()
                .id(id)
                .action(PlanStepAction.builder().kind(PlanStepAction.Kind.TOOL_CALL).toolName(toolName).build())
                .build();
    }

    private static Plan plan(PlanStep... steps) {
        return Plan.builder().id("p").steps(new ArrayList<>(List.of(steps))).build();
    }

    @Test
    void shouldRunStepsInDependencyOrder() {
        when(chatProvider.chatWithSystem(eq(""), contains("gather"), anyString(), anyDouble()))
                .thenReturn(CompletableFuture.completedFuture("facts"));
        when(chatProvider.chatWithSystem(eq(""), contains("draft"), anyString(), anyDouble()))
                .thenReturn(CompletableFuture.completedFuture("draft text"));
        Plan plan = plan(prompt("b", "draft", "a"), prompt("a", "gather"), checkpoint("c", "done", "b"));

        PlanExecutionReport report = adapter.execute(plan, "m", 0.2, context).join();

        assertTrue(report.success());
        assertEquals(List.of("a", "b", "c"), report.completedSteps());
        assertEquals("draft text", plan.findStep("b").orElseThrow().getOutput());
        assertEquals("done", plan.finalStepOutput().orElseThrow());
    }

    @Test
    void shouldSkipDependentsOfFailedStep() {
        Plan plan = plan(toolCall("a", "web_search"), checkpoint("b", "after", "a"), checkpoint("c", "free"));

        PlanExecutionReport report = adapter.execute(plan, "m", 0.2, context).join();

        assertFalse(report.success());
        assertEquals(List.of("a"), report.failedSteps());
        assertEquals(List.of("b"), report.skippedSteps());
        assertEquals(List.of("c"), report.completedSteps());
        assertEquals("no tool registered: web_search", plan.findStep("a").orElseThrow().getError());
        assertEquals(PlanStepStatus.SKIPPED, plan.findStep("b").orElseThrow().getStatus());
    }

    @Test
    void shouldFailPromptStepWhenRateLimited() {
        when(rateLimiter.tryRecord("default"))
                .thenReturn(RateLimitResult.denied(RateLimitResult.Scope.GLOBAL, "global action limit exceeded"));
        Plan plan = plan(prompt("a", "gather"));

        PlanExecutionReport report = adapter.execute(plan, "m", 0.2, context).join();

        assertEquals(List.of("a"), report.failedSteps());
        assertEquals("rate limited: global action limit exceeded", plan.findStep("a").orElseThrow().getError());
    }

    @Test
    void shouldIncludePrerequisiteOutputsInPrompt() {
        PlanStep first = prompt("a", "gather");
        first.setOutput("facts");
        PlanStep second = prompt("b", "draft", "a");
        Plan plan = plan(first, second);

        String prompt = SequentialPlanExecutorAdapter.buildStepPrompt(plan, second);

        assertEquals("Step: b\n\nInstruction:\ndraft\n\nResults of prerequisite steps:\n- a: facts", prompt);
    }
}
