package me.golemcore.turnguard.domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanTest {

    private static PlanStep step(String id, String... dependsOn) {
        return PlanStep.builder()
                .id(id)
                .action(PlanStepAction.builder().kind(PlanStepAction.Kind.CHECKPOINT).label(id).build())
                .dependsOn(new ArrayList<>(List.of(dependsOn)))
                .build();
    }

    @Test
    void shouldKeepDeclarationOrderForIndependentSteps() {
        Plan plan = Plan.builder().id("p").steps(List.of(step("c"), step("a"), step("b"))).build();

        assertEquals(List.of("c", "a", "b"), plan.executionOrder());
    }

    @Test
    void shouldOrderDependenciesFirst() {
        Plan plan = Plan.builder()
                .id("p")
                .steps(List.of(step("report", "fetch", "clean"), step("fetch"), step("clean", "fetch")))
                .build();

        assertEquals(List.of("fetch", "clean", "report"), plan.executionOrder());
    }

    @Test
    void shouldRejectUnknownDependency() {
        Plan plan = Plan.builder().id("p").steps(List.of(step("a", "ghost"))).build();

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, plan::executionOrder);

        assertEquals("plan step a depends on unknown step ghost", error.getMessage());
    }

    @Test
    void shouldRejectSelfDependency() {
        Plan plan = Plan.builder().id("p").steps(List.of(step("a", "a"))).build();

        assertThrows(IllegalArgumentException.class, plan::executionOrder);
    }

    @Test
    void shouldReturnLastCompletedOutput() {
        PlanStep first = step("a");
        first.setStatus(PlanStepStatus.COMPLETED);
        first.setOutput("first");
        PlanStep second = step("b", "a");
        second.setStatus(PlanStepStatus.FAILED);
        Plan plan = Plan.builder().id("p").steps(List.of(first, second)).build();

        assertEquals("first", plan.finalStepOutput().orElseThrow());
        assertTrue(plan.findStep("b").isPresent());
        assertTrue(plan.findStep("z").isEmpty());
    }
}
