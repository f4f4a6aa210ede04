package me.golemcore.turnguard.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.turnguard.domain.model.Plan;
import me.golemcore.turnguard.domain.model.PlanStepAction;
import me.golemcore.turnguard.domain.model.PlanStepStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PlanParserTest {

    private static final String VALID_PLAN = """
            {
              "id": "p1",
              "description": "collect and summarize",
              "steps": [
                {"id": "fetch", "action": {"kind": "tool_call", "tool_name": "http_get", "args": {"url": "x"}}},
                {"id": "summarize", "action": {"kind": "prompt", "text": "summarize"}, "depends_on": ["fetch"]},
                {"id": "done", "action": {"kind": "checkpoint", "label": "finished"}, "depends_on": ["summarize"]}
              ]
            }
            """;

    private PlanParser parser;

    @BeforeEach
    void setUp() {
        parser = new PlanParser(new ObjectMapper());
    }

    // ===== Extraction =====

    @Test
    void shouldExtractFromJsonFence() {
        String text = "Here is the plan:\n```json\n{\"id\":\"p\"}\n```\nthanks";

        assertEquals(Optional.of("{\"id\":\"p\"}"), parser.extractJson(text));
    }

    @Test
    void shouldExtractFromPlainFenceOpeningObject() {
        String text = "```\n{\"id\":\"p\"}\n```";

        assertEquals(Optional.of("{\"id\":\"p\"}"), parser.extractJson(text));
    }

    @Test
    void shouldFallBackToOuterBraces() {
        String text = "plan: {\"id\":\"p\",\"x\":{}} done";

        assertEquals(Optional.of("{\"id\":\"p\",\"x\":{}}"), parser.extractJson(text));
    }

    @Test
    void shouldFallBackWhenJsonFenceIsUnterminated() {
        String text = "```json {\"id\":\"p\"}";

        assertEquals(Optional.of("{\"id\":\"p\"}"), parser.extractJson(text));
    }

    @Test
    void shouldReturnEmptyWithoutObject() {
        assertTrue(parser.extractJson("no plan here").isEmpty());
        assertTrue(parser.extractJson(null).isEmpty());
    }

    // ===== Parsing =====

    @Test
    void shouldParseValidPlan() {
        Plan plan = parser.parse(VALID_PLAN);

        assertEquals("p1", plan.getId());
        assertEquals(3, plan.getSteps().size());
        assertEquals(PlanStepAction.Kind.TOOL_CALL, plan.getSteps().get(0).getAction().getKind());
        assertEquals("http_get", plan.getSteps().get(0).getAction().getToolName());
        assertEquals(List.of("fetch"), plan.getSteps().get(1).getDependsOn());
        assertEquals(List.of("fetch", "summarize", "done"), plan.executionOrder());
        assertTrue(plan.getSteps().stream().allMatch(step -> step.getStatus() == PlanStepStatus.PENDING));
    }

    @Test
    void shouldResetModelSuppliedStatus() {
        String json = """
                {"id":"p","steps":[{"id":"a","action":{"kind":"prompt","text":"t"},"status":"completed","output":"x"}]}
                """;

        Plan plan = parser.parse(json);

        assertEquals(PlanStepStatus.PENDING, plan.getSteps().get(0).getStatus());
        assertNull(plan.getSteps().get(0).getOutput());
    }

    @Test
    void shouldRejectMalformedJson() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> parser.parse("{not json"));

        assertTrue(error.getMessage().startsWith("invalid plan JSON"));
    }

    @Test
    void shouldRejectEmptyPlan() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> parser.parse("{\"id\":\"p\",\"steps\":[]}"));

        assertEquals("plan must have at least one step", error.getMessage());
    }

    @Test
    void shouldRejectDuplicateStepIds() {
        String json = """
                {"id":"p","steps":[
                  {"id":"a","action":{"kind":"prompt","text":"t"}},
                  {"id":"a","action":{"kind":"prompt","text":"u"}}]}
                """;

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> parser.parse(json));

        assertEquals("duplicate plan step id: a", error.getMessage());
    }

    @Test
    void shouldRejectStepWithoutAction() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> parser.parse("{\"id\":\"p\",\"steps\":[{\"id\":\"a\"}]}"));

        assertEquals("plan step a has no action", error.getMessage());
    }

    @Test
    void shouldRejectNullStep() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> parser.parse("{\"id\":\"p\",\"steps\":[null]}"));

        assertEquals("plan step cannot be null", error.getMessage());
    }

    @Test
    void shouldRejectNullDependency() {
        String json = """
                {"id":"p","steps":[
                  {"id":"a","action":{"kind":"prompt","text":"t"},"depends_on":[null]}]}
                """;

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> parser.parse(json));

        assertEquals("plan step a has a null dependency", error.getMessage());
    }

    @Test
    void shouldRejectCycles() {
        String json = """
                {"id":"p","steps":[
                  {"id":"a","action":{"kind":"prompt","text":"t"},"depends_on":["b"]},
                  {"id":"b","action":{"kind":"prompt","text":"u"},"depends_on":["a"]}]}
                """;

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> parser.parse(json));

        assertEquals("cycle detected in plan steps", error.getMessage());
    }
}
