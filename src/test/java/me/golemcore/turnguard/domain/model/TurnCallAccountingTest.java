package me.golemcore.turnguard.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TurnCallAccountingTest {

    @Test
    void shouldAllowSingleAnswerCallWithoutReflect() {
        TurnCallAccounting accounting = TurnCallAccounting.forTurn(false);

        accounting.consumeAnswerCall();

        assertEquals(1, accounting.getBudgetLimit());
        assertEquals(1, accounting.getAnswerCalls());
        assertEquals(0, accounting.getReflectCalls());
    }

    @Test
    void shouldRejectReflectCallWhenReflectDisabled() {
        TurnCallAccounting accounting = TurnCallAccounting.forTurn(false);
        accounting.consumeAnswerCall();

        CallBudgetExceededException error = assertThrows(CallBudgetExceededException.class,
                accounting::consumeReflectCall);

        assertEquals("persona per-turn call budget exceeded: consumed=2 budget=1", error.getMessage());
        assertEquals(2, error.getConsumed());
        assertEquals(1, error.getBudget());
    }

    @Test
    void shouldAllowAnswerAndReflectWhenReflectEnabled() {
        TurnCallAccounting accounting = TurnCallAccounting.forTurn(true);

        accounting.consumeAnswerCall();
        accounting.consumeReflectCall();

        assertEquals(2, accounting.getBudgetLimit());
        assertEquals(1, accounting.getAnswerCalls());
        assertEquals(1, accounting.getReflectCalls());
    }

    @Test
    void shouldRejectThirdCall() {
        TurnCallAccounting accounting = TurnCallAccounting.forTurn(true);
        accounting.consumeAnswerCall();
        accounting.consumeReflectCall();

        CallBudgetExceededException error = assertThrows(CallBudgetExceededException.class,
                accounting::consumeAnswerCall);

        assertEquals("persona per-turn call budget exceeded: consumed=3 budget=2", error.getMessage());
    }

    @Test
    void shouldKeepCountersIndependentPerTurn() {
        TurnCallAccounting first = TurnCallAccounting.forTurn(false);
        first.consumeAnswerCall();

        TurnCallAccounting second = TurnCallAccounting.forTurn(false);

        assertDoesNotThrow(second::consumeAnswerCall);
    }
}
