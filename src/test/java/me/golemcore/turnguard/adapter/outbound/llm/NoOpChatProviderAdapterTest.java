package me.golemcore.turnguard.adapter.outbound.llm;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NoOpChatProviderAdapterTest {

    private final NoOpChatProviderAdapter adapter = new NoOpChatProviderAdapter();

    @Test
    void shouldReturnPlaceholder() {
        assertEquals(NoOpChatProviderAdapter.PLACEHOLDER, adapter.chatWithSystem("s", "m", "model", 0.5).join());
    }

    @Test
    void shouldReportUnavailable() {
        assertFalse(adapter.isAvailable());
        assertEquals("none", adapter.getProviderId());
    }
}
