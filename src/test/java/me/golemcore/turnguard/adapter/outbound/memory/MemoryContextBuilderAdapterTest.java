package me.golemcore.turnguard.adapter.outbound.memory;

import me.golemcore.turnguard.domain.model.MemoryEvent;
import me.golemcore.turnguard.domain.model.TurnPolicyDeniedException;
import me.golemcore.turnguard.infrastructure.config.TurnGuardProperties;
import me.golemcore.turnguard.port.outbound.MemoryPort;
import me.golemcore.turnguard.security.TenantPolicyContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.junit.jupiter.api.Assertions.*;

class MemoryContextBuilderAdapterTest {

    private MemoryPort memoryPort;
    private TurnGuardProperties properties;
    private MemoryContextBuilderAdapter adapter;

    @BeforeEach
    void setUp() {
        memoryPort = mock(MemoryPort.class);
        properties = new TurnGuardProperties();
        adapter = new MemoryContextBuilderAdapter(memoryPort, properties);
    }

    @Test
    void shouldRenderRecalledEvents() {
        properties.getMemory().setRecallLimit(4);
        when(memoryPort.recall("default", "where do I live", 4)).thenReturn(CompletableFuture.completedFuture(List.of(
                MemoryEvent.builder().slotKey("user.city").value("Lisbon").build(),
                MemoryEvent.builder().slotKey("user.country").value("Portugal").build())));

        String context = adapter.buildContext("default", "where do I live", TenantPolicyContext.disabled()).join();

        assertEquals("[Memory context]\n- user.city: Lisbon\n- user.country: Portugal\n\n", context);
    }

    @Test
    void shouldRenderNothingWhenRecallEmpty() {
        when(memoryPort.recall(anyString(), anyString(), anyInt()))
                .thenReturn(CompletableFuture.completedFuture(List.of()));

        assertEquals("", adapter.buildContext("default", "hello", TenantPolicyContext.disabled()).join());
    }

    @Test
    void shouldEnforceTenantScopeBeforeRecall() {
        TenantPolicyContext tenant = TenantPolicyContext.enabled("acme");

        assertThrows(TurnPolicyDeniedException.class, () -> adapter.buildContext("globex:u", "hello", tenant));
        verify(memoryPort, never()).recall(anyString(), anyString(), anyInt());
    }
}
