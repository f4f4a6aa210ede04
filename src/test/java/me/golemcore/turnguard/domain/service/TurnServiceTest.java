package me.golemcore.turnguard.domain.service;

import me.golemcore.turnguard.domain.model.TurnCallAccounting;
import me.golemcore.turnguard.domain.model.TurnOutcome;
import me.golemcore.turnguard.domain.model.TurnPolicyDeniedException;
import me.golemcore.turnguard.domain.model.TurnRequest;
import me.golemcore.turnguard.infrastructure.config.TurnGuardProperties;
import me.golemcore.turnguard.security.MemoryWriteContext;
import me.golemcore.turnguard.security.TenantPolicyContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.junit.jupiter.api.Assertions.*;

class TurnServiceTest {

    private TurnGuardProperties properties;
    private TurnOrchestrator orchestrator;
    private VerifyRepairController verifyRepairController;
    private ExecutorService executor;
    private TurnService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new TurnGuardProperties();
        orchestrator = mock(TurnOrchestrator.class);
        verifyRepairController = mock(VerifyRepairController.class);
        when(verifyRepairController.run(any(MemoryWriteContext.class), any(Supplier.class)))
                .thenAnswer(invocation -> ((Supplier<TurnOutcome>) invocation.getArgument(1)).get());
        when(orchestrator.executeTurn(any(), any()))
                .thenReturn(new TurnOutcome("answer", false, TurnCallAccounting.forTurn(false)));
        executor = Executors.newSingleThreadExecutor();
        service = new TurnService(properties, orchestrator, verifyRepairController, executor);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(1, TimeUnit.SECONDS);
    }

    @Test
    void shouldReturnOrchestratorResponse() {
        TurnRequest request = TurnRequest.builder().entityId("default").userMessage("hi").build();

        assertEquals("answer", service.runTurn(request));
        verify(orchestrator).executeTurn(eq(request), any());
    }

    @Test
    void shouldDefaultBlankEntityToDefaultScope() {
        service.runTurn(TurnRequest.builder().entityId(" ").userMessage("hi").build());

        ArgumentCaptor<MemoryWriteContext> captor = ArgumentCaptor.forClass(MemoryWriteContext.class);
        verify(orchestrator).executeTurn(any(), captor.capture());
        assertEquals(TenantPolicyContext.DEFAULT_SCOPE, captor.getValue().entityId());
        assertFalse(captor.getValue().policyContext().enabled());
    }

    @Test
    void shouldApplyConfiguredTenant() {
        properties.getTenant().setEnabled(true);
        properties.getTenant().setTenantId("acme");

        service.runTurn(TurnRequest.builder().entityId("acme:u1").userMessage("hi").build());

        ArgumentCaptor<MemoryWriteContext> captor = ArgumentCaptor.forClass(MemoryWriteContext.class);
        verify(orchestrator).executeTurn(any(), captor.capture());
        assertEquals(TenantPolicyContext.enabled("acme"), captor.getValue().policyContext());
    }

    @Test
    void shouldCompleteSubmittedTurnOnExecutor() throws Exception {
        CompletableFuture<String> future = service.submit(TurnRequest.builder().userMessage("hi").build());

        assertEquals("answer", future.get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldCompleteExceptionallyWithTurnError() {
        when(orchestrator.executeTurn(any(), any()))
                .thenThrow(new TurnPolicyDeniedException("blocked by security policy: action limit exceeded"));

        CompletableFuture<String> future = service.submit(TurnRequest.builder().userMessage("hi").build());

        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TurnPolicyDeniedException.class, error.getCause());
    }
}
