package me.golemcore.turnguard.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.turnguard.domain.model.TurnOutcome;
import me.golemcore.turnguard.domain.model.TurnRequest;
import me.golemcore.turnguard.infrastructure.config.TurnGuardProperties;
import me.golemcore.turnguard.port.inbound.TurnPort;
import me.golemcore.turnguard.security.MemoryWriteContext;
import me.golemcore.turnguard.security.TenantPolicyContext;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for callers: runs each turn under {@link VerifyRepairController}
 * with the tenant scope from configuration.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TurnService implements TurnPort {

    private final TurnGuardProperties properties;
    private final TurnOrchestrator turnOrchestrator;
    private final VerifyRepairController verifyRepairController;
    private final ExecutorService turnRunExecutor;

    @Override
    public CompletableFuture<String> submit(TurnRequest request) {
        return CompletableFuture.supplyAsync(() -> runTurn(request), turnRunExecutor);
    }

    @Override
    public String runTurn(TurnRequest request) {
        String entityId = request.getEntityId() != null && !request.getEntityId().isBlank() ? request.getEntityId()
                : TenantPolicyContext.DEFAULT_SCOPE;
        MemoryWriteContext writeContext = MemoryWriteContext.forEntity(entityId, tenantContext());
        log.debug("[Turn] Starting turn for entity {}", writeContext.entityId());
        TurnOutcome outcome = verifyRepairController.run(writeContext,
                () -> turnOrchestrator.executeTurn(request, writeContext));
        log.debug("[Turn] Turn finished for entity {}: planner={}, calls={}/{}", writeContext.entityId(),
                outcome.plannerUsed(), outcome.accounting().getAnswerCalls() + outcome.accounting().getReflectCalls(),
                outcome.accounting().getBudgetLimit());
        return outcome.response();
    }

    private TenantPolicyContext tenantContext() {
        TurnGuardProperties.TenantProperties tenant = properties.getTenant();
        return tenant.isEnabled() ? TenantPolicyContext.enabled(tenant.getTenantId()) : TenantPolicyContext.disabled();
    }
}
