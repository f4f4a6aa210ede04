package me.golemcore.turnguard.adapter.outbound.memory;

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
import me.golemcore.turnguard.domain.model.MemoryEvent;
import me.golemcore.turnguard.infrastructure.config.TurnGuardProperties;
import me.golemcore.turnguard.port.outbound.ContextBuilderPort;
import me.golemcore.turnguard.port.outbound.MemoryPort;
import me.golemcore.turnguard.security.TenantPolicyContext;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Builds the memory context block prepended to the user message:
 *
 * <pre>
 * [Memory context]
 * - slot: value
 *
 * </pre>
 *
 * Returns an empty string when nothing is recalled.
 */
@Component
@RequiredArgsConstructor
public class MemoryContextBuilderAdapter implements ContextBuilderPort {

    static final String HEADER = "[Memory context]\n";

    private final MemoryPort memoryPort;
    private final TurnGuardProperties properties;

    @Override
    public CompletableFuture<String> buildContext(String entityId, String userMessage,
            TenantPolicyContext policyContext) {
        policyContext.enforceScope(entityId);
        int limit = properties.getMemory().getRecallLimit();
        return memoryPort.recall(entityId, userMessage, limit).thenApply(MemoryContextBuilderAdapter::render);
    }

    static String render(List<MemoryEvent> recalled) {
        if (recalled == null || recalled.isEmpty()) {
            return "";
        }
        StringBuilder context = new StringBuilder(HEADER);
        for (MemoryEvent event : recalled) {
            context.append("- ").append(event.getSlotKey()).append(": ").append(event.getValue()).append('\n');
        }
        context.append('\n');
        return context.toString();
    }
}
