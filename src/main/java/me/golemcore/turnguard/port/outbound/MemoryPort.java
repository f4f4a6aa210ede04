package me.golemcore.turnguard.port.outbound;

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

import me.golemcore.turnguard.domain.model.ConsolidationInput;
import me.golemcore.turnguard.domain.model.MemoryEvent;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the durable memory store. Callers pass every event through
 * {@link me.golemcore.turnguard.security.MemoryWritePolicy} before appending.
 */
public interface MemoryPort {

    CompletableFuture<Void> appendEvent(MemoryEvent event);

    CompletableFuture<Long> countEvents(String entityId);

    /**
     * Returns up to {@code limit} events for the entity relevant to the query,
     * most relevant first.
     */
    CompletableFuture<List<MemoryEvent>> recall(String entityId, String query, int limit);

    /**
     * Compacts the entity's recent events. Invoked in the background after a
     * turn; the caller does not await the result.
     */
    CompletableFuture<Void> consolidate(ConsolidationInput input);
}
