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
import me.golemcore.turnguard.domain.model.ConsolidationInput;
import me.golemcore.turnguard.port.outbound.MemoryPort;
import me.golemcore.turnguard.security.SecretScrubber;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Schedules post-turn memory consolidation on the consolidation executor. The
 * caller gets no handle: a failure is logged and never reaches the turn.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConsolidationDispatcher {

    private final MemoryPort memoryPort;
    private final ExecutorService consolidationExecutor;

    public void dispatch(String entityId, String userMessage, String response) {
        long checkpoint;
        try {
            checkpoint = memoryPort.countEvents(entityId).join();
        } catch (RuntimeException e) {
            log.warn("[Consolidation] Post-turn consolidation checkpoint skipped: {}",
                    SecretScrubber.sanitizeError(VerifyFailureAnalyzer.describe(e)));
            return;
        }

        ConsolidationInput input = new ConsolidationInput(entityId, checkpoint, userMessage, response);
        try {
            consolidationExecutor.execute(() -> consolidate(input));
        } catch (RejectedExecutionException e) {
            log.warn("[Consolidation] Executor rejected consolidation for entity {}", entityId);
        }
    }

    private void consolidate(ConsolidationInput input) {
        try {
            memoryPort.consolidate(input).join();
            log.debug("[Consolidation] Completed for entity {} at checkpoint {}", input.entityId(),
                    input.checkpointEventCount());
        } catch (RuntimeException e) {
            log.warn("[Consolidation] Failed for entity {}: {}", input.entityId(),
                    SecretScrubber.sanitizeError(VerifyFailureAnalyzer.describe(e)));
        }
    }
}
