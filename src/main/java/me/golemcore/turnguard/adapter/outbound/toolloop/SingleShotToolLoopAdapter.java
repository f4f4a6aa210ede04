package me.golemcore.turnguard.adapter.outbound.toolloop;

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
import me.golemcore.turnguard.domain.model.ToolExecutionContext;
import me.golemcore.turnguard.domain.model.ToolLoopResult;
import me.golemcore.turnguard.domain.model.ToolLoopStopReason;
import me.golemcore.turnguard.domain.service.VerifyFailureAnalyzer;
import me.golemcore.turnguard.port.outbound.ChatProviderPort;
import me.golemcore.turnguard.port.outbound.ToolLoopPort;
import me.golemcore.turnguard.ratelimit.RateLimitResult;
import me.golemcore.turnguard.security.SecretScrubber;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Tool loop with no registered tools: a single model call per turn, gated by
 * the entity rate limiter.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SingleShotToolLoopAdapter implements ToolLoopPort {

    private final ChatProviderPort chatProviderPort;

    @Override
    public CompletableFuture<ToolLoopResult> run(String systemPrompt, String prompt, String model, double temperature,
            ToolExecutionContext context) {
        if (context.maxToolLoopIterations() < 1) {
            return CompletableFuture.completedFuture(
                    new ToolLoopResult("", 0, ToolLoopStopReason.maxIterations()));
        }

        RateLimitResult rate = context.rateLimiter().tryRecord(context.entityId());
        if (!rate.isAllowed()) {
            log.warn("[RateLimit] Tool loop call denied for {}: {}", context.entityId(), rate.getReason());
            return CompletableFuture.completedFuture(
                    new ToolLoopResult("Rate limit reached: " + rate.getReason(), 0,
                            ToolLoopStopReason.rateLimited()));
        }

        return chatProviderPort.chatWithSystem(systemPrompt, prompt, model, temperature)
                .thenApply(text -> new ToolLoopResult(text, 1, ToolLoopStopReason.completed()))
                .exceptionally(error -> new ToolLoopResult("", 1, ToolLoopStopReason.error(
                        SecretScrubber.sanitizeError(VerifyFailureAnalyzer.describe(error)))));
    }

    @Override
    public List<String> availableToolNames(ToolExecutionContext context) {
        return List.of();
    }
}
