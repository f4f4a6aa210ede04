package me.golemcore.turnguard.adapter.outbound.llm;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.turnguard.port.outbound.ChatProviderPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * No-op chat provider used when no model backend is wired in.
 *
 * <p>
 * Always returns a placeholder answer without calling any external API.
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpChatProviderAdapter implements ChatProviderPort {

    static final String PLACEHOLDER = "[No chat provider configured]";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<String> chatWithSystem(String systemPrompt, String message, String model,
            double temperature) {
        log.warn("NoOpChatProviderAdapter: chatWithSystem() called - no chat provider configured");
        return CompletableFuture.completedFuture(PLACEHOLDER);
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
