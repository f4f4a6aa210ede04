package me.golemcore.turnguard.infrastructure.config;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Executors for turn runs and background memory consolidation. Both use
 * daemon threads so neither keeps the JVM alive.
 */
@Configuration
@Slf4j
public class TurnExecutionConfiguration {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 2;

    private final List<ExecutorService> executors = new ArrayList<>();

    @Bean
    public ExecutorService turnRunExecutor() {
        return register(Executors.newCachedThreadPool(daemon("turn-run")));
    }

    @Bean
    public ExecutorService consolidationExecutor() {
        return register(Executors.newSingleThreadExecutor(daemon("memory-consolidation")));
    }

    @PreDestroy
    public void shutdown() {
        synchronized (executors) {
            for (ExecutorService executor : executors) {
                executor.shutdown();
                try {
                    if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                        executor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    executor.shutdownNow();
                }
            }
        }
        log.debug("[Turn] Executors shut down");
    }

    private ExecutorService register(ExecutorService executor) {
        synchronized (executors) {
            executors.add(executor);
        }
        return executor;
    }

    private static ThreadFactory daemon(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
