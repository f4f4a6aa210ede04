package me.golemcore.turnguard.port.inbound;

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

import me.golemcore.turnguard.domain.model.TurnRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Inbound port used by channel transports and the CLI to run one turn.
 */
public interface TurnPort {

    /**
     * Runs the turn on its own worker and completes with the answer, or
     * exceptionally with the terminal turn error.
     */
    CompletableFuture<String> submit(TurnRequest request);

    /**
     * Runs the turn on the calling thread.
     */
    String runTurn(TurnRequest request);
}
