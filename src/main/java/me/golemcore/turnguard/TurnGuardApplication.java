package me.golemcore.turnguard;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore turn guard.
 *
 * <p>
 * The turn guard is the control plane around one agent turn. It bounds the
 * model calls a turn may make and retries or escalates failed turns. Every
 * self-state writeback proposed by the model is validated before it is
 * persisted.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Inbound            → TurnPort (channel transports, CLI)
 * Domain Layer       → TurnService, VerifyRepairController, TurnOrchestrator,
 *                      ReflectWritebackService, WritebackGuard
 * Outbound           → Chat provider, Memory, Tool loop, Plan executor,
 *                      Persona state adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code turnguard.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TurnGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(TurnGuardApplication.class, args);
    }

}
