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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the turn guard, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code turnguard.*} prefix:
 * <ul>
 * <li>{@link AutonomyProperties} - autonomy level, rollout stage, action/cost
 * limits, verify/repair caps and temperature bands</li>
 * <li>{@link PersonaProperties} - reflect/writeback and persona state</li>
 * <li>{@link MemoryProperties} - autosave and context recall</li>
 * <li>{@link PlannerProperties} - multi-step planner routing</li>
 * <li>{@link TenantProperties} - tenant write-scope enforcement</li>
 * <li>{@link ModelProperties} - answer model and default temperature</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "turnguard")
@Data
public class TurnGuardProperties {

    private AutonomyProperties autonomy = new AutonomyProperties();
    private PersonaProperties persona = new PersonaProperties();
    private MemoryProperties memory = new MemoryProperties();
    private PlannerProperties planner = new PlannerProperties();
    private TenantProperties tenant = new TenantProperties();
    private ModelProperties model = new ModelProperties();

    @Data
    public static class AutonomyProperties {
        private String level = "supervised";
        private RolloutProperties rollout = new RolloutProperties();
        private int maxActionsPerHour = 20;
        private int maxActionsPerEntityPerHour = 20;
        private int maxCostPerDayCents = 500;
        private int maxToolLoopIterations = 10;
        private int verifyRepairMaxAttempts = 3;
        private int verifyRepairMaxRepairDepth = 2;
        private TemperatureBandsProperties temperatureBands = new TemperatureBandsProperties();
    }

    @Data
    public static class RolloutProperties {
        private boolean enabled = false;
        private String stage;
    }

    @Data
    public static class TemperatureBandsProperties {
        private BandProperties readOnly = new BandProperties(0.0, 0.2);
        private BandProperties supervised = new BandProperties(0.2, 0.7);
        private BandProperties full = new BandProperties(0.2, 1.0);
    }

    @Data
    public static class BandProperties {
        private double min;
        private double max;

        public BandProperties() {
        }

        public BandProperties(double min, double max) {
            this.min = min;
            this.max = max;
        }
    }

    @Data
    public static class PersonaProperties {
        private boolean enabledMainSession = false;
        private String personId = "default";
        private String stateFile = "${user.home}/.golemcore/turnguard/persona-state.json";
        private boolean selfTasksEnabled = false;
        private boolean styleProfileEnabled = false;
    }

    @Data
    public static class MemoryProperties {
        private boolean autoSave = true;
        private int recallLimit = 8;
        private int responseSummaryChars = 100;
    }

    @Data
    public static class PlannerProperties {
        private boolean enabled = true;
        private int minSteps = 3;
    }

    @Data
    public static class TenantProperties {
        private boolean enabled = false;
        private String tenantId;
    }

    @Data
    public static class ModelProperties {
        private String name = "default";
        private double temperature = 0.7;
    }
}
