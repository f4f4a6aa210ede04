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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.turnguard.domain.model.AutonomyLevel;
import me.golemcore.turnguard.domain.model.TemperatureBand;
import me.golemcore.turnguard.domain.model.VerifyRepairCaps;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.Map;

/**
 * Shared infrastructure beans and startup validation of the autonomy
 * configuration.
 *
 * <p>
 * Startup fails fast when the verify/repair caps or any temperature band are
 * invalid, so a misconfigured control plane never serves a turn.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final TurnGuardProperties properties;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore TurnGuard v{} starting...", version);

        TurnGuardProperties.AutonomyProperties autonomy = properties.getAutonomy();
        AutonomyLevel level = AutonomyLevel.fromConfig(autonomy.getLevel());
        VerifyRepairCaps caps = validateCaps(autonomy);
        validateBands(autonomy.getTemperatureBands());

        log.info("Autonomy level: {} (rollout enabled: {}, stage: {})", level.getConfigKey(),
                autonomy.getRollout().isEnabled(), autonomy.getRollout().getStage());
        log.info("Verify/repair caps: max_attempts={}, max_repair_depth={}", caps.maxAttempts(),
                caps.maxRepairDepth());
        log.info("Persona reflect/writeback: {}", properties.getPersona().isEnabledMainSession());
        log.info("Tenant scope: {}", properties.getTenant().isEnabled() ? properties.getTenant().getTenantId()
                : "disabled");
    }

    private static VerifyRepairCaps validateCaps(TurnGuardProperties.AutonomyProperties autonomy) {
        try {
            return new VerifyRepairCaps(autonomy.getVerifyRepairMaxAttempts(),
                    autonomy.getVerifyRepairMaxRepairDepth());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid verify/repair configuration: " + e.getMessage(), e);
        }
    }

    private static void validateBands(TurnGuardProperties.TemperatureBandsProperties bands) {
        Map<String, TurnGuardProperties.BandProperties> configured = Map.of(
                "read_only", bands.getReadOnly(),
                "supervised", bands.getSupervised(),
                "full", bands.getFull());
        configured.forEach((name, band) -> {
            TemperatureBand candidate = new TemperatureBand(band.getMin(), band.getMax());
            if (!candidate.isValid()) {
                throw new IllegalStateException("Invalid temperature band for " + name + ": " + candidate);
            }
        });
    }
}
