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
import me.golemcore.turnguard.domain.model.AutonomyLevel;
import me.golemcore.turnguard.domain.model.TemperatureBand;
import me.golemcore.turnguard.infrastructure.config.TurnGuardProperties;
import org.springframework.stereotype.Service;

/**
 * Maps an autonomy level to its configured sampling-temperature band and
 * clamps requested temperatures into it.
 *
 * <p>
 * Bands are configured under {@code turnguard.autonomy.temperature-bands.*}.
 * A clamp notice is logged only when the value actually changes.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TemperatureClamp {

    static final double EPSILON = 1e-9;

    private final TurnGuardProperties properties;

    public TemperatureBand bandFor(AutonomyLevel level) {
        TurnGuardProperties.TemperatureBandsProperties bands = properties.getAutonomy().getTemperatureBands();
        TurnGuardProperties.BandProperties band = switch (level) {
        case READ_ONLY -> bands.getReadOnly();
        case SUPERVISED -> bands.getSupervised();
        case FULL -> bands.getFull();
        };
        return new TemperatureBand(band.getMin(), band.getMax());
    }

    public double clamp(double requested, AutonomyLevel level) {
        TemperatureBand band = bandFor(level);
        double clamped = band.clamp(requested);
        if (Math.abs(clamped - requested) > EPSILON) {
            log.info("[Temperature] Clamped to autonomy band: level={}, requested={}, clamped={}, band={}",
                    level.getConfigKey(), requested, clamped, band);
        }
        return clamped;
    }
}
