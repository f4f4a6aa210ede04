package me.golemcore.turnguard.domain.model;

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

/**
 * Allowed sampling-temperature range for one autonomy level.
 */
public record TemperatureBand(double min, double max) {

    public static final double LOWER_LIMIT = 0.0;
    public static final double UPPER_LIMIT = 2.0;

    /**
     * A band is valid when neither bound is NaN, both lie within
     * {@code [0.0, 2.0]}, and {@code min <= max}.
     */
    public boolean isValid() {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            return false;
        }
        return min >= LOWER_LIMIT && max <= UPPER_LIMIT && min <= max;
    }

    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
