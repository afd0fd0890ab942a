package me.golemcore.companion.domain.service;

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

import me.golemcore.companion.infrastructure.config.CompanionProperties;
import org.springframework.stereotype.Component;

/**
 * Runtime generation parameters. Starts from the configured temperature and
 * is changed only by applied or reverted self-improvements.
 */
@Component
public class GenerationSettings {

    static final double MIN_TEMPERATURE = 0.0;
    static final double MAX_TEMPERATURE = 2.0;

    private double temperature;

    public GenerationSettings(CompanionProperties properties) {
        this.temperature = clamp(properties.getLlm().getTemperature());
    }

    public synchronized double getTemperature() {
        return temperature;
    }

    /**
     * @return the previous temperature
     */
    public synchronized double setTemperature(double value) {
        double previous = temperature;
        temperature = clamp(value);
        return previous;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return MIN_TEMPERATURE;
        }
        return Math.max(MIN_TEMPERATURE, Math.min(MAX_TEMPERATURE, value));
    }
}
