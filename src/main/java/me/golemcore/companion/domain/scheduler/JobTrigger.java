package me.golemcore.companion.domain.scheduler;

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

import java.time.Duration;

/**
 * When a periodic job is due: once {@code interval} has elapsed since its last
 * attempt, or once {@code counterThreshold} events of {@code counterSource}
 * have accumulated since its last successful run. Either condition suffices.
 *
 * @param interval
 *            null disables the time trigger
 * @param counterThreshold
 *            zero or less disables the counter trigger
 */
public record JobTrigger(Duration interval, int counterThreshold, CounterSource counterSource) {

    public static JobTrigger of(CompanionProperties.JobProperties properties, CounterSource counterSource) {
        Duration interval = properties.getInterval();
        if (interval != null && (interval.isZero() || interval.isNegative())) {
            interval = null;
        }
        return new JobTrigger(interval, properties.getCounterThreshold(), counterSource);
    }

    public boolean hasInterval() {
        return interval != null;
    }

    public boolean hasCounter() {
        return counterThreshold > 0 && counterSource != CounterSource.NONE;
    }
}
