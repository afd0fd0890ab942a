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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-job schedule bookkeeping, persisted as {@code scheduler/state.json}.
 * Mutated only by the {@link PeriodicScheduler}.
 */
@Data
@NoArgsConstructor
public class ScheduleState {

    private Map<String, JobState> jobs = new LinkedHashMap<>();

    public JobState job(String name) {
        return jobs.computeIfAbsent(name, k -> new JobState());
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class JobState {

        /** Last attempt, successful or not. Drives the interval trigger. */
        private Instant lastRunAt;

        private Instant lastSuccessAt;

        /** Events counted since the last successful run. */
        private int counter;

        private int failureCount;
        private String lastError;
    }
}
