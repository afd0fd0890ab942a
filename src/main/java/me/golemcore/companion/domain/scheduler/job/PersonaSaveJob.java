package me.golemcore.companion.domain.scheduler.job;

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
import me.golemcore.companion.domain.scheduler.CounterSource;
import me.golemcore.companion.domain.scheduler.JobContext;
import me.golemcore.companion.domain.scheduler.JobTrigger;
import me.golemcore.companion.domain.scheduler.PeriodicJob;
import me.golemcore.companion.domain.service.PersonaService;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import org.springframework.stereotype.Component;

/**
 * Persists the persona on its interval or after enough persona changes.
 */
@Component
@RequiredArgsConstructor
public class PersonaSaveJob implements PeriodicJob {

    private final PersonaService personaService;
    private final CompanionProperties properties;

    @Override
    public String getName() {
        return "persona-save";
    }

    @Override
    public int getOrder() {
        return 30;
    }

    @Override
    public JobTrigger getTrigger() {
        return JobTrigger.of(properties.getScheduler().getPersonaSave(), CounterSource.PERSONA_CHANGE);
    }

    @Override
    public void run(JobContext context) {
        personaService.save();
    }
}
