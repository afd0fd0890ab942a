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

import me.golemcore.companion.domain.exception.GenerationException;
import me.golemcore.companion.domain.scheduler.CounterSource;
import me.golemcore.companion.domain.scheduler.JobContext;
import me.golemcore.companion.domain.scheduler.JobTrigger;
import me.golemcore.companion.domain.scheduler.PeriodicJob;
import me.golemcore.companion.domain.service.ReflectionEngine;
import me.golemcore.companion.domain.service.SelfImprovementService;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import org.springframework.stereotype.Component;

/**
 * Reflects on recent interactions every few interactions and plans an
 * experiment from the reflection.
 */
@Component
public class ReflectionJob implements PeriodicJob {

    private final ReflectionEngine reflectionEngine;
    private final SelfImprovementService selfImprovementService;
    private final JobTrigger trigger;

    public ReflectionJob(ReflectionEngine reflectionEngine, SelfImprovementService selfImprovementService,
            CompanionProperties properties) {
        this.reflectionEngine = reflectionEngine;
        this.selfImprovementService = selfImprovementService;
        this.trigger = JobTrigger.of(properties.getScheduler().getReflection(), CounterSource.INTERACTION);
    }

    @Override
    public String getName() {
        return "reflection";
    }

    @Override
    public int getOrder() {
        return 90;
    }

    @Override
    public JobTrigger getTrigger() {
        return trigger;
    }

    @Override
    public void run(JobContext context) throws GenerationException {
        reflectionEngine.reflect().ifPresent(selfImprovementService::planExperiment);
    }
}
