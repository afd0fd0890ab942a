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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.model.Experiment;
import me.golemcore.companion.domain.model.ExperimentStatus;
import me.golemcore.companion.domain.scheduler.CounterSource;
import me.golemcore.companion.domain.scheduler.JobContext;
import me.golemcore.companion.domain.scheduler.JobTrigger;
import me.golemcore.companion.domain.scheduler.PeriodicJob;
import me.golemcore.companion.domain.service.SelfImprovementService;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the experiments planned from reflections.
 */
@Component
@Slf4j
public class SelfImprovementJob implements PeriodicJob {

    private final SelfImprovementService selfImprovementService;
    private final JobTrigger trigger;

    public SelfImprovementJob(SelfImprovementService selfImprovementService, CompanionProperties properties) {
        this.selfImprovementService = selfImprovementService;
        this.trigger = JobTrigger.of(properties.getScheduler().getSelfImprovement(), CounterSource.NONE);
    }

    @Override
    public String getName() {
        return "self-improvement";
    }

    @Override
    public int getOrder() {
        return 60;
    }

    @Override
    public JobTrigger getTrigger() {
        return trigger;
    }

    @Override
    public void run(JobContext context) {
        List<Experiment> ran = selfImprovementService.runPlannedExperiments();
        long succeeded = ran.stream().filter(e -> e.getStatus() == ExperimentStatus.SUCCEEDED).count();
        log.info("[SelfImprovement] {} experiments run, {} succeeded", ran.size(), succeeded);
    }
}
