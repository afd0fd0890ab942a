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
import me.golemcore.companion.domain.model.EvaluationReport;
import me.golemcore.companion.domain.scheduler.CounterSource;
import me.golemcore.companion.domain.scheduler.JobContext;
import me.golemcore.companion.domain.scheduler.JobTrigger;
import me.golemcore.companion.domain.scheduler.PeriodicJob;
import me.golemcore.companion.domain.service.ExternalEvaluationService;
import me.golemcore.companion.domain.service.PersonaService;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import org.springframework.stereotype.Component;

/**
 * Evaluates answer quality and feeds the result into the persona traits.
 */
@Component
@Slf4j
public class ExternalEvaluationJob implements PeriodicJob {

    private final ExternalEvaluationService evaluationService;
    private final PersonaService personaService;
    private final JobTrigger trigger;

    public ExternalEvaluationJob(ExternalEvaluationService evaluationService, PersonaService personaService,
            CompanionProperties properties) {
        this.evaluationService = evaluationService;
        this.personaService = personaService;
        this.trigger = JobTrigger.of(properties.getScheduler().getExternalEvaluation(), CounterSource.NONE);
    }

    @Override
    public String getName() {
        return "external-evaluation";
    }

    @Override
    public int getOrder() {
        return 50;
    }

    @Override
    public JobTrigger getTrigger() {
        return trigger;
    }

    @Override
    public void run(JobContext context) {
        EvaluationReport report = evaluationService.evaluate();
        if (!report.isMeetsThreshold()) {
            log.warn("[Evaluation] Below threshold, suggestions: {}", report.getSuggestions());
        }
        context.reportPersonaChanges(
                personaService.applyExternalEvaluation(report.getOverallScore(), report.getConfidence()));
    }
}
