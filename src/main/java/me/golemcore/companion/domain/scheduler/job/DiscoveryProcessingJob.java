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
import me.golemcore.companion.domain.exception.GenerationException;
import me.golemcore.companion.domain.model.Discovery;
import me.golemcore.companion.domain.scheduler.CounterSource;
import me.golemcore.companion.domain.scheduler.JobContext;
import me.golemcore.companion.domain.scheduler.JobTrigger;
import me.golemcore.companion.domain.scheduler.PeriodicJob;
import me.golemcore.companion.domain.service.DiscoveryBuffer;
import me.golemcore.companion.domain.service.PersonaService;
import me.golemcore.companion.domain.service.ReflectionEngine;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns new discoveries into an insight and lets the newest of them shape the
 * persona.
 */
@Component
@Slf4j
public class DiscoveryProcessingJob implements PeriodicJob {

    static final int PERSONA_WINDOW = 3;

    private final ReflectionEngine reflectionEngine;
    private final DiscoveryBuffer discoveryBuffer;
    private final PersonaService personaService;
    private final JobTrigger trigger;

    public DiscoveryProcessingJob(ReflectionEngine reflectionEngine, DiscoveryBuffer discoveryBuffer,
            PersonaService personaService, CompanionProperties properties) {
        this.reflectionEngine = reflectionEngine;
        this.discoveryBuffer = discoveryBuffer;
        this.personaService = personaService;
        this.trigger = JobTrigger.of(properties.getScheduler().getDiscoveryProcessing(), CounterSource.DISCOVERY);
    }

    @Override
    public String getName() {
        return "discovery-processing";
    }

    @Override
    public int getOrder() {
        return 40;
    }

    @Override
    public JobTrigger getTrigger() {
        return trigger;
    }

    @Override
    public void run(JobContext context) throws GenerationException {
        reflectionEngine.processDiscoveries();

        List<Discovery> fresh = discoveryBuffer.takeUnprocessed();
        int changes = 0;
        for (Discovery discovery : fresh.subList(Math.max(0, fresh.size() - PERSONA_WINDOW), fresh.size())) {
            changes += personaService.applyDiscovery(discovery);
        }
        context.reportPersonaChanges(changes);
        log.info("[Discovery] Processed {} new discoveries, {} persona changes", fresh.size(), changes);
    }
}
