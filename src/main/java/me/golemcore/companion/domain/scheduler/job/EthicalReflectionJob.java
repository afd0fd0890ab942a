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
import me.golemcore.companion.domain.model.ReflectionRecord;
import me.golemcore.companion.domain.scheduler.CounterSource;
import me.golemcore.companion.domain.scheduler.JobContext;
import me.golemcore.companion.domain.scheduler.JobTrigger;
import me.golemcore.companion.domain.scheduler.PeriodicJob;
import me.golemcore.companion.domain.service.EthicalFramework;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.MemoryStorePort;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Stores an ethical insight drawn from the recent ethical decisions.
 */
@Component
@Slf4j
public class EthicalReflectionJob implements PeriodicJob {

    private final EthicalFramework ethicalFramework;
    private final MemoryStorePort memoryStore;
    private final JobTrigger trigger;

    public EthicalReflectionJob(EthicalFramework ethicalFramework, MemoryStorePort memoryStore,
            CompanionProperties properties) {
        this.ethicalFramework = ethicalFramework;
        this.memoryStore = memoryStore;
        this.trigger = JobTrigger.of(properties.getScheduler().getEthicalReflection(), CounterSource.NONE);
    }

    @Override
    public String getName() {
        return "ethical-reflection";
    }

    @Override
    public int getOrder() {
        return 80;
    }

    @Override
    public JobTrigger getTrigger() {
        return trigger;
    }

    @Override
    public void run(JobContext context) throws GenerationException {
        Optional<ReflectionRecord> insight = ethicalFramework.generateInsight();
        if (insight.isEmpty()) {
            log.debug("[Ethics] No decisions to reflect on yet");
            return;
        }
        memoryStore.storeReflection(insight.get());
    }
}
