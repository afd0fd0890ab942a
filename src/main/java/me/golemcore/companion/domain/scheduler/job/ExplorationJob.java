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
import me.golemcore.companion.domain.model.Discovery;
import me.golemcore.companion.domain.scheduler.CounterSource;
import me.golemcore.companion.domain.scheduler.JobContext;
import me.golemcore.companion.domain.scheduler.JobTrigger;
import me.golemcore.companion.domain.scheduler.PeriodicJob;
import me.golemcore.companion.domain.service.DiscoveryBuffer;
import me.golemcore.companion.domain.service.PersonaService;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.DiscoverySourcePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Explores the persona's interests and the default topics for new
 * discoveries. A topic whose lookup fails is skipped.
 */
@Component
@Slf4j
public class ExplorationJob implements PeriodicJob {

    private final DiscoverySourcePort discoverySource;
    private final DiscoveryBuffer discoveryBuffer;
    private final PersonaService personaService;
    private final CompanionProperties.ExplorationProperties config;
    private final JobTrigger trigger;
    private final Clock clock;

    public ExplorationJob(DiscoverySourcePort discoverySource, DiscoveryBuffer discoveryBuffer,
            PersonaService personaService, CompanionProperties properties, Clock clock) {
        this.discoverySource = discoverySource;
        this.discoveryBuffer = discoveryBuffer;
        this.personaService = personaService;
        this.config = properties.getExploration();
        this.trigger = JobTrigger.of(properties.getScheduler().getExploration(), CounterSource.NONE);
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "exploration";
    }

    @Override
    public int getOrder() {
        return 10;
    }

    @Override
    public JobTrigger getTrigger() {
        return trigger;
    }

    @Override
    public void run(JobContext context) {
        Set<String> topics = new LinkedHashSet<>(personaService.snapshot().getInterests());
        topics.addAll(config.getDefaultTopics());

        Instant now = clock.instant();
        List<Discovery> found = new ArrayList<>();
        int explored = 0;
        for (String topic : topics) {
            if (explored++ >= config.getMaxTopics() || context.isCancelled()) {
                break;
            }
            try {
                for (Discovery discovery : discoverySource.explore(topic, config.getResultsPerTopic())) {
                    if (discovery.getDiscoveredAt() == null) {
                        discovery.setDiscoveredAt(now);
                    }
                    if (discovery.getTopic() == null) {
                        discovery.setTopic(topic);
                    }
                    found.add(discovery);
                }
            } catch (RuntimeException e) {
                log.warn("[Exploration] Topic '{}' failed: {}", topic, e.getMessage());
            }
        }

        if (!found.isEmpty()) {
            discoveryBuffer.addAll(found);
            context.reportDiscoveries(found.size());
        }
        log.info("[Exploration] {} discoveries from {} topics", found.size(), Math.min(explored, topics.size()));
    }
}
