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
import me.golemcore.companion.domain.scheduler.CounterSource;
import me.golemcore.companion.domain.scheduler.JobContext;
import me.golemcore.companion.domain.scheduler.JobTrigger;
import me.golemcore.companion.domain.scheduler.PeriodicJob;
import me.golemcore.companion.domain.service.ConversationInitiator;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Lets the companion open a conversation with every active sender.
 */
@Component
@Slf4j
public class ConversationInitiationJob implements PeriodicJob {

    private final ConversationInitiator initiator;
    private final JobTrigger trigger;

    public ConversationInitiationJob(ConversationInitiator initiator, CompanionProperties properties) {
        this.initiator = initiator;
        this.trigger = JobTrigger.of(properties.getScheduler().getConversationInitiation(), CounterSource.NONE);
    }

    @Override
    public String getName() {
        return "conversation-initiation";
    }

    @Override
    public int getOrder() {
        return 20;
    }

    @Override
    public JobTrigger getTrigger() {
        return trigger;
    }

    @Override
    public void run(JobContext context) throws GenerationException {
        Set<String> senders = context.activeSenders();
        if (senders.isEmpty()) {
            log.debug("[Initiation] No active senders");
            return;
        }
        Optional<String> message = initiator.maybeInitiate();
        if (message.isEmpty()) {
            return;
        }
        for (String sender : senders) {
            if (!context.sendMessage(sender, message.get())) {
                log.warn("[Initiation] Could not deliver opening message to {}", sender);
            }
        }
    }
}
