package me.golemcore.companion.domain.pipeline;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.model.FailureKind;
import me.golemcore.companion.domain.model.Interaction;
import me.golemcore.companion.domain.model.InteractionContext;
import me.golemcore.companion.port.outbound.MemoryStorePort;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Writes the finalized interaction once (order=70). A failed write is logged
 * and recorded on the context; the response is still delivered.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PersistenceStage implements PipelineStage {

    private final MemoryStorePort memoryStore;
    private final Clock clock;

    @Override
    public String getName() {
        return "Persistence";
    }

    @Override
    public int getOrder() {
        return 70;
    }

    @Override
    public boolean shouldProcess(InteractionContext context) {
        return !context.isRejected() && !context.isPersisted();
    }

    @Override
    public boolean isMandatory() {
        return true;
    }

    @Override
    public InteractionContext process(InteractionContext context) {
        Interaction interaction = context.toInteraction(clock.instant());
        try {
            memoryStore.storeInteraction(interaction);
            context.setPersisted(true);
        } catch (RuntimeException e) { // NOSONAR - delivery does not depend on durability
            log.warn("[Pipeline] Failed to persist interaction {}: {}", context.getInteractionId(),
                    e.getMessage());
            context.addFailure(FailureKind.PERSISTENCE_FAILURE);
        }
        return context;
    }
}
