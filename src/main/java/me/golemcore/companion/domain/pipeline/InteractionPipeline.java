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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.model.InboundMessage;
import me.golemcore.companion.domain.model.InteractionContext;
import me.golemcore.companion.domain.model.OutboundResponse;
import me.golemcore.companion.domain.model.TraceStep;
import me.golemcore.companion.infrastructure.i18n.MessageService;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Runs the ordered stages for one inbound message (SafetyGate -> ContextAssembly
 * -> ResponseGeneration -> PersonaTransform -> EthicalFilter -> Correction ->
 * Persistence).
 *
 * <p>
 * Failure handling:
 * <ul>
 * <li>a gate rejection ends the run immediately;</li>
 * <li>a stage that throws is logged, its failure traced, and the response is
 * replaced by the generic fallback;</li>
 * <li>cancellation is checked before each stage: remaining content stages are
 * skipped, the mandatory stages still run.</li>
 * </ul>
 * Every run therefore ends with a non-null response.
 */
@Component
@Slf4j
public class InteractionPipeline {

    private static final String GENERIC_FALLBACK_KEY = "system.error.generic";

    private final List<PipelineStage> stages;
    private final MessageService messageService;
    private final Clock clock;

    public InteractionPipeline(List<PipelineStage> stages, MessageService messageService, Clock clock) {
        List<PipelineStage> sorted = new ArrayList<>(stages);
        sorted.sort(Comparator.comparingInt(PipelineStage::getOrder));
        this.stages = List.copyOf(sorted);
        this.messageService = messageService;
        this.clock = clock;
        log.info("[Pipeline] stages: {}", this.stages.stream().map(PipelineStage::getName).toList());
    }

    public InteractionContext run(InboundMessage message) {
        return run(message, () -> false);
    }

    public InteractionContext run(InboundMessage message, BooleanSupplier cancelled) {
        InteractionContext context = InteractionContext.builder()
                .interactionId(UUID.randomUUID().toString())
                .message(message)
                .startedAt(clock.instant())
                .build();

        for (PipelineStage stage : stages) {
            if (context.isRejected()) {
                break;
            }
            if (!stage.isMandatory() && !context.isShortCircuited() && cancelled.getAsBoolean()) {
                log.info("[Pipeline] Cancelled before stage '{}'", stage.getName());
                context.addTrace(TraceStep.CANCELLED);
                context.shortCircuit(genericFallback());
            }
            if (!stage.shouldProcess(context)) {
                log.debug("[Pipeline] Stage '{}' skipped", stage.getName());
                continue;
            }

            long startMs = clock.millis();
            try {
                context = stage.process(context);
                log.debug("[Pipeline] Stage '{}' completed in {}ms", stage.getName(), clock.millis() - startMs);
            } catch (RuntimeException e) {
                log.error("[Pipeline] Stage '{}' FAILED after {}ms: {}", stage.getName(),
                        clock.millis() - startMs, e.getMessage(), e);
                context.addTrace(TraceStep.STAGE_FAILED);
                context.shortCircuit(genericFallback());
            }
        }

        if (context.getResponse() == null) {
            context.shortCircuit(genericFallback());
        }
        log.debug("[Pipeline] Interaction {} trace: {}", context.getInteractionId(), context.getTrace());
        return context;
    }

    public List<PipelineStage> getStages() {
        return stages;
    }

    private OutboundResponse genericFallback() {
        return OutboundResponse.fallback(messageService.getMessage(GENERIC_FALLBACK_KEY));
    }
}
