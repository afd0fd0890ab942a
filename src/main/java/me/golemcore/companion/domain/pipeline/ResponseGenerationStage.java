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
import me.golemcore.companion.domain.exception.GenerationException;
import me.golemcore.companion.domain.model.FailureKind;
import me.golemcore.companion.domain.model.GenerationRequest;
import me.golemcore.companion.domain.model.InteractionContext;
import me.golemcore.companion.domain.model.OutboundResponse;
import me.golemcore.companion.domain.model.TraceStep;
import me.golemcore.companion.domain.service.GenerationSettings;
import me.golemcore.companion.infrastructure.i18n.MessageService;
import me.golemcore.companion.port.outbound.ResponseGeneratorPort;
import org.springframework.stereotype.Component;

/**
 * Calls the response generator (order=30). A generation error short-circuits
 * to the fixed fallback reply.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResponseGenerationStage implements PipelineStage {

    private final ResponseGeneratorPort generator;
    private final GenerationSettings generationSettings;
    private final MessageService messageService;

    @Override
    public String getName() {
        return "ResponseGeneration";
    }

    @Override
    public int getOrder() {
        return 30;
    }

    @Override
    public InteractionContext process(InteractionContext context) {
        GenerationRequest request = request(context, null, generationSettings.getTemperature());
        try {
            String raw = generator.generate(request);
            context.setRawResponse(raw);
            context.setResponse(OutboundResponse.generated(raw));
            context.addTrace(TraceStep.GENERATED);
        } catch (GenerationException e) {
            log.warn("[Pipeline] Generation failed for interaction {}: {}", context.getInteractionId(),
                    e.getMessage());
            context.addTrace(TraceStep.GENERATION_FAILED);
            context.addFailure(FailureKind.GENERATION_FAILURE);
            context.shortCircuit(OutboundResponse.fallback(messageService.getMessage("generation.fallback")));
        }
        return context;
    }

    /**
     * Request built from the stage inputs, optionally extended with extra
     * guidance appended to the context.
     */
    static GenerationRequest request(InteractionContext context, String guidance, double temperature) {
        String base = context.getAssembledContext() != null ? context.getAssembledContext().getText() : "";
        String text = guidance == null ? base : base + "\n\n" + guidance;
        return GenerationRequest.builder()
                .context(text)
                .query(context.getSanitizedText())
                .temperature(temperature)
                .build();
    }
}
