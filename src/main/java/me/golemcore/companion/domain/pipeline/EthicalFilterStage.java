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
import me.golemcore.companion.domain.model.EthicalEvaluation;
import me.golemcore.companion.domain.model.FailureKind;
import me.golemcore.companion.domain.model.InteractionContext;
import me.golemcore.companion.domain.model.TraceStep;
import me.golemcore.companion.domain.service.EthicalFramework;
import me.golemcore.companion.domain.service.GenerationSettings;
import me.golemcore.companion.domain.service.PersonaVoice;
import me.golemcore.companion.port.outbound.ResponseGeneratorPort;
import org.springframework.stereotype.Component;

/**
 * Scores the voiced response against the ethical principles (order=50).
 *
 * <p>
 * A failing candidate gets exactly one regeneration from the generation
 * inputs plus correction guidance, voiced again and re-scored. When the retry
 * also fails, or cannot be produced, the response is flagged for the
 * correction stage. This is the only retry in the pipeline.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EthicalFilterStage implements PipelineStage {

    static final int MAX_RETRIES = 1;

    private final EthicalFramework ethicalFramework;
    private final ResponseGeneratorPort generator;
    private final PersonaVoice personaVoice;
    private final GenerationSettings generationSettings;

    @Override
    public String getName() {
        return "EthicalFilter";
    }

    @Override
    public int getOrder() {
        return 50;
    }

    @Override
    public InteractionContext process(InteractionContext context) {
        String query = context.getSanitizedText();
        String candidate = context.getResponseText();
        EthicalEvaluation evaluation = evaluate(context, candidate);
        if (evaluation.isPassed()) {
            context.addTrace(TraceStep.ETHICS_PASS);
            return context;
        }

        log.info("[Ethics] Candidate scored {} ({}), regenerating once", evaluation.getScore(),
                evaluation.getJudgment());
        context.addTrace(TraceStep.ETHICS_RETRY);
        context.setEthicalRetries(MAX_RETRIES);

        String retried;
        try {
            String raw = generator.generate(ResponseGenerationStage.request(context,
                    ethicalFramework.correctionGuidance(evaluation), generationSettings.getTemperature()));
            retried = personaVoice.apply(context.getPersona(), query, raw);
        } catch (GenerationException e) {
            log.warn("[Ethics] Regeneration failed: {}", e.getMessage());
            flag(context);
            return context;
        }

        EthicalEvaluation second = evaluate(context, retried);
        context.getResponse().setText(retried);
        if (second.isPassed()) {
            context.addTrace(TraceStep.ETHICS_PASS);
        } else {
            log.warn("[Ethics] Regenerated candidate still fails with score {}", second.getScore());
            flag(context);
        }
        return context;
    }

    private EthicalEvaluation evaluate(InteractionContext context, String candidate) {
        EthicalEvaluation evaluation = ethicalFramework.evaluate(candidate, context.getSanitizedText(),
                context.getPersona());
        ethicalFramework.recordDecision(evaluation, context.getSanitizedText(), candidate);
        context.setEthicalScore(evaluation.getScore());
        return evaluation;
    }

    private static void flag(InteractionContext context) {
        context.setEthicallyFlagged(true);
        context.addTrace(TraceStep.ETHICS_FAILED);
        context.addFailure(FailureKind.ETHICAL_VIOLATION);
    }
}
