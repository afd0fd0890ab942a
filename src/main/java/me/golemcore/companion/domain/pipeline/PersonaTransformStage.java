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
import me.golemcore.companion.domain.model.InteractionContext;
import me.golemcore.companion.domain.model.PersonaState;
import me.golemcore.companion.domain.model.TraceStep;
import me.golemcore.companion.domain.service.PersonaService;
import me.golemcore.companion.domain.service.PersonaVoice;
import org.springframework.stereotype.Component;

/**
 * Rewrites the raw response in the persona's voice and applies the trait
 * adjustments signalled by the query (order=40). Persona persistence is left
 * to the scheduler.
 */
@Component
@RequiredArgsConstructor
public class PersonaTransformStage implements PipelineStage {

    private final PersonaService personaService;
    private final PersonaVoice personaVoice;

    @Override
    public String getName() {
        return "PersonaTransform";
    }

    @Override
    public int getOrder() {
        return 40;
    }

    @Override
    public InteractionContext process(InteractionContext context) {
        PersonaState persona = personaService.snapshot();
        String voiced = personaVoice.apply(persona, context.getSanitizedText(), context.getRawResponse());
        context.getResponse().setText(voiced);
        context.setPersona(persona);
        context.setPersonaChanges(context.getPersonaChanges()
                + personaService.applyInteraction(context.getSanitizedText()));
        context.addTrace(TraceStep.PERSONA_APPLIED);
        return context;
    }
}
