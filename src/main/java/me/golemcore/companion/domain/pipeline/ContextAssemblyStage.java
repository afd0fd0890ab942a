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
import me.golemcore.companion.domain.exception.PersistenceException;
import me.golemcore.companion.domain.model.AssembledContext;
import me.golemcore.companion.domain.model.InteractionContext;
import me.golemcore.companion.domain.model.TraceStep;
import me.golemcore.companion.domain.service.ContextAssembler;
import me.golemcore.companion.domain.service.PersonaService;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the prompt context (order=20). When memory cannot be read the
 * response is generated from the persona context alone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContextAssemblyStage implements PipelineStage {

    private final ContextAssembler contextAssembler;
    private final PersonaService personaService;

    @Override
    public String getName() {
        return "ContextAssembly";
    }

    @Override
    public int getOrder() {
        return 20;
    }

    @Override
    public InteractionContext process(InteractionContext context) {
        String personaContext = personaService.buildPersonaContext();
        AssembledContext assembled;
        try {
            assembled = contextAssembler.assemble(context.getSanitizedText(), personaContext);
        } catch (PersistenceException e) {
            log.warn("[Pipeline] Memory unavailable, continuing without history: {}", e.getMessage());
            assembled = AssembledContext.builder().text(personaContext).sourceIds(List.of()).build();
        }
        context.setAssembledContext(assembled);
        context.addTrace(assembled.isEmpty() ? TraceStep.CONTEXT_EMPTY : TraceStep.CONTEXT_ASSEMBLED);
        return context;
    }
}
