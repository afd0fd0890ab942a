package me.golemcore.companion.domain.service;

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
import me.golemcore.companion.domain.model.GenerationRequest;
import me.golemcore.companion.domain.model.PersonaState;
import me.golemcore.companion.port.outbound.ResponseGeneratorPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Persona voice that asks the language model to reconstruct the response as
 * the persona. Keeps the raw response when the model call fails.
 */
@Component
@ConditionalOnProperty(name = "companion.persona.voice", havingValue = "llm")
@RequiredArgsConstructor
@Slf4j
public class LlmPersonaVoice implements PersonaVoice {

    private final ResponseGeneratorPort generator;

    @Override
    public String apply(PersonaState persona, String query, String rawResponse) {
        String traits = persona.getTraits().entrySet().stream()
                .map(e -> e.getKey() + " (" + Math.round(e.getValue() * 100) + "%)")
                .collect(Collectors.joining(", "));
        String instruction = "You are " + persona.getName() + ". Communication style: "
                + persona.getCommunicationStyle() + ". Traits: " + traits + ".\n"
                + "Rewrite the original response in your own first-person voice. Keep all of its "
                + "information and helpfulness. Return only the rewritten response.";
        String prompt = "User query: " + query + "\n\nOriginal response: " + rawResponse;
        try {
            String voiced = generator.generate(GenerationRequest.of(instruction, prompt));
            if (voiced == null || voiced.isBlank()) {
                return rawResponse;
            }
            return voiced.strip();
        } catch (GenerationException e) {
            log.warn("[Persona] Voice rewrite failed, keeping raw response: {}", e.getMessage());
            return rawResponse;
        }
    }
}
