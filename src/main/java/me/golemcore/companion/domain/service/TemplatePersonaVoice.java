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

import me.golemcore.companion.domain.model.PersonaState;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic persona voice: removes model self-references ("As an AI
 * language model, ...") in favour of the persona's name and introduces the
 * persona when answering a greeting.
 */
@Component
@ConditionalOnProperty(name = "companion.persona.voice", havingValue = "template", matchIfMissing = true)
public class TemplatePersonaVoice implements PersonaVoice {

    private static final Pattern AS_AN_AI = Pattern.compile(
            "\\bas an? (?:ai|artificial intelligence)(?: language model| assistant| model)?,?\\s*",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern I_AM_AN_AI = Pattern.compile(
            "\\b(I am|I'm) an? (?:ai|artificial intelligence)(?: language model| assistant| model)?\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern GREETING = Pattern.compile(
            "^\\s*(hello|hi|hey|good (morning|afternoon|evening)|greetings)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?](\\s|$)");

    @Override
    public String apply(PersonaState persona, String query, String rawResponse) {
        if (rawResponse == null || rawResponse.isBlank()) {
            return rawResponse;
        }
        String name = persona.getName();
        String voiced = I_AM_AN_AI.matcher(rawResponse).replaceAll(m -> m.group(1) + " " + name);
        voiced = AS_AN_AI.matcher(voiced).replaceAll("");
        voiced = capitalize(voiced.strip());

        if (voiced.isEmpty()) {
            return rawResponse;
        }
        if (isGreeting(query) && !voiced.toLowerCase(Locale.ROOT).contains(name.toLowerCase(Locale.ROOT))) {
            voiced = introduce(voiced, name);
        }
        return voiced;
    }

    static boolean isGreeting(String text) {
        return text != null && GREETING.matcher(text).find();
    }

    private static String introduce(String response, String name) {
        String introduction = "I'm " + name + ".";
        if (!isGreeting(response)) {
            return "Hello, " + introduction + " " + response;
        }
        Matcher end = SENTENCE_END.matcher(response);
        if (!end.find()) {
            return response + ". " + introduction;
        }
        int split = end.start() + 1;
        String rest = response.substring(split).strip();
        return response.substring(0, split) + " " + introduction + (rest.isEmpty() ? "" : " " + rest);
    }

    private static String capitalize(String text) {
        if (text.isEmpty() || !Character.isLowerCase(text.charAt(0))) {
            return text;
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
