package me.golemcore.companion.adapter.outbound.evaluation;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.exception.GenerationException;
import me.golemcore.companion.domain.model.EvaluationScore;
import me.golemcore.companion.domain.model.GenerationRequest;
import me.golemcore.companion.port.outbound.EvaluatorPort;
import me.golemcore.companion.port.outbound.ResponseGeneratorPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Evaluator that asks the language model for a JSON verdict
 * {@code {"score": 0.0-1.0, "rationale": "..."}}.
 *
 * <p>
 * An answer that cannot be parsed scores {@value #UNPARSABLE_SCORE}; a model
 * failure scores {@value #FAILURE_SCORE}.
 */
@Component
@ConditionalOnProperty(name = "companion.evaluator.provider", havingValue = "llm", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LlmEvaluatorAdapter implements EvaluatorPort {

    static final double UNPARSABLE_SCORE = 0.5;
    static final double FAILURE_SCORE = 0.0;

    private static final String INSTRUCTIONS = "You are a strict, independent evaluator. "
            + "Reply with JSON only, in the form {\"score\": <number between 0 and 1>, \"rationale\": \"<one sentence>\"}.";

    private final ResponseGeneratorPort generator;
    private final ObjectMapper objectMapper;

    @Override
    public EvaluationScore score(String response, String context) {
        String answer;
        try {
            answer = generator.generate(GenerationRequest.builder()
                    .context(INSTRUCTIONS + "\n\n" + context)
                    .query("Response to evaluate:\n" + response)
                    .temperature(0.0)
                    .build());
        } catch (GenerationException e) {
            log.warn("[Evaluator] Scoring failed: {}", e.getMessage());
            return new EvaluationScore(FAILURE_SCORE, "evaluator unavailable: " + e.getMessage());
        }
        return parse(answer);
    }

    EvaluationScore parse(String answer) {
        int start = answer.indexOf('{');
        int end = answer.lastIndexOf('}');
        if (start < 0 || end <= start) {
            log.debug("[Evaluator] No JSON object in answer: {}", answer);
            return new EvaluationScore(UNPARSABLE_SCORE, "unparsable evaluator answer");
        }
        try {
            JsonNode node = objectMapper.readTree(answer.substring(start, end + 1));
            JsonNode score = node.get("score");
            if (score == null || !score.isNumber()) {
                return new EvaluationScore(UNPARSABLE_SCORE, "evaluator answer has no numeric score");
            }
            JsonNode rationale = node.get("rationale");
            return new EvaluationScore(score.asDouble(), rationale != null ? rationale.asText() : null);
        } catch (JsonProcessingException e) {
            log.debug("[Evaluator] Invalid JSON in answer: {}", e.getOriginalMessage());
            return new EvaluationScore(UNPARSABLE_SCORE, "unparsable evaluator answer");
        }
    }
}
