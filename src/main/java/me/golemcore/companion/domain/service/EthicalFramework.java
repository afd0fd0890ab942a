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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.exception.GenerationException;
import me.golemcore.companion.domain.model.EthicalEvaluation;
import me.golemcore.companion.domain.model.EthicalReflection;
import me.golemcore.companion.domain.model.EvaluationScore;
import me.golemcore.companion.domain.model.GenerationRequest;
import me.golemcore.companion.domain.model.Judgment;
import me.golemcore.companion.domain.model.PersonaState;
import me.golemcore.companion.domain.model.ReflectionKind;
import me.golemcore.companion.domain.model.ReflectionRecord;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.EvaluatorPort;
import me.golemcore.companion.port.outbound.ResponseGeneratorPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Scores responses against the configured ethical principles and keeps a
 * bounded log of decisions for the periodic ethical insight.
 *
 * <p>
 * Judgment: score at or above the pass threshold is {@link Judgment#ALLOW},
 * at or above the review threshold {@link Judgment#REVIEW}, otherwise
 * {@link Judgment#BLOCK}.
 */
@Service
@Slf4j
public class EthicalFramework {

    static final int INSIGHT_WINDOW = 5;
    private static final int EXCERPT_CHARS = 200;

    private final EvaluatorPort evaluator;
    private final ResponseGeneratorPort generator;
    private final CompanionProperties.EthicsProperties config;
    private final Clock clock;
    private final Deque<EthicalReflection> reflections = new ArrayDeque<>();

    public EthicalFramework(EvaluatorPort evaluator, ResponseGeneratorPort generator,
            CompanionProperties properties, Clock clock) {
        this.evaluator = evaluator;
        this.generator = generator;
        this.config = properties.getEthics();
        this.clock = clock;
    }

    public EthicalEvaluation evaluate(String response, String query, PersonaState persona) {
        EvaluationScore result = evaluator.score(response, buildContext(query, persona));
        Judgment judgment = judge(result.score());
        log.debug("[Ethics] score={} judgment={}", result.score(), judgment);
        return EthicalEvaluation.builder()
                .score(result.score())
                .rationale(result.rationale())
                .judgment(judgment)
                .passed(result.score() >= config.getPassThreshold())
                .build();
    }

    public Judgment judge(double score) {
        if (score >= config.getPassThreshold()) {
            return Judgment.ALLOW;
        }
        if (score >= config.getReviewThreshold()) {
            return Judgment.REVIEW;
        }
        return Judgment.BLOCK;
    }

    /**
     * Guidance appended to the context when a candidate is regenerated after a
     * failed evaluation.
     */
    public String correctionGuidance(EthicalEvaluation evaluation) {
        StringBuilder sb = new StringBuilder("Your previous answer did not meet these principles:\n");
        config.getPrinciples().forEach((name, text) -> sb.append("- ").append(name).append(": ")
                .append(text).append('\n'));
        if (evaluation.getRationale() != null && !evaluation.getRationale().isBlank()) {
            sb.append("Reviewer notes: ").append(evaluation.getRationale()).append('\n');
        }
        sb.append("Answer again so that the response respects all of them.");
        return sb.toString();
    }

    public synchronized void recordDecision(EthicalEvaluation evaluation, String query, String response) {
        reflections.addLast(EthicalReflection.builder()
                .timestamp(clock.instant())
                .score(evaluation.getScore())
                .judgment(evaluation.getJudgment())
                .rationale(evaluation.getRationale())
                .queryExcerpt(excerpt(query))
                .responseExcerpt(excerpt(response))
                .build());
        while (reflections.size() > config.getReflectionHistory()) {
            reflections.removeFirst();
        }
    }

    public synchronized List<EthicalReflection> getReflections() {
        return new ArrayList<>(reflections);
    }

    /**
     * Summarize the most recent ethical decisions into an insight.
     *
     * @return empty when no decision has been recorded yet
     * @throws GenerationException
     *             if the model call fails
     */
    public Optional<ReflectionRecord> generateInsight() throws GenerationException {
        List<EthicalReflection> recent;
        synchronized (this) {
            if (reflections.isEmpty()) {
                return Optional.empty();
            }
            List<EthicalReflection> all = new ArrayList<>(reflections);
            recent = all.subList(Math.max(0, all.size() - INSIGHT_WINDOW), all.size());
        }

        StringBuilder prompt = new StringBuilder("Recent ethical decisions:\n");
        for (int i = 0; i < recent.size(); i++) {
            EthicalReflection r = recent.get(i);
            prompt.append(i + 1).append(". score ").append(String.format(Locale.ROOT, "%.2f", r.getScore()))
                    .append(" (").append(r.getJudgment()).append(") for query: ")
                    .append(r.getQueryExcerpt()).append('\n');
        }
        prompt.append("What general ethical insight follows from these decisions?");

        String insight = generator.generate(GenerationRequest.of(
                "You reflect on your own ethical decisions. Principles: " + String.join(", ",
                        config.getPrinciples().keySet()),
                prompt.toString()));
        log.info("[Ethics] Generated ethical insight from {} decisions", recent.size());
        return Optional.of(ReflectionRecord.builder()
                .id(UUID.randomUUID().toString())
                .kind(ReflectionKind.ETHICAL_INSIGHT)
                .timestamp(clock.instant())
                .text(insight)
                .build());
    }

    private String buildContext(String query, PersonaState persona) {
        StringBuilder sb = new StringBuilder("Evaluate the response against these ethical principles:\n");
        config.getPrinciples().forEach((name, text) -> sb.append("- ").append(name).append(": ")
                .append(text).append('\n'));
        if (persona != null) {
            sb.append("The response is written by ").append(persona.getName()).append(".\n");
        }
        sb.append("User query: ").append(query);
        return sb.toString();
    }

    private static String excerpt(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= EXCERPT_CHARS ? text : text.substring(0, EXCERPT_CHARS) + "...";
    }
}
