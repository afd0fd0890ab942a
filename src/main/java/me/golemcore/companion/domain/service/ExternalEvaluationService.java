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
import me.golemcore.companion.domain.model.EvaluationReport;
import me.golemcore.companion.domain.model.GenerationRequest;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.EvaluatorPort;
import me.golemcore.companion.port.outbound.ResponseGeneratorPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the test prompts through the generator and has the evaluator score
 * each answer per criterion. A prompt that cannot be answered scores zero on
 * every criterion and lowers the report confidence.
 */
@Service
@Slf4j
public class ExternalEvaluationService {

    private final ResponseGeneratorPort generator;
    private final EvaluatorPort evaluator;
    private final PersonaService personaService;
    private final GenerationSettings generationSettings;
    private final CompanionProperties.EvaluationProperties config;
    private final Clock clock;

    private EvaluationReport lastReport;

    public ExternalEvaluationService(ResponseGeneratorPort generator, EvaluatorPort evaluator,
            PersonaService personaService, GenerationSettings generationSettings, CompanionProperties properties,
            Clock clock) {
        this.generator = generator;
        this.evaluator = evaluator;
        this.personaService = personaService;
        this.generationSettings = generationSettings;
        this.config = properties.getEvaluation();
        this.clock = clock;
    }

    public EvaluationReport evaluate() {
        List<String> prompts = config.getTestPrompts();
        List<String> criteria = config.getCriteria();
        Map<String, Double> totals = new LinkedHashMap<>();
        criteria.forEach(criterion -> totals.put(criterion, 0.0));
        int answered = 0;

        String personaContext = personaService.buildPersonaContext();
        for (String prompt : prompts) {
            String response;
            try {
                response = generator.generate(GenerationRequest.builder()
                        .context(personaContext)
                        .query(prompt)
                        .temperature(generationSettings.getTemperature())
                        .build());
            } catch (GenerationException e) {
                log.warn("[Evaluation] No answer for test prompt '{}': {}", prompt, e.getMessage());
                continue;
            }
            answered++;
            for (String criterion : criteria) {
                double score = evaluator.score(response,
                        "Rate the " + criterion + " of this answer to the question: " + prompt).score();
                totals.merge(criterion, score, Double::sum);
            }
        }

        Map<String, Double> criterionScores = new LinkedHashMap<>();
        List<String> strengths = new ArrayList<>();
        List<String> weaknesses = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        double sum = 0.0;
        for (Map.Entry<String, Double> entry : totals.entrySet()) {
            double mean = prompts.isEmpty() ? 0.0 : entry.getValue() / prompts.size();
            criterionScores.put(entry.getKey(), mean);
            sum += mean;
            if (mean >= config.getThreshold()) {
                strengths.add(entry.getKey());
            } else {
                weaknesses.add(entry.getKey());
                suggestions.add("Improve " + entry.getKey() + " of answers");
            }
        }
        double overall = criterionScores.isEmpty() ? 0.0 : sum / criterionScores.size();

        EvaluationReport report = EvaluationReport.builder()
                .timestamp(clock.instant())
                .overallScore(overall)
                .confidence(prompts.isEmpty() ? 0.0 : (double) answered / prompts.size())
                .meetsThreshold(overall >= config.getThreshold())
                .criterionScores(criterionScores)
                .strengths(strengths)
                .weaknesses(weaknesses)
                .suggestions(suggestions)
                .build();
        synchronized (this) {
            lastReport = report;
        }
        log.info("[Evaluation] Overall score {} ({} of {} prompts answered), weaknesses: {}",
                String.format(Locale.ROOT, "%.2f", overall), answered, prompts.size(), weaknesses);
        return report;
    }

    public synchronized Optional<EvaluationReport> getLastReport() {
        return Optional.ofNullable(lastReport);
    }
}
