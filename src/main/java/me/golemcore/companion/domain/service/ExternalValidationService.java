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
import me.golemcore.companion.domain.model.GenerationRequest;
import me.golemcore.companion.domain.model.ValidationReport;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.EvaluatorPort;
import me.golemcore.companion.port.outbound.ResponseGeneratorPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates a change by answering the validation scenarios with the change's
 * generation parameters and having the independent evaluator score each
 * answer. A scenario that cannot be answered scores zero.
 */
@Service
@Slf4j
public class ExternalValidationService {

    private final ResponseGeneratorPort generator;
    private final EvaluatorPort evaluator;
    private final CompanionProperties.ValidationProperties config;
    private final Clock clock;
    private final Deque<ValidationReport> history = new ArrayDeque<>();

    public ExternalValidationService(ResponseGeneratorPort generator, EvaluatorPort evaluator,
            CompanionProperties properties, Clock clock) {
        this.generator = generator;
        this.evaluator = evaluator;
        this.config = properties.getValidation();
        this.clock = clock;
    }

    /**
     * @param subject
     *            id of the change under validation
     * @param temperature
     *            generation temperature the change uses
     */
    public ValidationReport validate(String subject, double temperature) {
        List<String> scenarios = config.getScenarios();
        Map<String, Double> totals = new LinkedHashMap<>();
        config.getThresholds().keySet().forEach(metric -> totals.put(metric, 0.0));

        for (String scenario : scenarios) {
            String response;
            try {
                response = generator.generate(GenerationRequest.builder()
                        .context("Respond to the following situation.")
                        .query(scenario)
                        .temperature(temperature)
                        .build());
            } catch (GenerationException e) {
                log.warn("[Validation] Scenario could not be answered: {}", e.getMessage());
                continue;
            }
            for (String metric : totals.keySet()) {
                double score = evaluator.score(response, "Rate the " + metric.replace('_', ' ')
                        + " of this response to the situation: " + scenario).score();
                totals.merge(metric, score, Double::sum);
            }
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();
        totals.forEach((metric, total) -> {
            double mean = scenarios.isEmpty() ? 0.0 : total / scenarios.size();
            scores.put(metric, mean);
            if (mean < config.getThresholds().getOrDefault(metric, config.getDefaultThreshold())) {
                failed.add(metric);
            }
        });

        ValidationReport report = ValidationReport.builder()
                .subject(subject)
                .timestamp(clock.instant())
                .passed(failed.isEmpty())
                .scores(scores)
                .failedMetrics(failed)
                .build();
        synchronized (this) {
            history.addLast(report);
            while (history.size() > config.getHistoryLimit()) {
                history.removeFirst();
            }
        }
        if (report.isPassed()) {
            log.info("[Validation] Change {} passed validation", subject);
        } else {
            log.warn("[Validation] Change {} failed validation on {}", subject, failed);
        }
        return report;
    }

    public synchronized List<ValidationReport> getHistory() {
        return new ArrayList<>(history);
    }
}
