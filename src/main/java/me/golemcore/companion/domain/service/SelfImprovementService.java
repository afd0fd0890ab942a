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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.exception.GenerationException;
import me.golemcore.companion.domain.model.Experiment;
import me.golemcore.companion.domain.model.ExperimentStatus;
import me.golemcore.companion.domain.model.GenerationRequest;
import me.golemcore.companion.domain.model.Improvement;
import me.golemcore.companion.domain.model.ImprovementStatus;
import me.golemcore.companion.domain.model.ReflectionRecord;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.EvaluatorPort;
import me.golemcore.companion.port.outbound.ResponseGeneratorPort;
import me.golemcore.companion.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Plans generation-parameter experiments from reflections, tests them against
 * the evaluation prompts and applies the successful ones to
 * {@link GenerationSettings}.
 *
 * <p>
 * An experiment succeeds when every metric reaches the improvement threshold
 * and the mean margin over the threshold is positive. The applied change
 * becomes the single {@link ImprovementStatus#ACTIVE} improvement and can be
 * quarantined later, which restores the previous temperature.
 *
 * <p>
 * Experiments and improvements are kept in {@code improvement/state.json}.
 */
@Service
@Slf4j
public class SelfImprovementService {

    static final double TEMPERATURE_STEP = 0.2;

    private static final String IMPROVEMENT_DIR = "improvement";
    private static final String STATE_FILE = "state.json";

    private final ResponseGeneratorPort generator;
    private final EvaluatorPort evaluator;
    private final GenerationSettings generationSettings;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final CompanionProperties.SelfImprovementProperties config;
    private final List<String> testPrompts;
    private final Clock clock;

    private ImprovementLog state = new ImprovementLog();

    public SelfImprovementService(ResponseGeneratorPort generator, EvaluatorPort evaluator,
            GenerationSettings generationSettings, StoragePort storagePort, ObjectMapper objectMapper,
            CompanionProperties properties, Clock clock) {
        this.generator = generator;
        this.evaluator = evaluator;
        this.generationSettings = generationSettings;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.config = properties.getSelfImprovement();
        this.testPrompts = properties.getEvaluation().getTestPrompts();
        this.clock = clock;
    }

    @PostConstruct
    public synchronized void init() {
        try {
            String json = storagePort.getText(IMPROVEMENT_DIR, STATE_FILE).join();
            if (json != null && !json.isBlank()) {
                state = objectMapper.readValue(json, ImprovementLog.class);
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - start with an empty log
            log.warn("[SelfImprovement] Failed to load state, starting fresh: {}", e.getMessage());
            state = new ImprovementLog();
        }
        getActiveImprovement().ifPresent(active -> {
            generationSettings.setTemperature(active.getTemperature());
            log.info("[SelfImprovement] Restored active improvement {} (temperature {})", active.getId(),
                    active.getTemperature());
        });
    }

    /**
     * Plan one temperature experiment motivated by a reflection.
     */
    public synchronized Experiment planExperiment(ReflectionRecord reflection) {
        double current = generationSettings.getTemperature();
        double candidate = config.getExperimentTemperature();
        if (Math.abs(candidate - current) < 1e-9) {
            candidate = current > 1.0 ? current - TEMPERATURE_STEP : current + TEMPERATURE_STEP;
        }
        Experiment experiment = Experiment.builder()
                .id(UUID.randomUUID().toString())
                .hypothesis(String.format(Locale.ROOT,
                        "Generating with temperature %.2f instead of %.2f improves %s", candidate, current,
                        String.join(", ", config.getMetrics())))
                .reflectionId(reflection != null ? reflection.getId() : null)
                .temperature(candidate)
                .createdAt(clock.instant())
                .build();
        state.getExperiments().add(experiment);
        while (state.getExperiments().size() > config.getMaxExperiments()) {
            state.getExperiments().remove(0);
        }
        save();
        log.info("[SelfImprovement] Planned experiment {}: {}", experiment.getId(), experiment.getHypothesis());
        return experiment;
    }

    /**
     * Run every planned experiment.
     *
     * @return the experiments that ran in this call
     */
    public synchronized List<Experiment> runPlannedExperiments() {
        List<Experiment> ran = new ArrayList<>();
        for (Experiment experiment : state.getExperiments()) {
            if (experiment.getStatus() != ExperimentStatus.PLANNED) {
                continue;
            }
            runExperiment(experiment);
            ran.add(experiment);
        }
        if (!ran.isEmpty()) {
            save();
        }
        return ran;
    }

    public synchronized Optional<Improvement> getActiveImprovement() {
        return state.getImprovements().stream()
                .filter(improvement -> improvement.getStatus() == ImprovementStatus.ACTIVE)
                .reduce((first, second) -> second);
    }

    /**
     * Mark an improvement inactive and restore the temperature it replaced.
     */
    public synchronized void quarantine(String improvementId, String reason) {
        for (Improvement improvement : state.getImprovements()) {
            if (!improvement.getId().equals(improvementId)
                    || improvement.getStatus() == ImprovementStatus.QUARANTINED) {
                continue;
            }
            boolean wasActive = improvement.getStatus() == ImprovementStatus.ACTIVE;
            improvement.setStatus(ImprovementStatus.QUARANTINED);
            improvement.setQuarantinedAt(clock.instant());
            improvement.setQuarantineReason(reason);
            if (wasActive) {
                generationSettings.setTemperature(improvement.getPreviousTemperature());
            }
            save();
            log.warn("[SelfImprovement] Improvement {} quarantined: {}", improvementId, reason);
            return;
        }
    }

    public synchronized List<Experiment> getExperiments() {
        return new ArrayList<>(state.getExperiments());
    }

    public synchronized List<Improvement> getImprovements() {
        return new ArrayList<>(state.getImprovements());
    }

    private void runExperiment(Experiment experiment) {
        Map<String, Double> results = new LinkedHashMap<>();
        try {
            for (String metric : config.getMetrics()) {
                results.put(metric, measure(metric, experiment.getTemperature()));
            }
        } catch (GenerationException e) {
            log.warn("[SelfImprovement] Experiment {} could not be measured: {}", experiment.getId(),
                    e.getMessage());
            complete(experiment, ExperimentStatus.FAILED, results, null);
            return;
        }

        double margin = results.values().stream()
                .mapToDouble(value -> value - config.getImprovementThreshold())
                .average()
                .orElse(0.0);
        boolean allAbove = results.values().stream().allMatch(value -> value >= config.getImprovementThreshold());
        if (margin > 0 && allAbove) {
            complete(experiment, ExperimentStatus.SUCCEEDED, results, margin);
            apply(experiment);
        } else {
            complete(experiment, ExperimentStatus.FAILED, results, margin);
            log.info("[SelfImprovement] Experiment {} did not improve: {}", experiment.getId(), results);
        }
    }

    private double measure(String metric, double temperature) throws GenerationException {
        if (testPrompts.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (String prompt : testPrompts) {
            String response = generator.generate(GenerationRequest.builder()
                    .context("Answer helpfully and precisely.")
                    .query(prompt)
                    .temperature(temperature)
                    .build());
            total += evaluator.score(response, "Rate the " + metric.replace('_', ' ')
                    + " of this answer to the question: " + prompt).score();
        }
        return total / testPrompts.size();
    }

    private void complete(Experiment experiment, ExperimentStatus status, Map<String, Double> results,
            Double margin) {
        experiment.setStatus(status);
        experiment.setResults(results);
        experiment.setImprovement(margin);
        experiment.setCompletedAt(clock.instant());
    }

    private void apply(Experiment experiment) {
        Instant now = clock.instant();
        for (Improvement improvement : state.getImprovements()) {
            if (improvement.getStatus() == ImprovementStatus.ACTIVE) {
                improvement.setStatus(ImprovementStatus.SUPERSEDED);
            }
        }
        double previous = generationSettings.setTemperature(experiment.getTemperature());
        Improvement improvement = Improvement.builder()
                .id(UUID.randomUUID().toString())
                .experimentId(experiment.getId())
                .description(experiment.getHypothesis())
                .temperature(experiment.getTemperature())
                .previousTemperature(previous)
                .appliedAt(now)
                .build();
        state.getImprovements().add(improvement);
        log.info("[SelfImprovement] Applied improvement {}: temperature {} -> {}", improvement.getId(), previous,
                experiment.getTemperature());
    }

    private void save() {
        try {
            String json = objectMapper.writeValueAsString(state);
            storagePort.putTextAtomic(IMPROVEMENT_DIR, STATE_FILE, json, false).join();
        } catch (Exception e) { // NOSONAR - state is rebuilt from memory on the next save
            log.warn("[SelfImprovement] Failed to save state: {}", e.getMessage());
        }
    }

    /**
     * Persisted form of the experiment and improvement history.
     */
    @Data
    @NoArgsConstructor
    public static class ImprovementLog {
        private List<Experiment> experiments = new ArrayList<>();
        private List<Improvement> improvements = new ArrayList<>();
    }
}
