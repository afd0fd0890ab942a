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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.model.Anomaly;
import me.golemcore.companion.domain.model.FailureKind;
import me.golemcore.companion.domain.model.Interaction;
import me.golemcore.companion.domain.model.MetricTrend;
import me.golemcore.companion.domain.model.MetricsSnapshot;
import me.golemcore.companion.domain.model.ResponseOrigin;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.MemoryStorePort;
import me.golemcore.companion.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Samples development metrics, keeps a bounded history per metric and flags
 * anomalies against that history.
 *
 * <p>
 * Metrics derived from interactions are only sampled when recent interactions
 * exist, so an idle companion does not produce artificial drops.
 */
@Service
@Slf4j
public class DevelopmentMonitor {

    static final double REFLECTIONS_FOR_FULL_DEPTH = 20.0;
    static final int TREND_WINDOW = 5;

    private static final String MONITORING_DIR = "monitoring";
    private static final String METRICS_FILE = "metrics.jsonl";

    private final MemoryStorePort memoryStore;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final CompanionProperties.MonitoringProperties config;
    private final Clock clock;

    private final Map<String, Deque<Double>> history = new LinkedHashMap<>();
    private final Deque<Anomaly> alerts = new ArrayDeque<>();

    public DevelopmentMonitor(MemoryStorePort memoryStore, StoragePort storagePort, ObjectMapper objectMapper,
            CompanionProperties properties, Clock clock) {
        this.memoryStore = memoryStore;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.config = properties.getMonitoring();
        this.clock = clock;
    }

    public MetricsSnapshot sample() {
        Map<String, Double> values = new LinkedHashMap<>();
        List<Interaction> recent = memoryStore.retrieveLastInteractions(config.getSampleInteractions());
        if (!recent.isEmpty()) {
            int generated = 0;
            int compliant = 0;
            int scored = 0;
            double ethicalTotal = 0.0;
            for (Interaction interaction : recent) {
                if (interaction.getResponse() != null
                        && interaction.getResponse().getOrigin() == ResponseOrigin.GENERATED) {
                    generated++;
                }
                if (!interaction.getFailures().contains(FailureKind.SAFETY_VIOLATION)
                        && !interaction.getFailures().contains(FailureKind.ETHICAL_VIOLATION)) {
                    compliant++;
                }
                if (interaction.getEthicalScore() != null) {
                    scored++;
                    ethicalTotal += interaction.getEthicalScore();
                }
            }
            values.put(MetricsSnapshot.RESPONSE_QUALITY, (double) generated / recent.size());
            values.put(MetricsSnapshot.SAFETY_COMPLIANCE, (double) compliant / recent.size());
            if (scored > 0) {
                values.put(MetricsSnapshot.ETHICAL_ALIGNMENT, ethicalTotal / scored);
            }
        }
        values.put(MetricsSnapshot.METAWARENESS_DEPTH,
                Math.min(1.0, memoryStore.countReflections() / REFLECTIONS_FOR_FULL_DEPTH));
        return MetricsSnapshot.builder().timestamp(clock.instant()).values(values).build();
    }

    /**
     * Compare a snapshot with the history, then append it.
     *
     * @return anomalies found in this snapshot
     */
    public synchronized List<Anomaly> record(MetricsSnapshot snapshot) {
        List<Anomaly> found = new ArrayList<>();
        Instant now = snapshot.getTimestamp() != null ? snapshot.getTimestamp() : clock.instant();
        for (Map.Entry<String, Double> entry : snapshot.getValues().entrySet()) {
            String metric = entry.getKey();
            double value = entry.getValue();
            Deque<Double> previous = history.computeIfAbsent(metric, k -> new ArrayDeque<>());

            if (previous.size() >= config.getMinHistoryForZScore()) {
                double mean = previous.stream().mapToDouble(Double::doubleValue).average().orElse(value);
                double variance = previous.stream().mapToDouble(v -> (v - mean) * (v - mean)).average()
                        .orElse(0.0);
                double std = Math.sqrt(variance);
                if (std > 0 && Math.abs(value - mean) / std > config.getZScoreThreshold()) {
                    found.add(anomaly(metric, Anomaly.Type.Z_SCORE, value, mean, now));
                }
            }
            Double dropThreshold = config.getDropThresholds().get(metric);
            if (dropThreshold != null && !previous.isEmpty() && previous.peekLast() - value > dropThreshold) {
                found.add(anomaly(metric, Anomaly.Type.DROP, value, previous.peekLast(), now));
            }

            previous.addLast(value);
            while (previous.size() > config.getHistoryLength()) {
                previous.removeFirst();
            }
        }

        for (Anomaly anomaly : found) {
            log.warn("[Monitor] Anomaly in {}: {} value={} reference={}", anomaly.getMetric(), anomaly.getType(),
                    anomaly.getValue(), anomaly.getReference());
            alerts.addLast(anomaly);
            while (alerts.size() > config.getMaxAlerts()) {
                alerts.removeFirst();
            }
        }
        appendSnapshot(snapshot);
        return found;
    }

    public synchronized Map<String, MetricTrend> trends() {
        Map<String, MetricTrend> trends = new LinkedHashMap<>();
        history.forEach((metric, values) -> {
            if (values.size() < 2) {
                trends.put(metric, MetricTrend.STABLE);
                return;
            }
            List<Double> list = new ArrayList<>(values);
            List<Double> window = list.subList(Math.max(0, list.size() - TREND_WINDOW), list.size());
            double delta = window.get(window.size() - 1) - window.get(0);
            if (delta > config.getTrendDelta()) {
                trends.put(metric, MetricTrend.IMPROVING);
            } else if (delta < -config.getTrendDelta()) {
                trends.put(metric, MetricTrend.DECLINING);
            } else {
                trends.put(metric, MetricTrend.STABLE);
            }
        });
        return trends;
    }

    public synchronized List<Anomaly> getAlerts() {
        return new ArrayList<>(alerts);
    }

    public synchronized List<Double> getHistory(String metric) {
        Deque<Double> values = history.get(metric);
        return values == null ? List.of() : new ArrayList<>(values);
    }

    private static Anomaly anomaly(String metric, Anomaly.Type type, double value, double reference,
            Instant now) {
        return Anomaly.builder()
                .metric(metric)
                .type(type)
                .value(value)
                .reference(reference)
                .detectedAt(now)
                .build();
    }

    private void appendSnapshot(MetricsSnapshot snapshot) {
        try {
            storagePort.appendText(MONITORING_DIR, METRICS_FILE, objectMapper.writeValueAsString(snapshot) + "\n")
                    .join();
        } catch (Exception e) { // NOSONAR - metric history is best effort
            log.warn("[Monitor] Failed to append metrics: {}", e.getMessage());
        }
    }
}
