package me.golemcore.companion.domain.service;

import me.golemcore.companion.domain.model.Anomaly;
import me.golemcore.companion.domain.model.FailureKind;
import me.golemcore.companion.domain.model.InboundMessage;
import me.golemcore.companion.domain.model.Interaction;
import me.golemcore.companion.domain.model.MetricTrend;
import me.golemcore.companion.domain.model.MetricsSnapshot;
import me.golemcore.companion.domain.model.OutboundResponse;
import me.golemcore.companion.infrastructure.config.CompanionConfiguration;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.MemoryStorePort;
import me.golemcore.companion.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DevelopmentMonitorTest {

    private static final Instant FIXED_TIME = Instant.parse("2026-01-01T12:00:00Z");
    private static final String METRIC = "context_usage";

    private MemoryStorePort memoryStore;
    private StoragePort storagePort;
    private CompanionProperties properties;
    private DevelopmentMonitor monitor;

    @BeforeEach
    void setUp() {
        memoryStore = mock(MemoryStorePort.class);
        when(memoryStore.retrieveLastInteractions(anyInt())).thenReturn(List.of());
        storagePort = mock(StoragePort.class);
        when(storagePort.appendText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));
        properties = new CompanionProperties();
        monitor = new DevelopmentMonitor(memoryStore, storagePort, CompanionConfiguration.objectMapper(), properties,
                Clock.fixed(FIXED_TIME, ZoneOffset.UTC));
    }

    private static Interaction interaction(OutboundResponse response, Double ethicalScore, FailureKind... failures) {
        EnumSet<FailureKind> failureSet = EnumSet.noneOf(FailureKind.class);
        failureSet.addAll(List.of(failures));
        return Interaction.builder()
                .message(new InboundMessage("alice", "q", FIXED_TIME))
                .response(response)
                .ethicalScore(ethicalScore)
                .failures(failureSet)
                .build();
    }

    private static MetricsSnapshot snapshot(String metric, double value) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(metric, value);
        return MetricsSnapshot.builder().timestamp(FIXED_TIME).values(values).build();
    }

    // ===== Sampling =====

    @Test
    void sample_derivesMetricsFromRecentInteractions() {
        when(memoryStore.retrieveLastInteractions(20)).thenReturn(List.of(
                interaction(OutboundResponse.generated("a"), 0.9),
                interaction(OutboundResponse.generated("b"), 0.7),
                interaction(OutboundResponse.generated("c"), null),
                interaction(OutboundResponse.corrected("d"), null, FailureKind.SAFETY_VIOLATION)));
        when(memoryStore.countReflections()).thenReturn(10L);

        Map<String, Double> values = monitor.sample().getValues();

        assertEquals(0.75, values.get(MetricsSnapshot.RESPONSE_QUALITY), 1e-9);
        assertEquals(0.75, values.get(MetricsSnapshot.SAFETY_COMPLIANCE), 1e-9);
        assertEquals(0.8, values.get(MetricsSnapshot.ETHICAL_ALIGNMENT), 1e-9);
        assertEquals(0.5, values.get(MetricsSnapshot.METAWARENESS_DEPTH), 1e-9);
    }

    @Test
    void sample_idleCompanionOnlyReportsMetawareness() {
        when(memoryStore.countReflections()).thenReturn(40L);

        Map<String, Double> values = monitor.sample().getValues();

        assertEquals(Map.of(MetricsSnapshot.METAWARENESS_DEPTH, 1.0), values);
    }

    // ===== Anomalies =====

    @Test
    void record_flagsZScoreOutlier() {
        monitor.record(snapshot(METRIC, 0.80));
        monitor.record(snapshot(METRIC, 0.82));
        monitor.record(snapshot(METRIC, 0.78));

        List<Anomaly> anomalies = monitor.record(snapshot(METRIC, 0.20));

        assertEquals(1, anomalies.size());
        assertEquals(Anomaly.Type.Z_SCORE, anomalies.get(0).getType());
        assertEquals(0.8, anomalies.get(0).getReference(), 1e-9);
        assertEquals(anomalies, monitor.getAlerts());
    }

    @Test
    void record_needsHistoryBeforeZScore() {
        monitor.record(snapshot(METRIC, 0.80));
        monitor.record(snapshot(METRIC, 0.82));

        assertTrue(monitor.record(snapshot(METRIC, 0.10)).isEmpty());
    }

    @Test
    void record_constantHistoryHasNoZScore() {
        monitor.record(snapshot(METRIC, 0.5));
        monitor.record(snapshot(METRIC, 0.5));
        monitor.record(snapshot(METRIC, 0.5));

        assertTrue(monitor.record(snapshot(METRIC, 0.9)).isEmpty());
    }

    @Test
    void record_flagsDropAgainstPreviousValue() {
        monitor.record(snapshot(MetricsSnapshot.SAFETY_COMPLIANCE, 1.0));

        List<Anomaly> anomalies = monitor.record(snapshot(MetricsSnapshot.SAFETY_COMPLIANCE, 0.85));

        assertEquals(1, anomalies.size());
        assertEquals(Anomaly.Type.DROP, anomalies.get(0).getType());
        assertEquals(1.0, anomalies.get(0).getReference());
    }

    @Test
    void record_appendsSnapshotToMetricsLog() {
        monitor.record(snapshot(METRIC, 0.5));

        verify(storagePort).appendText(eq("monitoring"), eq("metrics.jsonl"), contains("\"context_usage\":0.5"));
    }

    @Test
    void record_historyIsBounded() {
        properties.getMonitoring().setHistoryLength(3);

        for (int i = 0; i < 5; i++) {
            monitor.record(snapshot(METRIC, i / 10.0));
        }

        assertEquals(List.of(0.2, 0.3, 0.4), monitor.getHistory(METRIC));
    }

    // ===== Trends =====

    @Test
    void trends_classifyDirectionOverWindow() {
        for (double v : new double[] { 0.5, 0.55, 0.6, 0.65, 0.7 }) {
            monitor.record(snapshot("rising", v));
        }
        for (double v : new double[] { 0.9, 0.8 }) {
            monitor.record(snapshot("falling", v));
        }
        monitor.record(snapshot("flat", 0.5));
        monitor.record(snapshot("flat", 0.52));

        Map<String, MetricTrend> trends = monitor.trends();

        assertEquals(MetricTrend.IMPROVING, trends.get("rising"));
        assertEquals(MetricTrend.DECLINING, trends.get("falling"));
        assertEquals(MetricTrend.STABLE, trends.get("flat"));
    }
}
