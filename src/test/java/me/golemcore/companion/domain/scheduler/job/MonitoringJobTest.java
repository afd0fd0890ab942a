package me.golemcore.companion.domain.scheduler.job;

import me.golemcore.companion.domain.model.Anomaly;
import me.golemcore.companion.domain.model.Improvement;
import me.golemcore.companion.domain.model.MetricsSnapshot;
import me.golemcore.companion.domain.model.ValidationReport;
import me.golemcore.companion.domain.scheduler.JobContext;
import me.golemcore.companion.domain.service.CorrectionMechanism;
import me.golemcore.companion.domain.service.DevelopmentMonitor;
import me.golemcore.companion.domain.service.ExternalValidationService;
import me.golemcore.companion.domain.service.SelfImprovementService;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.security.SafetyGate;
import me.golemcore.companion.security.SecurityReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MonitoringJobTest {

    private static final Improvement ACTIVE = Improvement.builder()
            .id("imp-1").description("Generating with temperature 0.50").temperature(0.5)
            .previousTemperature(0.7).build();

    private DevelopmentMonitor monitor;
    private ExternalValidationService validationService;
    private SelfImprovementService selfImprovementService;
    private CorrectionMechanism correctionMechanism;
    private JobContext context;
    private MonitoringJob job;

    @BeforeEach
    void setUp() {
        monitor = mock(DevelopmentMonitor.class);
        when(monitor.sample()).thenReturn(MetricsSnapshot.builder().values(Map.of("safety_compliance", 0.5))
                .build());
        when(monitor.record(any())).thenReturn(List.of());
        when(monitor.trends()).thenReturn(Map.of());
        validationService = mock(ExternalValidationService.class);
        selfImprovementService = mock(SelfImprovementService.class);
        when(selfImprovementService.getActiveImprovement()).thenReturn(Optional.of(ACTIVE));
        correctionMechanism = mock(CorrectionMechanism.class);
        SafetyGate safetyGate = mock(SafetyGate.class);
        when(safetyGate.generateReport()).thenReturn(SecurityReport.builder()
                .totalIncidents(2).incidentsByType(Map.of()).recentIncidents(List.of()).build());
        context = mock(JobContext.class);
        job = new MonitoringJob(monitor, validationService, selfImprovementService, correctionMechanism,
                safetyGate, new CompanionProperties());
    }

    private void anomalyDetected() {
        when(monitor.record(any())).thenReturn(List.of(Anomaly.builder()
                .metric("safety_compliance").type(Anomaly.Type.DROP).value(0.5).reference(1.0).build()));
    }

    @Test
    void trigger_runsEveryMinute() {
        assertEquals(Duration.ofSeconds(60), job.getTrigger().interval());
    }

    @Test
    void run_withoutAnomaliesDoesNotValidate() {
        job.run(context);

        verify(monitor).record(any());
        verifyNoInteractions(validationService);
        verify(selfImprovementService, never()).quarantine(anyString(), anyString());
    }

    @Test
    void run_anomalyWithFailedValidationQuarantinesChange() {
        anomalyDetected();
        when(validationService.validate("imp-1", 0.5)).thenReturn(ValidationReport.builder()
                .subject("imp-1").passed(false).failedMetrics(List.of("safety_score")).build());

        job.run(context);

        String reason = "failed validation on [safety_score] after anomalies in [safety_compliance]";
        verify(selfImprovementService).quarantine("imp-1", reason);
        verify(correctionMechanism).quarantine("imp-1", "Generating with temperature 0.50", reason);
    }

    @Test
    void run_anomalyWithPassedValidationKeepsChange() {
        anomalyDetected();
        when(validationService.validate("imp-1", 0.5)).thenReturn(ValidationReport.builder()
                .subject("imp-1").passed(true).build());

        job.run(context);

        verify(selfImprovementService, never()).quarantine(anyString(), anyString());
        verifyNoInteractions(correctionMechanism);
    }

    @Test
    void run_anomalyWithoutActiveImprovementSkipsValidation() {
        anomalyDetected();
        when(selfImprovementService.getActiveImprovement()).thenReturn(Optional.empty());

        job.run(context);

        verifyNoInteractions(validationService);
    }
}
