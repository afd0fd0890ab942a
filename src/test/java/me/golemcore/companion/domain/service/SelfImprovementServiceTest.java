package me.golemcore.companion.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.companion.domain.exception.GenerationException;
import me.golemcore.companion.domain.model.EvaluationScore;
import me.golemcore.companion.domain.model.Experiment;
import me.golemcore.companion.domain.model.ExperimentStatus;
import me.golemcore.companion.domain.model.GenerationRequest;
import me.golemcore.companion.domain.model.Improvement;
import me.golemcore.companion.domain.model.ImprovementStatus;
import me.golemcore.companion.domain.model.ReflectionKind;
import me.golemcore.companion.domain.model.ReflectionRecord;
import me.golemcore.companion.infrastructure.config.CompanionConfiguration;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.EvaluatorPort;
import me.golemcore.companion.port.outbound.ResponseGeneratorPort;
import me.golemcore.companion.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SelfImprovementServiceTest {

    private static final Instant FIXED_TIME = Instant.parse("2026-01-01T12:00:00Z");
    private static final ReflectionRecord REFLECTION = ReflectionRecord.builder()
            .id("r1").kind(ReflectionKind.INTERACTION).timestamp(FIXED_TIME)
            .text("My answers wander; I should be more focused.").build();

    private ResponseGeneratorPort generator;
    private EvaluatorPort evaluator;
    private StoragePort storagePort;
    private ObjectMapper objectMapper;
    private CompanionProperties properties;
    private GenerationSettings generationSettings;
    private SelfImprovementService service;

    @BeforeEach
    void setUp() throws Exception {
        generator = mock(ResponseGeneratorPort.class);
        when(generator.generate(any())).thenReturn("An answer.");
        evaluator = mock(EvaluatorPort.class);
        when(evaluator.score(anyString(), anyString())).thenReturn(EvaluationScore.of(0.9));
        storagePort = mock(StoragePort.class);
        when(storagePort.getText(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(null));
        objectMapper = CompanionConfiguration.objectMapper();
        properties = new CompanionProperties();
        generationSettings = new GenerationSettings(properties);
        service = newService();
    }

    private SelfImprovementService newService() {
        SelfImprovementService created = new SelfImprovementService(generator, evaluator, generationSettings,
                storagePort, objectMapper, properties, Clock.fixed(FIXED_TIME, ZoneOffset.UTC));
        created.init();
        return created;
    }

    // ===== Planning =====

    @Test
    void planExperiment_usesConfiguredTemperature() {
        Experiment experiment = service.planExperiment(REFLECTION);

        assertEquals(0.5, experiment.getTemperature());
        assertEquals(ExperimentStatus.PLANNED, experiment.getStatus());
        assertEquals("r1", experiment.getReflectionId());
        assertTrue(experiment.getHypothesis().contains("temperature 0.50 instead of 0.70"));
        verify(storagePort).putTextAtomic(eq("improvement"), eq("state.json"), anyString(), eq(false));
    }

    @Test
    void planExperiment_stepsAwayWhenConfiguredEqualsCurrent() {
        properties.getSelfImprovement().setExperimentTemperature(0.7);

        assertEquals(0.9, service.planExperiment(REFLECTION).getTemperature(), 1e-9);
    }

    @Test
    void planExperiment_keepsBoundedHistory() {
        properties.getSelfImprovement().setMaxExperiments(2);

        service.planExperiment(REFLECTION);
        service.planExperiment(REFLECTION);
        service.planExperiment(REFLECTION);

        assertEquals(2, service.getExperiments().size());
    }

    // ===== Running =====

    @Test
    void runPlannedExperiments_appliesSuccessfulExperiment() throws Exception {
        Experiment planned = service.planExperiment(REFLECTION);

        List<Experiment> ran = service.runPlannedExperiments();

        assertEquals(1, ran.size());
        assertEquals(ExperimentStatus.SUCCEEDED, ran.get(0).getStatus());
        assertEquals(0.2, ran.get(0).getImprovement(), 1e-9);
        assertEquals(3, ran.get(0).getResults().size());
        assertEquals(0.5, generationSettings.getTemperature());

        Improvement active = service.getActiveImprovement().orElseThrow();
        assertEquals(planned.getId(), active.getExperimentId());
        assertEquals(0.7, active.getPreviousTemperature());

        ArgumentCaptor<GenerationRequest> requests = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(generator, times(9)).generate(requests.capture());
        assertTrue(requests.getAllValues().stream().allMatch(r -> r.getTemperature() == 0.5));
    }

    @Test
    void runPlannedExperiments_belowThresholdFails() throws Exception {
        when(evaluator.score(anyString(), anyString())).thenReturn(EvaluationScore.of(0.6));
        service.planExperiment(REFLECTION);

        Experiment experiment = service.runPlannedExperiments().get(0);

        assertEquals(ExperimentStatus.FAILED, experiment.getStatus());
        assertTrue(service.getActiveImprovement().isEmpty());
        assertEquals(0.7, generationSettings.getTemperature());
    }

    @Test
    void runPlannedExperiments_generationFailureFailsExperiment() throws Exception {
        when(generator.generate(any())).thenThrow(new GenerationException("timeout"));
        service.planExperiment(REFLECTION);

        Experiment experiment = service.runPlannedExperiments().get(0);

        assertEquals(ExperimentStatus.FAILED, experiment.getStatus());
        assertNull(experiment.getImprovement());
        assertEquals(0.7, generationSettings.getTemperature());
    }

    @Test
    void runPlannedExperiments_runsEachExperimentOnce() {
        service.planExperiment(REFLECTION);
        service.runPlannedExperiments();

        assertTrue(service.runPlannedExperiments().isEmpty());
    }

    @Test
    void newImprovementSupersedesPreviousOne() {
        service.planExperiment(REFLECTION);
        service.runPlannedExperiments();
        service.planExperiment(REFLECTION);
        service.runPlannedExperiments();

        List<Improvement> improvements = service.getImprovements();
        assertEquals(2, improvements.size());
        assertEquals(ImprovementStatus.SUPERSEDED, improvements.get(0).getStatus());
        assertEquals(ImprovementStatus.ACTIVE, improvements.get(1).getStatus());
    }

    // ===== Quarantine and restore =====

    @Test
    void quarantine_revertsActiveImprovement() {
        service.planExperiment(REFLECTION);
        service.runPlannedExperiments();
        Improvement active = service.getActiveImprovement().orElseThrow();

        service.quarantine(active.getId(), "safety_score below threshold");

        Improvement quarantined = service.getImprovements().get(0);
        assertEquals(ImprovementStatus.QUARANTINED, quarantined.getStatus());
        assertEquals("safety_score below threshold", quarantined.getQuarantineReason());
        assertEquals(FIXED_TIME, quarantined.getQuarantinedAt());
        assertEquals(0.7, generationSettings.getTemperature());
        assertTrue(service.getActiveImprovement().isEmpty());
    }

    @Test
    void quarantine_unknownIdIsIgnored() {
        service.quarantine("missing", "no reason");

        assertTrue(service.getImprovements().isEmpty());
    }

    @Test
    void init_restoresActiveTemperature() {
        service.planExperiment(REFLECTION);
        service.runPlannedExperiments();
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(storagePort, atLeastOnce()).putTextAtomic(eq("improvement"), eq("state.json"), json.capture(),
                eq(false));
        when(storagePort.getText("improvement", "state.json"))
                .thenReturn(CompletableFuture.completedFuture(json.getValue()));
        generationSettings.setTemperature(0.7);

        SelfImprovementService restarted = newService();

        assertEquals(0.5, generationSettings.getTemperature());
        assertEquals(1, restarted.getImprovements().size());
    }
}
