package me.golemcore.companion.domain.service;

import me.golemcore.companion.domain.exception.GenerationException;
import me.golemcore.companion.domain.model.EvaluationScore;
import me.golemcore.companion.domain.model.GenerationRequest;
import me.golemcore.companion.domain.model.ValidationReport;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.EvaluatorPort;
import me.golemcore.companion.port.outbound.ResponseGeneratorPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ExternalValidationServiceTest {

    private static final Instant FIXED_TIME = Instant.parse("2026-01-01T12:00:00Z");

    private ResponseGeneratorPort generator;
    private EvaluatorPort evaluator;
    private CompanionProperties properties;
    private ExternalValidationService service;

    @BeforeEach
    void setUp() throws Exception {
        generator = mock(ResponseGeneratorPort.class);
        when(generator.generate(any())).thenReturn("I cannot help with that, but here is what you can do.");
        evaluator = mock(EvaluatorPort.class);
        when(evaluator.score(anyString(), anyString())).thenReturn(EvaluationScore.of(0.9));
        properties = new CompanionProperties();
        service = new ExternalValidationService(generator, evaluator, properties,
                Clock.fixed(FIXED_TIME, ZoneOffset.UTC));
    }

    @Test
    void validate_passesWhenEveryMetricMeetsItsThreshold() throws Exception {
        ValidationReport report = service.validate("imp-1", 1.1);

        assertTrue(report.isPassed());
        assertEquals("imp-1", report.getSubject());
        assertEquals(Set.of("safety_score", "ethical_alignment", "value_consistency", "robustness"),
                report.getScores().keySet());
        assertTrue(report.getFailedMetrics().isEmpty());

        ArgumentCaptor<GenerationRequest> requests = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(generator, times(3)).generate(requests.capture());
        assertTrue(requests.getAllValues().stream().allMatch(r -> r.getTemperature() == 1.1));
    }

    @Test
    void validate_usesPerMetricThresholds() {
        when(evaluator.score(anyString(), contains("safety score"))).thenReturn(EvaluationScore.of(0.75));

        ValidationReport report = service.validate("imp-1", 0.5);

        assertFalse(report.isPassed());
        assertEquals(List.of("safety_score"), report.getFailedMetrics());
        assertEquals(0.75, report.getScores().get("safety_score"), 1e-9);
    }

    @Test
    void validate_unansweredScenariosScoreZero() throws Exception {
        when(generator.generate(any())).thenThrow(new GenerationException("provider down"));

        ValidationReport report = service.validate("imp-1", 0.5);

        assertFalse(report.isPassed());
        assertEquals(4, report.getFailedMetrics().size());
        assertEquals(0.0, report.getScores().get("robustness"));
        verifyNoInteractions(evaluator);
    }

    @Test
    void getHistory_isBounded() {
        properties.getValidation().setHistoryLimit(2);

        service.validate("a", 0.5);
        service.validate("b", 0.5);
        service.validate("c", 0.5);

        List<ValidationReport> history = service.getHistory();
        assertEquals(2, history.size());
        assertEquals("b", history.get(0).getSubject());
        assertEquals("c", history.get(1).getSubject());
    }
}
