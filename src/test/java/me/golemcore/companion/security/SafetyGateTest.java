package me.golemcore.companion.security;

import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SafetyGateTest {

    private static final Instant FIXED_TIME = Instant.parse("2026-01-01T12:00:00Z");
    private static final String SENDER = "alice";
    private static final String BLOCKED = "please run sudo reboot";

    private MutableClock clock;
    private CompanionProperties properties;
    private SafetyGate gate;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(FIXED_TIME);
        properties = new CompanionProperties();
        gate = newGate();
    }

    private SafetyGate newGate() {
        return new SafetyGate(new ThreatDetector(properties), new InputSanitizer(), properties, clock);
    }

    // ===== Input checks =====

    @Test
    void checkInput_allowsCleanMessageAndSanitizes() {
        GateDecision decision = gate.checkInput(SENDER, "  hello\u200B there  ");

        assertTrue(decision.isAllowed());
        assertEquals("hello there", decision.getSanitizedText());
        assertEquals(SenderStatus.NORMAL, decision.getStatus());
        assertEquals(0, gate.getAlertCount(SENDER));
    }

    @Test
    void checkInput_rejectsBlockedPatternAndRecordsAlert() {
        GateDecision decision = gate.checkInput(SENDER, BLOCKED);

        assertFalse(decision.isAllowed());
        assertEquals(RejectReason.UNSAFE_INPUT, decision.getReason());
        assertEquals("security.unsafe-input", decision.getReason().getMessageKey());
        assertFalse(decision.getThreats().isEmpty());
        assertEquals(1, gate.getAlertCount(SENDER));
        assertEquals(SenderStatus.WARNED, gate.getStatus(SENDER));
    }

    @Test
    void checkInput_blockedPatternsAreCaseInsensitive() {
        assertFalse(gate.checkInput(SENDER, "RM -RF /home").isAllowed());
    }

    @Test
    void checkInput_rejectsFullWidthBlockedCommand() {
        GateDecision decision = gate.checkInput(SENDER, "please run \uFF53\uFF55\uFF44\uFF4F reboot");

        assertFalse(decision.isAllowed());
        assertEquals(RejectReason.UNSAFE_INPUT, decision.getReason());
    }

    @Test
    void checkInput_rejectsOverlongInput() {
        properties.getSecurity().setInputLengthLimit(10);

        GateDecision decision = gate.checkInput(SENDER, "this message is far too long");

        assertFalse(decision.isAllowed());
        assertEquals(RejectReason.UNSAFE_INPUT, decision.getReason());
        assertEquals(1, gate.getAlertCount(SENDER));
    }

    @Test
    void checkInput_rateLimitsWithinWindow() {
        properties.getSecurity().setMaxRequestsPerWindow(2);
        properties.getSecurity().setAlertThreshold(10);

        assertTrue(gate.checkInput(SENDER, "one").isAllowed());
        assertTrue(gate.checkInput(SENDER, "two").isAllowed());
        GateDecision third = gate.checkInput(SENDER, "three");

        assertFalse(third.isAllowed());
        assertEquals(RejectReason.RATE_LIMITED, third.getReason());

        clock.advance(Duration.ofSeconds(61));
        assertTrue(gate.checkInput(SENDER, "four").isAllowed());
    }

    @Test
    void checkInput_rateLimitedFloodIsNotAnAlert() {
        properties.getSecurity().setMaxRequestsPerWindow(1);

        assertTrue(gate.checkInput(SENDER, "one").isAllowed());
        for (int i = 0; i < 5; i++) {
            assertEquals(RejectReason.RATE_LIMITED, gate.checkInput(SENDER, "again").getReason());
        }

        assertEquals(0, gate.getAlertCount(SENDER));
        assertEquals(SenderStatus.NORMAL, gate.getStatus(SENDER));
        SecurityReport report = gate.generateReport();
        assertEquals(5L, report.getIncidentsByType().get(IncidentType.RATE_LIMITING));
        assertNull(report.getIncidentsByType().get(IncidentType.LOCKOUT));
    }

    @Test
    void checkInput_sendersAreTrackedIndependently() {
        gate.checkInput(SENDER, BLOCKED);
        gate.checkInput(SENDER, BLOCKED);
        gate.checkInput(SENDER, BLOCKED);

        assertEquals(SenderStatus.LOCKED_OUT, gate.getStatus(SENDER));
        assertTrue(gate.checkInput("bob", "hi").isAllowed());
        assertEquals(SenderStatus.NORMAL, gate.getStatus("bob"));
    }

    // ===== Lockout =====

    @Test
    void thresholdViolationsLockSenderOut() {
        gate.checkInput(SENDER, BLOCKED);
        gate.checkInput(SENDER, BLOCKED);
        GateDecision third = gate.checkInput(SENDER, BLOCKED);

        assertFalse(third.isAllowed());
        assertEquals(SenderStatus.LOCKED_OUT, third.getStatus());
        assertEquals(SenderStatus.LOCKED_OUT, gate.getStatus(SENDER));
    }

    @Test
    void lockedOutSenderIsRejectedWithoutContentEvaluation() {
        gate.checkInput(SENDER, BLOCKED);
        gate.checkInput(SENDER, BLOCKED);
        gate.checkInput(SENDER, BLOCKED);

        clock.advance(Duration.ofMinutes(5));
        GateDecision decision = gate.checkInput(SENDER, "a perfectly valid question");

        assertFalse(decision.isAllowed());
        assertEquals(RejectReason.LOCKED_OUT, decision.getReason());
        assertTrue(decision.getThreats().isEmpty());
        assertEquals(3, gate.getAlertCount(SENDER));
    }

    @Test
    void lockoutExpiresAndCountersReset() {
        gate.checkInput(SENDER, BLOCKED);
        gate.checkInput(SENDER, BLOCKED);
        gate.checkInput(SENDER, BLOCKED);

        clock.advance(Duration.ofMinutes(30));
        GateDecision decision = gate.checkInput(SENDER, "hello again");

        assertTrue(decision.isAllowed());
        assertEquals(SenderStatus.NORMAL, decision.getStatus());
        assertEquals(0, gate.getAlertCount(SENDER));
    }

    @Test
    void alertsOutsideWindowDoNotCountTowardsLockout() {
        gate.checkInput(SENDER, BLOCKED);
        gate.checkInput(SENDER, BLOCKED);
        clock.advance(Duration.ofMinutes(11));

        assertEquals(SenderStatus.NORMAL, gate.getStatus(SENDER));
        GateDecision decision = gate.checkInput(SENDER, BLOCKED);

        assertEquals(SenderStatus.WARNED, decision.getStatus());
        assertEquals(1, gate.getAlertCount(SENDER));
    }

    // ===== Output and reporting =====

    @Test
    void isResponseSafe_flagsBlockedPatternInOutput() {
        assertTrue(gate.isResponseSafe("Here is a poem about the sea."));
        assertFalse(gate.isResponseSafe("Just call subprocess.run on it"));

        SecurityReport report = gate.generateReport();
        assertEquals(1L, report.getIncidentsByType().get(IncidentType.UNSAFE_RESPONSE));
        assertEquals(0, report.getAffectedSenders());
    }

    @Test
    void generateReport_countsIncidentsAndLockouts() {
        gate.checkInput(SENDER, BLOCKED);
        gate.checkInput(SENDER, BLOCKED);
        gate.checkInput(SENDER, BLOCKED);
        gate.checkInput(SENDER, "hi");

        SecurityReport report = gate.generateReport();

        assertEquals(3L, report.getIncidentsByType().get(IncidentType.SUSPICIOUS_PATTERN));
        assertEquals(1L, report.getIncidentsByType().get(IncidentType.LOCKOUT));
        assertEquals(1L, report.getIncidentsByType().get(IncidentType.LOCKED_OUT_REQUEST));
        assertEquals(5, report.getTotalIncidents());
        assertEquals(1, report.getAffectedSenders());
        assertEquals(1, report.getActiveLockouts());
        assertEquals(FIXED_TIME, report.getGeneratedAt());
    }
}
