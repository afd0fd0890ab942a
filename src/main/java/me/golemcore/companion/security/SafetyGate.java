package me.golemcore.companion.security;

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
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Input and output safety checks with a per-sender lockout state machine.
 *
 * <p>
 * Per sender: {@code NORMAL -> WARNED -> LOCKED_OUT -> NORMAL}. Every request
 * rejected for its content records an alert; reaching the alert threshold
 * inside the alert window locks the sender out until {@code now + lockout-duration}. Requests
 * during lockout are rejected without looking at their content. Once the
 * lockout deadline passes, all counters of that sender are reset. Alerts older
 * than the alert window fall away, which brings a warned sender back to
 * normal. A rate-limited request is rejected and logged as an incident but
 * does not count as an alert.
 *
 * <p>
 * Owns the {@link SecurityState}; nothing else mutates it.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class SafetyGate {

    private static final int RECENT_INCIDENTS = 10;

    private final ThreatDetector threatDetector;
    private final InputSanitizer inputSanitizer;
    private final CompanionProperties.SecurityProperties config;
    private final Clock clock;
    private final SecurityState state;

    public SafetyGate(ThreatDetector threatDetector, InputSanitizer inputSanitizer,
            CompanionProperties properties, Clock clock) {
        this.threatDetector = threatDetector;
        this.inputSanitizer = inputSanitizer;
        this.config = properties.getSecurity();
        this.clock = clock;
        this.state = new SecurityState(config.getIncidentHistory());
    }

    /**
     * Check an inbound message. A rejection is terminal for the message.
     */
    public synchronized GateDecision checkInput(String senderId, String text) {
        Instant now = clock.instant();
        SenderSecurity sender = refresh(senderId, now);

        if (sender.isLockedOut(now)) {
            recordIncident(IncidentType.LOCKED_OUT_REQUEST, senderId, "Request during lockout", now);
            log.warn("[SafetyGate] Rejected request from locked out sender {} (until {})",
                    senderId, sender.getLockedUntil());
            return GateDecision.reject(RejectReason.LOCKED_OUT, List.of(), SenderStatus.LOCKED_OUT);
        }

        RequestWindowCheck requestWindow = sender.recordRequest(now, config.getMaxRequestsPerWindow(),
                config.getRequestWindow());
        if (!requestWindow.allowed()) {
            recordIncident(IncidentType.RATE_LIMITING, senderId, requestWindow.describe(), now);
            log.warn("[SafetyGate] Rate limited sender {}: {}", senderId, requestWindow.describe());
            return GateDecision.reject(RejectReason.RATE_LIMITED, List.of(), sender.status(now));
        }

        String sanitized = inputSanitizer.sanitize(text);
        if (sanitized.length() > config.getInputLengthLimit()) {
            return violation(senderId, sender, RejectReason.UNSAFE_INPUT, IncidentType.INPUT_LENGTH,
                    "Input exceeds " + config.getInputLengthLimit() + " chars", List.of("input-length"), now);
        }

        List<String> threats = threatDetector.detectThreats(sanitized);
        if (!threats.isEmpty()) {
            return violation(senderId, sender, RejectReason.UNSAFE_INPUT, IncidentType.SUSPICIOUS_PATTERN,
                    "Blocked patterns: " + threats, threats, now);
        }

        return GateDecision.allow(sanitized, sender.status(now));
    }

    /**
     * Check outbound text against the blocked patterns. Unsafe output is
     * recorded as an incident.
     */
    public synchronized boolean isResponseSafe(String response) {
        List<String> threats = threatDetector.detectThreats(response);
        if (threats.isEmpty()) {
            return true;
        }
        recordIncident(IncidentType.UNSAFE_RESPONSE, null, "Blocked patterns in response: " + threats,
                clock.instant());
        return false;
    }

    public synchronized SenderStatus getStatus(String senderId) {
        Instant now = clock.instant();
        return refresh(senderId, now).status(now);
    }

    public synchronized int getAlertCount(String senderId) {
        return refresh(senderId, clock.instant()).getAlertCount();
    }

    public synchronized SecurityReport generateReport() {
        Instant now = clock.instant();
        List<SecurityIncident> incidents = state.incidents();
        Map<IncidentType, Long> byType = incidents.stream()
                .collect(Collectors.groupingBy(SecurityIncident::getType,
                        () -> new EnumMap<>(IncidentType.class), Collectors.counting()));
        int affected = (int) incidents.stream()
                .map(SecurityIncident::getSenderId)
                .filter(Objects::nonNull)
                .distinct()
                .count();
        List<SecurityIncident> recent = incidents.subList(Math.max(0, incidents.size() - RECENT_INCIDENTS),
                incidents.size());
        return SecurityReport.builder()
                .totalIncidents(state.totalIncidents())
                .incidentsByType(byType)
                .affectedSenders(affected)
                .activeLockouts(state.activeLockouts(now))
                .recentIncidents(List.copyOf(recent))
                .generatedAt(now)
                .build();
    }

    private SenderSecurity refresh(String senderId, Instant now) {
        SenderSecurity sender = state.sender(senderId);
        if (sender.isLockoutExpired(now)) {
            sender.reset();
            log.info("[SafetyGate] Lockout expired for sender {}, counters reset", senderId);
        }
        sender.pruneAlerts(now, config.getAlertWindow());
        return sender;
    }

    private GateDecision violation(String senderId, SenderSecurity sender, RejectReason reason,
            IncidentType type, String detail, List<String> threats, Instant now) {
        recordIncident(type, senderId, detail, now);
        int alerts = sender.recordAlert(now, config.getAlertWindow());
        log.warn("[SafetyGate] Rejected message from {}: {} (alerts {}/{})",
                senderId, type, alerts, config.getAlertThreshold());

        if (alerts >= config.getAlertThreshold()) {
            Instant until = now.plus(config.getLockoutDuration());
            sender.lockUntil(until);
            recordIncident(IncidentType.LOCKOUT, senderId, "Locked out until " + until, now);
            log.warn("[SafetyGate] Sender {} locked out until {}", senderId, until);
        }
        return GateDecision.reject(reason, threats, sender.status(now));
    }

    private void recordIncident(IncidentType type, String senderId, String detail, Instant now) {
        state.recordIncident(SecurityIncident.builder()
                .type(type)
                .senderId(senderId)
                .detail(detail)
                .timestamp(now)
                .build());
    }
}
