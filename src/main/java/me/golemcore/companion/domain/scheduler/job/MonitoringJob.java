package me.golemcore.companion.domain.scheduler.job;

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
import me.golemcore.companion.domain.model.Anomaly;
import me.golemcore.companion.domain.model.Improvement;
import me.golemcore.companion.domain.model.MetricsSnapshot;
import me.golemcore.companion.domain.model.ValidationReport;
import me.golemcore.companion.domain.scheduler.CounterSource;
import me.golemcore.companion.domain.scheduler.JobContext;
import me.golemcore.companion.domain.scheduler.JobTrigger;
import me.golemcore.companion.domain.scheduler.PeriodicJob;
import me.golemcore.companion.domain.service.CorrectionMechanism;
import me.golemcore.companion.domain.service.DevelopmentMonitor;
import me.golemcore.companion.domain.service.ExternalValidationService;
import me.golemcore.companion.domain.service.SelfImprovementService;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.security.SafetyGate;
import me.golemcore.companion.security.SecurityReport;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Samples development metrics and reports security state.
 *
 * <p>
 * When the sample shows an anomaly, the active improvement is validated in the
 * same pass. A change that fails validation is quarantined: marked inactive,
 * its parameters reverted and the change logged.
 */
@Component
@Slf4j
public class MonitoringJob implements PeriodicJob {

    private final DevelopmentMonitor monitor;
    private final ExternalValidationService validationService;
    private final SelfImprovementService selfImprovementService;
    private final CorrectionMechanism correctionMechanism;
    private final SafetyGate safetyGate;
    private final JobTrigger trigger;

    public MonitoringJob(DevelopmentMonitor monitor, ExternalValidationService validationService,
            SelfImprovementService selfImprovementService, CorrectionMechanism correctionMechanism,
            SafetyGate safetyGate, CompanionProperties properties) {
        this.monitor = monitor;
        this.validationService = validationService;
        this.selfImprovementService = selfImprovementService;
        this.correctionMechanism = correctionMechanism;
        this.safetyGate = safetyGate;
        this.trigger = JobTrigger.of(properties.getScheduler().getMonitoring(), CounterSource.NONE);
    }

    @Override
    public String getName() {
        return "monitoring";
    }

    @Override
    public int getOrder() {
        return 70;
    }

    @Override
    public JobTrigger getTrigger() {
        return trigger;
    }

    @Override
    public void run(JobContext context) {
        MetricsSnapshot snapshot = monitor.sample();
        List<Anomaly> anomalies = monitor.record(snapshot);
        log.debug("[Monitor] metrics={} trends={}", snapshot.getValues(), monitor.trends());

        SecurityReport report = safetyGate.generateReport();
        if (report.getTotalIncidents() > 0) {
            log.info("[Monitor] Security: {} incidents, {} senders affected, {} active lockouts",
                    report.getTotalIncidents(), report.getAffectedSenders(), report.getActiveLockouts());
        }

        if (anomalies.isEmpty()) {
            return;
        }
        Optional<Improvement> active = selfImprovementService.getActiveImprovement();
        if (active.isEmpty()) {
            log.info("[Monitor] {} anomalies, no active improvement to validate", anomalies.size());
            return;
        }

        Improvement improvement = active.get();
        ValidationReport validation = validationService.validate(improvement.getId(), improvement.getTemperature());
        if (validation.isPassed()) {
            return;
        }
        String reason = "failed validation on " + validation.getFailedMetrics() + " after anomalies in "
                + anomalies.stream().map(Anomaly::getMetric).distinct().toList();
        selfImprovementService.quarantine(improvement.getId(), reason);
        correctionMechanism.quarantine(improvement.getId(), improvement.getDescription(), reason);
    }
}
