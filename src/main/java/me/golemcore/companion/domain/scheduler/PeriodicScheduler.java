package me.golemcore.companion.domain.scheduler;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.exception.GenerationException;
import me.golemcore.companion.domain.exception.SchedulerJobException;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Decides on each pass which periodic jobs are due and runs them one after
 * another in their fixed order.
 *
 * <p>
 * Rules:
 * <ul>
 * <li>the interval is measured from the last attempt, so a failing job waits a
 * full interval like a successful one;</li>
 * <li>counters reset only when the job succeeds;</li>
 * <li>after a failure the counter trigger is held back: until the interval has
 * passed for a job that has one, otherwise until the failure retry gap has
 * passed;</li>
 * <li>a job that never ran measures its interval from scheduler start;</li>
 * <li>one job's failure never stops the others;</li>
 * <li>cancellation is checked before each job.</li>
 * </ul>
 */
@Component
@Slf4j
public class PeriodicScheduler {

    private static final String SCHEDULER_DIR = "scheduler";
    private static final String STATE_FILE = "state.json";

    private final List<PeriodicJob> jobs;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Duration failureRetryGap;
    private final Clock clock;

    private ScheduleState state = new ScheduleState();
    private Instant startedAt;

    public PeriodicScheduler(List<PeriodicJob> jobs, StoragePort storagePort, ObjectMapper objectMapper,
            CompanionProperties properties, Clock clock) {
        List<PeriodicJob> sorted = new ArrayList<>(jobs);
        sorted.sort(Comparator.comparingInt(PeriodicJob::getOrder));
        this.jobs = List.copyOf(sorted);
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.failureRetryGap = properties.getScheduler().getFailureRetryGap();
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @PostConstruct
    public synchronized void init() {
        startedAt = clock.instant();
        try {
            String json = storagePort.getText(SCHEDULER_DIR, STATE_FILE).join();
            if (json != null && !json.isBlank()) {
                state = objectMapper.readValue(json, ScheduleState.class);
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - a lost state only delays jobs
            log.warn("[Scheduler] Failed to load schedule state, starting fresh: {}", e.getMessage());
            state = new ScheduleState();
        }
        for (PeriodicJob job : jobs) {
            state.job(job.getName());
        }
        log.info("[Scheduler] jobs: {}", jobs.stream().map(PeriodicJob::getName).toList());
    }

    /**
     * Count events for every job whose counter trigger listens to the source.
     */
    public synchronized void recordEvent(CounterSource source, int count) {
        if (count <= 0) {
            return;
        }
        for (PeriodicJob job : jobs) {
            JobTrigger trigger = job.getTrigger();
            if (trigger.hasCounter() && trigger.counterSource() == source) {
                ScheduleState.JobState jobState = state.job(job.getName());
                jobState.setCounter(jobState.getCounter() + count);
            }
        }
    }

    public synchronized boolean isDue(PeriodicJob job, Instant now) {
        JobTrigger trigger = job.getTrigger();
        ScheduleState.JobState jobState = state.job(job.getName());
        if (trigger.hasInterval()) {
            Instant last = jobState.getLastRunAt() != null ? jobState.getLastRunAt() : startedAt;
            if (!now.isBefore(last.plus(trigger.interval()))) {
                return true;
            }
        }
        if (!trigger.hasCounter() || jobState.getCounter() < trigger.counterThreshold()) {
            return false;
        }
        if (jobState.getLastError() != null && jobState.getLastRunAt() != null) {
            Duration backoff = trigger.hasInterval() ? trigger.interval() : failureRetryGap;
            return !now.isBefore(jobState.getLastRunAt().plus(backoff));
        }
        return true;
    }

    /**
     * Run every due job in order.
     *
     * @return names of the jobs attempted in this pass
     */
    public List<String> runDueJobs(JobContext context) {
        List<String> attempted = new ArrayList<>();
        for (PeriodicJob job : jobs) {
            if (context.isCancelled()) {
                log.info("[Scheduler] Cancelled, {} not evaluated", job.getName());
                break;
            }
            Instant now = clock.instant();
            if (!isDue(job, now)) {
                continue;
            }
            attempted.add(job.getName());
            runJob(job, context, now);
        }
        if (!attempted.isEmpty()) {
            saveState();
        }
        return attempted;
    }

    public synchronized ScheduleState.JobState getJobState(String name) {
        ScheduleState.JobState jobState = state.job(name);
        return ScheduleState.JobState.builder()
                .lastRunAt(jobState.getLastRunAt())
                .lastSuccessAt(jobState.getLastSuccessAt())
                .counter(jobState.getCounter())
                .failureCount(jobState.getFailureCount())
                .lastError(jobState.getLastError())
                .build();
    }

    public List<PeriodicJob> getJobs() {
        return jobs;
    }

    public synchronized void saveState() {
        try {
            String json = objectMapper.writeValueAsString(state);
            storagePort.putTextAtomic(SCHEDULER_DIR, STATE_FILE, json, false).join();
        } catch (Exception e) { // NOSONAR - schedule state is rewritten after the next pass
            log.warn("[Scheduler] Failed to save schedule state: {}", e.getMessage());
        }
    }

    private void runJob(PeriodicJob job, JobContext context, Instant now) {
        long startMs = clock.millis();
        log.info("[Scheduler] Running job '{}'", job.getName());
        try {
            job.run(context);
            synchronized (this) {
                ScheduleState.JobState jobState = state.job(job.getName());
                jobState.setLastRunAt(now);
                jobState.setLastSuccessAt(now);
                jobState.setCounter(0);
                jobState.setLastError(null);
            }
            log.info("[Scheduler] Job '{}' completed in {}ms", job.getName(), clock.millis() - startMs);
        } catch (GenerationException | RuntimeException e) {
            SchedulerJobException failure = new SchedulerJobException(job.getName(), e);
            synchronized (this) {
                ScheduleState.JobState jobState = state.job(job.getName());
                jobState.setLastRunAt(now);
                jobState.setFailureCount(jobState.getFailureCount() + 1);
                jobState.setLastError(e.getMessage());
            }
            log.error("[Scheduler] Job '{}' FAILED after {}ms: {}", job.getName(), clock.millis() - startMs,
                    failure.getMessage(), e);
        }
    }
}
