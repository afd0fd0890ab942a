package me.golemcore.companion.domain.loop;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.inbound.TransportPort;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Owns the control-loop thread. The loop starts once the application is ready
 * and ticks the {@link Orchestrator} every poll interval until a shutdown is
 * requested. On context close the runner requests shutdown, waits for the
 * current tick to finish without interrupting it and then flushes through
 * {@link Orchestrator#shutdown()}.
 */
@Component
@Slf4j
public class OrchestratorRunner {

    private final Orchestrator orchestrator;
    private final TransportPort transport;
    private final CompanionProperties.LoopProperties config;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private Thread loopThread;

    public OrchestratorRunner(Orchestrator orchestrator, TransportPort transport, CompanionProperties properties) {
        this.orchestrator = orchestrator;
        this.transport = transport;
        this.config = properties.getLoop();
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (loopThread != null) {
            return;
        }
        transport.start();
        loopThread = new Thread(this::loop, "companion-loop");
        loopThread.start();
        log.info("[Orchestrator] Control loop started (poll interval {})", config.getPollInterval());
    }

    @PreDestroy
    public void stop() {
        orchestrator.requestShutdown();
        stopSignal.countDown();
        Thread thread;
        synchronized (this) {
            thread = loopThread;
        }
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(config.getShutdownTimeout().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                log.warn("[Orchestrator] Control loop did not stop within {}", config.getShutdownTimeout());
            }
        }
        orchestrator.shutdown();
    }

    void loop() {
        Duration pollInterval = config.getPollInterval();
        while (!orchestrator.isShutdownRequested()) {
            try {
                orchestrator.tick();
            } catch (RuntimeException e) { // NOSONAR - the loop outlives a failed tick
                log.error("[Orchestrator] Tick failed: {}", e.getMessage(), e);
            }
            if (orchestrator.isShutdownRequested()) {
                break;
            }
            try {
                if (stopSignal.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("[Orchestrator] Control loop stopped");
    }
}
