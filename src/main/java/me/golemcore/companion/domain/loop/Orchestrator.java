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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.model.CorrectionResult;
import me.golemcore.companion.domain.model.InboundMessage;
import me.golemcore.companion.domain.model.InteractionContext;
import me.golemcore.companion.domain.model.OrchestratorState;
import me.golemcore.companion.domain.model.OutboundResponse;
import me.golemcore.companion.domain.pipeline.InteractionPipeline;
import me.golemcore.companion.domain.scheduler.CounterSource;
import me.golemcore.companion.domain.scheduler.JobContext;
import me.golemcore.companion.domain.scheduler.PeriodicScheduler;
import me.golemcore.companion.domain.service.CorrectionMechanism;
import me.golemcore.companion.domain.service.PersonaService;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.infrastructure.i18n.MessageService;
import me.golemcore.companion.port.inbound.TransportPort;
import me.golemcore.companion.port.outbound.MemoryStorePort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Top-level control loop. One {@link #tick()} polls a bounded batch from the
 * transport, runs each message through the {@link InteractionPipeline} in
 * arrival order, delivers the responses, then lets the
 * {@link PeriodicScheduler} run the due jobs.
 *
 * <p>
 * States cycle IDLE -> RECEIVING_MESSAGES -> PROCESSING_MESSAGE ->
 * RESPONDING_TO_USER -> CHECKING_PERIODIC_TASKS -> IDLE. SHUTTING_DOWN is
 * terminal and flushes the persona and memory stores.
 *
 * <p>
 * This is the only component that talks to the transport. Counter events and
 * job messages are routed through here.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class Orchestrator {

    private static final String GENERIC_FALLBACK_KEY = "system.error.generic";

    private final TransportPort transport;
    private final InteractionPipeline pipeline;
    private final PeriodicScheduler scheduler;
    private final PersonaService personaService;
    private final MemoryStorePort memoryStore;
    private final CorrectionMechanism correctionMechanism;
    private final MessageService messageService;
    private final CompanionProperties.LoopProperties config;

    private final AtomicReference<OrchestratorState> state = new AtomicReference<>(OrchestratorState.IDLE);
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final AtomicBoolean shutDown = new AtomicBoolean(false);
    private final Set<String> activeSenders = ConcurrentHashMap.newKeySet();
    private final JobContext jobContext = new OrchestratorJobContext();

    public Orchestrator(TransportPort transport, InteractionPipeline pipeline, PeriodicScheduler scheduler,
            PersonaService personaService, MemoryStorePort memoryStore, CorrectionMechanism correctionMechanism,
            MessageService messageService, CompanionProperties properties) {
        this.transport = transport;
        this.pipeline = pipeline;
        this.scheduler = scheduler;
        this.personaService = personaService;
        this.memoryStore = memoryStore;
        this.correctionMechanism = correctionMechanism;
        this.messageService = messageService;
        this.config = properties.getLoop();
    }

    /**
     * One pass of the control loop.
     */
    public void tick() {
        if (isShutdownRequested()) {
            return;
        }

        transition(OrchestratorState.RECEIVING_MESSAGES);
        List<InboundMessage> batch;
        try {
            batch = transport.receiveNewMessages(config.getBatchSize());
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Failed to receive messages: {}", e.getMessage(), e);
            batch = List.of();
        }

        for (int i = 0; i < batch.size(); i++) {
            if (isShutdownRequested()) {
                log.info("[Orchestrator] Shutdown requested, {} messages left unprocessed", batch.size() - i);
                break;
            }
            InboundMessage message = batch.get(i);
            transition(OrchestratorState.PROCESSING_MESSAGE);
            OutboundResponse response = processMessage(message);
            transition(OrchestratorState.RESPONDING_TO_USER);
            deliver(message.senderId(), response.getText());
        }

        if (transport.isStopRequested()) {
            requestShutdown();
        }
        if (isShutdownRequested()) {
            return;
        }

        transition(OrchestratorState.CHECKING_PERIODIC_TASKS);
        try {
            scheduler.runDueJobs(jobContext);
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Periodic task check failed: {}", e.getMessage(), e);
        }
        transition(OrchestratorState.IDLE);
    }

    /**
     * Run one message through the pipeline. Never throws: a failure yields the
     * generic fallback reply.
     */
    public OutboundResponse processMessage(InboundMessage message) {
        try {
            InteractionContext context = pipeline.run(message, this::isShutdownRequested);
            if (!context.isRejected()) {
                activeSenders.add(message.senderId());
                scheduler.recordEvent(CounterSource.INTERACTION, 1);
                scheduler.recordEvent(CounterSource.PERSONA_CHANGE, context.getPersonaChanges());
            }
            return context.getResponse();
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Processing message from {} failed: {}", message.senderId(), e.getMessage(),
                    e);
            return OutboundResponse.fallback(messageService.getMessage(GENERIC_FALLBACK_KEY));
        }
    }

    public void requestShutdown() {
        if (shutdownRequested.compareAndSet(false, true)) {
            log.info("[Orchestrator] Shutdown requested");
        }
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }

    /**
     * Enter SHUTTING_DOWN and flush the stores. Safe to call more than once.
     */
    public void shutdown() {
        requestShutdown();
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        transition(OrchestratorState.SHUTTING_DOWN);
        try {
            personaService.save();
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Persona flush failed: {}", e.getMessage(), e);
        }
        try {
            memoryStore.flush();
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Memory flush failed: {}", e.getMessage(), e);
        }
        scheduler.saveState();
        transport.stop();
        log.info("[Orchestrator] Shut down");
    }

    public OrchestratorState getState() {
        return state.get();
    }

    public Set<String> getActiveSenders() {
        return Set.copyOf(activeSenders);
    }

    JobContext getJobContext() {
        return jobContext;
    }

    private void transition(OrchestratorState next) {
        OrchestratorState previous = state.getAndSet(next);
        if (previous != next) {
            log.trace("[Orchestrator] {} -> {}", previous, next);
        }
    }

    private boolean deliver(String senderId, String text) {
        try {
            boolean sent = transport.send(senderId, text);
            if (!sent) {
                log.warn("[Orchestrator] Transport did not deliver response to {}", senderId);
            }
            return sent;
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Failed to deliver response to {}: {}", senderId, e.getMessage(), e);
            return false;
        }
    }

    private class OrchestratorJobContext implements JobContext {

        @Override
        public Set<String> activeSenders() {
            return getActiveSenders();
        }

        @Override
        public boolean sendMessage(String senderId, String text) {
            CorrectionResult review = correctionMechanism.review(text, false);
            return deliver(senderId, review.getText());
        }

        @Override
        public void reportPersonaChanges(int changes) {
            scheduler.recordEvent(CounterSource.PERSONA_CHANGE, changes);
        }

        @Override
        public void reportDiscoveries(int discoveries) {
            scheduler.recordEvent(CounterSource.DISCOVERY, discoveries);
        }

        @Override
        public boolean isCancelled() {
            return isShutdownRequested();
        }
    }
}
