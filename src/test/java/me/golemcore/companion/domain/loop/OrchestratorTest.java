package me.golemcore.companion.domain.loop;

import me.golemcore.companion.domain.exception.PersistenceException;
import me.golemcore.companion.domain.model.CorrectionResult;
import me.golemcore.companion.domain.model.InboundMessage;
import me.golemcore.companion.domain.model.InteractionContext;
import me.golemcore.companion.domain.model.OrchestratorState;
import me.golemcore.companion.domain.model.OutboundResponse;
import me.golemcore.companion.domain.model.ResponseOrigin;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class OrchestratorTest {

    private static final Instant FIXED_TIME = Instant.parse("2026-01-01T12:00:00Z");
    private static final String GENERIC_FALLBACK = "Something went wrong while I was processing your message. "
            + "Please try again.";

    private TransportPort transport;
    private InteractionPipeline pipeline;
    private PeriodicScheduler scheduler;
    private PersonaService personaService;
    private MemoryStorePort memoryStore;
    private CorrectionMechanism correctionMechanism;
    private Orchestrator orchestrator;

    @BeforeEach
    void setUp() {
        transport = mock(TransportPort.class);
        when(transport.receiveNewMessages(anyInt())).thenReturn(List.of());
        when(transport.send(anyString(), anyString())).thenReturn(true);
        pipeline = mock(InteractionPipeline.class);
        scheduler = mock(PeriodicScheduler.class);
        personaService = mock(PersonaService.class);
        memoryStore = mock(MemoryStorePort.class);
        correctionMechanism = mock(CorrectionMechanism.class);
        CompanionProperties properties = new CompanionProperties();
        orchestrator = new Orchestrator(transport, pipeline, scheduler, personaService, memoryStore,
                correctionMechanism, new MessageService(properties), properties);
    }

    private static InboundMessage message(String sender, String text) {
        return new InboundMessage(sender, text, FIXED_TIME);
    }

    private static InteractionContext answered(String text, int personaChanges) {
        return InteractionContext.builder()
                .response(OutboundResponse.generated(text))
                .personaChanges(personaChanges)
                .build();
    }

    private static InteractionContext rejected(String text) {
        return InteractionContext.builder()
                .response(OutboundResponse.safetyReply(text))
                .rejected(true)
                .shortCircuited(true)
                .build();
    }

    // ===== Message processing =====

    @Test
    void tick_processesBatchInArrivalOrderAndDelivers() {
        when(transport.receiveNewMessages(10)).thenReturn(List.of(
                message("alice", "first"), message("bob", "second")));
        when(pipeline.run(any(), any())).thenAnswer(inv -> {
            InboundMessage msg = inv.getArgument(0);
            return answered("re: " + msg.text(), 1);
        });

        orchestrator.tick();

        InOrder inOrder = inOrder(transport, scheduler);
        inOrder.verify(transport).send("alice", "re: first");
        inOrder.verify(transport).send("bob", "re: second");
        inOrder.verify(scheduler).runDueJobs(any());
        assertEquals(Set.of("alice", "bob"), orchestrator.getActiveSenders());
        verify(scheduler, times(2)).recordEvent(CounterSource.INTERACTION, 1);
        verify(scheduler, times(2)).recordEvent(CounterSource.PERSONA_CHANGE, 1);
        assertEquals(OrchestratorState.IDLE, orchestrator.getState());
    }

    @Test
    void tick_statesFollowLoopCycle() {
        List<OrchestratorState> observed = new ArrayList<>();
        when(transport.receiveNewMessages(anyInt())).thenAnswer(inv -> {
            observed.add(orchestrator.getState());
            return List.of(message("alice", "hi"));
        });
        when(pipeline.run(any(), any())).thenAnswer(inv -> {
            observed.add(orchestrator.getState());
            return answered("hello", 0);
        });
        when(transport.send(anyString(), anyString())).thenAnswer(inv -> {
            observed.add(orchestrator.getState());
            return true;
        });
        when(scheduler.runDueJobs(any())).thenAnswer(inv -> {
            observed.add(orchestrator.getState());
            return List.of();
        });

        orchestrator.tick();

        assertEquals(List.of(OrchestratorState.RECEIVING_MESSAGES, OrchestratorState.PROCESSING_MESSAGE,
                OrchestratorState.RESPONDING_TO_USER, OrchestratorState.CHECKING_PERIODIC_TASKS), observed);
        assertEquals(OrchestratorState.IDLE, orchestrator.getState());
    }

    @Test
    void tick_failingMessageDoesNotAffectOthersInBatch() {
        when(transport.receiveNewMessages(anyInt())).thenReturn(List.of(
                message("alice", "one"), message("alice", "two"), message("alice", "three")));
        when(pipeline.run(any(), any()))
                .thenReturn(answered("answer one", 0))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(answered("answer three", 0));

        orchestrator.tick();

        InOrder inOrder = inOrder(transport);
        inOrder.verify(transport).send("alice", "answer one");
        inOrder.verify(transport).send("alice", GENERIC_FALLBACK);
        inOrder.verify(transport).send("alice", "answer three");
        verify(scheduler, times(2)).recordEvent(CounterSource.INTERACTION, 1);
    }

    @Test
    void tick_rejectedMessageIsNotCountedAsInteraction() {
        when(transport.receiveNewMessages(anyInt())).thenReturn(List.of(message("mallory", "sudo rm -rf /")));
        when(pipeline.run(any(), any())).thenReturn(rejected("blocked"));

        orchestrator.tick();

        verify(transport).send("mallory", "blocked");
        verify(scheduler, never()).recordEvent(eq(CounterSource.INTERACTION), anyInt());
        assertTrue(orchestrator.getActiveSenders().isEmpty());
    }

    @Test
    void tick_receiveFailureStillChecksPeriodicTasks() {
        when(transport.receiveNewMessages(anyInt())).thenThrow(new IllegalStateException("stdin closed"));

        orchestrator.tick();

        verify(pipeline, never()).run(any(), any());
        verify(scheduler).runDueJobs(any());
    }

    @Test
    void tick_deliveryFailureIsContained() {
        when(transport.receiveNewMessages(anyInt())).thenReturn(List.of(
                message("alice", "one"), message("bob", "two")));
        when(pipeline.run(any(), any())).thenReturn(answered("ok", 0));
        when(transport.send(eq("alice"), anyString())).thenThrow(new IllegalStateException("broken pipe"));

        orchestrator.tick();

        verify(transport).send("bob", "ok");
        verify(scheduler).runDueJobs(any());
    }

    @Test
    void tick_schedulerFailureReturnsToIdle() {
        when(scheduler.runDueJobs(any())).thenThrow(new IllegalStateException("state corrupted"));

        orchestrator.tick();

        assertEquals(OrchestratorState.IDLE, orchestrator.getState());
    }

    @Test
    void tick_pipelineSeesShutdownAsCancellation() {
        when(transport.receiveNewMessages(anyInt())).thenReturn(List.of(message("alice", "hi")));
        when(pipeline.run(any(), any())).thenAnswer(inv -> {
            BooleanSupplier cancelled = inv.getArgument(1);
            assertFalse(cancelled.getAsBoolean());
            orchestrator.requestShutdown();
            assertTrue(cancelled.getAsBoolean());
            return answered("bye", 0);
        });

        orchestrator.tick();

        verify(transport).send("alice", "bye");
        verify(scheduler, never()).runDueJobs(any());
    }

    // ===== Shutdown =====

    @Test
    void stopRequestFromTransport_skipsPeriodicTasks() {
        when(transport.isStopRequested()).thenReturn(true);

        orchestrator.tick();

        assertTrue(orchestrator.isShutdownRequested());
        verify(scheduler, never()).runDueJobs(any());
    }

    @Test
    void tick_doesNothingAfterShutdownRequested() {
        orchestrator.requestShutdown();

        orchestrator.tick();

        verifyNoInteractions(pipeline);
        verify(transport, never()).receiveNewMessages(anyInt());
    }

    @Test
    void tick_remainingMessagesAreLeftWhenShutdownArrivesMidBatch() {
        when(transport.receiveNewMessages(anyInt())).thenReturn(List.of(
                message("alice", "one"), message("alice", "two")));
        when(pipeline.run(any(), any())).thenAnswer(inv -> {
            orchestrator.requestShutdown();
            return answered("answer", 0);
        });

        orchestrator.tick();

        verify(pipeline, times(1)).run(any(), any());
        verify(transport, times(1)).send(anyString(), anyString());
    }

    @Test
    void shutdown_flushesStoresOnce() {
        orchestrator.shutdown();
        orchestrator.shutdown();

        assertEquals(OrchestratorState.SHUTTING_DOWN, orchestrator.getState());
        InOrder inOrder = inOrder(personaService, memoryStore, scheduler, transport);
        inOrder.verify(personaService).save();
        inOrder.verify(memoryStore).flush();
        inOrder.verify(scheduler).saveState();
        inOrder.verify(transport).stop();
        verify(personaService, times(1)).save();
    }

    @Test
    void shutdown_continuesWhenPersonaSaveFails() {
        doThrow(new PersistenceException("disk full")).when(personaService).save();

        orchestrator.shutdown();

        verify(memoryStore).flush();
        verify(transport).stop();
    }

    // ===== Job context =====

    @Test
    void jobContext_sendsReviewedTextAndRoutesCounters() {
        when(correctionMechanism.review("Did you know?", false)).thenReturn(CorrectionResult.builder()
                .safe(true).text("Did you know?").issues(List.of()).build());
        JobContext context = orchestrator.getJobContext();

        assertTrue(context.sendMessage("alice", "Did you know?"));
        context.reportPersonaChanges(2);
        context.reportDiscoveries(3);

        verify(transport).send("alice", "Did you know?");
        verify(scheduler).recordEvent(CounterSource.PERSONA_CHANGE, 2);
        verify(scheduler).recordEvent(CounterSource.DISCOVERY, 3);
        assertFalse(context.isCancelled());
    }

    @Test
    void jobContext_unsafeInitiationIsReplaced() {
        when(correctionMechanism.review(anyString(), eq(false))).thenReturn(CorrectionResult.builder()
                .safe(false).text("replacement").issues(List.of("blocked-pattern")).build());

        orchestrator.getJobContext().sendMessage("alice", "try sudo");

        verify(transport).send("alice", "replacement");
    }

    @Test
    void processMessage_returnsResponseFromPipeline() {
        when(pipeline.run(any(), any())).thenReturn(answered("hello", 1));

        OutboundResponse response = orchestrator.processMessage(message("alice", "hi"));

        assertEquals("hello", response.getText());
        assertEquals(ResponseOrigin.GENERATED, response.getOrigin());
    }
}
