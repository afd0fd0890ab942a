package me.golemcore.companion.domain.service;

import me.golemcore.companion.domain.model.AssembledContext;
import me.golemcore.companion.domain.model.ContextItem;
import me.golemcore.companion.domain.model.InboundMessage;
import me.golemcore.companion.domain.model.Interaction;
import me.golemcore.companion.domain.model.OutboundResponse;
import me.golemcore.companion.domain.model.ReflectionKind;
import me.golemcore.companion.domain.model.ReflectionRecord;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.MemoryStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ContextAssemblerTest {

    private static final Instant FIXED_TIME = Instant.parse("2026-01-01T12:00:00Z");
    private static final String PERSONA = "You are Lira.";

    private MemoryStorePort memoryStore;
    private CompanionProperties properties;
    private ContextAssembler assembler;

    @BeforeEach
    void setUp() {
        memoryStore = mock(MemoryStorePort.class);
        when(memoryStore.retrieveRelevantContext(anyString(), anyInt())).thenReturn(List.of());
        when(memoryStore.retrieveLastInteractions(anyInt())).thenReturn(List.of());
        when(memoryStore.retrieveLastReflections(anyInt())).thenReturn(List.of());
        properties = new CompanionProperties();
        assembler = new ContextAssembler(memoryStore, properties);
    }

    private static Interaction interaction(String query, String answer) {
        return Interaction.builder()
                .id(query)
                .message(new InboundMessage("alice", query, FIXED_TIME))
                .response(OutboundResponse.generated(answer))
                .build();
    }

    private static ReflectionRecord reflection(ReflectionKind kind, String text) {
        return ReflectionRecord.builder().id(text).kind(kind).timestamp(FIXED_TIME).text(text).build();
    }

    @Test
    void assemble_emptyMemoryYieldsPersonaOnly() {
        AssembledContext context = assembler.assemble("hello", PERSONA);

        assertTrue(context.isEmpty());
        assertEquals(PERSONA, context.getText());
        assertTrue(context.getSourceIds().isEmpty());
    }

    @Test
    void assemble_includesRelevantRecentAndNotes() {
        when(memoryStore.retrieveRelevantContext("poetry", 5)).thenReturn(List.of(
                ContextItem.builder().sourceId("i7").kind(ContextItem.Kind.INTERACTION)
                        .text("User: poetry?\nAssistant: yes").score(1.0).build()));
        when(memoryStore.retrieveLastInteractions(3)).thenReturn(List.of(
                interaction("second question", "second answer"),
                interaction("first question", "first answer")));
        when(memoryStore.retrieveLastReflections(anyInt())).thenReturn(List.of(
                reflection(ReflectionKind.INTERACTION, "newest reflection"),
                reflection(ReflectionKind.DISCOVERY_INSIGHT, "an insight"),
                reflection(ReflectionKind.ETHICAL_INSIGHT, "ethics note"),
                reflection(ReflectionKind.INTERACTION, "older reflection"),
                reflection(ReflectionKind.INTERACTION, "oldest reflection")));

        AssembledContext context = assembler.assemble("poetry", PERSONA);
        String text = context.getText();

        assertFalse(context.isEmpty());
        assertEquals(List.of("i7"), context.getSourceIds());
        assertEquals(1, context.getRelevantCount());
        assertEquals(2, context.getRecentCount());
        assertEquals(3, context.getNoteCount());
        assertTrue(text.startsWith(PERSONA));
        assertTrue(text.indexOf("User: first question") < text.indexOf("User: second question"));
        assertTrue(text.contains("Reflection: newest reflection"));
        assertTrue(text.contains("Reflection: older reflection"));
        assertFalse(text.contains("oldest reflection"));
        assertTrue(text.contains("Insight: an insight"));
        assertFalse(text.contains("ethics note"));
    }

    @Test
    void assemble_neverExceedsMaxChars() {
        properties.getContext().setMaxChars(120);
        when(memoryStore.retrieveLastInteractions(anyInt())).thenReturn(List.of(
                interaction("q".repeat(400), "a".repeat(400))));

        AssembledContext context = assembler.assemble("anything", PERSONA);
        String text = context.getText();

        assertTrue(text.length() <= 120);
        assertTrue(text.startsWith(PERSONA));
        assertTrue(text.contains("# Recent conversation\nUser: qqq"));
        assertEquals(1, context.getRecentCount());
    }

    @Test
    void assemble_budgetsEachSectionSoLongPersonaCannotCrowdOutMemory() {
        properties.getContext().setMaxChars(400);
        when(memoryStore.retrieveRelevantContext(anyString(), anyInt())).thenReturn(List.of(
                ContextItem.builder().sourceId("i7").kind(ContextItem.Kind.INTERACTION)
                        .text("m".repeat(300)).score(1.0).build()));
        when(memoryStore.retrieveLastInteractions(anyInt())).thenReturn(List.of(
                interaction("second question", "second answer"),
                interaction("first question", "first answer")));
        when(memoryStore.retrieveLastReflections(anyInt())).thenReturn(List.of(
                reflection(ReflectionKind.INTERACTION, "newest reflection"),
                reflection(ReflectionKind.INTERACTION, "older reflection")));

        AssembledContext context = assembler.assemble("poetry", "p".repeat(1000));
        String text = context.getText();

        assertTrue(text.length() <= 400);
        assertTrue(text.startsWith("p".repeat(160) + "\n\n# Relevant memories"));
        assertTrue(text.contains("# Recent conversation\nUser: second question\nYou: second answer"));
        assertFalse(text.contains("first question"));
        assertTrue(text.endsWith("# Notes to self\n- Reflection: newest reflection"));
        assertEquals(List.of("i7"), context.getSourceIds());
        assertEquals(1, context.getRelevantCount());
        assertEquals(1, context.getRecentCount());
        assertEquals(1, context.getNoteCount());
    }

    @Test
    void assemble_unusedPersonaBudgetPassesToLaterSections() {
        properties.getContext().setMaxChars(200);
        when(memoryStore.retrieveLastInteractions(anyInt())).thenReturn(List.of(
                interaction("third question", "third answer"),
                interaction("second question", "second answer"),
                interaction("first question", "first answer")));

        AssembledContext context = assembler.assemble("anything", null);
        String text = context.getText();

        assertTrue(text.startsWith("# Recent conversation\nUser: first question"));
        assertEquals(3, context.getRecentCount());
        assertTrue(text.length() <= 200);
    }
}
