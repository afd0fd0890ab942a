package me.golemcore.companion.adapter.outbound.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.companion.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.companion.domain.exception.PersistenceException;
import me.golemcore.companion.domain.model.ContextItem;
import me.golemcore.companion.domain.model.FailureKind;
import me.golemcore.companion.domain.model.InboundMessage;
import me.golemcore.companion.domain.model.Interaction;
import me.golemcore.companion.domain.model.OutboundResponse;
import me.golemcore.companion.domain.model.ReflectionKind;
import me.golemcore.companion.domain.model.ReflectionRecord;
import me.golemcore.companion.domain.model.TraceStep;
import me.golemcore.companion.infrastructure.config.CompanionConfiguration;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JsonMemoryStoreAdapterTest {

    private static final Instant FIXED_TIME = Instant.parse("2026-01-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private CompanionProperties properties;
    private JsonMemoryStoreAdapter memoryStore;

    @BeforeEach
    void setUp() {
        properties = new CompanionProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = CompanionConfiguration.objectMapper();
        memoryStore = new JsonMemoryStoreAdapter(storage, objectMapper, properties);
        memoryStore.init();
    }

    private static Interaction interaction(String id, String query, String answer, int minutes) {
        Instant at = FIXED_TIME.plusSeconds(minutes * 60L);
        return Interaction.builder()
                .id(id)
                .message(new InboundMessage("alice", query, at))
                .response(OutboundResponse.generated(answer))
                .trace(List.of(TraceStep.GATE_PASS, TraceStep.GENERATED))
                .startedAt(at)
                .completedAt(at)
                .build();
    }

    @Test
    void storeInteraction_appendsJsonLine() throws Exception {
        memoryStore.storeInteraction(interaction("i1", "hello", "Hello! I'm Lira.", 0));

        String content = Files.readString(tempDir.resolve("memory").resolve("interactions.jsonl"));
        assertEquals(1, content.lines().count());
        assertTrue(content.contains("\"gate-pass\""));
        assertTrue(content.contains("2026-01-01T12:00:00Z"));
    }

    @Test
    void logsAreReloadedOnInit() {
        Interaction stored = interaction("i1", "tell me about poetry", "Poetry is compressed feeling.", 0);
        stored.setFailures(EnumSet.of(FailureKind.PERSISTENCE_FAILURE));
        memoryStore.storeInteraction(stored);
        memoryStore.storeReflection(ReflectionRecord.builder()
                .id("r1").kind(ReflectionKind.INTERACTION).timestamp(FIXED_TIME).text("I enjoy poetry.").build());

        JsonMemoryStoreAdapter reloaded = new JsonMemoryStoreAdapter(storage, objectMapper, properties);
        reloaded.init();

        List<Interaction> interactions = reloaded.retrieveLastInteractions(5);
        assertEquals(1, interactions.size());
        assertEquals("tell me about poetry", interactions.get(0).getMessage().text());
        assertEquals(Set.of(FailureKind.PERSISTENCE_FAILURE), interactions.get(0).getFailures());
        assertEquals(List.of(TraceStep.GATE_PASS, TraceStep.GENERATED), interactions.get(0).getTrace());
        assertEquals(1, reloaded.countReflections());
    }

    @Test
    void init_skipsUnreadableLines() throws Exception {
        memoryStore.storeInteraction(interaction("i1", "hello", "hi", 0));
        Files.writeString(tempDir.resolve("memory").resolve("interactions.jsonl"), "{broken\n",
                StandardOpenOption.APPEND);

        JsonMemoryStoreAdapter reloaded = new JsonMemoryStoreAdapter(storage, objectMapper, properties);
        reloaded.init();

        assertEquals(1, reloaded.retrieveLastInteractions(10).size());
    }

    @Test
    void retrieveLastInteractions_newestFirst() {
        memoryStore.storeInteraction(interaction("i1", "one", "a", 0));
        memoryStore.storeInteraction(interaction("i2", "two", "b", 1));
        memoryStore.storeInteraction(interaction("i3", "three", "c", 2));

        List<Interaction> last = memoryStore.retrieveLastInteractions(2);

        assertEquals(List.of("i3", "i2"), last.stream().map(Interaction::getId).toList());
    }

    @Test
    void retrieveRelevantContext_ranksByTokenOverlapThenRecency() {
        memoryStore.storeInteraction(interaction("i1", "what is poetry", "Poetry is rhythm.", 0));
        memoryStore.storeInteraction(interaction("i2", "favourite poetry form", "Sonnets.", 1));
        memoryStore.storeInteraction(interaction("i3", "weather today", "Sunny.", 2));
        memoryStore.storeReflection(ReflectionRecord.builder()
                .id("r1").kind(ReflectionKind.INTERACTION).timestamp(FIXED_TIME.plusSeconds(600))
                .text("People keep asking about poetry form and rhythm.").build());

        List<ContextItem> items = memoryStore.retrieveRelevantContext("poetry form rhythm", 3);

        assertEquals(List.of("r1", "i2", "i1"), items.stream().map(ContextItem::getSourceId).toList());
        assertEquals(1.0, items.get(0).getScore(), 1e-9);
        assertEquals(ContextItem.Kind.REFLECTION, items.get(0).getKind());
    }

    @Test
    void retrieveRelevantContext_ignoresShortTokensAndNoOverlap() {
        memoryStore.storeInteraction(interaction("i1", "weather today", "Sunny.", 0));

        assertTrue(memoryStore.retrieveRelevantContext("is it ok", 5).isEmpty());
        assertTrue(memoryStore.retrieveRelevantContext("poetry", 5).isEmpty());
        assertTrue(memoryStore.retrieveRelevantContext("weather", 0).isEmpty());
    }

    // ===== Cache window =====

    @Test
    void cacheWindow_evictsOldestButKeepsLogComplete() throws Exception {
        properties.getMemory().setMaxCachedInteractions(2);
        memoryStore.storeInteraction(interaction("i1", "poetry basics", "Start with rhythm.", 0));
        memoryStore.storeInteraction(interaction("i2", "weather today", "Sunny.", 1));
        memoryStore.storeInteraction(interaction("i3", "weather tomorrow", "Rain.", 2));

        assertEquals(List.of("i3", "i2"),
                memoryStore.retrieveLastInteractions(10).stream().map(Interaction::getId).toList());
        assertTrue(memoryStore.retrieveRelevantContext("poetry", 5).isEmpty());
        String content = Files.readString(tempDir.resolve("memory").resolve("interactions.jsonl"));
        assertEquals(3, content.lines().count());
    }

    @Test
    void cacheWindow_reloadKeepsNewestRecordsAndFullReflectionCount() {
        for (int i = 0; i < 4; i++) {
            memoryStore.storeReflection(ReflectionRecord.builder()
                    .id("r" + i).kind(ReflectionKind.INTERACTION).timestamp(FIXED_TIME.plusSeconds(i))
                    .text("Reflection number " + i).build());
        }
        properties.getMemory().setMaxCachedReflections(2);

        JsonMemoryStoreAdapter reloaded = new JsonMemoryStoreAdapter(storage, objectMapper, properties);
        reloaded.init();

        assertEquals(List.of("r3", "r2"),
                reloaded.retrieveLastReflections(10).stream().map(ReflectionRecord::getId).toList());
        assertEquals(4, reloaded.countReflections());
        assertEquals(2, reloaded.retrieveRelevantContext("reflection", 10).size());
    }

    @Test
    void storeInteraction_wrapsStorageFailure() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.appendText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new PersistenceException("disk full")));
        JsonMemoryStoreAdapter adapter = new JsonMemoryStoreAdapter(failing, objectMapper, properties);

        assertThrows(PersistenceException.class,
                () -> adapter.storeInteraction(interaction("i1", "hello", "hi", 0)));
        assertTrue(adapter.retrieveLastInteractions(1).isEmpty());
    }

    @Test
    void tokenize_lowercasesAndDropsShortWords() {
        assertEquals(Set.of("hello", "world", "self-awareness"),
                JsonMemoryStoreAdapter.tokenize("Hello, WORLD! an ok self-awareness"));
    }
}
