package me.golemcore.companion.adapter.outbound.persona;

import me.golemcore.companion.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.companion.domain.exception.PersistenceException;
import me.golemcore.companion.domain.model.PersonaState;
import me.golemcore.companion.infrastructure.config.CompanionConfiguration;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonPersonaStoreAdapterTest {

    @TempDir
    Path tempDir;

    private JsonPersonaStoreAdapter personaStore;

    @BeforeEach
    void setUp() {
        CompanionProperties properties = new CompanionProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        personaStore = new JsonPersonaStoreAdapter(storage, CompanionConfiguration.objectMapper());
    }

    @Test
    void load_emptyWhenNothingSaved() {
        assertEquals(Optional.empty(), personaStore.load());
    }

    @Test
    void saveAndLoad() {
        Map<String, Double> traits = new LinkedHashMap<>();
        traits.put(PersonaState.TRAIT_EMPATHY, 0.72);
        PersonaState persona = PersonaState.builder()
                .name("Lira")
                .traits(traits)
                .interactionCount(12)
                .lastSavedAt(Instant.parse("2026-01-01T12:00:00Z"))
                .build();

        personaStore.save(persona);
        PersonaState loaded = personaStore.load().orElseThrow();

        assertEquals("Lira", loaded.getName());
        assertEquals(0.72, loaded.getTrait(PersonaState.TRAIT_EMPATHY));
        assertEquals(12, loaded.getInteractionCount());
        assertEquals(Instant.parse("2026-01-01T12:00:00Z"), loaded.getLastSavedAt());
    }

    @Test
    void load_corruptSnapshotRaisesPersistenceException() throws Exception {
        Files.writeString(tempDir.resolve("persona").resolve("persona.json"), "{not json");

        assertThrows(PersistenceException.class, () -> personaStore.load());
    }
}
