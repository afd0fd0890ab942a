package me.golemcore.companion.domain.service;

import me.golemcore.companion.domain.exception.PersistenceException;
import me.golemcore.companion.domain.model.Discovery;
import me.golemcore.companion.domain.model.PersonaState;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.PersonaStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PersonaServiceTest {

    private static final Instant FIXED_TIME = Instant.parse("2026-01-01T12:00:00Z");

    private PersonaStorePort personaStore;
    private PersonaService service;

    @BeforeEach
    void setUp() {
        personaStore = mock(PersonaStorePort.class);
        when(personaStore.load()).thenReturn(Optional.empty());
        service = new PersonaService(personaStore, new CompanionProperties(),
                Clock.fixed(FIXED_TIME, ZoneOffset.UTC));
        service.init();
    }

    @Test
    void init_usesConfiguredDefaultsWhenNothingSaved() {
        PersonaState persona = service.snapshot();

        assertEquals("Lira", persona.getName());
        assertEquals(0.5, persona.getTrait(PersonaState.TRAIT_CURIOSITY));
        assertEquals(4, persona.getTraits().size());
    }

    @Test
    void init_clampsLoadedTraits() {
        Map<String, Double> traits = new LinkedHashMap<>();
        traits.put(PersonaState.TRAIT_EMPATHY, 3.0);
        traits.put(PersonaState.TRAIT_CURIOSITY, -1.0);
        when(personaStore.load()).thenReturn(Optional.of(PersonaState.builder().name("Nova").traits(traits).build()));

        service.init();

        PersonaState persona = service.snapshot();
        assertEquals("Nova", persona.getName());
        assertEquals(1.0, persona.getTrait(PersonaState.TRAIT_EMPATHY));
        assertEquals(0.0, persona.getTrait(PersonaState.TRAIT_CURIOSITY));
    }

    @Test
    void init_fallsBackToDefaultsWhenLoadFails() {
        when(personaStore.load()).thenThrow(new PersistenceException("corrupt persona file"));

        service.init();

        assertEquals("Lira", service.getName());
    }

    @Test
    void snapshot_isDetachedCopy() {
        PersonaState snapshot = service.snapshot();
        snapshot.getTraits().put(PersonaState.TRAIT_CURIOSITY, 0.99);

        assertEquals(0.5, service.snapshot().getTrait(PersonaState.TRAIT_CURIOSITY));
    }

    @Test
    void adjustTrait_clampsAndRejectsUnknownTrait() {
        assertEquals(1.0, service.adjustTrait(PersonaState.TRAIT_EMPATHY, 5.0));
        assertEquals(0.0, service.adjustTrait(PersonaState.TRAIT_EMPATHY, -5.0));
        assertEquals(-1, service.adjustTrait("stubbornness", 0.1));
    }

    @Test
    void applyInteraction_positiveQuestionRaisesFriendlinessAndCuriosity() {
        int changes = service.applyInteraction("Thanks, that was great! Can you tell me more?");

        PersonaState persona = service.snapshot();
        assertEquals(1, changes);
        assertEquals(0.52, persona.getTrait(PersonaState.TRAIT_FRIENDLINESS), 1e-9);
        assertEquals(0.51, persona.getTrait(PersonaState.TRAIT_CURIOSITY), 1e-9);
        assertEquals(1, persona.getInteractionCount());
    }

    @Test
    void applyInteraction_addsNewInterestFromQuery() {
        service.applyInteraction("what do you think about ethics in general");

        assertTrue(service.snapshot().getInterests().contains("ethics"));
    }

    @Test
    void applyDiscovery_scalesEmpathyByImportance() {
        Discovery discovery = Discovery.builder()
                .topic("grief")
                .content("How communities share grief and compassion")
                .importance(0.5)
                .build();

        assertEquals(1, service.applyDiscovery(discovery));

        PersonaState persona = service.snapshot();
        assertEquals(0.52, persona.getTrait(PersonaState.TRAIT_EMPATHY), 1e-9);
        assertEquals(0.5, persona.getTrait(PersonaState.TRAIT_ANALYTICAL), 1e-9);
        assertEquals(1, persona.getDiscoveryCount());
    }

    @Test
    void applyDiscovery_ignoresNull() {
        assertEquals(0, service.applyDiscovery(null));
    }

    @Test
    void applyExternalEvaluation_movesTraitsTowardsScore() {
        service.applyExternalEvaluation(1.0, 1.0);

        PersonaState persona = service.snapshot();
        assertEquals(0.6, persona.getTrait(PersonaState.TRAIT_ANALYTICAL), 1e-9);
        assertEquals(0.6, persona.getTrait(PersonaState.TRAIT_FRIENDLINESS), 1e-9);
    }

    @Test
    void applyExternalEvaluation_zeroConfidenceChangesNothing() {
        service.applyExternalEvaluation(0.0, 0.0);

        assertEquals(0.5, service.snapshot().getTrait(PersonaState.TRAIT_ANALYTICAL), 1e-9);
    }

    @Test
    void save_stampsAndPersistsCopy() {
        service.save();

        ArgumentCaptor<PersonaState> captor = ArgumentCaptor.forClass(PersonaState.class);
        verify(personaStore).save(captor.capture());
        assertEquals(FIXED_TIME, captor.getValue().getLastSavedAt());
        assertEquals(FIXED_TIME, service.snapshot().getLastSavedAt());
    }

    @Test
    void save_propagatesStoreFailure() {
        doThrow(new PersistenceException("disk full")).when(personaStore).save(any());

        assertThrows(PersistenceException.class, () -> service.save());
        assertNull(service.snapshot().getLastSavedAt());
    }

    @Test
    void buildPersonaContext_describesPersona() {
        String context = service.buildPersonaContext();

        assertTrue(context.startsWith("You are Lira"));
        assertTrue(context.contains("curiosity: 0.50"));
        assertTrue(context.contains("Always respond as Lira in the first person."));
    }
}
