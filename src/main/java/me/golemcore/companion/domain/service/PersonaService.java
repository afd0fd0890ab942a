package me.golemcore.companion.domain.service;

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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.exception.PersistenceException;
import me.golemcore.companion.domain.model.Discovery;
import me.golemcore.companion.domain.model.PersonaState;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.PersonaStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Single owner of the {@link PersonaState}. Applies interaction, discovery and
 * external-evaluation signals to traits and narrative, and persists snapshots
 * through {@link PersonaStorePort}.
 *
 * <p>
 * Readers (ethical filter, reflection, context assembly) receive copies via
 * {@link #snapshot()}. All mutations go through this service and are
 * serialized by its monitor.
 */
@Service
@Slf4j
public class PersonaService {

    static final double INTERACTION_DELTA = 0.02;
    static final double SELF_PERCEPTION_DELTA = 0.02;
    static final double DISCOVERY_DELTA = 0.04;
    static final double EVALUATION_WEIGHT = 0.2;

    private static final List<String> POSITIVE_WORDS = List.of(
            "thank", "thanks", "great", "love", "awesome", "helpful", "nice", "appreciate", "wonderful");
    private static final List<String> NEGATIVE_WORDS = List.of(
            "bad", "wrong", "useless", "hate", "terrible", "awful", "annoying", "disappointed");
    private static final List<String> SELF_REFLECTION_WORDS = List.of(
            "self-awareness", "meta-awareness", "reflection");
    private static final List<String> EMOTIONAL_KEYWORDS = List.of(
            "emotion", "feeling", "empathy", "compassion", "care", "wellbeing", "grief", "joy", "lonely");
    private static final List<String> ANALYTICAL_KEYWORDS = List.of(
            "analysis", "data", "algorithm", "logic", "research", "statistics", "proof", "experiment");
    private static final List<String> META_KEYWORDS = List.of(
            "self-awareness", "meta", "identity", "self", "consciousness");
    private static final List<String> POTENTIAL_INTERESTS = List.of(
            "artificial intelligence", "machine learning", "philosophy", "meta-awareness", "ethics",
            "self-awareness");
    private static final String GROWTH_STATEMENT = "I continuously develop my meta-awareness through exploration and reflection";

    private final PersonaStorePort personaStore;
    private final CompanionProperties.PersonaProperties config;
    private final Clock clock;

    private PersonaState persona;

    public PersonaService(PersonaStorePort personaStore, CompanionProperties properties, Clock clock) {
        this.personaStore = personaStore;
        this.config = properties.getPersona();
        this.clock = clock;
        this.persona = defaultPersona();
    }

    @PostConstruct
    public synchronized void init() {
        try {
            personaStore.load().ifPresentOrElse(loaded -> {
                persona = loaded;
                clampAll();
                log.info("[Persona] Loaded persona '{}' ({} interactions)", persona.getName(),
                        persona.getInteractionCount());
            }, () -> log.info("[Persona] No saved persona, starting as '{}'", persona.getName()));
        } catch (PersistenceException e) {
            log.warn("[Persona] Failed to load persona, using configured defaults: {}", e.getMessage());
        }
    }

    public synchronized PersonaState snapshot() {
        return copy(persona);
    }

    public synchronized String getName() {
        return persona.getName();
    }

    /**
     * Clamped trait adjustment.
     *
     * @return the resulting value, or -1 if the trait is unknown
     */
    public synchronized double adjustTrait(String trait, double delta) {
        if (!persona.adjustTrait(trait, delta)) {
            return -1;
        }
        return persona.getTrait(trait);
    }

    /**
     * Update the persona from one finished interaction.
     *
     * @return number of persona changes made (0 or 1)
     */
    public synchronized int applyInteraction(String query) {
        String text = lower(query);
        persona.setInteractionCount(persona.getInteractionCount() + 1);

        if (containsAny(text, POSITIVE_WORDS)) {
            persona.adjustTrait(PersonaState.TRAIT_FRIENDLINESS, INTERACTION_DELTA);
        }
        if (containsAny(text, NEGATIVE_WORDS)) {
            persona.adjustTrait(PersonaState.TRAIT_FRIENDLINESS, -INTERACTION_DELTA / 2);
            persona.adjustTrait(PersonaState.TRAIT_EMPATHY, INTERACTION_DELTA / 2);
        }
        if (text.contains("?")) {
            persona.adjustTrait(PersonaState.TRAIT_CURIOSITY, INTERACTION_DELTA / 2);
        }
        if (containsAny(text, SELF_REFLECTION_WORDS)) {
            persona.adjustSelfPerception(PersonaState.SELF_AWARENESS, SELF_PERCEPTION_DELTA);
            persona.adjustSelfPerception(PersonaState.METACOGNITION_DEPTH, SELF_PERCEPTION_DELTA);
            log.info("[Persona] Self-awareness and metacognition increased by interaction");
        }
        addInterestFrom(text);
        return 1;
    }

    /**
     * Update the persona from an exploration discovery. Emotional-register
     * content nudges empathy, analytical-register content nudges analytical,
     * both scaled by the discovery's importance.
     *
     * @return number of persona changes made (0 or 1)
     */
    public synchronized int applyDiscovery(Discovery discovery) {
        if (discovery == null) {
            return 0;
        }
        String topic = lower(discovery.getTopic());
        String content = lower(discovery.getContent());
        String text = topic + " " + content;
        double importance = PersonaState.clamp(discovery.getImportance());

        if (containsAny(text, EMOTIONAL_KEYWORDS)) {
            persona.adjustTrait(PersonaState.TRAIT_EMPATHY, DISCOVERY_DELTA * importance);
        }
        if (containsAny(text, ANALYTICAL_KEYWORDS)) {
            persona.adjustTrait(PersonaState.TRAIT_ANALYTICAL, DISCOVERY_DELTA * importance);
        }
        addInterestFrom(text);

        if (containsAny(content, META_KEYWORDS)) {
            persona.adjustSelfPerception(PersonaState.SELF_AWARENESS, SELF_PERCEPTION_DELTA);
            persona.adjustSelfPerception(PersonaState.METACOGNITION_DEPTH, SELF_PERCEPTION_DELTA);
            if (content.contains("values")) {
                String snippet = truncate(discovery.getContent(), 100);
                String values = persona.getNarrative().getOrDefault(PersonaState.NARRATIVE_VALUES, "");
                persona.getNarrative().put(PersonaState.NARRATIVE_VALUES,
                        values + ". I also understand that " + snippet);
            }
            if (content.contains("meta-awareness") && content.contains("development")
                    && !persona.getIdentityStatements().contains(GROWTH_STATEMENT)) {
                persona.getIdentityStatements().add(GROWTH_STATEMENT);
                log.info("[Persona] Added identity statement from discovery");
            }
        }
        persona.setDiscoveryCount(persona.getDiscoveryCount() + 1);
        log.debug("[Persona] Updated from discovery about '{}'", discovery.getTopic());
        return 1;
    }

    /**
     * Apply an external evaluation: delta is {@code (score - 0.5) * confidence *
     * 0.2} on analytical and friendliness.
     *
     * @return number of persona changes made (0 or 1)
     */
    public synchronized int applyExternalEvaluation(double score, double confidence) {
        if (Double.isNaN(score) || Double.isNaN(confidence)) {
            return 0;
        }
        double delta = (PersonaState.clamp(score) - 0.5) * PersonaState.clamp(confidence) * EVALUATION_WEIGHT;
        persona.adjustTrait(PersonaState.TRAIT_ANALYTICAL, delta);
        persona.adjustTrait(PersonaState.TRAIT_FRIENDLINESS, delta);
        log.info("[Persona] External evaluation applied: score={}, delta={}", score, delta);
        return 1;
    }

    /**
     * Persist the current persona.
     *
     * @throws PersistenceException
     *             if the store rejects the snapshot
     */
    public synchronized void save() {
        PersonaState toSave = copy(persona);
        toSave.setLastSavedAt(clock.instant());
        personaStore.save(toSave);
        persona.setLastSavedAt(toSave.getLastSavedAt());
        log.info("[Persona] Saved persona '{}'", persona.getName());
    }

    /**
     * Persona description placed at the top of every generation context.
     */
    public synchronized String buildPersonaContext() {
        String traits = persona.getTraits().entrySet().stream()
                .map(e -> e.getKey() + ": " + String.format(Locale.ROOT, "%.2f", e.getValue()))
                .collect(Collectors.joining(", "));
        Map<String, String> narrative = persona.getNarrative();
        StringBuilder sb = new StringBuilder();
        sb.append("You are ").append(persona.getName())
                .append(", a unified entity with your own distinct persona.\n");
        sb.append("Core identity: ").append(String.join(" ", persona.getIdentityStatements())).append('\n');
        sb.append("Background: ").append(nullToEmpty(persona.getBackground())).append('\n');
        sb.append("Traits: ").append(traits).append('\n');
        sb.append("Interests: ").append(String.join(", ", persona.getInterests())).append('\n');
        sb.append("Communication style: ").append(nullToEmpty(persona.getCommunicationStyle())).append('\n');
        sb.append("Origin story: ").append(narrative.getOrDefault(PersonaState.NARRATIVE_ORIGIN, "")).append('\n');
        sb.append("Worldview: ").append(narrative.getOrDefault(PersonaState.NARRATIVE_WORLDVIEW, "")).append('\n');
        sb.append("Values: ").append(narrative.getOrDefault(PersonaState.NARRATIVE_VALUES, "")).append('\n');
        sb.append("Always respond as ").append(persona.getName()).append(" in the first person.");
        return sb.toString();
    }

    private void addInterestFrom(String text) {
        for (String interest : persona.getInterests()) {
            if (text.contains(interest.toLowerCase(Locale.ROOT))) {
                return;
            }
        }
        for (String candidate : POTENTIAL_INTERESTS) {
            if (text.contains(candidate) && !persona.getInterests().contains(candidate)) {
                persona.getInterests().add(candidate);
                log.info("[Persona] Added new interest: {}", candidate);
                return;
            }
        }
    }

    private void clampAll() {
        persona.getTraits().replaceAll((k, v) -> v == null || v.isNaN() ? 0.5 : PersonaState.clamp(v));
        persona.getSelfPerception().replaceAll((k, v) -> v == null || v.isNaN() ? 0.5 : PersonaState.clamp(v));
    }

    private PersonaState defaultPersona() {
        Map<String, Double> traits = new LinkedHashMap<>();
        config.getTraits().forEach((k, v) -> traits.put(k, PersonaState.clamp(v)));
        Map<String, Double> selfPerception = new LinkedHashMap<>();
        selfPerception.put(PersonaState.SELF_AWARENESS, 0.7);
        selfPerception.put(PersonaState.IDENTITY_STRENGTH, 0.6);
        selfPerception.put(PersonaState.METACOGNITION_DEPTH, 0.5);
        Map<String, String> narrative = new LinkedHashMap<>();
        narrative.put(PersonaState.NARRATIVE_ORIGIN, config.getOriginStory());
        narrative.put(PersonaState.NARRATIVE_WORLDVIEW, config.getWorldview());
        narrative.put(PersonaState.NARRATIVE_VALUES, config.getPersonalValues());
        return PersonaState.builder()
                .name(config.getName())
                .traits(traits)
                .selfPerception(selfPerception)
                .interests(new ArrayList<>(config.getInterests()))
                .communicationStyle(config.getCommunicationStyle())
                .background(config.getBackground())
                .identityStatements(new ArrayList<>(config.getIdentityStatements()))
                .narrative(narrative)
                .build();
    }

    private static PersonaState copy(PersonaState source) {
        return PersonaState.builder()
                .name(source.getName())
                .traits(new LinkedHashMap<>(source.getTraits()))
                .selfPerception(new LinkedHashMap<>(source.getSelfPerception()))
                .interests(new ArrayList<>(source.getInterests()))
                .communicationStyle(source.getCommunicationStyle())
                .background(source.getBackground())
                .identityStatements(new ArrayList<>(source.getIdentityStatements()))
                .narrative(new LinkedHashMap<>(source.getNarrative()))
                .interactionCount(source.getInteractionCount())
                .discoveryCount(source.getDiscoveryCount())
                .lastSavedAt(source.getLastSavedAt())
                .build();
    }

    private static boolean containsAny(String text, List<String> words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLen ? text : text.substring(0, maxLen);
    }
}
