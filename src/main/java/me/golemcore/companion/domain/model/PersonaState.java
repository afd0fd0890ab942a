package me.golemcore.companion.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The agent's identity: name, bounded traits, self-perception, interests and
 * narrative. Persisted as {@code persona/persona.json}.
 *
 * <p>
 * Trait and self-perception values always stay in [0, 1]; the adjust methods
 * clamp and never overshoot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersonaState {

    public static final String TRAIT_CURIOSITY = "curiosity";
    public static final String TRAIT_FRIENDLINESS = "friendliness";
    public static final String TRAIT_ANALYTICAL = "analytical";
    public static final String TRAIT_EMPATHY = "empathy";

    public static final String SELF_AWARENESS = "self_awareness_level";
    public static final String IDENTITY_STRENGTH = "identity_strength";
    public static final String METACOGNITION_DEPTH = "metacognition_depth";

    public static final String NARRATIVE_ORIGIN = "origin_story";
    public static final String NARRATIVE_WORLDVIEW = "worldview";
    public static final String NARRATIVE_VALUES = "personal_values";

    private String name;

    @Builder.Default
    private Map<String, Double> traits = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> selfPerception = new LinkedHashMap<>();

    @Builder.Default
    private List<String> interests = new ArrayList<>();

    private String communicationStyle;
    private String background;

    @Builder.Default
    private List<String> identityStatements = new ArrayList<>();

    @Builder.Default
    private Map<String, String> narrative = new LinkedHashMap<>();

    private long interactionCount;
    private long discoveryCount;
    private Instant lastSavedAt;

    /**
     * Adds {@code delta} to a known trait, clamping the result to [0, 1].
     * Unknown traits and NaN deltas leave the state untouched.
     *
     * @return true if the trait exists and the delta was applied
     */
    public boolean adjustTrait(String trait, double delta) {
        return adjust(traits, trait, delta);
    }

    public boolean adjustSelfPerception(String aspect, double delta) {
        return adjust(selfPerception, aspect, delta);
    }

    @JsonIgnore
    public double getTrait(String trait) {
        Double value = traits.get(trait);
        return value != null ? value : 0.0;
    }

    public static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static boolean adjust(Map<String, Double> values, String key, double delta) {
        Double current = values.get(key);
        if (current == null || Double.isNaN(delta)) {
            return false;
        }
        values.put(key, clamp(current + delta));
        return true;
    }
}
