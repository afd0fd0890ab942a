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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.exception.GenerationException;
import me.golemcore.companion.domain.model.Discovery;
import me.golemcore.companion.domain.model.GenerationRequest;
import me.golemcore.companion.domain.model.Interaction;
import me.golemcore.companion.domain.model.ReflectionKind;
import me.golemcore.companion.domain.model.ReflectionRecord;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.MemoryStorePort;
import me.golemcore.companion.port.outbound.ResponseGeneratorPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Produces reflection records from recent interactions and from recent
 * discoveries. Every record is written to the memory store before it is
 * returned.
 */
@Service
@Slf4j
public class ReflectionEngine {

    static final int DISCOVERY_WINDOW = 5;

    private static final String REFLECTION_CONTEXT = "You are reflecting on your own recent conversations. "
            + "Describe what went well, what could be better and what you learned about yourself.";
    private static final String DISCOVERY_CONTEXT = "You are reflecting on information you recently discovered. "
            + "Summarize the insight and how it changes your understanding.";

    private final MemoryStorePort memoryStore;
    private final ResponseGeneratorPort generator;
    private final DiscoveryBuffer discoveryBuffer;
    private final CompanionProperties.ReflectionProperties config;
    private final Clock clock;

    public ReflectionEngine(MemoryStorePort memoryStore, ResponseGeneratorPort generator,
            DiscoveryBuffer discoveryBuffer, CompanionProperties properties, Clock clock) {
        this.memoryStore = memoryStore;
        this.generator = generator;
        this.discoveryBuffer = discoveryBuffer;
        this.config = properties.getReflection();
        this.clock = clock;
    }

    /**
     * Reflect on the last {@code depth} interactions.
     *
     * @return empty when there is nothing to reflect on
     */
    public Optional<ReflectionRecord> reflect() throws GenerationException {
        List<Interaction> interactions = new ArrayList<>(memoryStore.retrieveLastInteractions(config.getDepth()));
        if (interactions.isEmpty()) {
            log.debug("[Reflection] No interactions to reflect on");
            return Optional.empty();
        }
        Collections.reverse(interactions);

        StringBuilder prompt = new StringBuilder();
        List<String> sourceIds = new ArrayList<>();
        for (int i = 0; i < interactions.size(); i++) {
            Interaction interaction = interactions.get(i);
            sourceIds.add(interaction.getId());
            prompt.append("Interaction ").append(i + 1).append(":\n")
                    .append("Query: ").append(interaction.getMessage().text()).append('\n')
                    .append("Response: ")
                    .append(interaction.getResponse() != null ? interaction.getResponse().getText() : "")
                    .append("\n\n");
        }

        String text = generator.generate(GenerationRequest.of(REFLECTION_CONTEXT, prompt.toString().trim()));
        ReflectionRecord reflection = store(ReflectionKind.INTERACTION, sourceIds, text);
        log.info("[Reflection] Reflected on {} interactions", interactions.size());
        return Optional.of(reflection);
    }

    /**
     * Turn the most recent discoveries into a discovery insight.
     *
     * @return empty when no discovery is buffered
     */
    public Optional<ReflectionRecord> processDiscoveries() throws GenerationException {
        List<Discovery> discoveries = discoveryBuffer.recent(DISCOVERY_WINDOW);
        if (discoveries.isEmpty()) {
            return Optional.empty();
        }

        StringBuilder prompt = new StringBuilder("Recent discoveries:\n");
        List<String> sourceIds = new ArrayList<>();
        for (Discovery discovery : discoveries) {
            sourceIds.add(discovery.getSource() != null ? discovery.getSource() : discovery.getTopic());
            prompt.append("- ").append(discovery.getTopic()).append(": ").append(discovery.getContent())
                    .append('\n');
        }
        prompt.append("What is the most important insight here?");

        String text = generator.generate(GenerationRequest.of(DISCOVERY_CONTEXT, prompt.toString()));
        ReflectionRecord insight = store(ReflectionKind.DISCOVERY_INSIGHT, sourceIds, text);
        log.info("[Reflection] Discovery insight from {} discoveries", discoveries.size());
        return Optional.of(insight);
    }

    private ReflectionRecord store(ReflectionKind kind, List<String> sourceIds, String text) {
        ReflectionRecord record = ReflectionRecord.builder()
                .id(UUID.randomUUID().toString())
                .kind(kind)
                .timestamp(clock.instant())
                .sourceIds(sourceIds)
                .text(text)
                .build();
        memoryStore.storeReflection(record);
        return record;
    }
}
