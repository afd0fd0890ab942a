package me.golemcore.companion.adapter.outbound.memory;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.exception.PersistenceException;
import me.golemcore.companion.domain.model.ContextItem;
import me.golemcore.companion.domain.model.Interaction;
import me.golemcore.companion.domain.model.ReflectionRecord;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.MemoryStorePort;
import me.golemcore.companion.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Append-only memory backed by two JSONL logs under {@code memory/}:
 * {@code interactions.jsonl} and {@code reflections.jsonl}. The logs keep the
 * full history; only the newest records, up to
 * {@code companion.memory.max-cached-interactions} and
 * {@code companion.memory.max-cached-reflections}, are held in memory and
 * answer queries.
 *
 * <p>
 * Relevance is lexical: the share of query tokens found in an entry, ties
 * broken by recency. Entries without any overlap are not returned. Tokens are
 * computed once per cached record.
 */
@Component
@Slf4j
public class JsonMemoryStoreAdapter implements MemoryStorePort {

    private static final String MEMORY_DIR = "memory";
    private static final String INTERACTIONS_FILE = "interactions.jsonl";
    private static final String REFLECTIONS_FILE = "reflections.jsonl";
    private static final int MIN_TOKEN_LENGTH = 3;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final CompanionProperties.MemoryProperties config;
    private final Deque<Cached<Interaction>> interactions = new ArrayDeque<>();
    private final Deque<Cached<ReflectionRecord>> reflections = new ArrayDeque<>();
    private long reflectionCount;

    public JsonMemoryStoreAdapter(StoragePort storagePort, ObjectMapper objectMapper,
            CompanionProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.config = properties.getMemory();
    }

    @PostConstruct
    public synchronized void init() {
        List<Interaction> storedInteractions = readLog(INTERACTIONS_FILE, Interaction.class);
        List<ReflectionRecord> storedReflections = readLog(REFLECTIONS_FILE, ReflectionRecord.class);
        storedInteractions.forEach(this::cacheInteraction);
        storedReflections.forEach(this::cacheReflection);
        reflectionCount = storedReflections.size();
        log.info("[Memory] Loaded {} interactions and {} reflections, caching {} and {}",
                storedInteractions.size(), storedReflections.size(), interactions.size(), reflections.size());
    }

    @Override
    public synchronized void storeInteraction(Interaction interaction) {
        append(INTERACTIONS_FILE, interaction);
        cacheInteraction(interaction);
    }

    @Override
    public synchronized void storeReflection(ReflectionRecord reflection) {
        append(REFLECTIONS_FILE, reflection);
        cacheReflection(reflection);
        reflectionCount++;
    }

    @Override
    public synchronized List<ContextItem> retrieveRelevantContext(String query, int k) {
        Set<String> queryTokens = tokenize(query);
        if (queryTokens.isEmpty() || k <= 0) {
            return List.of();
        }

        List<ContextItem> scored = new ArrayList<>();
        for (Cached<Interaction> entry : interactions) {
            double relevance = relevance(queryTokens, entry.tokens());
            if (relevance > 0) {
                scored.add(contextItem(entry, ContextItem.Kind.INTERACTION, entry.item().getId(), relevance,
                        entry.item().getCompletedAt()));
            }
        }
        for (Cached<ReflectionRecord> entry : reflections) {
            double relevance = relevance(queryTokens, entry.tokens());
            if (relevance > 0) {
                scored.add(contextItem(entry, ContextItem.Kind.REFLECTION, entry.item().getId(), relevance,
                        entry.item().getTimestamp()));
            }
        }

        scored.sort(Comparator.comparingDouble(ContextItem::getScore).reversed()
                .thenComparing(ContextItem::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder())));
        return List.copyOf(scored.subList(0, Math.min(k, scored.size())));
    }

    @Override
    public synchronized List<Interaction> retrieveLastInteractions(int n) {
        return newestFirst(interactions, n);
    }

    @Override
    public synchronized List<ReflectionRecord> retrieveLastReflections(int n) {
        return newestFirst(reflections, n);
    }

    @Override
    public synchronized long countReflections() {
        return reflectionCount;
    }

    @Override
    public void flush() {
        // every record is appended synchronously; nothing is buffered
        log.debug("[Memory] Flush requested, {} interactions cached", interactions.size());
    }

    private void cacheInteraction(Interaction interaction) {
        String text = interactionText(interaction);
        cache(interactions, new Cached<>(interaction, text, tokenize(text)), config.getMaxCachedInteractions());
    }

    private void cacheReflection(ReflectionRecord reflection) {
        String text = reflection.getText();
        cache(reflections, new Cached<>(reflection, text, tokenize(text)), config.getMaxCachedReflections());
    }

    private static <T> void cache(Deque<Cached<T>> window, Cached<T> entry, int limit) {
        window.addLast(entry);
        while (window.size() > Math.max(1, limit)) {
            window.removeFirst();
        }
    }

    private static ContextItem contextItem(Cached<?> entry, ContextItem.Kind kind, String sourceId,
            double relevance, Instant timestamp) {
        return ContextItem.builder()
                .sourceId(sourceId)
                .kind(kind)
                .text(entry.text())
                .score(relevance)
                .timestamp(timestamp)
                .build();
    }

    private void append(String file, Object record) {
        try {
            String line = objectMapper.writeValueAsString(record) + "\n";
            storagePort.appendText(MEMORY_DIR, file, line).join();
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize record for " + file, e);
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to append to " + file, e.getCause());
        }
    }

    private <T> List<T> readLog(String file, Class<T> type) {
        String content;
        try {
            content = storagePort.getText(MEMORY_DIR, file).join();
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to read " + file, e.getCause());
        }
        List<T> records = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return records;
        }
        int skipped = 0;
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(objectMapper.readValue(line, type));
            } catch (JsonProcessingException e) {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("[Memory] Skipped {} unreadable lines in {}", skipped, file);
        }
        return records;
    }

    private static <T> List<T> newestFirst(Deque<Cached<T>> window, int n) {
        List<T> result = new ArrayList<>();
        Iterator<Cached<T>> it = window.descendingIterator();
        while (it.hasNext() && result.size() < n) {
            result.add(it.next().item());
        }
        return result;
    }

    private static String interactionText(Interaction interaction) {
        String query = interaction.getMessage() != null ? interaction.getMessage().text() : "";
        String response = interaction.getResponse() != null ? interaction.getResponse().getText() : "";
        return "User: " + query + "\nAssistant: " + response;
    }

    private static double relevance(Set<String> queryTokens, Set<String> contentTokens) {
        if (contentTokens.isEmpty()) {
            return 0.0;
        }
        int matches = 0;
        for (String token : queryTokens) {
            if (contentTokens.contains(token)) {
                matches++;
            }
        }
        return (double) matches / queryTokens.size();
    }

    static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}_-]+")) {
            if (token.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private record Cached<T>(T item, String text, Set<String> tokens) {
    }
}
