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
import me.golemcore.companion.domain.model.AssembledContext;
import me.golemcore.companion.domain.model.ContextItem;
import me.golemcore.companion.domain.model.Interaction;
import me.golemcore.companion.domain.model.ReflectionKind;
import me.golemcore.companion.domain.model.ReflectionRecord;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.MemoryStorePort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the generation context from memory: top-K relevant entries, the most
 * recent interaction pairs and a few metacognitive notes, under a persona
 * header. The result never exceeds {@code companion.context.max-chars}.
 *
 * <p>
 * Each section has its own share of the budget: persona 40%, relevant
 * memories 30%, recent conversation 20%, notes the rest. Space a section does
 * not use passes to the next one. Inside a section whole entries are kept in
 * priority order (best match, newest exchange) and only a lone entry that
 * does not fit on its own is cut.
 */
@Service
@Slf4j
public class ContextAssembler {

    private static final int ITEM_CHARS = 500;
    private static final int NOTE_SCAN = 20;
    private static final int PERSONA_PERCENT = 40;
    private static final int RELEVANT_PERCENT = 30;
    private static final int RECENT_PERCENT = 20;
    private static final String SECTION_SEPARATOR = "\n\n";

    private final MemoryStorePort memoryStore;
    private final CompanionProperties.ContextProperties config;
    private final CompanionProperties.ReflectionProperties reflectionConfig;

    public ContextAssembler(MemoryStorePort memoryStore, CompanionProperties properties) {
        this.memoryStore = memoryStore;
        this.config = properties.getContext();
        this.reflectionConfig = properties.getReflection();
    }

    public AssembledContext assemble(String query, String personaContext) {
        List<ContextItem> relevant = memoryStore.retrieveRelevantContext(query, config.getRelevantItems());
        List<Interaction> recent = memoryStore.retrieveLastInteractions(config.getRecentInteractions());
        List<String> notes = metacognitiveNotes();
        int maxChars = Math.max(0, config.getMaxChars());

        StringBuilder sb = new StringBuilder();
        int budget = share(maxChars, PERSONA_PERCENT);
        if (personaContext != null && !personaContext.isBlank()) {
            sb.append(clip(personaContext.strip(), budget));
        }

        budget = share(maxChars, PERSONA_PERCENT + RELEVANT_PERCENT) - sb.length();
        List<String> relevantEntries = new ArrayList<>();
        for (ContextItem item : relevant) {
            relevantEntries.add("- " + clip(item.getText(), ITEM_CHARS));
        }
        int relevantKept = appendSection(sb, "# Relevant memories", relevantEntries, budget, false);

        budget = share(maxChars, PERSONA_PERCENT + RELEVANT_PERCENT + RECENT_PERCENT) - sb.length();
        List<String> recentEntries = new ArrayList<>();
        for (Interaction interaction : recent) {
            String exchange = "User: " + clip(interaction.getMessage().text(), ITEM_CHARS);
            if (interaction.getResponse() != null) {
                exchange += "\nYou: " + clip(interaction.getResponse().getText(), ITEM_CHARS);
            }
            recentEntries.add(exchange);
        }
        int recentKept = appendSection(sb, "# Recent conversation", recentEntries, budget, true);

        budget = maxChars - sb.length();
        List<String> noteEntries = new ArrayList<>();
        for (String note : notes) {
            noteEntries.add("- " + note);
        }
        int notesKept = appendSection(sb, "# Notes to self", noteEntries, budget, false);

        List<String> sourceIds = new ArrayList<>();
        for (ContextItem item : relevant.subList(0, relevantKept)) {
            sourceIds.add(item.getSourceId());
        }
        String text = sb.toString();
        log.debug("[Context] {}/{} relevant, {}/{} recent, {}/{} notes, {} chars",
                relevantKept, relevant.size(), recentKept, recent.size(), notesKept, notes.size(), text.length());
        return AssembledContext.builder()
                .text(text)
                .sourceIds(sourceIds)
                .relevantCount(relevantKept)
                .recentCount(recentKept)
                .noteCount(notesKept)
                .build();
    }

    /**
     * Append a header and as many entries as fit in {@code budget} chars,
     * separator included. Entries are offered in priority order; with
     * {@code reverse} the kept ones are written oldest first.
     *
     * @return number of entries written
     */
    private static int appendSection(StringBuilder sb, String header, List<String> entries, int budget,
            boolean reverse) {
        if (entries.isEmpty()) {
            return 0;
        }
        String separator = sb.length() > 0 ? SECTION_SEPARATOR : "";
        int room = budget - separator.length() - header.length();
        List<String> kept = new ArrayList<>();
        int used = 0;
        for (String entry : entries) {
            int cost = entry.length() + 1;
            if (used + cost > room) {
                if (kept.isEmpty() && room > 1) {
                    kept.add(entry.substring(0, room - 1));
                }
                break;
            }
            kept.add(entry);
            used += cost;
        }
        if (kept.isEmpty()) {
            return 0;
        }
        if (reverse) {
            Collections.reverse(kept);
        }
        sb.append(separator).append(header);
        for (String entry : kept) {
            sb.append('\n').append(entry);
        }
        return kept.size();
    }

    private static int share(int maxChars, int percent) {
        return (int) ((long) maxChars * percent / 100);
    }

    private List<String> metacognitiveNotes() {
        int perKind = reflectionConfig.getNotesInContext();
        List<String> reflections = new ArrayList<>();
        List<String> insights = new ArrayList<>();
        for (ReflectionRecord record : memoryStore.retrieveLastReflections(NOTE_SCAN)) {
            String note = clip(record.getText(), reflectionConfig.getNoteChars());
            if (record.getKind() == ReflectionKind.INTERACTION && reflections.size() < perKind) {
                reflections.add("Reflection: " + note);
            } else if (record.getKind() == ReflectionKind.DISCOVERY_INSIGHT && insights.size() < perKind) {
                insights.add("Insight: " + note);
            }
        }
        List<String> notes = new ArrayList<>(reflections);
        notes.addAll(insights);
        return notes;
    }

    private static String clip(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }
}
