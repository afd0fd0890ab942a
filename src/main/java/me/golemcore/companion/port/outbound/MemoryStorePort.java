package me.golemcore.companion.port.outbound;

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

import me.golemcore.companion.domain.model.ContextItem;
import me.golemcore.companion.domain.model.Interaction;
import me.golemcore.companion.domain.model.ReflectionRecord;

import java.util.List;

/**
 * Durable memory of interactions and reflections with relevance and recency
 * queries. Records are append-only.
 */
public interface MemoryStorePort {

    /**
     * Persist a finalized interaction.
     *
     * @throws me.golemcore.companion.domain.exception.PersistenceException
     *             if the record could not be written
     */
    void storeInteraction(Interaction interaction);

    void storeReflection(ReflectionRecord reflection);

    /**
     * Most relevant past interactions and reflections for a query, best first.
     */
    List<ContextItem> retrieveRelevantContext(String query, int k);

    /**
     * Most recent interactions, newest first.
     */
    List<Interaction> retrieveLastInteractions(int n);

    /**
     * Most recent reflections, newest first.
     */
    List<ReflectionRecord> retrieveLastReflections(int n);

    long countReflections();

    void flush();
}
