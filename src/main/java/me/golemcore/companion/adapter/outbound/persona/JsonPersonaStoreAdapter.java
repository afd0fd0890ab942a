package me.golemcore.companion.adapter.outbound.persona;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.exception.PersistenceException;
import me.golemcore.companion.domain.model.PersonaState;
import me.golemcore.companion.port.outbound.PersonaStorePort;
import me.golemcore.companion.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Persona snapshot stored as {@code persona/persona.json}, written atomically
 * with a {@code .bak} of the previous version.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonPersonaStoreAdapter implements PersonaStorePort {

    private static final String PERSONA_DIR = "persona";
    private static final String PERSONA_FILE = "persona.json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<PersonaState> load() {
        try {
            String json = storagePort.getText(PERSONA_DIR, PERSONA_FILE).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, PersonaState.class));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt persona snapshot", e);
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to read persona snapshot", e.getCause());
        }
    }

    @Override
    public void save(PersonaState persona) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(persona);
            storagePort.putTextAtomic(PERSONA_DIR, PERSONA_FILE, json, true).join();
            log.debug("[Persona] Snapshot written ({} chars)", json.length());
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize persona", e);
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to write persona snapshot", e.getCause());
        }
    }
}
