package me.golemcore.companion;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Companion.
 *
 * <p>
 * A long-running conversational companion. Every inbound message goes through
 * a guarded pipeline:
 *
 * <pre>
 * SafetyGate → ContextAssembly → ResponseGeneration → PersonaTransform
 *            → EthicalFilter → Correction → Persistence
 * </pre>
 *
 * <p>
 * Between message batches a periodic scheduler runs background jobs
 * (exploration, conversation initiation, persona persistence, discovery
 * processing, external evaluation, self-improvement, monitoring, ethical
 * reflection and interaction reflection).
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code companion.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CompanionApplication {

    public static void main(String[] args) {
        SpringApplication.run(CompanionApplication.class, args);
    }

}
