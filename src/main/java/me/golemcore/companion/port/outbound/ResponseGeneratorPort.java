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

import me.golemcore.companion.domain.exception.GenerationException;
import me.golemcore.companion.domain.model.GenerationRequest;

/**
 * Port to the language model that turns context and a query into text.
 */
public interface ResponseGeneratorPort {

    /**
     * Generate a candidate response.
     *
     * @throws GenerationException
     *             on timeout, provider error or resource exhaustion
     */
    String generate(GenerationRequest request) throws GenerationException;
}
