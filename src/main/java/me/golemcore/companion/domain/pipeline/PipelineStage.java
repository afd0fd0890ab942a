package me.golemcore.companion.domain.pipeline;

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

import me.golemcore.companion.domain.model.InteractionContext;

/**
 * One step of the interaction pipeline. Stages run in ascending
 * {@link #getOrder()} and each receives the context accumulated by the stages
 * before it.
 */
public interface PipelineStage {

    String getName();

    /**
     * Processing order (lower = earlier).
     */
    int getOrder();

    InteractionContext process(InteractionContext context);

    /**
     * Content stages are skipped once the context has short-circuited to a
     * terminal response.
     */
    default boolean shouldProcess(InteractionContext context) {
        return !context.isShortCircuited();
    }

    /**
     * Mandatory stages run on every message that passed the safety gate, even
     * after a short-circuit or a cancellation.
     */
    default boolean isMandatory() {
        return false;
    }
}
