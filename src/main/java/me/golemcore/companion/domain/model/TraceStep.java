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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Steps recorded in an interaction's pipeline trace. Serialized by label.
 */
public enum TraceStep {

    GATE_PASS("gate-pass"),
    GATE_REJECTED("gate-rejected"),
    CONTEXT_EMPTY("context-empty"),
    CONTEXT_ASSEMBLED("context-assembled"),
    GENERATED("generated"),
    GENERATION_FAILED("generation-failed"),
    PERSONA_APPLIED("persona-applied"),
    ETHICS_PASS("ethics-pass"),
    ETHICS_RETRY("ethics-retry"),
    ETHICS_FAILED("ethics-failed"),
    CORRECTION_PASS("correction-pass"),
    CORRECTION_APPLIED("correction-applied"),
    STAGE_FAILED("stage-failed"),
    CANCELLED("cancelled");

    private final String label;

    TraceStep(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static TraceStep fromLabel(String label) {
        for (TraceStep step : values()) {
            if (step.label.equals(label)) {
                return step;
            }
        }
        throw new IllegalArgumentException("Unknown trace step: " + label);
    }
}
