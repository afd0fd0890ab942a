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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Working state of one message while it moves through the pipeline. Lives only
 * for a single pipeline run; {@link #toInteraction(Instant)} produces the
 * record that is persisted.
 */
@Data
@Builder
public class InteractionContext {

    private String interactionId;
    private InboundMessage message;
    private Instant startedAt;

    /** Input text after sanitisation; null until the gate passed. */
    private String sanitizedText;

    private AssembledContext assembledContext;

    /** Persona snapshot taken by the persona stage, read by the ethical filter. */
    private PersonaState persona;

    /** Response text as produced by the generator before the persona voice. */
    private String rawResponse;

    /** Current response; replaced or rewritten by later stages. */
    private OutboundResponse response;

    private Double ethicalScore;
    private boolean ethicallyFlagged;
    private int ethicalRetries;

    /** Persona adjustments made while processing this message. */
    private int personaChanges;

    /** Set by the safety gate; nothing else runs. */
    private boolean rejected;

    /** Terminal response chosen early; only mandatory stages still run. */
    private boolean shortCircuited;

    private boolean persisted;

    @Builder.Default
    private List<TraceStep> trace = new ArrayList<>();

    @Builder.Default
    private Set<FailureKind> failures = EnumSet.noneOf(FailureKind.class);

    public void addTrace(TraceStep step) {
        trace.add(step);
    }

    public void addFailure(FailureKind kind) {
        failures.add(kind);
    }

    /**
     * Replace the response with a terminal one and skip the remaining content
     * stages.
     */
    public void shortCircuit(OutboundResponse terminal) {
        this.response = terminal;
        this.shortCircuited = true;
    }

    public String getResponseText() {
        return response != null ? response.getText() : null;
    }

    public Interaction toInteraction(Instant completedAt) {
        return Interaction.builder()
                .id(interactionId)
                .message(message)
                .response(response)
                .trace(new ArrayList<>(trace))
                .failures(failures.isEmpty() ? EnumSet.noneOf(FailureKind.class) : EnumSet.copyOf(failures))
                .ethicalScore(ethicalScore)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .build();
    }
}
