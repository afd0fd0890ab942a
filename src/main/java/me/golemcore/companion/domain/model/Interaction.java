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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * One processed message: the inbound text, the final response and the
 * pipeline trace. Written once to the memory store and never changed after.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Interaction {

    private String id;
    private InboundMessage message;
    private OutboundResponse response;

    @Builder.Default
    private List<TraceStep> trace = new ArrayList<>();

    @Builder.Default
    private Set<FailureKind> failures = EnumSet.noneOf(FailureKind.class);

    private Double ethicalScore;
    private Instant startedAt;
    private Instant completedAt;
}
