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

/**
 * A memory entry returned by a relevance query, ordered by score.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextItem {

    private String sourceId;
    private Kind kind;
    private String text;
    private double score;
    private Instant timestamp;

    public enum Kind {
        INTERACTION, REFLECTION
    }
}
