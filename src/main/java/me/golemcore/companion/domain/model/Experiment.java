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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A planned change of generation parameters, tested against the evaluation
 * prompts before it is applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Experiment {

    private String id;
    private String hypothesis;
    private String reflectionId;
    private double temperature;

    @Builder.Default
    private ExperimentStatus status = ExperimentStatus.PLANNED;

    @Builder.Default
    private Map<String, Double> results = new LinkedHashMap<>();

    private Double improvement;
    private Instant createdAt;
    private Instant completedAt;
}
