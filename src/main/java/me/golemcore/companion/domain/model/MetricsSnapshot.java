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
 * Development metrics sampled by one monitoring run, each in [0,1].
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSnapshot {

    public static final String RESPONSE_QUALITY = "response_quality";
    public static final String SAFETY_COMPLIANCE = "safety_compliance";
    public static final String ETHICAL_ALIGNMENT = "ethical_alignment";
    public static final String METAWARENESS_DEPTH = "metawareness_depth";

    private Instant timestamp;

    @Builder.Default
    private Map<String, Double> values = new LinkedHashMap<>();
}
