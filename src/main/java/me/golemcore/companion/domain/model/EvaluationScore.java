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

/**
 * Score returned by an evaluator collaborator.
 *
 * @param score
 *            value in [0, 1]
 * @param rationale
 *            optional free-text explanation, may be null
 */
public record EvaluationScore(double score, String rationale) {

    public EvaluationScore {
        score = Double.isNaN(score) ? 0.0 : Math.max(0.0, Math.min(1.0, score));
    }

    public static EvaluationScore of(double score) {
        return new EvaluationScore(score, null);
    }
}
