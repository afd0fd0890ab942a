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

import me.golemcore.companion.domain.model.EvaluationScore;

/**
 * Independent scorer used by the ethical filter, external evaluation and
 * external validation. The context describes what the response is judged
 * against.
 */
public interface EvaluatorPort {

    /**
     * Score a response in [0, 1]. Implementations do not throw; a scorer that
     * cannot judge returns a low score with a rationale.
     */
    EvaluationScore score(String response, String context);
}
