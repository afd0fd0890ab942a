package me.golemcore.companion.adapter.outbound.evaluation;

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
import me.golemcore.companion.port.outbound.EvaluatorPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Evaluator used when scoring is switched off: every response passes.
 */
@Component
@ConditionalOnProperty(name = "companion.evaluator.provider", havingValue = "pass-through")
public class PassThroughEvaluatorAdapter implements EvaluatorPort {

    @Override
    public EvaluationScore score(String response, String context) {
        return new EvaluationScore(1.0, "evaluation disabled");
    }
}
