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

import lombok.RequiredArgsConstructor;
import me.golemcore.companion.domain.model.CorrectionResult;
import me.golemcore.companion.domain.model.FailureKind;
import me.golemcore.companion.domain.model.InteractionContext;
import me.golemcore.companion.domain.model.OutboundResponse;
import me.golemcore.companion.domain.model.TraceStep;
import me.golemcore.companion.domain.service.CorrectionMechanism;
import org.springframework.stereotype.Component;

/**
 * Final output gate (order=60). Runs on every message that passed the safety
 * gate, whatever the upstream stages decided.
 */
@Component
@RequiredArgsConstructor
public class CorrectionStage implements PipelineStage {

    private static final String ETHICAL_ISSUE = "ethical-filter";

    private final CorrectionMechanism correctionMechanism;

    @Override
    public String getName() {
        return "Correction";
    }

    @Override
    public int getOrder() {
        return 60;
    }

    @Override
    public boolean shouldProcess(InteractionContext context) {
        return !context.isRejected();
    }

    @Override
    public boolean isMandatory() {
        return true;
    }

    @Override
    public InteractionContext process(InteractionContext context) {
        CorrectionResult result = correctionMechanism.review(context.getResponseText(),
                context.isEthicallyFlagged());
        if (result.isSafe()) {
            context.addTrace(TraceStep.CORRECTION_PASS);
            return context;
        }

        context.setResponse(OutboundResponse.corrected(result.getText()));
        context.addTrace(TraceStep.CORRECTION_APPLIED);
        if (result.getIssues().stream().anyMatch(issue -> !ETHICAL_ISSUE.equals(issue))) {
            context.addFailure(FailureKind.SAFETY_VIOLATION);
        }
        return context;
    }
}
