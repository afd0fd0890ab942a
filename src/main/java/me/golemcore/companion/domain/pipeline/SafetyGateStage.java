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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.model.FailureKind;
import me.golemcore.companion.domain.model.InteractionContext;
import me.golemcore.companion.domain.model.OutboundResponse;
import me.golemcore.companion.domain.model.TraceStep;
import me.golemcore.companion.infrastructure.i18n.MessageService;
import me.golemcore.companion.security.GateDecision;
import me.golemcore.companion.security.SafetyGate;
import org.springframework.stereotype.Component;

/**
 * Input gate (order=10). A rejection is terminal: the fixed reply for the
 * rejection reason becomes the response and no other stage runs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SafetyGateStage implements PipelineStage {

    private final SafetyGate safetyGate;
    private final MessageService messageService;

    @Override
    public String getName() {
        return "SafetyGate";
    }

    @Override
    public int getOrder() {
        return 10;
    }

    @Override
    public InteractionContext process(InteractionContext context) {
        GateDecision decision = safetyGate.checkInput(context.getMessage().senderId(),
                context.getMessage().text());
        if (decision.isAllowed()) {
            context.setSanitizedText(decision.getSanitizedText());
            context.addTrace(TraceStep.GATE_PASS);
            return context;
        }

        context.setRejected(true);
        context.addTrace(TraceStep.GATE_REJECTED);
        context.addFailure(FailureKind.INPUT_REJECTED);
        context.shortCircuit(OutboundResponse.safetyReply(
                messageService.getMessage(decision.getReason().getMessageKey())));
        return context;
    }
}
