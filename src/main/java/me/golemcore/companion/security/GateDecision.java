package me.golemcore.companion.security;

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
import lombok.Value;

import java.util.List;

/**
 * Outcome of the input safety check for one message.
 */
@Value
@Builder
public class GateDecision {

    boolean allowed;
    RejectReason reason;
    String sanitizedText;
    List<String> threats;
    SenderStatus status;

    public static GateDecision allow(String sanitizedText, SenderStatus status) {
        return GateDecision.builder()
                .allowed(true)
                .sanitizedText(sanitizedText)
                .threats(List.of())
                .status(status)
                .build();
    }

    public static GateDecision reject(RejectReason reason, List<String> threats, SenderStatus status) {
        return GateDecision.builder()
                .allowed(false)
                .reason(reason)
                .threats(threats)
                .status(status)
                .build();
    }
}
