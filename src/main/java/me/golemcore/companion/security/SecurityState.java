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

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Security state of all senders plus the bounded incident history. Mutated
 * only through {@link SafetyGate}.
 */
public class SecurityState {

    private final Map<String, SenderSecurity> senders = new ConcurrentHashMap<>();
    private final Deque<SecurityIncident> incidents = new ArrayDeque<>();
    private final int incidentLimit;
    private long totalIncidents;

    public SecurityState(int incidentLimit) {
        this.incidentLimit = incidentLimit;
    }

    SenderSecurity sender(String senderId) {
        return senders.computeIfAbsent(senderId, id -> new SenderSecurity());
    }

    SenderSecurity peek(String senderId) {
        return senders.get(senderId);
    }

    void recordIncident(SecurityIncident incident) {
        incidents.addLast(incident);
        totalIncidents++;
        while (incidents.size() > incidentLimit) {
            incidents.removeFirst();
        }
    }

    List<SecurityIncident> incidents() {
        return new ArrayList<>(incidents);
    }

    long totalIncidents() {
        return totalIncidents;
    }

    int activeLockouts(Instant now) {
        return (int) senders.values().stream().filter(s -> s.isLockedOut(now)).count();
    }
}
