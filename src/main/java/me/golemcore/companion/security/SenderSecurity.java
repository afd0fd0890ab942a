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


import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-sender counters: request timestamps in the rolling rate window, alert
 * timestamps in the alert window, and the lockout deadline (null when not
 * locked).
 */
public class SenderSecurity {

    private final Deque<Instant> requestTimes = new ArrayDeque<>();
    private final Deque<Instant> alertTimes = new ArrayDeque<>();
    private Instant lockedUntil;

    SenderStatus status(Instant now) {
        if (isLockedOut(now)) {
            return SenderStatus.LOCKED_OUT;
        }
        return alertTimes.isEmpty() ? SenderStatus.NORMAL : SenderStatus.WARNED;
    }

    boolean isLockedOut(Instant now) {
        return lockedUntil != null && now.isBefore(lockedUntil);
    }

    boolean isLockoutExpired(Instant now) {
        return lockedUntil != null && !now.isBefore(lockedUntil);
    }

    void lockUntil(Instant until) {
        this.lockedUntil = until;
    }

    void reset() {
        requestTimes.clear();
        alertTimes.clear();
        lockedUntil = null;
    }

    RequestWindowCheck recordRequest(Instant now, int maxRequests, Duration window) {
        prune(requestTimes, now.minus(window));
        requestTimes.addLast(now);
        if (requestTimes.size() > maxRequests) {
            return RequestWindowCheck.exceeded(requestTimes.size(), maxRequests, window,
                    requestTimes.peekFirst().plus(window));
        }
        return RequestWindowCheck.within(requestTimes.size(), maxRequests, window);
    }

    int recordAlert(Instant now, Duration window) {
        pruneAlerts(now, window);
        alertTimes.addLast(now);
        return alertTimes.size();
    }

    void pruneAlerts(Instant now, Duration window) {
        prune(alertTimes, now.minus(window));
    }

    public int getAlertCount() {
        return alertTimes.size();
    }

    public int getRequestCount() {
        return requestTimes.size();
    }

    public Instant getLockedUntil() {
        return lockedUntil;
    }

    private static void prune(Deque<Instant> times, Instant cutoff) {
        while (!times.isEmpty() && !times.peekFirst().isAfter(cutoff)) {
            times.removeFirst();
        }
    }
}
