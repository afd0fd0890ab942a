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

/**
 * Outcome of counting one request against a sender's sliding request window.
 *
 * @param allowed
 *            false when the window already held {@code limit} requests
 * @param requestsInWindow
 *            requests counted in the window, this one included
 * @param limit
 *            allowed requests per window
 * @param window
 *            window length
 * @param retryAt
 *            earliest instant a new request fits again; null when allowed
 */
record RequestWindowCheck(boolean allowed, int requestsInWindow, int limit, Duration window, Instant retryAt) {

    static RequestWindowCheck within(int requestsInWindow, int limit, Duration window) {
        return new RequestWindowCheck(true, requestsInWindow, limit, window, null);
    }

    static RequestWindowCheck exceeded(int requestsInWindow, int limit, Duration window, Instant retryAt) {
        return new RequestWindowCheck(false, requestsInWindow, limit, window, retryAt);
    }

    String describe() {
        if (allowed) {
            return requestsInWindow + "/" + limit + " requests in " + window;
        }
        return "More than " + limit + " requests in " + window + ", retry at " + retryAt;
    }
}
