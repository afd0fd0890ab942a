package me.golemcore.companion.domain.scheduler;

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

import java.util.Set;

/**
 * What a periodic job may do beyond its own collaborators. All effects on the
 * transport and on the schedule counters go through here.
 */
public interface JobContext {

    /**
     * Senders that had at least one message accepted.
     */
    Set<String> activeSenders();

    /**
     * Send a message initiated by the companion. The text passes the final
     * output gate first.
     *
     * @return true when the transport accepted the message
     */
    boolean sendMessage(String senderId, String text);

    void reportPersonaChanges(int changes);

    void reportDiscoveries(int discoveries);

    boolean isCancelled();
}
