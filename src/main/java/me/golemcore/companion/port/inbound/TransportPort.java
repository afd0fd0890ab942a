package me.golemcore.companion.port.inbound;

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

import me.golemcore.companion.domain.model.InboundMessage;

import java.util.List;

/**
 * Message transport the orchestrator polls and replies through. Only the
 * orchestrator talks to it.
 */
public interface TransportPort {

    String getTransportType();

    void start();

    void stop();

    boolean isRunning();

    /**
     * Drain up to {@code maxMessages} pending messages in arrival order.
     * Non-blocking.
     */
    List<InboundMessage> receiveNewMessages(int maxMessages);

    /**
     * Deliver text to a sender.
     *
     * @return true if the transport accepted the message
     */
    boolean send(String senderId, String text);

    /**
     * Whether the transport received an operator stop request.
     */
    default boolean isStopRequested() {
        return false;
    }
}
