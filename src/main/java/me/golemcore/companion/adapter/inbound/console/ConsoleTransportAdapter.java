package me.golemcore.companion.adapter.inbound.console;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.model.InboundMessage;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.inbound.TransportPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Console transport: a daemon thread reads lines from stdin into a queue that
 * the orchestrator drains on each tick, replies go to stdout.
 *
 * <p>
 * A line equal to one of the shutdown keywords is not delivered as a message;
 * it asks the orchestrator to stop instead.
 */
@Component
@Slf4j
public class ConsoleTransportAdapter implements TransportPort {

    private final CompanionProperties.ConsoleProperties config;
    private final Clock clock;
    private final InputStream input;
    private final PrintStream output;
    private final BlockingQueue<InboundMessage> queue = new LinkedBlockingQueue<>();

    private volatile boolean running;
    private volatile boolean stopRequested;
    private Thread readerThread;

    @Autowired
    public ConsoleTransportAdapter(CompanionProperties properties, Clock clock) {
        this(properties, clock, System.in, System.out);
    }

    ConsoleTransportAdapter(CompanionProperties properties, Clock clock, InputStream input, PrintStream output) {
        this.config = properties.getTransport().getConsole();
        this.clock = clock;
        this.input = input;
        this.output = output;
    }

    @Override
    public String getTransportType() {
        return "console";
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!config.isEnabled()) {
            log.info("[Console] Console transport disabled");
            return;
        }
        running = true;
        readerThread = new Thread(this::readLoop, "console-reader");
        readerThread.setDaemon(true);
        readerThread.start();
        log.info("[Console] Listening on stdin as sender '{}'", config.getSenderId());
    }

    @Override
    public synchronized void stop() {
        running = false;
        if (readerThread != null) {
            readerThread.interrupt();
            readerThread = null;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public List<InboundMessage> receiveNewMessages(int maxMessages) {
        List<InboundMessage> batch = new ArrayList<>();
        queue.drainTo(batch, maxMessages);
        return batch;
    }

    @Override
    public boolean send(String senderId, String text) {
        output.println(text);
        output.flush();
        return !output.checkError();
    }

    @Override
    public boolean isStopRequested() {
        return stopRequested;
    }

    void readLoop() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                if (config.getShutdownKeywords().contains(trimmed.toLowerCase(Locale.ROOT))) {
                    log.info("[Console] Shutdown requested from console");
                    stopRequested = true;
                    break;
                }
                queue.add(new InboundMessage(config.getSenderId(), trimmed, clock.instant()));
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[Console] Reader thread error: {}", e.getMessage());
            }
        } finally {
            running = false;
        }
    }
}
