package me.golemcore.companion.domain.service;

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

import me.golemcore.companion.domain.model.Discovery;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded buffer of recent discoveries, oldest evicted first. Discoveries not
 * yet applied to the persona are tracked separately.
 */
@Component
public class DiscoveryBuffer {

    private final Deque<Discovery> discoveries = new ArrayDeque<>();
    private final Deque<Discovery> unprocessed = new ArrayDeque<>();
    private final int capacity;

    public DiscoveryBuffer(CompanionProperties properties) {
        this.capacity = Math.max(1, properties.getExploration().getMaxRecentDiscoveries());
    }

    public synchronized void addAll(List<Discovery> items) {
        for (Discovery item : items) {
            discoveries.addLast(item);
            unprocessed.addLast(item);
            while (discoveries.size() > capacity) {
                discoveries.removeFirst();
            }
            while (unprocessed.size() > capacity) {
                unprocessed.removeFirst();
            }
        }
    }

    /**
     * @return up to {@code n} most recent discoveries, oldest first
     */
    public synchronized List<Discovery> recent(int n) {
        List<Discovery> all = new ArrayList<>(discoveries);
        return new ArrayList<>(all.subList(Math.max(0, all.size() - n), all.size()));
    }

    /**
     * Hand out the discoveries added since the previous call, oldest first.
     */
    public synchronized List<Discovery> takeUnprocessed() {
        List<Discovery> taken = new ArrayList<>(unprocessed);
        unprocessed.clear();
        return taken;
    }

    public synchronized int size() {
        return discoveries.size();
    }
}
