package me.golemcore.companion.adapter.outbound.discovery;

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
import me.golemcore.companion.domain.model.Discovery;
import me.golemcore.companion.port.outbound.DiscoverySourcePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Discovery source used while no external search is selected. Exploration
 * then finds nothing and initiation falls back to persona interests.
 */
@Component
@ConditionalOnProperty(name = "companion.discovery.provider", havingValue = "none", matchIfMissing = true)
@Slf4j
public class NoOpDiscoverySourceAdapter implements DiscoverySourcePort {

    @Override
    public List<Discovery> explore(String topic, int maxResults) {
        log.trace("[Discovery] No discovery source configured, skipping '{}'", topic);
        return List.of();
    }
}
