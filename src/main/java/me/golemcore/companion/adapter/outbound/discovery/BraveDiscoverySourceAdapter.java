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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.exception.FatalStartupException;
import me.golemcore.companion.domain.model.Discovery;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.infrastructure.http.FeignClientFactory;
import me.golemcore.companion.port.outbound.DiscoverySourcePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Explores topics through the Brave web search API. Each web result becomes
 * one discovery whose importance decays with its rank. A failed search yields
 * no discoveries; a 429 is retried with exponential backoff first.
 */
@Component
@ConditionalOnProperty(name = "companion.discovery.provider", havingValue = "brave")
@Slf4j
public class BraveDiscoverySourceAdapter implements DiscoverySourcePort {

    private static final int MAX_COUNT = 20;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final double TOP_IMPORTANCE = 1.0;
    private static final double MIN_IMPORTANCE = 0.5;
    private static final double RANK_DECAY = 0.1;

    private final FeignClientFactory feignClientFactory;
    private final CompanionProperties.BraveProperties config;
    private final Clock clock;

    private BraveSearchApi searchApi;

    public BraveDiscoverySourceAdapter(FeignClientFactory feignClientFactory, CompanionProperties properties,
            Clock clock) {
        this.feignClientFactory = feignClientFactory;
        this.config = properties.getDiscovery().getBrave();
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new FatalStartupException(
                    "Brave discovery selected without an API key. Set companion.discovery.brave.api-key");
        }
        this.searchApi = feignClientFactory.create(BraveSearchApi.class, config.getBaseUrl());
        log.info("[Discovery] Brave search source initialized ({})", config.getBaseUrl());
    }

    @Override
    public List<Discovery> explore(String topic, int maxResults) {
        if (topic == null || topic.isBlank() || maxResults <= 0) {
            return List.of();
        }
        int count = Math.min(MAX_COUNT, maxResults);
        BraveSearchResponse response = searchWithRetry(topic, count);
        if (response == null || response.getWeb() == null || response.getWeb().getResults() == null) {
            return List.of();
        }
        return toDiscoveries(topic, response.getWeb().getResults(), count);
    }

    private BraveSearchResponse searchWithRetry(String topic, int count) {
        int maxRetries = Math.max(0, config.getMaxRetries());
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                log.debug("[Discovery] Brave search: topic='{}', count={}, attempt={}", topic, count, attempt);
                return searchApi.search(config.getApiKey(), topic, count);
            } catch (FeignException e) {
                if (e.status() == HTTP_TOO_MANY_REQUESTS && attempt < maxRetries) {
                    long backoffMs = (long) (config.getInitialBackoffMs() * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[Discovery] Brave rate limit hit (attempt {}/{}), retrying in {}ms",
                            attempt + 1, maxRetries, backoffMs);
                    sleep(backoffMs);
                } else {
                    log.warn("[Discovery] Brave search failed (status {}) for '{}': {}",
                            e.status(), topic, e.getMessage());
                    return null;
                }
            }
        }
        return null;
    }

    private List<Discovery> toDiscoveries(String topic, List<WebResult> results, int count) {
        Instant now = clock.instant();
        List<Discovery> discoveries = new ArrayList<>();
        for (WebResult result : results) {
            if (discoveries.size() >= count) {
                break;
            }
            String content = describe(result);
            if (content.isEmpty()) {
                continue;
            }
            double importance = Math.max(MIN_IMPORTANCE, TOP_IMPORTANCE - discoveries.size() * RANK_DECAY);
            discoveries.add(Discovery.builder()
                    .topic(topic)
                    .content(content)
                    .source(result.getUrl())
                    .importance(importance)
                    .discoveredAt(now)
                    .build());
        }
        return discoveries;
    }

    private static String describe(WebResult result) {
        String title = result.getTitle() != null ? result.getTitle().strip() : "";
        String description = result.getDescription() != null ? result.getDescription().strip() : "";
        if (title.isEmpty()) {
            return description;
        }
        return description.isEmpty() ? title : title + ": " + description;
    }

    private void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Brave retry sleep interrupted", e);
        }
    }

    interface BraveSearchApi {
        @RequestLine("GET /res/v1/web/search?q={query}&count={count}")
        @Headers({
                "Accept: application/json",
                "X-Subscription-Token: {apiKey}"
        })
        BraveSearchResponse search(
                @Param("apiKey") String apiKey,
                @Param("query") String query,
                @Param("count") int count);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class BraveSearchResponse {
        private WebResults web;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResults {
        private List<WebResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResult {
        private String title;
        private String url;
        private String description;
    }
}
