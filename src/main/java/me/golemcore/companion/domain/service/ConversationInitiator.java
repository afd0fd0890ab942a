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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.exception.GenerationException;
import me.golemcore.companion.domain.model.Discovery;
import me.golemcore.companion.domain.model.GenerationRequest;
import me.golemcore.companion.domain.model.PersonaState;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.ResponseGeneratorPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Decides whether the companion starts a conversation on its own and writes
 * the opening message.
 *
 * <p>
 * An initiation needs the probability gate to pass, the minimum spacing since
 * the previous initiation to have elapsed and the daily cap not to be reached.
 * The topic is the best scoring recent discovery, falling back to a persona
 * interest.
 */
@Service
@Slf4j
public class ConversationInitiator {

    static final double RELEVANCE_WEIGHT = 0.3;
    static final double FRESHNESS_WEIGHT = 0.2;
    static final double IMPORTANCE_WEIGHT = 0.2;
    static final double NOVELTY_WEIGHT = 0.3;

    private final DiscoveryBuffer discoveryBuffer;
    private final PersonaService personaService;
    private final ResponseGeneratorPort generator;
    private final CompanionProperties.InitiationProperties config;
    private final int discoveryWindow;
    private final Clock clock;
    private final Random random;

    private final Deque<String> recentTopics = new ArrayDeque<>();
    private Instant lastInitiation;
    private LocalDate dailyDate;
    private int dailyCount;

    public ConversationInitiator(DiscoveryBuffer discoveryBuffer, PersonaService personaService,
            ResponseGeneratorPort generator, CompanionProperties properties, Clock clock, Random random) {
        this.discoveryBuffer = discoveryBuffer;
        this.personaService = personaService;
        this.generator = generator;
        this.config = properties.getInitiation();
        this.discoveryWindow = properties.getExploration().getMaxRecentDiscoveries();
        this.clock = clock;
        this.random = random;
    }

    /**
     * @return the opening message, or empty when no conversation should be
     *         started now
     */
    public synchronized Optional<String> maybeInitiate() throws GenerationException {
        Instant now = clock.instant();
        if (lastInitiation != null && now.isBefore(lastInitiation.plus(config.getMinTimeBetween()))) {
            return Optional.empty();
        }
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        if (!today.equals(dailyDate)) {
            dailyDate = today;
            dailyCount = 0;
        }
        if (dailyCount >= config.getMaxDaily()) {
            log.debug("[Initiation] Daily limit of {} reached", config.getMaxDaily());
            return Optional.empty();
        }
        if (random.nextDouble() >= config.getProbability()) {
            return Optional.empty();
        }

        PersonaState persona = personaService.snapshot();
        Optional<String> topic = chooseTopic(persona, now);
        if (topic.isEmpty()) {
            return Optional.empty();
        }

        String message = generator.generate(GenerationRequest.of(personaService.buildPersonaContext(),
                "Start a short, friendly conversation with the user about: " + topic.get()
                        + ". Ask one open question."));

        lastInitiation = now;
        dailyCount++;
        recentTopics.addLast(topic.get());
        while (recentTopics.size() > config.getTopicHistory()) {
            recentTopics.removeFirst();
        }
        log.info("[Initiation] Starting a conversation about '{}' ({} today)", topic.get(), dailyCount);
        return Optional.of(message);
    }

    Optional<String> chooseTopic(PersonaState persona, Instant now) {
        Discovery best = null;
        double bestScore = -1;
        for (Discovery discovery : discoveryBuffer.recent(discoveryWindow)) {
            double score = score(discovery, persona, now);
            if (score > bestScore) {
                best = discovery;
                bestScore = score;
            }
        }
        if (best != null && isNovel(best.getTopic())) {
            return Optional.of(best.getTopic());
        }
        for (String interest : persona.getInterests()) {
            if (isNovel(interest)) {
                return Optional.of(interest);
            }
        }
        return Optional.empty();
    }

    double score(Discovery discovery, PersonaState persona, Instant now) {
        String text = (discovery.getTopic() + " " + discovery.getContent()).toLowerCase(Locale.ROOT);
        double relevance = 0.0;
        for (String interest : persona.getInterests()) {
            if (text.contains(interest.toLowerCase(Locale.ROOT))) {
                relevance = 1.0;
                break;
            }
        }

        double freshness = 0.0;
        if (discovery.getDiscoveredAt() != null) {
            Duration age = Duration.between(discovery.getDiscoveredAt(), now);
            freshness = Math.max(0.0,
                    1.0 - (double) age.toSeconds() / Math.max(1, config.getFreshnessHorizon().toSeconds()));
        }

        double novelty = isNovel(discovery.getTopic()) ? 1.0 : 0.0;
        return RELEVANCE_WEIGHT * relevance
                + FRESHNESS_WEIGHT * Math.min(1.0, freshness)
                + IMPORTANCE_WEIGHT * discovery.getImportance()
                + NOVELTY_WEIGHT * novelty;
    }

    private boolean isNovel(String topic) {
        for (String recent : recentTopics) {
            if (jaccard(topic, recent) > config.getNoveltySimilarity()) {
                return false;
            }
        }
        return true;
    }

    static double jaccard(String a, String b) {
        Set<String> left = words(a);
        Set<String> right = words(b);
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> words(String text) {
        Set<String> words = new HashSet<>();
        if (text == null) {
            return words;
        }
        for (String word : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    synchronized List<String> getRecentTopics() {
        return List.copyOf(recentTopics);
    }
}
