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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.exception.FatalStartupException;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Matches text against the configured blocked patterns
 * ({@code companion.security.blocked-patterns}). Used on inbound messages by
 * the safety gate and on outbound text by the correction mechanism.
 *
 * <p>
 * Patterns are compiled case-insensitively once at startup; an invalid
 * pattern aborts startup.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ThreatDetector {

    private final List<Pattern> blockedPatterns;

    public ThreatDetector(CompanionProperties properties) {
        List<Pattern> compiled = new ArrayList<>();
        for (String regex : properties.getSecurity().getBlockedPatterns()) {
            try {
                compiled.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                throw new FatalStartupException("Invalid blocked pattern: " + regex, e);
            }
        }
        this.blockedPatterns = List.copyOf(compiled);
        log.info("[Security] {} blocked patterns loaded", blockedPatterns.size());
    }

    /**
     * Returns the source of every blocked pattern found in the input.
     */
    public List<String> detectThreats(String input) {
        if (input == null || input.isBlank()) {
            return List.of();
        }
        List<String> threats = new ArrayList<>();
        for (Pattern pattern : blockedPatterns) {
            if (pattern.matcher(input).find()) {
                log.warn("[Security] Blocked pattern detected: pattern={}", pattern.pattern());
                threats.add(pattern.pattern());
            }
        }
        return threats;
    }

    public boolean containsThreat(String input) {
        return !detectThreats(input).isEmpty();
    }
}
