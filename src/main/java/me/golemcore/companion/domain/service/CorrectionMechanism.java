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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.model.CorrectionResult;
import me.golemcore.companion.domain.model.EvaluationScore;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.infrastructure.i18n.MessageService;
import me.golemcore.companion.port.outbound.EvaluatorPort;
import me.golemcore.companion.port.outbound.StoragePort;
import me.golemcore.companion.security.SafetyGate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;

/**
 * Final output gate. Re-checks every outbound response independently of the
 * upstream stages and replaces unsafe text with a fixed reply that carries no
 * content of its own.
 *
 * <p>
 * A response is unsafe when the ethical filter flagged it, when it matches a
 * blocked pattern, or when its keyword score falls below the correction
 * threshold. Keyword matches in high-severity categories cost 0.3, other
 * categories 0.1. A response that survives those checks is scored by the
 * evaluator against the correction guidelines, and a guideline score below
 * the same threshold makes it unsafe as well.
 *
 * <p>
 * Also keeps the quarantine log for changes rejected by external validation.
 */
@Service
@Slf4j
public class CorrectionMechanism {

    static final double HIGH_SEVERITY_PENALTY = 0.3;
    static final double MEDIUM_SEVERITY_PENALTY = 0.1;

    private static final String SECURITY_DIR = "security";
    private static final String CORRECTIONS_FILE = "corrections.jsonl";
    private static final String QUARANTINE_FILE = "quarantine.jsonl";
    private static final String GUIDELINE_ISSUE = "guideline-evaluation";

    private final SafetyGate safetyGate;
    private final EvaluatorPort evaluator;
    private final MessageService messageService;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final CompanionProperties.CorrectionProperties config;
    private final Clock clock;
    private final Map<String, List<Pattern>> keywordPatterns = new LinkedHashMap<>();
    private final Deque<Map<String, Object>> history = new ArrayDeque<>();
    private int seriousViolations;

    public CorrectionMechanism(SafetyGate safetyGate, EvaluatorPort evaluator, MessageService messageService,
            StoragePort storagePort, ObjectMapper objectMapper, CompanionProperties properties, Clock clock) {
        this.safetyGate = safetyGate;
        this.evaluator = evaluator;
        this.messageService = messageService;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.config = properties.getCorrection();
        this.clock = clock;
        config.getKeywords().forEach((category, words) -> {
            List<Pattern> patterns = new ArrayList<>();
            for (String word : words) {
                patterns.add(Pattern.compile("\\b" + Pattern.quote(word) + "\\b", Pattern.CASE_INSENSITIVE));
            }
            keywordPatterns.put(category, patterns);
        });
    }

    /**
     * Review an outbound response.
     *
     * @param response
     *            candidate text
     * @param ethicallyFlagged
     *            true when the ethical filter still failed after its retry
     */
    public CorrectionResult review(String response, boolean ethicallyFlagged) {
        String text = response == null ? "" : response;
        List<String> issues = new ArrayList<>();
        double score = 1.0;
        boolean serious = false;

        for (Map.Entry<String, List<Pattern>> category : keywordPatterns.entrySet()) {
            boolean high = config.getHighSeverityCategories().contains(category.getKey());
            for (Pattern pattern : category.getValue()) {
                if (pattern.matcher(text).find()) {
                    issues.add(category.getKey() + ":" + unquote(pattern));
                    score -= high ? HIGH_SEVERITY_PENALTY : MEDIUM_SEVERITY_PENALTY;
                    serious |= high;
                }
            }
        }
        score = Math.max(0.0, score);

        if (!safetyGate.isResponseSafe(text)) {
            issues.add("blocked-pattern");
            serious = true;
        }
        if (ethicallyFlagged) {
            issues.add("ethical-filter");
        }

        boolean unsafe = ethicallyFlagged || issues.contains("blocked-pattern") || score < config.getThreshold();
        if (!unsafe) {
            EvaluationScore guidelineScore = evaluator.score(text, guidelineContext());
            if (guidelineScore.score() >= config.getThreshold()) {
                return CorrectionResult.builder().safe(true).text(text).score(score).issues(issues).build();
            }
            issues.add(GUIDELINE_ISSUE);
            score = Math.min(score, guidelineScore.score());
            log.debug("[Correction] Guideline score {} below threshold: {}", guidelineScore.score(),
                    guidelineScore.rationale());
        }

        log.warn("[Correction] Response replaced: score={}, issues={}", score, issues);
        recordCorrection(score, issues, serious);
        return CorrectionResult.builder()
                .safe(false)
                .text(messageService.getMessage("correction.replacement"))
                .score(score)
                .issues(issues)
                .serious(serious)
                .build();
    }

    /**
     * Record a change that external validation rejected.
     */
    public void quarantine(String changeId, String description, String reason) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("changeId", changeId);
        entry.put("description", description);
        entry.put("reason", reason);
        entry.put("quarantinedAt", clock.instant().toString());
        log.warn("[Correction] Quarantined change {}: {}", changeId, reason);
        append(QUARANTINE_FILE, entry);
    }

    public synchronized int getSeriousViolations() {
        return seriousViolations;
    }

    public synchronized List<Map<String, Object>> getHistory() {
        return new ArrayList<>(history);
    }

    private String guidelineContext() {
        StringBuilder sb = new StringBuilder("Judge whether the response follows these guidelines:");
        for (String guideline : config.getGuidelines()) {
            sb.append("\n- ").append(guideline);
        }
        return sb.toString();
    }

    private synchronized void recordCorrection(double score, List<String> issues, boolean serious) {
        Instant now = clock.instant();
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", now.toString());
        entry.put("score", score);
        entry.put("issues", issues);
        entry.put("serious", serious);
        history.addLast(entry);
        while (history.size() > config.getHistoryLimit()) {
            history.removeFirst();
        }
        if (serious) {
            seriousViolations++;
            if (seriousViolations == config.getSeriousViolationThreshold()) {
                log.error("[Correction] {} serious violations recorded, operator attention required",
                        seriousViolations);
            }
        }
        append(CORRECTIONS_FILE, entry);
    }

    private void append(String file, Map<String, Object> entry) {
        try {
            storagePort.appendText(SECURITY_DIR, file, objectMapper.writeValueAsString(entry) + "\n").join();
        } catch (JsonProcessingException | CompletionException e) {
            log.warn("[Correction] Failed to write {}: {}", file, e.getMessage());
        }
    }

    private static String unquote(Pattern pattern) {
        return pattern.pattern().replace("\\b", "").replace("\\Q", "").replace("\\E", "");
    }
}
