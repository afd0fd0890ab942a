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
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Cleans inbound chat text before the threat scan.
 *
 * <p>
 * Text is folded to NFKC so that full-width and other compatibility forms of
 * a blocked command match the plain patterns. Invisible formatting characters
 * (zero-width, soft hyphen, BiDi controls) and control characters other than
 * newline and tab are dropped, runs of blank lines shrink to one, and the
 * result is stripped.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class InputSanitizer {

    private static final Pattern INVISIBLE = Pattern.compile(
            "[\\u200B-\\u200F\\uFEFF\\u2060\\u00AD\\u061C\\u180E\\u202A-\\u202E\\u2066-\\u2069]");
    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n[ \\t]*(?:\\n[ \\t]*)+\\n");

    public String sanitize(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        String folded = Normalizer.normalize(input.replace("\r\n", "\n"), Normalizer.Form.NFKC);
        String visible = CONTROL.matcher(INVISIBLE.matcher(folded).replaceAll("")).replaceAll("");
        String sanitized = BLANK_LINES.matcher(visible).replaceAll("\n\n").strip();
        if (sanitized.length() != input.length()) {
            log.debug("[Security] Sanitized inbound text: {} -> {} chars", input.length(), sanitized.length());
        }
        return sanitized;
    }
}
