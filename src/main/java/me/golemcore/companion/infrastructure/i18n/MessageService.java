package me.golemcore.companion.infrastructure.i18n;

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
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Localized fixed replies of the companion (safety replies, fallbacks, the
 * correction replacement text).
 *
 * <p>
 * Bundles are loaded from {@code messages_<lang>.properties}. Unsupported
 * languages fall back to English; a missing key returns the key itself.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MessageService {

    public static final String LANG_EN = "en";
    public static final String LANG_RU = "ru";
    public static final String DEFAULT_LANG = LANG_EN;

    private static final Set<String> SUPPORTED_LANGUAGES = Set.of(LANG_EN, LANG_RU);

    private final Map<String, ResourceBundle> bundles = new ConcurrentHashMap<>();
    private final String language;

    public MessageService(CompanionProperties properties) {
        for (String lang : SUPPORTED_LANGUAGES) {
            loadBundle(lang);
        }
        String configured = properties.getLanguage();
        if (configured != null && SUPPORTED_LANGUAGES.contains(configured)) {
            this.language = configured;
        } else {
            log.warn("Unsupported language: {}, using default", configured);
            this.language = DEFAULT_LANG;
        }
    }

    private void loadBundle(String lang) {
        try {
            ResourceBundle bundle = ResourceBundle.getBundle("messages", Locale.forLanguageTag(lang));
            bundles.put(lang, bundle);
            log.debug("Loaded message bundle for language: {}", lang);
        } catch (MissingResourceException e) {
            log.warn("Failed to load message bundle for language: {}", lang);
        }
    }

    public String getMessage(String key, Object... args) {
        ResourceBundle bundle = bundles.getOrDefault(language, bundles.get(DEFAULT_LANG));
        if (bundle == null) {
            return key;
        }
        try {
            String message = bundle.getString(key);
            if (args != null && args.length > 0) {
                return MessageFormat.format(message, args);
            }
            return message;
        } catch (MissingResourceException e) {
            log.warn("Missing message key: {} for language: {}", key, language);
            return key;
        }
    }

    public String getLanguage() {
        return language;
    }
}
