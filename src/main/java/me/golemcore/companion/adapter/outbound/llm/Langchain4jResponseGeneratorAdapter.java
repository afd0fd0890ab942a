package me.golemcore.companion.adapter.outbound.llm;

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

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.companion.domain.exception.FatalStartupException;
import me.golemcore.companion.domain.exception.GenerationException;
import me.golemcore.companion.domain.model.GenerationRequest;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import me.golemcore.companion.port.outbound.ResponseGeneratorPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Response generator backed by an OpenAI-compatible chat model through
 * langchain4j.
 *
 * <p>
 * The context becomes the system message and the query the user message.
 * Retries are disabled: every provider error, timeout or empty answer surfaces
 * as a {@link GenerationException} and the pipeline falls back.
 */
@Component
@Slf4j
public class Langchain4jResponseGeneratorAdapter implements ResponseGeneratorPort {

    private final CompanionProperties.LlmProperties config;
    private ChatModel chatModel;

    @Autowired
    public Langchain4jResponseGeneratorAdapter(CompanionProperties properties) {
        this.config = properties.getLlm();
    }

    Langchain4jResponseGeneratorAdapter(CompanionProperties properties, ChatModel chatModel) {
        this.config = properties.getLlm();
        this.chatModel = chatModel;
    }

    @PostConstruct
    public void init() {
        if (chatModel != null) {
            return;
        }
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new FatalStartupException(
                    "No API key for the response generator. Set companion.llm.api-key");
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0)
                .temperature(config.getTemperature())
                .timeout(config.getTimeout());
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        this.chatModel = builder.build();
        log.info("Response generator initialized with model: {}", config.getModel());
    }

    @Override
    public String generate(GenerationRequest request) throws GenerationException {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getContext() != null && !request.getContext().isBlank()) {
            messages.add(SystemMessage.from(request.getContext()));
        }
        messages.add(UserMessage.from(request.getQuery() == null ? "" : request.getQuery()));

        ChatRequest.Builder chatRequest = ChatRequest.builder().messages(messages);
        if (request.getTemperature() != null) {
            chatRequest.temperature(request.getTemperature());
        }

        ChatResponse response;
        try {
            response = chatModel.chat(chatRequest.build());
        } catch (RuntimeException e) {
            log.warn("[LLM] Generation failed: {}", e.getMessage());
            throw new GenerationException("Generation failed: " + e.getMessage(), e);
        }

        String text = response != null && response.aiMessage() != null ? response.aiMessage().text() : null;
        if (text == null || text.isBlank()) {
            throw new GenerationException("Model returned an empty response");
        }
        return text.trim();
    }
}
