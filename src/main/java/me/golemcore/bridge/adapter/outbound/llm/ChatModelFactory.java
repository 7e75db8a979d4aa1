package me.golemcore.bridge.adapter.outbound.llm;

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

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;

import java.time.Duration;
import java.util.Locale;

/**
 * Builds langchain4j chat models from {@code bridge.llm.*}.
 *
 * <p>
 * Anthropic gets its native client. Every other provider, Gemini included, is
 * reached through the OpenAI-compatible API; Gemini defaults to Google's
 * OpenAI-compatible endpoint when no base URL is configured.
 */
@Slf4j
public class ChatModelFactory {

    static final String PROVIDER_ANTHROPIC = "anthropic";
    static final String PROVIDER_GEMINI = "gemini";
    static final String GEMINI_OPENAI_BASE_URL = "https://generativelanguage.googleapis.com/v1beta/openai/";

    private final BridgeProperties.LlmProperties llm;

    public ChatModelFactory(BridgeProperties.LlmProperties llm) {
        this.llm = llm;
    }

    /**
     * Creates the configured chat model. Retries are disabled: a failed call is
     * reported once and never repeated.
     *
     * @throws IllegalStateException
     *             if the provider has no API key configured
     */
    public ChatModel create() {
        String provider = getProvider();
        BridgeProperties.ProviderProperties config = getProviderConfig(provider);

        log.info("[LLM] Creating {} model: {}", provider, llm.getModel());
        if (PROVIDER_ANTHROPIC.equals(provider)) {
            return createAnthropicModel(config);
        }
        return createOpenAiModel(provider, config);
    }

    /**
     * Checks whether the configured provider has an API key.
     */
    public boolean isConfigured() {
        BridgeProperties.ProviderProperties config = llm.getProviders().get(getProvider());
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    public String getModelName() {
        return llm.getModel();
    }

    private String getProvider() {
        return llm.getProvider() != null ? llm.getProvider().trim().toLowerCase(Locale.ROOT) : "";
    }

    private BridgeProperties.ProviderProperties getProviderConfig(String provider) {
        BridgeProperties.ProviderProperties config = llm.getProviders().get(provider);
        if (config == null || config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("Provider not configured: " + provider
                    + ". Add bridge.llm.providers." + provider + ".api-key");
        }
        return config;
    }

    private ChatModel createAnthropicModel(BridgeProperties.ProviderProperties config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(0)
                .maxTokens(llm.getMaxTokens() != null ? llm.getMaxTokens() : 4096)
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (llm.getTemperature() != null) {
            builder.temperature(llm.getTemperature());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(String provider, BridgeProperties.ProviderProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(0)
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));

        String baseUrl = config.getBaseUrl();
        if (baseUrl == null && PROVIDER_GEMINI.equals(provider)) {
            baseUrl = GEMINI_OPENAI_BASE_URL;
        }
        if (baseUrl != null) {
            builder.baseUrl(baseUrl);
        }
        if (llm.getTemperature() != null) {
            builder.temperature(llm.getTemperature());
        }
        if (llm.getMaxTokens() != null) {
            builder.maxTokens(llm.getMaxTokens());
        }
        return builder.build();
    }
}
