package org.example.diary.config;

import org.example.diary.service.llm.GeminiLlmProvider;
import org.example.diary.service.llm.LlmProvider;
import org.example.diary.service.llm.OllamaLlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the generation backend used to write diary entries.
 */
@Configuration
public class LlmProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmProviderConfig.class);

    @Value("${ai.diary.provider:gemini}")
    private String diaryProvider;

    @Value("${ai.diary.timeout-seconds:120}")
    private int diaryTimeoutSeconds;

    @Value("${ai.diary.gemini.base-url:" + GeminiLlmProvider.DEFAULT_BASE_URL + "}")
    private String diaryGeminiBaseUrl;

    @Value("${ai.diary.gemini.api-key:}")
    private String diaryGeminiApiKey;

    @Value("${ai.diary.gemini.model:gemini-1.5-flash}")
    private String diaryGeminiModel;

    @Value("${ai.diary.ollama.base-url:http://localhost:11434}")
    private String diaryOllamaBaseUrl;

    @Value("${ai.diary.ollama.model:llama3.1:latest}")
    private String diaryOllamaModel;

    @Bean
    @Qualifier("diaryLlmProvider")
    public LlmProvider diaryLlmProvider() {
        log.info("Configuring diary LLM provider: {}", diaryProvider);
        return createProvider(
                diaryProvider,
                diaryGeminiBaseUrl, diaryGeminiApiKey, diaryGeminiModel,
                diaryOllamaBaseUrl, diaryOllamaModel,
                diaryTimeoutSeconds
        );
    }

    static LlmProvider createProvider(
            String providerType,
            String geminiBaseUrl, String geminiApiKey, String geminiModel,
            String ollamaBaseUrl, String ollamaModel,
            int timeoutSeconds) {

        String type = providerType == null ? "" : providerType.toLowerCase();
        return switch (type) {
            case "gemini" -> {
                if (geminiApiKey == null || geminiApiKey.isBlank()) {
                    log.warn("Gemini API key not configured, falling back to Ollama");
                    yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
                }
                log.info("Creating Gemini provider: model={}", geminiModel);
                yield new GeminiLlmProvider(geminiBaseUrl, geminiApiKey, geminiModel, timeoutSeconds);
            }
            case "ollama" -> {
                log.info("Creating Ollama provider: baseUrl={}, model={}", ollamaBaseUrl, ollamaModel);
                yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
            }
            default -> {
                log.warn("Unknown provider type '{}', falling back to Ollama", providerType);
                yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
            }
        };
    }
}
