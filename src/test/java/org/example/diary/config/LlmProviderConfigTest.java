package org.example.diary.config;

import org.example.diary.service.llm.GeminiLlmProvider;
import org.example.diary.service.llm.LlmProvider;
import org.example.diary.service.llm.OllamaLlmProvider;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LlmProviderConfigTest {

    @Test
    void createProvider_geminiWithKey() {
        LlmProvider provider = create("gemini", "key");

        assertInstanceOf(GeminiLlmProvider.class, provider);
        assertEquals("gemini", provider.getProviderName());
    }

    @Test
    void createProvider_geminiWithoutKeyFallsBackToOllama() {
        assertInstanceOf(OllamaLlmProvider.class, create("gemini", ""));
        assertInstanceOf(OllamaLlmProvider.class, create("GEMINI", null));
    }

    @Test
    void createProvider_ollama() {
        assertEquals("ollama", create("ollama", "key").getProviderName());
    }

    @Test
    void createProvider_unknownTypeFallsBackToOllama() {
        assertInstanceOf(OllamaLlmProvider.class, create("xai", "key"));
        assertInstanceOf(OllamaLlmProvider.class, create(null, "key"));
    }

    private static LlmProvider create(String type, String geminiKey) {
        return LlmProviderConfig.createProvider(
                type,
                GeminiLlmProvider.DEFAULT_BASE_URL, geminiKey, "gemini-1.5-flash",
                "http://localhost:11434", "llama3.1:latest",
                30);
    }
}
