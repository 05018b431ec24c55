package org.example.diary.service.llm;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeminiLlmProviderTest {

    private final GeminiLlmProvider provider =
            new GeminiLlmProvider(GeminiLlmProvider.DEFAULT_BASE_URL, "test-key", "gemini-1.5-flash", 5);

    @Test
    void parseResponse_collectsTextPartsAndFinishReason() {
        LlmResponse response = provider.parseResponse("""
                {
                  "candidates": [{
                    "content": {"role": "model", "parts": [
                      {"text": "thinking...", "thought": true},
                      {"text": "Hôm nay "},
                      {"text": "tôi suy niệm."}
                    ]},
                    "finishReason": "STOP"
                  }],
                  "usageMetadata": {"totalTokenCount": 42}
                }
                """);

        assertEquals(1, response.candidates().size());
        LlmResponse.Candidate candidate = response.candidates().get(0);
        assertEquals(FinishReason.STOP, candidate.finishReason());
        assertEquals(List.of("Hôm nay ", "tôi suy niệm."), candidate.textParts());
        assertNull(response.blockReason());
    }

    @Test
    void parseResponse_maxTokensWithoutContent() {
        LlmResponse response = provider.parseResponse("""
                {"candidates": [{"finishReason": "MAX_TOKENS"}]}
                """);

        assertEquals(FinishReason.MAX_TOKENS, response.candidates().get(0).finishReason());
        assertEquals("", response.mergedText());
    }

    @Test
    void parseResponse_promptFeedbackBlock() {
        LlmResponse response = provider.parseResponse("""
                {"promptFeedback": {"blockReason": "SAFETY"}}
                """);

        assertTrue(response.candidates().isEmpty());
        assertEquals("SAFETY", response.blockReason());
    }

    @Test
    void parseResponse_invalidBodies() {
        assertThrows(LlmProviderException.class, () -> provider.parseResponse(""));
        assertThrows(LlmProviderException.class, () -> provider.parseResponse("not json"));
        assertThrows(LlmProviderException.class, () -> provider.parseResponse("[1, 2]"));
    }

    @Test
    void mapFinishReason_groupsPolicyStops() {
        assertEquals(FinishReason.SAFETY, GeminiLlmProvider.mapFinishReason("RECITATION"));
        assertEquals(FinishReason.SAFETY, GeminiLlmProvider.mapFinishReason("PROHIBITED_CONTENT"));
        assertEquals(FinishReason.UNSPECIFIED, GeminiLlmProvider.mapFinishReason(null));
        assertEquals(FinishReason.UNSPECIFIED, GeminiLlmProvider.mapFinishReason("FINISH_REASON_UNSPECIFIED"));
        assertEquals(FinishReason.OTHER, GeminiLlmProvider.mapFinishReason("MALFORMED_FUNCTION_CALL"));
    }

    @Test
    void availabilityDependsOnApiKey() {
        assertTrue(provider.isAvailable());
        assertFalse(new GeminiLlmProvider(GeminiLlmProvider.DEFAULT_BASE_URL, " ", "m", 5).isAvailable());
        assertEquals("gemini", provider.getProviderName());
    }
}
