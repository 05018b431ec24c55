package org.example.diary.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * LLM provider implementation for Google Gemini.
 * Calls the {@code models/{model}:generateContent} endpoint of the Generative Language API.
 */
public class GeminiLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(GeminiLlmProvider.class);
    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final String apiKey;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GeminiLlmProvider(String baseUrl, String apiKey, String model, int timeoutSeconds) {
        this.apiKey = apiKey;
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("x-goog-api-key", apiKey == null ? "" : apiKey)
                .build();
        log.info("Gemini LLM provider initialized: model={}", model);
    }

    @Override
    public LlmResponse generate(String prompt, LlmOptions options) {
        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("temperature", options.temperature());
        generationConfig.put("maxOutputTokens", options.maxTokens());

        Map<String, Object> requestBody = Map.of(
                "contents", List.of(Map.of(
                        "role", "user",
                        "parts", List.of(Map.of("text", prompt))
                )),
                "generationConfig", generationConfig
        );

        try {
            String response = webClient.post()
                    .uri("/models/{model}:generateContent", model)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();

            return parseResponse(response);

        } catch (WebClientResponseException e) {
            log.error("Gemini API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new LlmProviderException("Gemini API error: " + e.getStatusCode(), e);
        } catch (LlmProviderException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to generate response from Gemini", e);
            throw new LlmProviderException("Failed to generate response from Gemini", e);
        }
    }

    LlmResponse parseResponse(String response) {
        if (response == null || response.isBlank()) {
            throw new LlmProviderException("Empty response body from Gemini API");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new LlmProviderException("Invalid response format from Gemini API", e);
        }
        if (root == null || !root.isObject()) {
            throw new LlmProviderException("Invalid response format from Gemini API");
        }

        List<LlmResponse.Candidate> candidates = new ArrayList<>();
        JsonNode candidatesNode = root.path("candidates");
        if (candidatesNode.isArray()) {
            for (JsonNode candidateNode : candidatesNode) {
                List<String> parts = new ArrayList<>();
                for (JsonNode part : candidateNode.path("content").path("parts")) {
                    if (part.hasNonNull("text") && !part.path("thought").asBoolean(false)) {
                        parts.add(part.get("text").asText());
                    }
                }
                candidates.add(new LlmResponse.Candidate(
                        mapFinishReason(candidateNode.path("finishReason").asText(null)), parts));
            }
        }

        String blockReason = root.path("promptFeedback").path("blockReason").asText(null);
        return new LlmResponse(candidates, blockReason);
    }

    static FinishReason mapFinishReason(String finishReason) {
        if (finishReason == null || finishReason.isBlank()) {
            return FinishReason.UNSPECIFIED;
        }
        return switch (finishReason) {
            case "STOP" -> FinishReason.STOP;
            case "MAX_TOKENS" -> FinishReason.MAX_TOKENS;
            case "SAFETY", "RECITATION", "BLOCKLIST", "PROHIBITED_CONTENT", "SPII", "IMAGE_SAFETY" ->
                    FinishReason.SAFETY;
            case "FINISH_REASON_UNSPECIFIED" -> FinishReason.UNSPECIFIED;
            default -> FinishReason.OTHER;
        };
    }

    @Override
    public boolean isAvailable() {
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("Gemini not available: API key not configured");
            return false;
        }
        // a configured key counts as available, no request is sent
        return true;
    }

    @Override
    public String getProviderName() {
        return "gemini";
    }
}
