package org.example.diary.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * LLM provider implementation for Ollama.
 * Calls the Ollama /api/generate endpoint; a single candidate is reported per call.
 */
public class OllamaLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaLlmProvider.class);

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OllamaLlmProvider(String baseUrl, String model, int timeoutSeconds) {
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .build();
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
        log.info("Ollama LLM provider initialized: baseUrl={}, model={}", baseUrl, model);
    }

    @Override
    public LlmResponse generate(String prompt, LlmOptions options) {
        Map<String, Object> ollamaOptions = new HashMap<>();
        ollamaOptions.put("temperature", options.temperature());
        ollamaOptions.put("num_predict", options.maxTokens());

        Map<String, Object> requestBody = Map.of(
                "model", model,
                "prompt", prompt,
                "stream", false,
                "options", ollamaOptions
        );

        try {
            String response = webClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();

            return parseResponse(response);

        } catch (WebClientResponseException e) {
            log.error("Ollama API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new LlmProviderException("Ollama API error: " + e.getStatusCode(), e);
        } catch (LlmProviderException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to generate response from Ollama", e);
            throw new LlmProviderException("Failed to generate response from Ollama", e);
        }
    }

    LlmResponse parseResponse(String response) {
        JsonNode responseNode;
        try {
            responseNode = response == null ? null : objectMapper.readTree(response);
        } catch (Exception e) {
            throw new LlmProviderException("Invalid response format from Ollama", e);
        }
        if (responseNode == null || !responseNode.has("response")) {
            throw new LlmProviderException("Invalid response format from Ollama");
        }

        String text = responseNode.get("response").asText();
        FinishReason finishReason = switch (responseNode.path("done_reason").asText("")) {
            case "stop" -> FinishReason.STOP;
            case "length" -> FinishReason.MAX_TOKENS;
            case "" -> FinishReason.UNSPECIFIED;
            default -> FinishReason.OTHER;
        };
        List<String> parts = text.isEmpty() ? List.of() : List.of(text);
        return LlmResponse.of(new LlmResponse.Candidate(finishReason, parts));
    }

    /**
     * Available when the server answers {@code /api/tags} and lists the configured model.
     */
    @Override
    public boolean isAvailable() {
        String tags;
        try {
            tags = webClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(5));
        } catch (Exception e) {
            log.warn("Ollama not reachable: {}", e.getMessage());
            return false;
        }
        if (!hasModel(tags)) {
            log.warn("Ollama is running but model {} is not pulled", model);
            return false;
        }
        return true;
    }

    boolean hasModel(String tagsResponse) {
        if (tagsResponse == null || tagsResponse.isBlank()) {
            return false;
        }
        try {
            for (JsonNode entry : objectMapper.readTree(tagsResponse).path("models")) {
                String name = entry.path("name").asText("");
                if (name.equals(model) || name.equals(model + ":latest")) {
                    return true;
                }
            }
        } catch (JsonProcessingException e) {
            log.warn("Unreadable Ollama tag list: {}", e.getMessage());
        }
        return false;
    }

    @Override
    public String getProviderName() {
        return "ollama";
    }
}
