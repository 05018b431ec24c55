package org.example.diary.service.llm;

/**
 * Abstraction for text-generation backends (Gemini, Ollama).
 */
public interface LlmProvider {

    /**
     * Generate a response from the LLM.
     *
     * @param prompt the prompt to send
     * @param options generation options (temperature, token budget)
     * @return the candidates returned by the backend with their finish status
     * @throws LlmProviderException if the backend is unreachable or the response cannot be read
     */
    LlmResponse generate(String prompt, LlmOptions options);

    /**
     * Check if this provider is available and properly configured.
     *
     * @return true if the provider can accept requests
     */
    boolean isAvailable();

    /**
     * Get the name of this provider for logging/debugging.
     *
     * @return provider name (e.g., "gemini", "ollama")
     */
    String getProviderName();
}
