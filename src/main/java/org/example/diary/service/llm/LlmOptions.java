package org.example.diary.service.llm;

/**
 * Options for LLM generation requests.
 */
public record LlmOptions(
    double temperature,
    int maxTokens
) {
    /**
     * Create options with temperature and an output token budget.
     */
    public static LlmOptions withTemperatureAndMaxTokens(double temp, int maxTokens) {
        return new LlmOptions(temp, maxTokens);
    }
}
