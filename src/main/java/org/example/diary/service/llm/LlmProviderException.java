package org.example.diary.service.llm;

/**
 * Exception thrown when an LLM provider cannot be reached or returns a response it cannot read.
 */
public class LlmProviderException extends RuntimeException {

    public LlmProviderException(String message) {
        super(message);
    }

    public LlmProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
