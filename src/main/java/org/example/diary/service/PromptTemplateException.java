package org.example.diary.service;

/**
 * Thrown when a prompt template cannot be loaded or lacks a required placeholder.
 */
public class PromptTemplateException extends RuntimeException {

    public PromptTemplateException(String message) {
        super(message);
    }

    public PromptTemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
