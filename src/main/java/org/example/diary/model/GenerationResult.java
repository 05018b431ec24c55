package org.example.diary.model;

import java.util.List;

/**
 * Final result of a generation pipeline run.
 */
public record GenerationResult(
    boolean success,
    String text,
    FailureKind failure,
    String message,
    List<GenerationAttempt> attempts
) {
    public enum FailureKind {
        /** The backend refused the prompt for policy reasons. */
        BLOCKED,
        /** Every attempt ended truncated, empty or in a transport error. */
        EXHAUSTED
    }

    public GenerationResult {
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public static GenerationResult success(String text, List<GenerationAttempt> attempts) {
        return new GenerationResult(true, text, null, "Generated on attempt " + attempts.size(), attempts);
    }

    public static GenerationResult failure(FailureKind failure, String message, List<GenerationAttempt> attempts) {
        return new GenerationResult(false, null, failure, message, attempts);
    }

    public int attemptCount() {
        return attempts.size();
    }
}
