package org.example.diary.model;

/**
 * Classified result of a single backend call.
 *
 * @param text   generated text for {@link Kind#SUCCESS}, partial text (possibly null) for {@link Kind#TRUNCATED}
 * @param detail block reason or transport error detail
 */
public record GenerationOutcome(
    Kind kind,
    String text,
    String detail
) {
    public enum Kind {
        SUCCESS,
        TRUNCATED,
        BLOCKED,
        EMPTY,
        TRANSPORT_ERROR
    }

    public static GenerationOutcome success(String text) {
        return new GenerationOutcome(Kind.SUCCESS, text, null);
    }

    public static GenerationOutcome truncated(String partialText) {
        return new GenerationOutcome(Kind.TRUNCATED, partialText, null);
    }

    public static GenerationOutcome blocked(String reason) {
        return new GenerationOutcome(Kind.BLOCKED, null, reason);
    }

    public static GenerationOutcome empty() {
        return new GenerationOutcome(Kind.EMPTY, null, null);
    }

    public static GenerationOutcome transportError(String detail) {
        return new GenerationOutcome(Kind.TRANSPORT_ERROR, null, detail);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }
}
