package org.example.diary.service.llm;

import java.util.List;

/**
 * Raw response of a generation call: zero or more candidates, each with a finish status
 * and zero or more text fragments.
 *
 * @param blockReason set when the provider refused the prompt itself (no candidates), otherwise null
 */
public record LlmResponse(
    List<Candidate> candidates,
    String blockReason
) {
    public LlmResponse {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public record Candidate(FinishReason finishReason, List<String> textParts) {
        public Candidate {
            finishReason = finishReason == null ? FinishReason.UNSPECIFIED : finishReason;
            textParts = textParts == null ? List.of() : List.copyOf(textParts);
        }
    }

    public static LlmResponse of(Candidate... candidates) {
        return new LlmResponse(List.of(candidates), null);
    }

    public static LlmResponse blocked(String reason) {
        return new LlmResponse(List.of(), reason);
    }

    /**
     * All text fragments of all candidates joined with newlines and trimmed.
     */
    public String mergedText() {
        StringBuilder merged = new StringBuilder();
        for (Candidate candidate : candidates) {
            for (String part : candidate.textParts()) {
                if (merged.length() > 0) {
                    merged.append('\n');
                }
                merged.append(part);
            }
        }
        return merged.toString().trim();
    }
}
