package org.example.diary.service.llm;

/**
 * Why a candidate stopped generating, mapped from each provider's own status codes.
 */
public enum FinishReason {
    /** Natural end of output. */
    STOP,
    /** Output hit the token budget. */
    MAX_TOKENS,
    /** Output was withheld by a safety or policy filter. */
    SAFETY,
    OTHER,
    UNSPECIFIED
}
