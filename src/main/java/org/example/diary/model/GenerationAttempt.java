package org.example.diary.model;

public record GenerationAttempt(
    int stage,
    String prompt,
    double temperature,
    int maxOutputTokens,
    GenerationOutcome result
) {}
