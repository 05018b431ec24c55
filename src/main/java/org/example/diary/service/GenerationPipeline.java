package org.example.diary.service;

import org.example.diary.config.GenerationProperties;
import org.example.diary.model.GenerationAttempt;
import org.example.diary.model.GenerationOutcome;
import org.example.diary.model.GenerationResult;
import org.example.diary.model.GenerationResult.FailureKind;
import org.example.diary.service.llm.FinishReason;
import org.example.diary.service.llm.LlmOptions;
import org.example.diary.service.llm.LlmProvider;
import org.example.diary.service.llm.LlmProviderException;
import org.example.diary.service.llm.LlmResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a prompt against the generation backend with a bounded escalation policy.
 *
 * <ol>
 *   <li>Attempt 1 uses the initial temperature and token budget.</li>
 *   <li>Anything but success triggers attempt 2: same prompt, doubled budget (capped), the retry temperature.</li>
 *   <li>Only a truncated attempt 2 triggers attempt 3, with the prompt cut down to its head and tail.</li>
 * </ol>
 *
 * Calls are strictly sequential. A failed run is final; the caller decides whether to skip the cycle.
 */
@Service
public class GenerationPipeline {

    private static final Logger log = LoggerFactory.getLogger(GenerationPipeline.class);
    static final String SHORTENED_PROMPT_MARKER = "\n...\n";

    private final LlmProvider llmProvider;
    private final GenerationProperties properties;

    public GenerationPipeline(@Qualifier("diaryLlmProvider") LlmProvider llmProvider, GenerationProperties properties) {
        this.llmProvider = llmProvider;
        this.properties = properties;
    }

    public GenerationResult generate(String prompt) {
        List<GenerationAttempt> attempts = new ArrayList<>();

        double initialTemperature = properties.getInitialTemperature();
        int initialBudget = properties.getInitialMaxOutputTokens();
        GenerationAttempt first = attempt(1, prompt, initialTemperature, initialBudget);
        attempts.add(first);
        if (first.result().isSuccess()) {
            return GenerationResult.success(first.result().text(), attempts);
        }

        double retryTemperature = properties.getRetryTemperature();
        int retryBudget = escalatedBudget(initialBudget);
        GenerationAttempt second = attempt(2, prompt, retryTemperature, retryBudget);
        attempts.add(second);
        if (second.result().isSuccess()) {
            return GenerationResult.success(second.result().text(), attempts);
        }
        if (second.result().kind() != GenerationOutcome.Kind.TRUNCATED) {
            return failure(attempts);
        }

        String shortened = shortenPrompt(prompt);
        log.info("Retrying with shortened prompt: {} -> {} chars", prompt.length(), shortened.length());
        GenerationAttempt third = attempt(3, shortened, retryTemperature, retryBudget);
        attempts.add(third);
        if (third.result().isSuccess()) {
            return GenerationResult.success(third.result().text(), attempts);
        }
        return failure(attempts);
    }

    private GenerationAttempt attempt(int stage, String prompt, double temperature, int maxOutputTokens) {
        log.info("Generation attempt {} via {}: temperature={}, maxOutputTokens={}, promptChars={}",
                stage, llmProvider.getProviderName(), temperature, maxOutputTokens, prompt.length());

        GenerationOutcome outcome;
        try {
            LlmResponse response = llmProvider.generate(prompt,
                    LlmOptions.withTemperatureAndMaxTokens(temperature, maxOutputTokens));
            outcome = classify(response);
        } catch (LlmProviderException e) {
            log.error("Generation attempt {} failed in transport: {}", stage, e.getMessage());
            outcome = GenerationOutcome.transportError(e.getMessage());
        }

        switch (outcome.kind()) {
            case SUCCESS -> log.info("Generation attempt {} succeeded ({} chars)", stage, outcome.text().length());
            case TRUNCATED -> log.warn("Generation attempt {} stopped at the token budget", stage);
            case BLOCKED -> log.warn("Generation attempt {} was blocked: {}", stage, outcome.detail());
            case EMPTY -> log.warn("Generation attempt {} returned no text", stage);
            default -> log.debug("Generation attempt {} outcome {}", stage, outcome.kind());
        }
        return new GenerationAttempt(stage, prompt, temperature, maxOutputTokens, outcome);
    }

    /**
     * Blocked wins over truncated, truncated over empty; only a clean response with text is a success.
     */
    static GenerationOutcome classify(LlmResponse response) {
        if (response == null) {
            return GenerationOutcome.empty();
        }
        if (response.blockReason() != null && !response.blockReason().isBlank()) {
            return GenerationOutcome.blocked(response.blockReason());
        }

        boolean truncated = false;
        for (LlmResponse.Candidate candidate : response.candidates()) {
            if (candidate.finishReason() == FinishReason.SAFETY) {
                return GenerationOutcome.blocked("candidate finished with " + candidate.finishReason());
            }
            if (candidate.finishReason() == FinishReason.MAX_TOKENS) {
                truncated = true;
            }
        }

        String merged = response.mergedText();
        if (truncated) {
            return GenerationOutcome.truncated(merged.isEmpty() ? null : merged);
        }
        if (merged.isEmpty()) {
            return GenerationOutcome.empty();
        }
        return GenerationOutcome.success(merged);
    }

    int escalatedBudget(int budget) {
        long doubled = (long) budget * 2;
        return (int) Math.min(doubled, Math.max(budget, properties.getMaxOutputTokensCeiling()));
    }

    /**
     * Keeps the head of the prompt and its tail, where the task instructions live.
     */
    String shortenPrompt(String prompt) {
        int prefix = Math.max(0, properties.getShortenedPrefixChars());
        int suffix = Math.max(0, properties.getShortenedSuffixChars());
        if (prompt.length() <= prefix + suffix + SHORTENED_PROMPT_MARKER.length()) {
            return prompt;
        }

        // cut points never split a surrogate pair
        int headEnd = prefix;
        if (headEnd > 0 && Character.isHighSurrogate(prompt.charAt(headEnd - 1))) {
            headEnd--;
        }
        int tailStart = prompt.length() - suffix;
        if (tailStart < prompt.length() && Character.isLowSurrogate(prompt.charAt(tailStart))) {
            tailStart++;
        }
        return prompt.substring(0, headEnd) + SHORTENED_PROMPT_MARKER + prompt.substring(tailStart);
    }

    /**
     * A block on any attempt makes the run BLOCKED; EXHAUSTED means no attempt was blocked.
     */
    private GenerationResult failure(List<GenerationAttempt> attempts) {
        GenerationAttempt last = attempts.get(attempts.size() - 1);
        for (GenerationAttempt attempt : attempts) {
            if (attempt.result().kind() == GenerationOutcome.Kind.BLOCKED) {
                log.error("Generation blocked on attempt {} of {}: {}",
                        attempt.stage(), attempts.size(), attempt.result().detail());
                return GenerationResult.failure(FailureKind.BLOCKED,
                        "Blocked by backend policy: " + attempt.result().detail(), attempts);
            }
        }
        log.error("Generation exhausted after {} attempts, last outcome {}", attempts.size(), last.result().kind());
        return GenerationResult.failure(FailureKind.EXHAUSTED,
                "No usable text after " + attempts.size() + " attempts (last: " + last.result().kind() + ")", attempts);
    }
}
