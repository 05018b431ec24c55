package org.example.diary.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Token budgets, temperature schedule and prompt shortening sizes for the generation pipeline.
 * The retry temperature must be strictly lower than the initial one.
 */
@Component
@ConfigurationProperties(prefix = "diary.generation")
public class GenerationProperties {

    private double initialTemperature = 0.7;
    private int initialMaxOutputTokens = 2048;
    private double retryTemperature = 0.4;
    private int maxOutputTokensCeiling = 8192;
    private int shortenedPrefixChars = 6000;
    private int shortenedSuffixChars = 2000;

    @PostConstruct
    public void validate() {
        if (retryTemperature >= initialTemperature) {
            throw new IllegalStateException("diary.generation.retry-temperature (" + retryTemperature
                    + ") must be lower than diary.generation.initial-temperature (" + initialTemperature + ")");
        }
        if (initialMaxOutputTokens <= 0) {
            throw new IllegalStateException("diary.generation.initial-max-output-tokens must be positive: "
                    + initialMaxOutputTokens);
        }
        if (shortenedPrefixChars < 0 || shortenedSuffixChars < 0) {
            throw new IllegalStateException("diary.generation.shortened-*-chars must not be negative");
        }
    }

    public double getInitialTemperature() {
        return initialTemperature;
    }

    public void setInitialTemperature(double initialTemperature) {
        this.initialTemperature = initialTemperature;
    }

    public int getInitialMaxOutputTokens() {
        return initialMaxOutputTokens;
    }

    public void setInitialMaxOutputTokens(int initialMaxOutputTokens) {
        this.initialMaxOutputTokens = initialMaxOutputTokens;
    }

    public double getRetryTemperature() {
        return retryTemperature;
    }

    public void setRetryTemperature(double retryTemperature) {
        this.retryTemperature = retryTemperature;
    }

    public int getMaxOutputTokensCeiling() {
        return maxOutputTokensCeiling;
    }

    public void setMaxOutputTokensCeiling(int maxOutputTokensCeiling) {
        this.maxOutputTokensCeiling = maxOutputTokensCeiling;
    }

    public int getShortenedPrefixChars() {
        return shortenedPrefixChars;
    }

    public void setShortenedPrefixChars(int shortenedPrefixChars) {
        this.shortenedPrefixChars = shortenedPrefixChars;
    }

    public int getShortenedSuffixChars() {
        return shortenedSuffixChars;
    }

    public void setShortenedSuffixChars(int shortenedSuffixChars) {
        this.shortenedSuffixChars = shortenedSuffixChars;
    }
}
