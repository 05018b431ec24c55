package org.example.diary.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GenerationPropertiesTest {

    @Test
    void defaultsAreValid() {
        assertDoesNotThrow(() -> new GenerationProperties().validate());
    }

    @Test
    void retryTemperatureEqualToInitialIsRejected() {
        GenerationProperties properties = new GenerationProperties();
        properties.setInitialTemperature(0.5);
        properties.setRetryTemperature(0.5);

        IllegalStateException e = assertThrows(IllegalStateException.class, properties::validate);
        assertTrue(e.getMessage().contains("retry-temperature"));
    }

    @Test
    void retryTemperatureAboveInitialIsRejected() {
        GenerationProperties properties = new GenerationProperties();
        properties.setRetryTemperature(0.9);

        assertThrows(IllegalStateException.class, properties::validate);
    }

    @Test
    void nonPositiveBudgetIsRejected() {
        GenerationProperties properties = new GenerationProperties();
        properties.setInitialMaxOutputTokens(0);

        assertThrows(IllegalStateException.class, properties::validate);
    }
}
