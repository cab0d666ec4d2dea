package com.planwright.core.llm;

import java.time.Duration;

/**
 * Per-call generation settings.
 *
 * @param temperature     sampling temperature
 * @param maxOutputTokens reply length limit
 * @param timeout         deadline for the whole call
 */
public record GenerationOptions(
    double temperature,
    int maxOutputTokens,
    Duration timeout
) {

    public GenerationOptions withTemperature(double value) {
        return new GenerationOptions(value, maxOutputTokens, timeout);
    }
}
