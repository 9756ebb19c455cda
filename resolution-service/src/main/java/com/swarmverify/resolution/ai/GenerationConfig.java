package com.swarmverify.resolution.ai;

/**
 * Sampling parameters for one reasoning-backend call.
 *
 * @param temperature     sampling temperature
 * @param maxOutputTokens response length cap
 * @param searchGrounding ask the backend to ground the answer with live web search
 */
public record GenerationConfig(double temperature, int maxOutputTokens, boolean searchGrounding) {

    public static final double DEFAULT_TEMPERATURE = 0.3;
    public static final int    DEFAULT_MAX_TOKENS  = 1024;

    public static GenerationConfig defaults() {
        return new GenerationConfig(DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS, false);
    }

    public GenerationConfig withTemperature(double value) {
        return new GenerationConfig(value, maxOutputTokens, searchGrounding);
    }

    public GenerationConfig withSearchGrounding() {
        return new GenerationConfig(temperature, maxOutputTokens, true);
    }
}
