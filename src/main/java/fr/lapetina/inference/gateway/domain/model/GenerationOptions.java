package fr.lapetina.inference.gateway.domain.model;

/**
 * Sampling options passed to the backend.
 *
 * @param maxTokens   upper bound on generated tokens
 * @param temperature sampling temperature
 */
public record GenerationOptions(int maxTokens, double temperature) {

    public static final int DEFAULT_MAX_TOKENS = 1024;
    public static final double DEFAULT_TEMPERATURE = 0.7;

    public static GenerationOptions defaults() {
        return new GenerationOptions(DEFAULT_MAX_TOKENS, DEFAULT_TEMPERATURE);
    }
}
