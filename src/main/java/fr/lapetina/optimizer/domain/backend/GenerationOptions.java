package fr.lapetina.optimizer.domain.backend;

import java.time.Duration;

/**
 * Parameters passed to the backend alongside the prompt.
 *
 * @param timeout time left for this generation, or null when the caller sets no limit
 */
public record GenerationOptions(int maxTokens, double temperature, Duration timeout) {
    public GenerationOptions {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        if (Double.isNaN(temperature) || temperature < 0.0) {
            throw new IllegalArgumentException("temperature must not be negative: " + temperature);
        }
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
    }

    public GenerationOptions(int maxTokens, double temperature) {
        this(maxTokens, temperature, null);
    }

    public GenerationOptions withTimeout(Duration timeout) {
        return new GenerationOptions(maxTokens, temperature, timeout);
    }
}
