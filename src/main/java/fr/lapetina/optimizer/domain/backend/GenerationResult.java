package fr.lapetina.optimizer.domain.backend;

import java.util.Objects;

/**
 * Text returned by the backend.
 */
public record GenerationResult(String text, int tokensUsed, FinishReason finishReason) {
    public GenerationResult {
        Objects.requireNonNull(finishReason, "Finish reason is required");
        if (tokensUsed < 0) {
            throw new IllegalArgumentException("tokensUsed must not be negative: " + tokensUsed);
        }
        if (text == null) {
            text = "";
        }
    }

    /**
     * A result is complete when the backend stopped on its own and returned something.
     * Truncated or blank output is never cached.
     */
    public boolean isComplete() {
        return finishReason != FinishReason.LENGTH && !text.isBlank();
    }
}
