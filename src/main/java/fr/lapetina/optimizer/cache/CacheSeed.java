package fr.lapetina.optimizer.cache;

import java.util.Objects;

/**
 * A known analysis inserted into the cache at startup.
 */
public record CacheSeed(String analysisType, String content, String result, int tokensUsed, double quality) {
    public CacheSeed {
        Objects.requireNonNull(analysisType, "Analysis type is required");
        Objects.requireNonNull(content, "Content is required");
        Objects.requireNonNull(result, "Result is required");
    }
}
