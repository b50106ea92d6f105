package fr.lapetina.optimizer.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only view of a cache entry. Content is always returned decompressed.
 */
public record CachedAnalysis(
        String fingerprint,
        String analysisType,
        String content,
        int tokensUsed,
        double quality,
        Instant createdAt,
        Instant lastAccessed,
        long accessCount,
        Duration ttl,
        boolean compressed
) {
    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }
}
