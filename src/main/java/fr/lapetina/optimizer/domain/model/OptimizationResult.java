package fr.lapetina.optimizer.domain.model;

import java.time.Duration;

/**
 * Outcome of a successful optimize call.
 *
 * @param cacheHit  true when served from the cache without touching the backend
 * @param optimized true when served from cache or when prompt/parameters were tuned
 * @param workerId  worker that generated the content, null on a cache hit
 */
public record OptimizationResult(
        String requestId,
        String content,
        int tokensUsed,
        Duration responseTime,
        boolean cacheHit,
        boolean optimized,
        String sessionId,
        String workerId
) {
}
