package fr.lapetina.optimizer.domain.report;

import java.time.Instant;

/**
 * Cache usage for one analysis type, including the self-tuned TTL frequency boost.
 */
public record AnalysisTypeStats(
        String analysisType,
        long requests,
        long hits,
        long misses,
        double hitRate,
        double averageQuality,
        double averageTokens,
        double frequencyBoost,
        Instant lastOptimized
) {
}
