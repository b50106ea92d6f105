package fr.lapetina.optimizer.domain.report;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time cache statistics. {@code hitRate} is hits / (hits + misses), or 0 before any lookup.
 */
public record CacheStatistics(
        long totalRequests,
        long hits,
        long misses,
        double hitRate,
        int size,
        int maxSize,
        int validEntries,
        int expiredEntries,
        int compressedEntries,
        Duration averageAge,
        long evictions,
        int analysisTypes,
        Instant timestamp
) {
    public static double hitRate(long hits, long misses) {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0.0;
    }
}
