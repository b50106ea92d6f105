package fr.lapetina.optimizer.domain.report;

import java.time.Duration;
import java.time.Instant;

/**
 * Latest cache figures reported to the performance monitor.
 */
public record CacheMetrics(
        long hits,
        long misses,
        int size,
        long evictions,
        Duration averageAge,
        Instant recordedAt
) {
    public static CacheMetrics empty(Instant now) {
        return new CacheMetrics(0, 0, 0, 0, Duration.ZERO, now);
    }

    public long lookups() {
        return hits + misses;
    }

    public double hitRate() {
        return CacheStatistics.hitRate(hits, misses);
    }
}
