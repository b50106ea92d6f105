package fr.lapetina.optimizer.domain.report;

import java.time.Duration;
import java.time.Instant;

/**
 * Roll-up of optimizer activity, composed from the cache, balancer and metrics registry.
 */
public record PerformanceOptimizationMetrics(
        long totalRequests,
        long optimizedRequests,
        long cacheHits,
        long loadBalancedRequests,
        double cacheHitRate,
        double optimizationRate,
        int activeSessions,
        Duration averageResponseTime,
        Instant timestamp
) {
}
