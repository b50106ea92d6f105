package fr.lapetina.optimizer.domain.report;

/**
 * Request counters. Lifetime totals plus rates derived from the rolling window.
 */
public record RequestMetrics(
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        long timeoutRequests,
        int windowRequests,
        double windowErrorRate,
        double requestsPerSecond,
        int concurrentRequests,
        int peakConcurrentRequests
) {
}
