package fr.lapetina.optimizer.domain.report;

import java.time.Duration;

/**
 * Latency distribution over the rolling window. Percentiles use the nearest-rank method.
 */
public record LatencyMetrics(
        Duration mean,
        Duration p50,
        Duration p95,
        Duration p99,
        Duration min,
        Duration max,
        int sampleCount
) {
    public static LatencyMetrics empty() {
        return new LatencyMetrics(Duration.ZERO, Duration.ZERO, Duration.ZERO,
                Duration.ZERO, Duration.ZERO, Duration.ZERO, 0);
    }
}
