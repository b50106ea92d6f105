package fr.lapetina.optimizer.domain.alert;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits evaluated on every monitoring tick.
 * CPU and memory limits are percentages; rates are fractions in [0, 1].
 */
public record AlertThresholds(
        Duration maxResponseTime,
        double minCacheHitRate,
        double maxErrorRate,
        int maxConcurrentRequests,
        double maxCpuUsage,
        double maxMemoryUsage
) {
    public AlertThresholds {
        Objects.requireNonNull(maxResponseTime, "maxResponseTime is required");
    }

    public static AlertThresholds defaults() {
        return new AlertThresholds(Duration.ofSeconds(5), 0.7, 0.05, 100, 80.0, 85.0);
    }

    public AlertThresholds withMinCacheHitRate(double minCacheHitRate) {
        return new AlertThresholds(maxResponseTime, minCacheHitRate, maxErrorRate,
                maxConcurrentRequests, maxCpuUsage, maxMemoryUsage);
    }

    public AlertThresholds withMaxErrorRate(double maxErrorRate) {
        return new AlertThresholds(maxResponseTime, minCacheHitRate, maxErrorRate,
                maxConcurrentRequests, maxCpuUsage, maxMemoryUsage);
    }

    public AlertThresholds withMaxResponseTime(Duration maxResponseTime) {
        return new AlertThresholds(maxResponseTime, minCacheHitRate, maxErrorRate,
                maxConcurrentRequests, maxCpuUsage, maxMemoryUsage);
    }

    public AlertThresholds withMaxConcurrentRequests(int maxConcurrentRequests) {
        return new AlertThresholds(maxResponseTime, minCacheHitRate, maxErrorRate,
                maxConcurrentRequests, maxCpuUsage, maxMemoryUsage);
    }
}
