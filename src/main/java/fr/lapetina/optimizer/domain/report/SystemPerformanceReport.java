package fr.lapetina.optimizer.domain.report;

import fr.lapetina.optimizer.domain.alert.AlertThresholds;

import java.time.Instant;

/**
 * Aggregated view across all rolling windows at one instant.
 * {@code loadBalancing} is null when no load balancer is attached to the monitor.
 */
public record SystemPerformanceReport(
        RequestMetrics requests,
        LatencyMetrics latency,
        CacheMetrics cache,
        SystemMetrics system,
        LoadBalancingMetrics loadBalancing,
        AlertThresholds thresholds,
        Instant generatedAt
) {
}
