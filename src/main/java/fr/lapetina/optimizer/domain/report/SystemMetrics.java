package fr.lapetina.optimizer.domain.report;

import java.time.Duration;
import java.time.Instant;

/**
 * Latest process figures. CPU and memory usage are percentages in [0, 100].
 */
public record SystemMetrics(
        double cpuUsage,
        double memoryUsage,
        int workerCount,
        long heapSize,
        Duration gcPause,
        Instant recordedAt
) {
    public static SystemMetrics empty(Instant now) {
        return new SystemMetrics(0.0, 0.0, 0, 0L, Duration.ZERO, now);
    }
}
