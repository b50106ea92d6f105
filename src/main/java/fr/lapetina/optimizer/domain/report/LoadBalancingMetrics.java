package fr.lapetina.optimizer.domain.report;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of the session load balancer.
 *
 * @param totalSessions    assignment requests seen so far
 * @param balancedSessions assignments that created a new binding
 * @param rejectedSessions assignments that ended in a capacity rejection
 */
public record LoadBalancingMetrics(
        long totalSessions,
        int activeSessions,
        long balancedSessions,
        long rejectedSessions,
        int totalWorkers,
        int availableWorkers,
        int busyWorkers,
        double averageLoad,
        Map<String, WorkerLoad> workerLoads,
        String strategy,
        Instant timestamp
) {
    public LoadBalancingMetrics {
        workerLoads = Map.copyOf(workerLoads);
    }

    public record WorkerLoad(String workerId, int currentLoad, int capacity, double loadRatio) {
    }
}
