package fr.lapetina.optimizer.domain.strategy;

import fr.lapetina.optimizer.domain.model.WorkerSlot;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Least-loaded strategy, the default.
 *
 * Prefers the lowest load/capacity ratio so workers of different sizes fill evenly.
 * Ties go to the worker with the oldest heartbeat (the longest-running, warmed-up
 * one), then to the lowest worker id for determinism.
 *
 * <p>Loads and heartbeats change while other threads acquire and release slots, so each
 * candidate is read once into a {@link RankKey} and the sort only compares those keys.
 */
public final class LeastLoadedStrategy implements WorkerSelectionStrategy {

    private static final Comparator<RankKey> ORDER = Comparator
            .comparingDouble(RankKey::loadRatio)
            .thenComparing(RankKey::lastHeartbeat)
            .thenComparing(RankKey::id);

    @Override
    public String getName() {
        return "least-loaded";
    }

    @Override
    public List<WorkerSlot> rank(List<WorkerSlot> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        return candidates.stream()
                .filter(WorkerSlot::hasCapacity)
                .map(RankKey::of)
                .sorted(ORDER)
                .map(RankKey::worker)
                .toList();
    }

    private record RankKey(WorkerSlot worker, double loadRatio, Instant lastHeartbeat, String id) {
        static RankKey of(WorkerSlot worker) {
            return new RankKey(worker, worker.getLoadRatio(), worker.getLastHeartbeat(), worker.getId());
        }
    }
}
