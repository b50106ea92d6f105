package fr.lapetina.optimizer.domain.strategy;

import fr.lapetina.optimizer.domain.model.WorkerSlot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin strategy.
 *
 * Rotates the starting worker on every call, ignoring load beyond the capacity check.
 * Workers are ordered by id first so the rotation is stable across calls.
 *
 * Thread-safe via atomic counter.
 */
public final class RoundRobinStrategy implements WorkerSelectionStrategy {

    private final AtomicInteger counter = new AtomicInteger(0);

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public List<WorkerSlot> rank(List<WorkerSlot> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        List<WorkerSlot> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparing(WorkerSlot::getId));

        int size = ordered.size();
        int startIndex = Math.floorMod(counter.getAndIncrement(), size);

        List<WorkerSlot> ranked = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            WorkerSlot worker = ordered.get((startIndex + i) % size);
            if (worker.hasCapacity()) {
                ranked.add(worker);
            }
        }
        return ranked;
    }

    @Override
    public void reset() {
        counter.set(0);
    }
}
