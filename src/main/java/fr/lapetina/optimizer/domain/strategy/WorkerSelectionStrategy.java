package fr.lapetina.optimizer.domain.strategy;

import fr.lapetina.optimizer.domain.model.WorkerSlot;

import java.util.List;

/**
 * Strategy for ordering candidate workers when a session needs a new binding.
 *
 * The balancer tries the returned workers in order and binds to the first one whose
 * slot reservation succeeds, so a strategy only ranks and never reserves.
 * Implementations must be thread-safe.
 */
public interface WorkerSelectionStrategy {

    /**
     * Returns the name of this strategy for configuration and metrics.
     */
    String getName();

    /**
     * Orders the candidates by preference.
     *
     * @param candidates workers that match the requested specializations
     * @return workers with spare capacity, most preferred first
     */
    List<WorkerSlot> rank(List<WorkerSlot> candidates);

    /**
     * Resets any internal state. Called when workers are reloaded.
     */
    default void reset() {
        // Default no-op
    }
}
