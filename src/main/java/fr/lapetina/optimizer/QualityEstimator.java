package fr.lapetina.optimizer;

import fr.lapetina.optimizer.domain.backend.GenerationResult;

/**
 * Scores a generated result in [0, 1]. The score drives cache TTL and eviction.
 */
@FunctionalInterface
public interface QualityEstimator {

    double estimate(GenerationResult result);
}
