package fr.lapetina.optimizer;

import fr.lapetina.optimizer.domain.backend.FinishReason;
import fr.lapetina.optimizer.domain.backend.GenerationResult;

/**
 * Default quality score from the shape of the answer, without reading its meaning.
 * Blank answers score 0; otherwise 0.6, plus 0.2 for a substantial answer and 0.2 for a
 * natural stop.
 */
public final class HeuristicQualityEstimator implements QualityEstimator {

    static final int SUBSTANTIAL_LENGTH = 200;

    @Override
    public double estimate(GenerationResult result) {
        if (result.text().isBlank()) {
            return 0.0;
        }
        double quality = 0.6;
        if (result.text().length() >= SUBSTANTIAL_LENGTH) {
            quality += 0.2;
        }
        if (result.finishReason() == FinishReason.STOP) {
            quality += 0.2;
        }
        return Math.min(1.0, quality);
    }
}
