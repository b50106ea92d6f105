package fr.lapetina.optimizer;

import fr.lapetina.optimizer.domain.backend.FinishReason;
import fr.lapetina.optimizer.domain.backend.GenerationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HeuristicQualityEstimatorTest {

    private final HeuristicQualityEstimator estimator = new HeuristicQualityEstimator();

    @Test
    @DisplayName("should score blank answers zero")
    void shouldScoreBlankZero() {
        assertThat(estimator.estimate(new GenerationResult("   ", 3, FinishReason.STOP))).isZero();
    }

    @Test
    @DisplayName("should reward substantial answers that stopped naturally")
    void shouldRewardCompleteAnswers() {
        String longText = "x".repeat(HeuristicQualityEstimator.SUBSTANTIAL_LENGTH);

        assertThat(estimator.estimate(new GenerationResult(longText, 50, FinishReason.STOP)))
                .isCloseTo(1.0, within(1e-9));
        assertThat(estimator.estimate(new GenerationResult("short", 2, FinishReason.STOP)))
                .isCloseTo(0.8, within(1e-9));
        assertThat(estimator.estimate(new GenerationResult("short", 2, FinishReason.UNKNOWN)))
                .isCloseTo(0.6, within(1e-9));
    }
}
