package fr.lapetina.optimizer.infrastructure.metrics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PercentilesTest {

    @Test
    @DisplayName("should pick the nearest-rank value")
    void shouldPickNearestRank() {
        long[] values = {10, 20, 30, 40, 50, 60, 70, 80, 90, 100};

        assertThat(Percentiles.nearestRank(values, 0.50)).isEqualTo(50);
        assertThat(Percentiles.nearestRank(values, 0.51)).isEqualTo(60);
        assertThat(Percentiles.nearestRank(values, 0.99)).isEqualTo(100);
        assertThat(Percentiles.nearestRank(values, 1.0)).isEqualTo(100);
        assertThat(Percentiles.nearestRank(values, 0.01)).isEqualTo(10);
    }

    @Test
    @DisplayName("should return the only value of a single sample")
    void shouldHandleSingleValue() {
        assertThat(Percentiles.nearestRank(new long[]{42}, 0.95)).isEqualTo(42);
    }

    @Test
    @DisplayName("should reject empty samples and out of range percentiles")
    void shouldRejectInvalidInput() {
        assertThatThrownBy(() -> Percentiles.nearestRank(new long[0], 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Percentiles.nearestRank(new long[]{1}, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Percentiles.nearestRank(new long[]{1}, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
