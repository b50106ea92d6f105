package fr.lapetina.optimizer.domain.backend;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationResultTest {

    @Test
    @DisplayName("should map wire finish reasons case-insensitively")
    void shouldMapWireValues() {
        assertThat(FinishReason.fromWire("stop")).isEqualTo(FinishReason.STOP);
        assertThat(FinishReason.fromWire("END_TURN")).isEqualTo(FinishReason.STOP);
        assertThat(FinishReason.fromWire("length")).isEqualTo(FinishReason.LENGTH);
        assertThat(FinishReason.fromWire("max_tokens")).isEqualTo(FinishReason.LENGTH);
        assertThat(FinishReason.fromWire("load")).isEqualTo(FinishReason.UNKNOWN);
        assertThat(FinishReason.fromWire(null)).isEqualTo(FinishReason.UNKNOWN);
    }

    @Test
    @DisplayName("should only treat untruncated non-blank text as complete")
    void shouldDetectCompleteness() {
        assertThat(new GenerationResult("answer", 10, FinishReason.STOP).isComplete()).isTrue();
        assertThat(new GenerationResult("answer", 10, FinishReason.UNKNOWN).isComplete()).isTrue();
        assertThat(new GenerationResult("answer", 10, FinishReason.LENGTH).isComplete()).isFalse();
        assertThat(new GenerationResult("   ", 10, FinishReason.STOP).isComplete()).isFalse();
        assertThat(new GenerationResult(null, 0, FinishReason.STOP).text()).isEmpty();
    }

    @Test
    @DisplayName("should reject negative token counts")
    void shouldRejectNegativeTokens() {
        assertThatThrownBy(() -> new GenerationResult("x", -1, FinishReason.STOP))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
