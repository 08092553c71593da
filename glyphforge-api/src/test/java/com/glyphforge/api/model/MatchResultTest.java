package com.glyphforge.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchResultTest {

    @Test
    @DisplayName("Should mark result matched only above the threshold")
    void shouldMatchOnlyAboveThreshold() {
        assertThat(MatchResult.of(0.5, Map.of()).matched()).isFalse();
        assertThat(MatchResult.of(0.51, Map.of()).matched()).isTrue();
        assertThat(MatchResult.of(1.0, Map.of()).matched()).isTrue();
        assertThat(MatchResult.noMatch().matched()).isFalse();
    }

    @Test
    @DisplayName("Should clamp confidence into unit interval")
    void shouldClampConfidence() {
        assertThat(MatchResult.of(1.7, Map.of()).confidence()).isEqualTo(1.0);
        assertThat(MatchResult.of(-0.2, Map.of()).confidence()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should reject inconsistent matched flag")
    void shouldRejectInconsistentFlag() {
        assertThatThrownBy(() -> new MatchResult(true, 0.3, Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("disagrees");
        assertThatThrownBy(() -> new MatchResult(false, 1.2, Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("out of range");
    }
}
