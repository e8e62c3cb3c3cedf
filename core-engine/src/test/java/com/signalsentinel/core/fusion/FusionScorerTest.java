package com.signalsentinel.core.fusion;

import com.signalsentinel.core.config.FusionSettings;
import com.signalsentinel.core.exception.NumericOverflowException;
import com.signalsentinel.core.model.AlertTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FusionScorer}.
 */
class FusionScorerTest {

    private FusionScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new FusionScorer(new FusionSettings());
    }

    @Test
    @DisplayName("Should squash layer 1 monotonically into [0, 1)")
    void shouldSquashLayer1() {
        assertThat(scorer.squashLayer1(0.0)).isZero();
        assertThat(scorer.squashLayer1(-3.0)).isZero();
        assertThat(scorer.squashLayer1(1.0)).isCloseTo(1.0 - Math.exp(-1.0), within(1e-12));
        assertThat(scorer.squashLayer1(1.532)).isGreaterThan(scorer.squashLayer1(1.0)).isLessThan(1.0);
    }

    @Test
    @DisplayName("Should reject a non-finite layer-1 score")
    void shouldRejectNonFiniteLayer1() {
        assertThatThrownBy(() -> scorer.squashLayer1(Double.NaN))
                .isInstanceOf(NumericOverflowException.class);
        assertThatThrownBy(() -> scorer.squashLayer1(Double.POSITIVE_INFINITY))
                .isInstanceOf(NumericOverflowException.class);
    }

    @Test
    @DisplayName("Should fuse with the configured weights and clamp")
    void shouldFuse() {
        assertThat(scorer.fuse(0.5, 0.5, 0.5)).isCloseTo(0.5, within(1e-12));
        assertThat(scorer.fuse(0.8, 0.6, 0.4)).isCloseTo(0.35 * 0.8 + 0.40 * 0.6 + 0.25 * 0.4, within(1e-12));
        assertThat(scorer.fuse(1.0, 1.0, 1.0)).isCloseTo(1.0, within(1e-12)).isLessThanOrEqualTo(1.0);
        assertThat(scorer.fuse(0.0, 0.0, 0.0)).isZero();
    }

    @Test
    @DisplayName("Should reject a non-finite fused score")
    void shouldRejectNonFiniteFusion() {
        assertThatThrownBy(() -> scorer.fuse(Double.NaN, 0.5, 0.5))
                .isInstanceOf(NumericOverflowException.class);
    }

    @Test
    @DisplayName("Should map scores onto the tier ladder with inclusive lower bounds")
    void shouldMapTiers() {
        assertThat(scorer.tier(1.0)).isEqualTo(AlertTier.CRITICAL);
        assertThat(scorer.tier(0.95)).isEqualTo(AlertTier.CRITICAL);
        assertThat(scorer.tier(0.949)).isEqualTo(AlertTier.HIGH);
        assertThat(scorer.tier(0.80)).isEqualTo(AlertTier.HIGH);
        assertThat(scorer.tier(0.65)).isEqualTo(AlertTier.MODERATE);
        assertThat(scorer.tier(0.45)).isEqualTo(AlertTier.WATCHLIST);
        assertThat(scorer.tier(0.25)).isEqualTo(AlertTier.LOW);
        assertThat(scorer.tier(0.2499)).isEqualTo(AlertTier.NONE);
        assertThat(scorer.tier(0.0)).isEqualTo(AlertTier.NONE);
    }
}
