package com.signalsentinel.core.fusion;

import com.signalsentinel.core.config.FusionSettings;
import com.signalsentinel.core.model.BayesianResult;
import com.signalsentinel.core.model.CausalityResult;
import com.signalsentinel.core.model.DisproportionalityResult;
import com.signalsentinel.core.model.NoveltyResult;
import com.signalsentinel.core.model.RatioEstimate;
import com.signalsentinel.core.model.SignalStrength;
import com.signalsentinel.core.model.TemporalResult;
import com.signalsentinel.core.model.WhoUmcCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link EvidenceScorer}.
 */
class EvidenceScorerTest {

    private EvidenceScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new EvidenceScorer(new FusionSettings());
    }

    @Test
    @DisplayName("Should weight all four components")
    void shouldWeightAllComponents() {
        double score = scorer.score(disproportionality(3, 6.0, 7.0), bayesian(4.5, true),
                temporal(0.4), causality(0.8));

        assertThat(score).isCloseTo(0.3 * 1.0 + 0.4 * 1.0 + 0.2 * 0.4 + 0.1 * 0.8, within(1e-12));
    }

    @Test
    @DisplayName("Should borrow Bayesian and classical scores for missing temporal and causality")
    void shouldBorrowMissingComponents() {
        double score = scorer.score(disproportionality(1, 3.5, 3.5), bayesian(1.5, false), null, null);

        assertThat(score).isCloseTo(0.3 * 0.55 + 0.4 * 0.6 + 0.2 * 0.6 + 0.1 * 0.55, within(1e-12));
    }

    @Test
    @DisplayName("Should fall back to the neutral score when nothing was computed")
    void shouldUseMissingEvidenceScore() {
        assertThat(scorer.score(null, null, null, null)).isCloseTo(0.5, within(1e-12));
    }

    @Test
    @DisplayName("Should grade classical evidence by signal count and ratio size")
    void shouldGradeClassicalEvidence() {
        assertThat(EvidenceScorer.classical(disproportionality(0, 1.0, 1.0))).isEqualTo(0.2);
        assertThat(EvidenceScorer.classical(disproportionality(2, 4.0, 4.0))).isCloseTo(0.75, within(1e-12));
        assertThat(EvidenceScorer.classical(disproportionality(3, 10.0, 12.0))).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Should grade Bayesian evidence by EB05 and FDR significance")
    void shouldGradeBayesianEvidence() {
        assertThat(EvidenceScorer.bayesian(bayesian(0.5, false))).isEqualTo(0.30);
        assertThat(EvidenceScorer.bayesian(bayesian(1.2, false))).isEqualTo(0.60);
        assertThat(EvidenceScorer.bayesian(bayesian(2.5, true))).isCloseTo(0.85, within(1e-12));
        assertThat(EvidenceScorer.bayesian(bayesian(6.0, true))).isCloseTo(1.0, within(1e-12));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static DisproportionalityResult disproportionality(int signals, double prr, double ror) {
        return DisproportionalityResult.builder()
                .observed(10)
                .expected(2.0)
                .prr(new RatioEstimate("PRR", prr, prr / 2, prr * 2, signals >= 1))
                .ror(new RatioEstimate("ROR", ror, ror / 2, ror * 2, signals >= 2))
                .ic(new RatioEstimate("IC", 1.0, 0.5, 1.5, signals >= 3))
                .chiSquare(12.0, 0.001)
                .strength(SignalStrength.MODERATE)
                .build();
    }

    private static BayesianResult bayesian(double eb05, boolean fdrSignificant) {
        return BayesianResult.builder()
                .observed(10)
                .expected(2.0)
                .posterior(12.0, 3.0)
                .ebgm(eb05 + 1.0)
                .interval(eb05, eb05 + 2.0)
                .rawPValue(0.001)
                .adjustedPValue(fdrSignificant ? 0.01 : 0.2)
                .fdrSignificant(fdrSignificant)
                .strength(SignalStrength.MODERATE)
                .build();
    }

    private static TemporalResult temporal(double risk) {
        return TemporalResult.builder()
                .novelty(new NoveltyResult(400, 0.05, 0.2, 1.0, 0.3, false))
                .riskScore(risk, List.of())
                .build();
    }

    private static CausalityResult causality(double confidence) {
        return CausalityResult.builder()
                .whoUmc(WhoUmcCategory.PROBABLE, "test case")
                .confidence(confidence)
                .build();
    }
}
