package com.signalsentinel.core.bayes;

import com.signalsentinel.core.config.BayesianSettings;
import com.signalsentinel.core.model.ContingencyTable;
import com.signalsentinel.core.model.ShrinkagePrior;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ShrinkagePriorEstimator}.
 */
class ShrinkagePriorEstimatorTest {

    private ShrinkagePriorEstimator estimator;

    @BeforeEach
    void setUp() {
        estimator = new ShrinkagePriorEstimator(new BayesianSettings());
    }

    @Test
    @DisplayName("Should fit shape and rate by the method of moments")
    void shouldFitByMomentMatching() {
        // observed/expected ratios 1, 2, 3 -> mean 2, population variance 2/3
        ShrinkagePrior prior = estimator.fit(List.of(tableWithRatio(1), tableWithRatio(2), tableWithRatio(3)));

        assertThat(prior.getRate()).isCloseTo(3.0, within(1e-9));
        assertThat(prior.getShape()).isCloseTo(6.0, within(1e-9));
        assertThat(prior.getFittedFrom()).isEqualTo(3);
        assertThat(prior.isLowConfidence()).isFalse();
    }

    @Test
    @DisplayName("Should fall back to the default prior with too few usable tables")
    void shouldFallBackToDefaultPrior() {
        ShrinkagePrior prior = estimator.fit(List.of(tableWithRatio(4), new ContingencyTable(0, 0, 0, 0)));

        assertThat(prior.getShape()).isEqualTo(ShrinkagePrior.DEFAULT_SHAPE);
        assertThat(prior.getRate()).isEqualTo(ShrinkagePrior.DEFAULT_RATE);
        assertThat(prior.isLowConfidence()).isTrue();
    }

    @Test
    @DisplayName("Should use shape 2 when every ratio is identical")
    void shouldHandleZeroVariance() {
        ShrinkagePrior prior = estimator.fit(List.of(tableWithRatio(2), tableWithRatio(2)));

        assertThat(prior.getShape()).isEqualTo(2.0);
        assertThat(prior.getRate()).isCloseTo(1.0, within(1e-12));
        assertThat(prior.getMean()).isCloseTo(2.0, within(1e-12));
    }

    @Test
    @DisplayName("Should clamp extreme parameters to the configured range")
    void shouldClampExtremeParameters() {
        // nearly identical ratios give a tiny variance and a huge rate
        ContingencyTable t1 = new ContingencyTable(1000, 9000, 9000, 81_000_000);
        ContingencyTable t2 = new ContingencyTable(1001, 8999, 9000, 81_000_000);

        ShrinkagePrior prior = estimator.fit(List.of(t1, t2));

        assertThat(prior.getRate()).isEqualTo(10.0);
        assertThat(prior.getShape()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Should produce the same prior regardless of input order")
    void shouldBeOrderIndependentForSameSet() {
        List<ContingencyTable> forward = List.of(tableWithRatio(1), tableWithRatio(3), tableWithRatio(5));
        List<ContingencyTable> backward = List.of(tableWithRatio(5), tableWithRatio(3), tableWithRatio(1));

        assertThat(estimator.fit(forward).getRate()).isCloseTo(estimator.fit(backward).getRate(), within(1e-12));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Table with drug total 100, event total 100 and N = 10000, so E = 1. */
    static ContingencyTable tableWithRatio(long a) {
        return new ContingencyTable(a, 100 - a, 100 - a, 10_000 - 200 + a);
    }
}
