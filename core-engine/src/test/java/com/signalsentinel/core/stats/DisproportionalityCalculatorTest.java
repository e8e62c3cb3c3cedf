package com.signalsentinel.core.stats;

import com.signalsentinel.core.config.DisproportionalitySettings;
import com.signalsentinel.core.exception.InsufficientDataException;
import com.signalsentinel.core.model.ContingencyTable;
import com.signalsentinel.core.model.DisproportionalityResult;
import com.signalsentinel.core.model.RatioEstimate;
import com.signalsentinel.core.model.SignalStrength;
import org.apache.commons.math3.distribution.HypergeometricDistribution;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

/**
 * Unit tests for {@link DisproportionalityCalculator}.
 */
class DisproportionalityCalculatorTest {

    private DisproportionalityCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new DisproportionalityCalculator(new DisproportionalitySettings());
    }

    @Test
    @DisplayName("Should flag a clear signal on a large table")
    void shouldFlagClearSignal() {
        DisproportionalityResult result = calculator.calculate(new ContingencyTable(45, 955, 120, 9880));

        // (45/1000) / (120/10000)
        assertThat(result.getPrr().getValue()).isCloseTo(3.75, within(1e-9));
        assertThat(result.getPrr().getLower()).isCloseTo(2.68, within(0.01));
        assertThat(result.getPrr().getUpper()).isCloseTo(5.25, within(0.01));
        assertThat(result.getPrr().isSignal()).isTrue();
        assertThat(result.getRor().getValue()).isCloseTo(3.8796, within(1e-4));
        assertThat(result.getIc().isSignal()).isTrue();
        assertThat(result.getExpected()).isCloseTo(15.0, within(1e-9));
        assertThat(result.isSignal()).isTrue();
        assertThat(result.getSignalCount()).isEqualTo(3);
        assertThat(result.getFisherPValue()).isEmpty();
        assertThat(result.getPValue()).isLessThan(0.001);
        assertThat(result.getStrength()).isEqualTo(SignalStrength.VERY_STRONG);
    }

    @Test
    @DisplayName("Should not flag a signal below the minimum count")
    void shouldNotFlagBelowMinimumCount() {
        DisproportionalityResult result = calculator.calculate(new ContingencyTable(2, 955, 120, 9880));

        assertThat(result.getPrr().getValue()).isPositive();
        assertThat(result.isSignal()).isFalse();
    }

    @Test
    @DisplayName("Should not flag a signal below the minimum count even for a huge ratio")
    void shouldIgnoreHugeRatioBelowMinimumCount() {
        DisproportionalityResult result = calculator.calculate(new ContingencyTable(2, 8, 10, 10_000));

        assertThat(result.getPrr().getValue()).isGreaterThan(100.0);
        assertThat(result.getPrr().isSignal()).isFalse();
        assertThat(result.getRor().isSignal()).isFalse();
        assertThat(result.isSignal()).isFalse();
    }

    @Test
    @DisplayName("Should keep every metric finite when the observed count is zero")
    void shouldStayFiniteWithZeroObserved() {
        DisproportionalityResult result = calculator.calculate(new ContingencyTable(0, 100, 50, 10_000));

        for (RatioEstimate estimate : new RatioEstimate[] { result.getPrr(), result.getRor(), result.getIc() }) {
            assertThat(Double.isFinite(estimate.getValue())).as(estimate.getMetric()).isTrue();
            assertThat(estimate.getLower()).as(estimate.getMetric()).isLessThanOrEqualTo(estimate.getValue());
            assertThat(estimate.getUpper()).as(estimate.getMetric()).isGreaterThanOrEqualTo(estimate.getValue());
        }
        assertThat(result.isSignal()).isFalse();
        assertThat(result.getFisherPValue()).isPresent();
        assertThat(result.getStrength()).isEqualTo(SignalStrength.NONE);
    }

    @Test
    @DisplayName("Should grow PRR and ROR monotonically with the observed count")
    void shouldBeMonotoneInObservedCount() {
        ContingencyTable base = new ContingencyTable(1, 500, 80, 9000);
        double previousPrr = 0;
        double previousRor = 0;
        for (long a = 1; a <= 60; a++) {
            ContingencyTable table = base.withA(a);
            double prr = calculator.prr(table).getValue();
            double ror = calculator.ror(table).getValue();
            assertThat(prr).as("PRR at a=%d", a).isGreaterThan(previousPrr);
            assertThat(ror).as("ROR at a=%d", a).isGreaterThan(previousRor);
            previousPrr = prr;
            previousRor = ror;
        }
    }

    @Test
    @DisplayName("Should never decrease PRR or ROR from a = 0, zero cells included")
    void shouldBeMonotoneFromZeroAcrossZeroCellTables() {
        for (long b : GRID) {
            for (long c : GRID) {
                for (long d : GRID) {
                    RatioEstimate previousPrr = null;
                    RatioEstimate previousRor = null;
                    for (long a = 0; a <= 40; a++) {
                        ContingencyTable table = new ContingencyTable(a, b, c, d);
                        if (table.getTotal() == 0) {
                            continue;
                        }
                        RatioEstimate prr = calculator.prr(table);
                        RatioEstimate ror = calculator.ror(table);
                        assertOrderedInterval(prr, table);
                        assertOrderedInterval(ror, table);
                        if (previousPrr != null) {
                            assertThat(prr.getValue()).as("PRR %s", table)
                                    .isGreaterThanOrEqualTo(previousPrr.getValue() * (1 - 1e-12));
                            assertThat(ror.getValue()).as("ROR %s", table)
                                    .isGreaterThanOrEqualTo(previousRor.getValue() * (1 - 1e-12));
                        }
                        previousPrr = prr;
                        previousRor = ror;
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("Should never decrease IC while the observed count stays within both other margins")
    void shouldBeMonotoneInIcWhileObservedCountIsMinor() {
        for (long b : GRID) {
            for (long c : GRID) {
                for (long d : GRID) {
                    // IC is monotone while a <= min(b, c); beyond that E grows faster than a
                    long limit = Math.min(40, Math.min(b, c));
                    for (long a = 0; a + 1 <= limit; a++) {
                        ContingencyTable table = new ContingencyTable(a, b, c, d);
                        double ic = calculator.ic(table).getValue();
                        double next = calculator.ic(table.withA(a + 1)).getValue();
                        assertThat(next).as("IC %s -> a=%d", table, a + 1).isGreaterThanOrEqualTo(ic - 1e-12);
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("Should let IC fall once the observed count dominates its margins")
    void shouldLetIcFallWhenObservedCountDominates() {
        ContingencyTable table = new ContingencyTable(2, 0, 0, 1);

        double ic = calculator.ic(table).getValue();
        double next = calculator.ic(table.withA(3)).getValue();

        // log2(2.5 / (4/3 + 0.5)) then log2(3.5 / (9/4 + 0.5))
        assertThat(ic).isCloseTo(Math.log(2.5 / (4.0 / 3 + 0.5)) / Math.log(2), within(1e-12));
        assertThat(next).isLessThan(ic);
    }

    @Test
    @DisplayName("Should throw InsufficientDataException for an empty table")
    void shouldRejectEmptyTable() {
        assertThatThrownBy(() -> calculator.calculate(new ContingencyTable(0, 0, 0, 0)))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("N = 0");
    }

    @Test
    @DisplayName("Should compute Fisher's two-sided exact p-value")
    void shouldComputeFisherExact() {
        // P(k) = C(4,k)C(4,4-k)/70; tables no more likely than k=3 sum to 34/70
        Double p = calculator.fisherExactTwoSided(new ContingencyTable(3, 1, 1, 3));

        assertThat(p).isCloseTo(34.0 / 70.0, within(1e-9));
    }

    @Test
    @DisplayName("Should match the full-support Fisher sum when walking out from the mode")
    void shouldMatchFullSupportFisherSum() {
        ContingencyTable[] tables = {
                new ContingencyTable(2, 3_000, 3_000, 50_000),
                new ContingencyTable(0, 40, 25, 900),
                new ContingencyTable(4, 1, 0, 7),
                new ContingencyTable(1, 9, 600, 30)
        };
        for (ContingencyTable table : tables) {
            assertThat(calculator.fisherExactTwoSided(table)).as("%s", table)
                    .isCloseTo(fullSupportFisher(table), within(1e-12));
        }
    }

    @Test
    @DisplayName("Should compute Fisher's p-value for huge margins without walking the whole support")
    void shouldComputeFisherForHugeMargins() {
        ContingencyTable table = new ContingencyTable(3, 20_000_000, 20_000_000, 500_000_000);

        Double p = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> calculator.fisherExactTwoSided(table));

        // E is about 741 001, so three reports lie far in the lower tail
        assertThat(p).isNotNull().isBetween(0.0, 1e-12);
    }

    @Test
    @DisplayName("Should compute Yates-corrected chi-square")
    void shouldComputeYatesChiSquare() {
        double chi = calculator.yatesChiSquare(new ContingencyTable(10, 20, 30, 40));

        assertThat(chi).isCloseTo(2_250_000.0 / 5_040_000.0, within(1e-9));
    }

    @Test
    @DisplayName("Should honour a stricter PRR threshold")
    void shouldHonourConfiguredThreshold() {
        DisproportionalitySettings strict = new DisproportionalitySettings();
        strict.setPrrThreshold(4.0);
        DisproportionalityCalculator strictCalculator = new DisproportionalityCalculator(strict);

        RatioEstimate prr = strictCalculator.prr(new ContingencyTable(45, 955, 120, 9880));

        assertThat(prr.isSignal()).isFalse();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static final long[] GRID = { 0, 1, 2, 3, 5, 10, 100, 1000 };

    private static void assertOrderedInterval(RatioEstimate estimate, ContingencyTable table) {
        assertThat(estimate.getValue()).as("%s %s", estimate.getMetric(), table).isFinite().isNotNegative();
        assertThat(estimate.getLower()).as("%s lower %s", estimate.getMetric(), table)
                .isLessThanOrEqualTo(estimate.getValue());
        assertThat(estimate.getUpper()).as("%s upper %s", estimate.getMetric(), table)
                .isGreaterThanOrEqualTo(estimate.getValue());
    }

    private static double fullSupportFisher(ContingencyTable table) {
        HypergeometricDistribution hyper = new HypergeometricDistribution(null, (int) table.getTotal(),
                (int) table.getEventTotal(), (int) table.getDrugTotal());
        double observedLog = hyper.logProbability((int) table.getA());
        double p = 0.0;
        for (int k = hyper.getSupportLowerBound(); k <= hyper.getSupportUpperBound(); k++) {
            double logP = hyper.logProbability(k);
            if (logP <= observedLog + 1e-7) {
                p += Math.exp(logP);
            }
        }
        return Math.min(1.0, p);
    }
}
