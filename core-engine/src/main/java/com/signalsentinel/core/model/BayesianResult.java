package com.signalsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Empirical-Bayes shrunk estimate for one drug-event pair.
 *
 * <p>
 * The raw tail probability is filled in by the per-pair posterior step; the
 * adjusted p-value and {@code fdrSignificant} flag are attached afterwards,
 * once the whole batch has been corrected for multiple testing, via
 * {@link #withAdjustment(double, boolean)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class BayesianResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long observed;
    private final double expected;
    private final double posteriorShape;
    private final double posteriorRate;
    private final double ebgm;
    private final double eb05;
    private final double eb95;
    private final double rawPValue;
    private final double adjustedPValue;
    private final boolean fdrSignificant;
    private final boolean signal;
    private final boolean lowConfidence;
    private final SignalStrength strength;

    private BayesianResult(Builder b) {
        this.observed = b.observed;
        this.expected = b.expected;
        this.posteriorShape = b.posteriorShape;
        this.posteriorRate = b.posteriorRate;
        this.ebgm = b.ebgm;
        this.eb05 = b.eb05;
        this.eb95 = b.eb95;
        this.rawPValue = b.rawPValue;
        this.adjustedPValue = b.adjustedPValue;
        this.fdrSignificant = b.fdrSignificant;
        this.signal = b.signal;
        this.lowConfidence = b.lowConfidence;
        this.strength = Objects.requireNonNull(b.strength, "strength must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy of this result carrying the batch-level multiple-testing outcome.
     *
     * @param adjusted       Benjamini–Hochberg adjusted p-value
     * @param fdrSignificant whether {@code adjusted} is within the FDR target
     * @return a new result; this instance is unchanged
     */
    public BayesianResult withAdjustment(double adjusted, boolean fdrSignificant) {
        return toBuilder()
                .adjustedPValue(adjusted)
                .fdrSignificant(fdrSignificant)
                .build();
    }

    private Builder toBuilder() {
        return new Builder()
                .observed(observed)
                .expected(expected)
                .posterior(posteriorShape, posteriorRate)
                .ebgm(ebgm)
                .interval(eb05, eb95)
                .rawPValue(rawPValue)
                .adjustedPValue(adjustedPValue)
                .fdrSignificant(fdrSignificant)
                .signal(signal)
                .lowConfidence(lowConfidence)
                .strength(strength);
    }

    public long getObserved() {
        return observed;
    }

    public double getExpected() {
        return expected;
    }

    public double getPosteriorShape() {
        return posteriorShape;
    }

    public double getPosteriorRate() {
        return posteriorRate;
    }

    /** Empirical Bayes geometric mean of the posterior. */
    public double getEbgm() {
        return ebgm;
    }

    /** 5th percentile of the posterior. */
    public double getEb05() {
        return eb05;
    }

    /** 95th percentile of the posterior. */
    public double getEb95() {
        return eb95;
    }

    /** Posterior probability that the relative reporting rate is at most 1. */
    public double getRawPValue() {
        return rawPValue;
    }

    public double getAdjustedPValue() {
        return adjustedPValue;
    }

    public boolean isFdrSignificant() {
        return fdrSignificant;
    }

    public boolean isSignal() {
        return signal;
    }

    public boolean isLowConfidence() {
        return lowConfidence;
    }

    public SignalStrength getStrength() {
        return strength;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BayesianResult that))
            return false;
        return observed == that.observed
                && Double.compare(expected, that.expected) == 0
                && Double.compare(posteriorShape, that.posteriorShape) == 0
                && Double.compare(posteriorRate, that.posteriorRate) == 0
                && Double.compare(ebgm, that.ebgm) == 0
                && Double.compare(eb05, that.eb05) == 0
                && Double.compare(eb95, that.eb95) == 0
                && Double.compare(rawPValue, that.rawPValue) == 0
                && Double.compare(adjustedPValue, that.adjustedPValue) == 0
                && fdrSignificant == that.fdrSignificant
                && signal == that.signal
                && lowConfidence == that.lowConfidence
                && strength == that.strength;
    }

    @Override
    public int hashCode() {
        return Objects.hash(observed, expected, ebgm, eb05, eb95, rawPValue, adjustedPValue,
                fdrSignificant, signal, lowConfidence, strength);
    }

    @Override
    public String toString() {
        return String.format(
                "BayesianResult{observed=%d, expected=%.3f, ebgm=%.4f, eb05=%.4f, eb95=%.4f, "
                        + "p=%.4g, adjusted=%.4g, signal=%s, lowConfidence=%s}",
                observed, expected, ebgm, eb05, eb95, rawPValue, adjustedPValue, signal,
                lowConfidence);
    }

    /**
     * Fluent builder for {@link BayesianResult}.
     */
    public static class Builder {
        private long observed;
        private double expected;
        private double posteriorShape;
        private double posteriorRate;
        private double ebgm;
        private double eb05;
        private double eb95;
        private double rawPValue = 1.0;
        private double adjustedPValue = 1.0;
        private boolean fdrSignificant;
        private boolean signal;
        private boolean lowConfidence;
        private SignalStrength strength = SignalStrength.NONE;

        public Builder observed(long v) {
            this.observed = v;
            return this;
        }

        public Builder expected(double v) {
            this.expected = v;
            return this;
        }

        public Builder posterior(double shape, double rate) {
            this.posteriorShape = shape;
            this.posteriorRate = rate;
            return this;
        }

        public Builder ebgm(double v) {
            this.ebgm = v;
            return this;
        }

        public Builder interval(double lower, double upper) {
            this.eb05 = lower;
            this.eb95 = upper;
            return this;
        }

        public Builder rawPValue(double v) {
            this.rawPValue = v;
            return this;
        }

        public Builder adjustedPValue(double v) {
            this.adjustedPValue = v;
            return this;
        }

        public Builder fdrSignificant(boolean v) {
            this.fdrSignificant = v;
            return this;
        }

        public Builder signal(boolean v) {
            this.signal = v;
            return this;
        }

        public Builder lowConfidence(boolean v) {
            this.lowConfidence = v;
            return this;
        }

        public Builder strength(SignalStrength v) {
            this.strength = v;
            return this;
        }

        public BayesianResult build() {
            return new BayesianResult(this);
        }
    }
}
