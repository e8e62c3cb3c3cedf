package com.signalsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Classical disproportionality statistics for one contingency table.
 *
 * <p>
 * Carries PRR, ROR and IC estimates with their intervals, the Yates-corrected
 * chi-square test, Fisher's exact test when the counts are small, and an
 * overall {@link SignalStrength} grade.
 * </p>
 *
 * @since 1.0.0
 */
public final class DisproportionalityResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long observed;
    private final double expected;
    private final RatioEstimate prr;
    private final RatioEstimate ror;
    private final RatioEstimate ic;
    private final double chiSquare;
    private final double chiSquarePValue;
    private final Double fisherPValue;
    private final SignalStrength strength;

    private DisproportionalityResult(Builder b) {
        this.observed = b.observed;
        this.expected = b.expected;
        this.prr = Objects.requireNonNull(b.prr, "prr must not be null");
        this.ror = Objects.requireNonNull(b.ror, "ror must not be null");
        this.ic = Objects.requireNonNull(b.ic, "ic must not be null");
        this.chiSquare = b.chiSquare;
        this.chiSquarePValue = b.chiSquarePValue;
        this.fisherPValue = b.fisherPValue;
        this.strength = Objects.requireNonNull(b.strength, "strength must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public long getObserved() {
        return observed;
    }

    public double getExpected() {
        return expected;
    }

    public RatioEstimate getPrr() {
        return prr;
    }

    public RatioEstimate getRor() {
        return ror;
    }

    public RatioEstimate getIc() {
        return ic;
    }

    public double getChiSquare() {
        return chiSquare;
    }

    public double getChiSquarePValue() {
        return chiSquarePValue;
    }

    /**
     * @return Fisher's two-sided p-value; empty when the counts were large
     *         enough for the chi-square approximation
     */
    public OptionalDouble getFisherPValue() {
        return fisherPValue == null ? OptionalDouble.empty() : OptionalDouble.of(fisherPValue);
    }

    /**
     * P-value used for grading: Fisher's when present, chi-square otherwise.
     */
    public double getPValue() {
        return fisherPValue != null ? fisherPValue : chiSquarePValue;
    }

    /**
     * @return number of metrics (out of PRR, ROR, IC) that flag a signal
     */
    public int getSignalCount() {
        int count = 0;
        if (prr.isSignal())
            count++;
        if (ror.isSignal())
            count++;
        if (ic.isSignal())
            count++;
        return count;
    }

    /**
     * @return {@code true} if any of the three metrics flags a signal
     */
    public boolean isSignal() {
        return getSignalCount() > 0;
    }

    public SignalStrength getStrength() {
        return strength;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DisproportionalityResult that))
            return false;
        return observed == that.observed
                && Double.compare(expected, that.expected) == 0
                && Double.compare(chiSquare, that.chiSquare) == 0
                && Double.compare(chiSquarePValue, that.chiSquarePValue) == 0
                && Objects.equals(fisherPValue, that.fisherPValue)
                && prr.equals(that.prr)
                && ror.equals(that.ror)
                && ic.equals(that.ic)
                && strength == that.strength;
    }

    @Override
    public int hashCode() {
        return Objects.hash(observed, expected, prr, ror, ic, chiSquare, chiSquarePValue,
                fisherPValue, strength);
    }

    @Override
    public String toString() {
        return "DisproportionalityResult{" +
                "observed=" + observed +
                ", expected=" + String.format("%.3f", expected) +
                ", " + prr +
                ", " + ror +
                ", " + ic +
                ", chiSquare=" + String.format("%.3f", chiSquare) +
                ", strength=" + strength +
                '}';
    }

    /**
     * Fluent builder for {@link DisproportionalityResult}.
     */
    public static class Builder {
        private long observed;
        private double expected;
        private RatioEstimate prr;
        private RatioEstimate ror;
        private RatioEstimate ic;
        private double chiSquare;
        private double chiSquarePValue = 1.0;
        private Double fisherPValue;
        private SignalStrength strength = SignalStrength.NONE;

        public Builder observed(long v) {
            this.observed = v;
            return this;
        }

        public Builder expected(double v) {
            this.expected = v;
            return this;
        }

        public Builder prr(RatioEstimate v) {
            this.prr = v;
            return this;
        }

        public Builder ror(RatioEstimate v) {
            this.ror = v;
            return this;
        }

        public Builder ic(RatioEstimate v) {
            this.ic = v;
            return this;
        }

        public Builder chiSquare(double statistic, double pValue) {
            this.chiSquare = statistic;
            this.chiSquarePValue = pValue;
            return this;
        }

        public Builder fisherPValue(Double v) {
            this.fisherPValue = v;
            return this;
        }

        public Builder strength(SignalStrength v) {
            this.strength = v;
            return this;
        }

        public DisproportionalityResult build() {
            return new DisproportionalityResult(this);
        }
    }
}
