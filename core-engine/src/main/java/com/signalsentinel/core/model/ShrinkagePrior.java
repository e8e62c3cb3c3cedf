package com.signalsentinel.core.model;

import java.io.Serializable;

/**
 * Gamma shrinkage prior fitted once per batch.
 *
 * <p>
 * Produced by a dedicated aggregation step over every pair in the batch and
 * then shared read-only by the per-pair posterior computations. Never mutated
 * after construction; a fresh instance is fitted for every batch.
 * </p>
 *
 * @since 1.0.0
 */
public final class ShrinkagePrior implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Shape used when the batch is too small to fit a prior. */
    public static final double DEFAULT_SHAPE = 2.0;

    /** Rate used when the batch is too small to fit a prior. */
    public static final double DEFAULT_RATE = 4.0;

    private final double shape;
    private final double rate;
    private final int fittedFrom;
    private final boolean lowConfidence;

    /**
     * @param shape         Gamma shape, must be &gt; 0
     * @param rate          Gamma rate, must be &gt; 0
     * @param fittedFrom    number of observed/expected ratios used in the fit
     * @param lowConfidence {@code true} when the default prior stands in for a
     *                      fitted one
     * @throws IllegalArgumentException if {@code shape} or {@code rate} is not
     *                                  strictly positive
     */
    public ShrinkagePrior(double shape, double rate, int fittedFrom, boolean lowConfidence) {
        if (!(shape > 0) || !Double.isFinite(shape)) {
            throw new IllegalArgumentException("Prior shape must be > 0, got: " + shape);
        }
        if (!(rate > 0) || !Double.isFinite(rate)) {
            throw new IllegalArgumentException("Prior rate must be > 0, got: " + rate);
        }
        this.shape = shape;
        this.rate = rate;
        this.fittedFrom = fittedFrom;
        this.lowConfidence = lowConfidence;
    }

    /**
     * @return the fallback prior Gamma(2.0, 4.0), flagged low-confidence
     */
    public static ShrinkagePrior defaultPrior() {
        return new ShrinkagePrior(DEFAULT_SHAPE, DEFAULT_RATE, 0, true);
    }

    public double getShape() {
        return shape;
    }

    public double getRate() {
        return rate;
    }

    /** Prior mean of the relative reporting rate, {@code shape / rate}. */
    public double getMean() {
        return shape / rate;
    }

    public int getFittedFrom() {
        return fittedFrom;
    }

    public boolean isLowConfidence() {
        return lowConfidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ShrinkagePrior that))
            return false;
        return Double.compare(shape, that.shape) == 0
                && Double.compare(rate, that.rate) == 0
                && fittedFrom == that.fittedFrom
                && lowConfidence == that.lowConfidence;
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(shape, rate, fittedFrom, lowConfidence);
    }

    @Override
    public String toString() {
        return String.format("ShrinkagePrior{shape=%.4f, rate=%.4f, fittedFrom=%d%s}",
                shape, rate, fittedFrom, lowConfidence ? ", lowConfidence" : "");
    }
}
