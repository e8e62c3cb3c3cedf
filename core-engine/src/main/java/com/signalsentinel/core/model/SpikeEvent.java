package com.signalsentinel.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A reporting period whose count stands out from its trailing baseline.
 *
 * @since 1.0.0
 */
public final class SpikeEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDate period;
    private final long observed;
    private final double baselineMean;
    private final double zScore;
    private final double foldIncrease;
    private final double pValue;

    public SpikeEvent(LocalDate period, long observed, double baselineMean, double zScore,
            double foldIncrease, double pValue) {
        this.period = Objects.requireNonNull(period, "period must not be null");
        this.observed = observed;
        this.baselineMean = baselineMean;
        this.zScore = zScore;
        this.foldIncrease = foldIncrease;
        this.pValue = pValue;
    }

    public LocalDate getPeriod() {
        return period;
    }

    public long getObserved() {
        return observed;
    }

    public double getBaselineMean() {
        return baselineMean;
    }

    public double getZScore() {
        return zScore;
    }

    /** Observed count divided by the baseline mean. */
    public double getFoldIncrease() {
        return foldIncrease;
    }

    /** Poisson upper-tail probability of the observed count. */
    public double getPValue() {
        return pValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SpikeEvent that))
            return false;
        return observed == that.observed
                && Double.compare(baselineMean, that.baselineMean) == 0
                && Double.compare(zScore, that.zScore) == 0
                && Double.compare(foldIncrease, that.foldIncrease) == 0
                && Double.compare(pValue, that.pValue) == 0
                && period.equals(that.period);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, observed, baselineMean, zScore, foldIncrease, pValue);
    }

    @Override
    public String toString() {
        return String.format("SpikeEvent{%s observed=%d baseline=%.2f z=%.2f fold=%.2f p=%.3g}",
                period, observed, baselineMean, zScore, foldIncrease, pValue);
    }
}
