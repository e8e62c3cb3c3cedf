package com.signalsentinel.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A period at which the mean reporting level shifts.
 *
 * @since 1.0.0
 */
public final class ChangePoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDate period;
    private final double meanBefore;
    private final double meanAfter;
    private final double pValue;
    private final boolean significant;

    public ChangePoint(LocalDate period, double meanBefore, double meanAfter, double pValue,
            boolean significant) {
        this.period = Objects.requireNonNull(period, "period must not be null");
        this.meanBefore = meanBefore;
        this.meanAfter = meanAfter;
        this.pValue = pValue;
        this.significant = significant;
    }

    public LocalDate getPeriod() {
        return period;
    }

    public double getMeanBefore() {
        return meanBefore;
    }

    public double getMeanAfter() {
        return meanAfter;
    }

    /**
     * @return {@code meanAfter / meanBefore}, infinite when the level was zero
     *         before
     */
    public double getFoldChange() {
        return meanBefore == 0 ? Double.POSITIVE_INFINITY : meanAfter / meanBefore;
    }

    public boolean isIncrease() {
        return meanAfter > meanBefore;
    }

    public double getPValue() {
        return pValue;
    }

    public boolean isSignificant() {
        return significant;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChangePoint that))
            return false;
        return Double.compare(meanBefore, that.meanBefore) == 0
                && Double.compare(meanAfter, that.meanAfter) == 0
                && Double.compare(pValue, that.pValue) == 0
                && significant == that.significant
                && period.equals(that.period);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, meanBefore, meanAfter, pValue, significant);
    }

    @Override
    public String toString() {
        return String.format("ChangePoint{%s %.2f -> %.2f p=%.3g}", period, meanBefore, meanAfter, pValue);
    }
}
