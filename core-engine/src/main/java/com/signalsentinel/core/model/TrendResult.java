package com.signalsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Log-linear trend fitted over the most recent reporting periods.
 *
 * <p>
 * The slope is in natural-log units per period. When the trend is
 * significant, {@link #getDoublingPeriods()} reports the number of periods it
 * takes the count to double (increasing) or halve (decreasing).
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final TrendDirection direction;
    private final double slope;
    private final double rSquared;
    private final double pValue;
    private final int pointsUsed;
    private final Double doublingPeriods;

    public TrendResult(TrendDirection direction, double slope, double rSquared, double pValue,
            int pointsUsed, Double doublingPeriods) {
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.slope = slope;
        this.rSquared = rSquared;
        this.pValue = pValue;
        this.pointsUsed = pointsUsed;
        this.doublingPeriods = doublingPeriods;
    }

    public TrendDirection getDirection() {
        return direction;
    }

    public double getSlope() {
        return slope;
    }

    public double getRSquared() {
        return rSquared;
    }

    public double getPValue() {
        return pValue;
    }

    public int getPointsUsed() {
        return pointsUsed;
    }

    public boolean isSignificant() {
        return direction != TrendDirection.STABLE;
    }

    public OptionalDouble getDoublingPeriods() {
        return doublingPeriods == null ? OptionalDouble.empty() : OptionalDouble.of(doublingPeriods);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendResult that))
            return false;
        return direction == that.direction
                && Double.compare(slope, that.slope) == 0
                && Double.compare(rSquared, that.rSquared) == 0
                && Double.compare(pValue, that.pValue) == 0
                && pointsUsed == that.pointsUsed
                && Objects.equals(doublingPeriods, that.doublingPeriods);
    }

    @Override
    public int hashCode() {
        return Objects.hash(direction, slope, rSquared, pValue, pointsUsed, doublingPeriods);
    }

    @Override
    public String toString() {
        return String.format("TrendResult{%s slope=%.4f r2=%.3f p=%.3g}", direction, slope, rSquared, pValue);
    }
}
