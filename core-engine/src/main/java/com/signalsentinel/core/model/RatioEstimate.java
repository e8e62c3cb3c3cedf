package com.signalsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A point estimate with its 95% interval and the signal verdict of the
 * metric that produced it.
 *
 * @since 1.0.0
 */
public final class RatioEstimate implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metric;
    private final double value;
    private final double lower;
    private final double upper;
    private final boolean signal;

    public RatioEstimate(String metric, double value, double lower, double upper, boolean signal) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.value = value;
        this.lower = lower;
        this.upper = upper;
        this.signal = signal;
    }

    public String getMetric() {
        return metric;
    }

    public double getValue() {
        return value;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    public boolean isSignal() {
        return signal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RatioEstimate that))
            return false;
        return Double.compare(value, that.value) == 0
                && Double.compare(lower, that.lower) == 0
                && Double.compare(upper, that.upper) == 0
                && signal == that.signal
                && metric.equals(that.metric);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, value, lower, upper, signal);
    }

    @Override
    public String toString() {
        return String.format("%s=%.4f [%.4f, %.4f]%s", metric, value, lower, upper,
                signal ? " signal" : "");
    }
}
