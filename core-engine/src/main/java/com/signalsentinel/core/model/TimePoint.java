package com.signalsentinel.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Report count for one reporting period.
 *
 * @since 1.0.0
 */
public final class TimePoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDate period;
    private final long count;

    /**
     * @throws IllegalArgumentException if {@code count} is negative
     */
    public TimePoint(LocalDate period, long count) {
        this.period = Objects.requireNonNull(period, "period must not be null");
        if (count < 0) {
            throw new IllegalArgumentException(
                    "Report count must be >= 0 for period " + period + ", got: " + count);
        }
        this.count = count;
    }

    public LocalDate getPeriod() {
        return period;
    }

    public long getCount() {
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimePoint that))
            return false;
        return count == that.count && period.equals(that.period);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, count);
    }

    @Override
    public String toString() {
        return period + "=" + count;
    }
}
