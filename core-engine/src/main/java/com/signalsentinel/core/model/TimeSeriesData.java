package com.signalsentinel.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered report counts for one drug-event pair.
 *
 * <p>
 * Periods must be strictly increasing at the series' granularity: two points
 * falling in the same bucket, or a point earlier than its predecessor, are
 * rejected at construction.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeriesData implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<TimePoint> points;
    private final ReportingGranularity granularity;

    /**
     * @throws IllegalArgumentException if periods are out of order or
     *                                  duplicated
     */
    public TimeSeriesData(List<TimePoint> points, ReportingGranularity granularity) {
        Objects.requireNonNull(points, "points must not be null");
        this.granularity = Objects.requireNonNull(granularity, "granularity must not be null");

        LocalDate previous = null;
        for (TimePoint point : points) {
            Objects.requireNonNull(point, "time point must not be null");
            LocalDate bucket = granularity.bucketOf(point.getPeriod());
            if (previous != null) {
                if (bucket.equals(previous)) {
                    throw new IllegalArgumentException(
                            "Duplicate " + granularity + " period in time series: " + point.getPeriod());
                }
                if (bucket.isBefore(previous)) {
                    throw new IllegalArgumentException(
                            "Time series out of order at " + point.getPeriod() + " (after " + previous + ")");
                }
            }
            previous = bucket;
        }
        this.points = List.copyOf(points);
    }

    /**
     * Convenience factory for evenly spaced counts starting at {@code start}.
     */
    public static TimeSeriesData of(LocalDate start, ReportingGranularity granularity, long... counts) {
        List<TimePoint> points = new ArrayList<>(counts.length);
        LocalDate bucket = granularity.bucketOf(start);
        for (int i = 0; i < counts.length; i++) {
            points.add(new TimePoint(bucket.plus(i, granularity.getUnit()), counts[i]));
        }
        return new TimeSeriesData(points, granularity);
    }

    public List<TimePoint> getPoints() {
        return points;
    }

    public ReportingGranularity getGranularity() {
        return granularity;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public long getTotalCount() {
        long total = 0;
        for (TimePoint p : points) {
            total += p.getCount();
        }
        return total;
    }

    /**
     * @return the first period with at least one report
     */
    public Optional<LocalDate> getFirstReportPeriod() {
        return points.stream()
                .filter(p -> p.getCount() > 0)
                .map(TimePoint::getPeriod)
                .findFirst();
    }

    /**
     * @return the last period with at least one report
     */
    public Optional<LocalDate> getLastReportPeriod() {
        for (int i = points.size() - 1; i >= 0; i--) {
            if (points.get(i).getCount() > 0) {
                return Optional.of(points.get(i).getPeriod());
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeSeriesData that))
            return false;
        return granularity == that.granularity && points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(points, granularity);
    }

    @Override
    public String toString() {
        return "TimeSeriesData{granularity=" + granularity + ", points=" + points.size() + '}';
    }
}
