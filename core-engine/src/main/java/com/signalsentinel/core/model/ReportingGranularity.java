package com.signalsentinel.core.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Bucket size of a reporting time series.
 *
 * @since 1.0.0
 */
public enum ReportingGranularity {

    DAY(ChronoUnit.DAYS),
    WEEK(ChronoUnit.WEEKS),
    MONTH(ChronoUnit.MONTHS);

    private final ChronoUnit unit;

    ReportingGranularity(ChronoUnit unit) {
        this.unit = unit;
    }

    public ChronoUnit getUnit() {
        return unit;
    }

    /**
     * Start of the bucket containing {@code date}: the date itself, the
     * Monday of its week, or the first of its month.
     */
    public LocalDate bucketOf(LocalDate date) {
        return switch (this) {
            case DAY -> date;
            case WEEK -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> date.withDayOfMonth(1);
        };
    }

    /**
     * Whole periods elapsed between the buckets of two dates.
     */
    public long periodsBetween(LocalDate from, LocalDate to) {
        return unit.between(bucketOf(from), bucketOf(to));
    }
}
