package com.signalsentinel.core.model;

/**
 * Time-to-onset buckets, from first exposure to the reaction.
 *
 * @since 1.0.0
 */
public enum LatencyCategory {
    /** Within a day. */
    IMMEDIATE(1),
    /** Two to seven days. */
    EARLY(7),
    /** Eight to thirty days. */
    DELAYED(30),
    /** 31 to 90 days. */
    LATE(90),
    /** More than 90 days. */
    VERY_LATE(Integer.MAX_VALUE);

    private final int maxDays;

    LatencyCategory(int maxDays) {
        this.maxDays = maxDays;
    }

    /** Inclusive upper bound of the bucket in days. */
    public int getMaxDays() {
        return maxDays;
    }

    /**
     * @throws IllegalArgumentException if {@code days} is negative
     */
    public static LatencyCategory of(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("Time to onset must be >= 0 days, got: " + days);
        }
        for (LatencyCategory category : values()) {
            if (days <= category.maxDays) {
                return category;
            }
        }
        return VERY_LATE;
    }
}
