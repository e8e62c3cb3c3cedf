package com.signalsentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Case counts per {@link LatencyCategory} plus the median time to onset.
 *
 * <p>
 * Every category is present in {@link #getCounts()}, with zero where no case
 * fell into it. The median is empty when no onset was reported.
 * </p>
 *
 * @since 1.0.0
 */
public final class LatencyDistribution implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final LatencyDistribution EMPTY = new LatencyDistribution(Map.of(), null);

    private final Map<LatencyCategory, Integer> counts;
    private final Double medianDays;

    /**
     * @param counts     cases per category; missing categories count as zero
     * @param medianDays median onset in days, {@code null} when there were no
     *                   cases
     * @throws IllegalArgumentException if a count is negative, or the median
     *                                  is absent while cases were counted
     */
    public LatencyDistribution(Map<LatencyCategory, Integer> counts, Double medianDays) {
        Objects.requireNonNull(counts, "counts must not be null");
        EnumMap<LatencyCategory, Integer> copy = new EnumMap<>(LatencyCategory.class);
        int total = 0;
        for (LatencyCategory category : LatencyCategory.values()) {
            int count = counts.getOrDefault(category, 0);
            if (count < 0) {
                throw new IllegalArgumentException(category + " count must be >= 0, got: " + count);
            }
            copy.put(category, count);
            total += count;
        }
        if (total > 0 && medianDays == null) {
            throw new IllegalArgumentException("medianDays is required when cases were counted");
        }
        this.counts = Collections.unmodifiableMap(copy);
        this.medianDays = total > 0 ? medianDays : null;
    }

    public static LatencyDistribution empty() {
        return EMPTY;
    }

    public Map<LatencyCategory, Integer> getCounts() {
        return counts;
    }

    public int getCount(LatencyCategory category) {
        return counts.get(category);
    }

    public int getTotal() {
        int total = 0;
        for (int count : counts.values()) {
            total += count;
        }
        return total;
    }

    public boolean isEmpty() {
        return medianDays == null;
    }

    public OptionalDouble getMedianDays() {
        return medianDays == null ? OptionalDouble.empty() : OptionalDouble.of(medianDays);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LatencyDistribution that))
            return false;
        return counts.equals(that.counts) && Objects.equals(medianDays, that.medianDays);
    }

    @Override
    public int hashCode() {
        return Objects.hash(counts, medianDays);
    }

    @Override
    public String toString() {
        return "LatencyDistribution{counts=" + counts + ", medianDays=" + medianDays + '}';
    }
}
