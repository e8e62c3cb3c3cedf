package com.signalsentinel.core.temporal;

import com.signalsentinel.core.model.LatencyCategory;
import com.signalsentinel.core.model.LatencyDistribution;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Buckets per-case time to onset into {@link LatencyCategory} counts and
 * takes the median.
 *
 * <p>
 * The median of an even number of cases is the mean of the two middle
 * values.
 * </p>
 *
 * @since 1.0.0
 */
public class LatencyAnalyzer {

    /**
     * @param onsetDays days from first exposure to onset, one per case
     * @return the distribution; {@link LatencyDistribution#empty()} when no
     *         onset was reported
     * @throws IllegalArgumentException if an onset is negative
     */
    public LatencyDistribution analyze(List<Integer> onsetDays) {
        Objects.requireNonNull(onsetDays, "onsetDays must not be null");
        if (onsetDays.isEmpty()) {
            return LatencyDistribution.empty();
        }

        Map<LatencyCategory, Integer> counts = new EnumMap<>(LatencyCategory.class);
        double[] values = new double[onsetDays.size()];
        for (int i = 0; i < values.length; i++) {
            int days = onsetDays.get(i);
            counts.merge(LatencyCategory.of(days), 1, Integer::sum);
            values[i] = days;
        }
        return new LatencyDistribution(counts, new Median().evaluate(values));
    }
}
