package com.signalsentinel.core.temporal;

import com.signalsentinel.core.config.TemporalSettings;
import com.signalsentinel.core.model.ChangePoint;
import com.signalsentinel.core.model.TimeSeriesData;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.inference.TTest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Mean-shift change points by a single-split scan.
 *
 * <p>
 * Every split leaving at least {@code changePointMinSegment} periods on each
 * side is a candidate when the two segment means differ by at least
 * {@code changePointMinRatio}. Candidates are ranked by total within-segment
 * squared error (lowest first); the best {@code maxChangePoints} that are at
 * least one segment apart are reported. Welch's t-test on the two segments
 * gives the p-value.
 * </p>
 *
 * @since 1.0.0
 */
public class ChangePointDetector {

    private final TemporalSettings settings;
    private final TTest tTest = new TTest();

    public ChangePointDetector(TemporalSettings settings) {
        this.settings = Objects.requireNonNull(settings, "TemporalSettings must not be null");
    }

    /**
     * @return change points ordered by fit quality; empty for series shorter
     *         than two segments
     */
    public List<ChangePoint> detect(TimeSeriesData series) {
        Objects.requireNonNull(series, "TimeSeriesData must not be null");
        int minSegment = settings.getChangePointMinSegment();
        int n = series.size();
        List<ChangePoint> result = new ArrayList<>();
        if (n < 2 * minSegment || settings.getMaxChangePoints() == 0) {
            return result;
        }

        double[] counts = new double[n];
        for (int i = 0; i < n; i++) {
            counts[i] = series.getPoints().get(i).getCount();
        }

        List<double[]> candidates = new ArrayList<>();
        for (int split = minSegment; split <= n - minSegment; split++) {
            double[] before = Arrays.copyOfRange(counts, 0, split);
            double[] after = Arrays.copyOfRange(counts, split, n);
            double meanBefore = StatUtils.mean(before);
            double meanAfter = StatUtils.mean(after);
            if (!shiftLargeEnough(meanBefore, meanAfter)) {
                continue;
            }
            double cost = squaredError(before, meanBefore) + squaredError(after, meanAfter);
            candidates.add(new double[] { split, cost });
        }

        candidates.sort(Comparator.<double[]>comparingDouble(c -> c[1]).thenComparingDouble(c -> c[0]));

        List<Integer> chosen = new ArrayList<>();
        for (double[] candidate : candidates) {
            if (chosen.size() >= settings.getMaxChangePoints()) {
                break;
            }
            int split = (int) candidate[0];
            boolean separated = chosen.stream().allMatch(c -> Math.abs(c - split) >= minSegment);
            if (separated) {
                chosen.add(split);
            }
        }

        for (int split : chosen) {
            double[] before = Arrays.copyOfRange(counts, 0, split);
            double[] after = Arrays.copyOfRange(counts, split, n);
            double p = welchPValue(before, after);
            result.add(new ChangePoint(series.getPoints().get(split).getPeriod(),
                    StatUtils.mean(before), StatUtils.mean(after), p,
                    p < settings.getChangePointSignificance()));
        }
        return result;
    }

    private boolean shiftLargeEnough(double meanBefore, double meanAfter) {
        double low = Math.min(meanBefore, meanAfter);
        double high = Math.max(meanBefore, meanAfter);
        if (low == 0) {
            return high > 0;
        }
        return high / low >= settings.getChangePointMinRatio();
    }

    private double welchPValue(double[] before, double[] after) {
        if (StatUtils.variance(before) == 0 && StatUtils.variance(after) == 0) {
            return StatUtils.mean(before) == StatUtils.mean(after) ? 1.0 : 0.0;
        }
        return tTest.tTest(before, after);
    }

    private static double squaredError(double[] values, double mean) {
        double sse = 0;
        for (double v : values) {
            double diff = v - mean;
            sse += diff * diff;
        }
        return sse;
    }
}
