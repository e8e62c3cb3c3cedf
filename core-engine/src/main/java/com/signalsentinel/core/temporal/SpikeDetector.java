package com.signalsentinel.core.temporal;

import com.signalsentinel.core.config.TemporalSettings;
import com.signalsentinel.core.model.SpikeEvent;
import com.signalsentinel.core.model.TimePoint;
import com.signalsentinel.core.model.TimeSeriesData;
import org.apache.commons.math3.distribution.PoissonDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rolling-baseline spike detector.
 *
 * <p>
 * Every point after the first {@code spikeWindow} periods is compared with
 * the mean and population standard deviation of the window that precedes it.
 * A point is a spike when its z-score exceeds {@code spikeZThreshold}.
 * </p>
 *
 * <h3>Flat baselines</h3>
 * <p>
 * A standard deviation of zero falls back to {@code sqrt(mean)} (Poisson
 * approximation). A baseline of all zeros has no spread at all, so its
 * z-score is zero and no spike is reported against it.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * Series no longer than the window produce no spikes. This is not an error.
 * </p>
 *
 * @since 1.0.0
 */
public class SpikeDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SpikeDetector.class);

    private final int windowSize;
    private final double zThreshold;
    private final int recentDays;

    public SpikeDetector(TemporalSettings settings) {
        Objects.requireNonNull(settings, "TemporalSettings must not be null");
        this.windowSize = settings.getSpikeWindow();
        this.zThreshold = settings.getSpikeZThreshold();
        this.recentDays = settings.getRecentSpikeDays();
    }

    /**
     * @return spikes in chronological order; empty when the series is
     *         shorter than the window
     */
    public List<SpikeEvent> detect(TimeSeriesData series) {
        Objects.requireNonNull(series, "TimeSeriesData must not be null");
        List<TimePoint> points = series.getPoints();
        List<SpikeEvent> spikes = new ArrayList<>();

        if (points.size() <= windowSize) {
            LOG.trace("Series of {} point(s) shorter than spike window {}; skipping", points.size(), windowSize);
            return spikes;
        }

        for (int i = windowSize; i < points.size(); i++) {
            double mean = computeMean(points, i - windowSize, i);
            double stddev = computeStdDev(points, i - windowSize, i, mean);

            double sigma = stddev > 0 ? stddev : Math.sqrt(mean);
            long observed = points.get(i).getCount();
            double z = sigma > 0 ? (observed - mean) / sigma : 0.0;
            if (z > zThreshold) {
                double fold = mean > 0 ? observed / mean : observed;
                double p = poissonUpperTail(observed, mean);
                SpikeEvent spike = new SpikeEvent(points.get(i).getPeriod(), observed, mean, z, fold, p);
                LOG.debug("Spike detected: {}", spike);
                spikes.add(spike);
            }
        }
        return spikes;
    }

    /**
     * @return {@code true} if any spike lies within the recent-spike window
     *         of the series' last period
     */
    public boolean hasRecentSpike(List<SpikeEvent> spikes, TimeSeriesData series) {
        if (spikes.isEmpty() || series.isEmpty()) {
            return false;
        }
        LocalDate last = series.getPoints().get(series.size() - 1).getPeriod();
        for (SpikeEvent spike : spikes) {
            if (ChronoUnit.DAYS.between(spike.getPeriod(), last) <= recentDays) {
                return true;
            }
        }
        return false;
    }

    /**
     * {@code P(X ≥ observed)} for {@code X ~ Poisson(mean)}.
     */
    static double poissonUpperTail(long observed, double mean) {
        if (observed <= 0) {
            return 1.0;
        }
        if (mean <= 0) {
            return 0.0;
        }
        PoissonDistribution poisson = new PoissonDistribution(null, mean,
                PoissonDistribution.DEFAULT_EPSILON, PoissonDistribution.DEFAULT_MAX_ITERATIONS);
        int x = (int) Math.min(Integer.MAX_VALUE, observed);
        return Math.max(0.0, 1.0 - poisson.cumulativeProbability(x - 1));
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    private static double computeMean(List<TimePoint> points, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += points.get(i).getCount();
        }
        return sum / (to - from);
    }

    private static double computeStdDev(List<TimePoint> points, int from, int to, double mean) {
        double sumSquaredDiff = 0;
        for (int i = from; i < to; i++) {
            double diff = points.get(i).getCount() - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (to - from));
    }
}
