package com.signalsentinel.core.temporal;

import com.signalsentinel.core.config.TemporalSettings;
import com.signalsentinel.core.exception.InsufficientDataException;
import com.signalsentinel.core.model.TimePoint;
import com.signalsentinel.core.model.TimeSeriesData;
import com.signalsentinel.core.model.TrendDirection;
import com.signalsentinel.core.model.TrendResult;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.util.List;
import java.util.Objects;

/**
 * Log-linear trend over the most recent {@code trendWindow} periods.
 *
 * <p>
 * Regresses {@code ln(count + 1)} on elapsed periods. The trend is
 * increasing or decreasing when the slope's p-value is below
 * {@code trendSignificance}; an undefined p-value (two points, or a perfectly
 * flat series) counts as not significant.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendAnalyzer {

    private static final double LN2 = Math.log(2.0);

    private final int window;
    private final double significance;

    public TrendAnalyzer(TemporalSettings settings) {
        Objects.requireNonNull(settings, "TemporalSettings must not be null");
        this.window = settings.getTrendWindow();
        this.significance = settings.getTrendSignificance();
    }

    /**
     * @throws InsufficientDataException if the series has fewer than two
     *                                   points
     */
    public TrendResult analyze(TimeSeriesData series) {
        Objects.requireNonNull(series, "TimeSeriesData must not be null");
        List<TimePoint> points = series.getPoints();
        if (points.size() < 2) {
            throw new InsufficientDataException(
                    "Trend needs at least 2 time points, got: " + points.size());
        }

        List<TimePoint> recent = points.subList(Math.max(0, points.size() - window), points.size());
        TimePoint origin = recent.get(0);

        SimpleRegression regression = new SimpleRegression();
        for (TimePoint point : recent) {
            double x = series.getGranularity().periodsBetween(origin.getPeriod(), point.getPeriod());
            regression.addData(x, Math.log(point.getCount() + 1.0));
        }

        double slope = regression.getSlope();
        double pValue = regression.getSignificance();
        if (Double.isNaN(pValue)) {
            pValue = 1.0;
        }
        double rSquared = regression.getRSquare();
        if (Double.isNaN(rSquared)) {
            rSquared = 0.0;
        }

        TrendDirection direction = TrendDirection.STABLE;
        Double doubling = null;
        if (pValue < significance && slope != 0) {
            direction = slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
            doubling = LN2 / Math.abs(slope);
        }
        return new TrendResult(direction, slope, rSquared, pValue, recent.size(), doubling);
    }
}
