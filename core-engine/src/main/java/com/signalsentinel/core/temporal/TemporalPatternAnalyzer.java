package com.signalsentinel.core.temporal;

import com.signalsentinel.core.config.TemporalSettings;
import com.signalsentinel.core.exception.InsufficientDataException;
import com.signalsentinel.core.model.ChangePoint;
import com.signalsentinel.core.model.LatencyDistribution;
import com.signalsentinel.core.model.NoveltyResult;
import com.signalsentinel.core.model.SpikeEvent;
import com.signalsentinel.core.model.TemporalResult;
import com.signalsentinel.core.model.TimeSeriesData;
import com.signalsentinel.core.model.TrendDirection;
import com.signalsentinel.core.model.TrendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs every temporal detector over one pair's reporting series and combines
 * them into a single temporal risk score.
 *
 * <h3>Risk score</h3>
 *
 * <pre>
 *   0.30  recent spike
 *   0.25  significant change point
 *   0.20  significant increasing trend
 *   0.25  emerging association (0.15 when only the novelty score exceeds 0.6)
 * </pre>
 *
 * <p>
 * capped at 1. Each contribution also adds a human-readable flag.
 * </p>
 *
 * <p>
 * The time-to-onset distribution of the pair's cases is reported alongside
 * and does not contribute to the risk score.
 * </p>
 *
 * @since 1.0.0
 */
public class TemporalPatternAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(TemporalPatternAnalyzer.class);

    static final double RECENT_SPIKE_RISK = 0.30;
    static final double CHANGE_POINT_RISK = 0.25;
    static final double INCREASING_TREND_RISK = 0.20;
    static final double EMERGING_RISK = 0.25;
    static final double HIGH_NOVELTY_RISK = 0.15;
    static final double HIGH_NOVELTY = 0.6;

    private final SpikeDetector spikeDetector;
    private final TrendAnalyzer trendAnalyzer;
    private final NoveltyScorer noveltyScorer;
    private final ChangePointDetector changePointDetector;
    private final LatencyAnalyzer latencyAnalyzer = new LatencyAnalyzer();

    public TemporalPatternAnalyzer(TemporalSettings settings) {
        Objects.requireNonNull(settings, "TemporalSettings must not be null");
        this.spikeDetector = new SpikeDetector(settings);
        this.trendAnalyzer = new TrendAnalyzer(settings);
        this.noveltyScorer = new NoveltyScorer(settings);
        this.changePointDetector = new ChangePointDetector(settings);
    }

    /**
     * Analyze a series without onset data.
     *
     * @throws InsufficientDataException if the series is empty
     */
    public TemporalResult analyze(TimeSeriesData series, boolean labeled, LocalDate asOf) {
        return analyze(series, labeled, List.of(), asOf);
    }

    /**
     * @param series    reporting counts for the pair
     * @param labeled   whether the event is a labeled effect of the drug
     * @param onsetDays per-case time to onset in days; may be empty
     * @param asOf      reference date of the batch
     * @throws InsufficientDataException if the series is empty
     */
    public TemporalResult analyze(TimeSeriesData series, boolean labeled, List<Integer> onsetDays,
            LocalDate asOf) {
        Objects.requireNonNull(series, "TimeSeriesData must not be null");
        Objects.requireNonNull(onsetDays, "onsetDays must not be null");
        Objects.requireNonNull(asOf, "asOf must not be null");
        if (series.isEmpty()) {
            throw new InsufficientDataException("Temporal analysis needs a non-empty time series");
        }

        List<SpikeEvent> spikes = spikeDetector.detect(series);
        boolean recentSpike = spikeDetector.hasRecentSpike(spikes, series);

        TrendResult trend = null;
        try {
            trend = trendAnalyzer.analyze(series);
        } catch (InsufficientDataException e) {
            LOG.debug("Trend omitted: {}", e.getMessage());
        }

        NoveltyResult novelty = noveltyScorer.score(series, labeled, asOf);
        List<ChangePoint> changePoints = changePointDetector.detect(series);
        LatencyDistribution latency = latencyAnalyzer.analyze(onsetDays);

        List<String> flags = new ArrayList<>();
        double risk = 0.0;
        if (recentSpike) {
            risk += RECENT_SPIKE_RISK;
            flags.add("Recent reporting spike");
        }
        if (changePoints.stream().anyMatch(ChangePoint::isSignificant)) {
            risk += CHANGE_POINT_RISK;
            flags.add("Significant change in reporting rate");
        }
        if (trend != null && trend.isSignificant() && trend.getDirection() == TrendDirection.INCREASING) {
            risk += INCREASING_TREND_RISK;
            flags.add("Significant increasing trend");
        }
        if (novelty.isEmerging()) {
            risk += EMERGING_RISK;
            flags.add("Emerging association");
        } else if (novelty.getScore() > HIGH_NOVELTY) {
            risk += HIGH_NOVELTY_RISK;
            flags.add("High novelty");
        }

        return TemporalResult.builder()
                .spikes(spikes, recentSpike)
                .trend(trend)
                .novelty(novelty)
                .changePoints(changePoints)
                .riskScore(Math.min(1.0, risk), flags)
                .latency(latency)
                .build();
    }
}
