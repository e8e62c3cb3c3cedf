package com.signalsentinel.core.temporal;

import com.signalsentinel.core.config.TemporalSettings;
import com.signalsentinel.core.exception.InsufficientDataException;
import com.signalsentinel.core.model.NoveltyResult;
import com.signalsentinel.core.model.TimeSeriesData;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Scores how new a drug-event association is.
 *
 * <pre>
 *   recency = 0.5 ^ (days / halfLife)
 *   volume  = 1 / (1 + ln(1 + total))
 *   growth  = min(1, total / max(periods, 1))
 *   score   = wRecency·recency + wVolume·volume + wGrowth·growth
 * </pre>
 *
 * <p>
 * {@code days} and {@code periods} run from the first period with a report
 * to the reference date. An association is <i>emerging</i> when it is no
 * older than the emerging window (shorter for labeled effects) and its score
 * exceeds the threshold.
 * </p>
 *
 * @since 1.0.0
 */
public class NoveltyScorer {

    private final TemporalSettings settings;

    public NoveltyScorer(TemporalSettings settings) {
        this.settings = Objects.requireNonNull(settings, "TemporalSettings must not be null");
    }

    /**
     * @param series  the pair's reporting series
     * @param labeled whether the event is already a labeled effect of the drug
     * @param asOf    reference date of the batch
     * @throws InsufficientDataException if the series is empty
     */
    public NoveltyResult score(TimeSeriesData series, boolean labeled, LocalDate asOf) {
        Objects.requireNonNull(series, "TimeSeriesData must not be null");
        Objects.requireNonNull(asOf, "asOf must not be null");
        if (series.isEmpty()) {
            throw new InsufficientDataException("Novelty needs at least one time point");
        }

        LocalDate first = series.getFirstReportPeriod().orElse(series.getPoints().get(0).getPeriod());
        long days = Math.max(0, ChronoUnit.DAYS.between(first, asOf));
        long periods = Math.max(1, series.getGranularity().periodsBetween(first, asOf));
        long total = series.getTotalCount();

        double recency = Math.pow(0.5, days / settings.getNoveltyHalfLifeDays());
        double volume = 1.0 / (1.0 + Math.log1p(total));
        double growth = Math.min(1.0, (double) total / periods);

        double score = settings.getRecencyWeight() * recency
                + settings.getVolumeWeight() * volume
                + settings.getGrowthWeight() * growth;
        score = Math.max(0.0, Math.min(1.0, score));

        int band = labeled ? settings.getLabeledEmergingDays() : settings.getUnlabeledEmergingDays();
        boolean emerging = days <= band && score > settings.getEmergingScoreThreshold();

        return new NoveltyResult(days, recency, volume, growth, score, emerging);
    }
}
