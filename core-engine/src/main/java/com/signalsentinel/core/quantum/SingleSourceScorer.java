package com.signalsentinel.core.quantum;

import com.signalsentinel.core.config.Layer1Settings;
import com.signalsentinel.core.model.CaseProfile;
import com.signalsentinel.core.model.DrugEventPair;
import com.signalsentinel.core.model.SingleSourceComponents;
import com.signalsentinel.core.model.TimeSeriesData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Layer-1 composite score from a single reporting source.
 *
 * <h3>Sub-scores (each in [0, 1])</h3>
 * <ul>
 * <li><b>rarity</b>: {@code 1 - a / total}, where {@code total} is the
 * profile's case total or else {@code a + b}</li>
 * <li><b>seriousness</b>: serious flag, the single most severe outcome
 * (death, hospitalization, disability) and the serious fraction</li>
 * <li><b>recency</b>: linear decay inside the recent and moderate windows,
 * slow decay afterwards</li>
 * <li><b>count</b>: {@code min(1, a / countSaturation)}</li>
 * </ul>
 *
 * <h3>Boosts</h3>
 * <p>
 * Pairwise interaction boosts apply when both sub-scores are strictly above
 * {@code pairThreshold}; the three-way boost when rarity, seriousness and
 * recency are all strictly above {@code tripleThreshold}. Each of those three
 * sub-scores inside the half-open tunneling band {@code (lower, upper]} adds
 * {@code tunnelingBoost}. The resulting score is not bounded above by 1.
 * </p>
 *
 * @since 1.0.0
 */
public class SingleSourceScorer {

    private static final Logger LOG = LoggerFactory.getLogger(SingleSourceScorer.class);

    private static final double RECENT_DECAY = 0.5;
    private static final double MODERATE_DECAY = 0.3;
    private static final double OLD_DECAY_DAYS = 3650.0;

    private final Layer1Settings settings;

    public SingleSourceScorer(Layer1Settings settings) {
        this.settings = Objects.requireNonNull(settings, "Layer1Settings must not be null");
    }

    public SingleSourceComponents score(DrugEventPair pair, LocalDate asOf) {
        Objects.requireNonNull(pair, "DrugEventPair must not be null");
        Objects.requireNonNull(asOf, "asOf must not be null");

        CaseProfile profile = pair.getCaseProfile().orElse(CaseProfile.empty());
        long count = pair.getTable().getA();

        double rarity = rarity(count, profile.getTotalCases().orElse(pair.getTable().getDrugTotal()));
        double seriousness = seriousness(profile, count);
        double recency = recency(latestReportDate(pair, profile), asOf);
        double countScore = Math.min(1.0, count / settings.getCountSaturation());

        double base = settings.getRarityWeight() * rarity
                + settings.getSeriousnessWeight() * seriousness
                + settings.getRecencyWeight() * recency
                + settings.getCountWeight() * countScore;

        double pairThreshold = settings.getPairThreshold();
        boolean rare = rarity > pairThreshold;
        boolean serious = seriousness > pairThreshold;
        boolean recent = recency > pairThreshold;
        double rareSerious = rare && serious ? settings.getRareSeriousBoost() : 0.0;
        double rareRecent = rare && recent ? settings.getRareRecentBoost() : 0.0;
        double seriousRecent = serious && recent ? settings.getSeriousRecentBoost() : 0.0;
        double triple = settings.getTripleThreshold();
        double allThree = rarity > triple && seriousness > triple && recency > triple
                ? settings.getAllThreeBoost()
                : 0.0;

        double tunneling = 0.0;
        for (double subScore : new double[] { rarity, seriousness, recency }) {
            if (subScore > settings.getTunnelingLower() && subScore <= settings.getTunnelingUpper()) {
                tunneling += settings.getTunnelingBoost();
            }
        }

        SingleSourceComponents components = SingleSourceComponents.builder()
                .subScores(rarity, seriousness, recency, countScore)
                .baseScore(base)
                .interactions(rareSerious, rareRecent, seriousRecent, allThree)
                .tunnelingBoost(tunneling)
                .build();
        LOG.debug("Layer-1 score for {}: {}", pair.key(), components);
        return components;
    }

    // ---------------------------------------------------------------
    // Sub-scores
    // ---------------------------------------------------------------

    static double rarity(long count, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return clamp(1.0 - (double) count / total);
    }

    double seriousness(CaseProfile profile, long count) {
        double score = 0.0;
        if (profile.getSeriousCount() > 0) {
            score += settings.getSeriousFlagWeight();
        }
        if (profile.getDeathCount() > 0) {
            score += settings.getDeathWeight();
        } else if (profile.getHospitalizationCount() > 0) {
            score += settings.getHospitalizationWeight();
        } else if (profile.getDisabilityCount() > 0) {
            score += settings.getDisabilityWeight();
        }
        if (count > 0) {
            score += settings.getSeriousFractionWeight() * profile.getSeriousCount() / count;
        }
        return Math.min(1.0, score);
    }

    double recency(Optional<LocalDate> latest, LocalDate asOf) {
        if (latest.isEmpty()) {
            return settings.getUnknownRecencyScore();
        }
        double days = Math.max(0, ChronoUnit.DAYS.between(latest.get(), asOf));
        double recentDays = settings.getRecentDays();
        double score;
        if (days <= recentDays) {
            score = settings.getRecentScore() - (days / recentDays) * RECENT_DECAY;
        } else if (days <= settings.getModerateDays()) {
            score = settings.getModerateScore() - ((days - recentDays) / recentDays) * MODERATE_DECAY;
        } else {
            score = settings.getOldScore() - (days - settings.getModerateDays()) / OLD_DECAY_DAYS;
        }
        return clamp(score);
    }

    /**
     * Latest report date from the case profile, falling back to the last
     * period of the time series that carries reports.
     */
    static Optional<LocalDate> latestReportDate(DrugEventPair pair, CaseProfile profile) {
        Optional<LocalDate> latest = profile.getLatestReportDate();
        if (latest.isPresent()) {
            return latest;
        }
        return pair.getTimeSeries().flatMap(TimeSeriesData::getLastReportPeriod);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
