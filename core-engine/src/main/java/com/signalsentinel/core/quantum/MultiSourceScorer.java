package com.signalsentinel.core.quantum;

import com.signalsentinel.core.config.Layer2Settings;
import com.signalsentinel.core.model.CaseProfile;
import com.signalsentinel.core.model.DrugEventPair;
import com.signalsentinel.core.model.MultiSourceComponents;
import com.signalsentinel.core.model.SourceEvidence;
import com.signalsentinel.core.model.TemporalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Layer-2 composite score combining corroboration across sources.
 *
 * <p>
 * Six components (frequency, severity, burst, novelty, consensus, mechanism)
 * are combined with convex weights and clamped to [0, 1].
 * </p>
 *
 * <h3>Consensus</h3>
 * <p>
 * With per-source evidence, priorities of the source types present are
 * normalised to sum to one and each item contributes
 * {@code priority · strength · max(0.1, confidence)}. When at least
 * {@code minHighConfidenceSources} items are both confident and strong the
 * consensus is boosted. Without evidence of any known source type the
 * consensus is the fraction of queried sources that corroborate.
 * </p>
 *
 * @since 1.0.0
 */
public class MultiSourceScorer {

    private static final Logger LOG = LoggerFactory.getLogger(MultiSourceScorer.class);

    private static final double MIN_CONFIDENCE = 0.1;

    // Novelty fallback on the latest report date: off-label and on-label ladders.
    private static final int[] UNLABELED_NOVELTY_DAYS = { 30, 90, 180, 365 };
    private static final double[] UNLABELED_NOVELTY_SCORES = { 1.0, 0.8, 0.6, 0.4, 0.2 };
    private static final int[] LABELED_NOVELTY_DAYS = { 30, 90 };
    private static final double[] LABELED_NOVELTY_SCORES = { 0.6, 0.4, 0.2 };
    private static final double UNKNOWN_UNLABELED_NOVELTY = 0.5;
    private static final double UNKNOWN_LABELED_NOVELTY = 0.2;

    private final Layer2Settings settings;

    public MultiSourceScorer(Layer2Settings settings) {
        this.settings = Objects.requireNonNull(settings, "Layer2Settings must not be null");
    }

    /**
     * @param pair     the pair being scored
     * @param temporal temporal analysis of the pair, or {@code null} when no
     *                 time series was available
     * @param asOf     reference date of the batch
     */
    public MultiSourceComponents score(DrugEventPair pair, TemporalResult temporal, LocalDate asOf) {
        Objects.requireNonNull(pair, "DrugEventPair must not be null");
        Objects.requireNonNull(asOf, "asOf must not be null");

        CaseProfile profile = pair.getCaseProfile().orElse(CaseProfile.empty());
        long count = pair.getTable().getA();

        double frequency = frequency(count);
        double severity = severity(profile, count);
        double burst = temporal != null ? burst(temporal.getMaxSpikeFold()) : 0.0;
        double novelty = novelty(temporal, profile, pair, asOf);
        double consensus = consensus(profile);
        double mechanism = profile.getMechanismPlausibility();

        double score = settings.getFrequencyWeight() * frequency
                + settings.getSeverityWeight() * severity
                + settings.getBurstWeight() * burst
                + settings.getNoveltyWeight() * novelty
                + settings.getConsensusWeight() * consensus
                + settings.getMechanismWeight() * mechanism;
        score = Math.max(0.0, Math.min(1.0, score));

        MultiSourceComponents components = new MultiSourceComponents(frequency, severity, burst, novelty,
                consensus, mechanism, score);
        LOG.debug("Layer-2 score for {}: {}", pair.key(), components);
        return components;
    }

    double frequency(long count) {
        List<Long> breakpoints = settings.getFrequencyBreakpoints();
        List<Double> scores = settings.getFrequencyScores();
        for (int i = 0; i < breakpoints.size(); i++) {
            if (count >= breakpoints.get(i)) {
                return scores.get(i);
            }
        }
        return 0.0;
    }

    static double severity(CaseProfile profile, long count) {
        if (profile.getSeverity().isPresent()) {
            return profile.getSeverity().getAsDouble();
        }
        if (count <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) profile.getSeriousCount() / count);
    }

    double burst(double maxSpikeFold) {
        if (maxSpikeFold <= 0) {
            return 0.0;
        }
        double burst = (maxSpikeFold - 1.0) / (settings.getBurstSaturationFold() - 1.0);
        return Math.max(0.0, Math.min(1.0, burst));
    }

    double novelty(TemporalResult temporal, CaseProfile profile, DrugEventPair pair, LocalDate asOf) {
        boolean labeled = profile.isLabeled();
        if (temporal != null) {
            double novelty = temporal.getNovelty().getScore();
            return labeled ? novelty * settings.getLabeledNoveltyFactor() : novelty;
        }
        Optional<LocalDate> latest = SingleSourceScorer.latestReportDate(pair, profile);
        if (latest.isEmpty()) {
            return labeled ? UNKNOWN_LABELED_NOVELTY : UNKNOWN_UNLABELED_NOVELTY;
        }
        long days = Math.max(0, ChronoUnit.DAYS.between(latest.get(), asOf));
        return labeled
                ? ladder(days, LABELED_NOVELTY_DAYS, LABELED_NOVELTY_SCORES)
                : ladder(days, UNLABELED_NOVELTY_DAYS, UNLABELED_NOVELTY_SCORES);
    }

    double consensus(CaseProfile profile) {
        List<SourceEvidence> evidence = profile.getSourceEvidence();
        Map<String, Double> priorities = settings.getSourcePriorities();

        Set<String> present = new LinkedHashSet<>();
        for (SourceEvidence item : evidence) {
            if (priorities.containsKey(item.getSourceType())) {
                present.add(item.getSourceType());
            }
        }
        double totalPriority = present.stream().mapToDouble(settings::sourcePriority).sum();

        if (present.isEmpty() || totalPriority <= 0) {
            if (profile.getSourcesQueried() == 0) {
                return 0.0;
            }
            return (double) profile.getSourcesCorroborating() / profile.getSourcesQueried();
        }

        double weighted = 0.0;
        int highConfidence = 0;
        for (SourceEvidence item : evidence) {
            if (!present.contains(item.getSourceType())) {
                continue;
            }
            double weight = settings.sourcePriority(item.getSourceType()) / totalPriority;
            weighted += weight * item.getStrength() * Math.max(MIN_CONFIDENCE, item.getConfidence());
            if (item.getConfidence() >= settings.getHighConfidence()
                    && item.getStrength() >= settings.getHighStrength()) {
                highConfidence++;
            }
        }

        double consensus = Math.min(1.0, weighted);
        if (highConfidence >= settings.getMinHighConfidenceSources()) {
            consensus = Math.min(1.0, consensus + settings.getConsensusBoost());
        }
        return consensus;
    }

    private static double ladder(long days, int[] limits, double[] scores) {
        for (int i = 0; i < limits.length; i++) {
            if (days <= limits[i]) {
                return scores[i];
            }
        }
        return scores[scores.length - 1];
    }
}
