package com.signalsentinel.core.fusion;

import com.signalsentinel.core.config.FusionSettings;
import com.signalsentinel.core.model.BayesianResult;
import com.signalsentinel.core.model.CausalityResult;
import com.signalsentinel.core.model.DisproportionalityResult;
import com.signalsentinel.core.model.TemporalResult;

import java.util.Objects;

/**
 * Weighted evidence score from the four analytical components.
 *
 * <pre>
 *   evidence = wClassical·classical + wBayesian·bayesian
 *            + wTemporal·temporal   + wCausality·causality
 * </pre>
 *
 * <p>
 * A missing classical or Bayesian component scores
 * {@code missingEvidenceScore}. A missing temporal component borrows the
 * Bayesian score and a missing causality component borrows the classical
 * score, so the weights always sum to one.
 * </p>
 *
 * @since 1.0.0
 */
public class EvidenceScorer {

    private static final double[] CLASSICAL_BY_SIGNAL_COUNT = { 0.2, 0.5, 0.7, 0.9 };
    private static final double STRONG_RATIO = 5.0;
    private static final double ELEVATED_RATIO = 3.0;

    private final FusionSettings settings;

    public EvidenceScorer(FusionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "FusionSettings must not be null");
    }

    /**
     * All arguments are nullable; {@code null} means the component was not
     * computed for the pair.
     */
    public double score(DisproportionalityResult disproportionality, BayesianResult bayesian,
            TemporalResult temporal, CausalityResult causality) {
        double classical = disproportionality != null
                ? classical(disproportionality)
                : settings.getMissingEvidenceScore();
        double bayes = bayesian != null ? bayesian(bayesian) : settings.getMissingEvidenceScore();
        double time = temporal != null ? temporal.getRiskScore() : bayes;
        double cause = causality != null ? causality.getConfidence() : classical;

        double score = settings.getClassicalWeight() * classical
                + settings.getBayesianWeight() * bayes
                + settings.getTemporalWeight() * time
                + settings.getCausalityWeight() * cause;
        return Math.max(0.0, Math.min(1.0, score));
    }

    static double classical(DisproportionalityResult result) {
        double score = CLASSICAL_BY_SIGNAL_COUNT[Math.min(3, result.getSignalCount())];
        double meanRatio = (result.getPrr().getValue() + result.getRor().getValue()) / 2.0;
        if (meanRatio > STRONG_RATIO) {
            score += 0.10;
        } else if (meanRatio > ELEVATED_RATIO) {
            score += 0.05;
        }
        return Math.min(1.0, score);
    }

    static double bayesian(BayesianResult result) {
        double eb05 = result.getEb05();
        double score;
        if (eb05 > 4) {
            score = 0.95;
        } else if (eb05 > 2) {
            score = 0.80;
        } else if (eb05 > 1) {
            score = 0.60;
        } else {
            score = 0.30;
        }
        if (result.isFdrSignificant()) {
            score += 0.05;
        }
        return Math.min(1.0, score);
    }
}
