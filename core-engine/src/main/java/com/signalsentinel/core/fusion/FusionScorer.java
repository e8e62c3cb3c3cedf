package com.signalsentinel.core.fusion;

import com.signalsentinel.core.config.FusionSettings;
import com.signalsentinel.core.exception.NumericOverflowException;
import com.signalsentinel.core.model.AlertTier;

import java.util.Objects;

/**
 * Combines the evidence score with both composite layers and maps the fused
 * score onto the alert-tier ladder.
 *
 * @since 1.0.0
 */
public class FusionScorer {

    private static final AlertTier[] LADDER = {
            AlertTier.CRITICAL, AlertTier.HIGH, AlertTier.MODERATE, AlertTier.WATCHLIST, AlertTier.LOW
    };

    private final FusionSettings settings;

    public FusionScorer(FusionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "FusionSettings must not be null");
    }

    /**
     * Maps the unbounded layer-1 score into [0, 1) with
     * {@code 1 - exp(-x / scale)}. Monotone; negative input maps to 0.
     */
    public double squashLayer1(double layer1) {
        NumericOverflowException.requireFinite(layer1, "layer-1 score");
        return 1.0 - Math.exp(-Math.max(0.0, layer1) / settings.getLayer1SquashScale());
    }

    /**
     * @param evidence        evidence score in [0, 1]
     * @param layer1Squashed  squashed layer-1 score
     * @param layer2          layer-2 score in [0, 1]
     * @return fused score clamped to [0, 1]
     * @throws NumericOverflowException if the fused score is not finite
     */
    public double fuse(double evidence, double layer1Squashed, double layer2) {
        double fused = settings.getEvidenceWeight() * evidence
                + settings.getLayer1Weight() * layer1Squashed
                + settings.getLayer2Weight() * layer2;
        NumericOverflowException.requireFinite(fused, "fusion score");
        return Math.max(0.0, Math.min(1.0, fused));
    }

    public AlertTier tier(double fusionScore) {
        double[] thresholds = settings.tierThresholds();
        for (int i = 0; i < thresholds.length; i++) {
            if (fusionScore >= thresholds[i]) {
                return LADDER[i];
            }
        }
        return AlertTier.NONE;
    }
}
