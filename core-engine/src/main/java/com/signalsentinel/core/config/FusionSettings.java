package com.signalsentinel.core.config;

import java.io.Serializable;
import java.util.List;

import static com.signalsentinel.core.config.ConfigChecks.requireConvex;
import static com.signalsentinel.core.config.ConfigChecks.requirePositive;
import static com.signalsentinel.core.config.ConfigChecks.requireUnit;

/**
 * Fusion weights, evidence-score weights, the Layer-1 squashing scale and the
 * alert tier ladder.
 *
 * @since 1.0.0
 */
public class FusionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    // --- Fusion weights (convex) ---
    private double evidenceWeight = 0.35;
    private double layer1Weight = 0.40;
    private double layer2Weight = 0.25;

    /** Scale of {@code 1 - exp(-layer1 / scale)}. */
    private double layer1SquashScale = 1.0;

    // --- Evidence score weights (convex) ---
    private double classicalWeight = 0.30;
    private double bayesianWeight = 0.40;
    private double temporalWeight = 0.20;
    private double causalityWeight = 0.10;

    /** Stand-in for a classical or Bayesian score that could not be computed. */
    private double missingEvidenceScore = 0.5;

    // --- Alert tiers ---
    private double criticalThreshold = 0.95;
    private double highThreshold = 0.80;
    private double moderateThreshold = 0.65;
    private double watchlistThreshold = 0.45;
    private double lowThreshold = 0.25;

    void validate(List<String> errors) {
        requireConvex(errors, "fusion",
                new String[] { "evidenceWeight", "layer1Weight", "layer2Weight" },
                evidenceWeight, layer1Weight, layer2Weight);
        requireConvex(errors, "fusion.evidence",
                new String[] { "classicalWeight", "bayesianWeight", "temporalWeight", "causalityWeight" },
                classicalWeight, bayesianWeight, temporalWeight, causalityWeight);
        requirePositive(errors, "fusion.layer1SquashScale", layer1SquashScale);
        requireUnit(errors, "fusion.missingEvidenceScore", missingEvidenceScore);

        double[] ladder = tierThresholds();
        String[] names = { "criticalThreshold", "highThreshold", "moderateThreshold",
                "watchlistThreshold", "lowThreshold" };
        for (int i = 0; i < ladder.length; i++) {
            requireUnit(errors, "fusion." + names[i], ladder[i]);
            if (i > 0 && ladder[i] >= ladder[i - 1]) {
                errors.add("fusion." + names[i] + " (" + ladder[i] + ") must be below fusion."
                        + names[i - 1] + " (" + ladder[i - 1] + ")");
            }
        }
    }

    /**
     * @return tier thresholds from {@code CRITICAL} down to {@code LOW}
     */
    public double[] tierThresholds() {
        return new double[] { criticalThreshold, highThreshold, moderateThreshold,
                watchlistThreshold, lowThreshold };
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for SnakeYAML)
    // ---------------------------------------------------------------

    public double getEvidenceWeight() {
        return evidenceWeight;
    }

    public void setEvidenceWeight(double evidenceWeight) {
        this.evidenceWeight = evidenceWeight;
    }

    public double getLayer1Weight() {
        return layer1Weight;
    }

    public void setLayer1Weight(double layer1Weight) {
        this.layer1Weight = layer1Weight;
    }

    public double getLayer2Weight() {
        return layer2Weight;
    }

    public void setLayer2Weight(double layer2Weight) {
        this.layer2Weight = layer2Weight;
    }

    public double getLayer1SquashScale() {
        return layer1SquashScale;
    }

    public void setLayer1SquashScale(double layer1SquashScale) {
        this.layer1SquashScale = layer1SquashScale;
    }

    public double getClassicalWeight() {
        return classicalWeight;
    }

    public void setClassicalWeight(double classicalWeight) {
        this.classicalWeight = classicalWeight;
    }

    public double getBayesianWeight() {
        return bayesianWeight;
    }

    public void setBayesianWeight(double bayesianWeight) {
        this.bayesianWeight = bayesianWeight;
    }

    public double getTemporalWeight() {
        return temporalWeight;
    }

    public void setTemporalWeight(double temporalWeight) {
        this.temporalWeight = temporalWeight;
    }

    public double getCausalityWeight() {
        return causalityWeight;
    }

    public void setCausalityWeight(double causalityWeight) {
        this.causalityWeight = causalityWeight;
    }

    public double getMissingEvidenceScore() {
        return missingEvidenceScore;
    }

    public void setMissingEvidenceScore(double missingEvidenceScore) {
        this.missingEvidenceScore = missingEvidenceScore;
    }

    public double getCriticalThreshold() {
        return criticalThreshold;
    }

    public void setCriticalThreshold(double criticalThreshold) {
        this.criticalThreshold = criticalThreshold;
    }

    public double getHighThreshold() {
        return highThreshold;
    }

    public void setHighThreshold(double highThreshold) {
        this.highThreshold = highThreshold;
    }

    public double getModerateThreshold() {
        return moderateThreshold;
    }

    public void setModerateThreshold(double moderateThreshold) {
        this.moderateThreshold = moderateThreshold;
    }

    public double getWatchlistThreshold() {
        return watchlistThreshold;
    }

    public void setWatchlistThreshold(double watchlistThreshold) {
        this.watchlistThreshold = watchlistThreshold;
    }

    public double getLowThreshold() {
        return lowThreshold;
    }

    public void setLowThreshold(double lowThreshold) {
        this.lowThreshold = lowThreshold;
    }

    @Override
    public String toString() {
        return "FusionSettings{weights=[" + evidenceWeight + ", " + layer1Weight + ", " + layer2Weight
                + "], layer1SquashScale=" + layer1SquashScale + '}';
    }
}
