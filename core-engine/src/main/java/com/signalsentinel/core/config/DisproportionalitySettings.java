package com.signalsentinel.core.config;

import java.io.Serializable;
import java.util.List;

import static com.signalsentinel.core.config.ConfigChecks.requireNonNegative;
import static com.signalsentinel.core.config.ConfigChecks.requirePositive;

/**
 * Thresholds for the classical PRR / ROR / IC statistics.
 *
 * @since 1.0.0
 */
public class DisproportionalitySettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** PRR must reach this value to flag a signal. */
    private double prrThreshold = 2.0;

    /** ROR must exceed this value to flag a signal. */
    private double rorThreshold = 1.0;

    /** Minimum observed count {@code a} for PRR and ROR signals. */
    private int minCount = 3;

    /** Normal quantile for the 95% PRR / ROR intervals. */
    private double confidenceZ = 1.96;

    /** Number of standard deviations below IC for IC025. */
    private double icSigmaMultiplier = 2.0;

    /** Added to every cell when any cell is zero. */
    private double continuityCorrection = 0.5;

    /** Fisher's exact test replaces chi-square when a or E is below this. */
    private double smallCountThreshold = 5.0;

    void validate(List<String> errors) {
        requirePositive(errors, "disproportionality.prrThreshold", prrThreshold);
        requireNonNegative(errors, "disproportionality.rorThreshold", rorThreshold);
        if (minCount < 0) {
            errors.add("disproportionality.minCount must be >= 0, got: " + minCount);
        }
        requirePositive(errors, "disproportionality.confidenceZ", confidenceZ);
        requirePositive(errors, "disproportionality.icSigmaMultiplier", icSigmaMultiplier);
        requirePositive(errors, "disproportionality.continuityCorrection", continuityCorrection);
        requireNonNegative(errors, "disproportionality.smallCountThreshold", smallCountThreshold);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for SnakeYAML)
    // ---------------------------------------------------------------

    public double getPrrThreshold() {
        return prrThreshold;
    }

    public void setPrrThreshold(double prrThreshold) {
        this.prrThreshold = prrThreshold;
    }

    public double getRorThreshold() {
        return rorThreshold;
    }

    public void setRorThreshold(double rorThreshold) {
        this.rorThreshold = rorThreshold;
    }

    public int getMinCount() {
        return minCount;
    }

    public void setMinCount(int minCount) {
        this.minCount = minCount;
    }

    public double getConfidenceZ() {
        return confidenceZ;
    }

    public void setConfidenceZ(double confidenceZ) {
        this.confidenceZ = confidenceZ;
    }

    public double getIcSigmaMultiplier() {
        return icSigmaMultiplier;
    }

    public void setIcSigmaMultiplier(double icSigmaMultiplier) {
        this.icSigmaMultiplier = icSigmaMultiplier;
    }

    public double getContinuityCorrection() {
        return continuityCorrection;
    }

    public void setContinuityCorrection(double continuityCorrection) {
        this.continuityCorrection = continuityCorrection;
    }

    public double getSmallCountThreshold() {
        return smallCountThreshold;
    }

    public void setSmallCountThreshold(double smallCountThreshold) {
        this.smallCountThreshold = smallCountThreshold;
    }

    @Override
    public String toString() {
        return "DisproportionalitySettings{prrThreshold=" + prrThreshold
                + ", minCount=" + minCount + ", confidenceZ=" + confidenceZ + '}';
    }
}
