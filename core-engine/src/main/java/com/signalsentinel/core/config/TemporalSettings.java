package com.signalsentinel.core.config;

import java.io.Serializable;
import java.util.List;

import static com.signalsentinel.core.config.ConfigChecks.requireConvex;
import static com.signalsentinel.core.config.ConfigChecks.requirePositive;
import static com.signalsentinel.core.config.ConfigChecks.requireUnit;

/**
 * Spike, trend, novelty and change-point parameters.
 *
 * <p>
 * Window sizes are in reporting periods of the analysed series; day counts
 * are calendar days.
 * </p>
 *
 * @since 1.0.0
 */
public class TemporalSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    // --- Spikes ---
    private int spikeWindow = 30;
    private double spikeZThreshold = 3.0;
    private int recentSpikeDays = 90;

    // --- Trend ---
    private int trendWindow = 12;
    private double trendSignificance = 0.05;

    // --- Novelty ---
    private double noveltyHalfLifeDays = 90.0;
    private double recencyWeight = 0.5;
    private double volumeWeight = 0.3;
    private double growthWeight = 0.2;
    private int labeledEmergingDays = 30;
    private int unlabeledEmergingDays = 180;
    private double emergingScoreThreshold = 0.5;

    // --- Change points ---
    private int changePointMinSegment = 10;
    private double changePointMinRatio = 1.5;
    private int maxChangePoints = 3;
    private double changePointSignificance = 0.05;

    void validate(List<String> errors) {
        if (spikeWindow < 2) {
            errors.add("temporal.spikeWindow must be >= 2, got: " + spikeWindow);
        }
        requirePositive(errors, "temporal.spikeZThreshold", spikeZThreshold);
        if (recentSpikeDays < 0) {
            errors.add("temporal.recentSpikeDays must be >= 0, got: " + recentSpikeDays);
        }
        if (trendWindow < 2) {
            errors.add("temporal.trendWindow must be >= 2, got: " + trendWindow);
        }
        if (!(trendSignificance > 0 && trendSignificance < 1)) {
            errors.add("temporal.trendSignificance must be in (0, 1), got: " + trendSignificance);
        }
        requirePositive(errors, "temporal.noveltyHalfLifeDays", noveltyHalfLifeDays);
        requireConvex(errors, "temporal.novelty", new String[] { "recencyWeight", "volumeWeight", "growthWeight" },
                recencyWeight, volumeWeight, growthWeight);
        if (labeledEmergingDays < 0 || unlabeledEmergingDays < 0) {
            errors.add("temporal emerging windows must be >= 0, got: "
                    + labeledEmergingDays + " / " + unlabeledEmergingDays);
        }
        requireUnit(errors, "temporal.emergingScoreThreshold", emergingScoreThreshold);
        if (changePointMinSegment < 2) {
            errors.add("temporal.changePointMinSegment must be >= 2, got: " + changePointMinSegment);
        }
        if (!(changePointMinRatio >= 1)) {
            errors.add("temporal.changePointMinRatio must be >= 1, got: " + changePointMinRatio);
        }
        if (maxChangePoints < 0) {
            errors.add("temporal.maxChangePoints must be >= 0, got: " + maxChangePoints);
        }
        if (!(changePointSignificance > 0 && changePointSignificance < 1)) {
            errors.add("temporal.changePointSignificance must be in (0, 1), got: " + changePointSignificance);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for SnakeYAML)
    // ---------------------------------------------------------------

    public int getSpikeWindow() {
        return spikeWindow;
    }

    public void setSpikeWindow(int spikeWindow) {
        this.spikeWindow = spikeWindow;
    }

    public double getSpikeZThreshold() {
        return spikeZThreshold;
    }

    public void setSpikeZThreshold(double spikeZThreshold) {
        this.spikeZThreshold = spikeZThreshold;
    }

    public int getRecentSpikeDays() {
        return recentSpikeDays;
    }

    public void setRecentSpikeDays(int recentSpikeDays) {
        this.recentSpikeDays = recentSpikeDays;
    }

    public int getTrendWindow() {
        return trendWindow;
    }

    public void setTrendWindow(int trendWindow) {
        this.trendWindow = trendWindow;
    }

    public double getTrendSignificance() {
        return trendSignificance;
    }

    public void setTrendSignificance(double trendSignificance) {
        this.trendSignificance = trendSignificance;
    }

    public double getNoveltyHalfLifeDays() {
        return noveltyHalfLifeDays;
    }

    public void setNoveltyHalfLifeDays(double noveltyHalfLifeDays) {
        this.noveltyHalfLifeDays = noveltyHalfLifeDays;
    }

    public double getRecencyWeight() {
        return recencyWeight;
    }

    public void setRecencyWeight(double recencyWeight) {
        this.recencyWeight = recencyWeight;
    }

    public double getVolumeWeight() {
        return volumeWeight;
    }

    public void setVolumeWeight(double volumeWeight) {
        this.volumeWeight = volumeWeight;
    }

    public double getGrowthWeight() {
        return growthWeight;
    }

    public void setGrowthWeight(double growthWeight) {
        this.growthWeight = growthWeight;
    }

    public int getLabeledEmergingDays() {
        return labeledEmergingDays;
    }

    public void setLabeledEmergingDays(int labeledEmergingDays) {
        this.labeledEmergingDays = labeledEmergingDays;
    }

    public int getUnlabeledEmergingDays() {
        return unlabeledEmergingDays;
    }

    public void setUnlabeledEmergingDays(int unlabeledEmergingDays) {
        this.unlabeledEmergingDays = unlabeledEmergingDays;
    }

    public double getEmergingScoreThreshold() {
        return emergingScoreThreshold;
    }

    public void setEmergingScoreThreshold(double emergingScoreThreshold) {
        this.emergingScoreThreshold = emergingScoreThreshold;
    }

    public int getChangePointMinSegment() {
        return changePointMinSegment;
    }

    public void setChangePointMinSegment(int changePointMinSegment) {
        this.changePointMinSegment = changePointMinSegment;
    }

    public double getChangePointMinRatio() {
        return changePointMinRatio;
    }

    public void setChangePointMinRatio(double changePointMinRatio) {
        this.changePointMinRatio = changePointMinRatio;
    }

    public int getMaxChangePoints() {
        return maxChangePoints;
    }

    public void setMaxChangePoints(int maxChangePoints) {
        this.maxChangePoints = maxChangePoints;
    }

    public double getChangePointSignificance() {
        return changePointSignificance;
    }

    public void setChangePointSignificance(double changePointSignificance) {
        this.changePointSignificance = changePointSignificance;
    }

    @Override
    public String toString() {
        return "TemporalSettings{spikeWindow=" + spikeWindow + ", spikeZThreshold=" + spikeZThreshold
                + ", trendWindow=" + trendWindow + ", noveltyHalfLifeDays=" + noveltyHalfLifeDays + '}';
    }
}
