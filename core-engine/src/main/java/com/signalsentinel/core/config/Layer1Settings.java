package com.signalsentinel.core.config;

import java.io.Serializable;
import java.util.List;

import static com.signalsentinel.core.config.ConfigChecks.requireConvex;
import static com.signalsentinel.core.config.ConfigChecks.requireNonNegative;
import static com.signalsentinel.core.config.ConfigChecks.requirePositive;
import static com.signalsentinel.core.config.ConfigChecks.requireUnit;

/**
 * Single-source composite scorer parameters: sub-score weights, interaction
 * boosts, the tunneling band and the sub-score normalisation constants.
 *
 * @since 1.0.0
 */
public class Layer1Settings implements Serializable {

    private static final long serialVersionUID = 1L;

    // --- Base weights (convex) ---
    private double rarityWeight = 0.40;
    private double seriousnessWeight = 0.35;
    private double recencyWeight = 0.20;
    private double countWeight = 0.05;

    // --- Interactions ---
    private double pairThreshold = 0.7;
    private double tripleThreshold = 0.6;
    private double rareSeriousBoost = 0.15;
    private double rareRecentBoost = 0.10;
    private double seriousRecentBoost = 0.10;
    private double allThreeBoost = 0.20;

    // --- Tunneling ---
    private double tunnelingLower = 0.5;
    private double tunnelingUpper = 0.7;
    private double tunnelingBoost = 0.05;

    // --- Seriousness ---
    private double seriousFlagWeight = 0.5;
    private double deathWeight = 0.5;
    private double hospitalizationWeight = 0.3;
    private double disabilityWeight = 0.2;
    private double seriousFractionWeight = 0.3;

    // --- Recency ---
    private int recentDays = 365;
    private int moderateDays = 730;
    private double recentScore = 1.0;
    private double moderateScore = 0.5;
    private double oldScore = 0.2;
    private double unknownRecencyScore = 0.5;

    // --- Count ---
    private double countSaturation = 10.0;

    void validate(List<String> errors) {
        requireConvex(errors, "layer1",
                new String[] { "rarityWeight", "seriousnessWeight", "recencyWeight", "countWeight" },
                rarityWeight, seriousnessWeight, recencyWeight, countWeight);
        requireUnit(errors, "layer1.pairThreshold", pairThreshold);
        requireUnit(errors, "layer1.tripleThreshold", tripleThreshold);
        requireNonNegative(errors, "layer1.rareSeriousBoost", rareSeriousBoost);
        requireNonNegative(errors, "layer1.rareRecentBoost", rareRecentBoost);
        requireNonNegative(errors, "layer1.seriousRecentBoost", seriousRecentBoost);
        requireNonNegative(errors, "layer1.allThreeBoost", allThreeBoost);
        requireUnit(errors, "layer1.tunnelingLower", tunnelingLower);
        requireUnit(errors, "layer1.tunnelingUpper", tunnelingUpper);
        if (tunnelingUpper < tunnelingLower) {
            errors.add("layer1.tunnelingUpper (" + tunnelingUpper + ") must be >= tunnelingLower ("
                    + tunnelingLower + ")");
        }
        requireNonNegative(errors, "layer1.tunnelingBoost", tunnelingBoost);
        requireNonNegative(errors, "layer1.seriousFlagWeight", seriousFlagWeight);
        requireNonNegative(errors, "layer1.deathWeight", deathWeight);
        requireNonNegative(errors, "layer1.hospitalizationWeight", hospitalizationWeight);
        requireNonNegative(errors, "layer1.disabilityWeight", disabilityWeight);
        requireNonNegative(errors, "layer1.seriousFractionWeight", seriousFractionWeight);
        if (recentDays <= 0 || moderateDays <= recentDays) {
            errors.add("layer1 recency buckets must satisfy 0 < recentDays < moderateDays, got: "
                    + recentDays + " / " + moderateDays);
        }
        requireUnit(errors, "layer1.recentScore", recentScore);
        requireUnit(errors, "layer1.moderateScore", moderateScore);
        requireUnit(errors, "layer1.oldScore", oldScore);
        requireUnit(errors, "layer1.unknownRecencyScore", unknownRecencyScore);
        requirePositive(errors, "layer1.countSaturation", countSaturation);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for SnakeYAML)
    // ---------------------------------------------------------------

    public double getRarityWeight() {
        return rarityWeight;
    }

    public void setRarityWeight(double rarityWeight) {
        this.rarityWeight = rarityWeight;
    }

    public double getSeriousnessWeight() {
        return seriousnessWeight;
    }

    public void setSeriousnessWeight(double seriousnessWeight) {
        this.seriousnessWeight = seriousnessWeight;
    }

    public double getRecencyWeight() {
        return recencyWeight;
    }

    public void setRecencyWeight(double recencyWeight) {
        this.recencyWeight = recencyWeight;
    }

    public double getCountWeight() {
        return countWeight;
    }

    public void setCountWeight(double countWeight) {
        this.countWeight = countWeight;
    }

    public double getPairThreshold() {
        return pairThreshold;
    }

    public void setPairThreshold(double pairThreshold) {
        this.pairThreshold = pairThreshold;
    }

    public double getTripleThreshold() {
        return tripleThreshold;
    }

    public void setTripleThreshold(double tripleThreshold) {
        this.tripleThreshold = tripleThreshold;
    }

    public double getRareSeriousBoost() {
        return rareSeriousBoost;
    }

    public void setRareSeriousBoost(double rareSeriousBoost) {
        this.rareSeriousBoost = rareSeriousBoost;
    }

    public double getRareRecentBoost() {
        return rareRecentBoost;
    }

    public void setRareRecentBoost(double rareRecentBoost) {
        this.rareRecentBoost = rareRecentBoost;
    }

    public double getSeriousRecentBoost() {
        return seriousRecentBoost;
    }

    public void setSeriousRecentBoost(double seriousRecentBoost) {
        this.seriousRecentBoost = seriousRecentBoost;
    }

    public double getAllThreeBoost() {
        return allThreeBoost;
    }

    public void setAllThreeBoost(double allThreeBoost) {
        this.allThreeBoost = allThreeBoost;
    }

    public double getTunnelingLower() {
        return tunnelingLower;
    }

    public void setTunnelingLower(double tunnelingLower) {
        this.tunnelingLower = tunnelingLower;
    }

    public double getTunnelingUpper() {
        return tunnelingUpper;
    }

    public void setTunnelingUpper(double tunnelingUpper) {
        this.tunnelingUpper = tunnelingUpper;
    }

    public double getTunnelingBoost() {
        return tunnelingBoost;
    }

    public void setTunnelingBoost(double tunnelingBoost) {
        this.tunnelingBoost = tunnelingBoost;
    }

    public double getSeriousFlagWeight() {
        return seriousFlagWeight;
    }

    public void setSeriousFlagWeight(double seriousFlagWeight) {
        this.seriousFlagWeight = seriousFlagWeight;
    }

    public double getDeathWeight() {
        return deathWeight;
    }

    public void setDeathWeight(double deathWeight) {
        this.deathWeight = deathWeight;
    }

    public double getHospitalizationWeight() {
        return hospitalizationWeight;
    }

    public void setHospitalizationWeight(double hospitalizationWeight) {
        this.hospitalizationWeight = hospitalizationWeight;
    }

    public double getDisabilityWeight() {
        return disabilityWeight;
    }

    public void setDisabilityWeight(double disabilityWeight) {
        this.disabilityWeight = disabilityWeight;
    }

    public double getSeriousFractionWeight() {
        return seriousFractionWeight;
    }

    public void setSeriousFractionWeight(double seriousFractionWeight) {
        this.seriousFractionWeight = seriousFractionWeight;
    }

    public int getRecentDays() {
        return recentDays;
    }

    public void setRecentDays(int recentDays) {
        this.recentDays = recentDays;
    }

    public int getModerateDays() {
        return moderateDays;
    }

    public void setModerateDays(int moderateDays) {
        this.moderateDays = moderateDays;
    }

    public double getRecentScore() {
        return recentScore;
    }

    public void setRecentScore(double recentScore) {
        this.recentScore = recentScore;
    }

    public double getModerateScore() {
        return moderateScore;
    }

    public void setModerateScore(double moderateScore) {
        this.moderateScore = moderateScore;
    }

    public double getOldScore() {
        return oldScore;
    }

    public void setOldScore(double oldScore) {
        this.oldScore = oldScore;
    }

    public double getUnknownRecencyScore() {
        return unknownRecencyScore;
    }

    public void setUnknownRecencyScore(double unknownRecencyScore) {
        this.unknownRecencyScore = unknownRecencyScore;
    }

    public double getCountSaturation() {
        return countSaturation;
    }

    public void setCountSaturation(double countSaturation) {
        this.countSaturation = countSaturation;
    }

    @Override
    public String toString() {
        return "Layer1Settings{weights=[" + rarityWeight + ", " + seriousnessWeight + ", "
                + recencyWeight + ", " + countWeight + "], pairThreshold=" + pairThreshold
                + ", tripleThreshold=" + tripleThreshold + '}';
    }
}
