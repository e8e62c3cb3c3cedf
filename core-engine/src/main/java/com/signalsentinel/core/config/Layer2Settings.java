package com.signalsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.signalsentinel.core.config.ConfigChecks.requireConvex;
import static com.signalsentinel.core.config.ConfigChecks.requireNonNegative;
import static com.signalsentinel.core.config.ConfigChecks.requireUnit;

/**
 * Multi-source composite scorer parameters.
 *
 * <p>
 * Frequency is scored by a step function: the first breakpoint the observed
 * count reaches (breakpoints in descending order) selects the score at the
 * same index.
 * </p>
 *
 * @since 1.0.0
 */
public class Layer2Settings implements Serializable {

    private static final long serialVersionUID = 1L;

    // --- Weights (convex) ---
    private double frequencyWeight = 0.25;
    private double severityWeight = 0.20;
    private double burstWeight = 0.15;
    private double noveltyWeight = 0.15;
    private double consensusWeight = 0.15;
    private double mechanismWeight = 0.10;

    // --- Frequency steps ---
    private List<Long> frequencyBreakpoints = new ArrayList<>(List.of(100L, 50L, 20L, 10L, 5L, 3L, 1L));
    private List<Double> frequencyScores = new ArrayList<>(List.of(1.0, 0.8, 0.6, 0.4, 0.3, 0.2, 0.1));

    // --- Burst / novelty ---
    private double burstSaturationFold = 4.0;
    private double labeledNoveltyFactor = 0.2;

    // --- Consensus ---
    private Map<String, Double> sourcePriorities = defaultSourcePriorities();
    private double highConfidence = 0.7;
    private double highStrength = 0.7;
    private int minHighConfidenceSources = 3;
    private double consensusBoost = 0.2;

    private static Map<String, Double> defaultSourcePriorities() {
        Map<String, Double> priorities = new LinkedHashMap<>();
        priorities.put("faers", 0.40);
        priorities.put("rwe", 0.25);
        priorities.put("clinicaltrials", 0.15);
        priorities.put("pubmed", 0.10);
        priorities.put("social", 0.07);
        priorities.put("label", 0.03);
        return priorities;
    }

    void validate(List<String> errors) {
        requireConvex(errors, "layer2",
                new String[] { "frequencyWeight", "severityWeight", "burstWeight", "noveltyWeight",
                        "consensusWeight", "mechanismWeight" },
                frequencyWeight, severityWeight, burstWeight, noveltyWeight, consensusWeight,
                mechanismWeight);

        if (frequencyBreakpoints.size() != frequencyScores.size()) {
            errors.add("layer2.frequencyBreakpoints and frequencyScores must have the same length, got: "
                    + frequencyBreakpoints.size() + " / " + frequencyScores.size());
        }
        for (int i = 0; i < frequencyBreakpoints.size(); i++) {
            long breakpoint = frequencyBreakpoints.get(i);
            if (breakpoint < 0) {
                errors.add("layer2.frequencyBreakpoints[" + i + "] must be >= 0, got: " + breakpoint);
            }
            if (i > 0 && breakpoint >= frequencyBreakpoints.get(i - 1)) {
                errors.add("layer2.frequencyBreakpoints must be strictly descending at index " + i);
            }
        }
        for (int i = 0; i < frequencyScores.size(); i++) {
            requireUnit(errors, "layer2.frequencyScores[" + i + "]", frequencyScores.get(i));
        }

        if (!(burstSaturationFold > 1)) {
            errors.add("layer2.burstSaturationFold must be > 1, got: " + burstSaturationFold);
        }
        requireUnit(errors, "layer2.labeledNoveltyFactor", labeledNoveltyFactor);
        sourcePriorities.forEach((source, weight) ->
                requireNonNegative(errors, "layer2.sourcePriorities." + source, weight));
        requireUnit(errors, "layer2.highConfidence", highConfidence);
        requireUnit(errors, "layer2.highStrength", highStrength);
        if (minHighConfidenceSources < 1) {
            errors.add("layer2.minHighConfidenceSources must be >= 1, got: " + minHighConfidenceSources);
        }
        requireNonNegative(errors, "layer2.consensusBoost", consensusBoost);
    }

    /**
     * @param sourceType source key (any case)
     * @return the configured priority, or {@code 0} for unknown sources
     */
    public double sourcePriority(String sourceType) {
        Double priority = sourcePriorities.get(sourceType.toLowerCase(Locale.ROOT));
        return priority != null ? priority : 0.0;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for SnakeYAML)
    // ---------------------------------------------------------------

    public double getFrequencyWeight() {
        return frequencyWeight;
    }

    public void setFrequencyWeight(double frequencyWeight) {
        this.frequencyWeight = frequencyWeight;
    }

    public double getSeverityWeight() {
        return severityWeight;
    }

    public void setSeverityWeight(double severityWeight) {
        this.severityWeight = severityWeight;
    }

    public double getBurstWeight() {
        return burstWeight;
    }

    public void setBurstWeight(double burstWeight) {
        this.burstWeight = burstWeight;
    }

    public double getNoveltyWeight() {
        return noveltyWeight;
    }

    public void setNoveltyWeight(double noveltyWeight) {
        this.noveltyWeight = noveltyWeight;
    }

    public double getConsensusWeight() {
        return consensusWeight;
    }

    public void setConsensusWeight(double consensusWeight) {
        this.consensusWeight = consensusWeight;
    }

    public double getMechanismWeight() {
        return mechanismWeight;
    }

    public void setMechanismWeight(double mechanismWeight) {
        this.mechanismWeight = mechanismWeight;
    }

    public List<Long> getFrequencyBreakpoints() {
        return Collections.unmodifiableList(frequencyBreakpoints);
    }

    /**
     * YAML integers arrive as {@link Integer} or {@link Long}; both are
     * accepted.
     */
    public void setFrequencyBreakpoints(List<? extends Number> frequencyBreakpoints) {
        List<Long> copy = new ArrayList<>();
        if (frequencyBreakpoints != null) {
            for (Number n : frequencyBreakpoints) {
                copy.add(n.longValue());
            }
        }
        this.frequencyBreakpoints = copy;
    }

    public List<Double> getFrequencyScores() {
        return Collections.unmodifiableList(frequencyScores);
    }

    public void setFrequencyScores(List<? extends Number> frequencyScores) {
        List<Double> copy = new ArrayList<>();
        if (frequencyScores != null) {
            for (Number n : frequencyScores) {
                copy.add(n.doubleValue());
            }
        }
        this.frequencyScores = copy;
    }

    public double getBurstSaturationFold() {
        return burstSaturationFold;
    }

    public void setBurstSaturationFold(double burstSaturationFold) {
        this.burstSaturationFold = burstSaturationFold;
    }

    public double getLabeledNoveltyFactor() {
        return labeledNoveltyFactor;
    }

    public void setLabeledNoveltyFactor(double labeledNoveltyFactor) {
        this.labeledNoveltyFactor = labeledNoveltyFactor;
    }

    public Map<String, Double> getSourcePriorities() {
        return Collections.unmodifiableMap(sourcePriorities);
    }

    public void setSourcePriorities(Map<String, ? extends Number> sourcePriorities) {
        Map<String, Double> copy = new LinkedHashMap<>();
        if (sourcePriorities != null) {
            sourcePriorities.forEach((k, v) -> copy.put(k.toLowerCase(Locale.ROOT), v.doubleValue()));
        }
        this.sourcePriorities = copy;
    }

    public double getHighConfidence() {
        return highConfidence;
    }

    public void setHighConfidence(double highConfidence) {
        this.highConfidence = highConfidence;
    }

    public double getHighStrength() {
        return highStrength;
    }

    public void setHighStrength(double highStrength) {
        this.highStrength = highStrength;
    }

    public int getMinHighConfidenceSources() {
        return minHighConfidenceSources;
    }

    public void setMinHighConfidenceSources(int minHighConfidenceSources) {
        this.minHighConfidenceSources = minHighConfidenceSources;
    }

    public double getConsensusBoost() {
        return consensusBoost;
    }

    public void setConsensusBoost(double consensusBoost) {
        this.consensusBoost = consensusBoost;
    }

    @Override
    public String toString() {
        return "Layer2Settings{weights=[" + frequencyWeight + ", " + severityWeight + ", "
                + burstWeight + ", " + noveltyWeight + ", " + consensusWeight + ", "
                + mechanismWeight + "], sources=" + sourcePriorities.keySet() + '}';
    }
}
