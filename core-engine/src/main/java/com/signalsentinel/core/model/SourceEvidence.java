package com.signalsentinel.core.model;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;

/**
 * Evidence for a drug-event pair from one data source (spontaneous reports,
 * literature, trials, ...).
 *
 * @since 1.0.0
 */
public final class SourceEvidence implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sourceType;
    private final double confidence;
    private final double strength;

    /**
     * @param sourceType source key, matched case-insensitively against the
     *                   configured source priorities
     * @param confidence confidence in [0, 1]
     * @param strength   signal strength in [0, 1]
     * @throws IllegalArgumentException if a value lies outside [0, 1]
     */
    public SourceEvidence(String sourceType, double confidence, double strength) {
        this.sourceType = Objects.requireNonNull(sourceType, "sourceType must not be null")
                .toLowerCase(Locale.ROOT);
        this.confidence = requireUnit(confidence, "confidence");
        this.strength = requireUnit(strength, "strength");
    }

    public String getSourceType() {
        return sourceType;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getStrength() {
        return strength;
    }

    private static double requireUnit(double value, String name) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in [0, 1], got: " + value);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SourceEvidence that))
            return false;
        return Double.compare(confidence, that.confidence) == 0
                && Double.compare(strength, that.strength) == 0
                && sourceType.equals(that.sourceType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceType, confidence, strength);
    }

    @Override
    public String toString() {
        return sourceType + "(confidence=" + confidence + ", strength=" + strength + ")";
    }
}
