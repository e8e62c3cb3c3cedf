package com.signalsentinel.core.model;

/**
 * Ordinal strength of a detected signal, with the confidence level attached
 * to each grade.
 *
 * @since 1.0.0
 */
public enum SignalStrength {

    NONE(0.25),
    WEAK(0.50),
    MODERATE(0.70),
    STRONG(0.85),
    VERY_STRONG(0.95);

    private final double confidence;

    SignalStrength(double confidence) {
        this.confidence = confidence;
    }

    public double getConfidence() {
        return confidence;
    }
}
