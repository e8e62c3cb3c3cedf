package com.signalsentinel.core.model;

/**
 * WHO-UMC causality categories, each with the base confidence it lends to the
 * causality assessment.
 *
 * @since 1.0.0
 */
public enum WhoUmcCategory {

    CERTAIN(0.95),
    PROBABLE(0.75),
    POSSIBLE(0.50),
    UNLIKELY(0.25),
    CONDITIONAL(0.40),
    UNASSESSABLE(0.20);

    private final double baseConfidence;

    WhoUmcCategory(double baseConfidence) {
        this.baseConfidence = baseConfidence;
    }

    public double getBaseConfidence() {
        return baseConfidence;
    }
}
