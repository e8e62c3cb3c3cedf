package com.signalsentinel.core.config;

import java.util.List;

/**
 * Validation helpers shared by the configuration sections. Each helper
 * appends a message to {@code errors} instead of throwing, so that a single
 * validation pass reports every problem at once.
 */
final class ConfigChecks {

    /** Tolerance when checking that convex weights sum to one. */
    static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    private ConfigChecks() {
    }

    static void requirePositive(List<String> errors, String name, double value) {
        if (!(value > 0) || !Double.isFinite(value)) {
            errors.add(name + " must be > 0, got: " + value);
        }
    }

    static void requireNonNegative(List<String> errors, String name, double value) {
        if (!(value >= 0) || !Double.isFinite(value)) {
            errors.add(name + " must be >= 0, got: " + value);
        }
    }

    static void requireUnit(List<String> errors, String name, double value) {
        if (!(value >= 0 && value <= 1)) {
            errors.add(name + " must be in [0, 1], got: " + value);
        }
    }

    /**
     * Every weight must be non-negative and together they must sum to one.
     */
    static void requireConvex(List<String> errors, String section, String[] names, double... weights) {
        double sum = 0;
        for (int i = 0; i < weights.length; i++) {
            requireNonNegative(errors, section + "." + names[i], weights[i]);
            sum += weights[i];
        }
        if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
            errors.add(section + " weights must sum to 1.0, got: " + sum);
        }
    }
}
