package com.signalsentinel.core.model;

/**
 * Tri-state answer to a clinical evidence question.
 *
 * @since 1.0.0
 */
public enum Answer {
    YES,
    NO,
    UNKNOWN;

    /**
     * @param value {@code true}, {@code false}, or {@code null} for unknown
     * @return the matching answer
     */
    public static Answer of(Boolean value) {
        if (value == null) {
            return UNKNOWN;
        }
        return value ? YES : NO;
    }
}
