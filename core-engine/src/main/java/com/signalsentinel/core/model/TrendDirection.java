package com.signalsentinel.core.model;

/**
 * @since 1.0.0
 */
public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE
}
