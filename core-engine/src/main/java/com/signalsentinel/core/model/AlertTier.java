package com.signalsentinel.core.model;

/**
 * Alert tiers ordered from most to least urgent. The score thresholds live in
 * configuration.
 *
 * @since 1.0.0
 */
public enum AlertTier {
    CRITICAL,
    HIGH,
    MODERATE,
    WATCHLIST,
    LOW,
    NONE
}
