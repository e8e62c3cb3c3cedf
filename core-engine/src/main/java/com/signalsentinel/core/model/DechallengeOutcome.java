package com.signalsentinel.core.model;

/**
 * What happened to the reaction after the drug was withdrawn.
 *
 * @since 1.0.0
 */
public enum DechallengeOutcome {
    IMPROVED,
    UNCHANGED,
    UNKNOWN
}
