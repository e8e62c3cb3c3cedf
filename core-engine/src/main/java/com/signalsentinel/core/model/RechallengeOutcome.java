package com.signalsentinel.core.model;

/**
 * What happened when the drug was re-administered.
 *
 * @since 1.0.0
 */
public enum RechallengeOutcome {
    RECURRED,
    DID_NOT_RECUR,
    NOT_ATTEMPTED
}
