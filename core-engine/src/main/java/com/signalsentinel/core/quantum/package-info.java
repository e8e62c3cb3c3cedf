/**
 * Two-layer composite scoring.
 *
 * <p>
 * {@link com.signalsentinel.core.quantum.SingleSourceScorer} (layer 1) rewards
 * rare, serious and recent reports with interaction and tunneling boosts.
 * {@link com.signalsentinel.core.quantum.MultiSourceScorer} (layer 2) measures
 * corroboration across reporting sources.
 * </p>
 */
package com.signalsentinel.core.quantum;
