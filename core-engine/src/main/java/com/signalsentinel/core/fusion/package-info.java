/**
 * Fusion orchestration: evidence score, fusion score, alert tiers and batch
 * ranking, driven by {@link com.signalsentinel.core.fusion.SignalScoringEngine}.
 */
package com.signalsentinel.core.fusion;
