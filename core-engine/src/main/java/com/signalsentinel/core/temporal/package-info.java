/**
 * Time-series analysis of reporting counts: spikes against a rolling
 * baseline, log-linear trend, novelty, mean-shift change points and the
 * combined temporal risk score.
 */
package com.signalsentinel.core.temporal;
