/**
 * Command-line batch runner for the signal scoring engine.
 *
 * <p>
 * This package reads drug-event pairs from a JSON file, scores the batch with
 * {@link com.signalsentinel.core.fusion.SignalScoringEngine} and writes the
 * ranked results back as JSON.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.signalsentinel.job.SignalBatchJob}: main entry point</li>
 * <li>{@link com.signalsentinel.job.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.signalsentinel.job.PairReader} /
 * {@link com.signalsentinel.job.ResultWriter}: JSON input and output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.signalsentinel.job;
