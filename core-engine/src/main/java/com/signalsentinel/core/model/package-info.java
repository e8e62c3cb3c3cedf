/**
 * Immutable domain objects for the signal detection engine.
 *
 * <ul>
 * <li>{@link com.signalsentinel.core.model.DrugEventPair} is the engine
 * input: a {@link com.signalsentinel.core.model.ContingencyTable} plus
 * optional clinical, temporal and case context.</li>
 * <li>{@link com.signalsentinel.core.model.FusionResult} is the engine
 * output, carrying every intermediate result.</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.signalsentinel.core.model;
