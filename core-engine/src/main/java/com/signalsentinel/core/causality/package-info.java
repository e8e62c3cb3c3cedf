/**
 * Deterministic causality assessment: the WHO-UMC decision table and the
 * Naranjo questionnaire, reported side by side.
 *
 * @since 1.0.0
 */
package com.signalsentinel.core.causality;
