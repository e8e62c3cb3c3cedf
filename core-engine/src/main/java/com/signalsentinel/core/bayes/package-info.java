/**
 * Empirical-Bayes Gamma-Poisson shrinkage with a batch-fitted prior and
 * Benjamini–Hochberg false discovery rate control.
 *
 * @since 1.0.0
 */
package com.signalsentinel.core.bayes;
