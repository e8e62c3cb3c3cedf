/**
 * Classical disproportionality statistics: PRR, ROR and the information
 * component, with chi-square and Fisher exact tests.
 *
 * @since 1.0.0
 */
package com.signalsentinel.core.stats;
