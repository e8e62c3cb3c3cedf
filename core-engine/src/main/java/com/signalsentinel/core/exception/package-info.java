/**
 * Unchecked exceptions raised by the scoring engine.
 *
 * @since 1.0.0
 */
package com.signalsentinel.core.exception;
