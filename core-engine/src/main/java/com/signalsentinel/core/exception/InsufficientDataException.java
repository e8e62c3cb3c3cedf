package com.signalsentinel.core.exception;

/**
 * Raised when an input is too sparse for a statistic to be computed.
 *
 * <p>
 * Non-fatal: the orchestrator omits the affected sub-result and records a
 * note on the pair's result.
 * </p>
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends SignalEngineException {

    private static final long serialVersionUID = 1L;

    public InsufficientDataException(String message) {
        super(message);
    }
}
