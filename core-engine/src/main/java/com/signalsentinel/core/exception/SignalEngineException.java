package com.signalsentinel.core.exception;

/**
 * Root of the engine's unchecked exception hierarchy.
 *
 * <p>
 * Subclasses distinguish failures that only omit a sub-result
 * ({@link InsufficientDataException}), failures that abort a single pair
 * ({@link NumericOverflowException}) and failures that abort the whole batch
 * ({@link InvalidConfigurationException}).
 * </p>
 *
 * @since 1.0.0
 */
public class SignalEngineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SignalEngineException(String message) {
        super(message);
    }

    public SignalEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
