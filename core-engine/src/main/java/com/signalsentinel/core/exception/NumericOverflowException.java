package com.signalsentinel.core.exception;

/**
 * Raised when a computation produces a non-finite value that cannot be
 * reported.
 *
 * <p>
 * Fatal for the affected pair only: the pair is returned as an error-marked
 * result and the rest of the batch proceeds.
 * </p>
 *
 * @since 1.0.0
 */
public class NumericOverflowException extends SignalEngineException {

    private static final long serialVersionUID = 1L;

    public NumericOverflowException(String message) {
        super(message);
    }

    /**
     * Return {@code value} unchanged, or throw when it is NaN or infinite.
     *
     * @param value the computed value
     * @param what  name of the quantity, used in the message
     * @return {@code value}
     * @throws NumericOverflowException if {@code value} is not finite
     */
    public static double requireFinite(double value, String what) {
        if (!Double.isFinite(value)) {
            throw new NumericOverflowException(what + " is not finite: " + value);
        }
        return value;
    }
}
