package com.signalsentinel.core.exception;

import java.util.Collections;
import java.util.List;

/**
 * Raised when a configuration value fails validation.
 *
 * <p>
 * Always raised before any scoring begins, so a batch is either scored with a
 * valid configuration or not scored at all.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidConfigurationException extends SignalEngineException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public InvalidConfigurationException(List<String> errors) {
        super("Signal detection configuration validation failed:\n  - "
                + String.join("\n  - ", errors));
        this.errors = List.copyOf(errors);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = Collections.singletonList(message);
    }

    /**
     * @return every validation error found, in discovery order
     */
    public List<String> getErrors() {
        return errors;
    }
}
