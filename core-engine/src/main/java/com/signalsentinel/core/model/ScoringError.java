package com.signalsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Marker carried by a result whose pair could not be scored.
 *
 * @since 1.0.0
 */
public final class ScoringError implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Failure categories. */
    public enum Kind {
        NUMERIC_OVERFLOW,
        INVALID_INPUT,
        INTERNAL
    }

    private final Kind kind;
    private final String message;

    public ScoringError(Kind kind, String message) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.message = message != null ? message : "";
    }

    public Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScoringError that))
            return false;
        return kind == that.kind && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
