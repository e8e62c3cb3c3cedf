package com.signalsentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Execution settings for batch scoring.
 *
 * @since 1.0.0
 */
public class EngineSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Worker threads per batch; {@code 0} means one per available processor. */
    private int parallelism = 0;

    void validate(List<String> errors) {
        if (parallelism < 0) {
            errors.add("engine.parallelism must be >= 0, got: " + parallelism);
        }
    }

    /**
     * @return the configured thread count, resolving {@code 0} to the number
     *         of available processors
     */
    public int effectiveParallelism() {
        return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    @Override
    public String toString() {
        return "EngineSettings{parallelism=" + parallelism + '}';
    }
}
