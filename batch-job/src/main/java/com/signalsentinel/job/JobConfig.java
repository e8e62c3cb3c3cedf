package com.signalsentinel.job;

import java.io.Serializable;

/**
 * Typed, immutable configuration object for the signal batch job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job can be driven from a shell, a container {@code -e} flag or a
 * scheduler's job definition.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String ENV_INPUT_PATH = "INPUT_PATH";
    public static final String ENV_OUTPUT_PATH = "OUTPUT_PATH";
    public static final String ENV_SIGNAL_CONFIG_PATH = "SIGNAL_CONFIG_PATH";
    public static final String ENV_ENGINE_PARALLELISM = "ENGINE_PARALLELISM";

    static final String DEFAULT_OUTPUT_PATH = "signal-results.json";

    // ---------------------------------------------------------------
    // Files
    // ---------------------------------------------------------------
    private final String inputPath;
    private final String outputPath;

    // ---------------------------------------------------------------
    // Engine
    // ---------------------------------------------------------------
    private final String signalConfigPath;
    private final int parallelism;

    private JobConfig(Builder b) {
        this.inputPath = b.inputPath;
        this.outputPath = b.outputPath;
        this.signalConfigPath = b.signalConfigPath;
        this.parallelism = b.parallelism;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .inputPath(env(ENV_INPUT_PATH, ""))
                    .outputPath(env(ENV_OUTPUT_PATH, DEFAULT_OUTPUT_PATH))
                    .signalConfigPath(env(ENV_SIGNAL_CONFIG_PATH, ""))
                    .parallelism(parseIntEnv(ENV_ENGINE_PARALLELISM, "0"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getInputPath() {
        return inputPath;
    }

    public String getOutputPath() {
        return outputPath;
    }

    /**
     * @return path of the YAML configuration; blank when the bundled
     *         defaults apply
     */
    public String getSignalConfigPath() {
        return signalConfigPath;
    }

    public boolean hasSignalConfigPath() {
        return !signalConfigPath.isBlank();
    }

    /**
     * @return worker threads per batch; {@code 0} keeps the value from the
     *         YAML configuration
     */
    public int getParallelism() {
        return parallelism;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that the input and output paths
     * are non-blank and distinct, and that parallelism is not negative.
     * </p>
     */
    public static class Builder {
        private String inputPath = "";
        private String outputPath = DEFAULT_OUTPUT_PATH;
        private String signalConfigPath = "";
        private int parallelism = 0;

        public Builder inputPath(String v) {
            this.inputPath = v;
            return this;
        }

        public Builder outputPath(String v) {
            this.outputPath = v;
            return this;
        }

        public Builder signalConfigPath(String v) {
            this.signalConfigPath = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(inputPath, "inputPath (" + ENV_INPUT_PATH + ")");
            requireNonBlank(outputPath, "outputPath (" + ENV_OUTPUT_PATH + ")");
            if (inputPath.equals(outputPath)) {
                throw new IllegalArgumentException("outputPath must differ from inputPath: " + inputPath);
            }
            if (signalConfigPath == null) {
                signalConfigPath = "";
            }
            if (parallelism < 0) {
                throw new IllegalArgumentException("parallelism must be >= 0, got: " + parallelism);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "inputPath='" + inputPath + '\'' +
                ", outputPath='" + outputPath + '\'' +
                ", signalConfigPath='" + signalConfigPath + '\'' +
                ", parallelism=" + parallelism +
                '}';
    }
}
