package com.signalsentinel.job;

import com.signalsentinel.core.config.SignalConfigLoader;
import com.signalsentinel.core.config.SignalDetectionConfig;
import com.signalsentinel.core.fusion.SignalScoringEngine;
import com.signalsentinel.core.model.AlertTier;
import com.signalsentinel.core.model.DrugEventPair;
import com.signalsentinel.core.model.FusionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Main entry point for the signal batch job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   INPUT_PATH (JSON array of pairs)
 *     → PairReader → DrugEventPair
 *     → SignalScoringEngine.scoreBatch (prior, components, FDR, fusion, ranking)
 *     → ResultWriter → JSON array of results
 *     → OUTPUT_PATH
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job settings are resolved from environment variables via {@link JobConfig}.
 * Scoring settings come from {@code SIGNAL_CONFIG_PATH} or the bundled
 * {@code signal-detection.yml}; {@code ENGINE_PARALLELISM} overrides the
 * configured worker count.
 * </p>
 *
 * <h3>Exit status</h3>
 * <p>
 * {@code 0} when the batch was scored and written, even if individual pairs
 * came back error-marked; {@code 1} for invalid configuration, unreadable or
 * malformed input, or an output that cannot be written.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignalBatchJob {

    private static final Logger LOG = LoggerFactory.getLogger(SignalBatchJob.class);

    private final JobConfig config;
    private final Clock clock;
    private final PairReader reader = new PairReader();
    private final ResultWriter writer = new ResultWriter();

    public SignalBatchJob(JobConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "JobConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    public static void main(String[] args) {
        try {
            JobConfig config = JobConfig.fromEnvironment();
            LOG.info("Starting signal batch job with config: {}", config);
            new SignalBatchJob(config, Clock.systemDefaultZone()).run();
        } catch (Exception e) {
            LOG.error("Signal batch job failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Read, score and write one batch.
     *
     * @return the engine's results, in output order
     * @throws IOException if the input cannot be read or the output written
     */
    public List<FusionResult> run() throws IOException {
        SignalDetectionConfig detectionConfig = loadDetectionConfig(config);
        SignalScoringEngine engine = new SignalScoringEngine(detectionConfig, clock);

        List<DrugEventPair> pairs = reader.read(Path.of(config.getInputPath()));
        LocalDate scoredOn = LocalDate.now(clock);
        List<FusionResult> results = engine.scoreBatch(pairs);

        writer.write(results, scoredOn, Path.of(config.getOutputPath()));
        logSummary(results);
        return results;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static SignalDetectionConfig loadDetectionConfig(JobConfig config) {
        SignalDetectionConfig detectionConfig = config.hasSignalConfigPath()
                ? SignalConfigLoader.fromFile(config.getSignalConfigPath())
                : SignalConfigLoader.load();
        if (config.getParallelism() > 0) {
            detectionConfig.getEngine().setParallelism(config.getParallelism());
        }
        return detectionConfig;
    }

    private static void logSummary(List<FusionResult> results) {
        long flagged = results.stream()
                .filter(r -> r.getAlertTier().filter(tier -> tier != AlertTier.NONE).isPresent())
                .count();
        long failed = results.stream().filter(r -> !r.isScored()).count();
        LOG.info("Batch complete: {} pair(s), {} with an alert tier above NONE, {} failed",
                results.size(), flagged, failed);
        results.stream()
                .filter(FusionResult::isScored)
                .limit(5)
                .forEach(r -> LOG.info("  #{} {} / {}: score={} tier={}", r.getRank().orElse(0),
                        r.getDrug(), r.getEvent(), r.getFusionScore().orElse(Double.NaN),
                        r.getAlertTier().orElse(AlertTier.NONE)));
    }
}
