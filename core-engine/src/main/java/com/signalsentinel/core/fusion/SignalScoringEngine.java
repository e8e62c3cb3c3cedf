package com.signalsentinel.core.fusion;

import com.signalsentinel.core.bayes.BayesianShrinkageEstimator;
import com.signalsentinel.core.bayes.GammaPoissonShrinker;
import com.signalsentinel.core.causality.CausalityAssessor;
import com.signalsentinel.core.config.SignalDetectionConfig;
import com.signalsentinel.core.exception.InsufficientDataException;
import com.signalsentinel.core.exception.InvalidConfigurationException;
import com.signalsentinel.core.exception.NumericOverflowException;
import com.signalsentinel.core.exception.SignalEngineException;
import com.signalsentinel.core.model.AlertTier;
import com.signalsentinel.core.model.BayesianResult;
import com.signalsentinel.core.model.CaseProfile;
import com.signalsentinel.core.model.CausalityResult;
import com.signalsentinel.core.model.ContingencyTable;
import com.signalsentinel.core.model.DisproportionalityResult;
import com.signalsentinel.core.model.DrugEventPair;
import com.signalsentinel.core.model.FusionResult;
import com.signalsentinel.core.model.MultiSourceComponents;
import com.signalsentinel.core.model.ScoringError;
import com.signalsentinel.core.model.ShrinkagePrior;
import com.signalsentinel.core.model.SingleSourceComponents;
import com.signalsentinel.core.model.TemporalResult;
import com.signalsentinel.core.model.TimeSeriesData;
import com.signalsentinel.core.quantum.MultiSourceScorer;
import com.signalsentinel.core.quantum.SingleSourceScorer;
import com.signalsentinel.core.stats.DisproportionalityCalculator;
import com.signalsentinel.core.temporal.TemporalPatternAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Entry point of the engine: scores drug-event pairs end to end.
 *
 * <h3>Batch phases</h3>
 * <ol>
 * <li><b>Prior fit</b>: one shrinkage prior over every table of the batch</li>
 * <li><b>Scoring</b>: disproportionality, Bayesian posterior, causality,
 * temporal analysis and both composite layers, per pair and in parallel</li>
 * <li><b>FDR</b>: Benjamini–Hochberg over every Bayesian p-value of the
 * batch</li>
 * <li><b>Fusion</b>: evidence score, squashed layer 1 and layer 2 combined
 * into the fusion score and alert tier</li>
 * <li><b>Ranking</b>: rank and percentile among the pairs that scored</li>
 * </ol>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * Missing data only omits the affected component and records a note. A pair
 * whose computation overflows, or whose input is rejected, comes back as an
 * error-marked result while the rest of the batch completes. An invalid
 * configuration is rejected by the constructor and again at the start of
 * every {@link #scoreBatch(List)} and {@link #scoreOne(DrugEventPair)} call,
 * before anything is scored.
 * </p>
 *
 * <h3>Configuration snapshot</h3>
 * <p>
 * The scoring components are built from the configuration once per call, so
 * a change made between batches applies to the whole of the next batch and
 * never to part of one. The configuration must not be changed while a call is
 * running.
 * </p>
 *
 * <h3>Threading</h3>
 * <p>
 * Each batch runs on its own fixed-size pool which is shut down before
 * {@link #scoreBatch(List)} returns. Results do not depend on the pool size.
 * The reference date for recency and novelty is read from the clock once per
 * batch.
 * </p>
 *
 * @since 1.0.0
 */
public class SignalScoringEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SignalScoringEngine.class);

    private final SignalDetectionConfig config;
    private final Clock clock;

    public SignalScoringEngine(SignalDetectionConfig config) {
        this(config, Clock.systemDefaultZone());
    }

    /**
     * @throws InvalidConfigurationException if the configuration is invalid
     */
    public SignalScoringEngine(SignalDetectionConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "SignalDetectionConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        config.validate();
    }

    /**
     * Score and rank one batch.
     *
     * @param pairs the batch; an empty list yields an empty result
     * @return one result per input pair: ranked results in rank order,
     *         followed by error-marked results in input order
     * @throws InvalidConfigurationException if the configuration was changed
     *                                       into an invalid state
     */
    public List<FusionResult> scoreBatch(List<DrugEventPair> pairs) {
        Objects.requireNonNull(pairs, "pairs must not be null");
        Pipeline pipeline = new Pipeline(config);
        if (pairs.isEmpty()) {
            return List.of();
        }
        LocalDate asOf = LocalDate.now(clock);
        long start = System.nanoTime();

        List<ContingencyTable> tables = pairs.stream()
                .map(DrugEventPair::getTable)
                .collect(Collectors.toList());
        ShrinkagePrior prior = pipeline.bayesianEstimator.fitPrior(tables);
        LOG.info("Fitted shrinkage prior for batch of {} pair(s): {}", pairs.size(), prior);

        GammaPoissonShrinker shrinker = pipeline.bayesianEstimator.shrinker(prior);
        List<PairAnalysis> analyses = analyzeAll(pipeline, pairs, shrinker, asOf);
        analyses = adjustForMultipleTesting(pipeline, analyses);

        List<FusionResult> fused = new ArrayList<>(analyses.size());
        for (PairAnalysis analysis : analyses) {
            fused.add(fuse(pipeline, analysis));
        }
        List<FusionResult> ranked = BatchRanker.rank(fused);

        logSummary(ranked, asOf, (System.nanoTime() - start) / 1_000_000);
        return Collections.unmodifiableList(ranked);
    }

    /**
     * Score a single pair without ranking it. The shrinkage prior falls back
     * to its default and the adjusted p-value equals the raw one.
     *
     * @throws InvalidConfigurationException if the configuration was changed
     *                                       into an invalid state
     */
    public FusionResult scoreOne(DrugEventPair pair) {
        Objects.requireNonNull(pair, "DrugEventPair must not be null");
        Pipeline pipeline = new Pipeline(config);
        LocalDate asOf = LocalDate.now(clock);
        ShrinkagePrior prior = pipeline.bayesianEstimator.fitPrior(List.of(pair.getTable()));
        PairAnalysis analysis = analyze(pipeline, pair, pipeline.bayesianEstimator.shrinker(prior), asOf);
        return fuse(pipeline, adjustForMultipleTesting(pipeline, List.of(analysis)).get(0));
    }

    public SignalDetectionConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Scoring phase
    // ---------------------------------------------------------------

    private List<PairAnalysis> analyzeAll(Pipeline pipeline, List<DrugEventPair> pairs,
            GammaPoissonShrinker shrinker, LocalDate asOf) {
        int threads = Math.max(1, Math.min(config.getEngine().effectiveParallelism(), pairs.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads, workerThreadFactory());
        try {
            List<Callable<PairAnalysis>> tasks = new ArrayList<>(pairs.size());
            for (DrugEventPair pair : pairs) {
                tasks.add(() -> analyze(pipeline, pair, shrinker, asOf));
            }
            List<Future<PairAnalysis>> futures = executor.invokeAll(tasks);

            List<PairAnalysis> analyses = new ArrayList<>(pairs.size());
            for (int i = 0; i < futures.size(); i++) {
                analyses.add(await(futures.get(i), pairs.get(i)));
            }
            return analyses;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SignalEngineException("Interrupted while scoring batch", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static PairAnalysis await(Future<PairAnalysis> future, DrugEventPair pair)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("Unexpected failure scoring {}", pair.key(), cause);
            return PairAnalysis.failed(pair, new ScoringError(ScoringError.Kind.INTERNAL,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage()));
        }
    }

    PairAnalysis analyze(Pipeline pipeline, DrugEventPair pair, GammaPoissonShrinker shrinker,
            LocalDate asOf) {
        List<String> notes = new ArrayList<>();
        try {
            DisproportionalityResult disproportionality = null;
            BayesianResult bayesian = null;
            try {
                disproportionality = pipeline.disproportionalityCalculator.calculate(pair.getTable());
                bayesian = shrinker.shrink(pair.getTable());
            } catch (InsufficientDataException e) {
                omit(pair, notes, "Disproportionality and Bayesian analysis", e);
            }

            CausalityResult causality = null;
            if (pair.getClinicalFeatures().isPresent()) {
                causality = pipeline.causalityAssessor.assess(pair.getClinicalFeatures().get());
            } else {
                notes.add("Causality not assessed: no clinical features");
            }

            TemporalResult temporal = null;
            if (pair.getTimeSeries().isPresent()) {
                TimeSeriesData series = pair.getTimeSeries().get();
                boolean labeled = pair.getCaseProfile().map(CaseProfile::isLabeled).orElse(false);
                List<Integer> onsetDays = pair.getCaseProfile().map(CaseProfile::getOnsetDays).orElse(List.of());
                try {
                    temporal = pipeline.temporalAnalyzer.analyze(series, labeled, onsetDays, asOf);
                    if (temporal.getTrend().isEmpty()) {
                        notes.add("Trend omitted: fewer than 2 time points");
                    }
                } catch (InsufficientDataException e) {
                    omit(pair, notes, "Temporal analysis", e);
                }
            } else {
                notes.add("Temporal analysis not performed: no time series");
            }

            SingleSourceComponents singleSource = pipeline.singleSourceScorer.score(pair, asOf);
            NumericOverflowException.requireFinite(singleSource.getScore(), "layer-1 score");
            MultiSourceComponents multiSource = pipeline.multiSourceScorer.score(pair, temporal, asOf);
            NumericOverflowException.requireFinite(multiSource.getScore(), "layer-2 score");

            return new PairAnalysis(pair, disproportionality, bayesian, causality, temporal, singleSource,
                    multiSource, notes);
        } catch (NumericOverflowException e) {
            LOG.error("Numeric overflow scoring {}: {}", pair.key(), e.getMessage());
            return PairAnalysis.failed(pair, new ScoringError(ScoringError.Kind.NUMERIC_OVERFLOW, e.getMessage()));
        } catch (SignalEngineException | IllegalArgumentException e) {
            LOG.error("Invalid input for {}: {}", pair.key(), e.getMessage());
            return PairAnalysis.failed(pair, new ScoringError(ScoringError.Kind.INVALID_INPUT, e.getMessage()));
        }
    }

    private static void omit(DrugEventPair pair, List<String> notes, String component,
            InsufficientDataException e) {
        LOG.warn("{} omitted for {}: {}", component, pair.key(), e.getMessage());
        notes.add(component + " omitted: " + e.getMessage());
    }

    // ---------------------------------------------------------------
    // FDR, fusion and reporting
    // ---------------------------------------------------------------

    private List<PairAnalysis> adjustForMultipleTesting(Pipeline pipeline, List<PairAnalysis> analyses) {
        List<Integer> positions = new ArrayList<>();
        List<BayesianResult> raw = new ArrayList<>();
        for (int i = 0; i < analyses.size(); i++) {
            PairAnalysis analysis = analyses.get(i);
            if (!analysis.isFailed() && analysis.bayesian != null) {
                positions.add(i);
                raw.add(analysis.bayesian);
            }
        }
        if (raw.isEmpty()) {
            return analyses;
        }

        List<BayesianResult> adjusted = pipeline.bayesianEstimator.adjust(raw);
        List<PairAnalysis> out = new ArrayList<>(analyses);
        for (int k = 0; k < positions.size(); k++) {
            int i = positions.get(k);
            out.set(i, out.get(i).withBayesian(adjusted.get(k)));
        }
        return out;
    }

    private FusionResult fuse(Pipeline pipeline, PairAnalysis analysis) {
        if (analysis.isFailed()) {
            return FusionResult.failed(analysis.pair, analysis.error);
        }
        try {
            double evidence = pipeline.evidenceScorer.score(analysis.disproportionality, analysis.bayesian,
                    analysis.temporal, analysis.causality);
            double squashed = pipeline.fusionScorer.squashLayer1(analysis.singleSource.getScore());
            double fusion = pipeline.fusionScorer.fuse(evidence, squashed, analysis.multiSource.getScore());
            AlertTier tier = pipeline.fusionScorer.tier(fusion);

            FusionResult result = FusionResult.builder()
                    .drug(analysis.pair.getDrug())
                    .event(analysis.pair.getEvent())
                    .observed(analysis.pair.getTable().getA())
                    .disproportionality(analysis.disproportionality)
                    .bayesian(analysis.bayesian)
                    .causality(analysis.causality)
                    .temporal(analysis.temporal)
                    .singleSource(analysis.singleSource)
                    .multiSource(analysis.multiSource)
                    .evidenceScore(evidence)
                    .layer1Squashed(squashed)
                    .fusionScore(fusion)
                    .alertTier(tier)
                    .notes(analysis.notes)
                    .build();
            LOG.debug("Fused {}: score={} tier={}", analysis.pair.key(), fusion, tier);
            return result;
        } catch (NumericOverflowException e) {
            LOG.error("Numeric overflow fusing {}: {}", analysis.pair.key(), e.getMessage());
            return FusionResult.failed(analysis.pair,
                    new ScoringError(ScoringError.Kind.NUMERIC_OVERFLOW, e.getMessage()));
        }
    }

    private static void logSummary(List<FusionResult> results, LocalDate asOf, long elapsedMs) {
        Map<AlertTier, Integer> tiers = new EnumMap<>(AlertTier.class);
        int failed = 0;
        for (FusionResult result : results) {
            if (result.getAlertTier().isPresent()) {
                tiers.merge(result.getAlertTier().get(), 1, Integer::sum);
            } else {
                failed++;
            }
        }
        LOG.info("Scored batch of {} pair(s) as of {} in {} ms: tiers={}, failed={}",
                results.size(), asOf, elapsedMs, tiers, failed);
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "signal-scorer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * The scoring components of one call, built from a configuration that has
     * just been validated.
     */
    static final class Pipeline {
        final DisproportionalityCalculator disproportionalityCalculator;
        final BayesianShrinkageEstimator bayesianEstimator;
        final CausalityAssessor causalityAssessor;
        final TemporalPatternAnalyzer temporalAnalyzer;
        final SingleSourceScorer singleSourceScorer;
        final MultiSourceScorer multiSourceScorer;
        final EvidenceScorer evidenceScorer;
        final FusionScorer fusionScorer;

        /**
         * @throws InvalidConfigurationException if the configuration is invalid
         */
        Pipeline(SignalDetectionConfig config) {
            config.validate();
            this.disproportionalityCalculator = new DisproportionalityCalculator(config.getDisproportionality());
            this.bayesianEstimator = new BayesianShrinkageEstimator(config.getBayesian());
            this.causalityAssessor = new CausalityAssessor(config.getCausality());
            this.temporalAnalyzer = new TemporalPatternAnalyzer(config.getTemporal());
            this.singleSourceScorer = new SingleSourceScorer(config.getLayer1());
            this.multiSourceScorer = new MultiSourceScorer(config.getLayer2());
            this.evidenceScorer = new EvidenceScorer(config.getFusion());
            this.fusionScorer = new FusionScorer(config.getFusion());
        }
    }
}
