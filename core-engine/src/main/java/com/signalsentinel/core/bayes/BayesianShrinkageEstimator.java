package com.signalsentinel.core.bayes;

import com.signalsentinel.core.config.BayesianSettings;
import com.signalsentinel.core.model.BayesianResult;
import com.signalsentinel.core.model.ContingencyTable;
import com.signalsentinel.core.model.ShrinkagePrior;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Three-step empirical-Bayes protocol over one batch.
 *
 * <ol>
 * <li>{@link #fitPrior(Collection)}: a single reduction over every table,
 * which must finish before any posterior is computed.</li>
 * <li>{@link #shrinker(ShrinkagePrior)}: per-pair posteriors, safe to run in
 * parallel against the shared read-only prior.</li>
 * <li>{@link #adjust(List)}: Benjamini–Hochberg correction once every
 * posterior is known.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class BayesianShrinkageEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(BayesianShrinkageEstimator.class);

    private final BayesianSettings settings;
    private final ShrinkagePriorEstimator priorEstimator;

    public BayesianShrinkageEstimator(BayesianSettings settings) {
        this.settings = Objects.requireNonNull(settings, "BayesianSettings must not be null");
        this.priorEstimator = new ShrinkagePriorEstimator(settings);
    }

    public ShrinkagePrior fitPrior(Collection<ContingencyTable> tables) {
        return priorEstimator.fit(tables);
    }

    public GammaPoissonShrinker shrinker(ShrinkagePrior prior) {
        return new GammaPoissonShrinker(settings, prior);
    }

    /**
     * Attach Benjamini–Hochberg adjusted p-values and FDR flags.
     *
     * @param results posterior results of one batch, in any order
     * @return new results in the same order
     */
    public List<BayesianResult> adjust(List<BayesianResult> results) {
        Objects.requireNonNull(results, "results must not be null");
        double[] raw = new double[results.size()];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = results.get(i).getRawPValue();
        }
        double[] adjusted = BenjaminiHochberg.adjust(raw);
        boolean[] flags = BenjaminiHochberg.significant(adjusted, settings.getFdrTarget());

        List<BayesianResult> out = new ArrayList<>(results.size());
        int discoveries = 0;
        for (int i = 0; i < raw.length; i++) {
            out.add(results.get(i).withAdjustment(adjusted[i], flags[i]));
            if (flags[i]) {
                discoveries++;
            }
        }
        LOG.info("Benjamini-Hochberg at FDR {}: {} of {} pair(s) significant",
                settings.getFdrTarget(), discoveries, raw.length);
        return out;
    }
}
