package com.signalsentinel.core.bayes;

import com.signalsentinel.core.config.BayesianSettings;
import com.signalsentinel.core.model.ContingencyTable;
import com.signalsentinel.core.model.ShrinkagePrior;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;

/**
 * Fits the batch-wide Gamma shrinkage prior by the method of moments.
 *
 * <p>
 * For every table with a positive expected count, the observed/expected ratio
 * {@code a/E} is collected. With mean {@code m} and population variance
 * {@code v} of those ratios:
 * </p>
 *
 * <pre>
 *   rate  = m / v
 *   shape = m · rate
 * </pre>
 *
 * <p>
 * Zero variance falls back to {@code shape = 2, rate = 2/m}. Both parameters
 * are clamped to the configured range. Tables with {@code E = 0} are left out
 * of the fit. When fewer than {@code minPairsForPrior} ratios are usable the
 * {@linkplain ShrinkagePrior#defaultPrior() default prior} is returned and
 * flagged low-confidence.
 * </p>
 *
 * @since 1.0.0
 */
public class ShrinkagePriorEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(ShrinkagePriorEstimator.class);

    private final BayesianSettings settings;

    public ShrinkagePriorEstimator(BayesianSettings settings) {
        this.settings = Objects.requireNonNull(settings, "BayesianSettings must not be null");
    }

    /**
     * Fit a prior over every table of the batch.
     *
     * @param tables all tables of the batch; must not be {@code null}
     * @return a new, immutable prior
     */
    public ShrinkagePrior fit(Collection<ContingencyTable> tables) {
        Objects.requireNonNull(tables, "tables must not be null");

        DescriptiveStatistics ratios = new DescriptiveStatistics();
        int excluded = 0;
        for (ContingencyTable table : tables) {
            double expected = table.getExpected();
            if (expected > 0) {
                ratios.addValue(table.getA() / expected);
            } else {
                excluded++;
            }
        }

        if (excluded > 0) {
            LOG.debug("Excluded {} table(s) with zero expected count from prior fitting", excluded);
        }

        int usable = (int) ratios.getN();
        if (usable < settings.getMinPairsForPrior()) {
            LOG.warn("Only {} usable observed/expected ratio(s) in batch of {}; falling back to default "
                    + "prior Gamma({}, {}) with low confidence", usable, tables.size(),
                    ShrinkagePrior.DEFAULT_SHAPE, ShrinkagePrior.DEFAULT_RATE);
            return ShrinkagePrior.defaultPrior();
        }

        double mean = ratios.getMean();
        double variance = ratios.getPopulationVariance();

        double shape;
        double rate;
        if (variance == 0) {
            shape = ShrinkagePrior.DEFAULT_SHAPE;
            rate = mean > 0 ? ShrinkagePrior.DEFAULT_SHAPE / mean : settings.getMaxPriorParameter();
        } else {
            rate = mean / variance;
            shape = mean * rate;
        }

        shape = clamp(shape);
        rate = clamp(rate);

        ShrinkagePrior prior = new ShrinkagePrior(shape, rate, usable, false);
        LOG.info("Fitted shrinkage prior from {} ratio(s): mean={} variance={} -> {}",
                usable, mean, variance, prior);
        return prior;
    }

    private double clamp(double value) {
        return Math.max(settings.getMinPriorParameter(), Math.min(settings.getMaxPriorParameter(), value));
    }
}
