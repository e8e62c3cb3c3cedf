package com.signalsentinel.core.stats;

import com.signalsentinel.core.config.DisproportionalitySettings;
import com.signalsentinel.core.exception.InsufficientDataException;
import com.signalsentinel.core.model.ContingencyTable;
import com.signalsentinel.core.model.DisproportionalityResult;
import com.signalsentinel.core.model.RatioEstimate;
import com.signalsentinel.core.model.SignalStrength;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.distribution.HypergeometricDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

import static com.signalsentinel.core.exception.NumericOverflowException.requireFinite;

/**
 * Classical frequentist disproportionality statistics over a 2×2 table.
 *
 * <h3>Metrics</h3>
 * <ul>
 * <li><b>PRR</b> {@code (a/(a+b)) / (c/(c+d))}, Wald interval on the log
 * scale. Signal when PRR reaches the threshold, {@code a} reaches the minimum
 * count and the lower bound exceeds 1.</li>
 * <li><b>ROR</b> {@code (a·d) / (b·c)}, Woolf interval on the log scale.
 * Signal when ROR and its lower bound exceed 1 and {@code a} reaches the
 * minimum count.</li>
 * <li><b>IC</b> {@code log2((a+0.5)/(E+0.5))}. Signal when IC025 &gt; 0.</li>
 * </ul>
 *
 * <h3>Zero cells</h3>
 * <p>
 * When any cell is zero, every cell receives the continuity correction before
 * PRR and ROR are computed, so both stay finite. The observed count compared
 * against {@code minCount} is always the uncorrected {@code a}.
 * </p>
 *
 * <p>
 * Instances are immutable and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class DisproportionalityCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(DisproportionalityCalculator.class);

    private static final double LN2 = Math.log(2.0);
    private static final double FISHER_TOLERANCE = 1e-7;
    private static final double FISHER_NEGLIGIBLE = 1e-17;

    private final DisproportionalitySettings settings;
    private final ChiSquaredDistribution chiSquared = new ChiSquaredDistribution(null, 1);

    public DisproportionalityCalculator(DisproportionalitySettings settings) {
        this.settings = Objects.requireNonNull(settings, "DisproportionalitySettings must not be null");
    }

    /**
     * Compute every metric and test for one table.
     *
     * @param table the counts; must not be {@code null}
     * @return the full result
     * @throws InsufficientDataException if the table total is zero
     */
    public DisproportionalityResult calculate(ContingencyTable table) {
        requireData(table);

        RatioEstimate prr = prr(table);
        RatioEstimate ror = ror(table);
        RatioEstimate ic = ic(table);

        double chi = yatesChiSquare(table);
        double chiP = chi > 0 ? 1.0 - chiSquared.cumulativeProbability(chi) : 1.0;

        Double fisherP = null;
        double expected = table.getExpected();
        if (table.getA() < settings.getSmallCountThreshold() || expected < settings.getSmallCountThreshold()) {
            fisherP = fisherExactTwoSided(table);
        }

        int signals = (prr.isSignal() ? 1 : 0) + (ror.isSignal() ? 1 : 0) + (ic.isSignal() ? 1 : 0);
        double p = fisherP != null ? fisherP : chiP;
        SignalStrength strength = SignalStrengthClassifier.classify(signals, table.getA(), p, prr.getValue());

        LOG.debug("Disproportionality {}: {} {} {} chi2={} p={} strength={}",
                table, prr, ror, ic, chi, p, strength);

        return DisproportionalityResult.builder()
                .observed(table.getA())
                .expected(expected)
                .prr(prr)
                .ror(ror)
                .ic(ic)
                .chiSquare(chi, chiP)
                .fisherPValue(fisherP)
                .strength(strength)
                .build();
    }

    // ---------------------------------------------------------------
    // Individual metrics
    // ---------------------------------------------------------------

    /**
     * Proportional reporting ratio with its 95% interval.
     *
     * @throws InsufficientDataException if the table total is zero
     */
    public RatioEstimate prr(ContingencyTable table) {
        requireData(table);
        double[] cells = correctedCells(table);
        double a = cells[0], b = cells[1], c = cells[2], d = cells[3];

        double value = (a / (a + b)) / (c / (c + d));
        double se = Math.sqrt(1.0 / a - 1.0 / (a + b) + 1.0 / c - 1.0 / (c + d));
        double[] ci = logInterval(value, se);

        boolean signal = value >= settings.getPrrThreshold()
                && table.getA() >= settings.getMinCount()
                && ci[0] > 1.0;
        return new RatioEstimate("PRR", requireFinite(value, "PRR"), ci[0], ci[1], signal);
    }

    /**
     * Reporting odds ratio with its 95% interval.
     *
     * @throws InsufficientDataException if the table total is zero
     */
    public RatioEstimate ror(ContingencyTable table) {
        requireData(table);
        double[] cells = correctedCells(table);
        double a = cells[0], b = cells[1], c = cells[2], d = cells[3];

        double value = (a * d) / (b * c);
        double se = Math.sqrt(1.0 / a + 1.0 / b + 1.0 / c + 1.0 / d);
        double[] ci = logInterval(value, se);

        boolean signal = value > settings.getRorThreshold()
                && ci[0] > 1.0
                && table.getA() >= settings.getMinCount();
        return new RatioEstimate("ROR", requireFinite(value, "ROR"), ci[0], ci[1], signal);
    }

    /**
     * Information component {@code log2((a+0.5)/(E+0.5))} with the interval
     * {@code IC ± k·σ}, where {@code Var(IC) ≈ (1/ln 2)²·(1/(a+0.5) + 1/(E+0.5))}.
     *
     * @throws InsufficientDataException if the table total is zero
     */
    public RatioEstimate ic(ContingencyTable table) {
        requireData(table);
        double a = table.getA();
        double expected = table.getExpected();

        double value = Math.log((a + 0.5) / (expected + 0.5)) / LN2;
        double sigma = Math.sqrt(1.0 / (a + 0.5) + 1.0 / (expected + 0.5)) / LN2;
        double lower = value - settings.getIcSigmaMultiplier() * sigma;
        double upper = value + settings.getIcSigmaMultiplier() * sigma;

        return new RatioEstimate("IC", requireFinite(value, "IC"), lower, upper, lower > 0);
    }

    // ---------------------------------------------------------------
    // Hypothesis tests
    // ---------------------------------------------------------------

    /**
     * Pearson chi-square with Yates' continuity correction, 1 d.f.
     *
     * @return the statistic, {@code 0} when any margin is empty
     */
    double yatesChiSquare(ContingencyTable table) {
        double a = table.getA(), b = table.getB(), c = table.getC(), d = table.getD();
        double n = table.getTotal();
        double margins = (a + b) * (c + d) * (a + c) * (b + d);
        if (margins == 0) {
            return 0.0;
        }
        double diff = Math.max(0.0, Math.abs(a * d - b * c) - n / 2.0);
        return requireFinite(n * diff * diff / margins, "chi-square");
    }

    /**
     * Two-sided Fisher exact p-value: the total probability of every table
     * with the same margins that is no more likely than the observed one.
     *
     * @return the p-value, or {@code null} when the table is too large for the
     *         hypergeometric implementation
     */
    Double fisherExactTwoSided(ContingencyTable table) {
        long n = table.getTotal();
        if (n > Integer.MAX_VALUE) {
            return null;
        }
        int population = (int) n;
        int successes = (int) table.getEventTotal();
        int sample = (int) table.getDrugTotal();
        HypergeometricDistribution hyper = new HypergeometricDistribution(null, population, successes, sample);

        int observed = (int) table.getA();
        double observedLog = hyper.logProbability(observed);
        int lower = hyper.getSupportLowerBound();
        int upper = hyper.getSupportUpperBound();
        int mode = (int) Math.max(lower, Math.min(upper,
                (long) (sample + 1) * (successes + 1) / ((long) population + 2)));

        // Unimodal: each tail is summed walking away from the mode
        double p = sumTail(hyper, mode, upper, 1, observedLog)
                + sumTail(hyper, mode - 1, lower, -1, observedLog);
        return Math.min(1.0, p);
    }

    /**
     * Sum of the probabilities from {@code from} towards {@code to} that do
     * not exceed the observed one. Stops once a term no longer changes the
     * sum, since terms only shrink further from the mode.
     */
    private static double sumTail(HypergeometricDistribution hyper, int from, int to, int step,
            double observedLog) {
        double sum = 0.0;
        for (int k = from; step > 0 ? k <= to : k >= to; k += step) {
            double logP = hyper.logProbability(k);
            if (logP > observedLog + FISHER_TOLERANCE) {
                continue;
            }
            double term = Math.exp(logP);
            sum += term;
            if (term == 0 || term < FISHER_NEGLIGIBLE * sum) {
                break;
            }
        }
        return sum;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private double[] correctedCells(ContingencyTable table) {
        double correction = table.hasZeroCell() ? settings.getContinuityCorrection() : 0.0;
        return new double[] {
                table.getA() + correction,
                table.getB() + correction,
                table.getC() + correction,
                table.getD() + correction
        };
    }

    private double[] logInterval(double value, double se) {
        double logValue = Math.log(value);
        double margin = settings.getConfidenceZ() * se;
        return new double[] { Math.exp(logValue - margin), Math.exp(logValue + margin) };
    }

    private static void requireData(ContingencyTable table) {
        Objects.requireNonNull(table, "ContingencyTable must not be null");
        if (table.getTotal() == 0) {
            throw new InsufficientDataException("Contingency table has no reports (N = 0)");
        }
    }
}
