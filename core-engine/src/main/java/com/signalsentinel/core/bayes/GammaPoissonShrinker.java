package com.signalsentinel.core.bayes;

import com.signalsentinel.core.config.BayesianSettings;
import com.signalsentinel.core.exception.InsufficientDataException;
import com.signalsentinel.core.model.BayesianResult;
import com.signalsentinel.core.model.ContingencyTable;
import com.signalsentinel.core.model.ShrinkagePrior;
import com.signalsentinel.core.model.SignalStrength;
import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.special.Gamma;

import java.util.Objects;

import static com.signalsentinel.core.exception.NumericOverflowException.requireFinite;

/**
 * Per-pair posterior under a fixed shrinkage prior.
 *
 * <p>
 * With prior {@code Gamma(α, β)}, observed count {@code N} and expected count
 * {@code E}, the relative reporting rate has posterior
 * {@code Gamma(α + N, β + E)} (shape / rate). From it:
 * </p>
 * <ul>
 * <li>{@code EBGM = exp(ψ(α + N) − ln(β + E))}, the posterior geometric
 * mean</li>
 * <li>{@code EB05}, {@code EB95}: posterior 5th / 95th percentiles</li>
 * <li>raw p-value: posterior {@code P(λ ≤ 1)}, below 0.05 exactly when EB05
 * exceeds 1</li>
 * </ul>
 *
 * <p>
 * The prior is only read, so one instance may serve every worker thread of a
 * batch.
 * </p>
 *
 * @since 1.0.0
 */
public class GammaPoissonShrinker {

    private final BayesianSettings settings;
    private final ShrinkagePrior prior;

    public GammaPoissonShrinker(BayesianSettings settings, ShrinkagePrior prior) {
        this.settings = Objects.requireNonNull(settings, "BayesianSettings must not be null");
        this.prior = Objects.requireNonNull(prior, "ShrinkagePrior must not be null");
    }

    public ShrinkagePrior getPrior() {
        return prior;
    }

    /**
     * Compute the posterior summary for one table. The adjusted p-value is
     * initialised to the raw one until the batch is corrected.
     *
     * @throws InsufficientDataException if the table total is zero
     * @throws com.signalsentinel.core.exception.NumericOverflowException if a
     *         posterior summary is not finite
     */
    public BayesianResult shrink(ContingencyTable table) {
        Objects.requireNonNull(table, "ContingencyTable must not be null");
        if (table.getTotal() == 0) {
            throw new InsufficientDataException("Contingency table has no reports (N = 0)");
        }

        long observed = table.getA();
        double expected = table.getExpected();
        double shape = prior.getShape() + observed;
        double rate = prior.getRate() + expected;

        GammaDistribution posterior = new GammaDistribution(null, shape, 1.0 / rate);
        double ebgm = requireFinite(Math.exp(Gamma.digamma(shape) - Math.log(rate)), "EBGM");
        double eb05 = requireFinite(posterior.inverseCumulativeProbability(0.05), "EB05");
        double eb95 = requireFinite(posterior.inverseCumulativeProbability(0.95), "EB95");
        double pValue = requireFinite(posterior.cumulativeProbability(1.0), "posterior P(lambda <= 1)");

        return BayesianResult.builder()
                .observed(observed)
                .expected(expected)
                .posterior(shape, rate)
                .ebgm(ebgm)
                .interval(eb05, eb95)
                .rawPValue(pValue)
                .adjustedPValue(pValue)
                .signal(eb05 > settings.getEb05Threshold())
                .lowConfidence(prior.isLowConfidence())
                .strength(grade(eb05, ebgm))
                .build();
    }

    private static SignalStrength grade(double eb05, double ebgm) {
        if (eb05 > 4.0) {
            return SignalStrength.VERY_STRONG;
        }
        if (eb05 > 2.0) {
            return SignalStrength.STRONG;
        }
        if (eb05 > 1.0) {
            return SignalStrength.MODERATE;
        }
        if (ebgm > 1.0) {
            return SignalStrength.WEAK;
        }
        return SignalStrength.NONE;
    }
}
