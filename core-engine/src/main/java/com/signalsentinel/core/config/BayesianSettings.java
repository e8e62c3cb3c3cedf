package com.signalsentinel.core.config;

import java.io.Serializable;
import java.util.List;

import static com.signalsentinel.core.config.ConfigChecks.requirePositive;

/**
 * Parameters of the Gamma-Poisson shrinkage estimator.
 *
 * @since 1.0.0
 */
public class BayesianSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** EB05 must exceed this for a signal. */
    private double eb05Threshold = 2.0;

    /** Benjamini–Hochberg false discovery rate target. */
    private double fdrTarget = 0.05;

    /** Lower clamp for fitted prior shape and rate. */
    private double minPriorParameter = 0.5;

    /** Upper clamp for fitted prior shape and rate. */
    private double maxPriorParameter = 10.0;

    /** Minimum usable observed/expected ratios required to fit a prior. */
    private int minPairsForPrior = 2;

    void validate(List<String> errors) {
        requirePositive(errors, "bayesian.eb05Threshold", eb05Threshold);
        if (!(fdrTarget > 0 && fdrTarget < 1)) {
            errors.add("bayesian.fdrTarget must be in (0, 1), got: " + fdrTarget);
        }
        requirePositive(errors, "bayesian.minPriorParameter", minPriorParameter);
        requirePositive(errors, "bayesian.maxPriorParameter", maxPriorParameter);
        if (maxPriorParameter < minPriorParameter) {
            errors.add("bayesian.maxPriorParameter (" + maxPriorParameter
                    + ") must be >= minPriorParameter (" + minPriorParameter + ")");
        }
        if (minPairsForPrior < 2) {
            errors.add("bayesian.minPairsForPrior must be >= 2, got: " + minPairsForPrior);
        }
    }

    public double getEb05Threshold() {
        return eb05Threshold;
    }

    public void setEb05Threshold(double eb05Threshold) {
        this.eb05Threshold = eb05Threshold;
    }

    public double getFdrTarget() {
        return fdrTarget;
    }

    public void setFdrTarget(double fdrTarget) {
        this.fdrTarget = fdrTarget;
    }

    public double getMinPriorParameter() {
        return minPriorParameter;
    }

    public void setMinPriorParameter(double minPriorParameter) {
        this.minPriorParameter = minPriorParameter;
    }

    public double getMaxPriorParameter() {
        return maxPriorParameter;
    }

    public void setMaxPriorParameter(double maxPriorParameter) {
        this.maxPriorParameter = maxPriorParameter;
    }

    public int getMinPairsForPrior() {
        return minPairsForPrior;
    }

    public void setMinPairsForPrior(int minPairsForPrior) {
        this.minPairsForPrior = minPairsForPrior;
    }

    @Override
    public String toString() {
        return "BayesianSettings{eb05Threshold=" + eb05Threshold + ", fdrTarget=" + fdrTarget + '}';
    }
}
