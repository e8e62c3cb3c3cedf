package com.signalsentinel.core.bayes;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;

/**
 * Benjamini–Hochberg step-up adjustment for false discovery rate control.
 *
 * <p>
 * For {@code m} p-values sorted ascending, the adjusted value at sorted rank
 * {@code i} is {@code min over j ≥ i of p(j)·m/j}, capped at 1. Ties keep
 * input order so the output is deterministic.
 * </p>
 *
 * @since 1.0.0
 */
public final class BenjaminiHochberg {

    private BenjaminiHochberg() {
    }

    /**
     * @param pValues raw p-values in input order; not modified
     * @return adjusted p-values in the same order
     * @throws IllegalArgumentException if a value lies outside [0, 1]
     */
    public static double[] adjust(double[] pValues) {
        Objects.requireNonNull(pValues, "pValues must not be null");
        int m = pValues.length;
        for (double p : pValues) {
            if (!(p >= 0.0 && p <= 1.0)) {
                throw new IllegalArgumentException("p-value must be in [0, 1], got: " + p);
            }
        }

        Integer[] order = new Integer[m];
        for (int i = 0; i < m; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> pValues[i]).thenComparingInt(i -> i));

        double[] adjusted = new double[m];
        double running = 1.0;
        for (int rank = m; rank >= 1; rank--) {
            int index = order[rank - 1];
            running = Math.min(running, pValues[index] * m / rank);
            adjusted[index] = running;
        }
        return adjusted;
    }

    /**
     * @return flags marking which adjusted p-values are within {@code fdr}
     */
    public static boolean[] significant(double[] adjusted, double fdr) {
        boolean[] flags = new boolean[adjusted.length];
        for (int i = 0; i < adjusted.length; i++) {
            flags[i] = adjusted[i] <= fdr;
        }
        return flags;
    }
}
