package com.signalsentinel.core.stats;

import com.signalsentinel.core.model.SignalStrength;

/**
 * Grades the overall strength of a disproportionality finding from the number
 * of metrics that flag it, the observed count and the test p-value.
 *
 * <table>
 * <caption>Grades (first match wins)</caption>
 * <tr><th>Grade</th><th>Metrics</th><th>Count</th><th>p</th></tr>
 * <tr><td>VERY_STRONG</td><td>3</td><td>&ge; 10</td><td>&lt; 0.001</td></tr>
 * <tr><td>STRONG</td><td>&ge; 2</td><td>&ge; 5</td><td>&lt; 0.01</td></tr>
 * <tr><td>MODERATE</td><td>&ge; 1</td><td>&ge; 3</td><td>&lt; 0.05</td></tr>
 * <tr><td>WEAK</td><td colspan="3">any metric, or PRR &ge; 1.5 with count &ge; 3</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class SignalStrengthClassifier {

    private SignalStrengthClassifier() {
    }

    public static SignalStrength classify(int signalCount, long observed, double pValue, double prr) {
        if (signalCount >= 3 && observed >= 10 && pValue < 0.001) {
            return SignalStrength.VERY_STRONG;
        }
        if (signalCount >= 2 && observed >= 5 && pValue < 0.01) {
            return SignalStrength.STRONG;
        }
        if (signalCount >= 1 && observed >= 3 && pValue < 0.05) {
            return SignalStrength.MODERATE;
        }
        if (signalCount >= 1 || (prr >= 1.5 && observed >= 3)) {
            return SignalStrength.WEAK;
        }
        return SignalStrength.NONE;
    }
}
