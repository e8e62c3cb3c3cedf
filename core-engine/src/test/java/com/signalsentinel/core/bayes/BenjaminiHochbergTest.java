package com.signalsentinel.core.bayes;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link BenjaminiHochberg}.
 */
class BenjaminiHochbergTest {

    @Test
    @DisplayName("Should adjust p-values in input order")
    void shouldAdjustInInputOrder() {
        double[] adjusted = BenjaminiHochberg.adjust(new double[] { 0.01, 0.04, 0.03, 0.005 });

        assertThat(adjusted[0]).isCloseTo(0.02, within(1e-12));
        assertThat(adjusted[1]).isCloseTo(0.04, within(1e-12));
        assertThat(adjusted[2]).isCloseTo(0.04, within(1e-12));
        assertThat(adjusted[3]).isCloseTo(0.02, within(1e-12));
    }

    @Test
    @DisplayName("Should never lower a p-value and cap at one")
    void shouldBoundAdjustedValues() {
        double[] raw = { 0.9, 0.5, 0.95, 0.2, 0.001 };
        double[] adjusted = BenjaminiHochberg.adjust(raw);

        for (int i = 0; i < raw.length; i++) {
            assertThat(adjusted[i]).isGreaterThanOrEqualTo(raw[i]).isLessThanOrEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("Should preserve the ordering of raw p-values")
    void shouldPreserveOrdering() {
        double[] raw = { 0.03, 0.001, 0.2, 0.04, 0.5 };
        double[] adjusted = BenjaminiHochberg.adjust(raw);

        for (int i = 0; i < raw.length; i++) {
            for (int j = 0; j < raw.length; j++) {
                if (raw[i] <= raw[j]) {
                    assertThat(adjusted[i]).isLessThanOrEqualTo(adjusted[j]);
                }
            }
        }
    }

    @Test
    @DisplayName("Should give tied p-values the same adjusted value")
    void shouldTreatTiesEqually() {
        double[] adjusted = BenjaminiHochberg.adjust(new double[] { 0.02, 0.02, 0.02 });

        for (double value : adjusted) {
            assertThat(value).isCloseTo(0.02, within(1e-12));
        }
    }

    @Test
    @DisplayName("Should flag adjusted values within the FDR target")
    void shouldFlagSignificant() {
        boolean[] flags = BenjaminiHochberg.significant(new double[] { 0.01, 0.05, 0.051 }, 0.05);

        assertThat(flags).containsExactly(true, true, false);
    }

    @Test
    @DisplayName("Should handle an empty input")
    void shouldHandleEmptyInput() {
        assertThat(BenjaminiHochberg.adjust(new double[0])).isEmpty();
    }

    @Test
    @DisplayName("Should reject p-values outside [0, 1]")
    void shouldRejectInvalidPValue() {
        assertThatThrownBy(() -> BenjaminiHochberg.adjust(new double[] { 0.1, 1.2 }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("1.2");
    }
}
