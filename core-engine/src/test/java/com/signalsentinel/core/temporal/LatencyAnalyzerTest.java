package com.signalsentinel.core.temporal;

import com.signalsentinel.core.model.LatencyCategory;
import com.signalsentinel.core.model.LatencyDistribution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link LatencyAnalyzer}.
 */
class LatencyAnalyzerTest {

    private final LatencyAnalyzer analyzer = new LatencyAnalyzer();

    @Test
    @DisplayName("Should bucket onsets on inclusive day boundaries")
    void shouldCategorizeOnBoundaries() {
        assertThat(LatencyCategory.of(0)).isEqualTo(LatencyCategory.IMMEDIATE);
        assertThat(LatencyCategory.of(1)).isEqualTo(LatencyCategory.IMMEDIATE);
        assertThat(LatencyCategory.of(2)).isEqualTo(LatencyCategory.EARLY);
        assertThat(LatencyCategory.of(7)).isEqualTo(LatencyCategory.EARLY);
        assertThat(LatencyCategory.of(8)).isEqualTo(LatencyCategory.DELAYED);
        assertThat(LatencyCategory.of(30)).isEqualTo(LatencyCategory.DELAYED);
        assertThat(LatencyCategory.of(31)).isEqualTo(LatencyCategory.LATE);
        assertThat(LatencyCategory.of(90)).isEqualTo(LatencyCategory.LATE);
        assertThat(LatencyCategory.of(91)).isEqualTo(LatencyCategory.VERY_LATE);
    }

    @Test
    @DisplayName("Should count cases per category and take the median")
    void shouldBuildDistribution() {
        LatencyDistribution latency = analyzer.analyze(List.of(3, 1, 45, 10, 200));

        assertThat(latency.getCount(LatencyCategory.IMMEDIATE)).isEqualTo(1);
        assertThat(latency.getCount(LatencyCategory.EARLY)).isEqualTo(1);
        assertThat(latency.getCount(LatencyCategory.DELAYED)).isEqualTo(1);
        assertThat(latency.getCount(LatencyCategory.LATE)).isEqualTo(1);
        assertThat(latency.getCount(LatencyCategory.VERY_LATE)).isEqualTo(1);
        assertThat(latency.getTotal()).isEqualTo(5);
        assertThat(latency.getMedianDays()).hasValue(10.0);
    }

    @Test
    @DisplayName("Should average the two middle onsets of an even count")
    void shouldAverageMiddleOnsets() {
        LatencyDistribution latency = analyzer.analyze(Arrays.asList(2, 4, 6, 30));

        assertThat(latency.getMedianDays()).hasValue(5.0);
        assertThat(latency.getCount(LatencyCategory.EARLY)).isEqualTo(3);
        assertThat(latency.getCount(LatencyCategory.IMMEDIATE)).isZero();
    }

    @Test
    @DisplayName("Should report every category as zero without onset data")
    void shouldHandleNoOnsets() {
        LatencyDistribution latency = analyzer.analyze(List.of());

        assertThat(latency.isEmpty()).isTrue();
        assertThat(latency.getMedianDays()).isEmpty();
        assertThat(latency.getCounts()).hasSize(LatencyCategory.values().length);
        assertThat(latency.getCounts().values()).containsOnly(0);
    }

    @Test
    @DisplayName("Should reject a negative onset")
    void shouldRejectNegativeOnset() {
        assertThatThrownBy(() -> analyzer.analyze(List.of(5, -1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1");
    }
}
