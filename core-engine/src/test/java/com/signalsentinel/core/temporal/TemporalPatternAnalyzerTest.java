package com.signalsentinel.core.temporal;

import com.signalsentinel.core.config.TemporalSettings;
import com.signalsentinel.core.exception.InsufficientDataException;
import com.signalsentinel.core.model.LatencyCategory;
import com.signalsentinel.core.model.ReportingGranularity;
import com.signalsentinel.core.model.TemporalResult;
import com.signalsentinel.core.model.TimeSeriesData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TemporalPatternAnalyzer}.
 */
class TemporalPatternAnalyzerTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private TemporalPatternAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new TemporalPatternAnalyzer(new TemporalSettings());
    }

    @Test
    @DisplayName("Should flag a recent spike on an emerging association")
    void shouldFlagRecentSpike() {
        long[] counts = new long[40];
        Arrays.fill(counts, 1);
        counts[39] = 20;
        TimeSeriesData series = TimeSeriesData.of(START, ReportingGranularity.DAY, counts);

        TemporalResult result = analyzer.analyze(series, false, START.plusDays(39));

        assertThat(result.hasRecentSpike()).isTrue();
        assertThat(result.getMaxSpikeFold()).isEqualTo(20.0);
        assertThat(result.getNovelty().isEmerging()).isTrue();
        assertThat(result.getFlags()).contains("Recent reporting spike", "Emerging association");
        assertThat(result.getRiskScore()).isGreaterThanOrEqualTo(0.55).isLessThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("Should flag a significant change in reporting rate")
    void shouldFlagChangePoint() {
        long[] counts = new long[30];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = i < 15 ? 2 : 10;
        }
        TimeSeriesData series = TimeSeriesData.of(START, ReportingGranularity.MONTH, counts);

        TemporalResult result = analyzer.analyze(series, true, START.plusMonths(60));

        assertThat(result.getChangePoints()).hasSize(1);
        assertThat(result.getFlags()).contains("Significant change in reporting rate");
        assertThat(result.getNovelty().isEmerging()).isFalse();
    }

    @Test
    @DisplayName("Should omit the trend for a single time point")
    void shouldOmitTrendForSinglePoint() {
        TimeSeriesData series = TimeSeriesData.of(START, ReportingGranularity.MONTH, 3);

        TemporalResult result = analyzer.analyze(series, false, START);

        assertThat(result.getTrend()).isEmpty();
        assertThat(result.getSpikes()).isEmpty();
        assertThat(result.getChangePoints()).isEmpty();
        assertThat(result.getNovelty()).isNotNull();
    }

    @Test
    @DisplayName("Should report the onset distribution without changing the risk")
    void shouldReportLatencyAlongside() {
        long[] counts = new long[12];
        Arrays.fill(counts, 3);
        TimeSeriesData series = TimeSeriesData.of(START, ReportingGranularity.MONTH, counts);

        TemporalResult withOnsets = analyzer.analyze(series, false, List.of(0, 6, 20, 60), START.plusYears(5));
        TemporalResult without = analyzer.analyze(series, false, START.plusYears(5));

        assertThat(withOnsets.getLatency().getCount(LatencyCategory.IMMEDIATE)).isEqualTo(1);
        assertThat(withOnsets.getLatency().getCount(LatencyCategory.LATE)).isEqualTo(1);
        assertThat(withOnsets.getLatency().getMedianDays()).hasValue(13.0);
        assertThat(withOnsets.getRiskScore()).isEqualTo(without.getRiskScore());
        assertThat(without.getLatency().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should report no risk for an old, quiet series")
    void shouldReportNoRiskForQuietSeries() {
        long[] counts = new long[12];
        Arrays.fill(counts, 3);
        TimeSeriesData series = TimeSeriesData.of(START, ReportingGranularity.MONTH, counts);

        TemporalResult result = analyzer.analyze(series, false, START.plusYears(5));

        assertThat(result.getRiskScore()).isZero();
        assertThat(result.getFlags()).isEmpty();
    }

    @Test
    @DisplayName("Should throw InsufficientDataException for an empty series")
    void shouldRejectEmptySeries() {
        TimeSeriesData empty = new TimeSeriesData(List.of(), ReportingGranularity.DAY);

        assertThatThrownBy(() -> analyzer.analyze(empty, false, START))
                .isInstanceOf(InsufficientDataException.class);
    }
}
