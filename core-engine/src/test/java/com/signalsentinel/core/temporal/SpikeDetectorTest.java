package com.signalsentinel.core.temporal;

import com.signalsentinel.core.config.TemporalSettings;
import com.signalsentinel.core.model.ReportingGranularity;
import com.signalsentinel.core.model.SpikeEvent;
import com.signalsentinel.core.model.TimeSeriesData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SpikeDetector}.
 */
class SpikeDetectorTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private SpikeDetector detector;

    @BeforeEach
    void setUp() {
        detector = new SpikeDetector(new TemporalSettings());
    }

    @Test
    @DisplayName("Should detect a spike over a flat baseline using the Poisson fallback")
    void shouldDetectSpikeOverFlatBaseline() {
        TimeSeriesData series = daily(30, 1, 10);

        List<SpikeEvent> spikes = detector.detect(series);

        assertThat(spikes).hasSize(1);
        SpikeEvent spike = spikes.get(0);
        assertThat(spike.getPeriod()).isEqualTo(START.plusDays(30));
        assertThat(spike.getBaselineMean()).isEqualTo(1.0);
        assertThat(spike.getZScore()).isCloseTo(9.0, within(1e-12));
        assertThat(spike.getFoldIncrease()).isCloseTo(10.0, within(1e-12));
        assertThat(spike.getPValue()).isLessThan(1e-6);
    }

    @Test
    @DisplayName("Should report no spike against an all-zero baseline")
    void shouldIgnoreAllZeroBaseline() {
        assertThat(detector.detect(daily(30, 0, 4))).isEmpty();
        assertThat(detector.detect(daily(30, 0, 50))).isEmpty();
    }

    @Test
    @DisplayName("Should produce no spikes while the window is warming up")
    void shouldSkipShortSeries() {
        long[] counts = new long[30];
        counts[29] = 100;

        assertThat(detector.detect(TimeSeriesData.of(START, ReportingGranularity.DAY, counts))).isEmpty();
    }

    @Test
    @DisplayName("Should not flag ordinary variation")
    void shouldIgnoreOrdinaryVariation() {
        long[] counts = new long[60];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = 4 + (i % 3);
        }

        assertThat(detector.detect(TimeSeriesData.of(START, ReportingGranularity.DAY, counts))).isEmpty();
    }

    @Test
    @DisplayName("Should treat a spike on the last period as recent")
    void shouldReportRecentSpike() {
        TimeSeriesData series = daily(30, 1, 10);

        assertThat(detector.hasRecentSpike(detector.detect(series), series)).isTrue();
    }

    @Test
    @DisplayName("Should not treat an old spike as recent")
    void shouldNotReportOldSpike() {
        long[] counts = new long[131];
        Arrays.fill(counts, 1);
        counts[30] = 10;
        TimeSeriesData series = TimeSeriesData.of(START, ReportingGranularity.DAY, counts);

        List<SpikeEvent> spikes = detector.detect(series);

        assertThat(spikes).extracting(SpikeEvent::getPeriod).containsExactly(START.plusDays(30));
        assertThat(detector.hasRecentSpike(spikes, series)).isFalse();
    }

    @Test
    @DisplayName("Should compute the Poisson upper tail")
    void shouldComputePoissonUpperTail() {
        // P(X >= 1 | mean 1) = 1 - e^-1
        assertThat(SpikeDetector.poissonUpperTail(1, 1.0)).isCloseTo(1 - Math.exp(-1), within(1e-12));
        assertThat(SpikeDetector.poissonUpperTail(0, 3.0)).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static TimeSeriesData daily(int baselineLength, long baseline, long last) {
        long[] counts = new long[baselineLength + 1];
        Arrays.fill(counts, baseline);
        counts[baselineLength] = last;
        return TimeSeriesData.of(START, ReportingGranularity.DAY, counts);
    }
}
