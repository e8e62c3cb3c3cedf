package com.signalsentinel.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Case-level aggregates for one drug-event pair, as delivered by the case
 * aggregation service.
 *
 * <p>
 * Feeds the composite scorers: outcome counts drive seriousness, the latest
 * report date drives recency, source counts and per-source evidence drive
 * consensus. Per-case onset days feed the latency distribution of the
 * temporal analysis. Every field is optional; missing values fall back to neutral
 * defaults in the scorers.
 * </p>
 *
 * @since 1.0.0
 */
public final class CaseProfile implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Long totalCases;
    private final long seriousCount;
    private final long deathCount;
    private final long hospitalizationCount;
    private final long disabilityCount;
    private final LocalDate latestReportDate;
    private final boolean labeled;
    private final int sourcesCorroborating;
    private final int sourcesQueried;
    private final List<SourceEvidence> sourceEvidence;
    private final double mechanismPlausibility;
    private final Double severity;
    private final List<Integer> onsetDays;

    private CaseProfile(Builder b) {
        this.totalCases = b.totalCases;
        this.seriousCount = requireNonNegative(b.seriousCount, "seriousCount");
        this.deathCount = requireNonNegative(b.deathCount, "deathCount");
        this.hospitalizationCount = requireNonNegative(b.hospitalizationCount, "hospitalizationCount");
        this.disabilityCount = requireNonNegative(b.disabilityCount, "disabilityCount");
        this.latestReportDate = b.latestReportDate;
        this.labeled = b.labeled;
        this.sourcesCorroborating = (int) requireNonNegative(b.sourcesCorroborating, "sourcesCorroborating");
        this.sourcesQueried = (int) requireNonNegative(b.sourcesQueried, "sourcesQueried");
        if (sourcesCorroborating > sourcesQueried) {
            throw new IllegalArgumentException("sourcesCorroborating (" + sourcesCorroborating
                    + ") must not exceed sourcesQueried (" + sourcesQueried + ")");
        }
        if (totalCases != null && totalCases < 0) {
            throw new IllegalArgumentException("totalCases must be >= 0, got: " + totalCases);
        }
        this.sourceEvidence = List.copyOf(b.sourceEvidence);
        this.mechanismPlausibility = requireUnit(b.mechanismPlausibility, "mechanismPlausibility");
        this.severity = b.severity == null ? null : requireUnit(b.severity, "severity");
        for (Integer days : b.onsetDays) {
            if (days == null || days < 0) {
                throw new IllegalArgumentException("onsetDays must hold non-negative values, got: " + days);
            }
        }
        this.onsetDays = List.copyOf(b.onsetDays);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Profile with nothing known; every scorer falls back to its default. */
    public static CaseProfile empty() {
        return new Builder().build();
    }

    /**
     * @return size of the reference population for rarity; empty when the
     *         drug total of the contingency table should be used
     */
    public OptionalLong getTotalCases() {
        return totalCases == null ? OptionalLong.empty() : OptionalLong.of(totalCases);
    }

    public long getSeriousCount() {
        return seriousCount;
    }

    public long getDeathCount() {
        return deathCount;
    }

    public long getHospitalizationCount() {
        return hospitalizationCount;
    }

    public long getDisabilityCount() {
        return disabilityCount;
    }

    public Optional<LocalDate> getLatestReportDate() {
        return Optional.ofNullable(latestReportDate);
    }

    /** Whether the event is already listed on the drug's label. */
    public boolean isLabeled() {
        return labeled;
    }

    public int getSourcesCorroborating() {
        return sourcesCorroborating;
    }

    public int getSourcesQueried() {
        return sourcesQueried;
    }

    public List<SourceEvidence> getSourceEvidence() {
        return sourceEvidence;
    }

    public double getMechanismPlausibility() {
        return mechanismPlausibility;
    }

    /**
     * @return externally assessed severity in [0, 1]; empty when the serious
     *         fraction should be used instead
     */
    public OptionalDouble getSeverity() {
        return severity == null ? OptionalDouble.empty() : OptionalDouble.of(severity);
    }

    /**
     * @return days from first exposure to onset, one entry per case that
     *         reported it; empty when unknown
     */
    public List<Integer> getOnsetDays() {
        return onsetDays;
    }

    private static long requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, got: " + value);
        }
        return value;
    }

    private static double requireUnit(double value, String name) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in [0, 1], got: " + value);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CaseProfile that))
            return false;
        return seriousCount == that.seriousCount
                && deathCount == that.deathCount
                && hospitalizationCount == that.hospitalizationCount
                && disabilityCount == that.disabilityCount
                && labeled == that.labeled
                && sourcesCorroborating == that.sourcesCorroborating
                && sourcesQueried == that.sourcesQueried
                && Double.compare(mechanismPlausibility, that.mechanismPlausibility) == 0
                && Objects.equals(totalCases, that.totalCases)
                && Objects.equals(latestReportDate, that.latestReportDate)
                && Objects.equals(severity, that.severity)
                && sourceEvidence.equals(that.sourceEvidence)
                && onsetDays.equals(that.onsetDays);
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalCases, seriousCount, deathCount, hospitalizationCount,
                disabilityCount, latestReportDate, labeled, sourcesCorroborating, sourcesQueried,
                sourceEvidence, mechanismPlausibility, severity, onsetDays);
    }

    @Override
    public String toString() {
        return "CaseProfile{" +
                "serious=" + seriousCount +
                ", deaths=" + deathCount +
                ", latestReportDate=" + latestReportDate +
                ", labeled=" + labeled +
                ", sources=" + sourcesCorroborating + "/" + sourcesQueried +
                '}';
    }

    /**
     * Fluent builder for {@link CaseProfile}.
     */
    public static class Builder {
        private Long totalCases;
        private long seriousCount;
        private long deathCount;
        private long hospitalizationCount;
        private long disabilityCount;
        private LocalDate latestReportDate;
        private boolean labeled;
        private long sourcesCorroborating;
        private long sourcesQueried;
        private List<SourceEvidence> sourceEvidence = new ArrayList<>();
        private double mechanismPlausibility = 0.5;
        private Double severity;
        private List<Integer> onsetDays = new ArrayList<>();

        public Builder totalCases(Long v) {
            this.totalCases = v;
            return this;
        }

        public Builder seriousCount(long v) {
            this.seriousCount = v;
            return this;
        }

        public Builder deathCount(long v) {
            this.deathCount = v;
            return this;
        }

        public Builder hospitalizationCount(long v) {
            this.hospitalizationCount = v;
            return this;
        }

        public Builder disabilityCount(long v) {
            this.disabilityCount = v;
            return this;
        }

        public Builder latestReportDate(LocalDate v) {
            this.latestReportDate = v;
            return this;
        }

        public Builder labeled(boolean v) {
            this.labeled = v;
            return this;
        }

        public Builder sources(int corroborating, int queried) {
            this.sourcesCorroborating = corroborating;
            this.sourcesQueried = queried;
            return this;
        }

        public Builder sourceEvidence(List<SourceEvidence> v) {
            this.sourceEvidence = v != null ? new ArrayList<>(v) : new ArrayList<>();
            return this;
        }

        public Builder mechanismPlausibility(double v) {
            this.mechanismPlausibility = v;
            return this;
        }

        public Builder severity(Double v) {
            this.severity = v;
            return this;
        }

        public Builder onsetDays(List<Integer> v) {
            this.onsetDays = v != null ? new ArrayList<>(v) : new ArrayList<>();
            return this;
        }

        /**
         * @throws IllegalArgumentException if a count or onset is negative or a
         *                                  score lies outside [0, 1]
         */
        public CaseProfile build() {
            return new CaseProfile(this);
        }
    }
}
