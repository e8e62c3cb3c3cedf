package com.signalsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * Engine input: one drug-event association and whatever context is known
 * about it.
 *
 * <p>
 * Only the contingency table is required. Clinical features, the reporting
 * time series and the case profile are optional; components whose input is
 * absent are skipped and noted on the result.
 * </p>
 *
 * @since 1.0.0
 */
public final class DrugEventPair implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String drug;
    private final String event;
    private final ContingencyTable table;
    private final ClinicalFeatures clinicalFeatures;
    private final TimeSeriesData timeSeries;
    private final CaseProfile caseProfile;

    private DrugEventPair(Builder b) {
        this.drug = requireNonBlank(b.drug, "drug");
        this.event = requireNonBlank(b.event, "event");
        this.table = Objects.requireNonNull(b.table, "contingency table must not be null");
        this.clinicalFeatures = b.clinicalFeatures;
        this.timeSeries = b.timeSeries;
        this.caseProfile = b.caseProfile;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DrugEventPair of(String drug, String event, ContingencyTable table) {
        return builder().drug(drug).event(event).table(table).build();
    }

    public String getDrug() {
        return drug;
    }

    public String getEvent() {
        return event;
    }

    public ContingencyTable getTable() {
        return table;
    }

    public Optional<ClinicalFeatures> getClinicalFeatures() {
        return Optional.ofNullable(clinicalFeatures);
    }

    public Optional<TimeSeriesData> getTimeSeries() {
        return Optional.ofNullable(timeSeries);
    }

    public Optional<CaseProfile> getCaseProfile() {
        return Optional.ofNullable(caseProfile);
    }

    /** {@code drug/event}, used in log lines. */
    public String key() {
        return drug + "/" + event;
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DrugEventPair that))
            return false;
        return drug.equals(that.drug)
                && event.equals(that.event)
                && table.equals(that.table)
                && Objects.equals(clinicalFeatures, that.clinicalFeatures)
                && Objects.equals(timeSeries, that.timeSeries)
                && Objects.equals(caseProfile, that.caseProfile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(drug, event, table, clinicalFeatures, timeSeries, caseProfile);
    }

    @Override
    public String toString() {
        return "DrugEventPair{" + key() + ", " + table + '}';
    }

    /**
     * Fluent builder for {@link DrugEventPair}. {@code drug}, {@code event}
     * and {@code table} are required.
     */
    public static class Builder {
        private String drug;
        private String event;
        private ContingencyTable table;
        private ClinicalFeatures clinicalFeatures;
        private TimeSeriesData timeSeries;
        private CaseProfile caseProfile;

        public Builder drug(String v) {
            this.drug = v;
            return this;
        }

        public Builder event(String v) {
            this.event = v;
            return this;
        }

        public Builder table(ContingencyTable v) {
            this.table = v;
            return this;
        }

        public Builder clinicalFeatures(ClinicalFeatures v) {
            this.clinicalFeatures = v;
            return this;
        }

        public Builder timeSeries(TimeSeriesData v) {
            this.timeSeries = v;
            return this;
        }

        public Builder caseProfile(CaseProfile v) {
            this.caseProfile = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code drug} or {@code event} is
         *                                  blank
         * @throws NullPointerException     if {@code table} is {@code null}
         */
        public DrugEventPair build() {
            return new DrugEventPair(this);
        }
    }
}
