package com.signalsentinel.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.signalsentinel.core.model.Answer;
import com.signalsentinel.core.model.CaseProfile;
import com.signalsentinel.core.model.ClinicalFeatures;
import com.signalsentinel.core.model.ContingencyTable;
import com.signalsentinel.core.model.DechallengeOutcome;
import com.signalsentinel.core.model.DrugEventPair;
import com.signalsentinel.core.model.RechallengeOutcome;
import com.signalsentinel.core.model.ReportingGranularity;
import com.signalsentinel.core.model.SourceEvidence;
import com.signalsentinel.core.model.TimePoint;
import com.signalsentinel.core.model.TimeSeriesData;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * JSON shape of one input drug-event pair.
 *
 * <p>
 * Mirrors {@link DrugEventPair} with plain, Jackson-friendly beans. Only
 * {@code drug}, {@code event} and {@code table} are required; the clinical
 * features, time series and case profile may be omitted.
 * </p>
 *
 * <pre>
 * {
 *   "drug": "drugA", "event": "hepatitis",
 *   "table": { "a": 45, "b": 955, "c": 500, "d": 98500 },
 *   "clinicalFeatures": { "timeToOnsetDays": 12, "dechallenge": "IMPROVED" },
 *   "timeSeries": { "granularity": "MONTH",
 *                   "points": [ { "period": "2025-01-01", "count": 2 } ] },
 *   "caseProfile": { "seriousCount": 45, "latestReportDate": "2025-06-30" }
 * }
 * </pre>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PairRecord {

    private String drug;
    private String event;
    private TableRecord table;
    private ClinicalRecord clinicalFeatures;
    private SeriesRecord timeSeries;
    private ProfileRecord caseProfile;

    /**
     * Convert to the engine's domain model.
     *
     * @throws IllegalArgumentException if a required part is missing or a
     *                                  value is rejected by the domain model
     */
    public DrugEventPair toPair() {
        if (table == null) {
            throw new IllegalArgumentException("table is required");
        }
        DrugEventPair.Builder builder = DrugEventPair.builder()
                .drug(drug)
                .event(event)
                .table(table.toTable());
        if (clinicalFeatures != null) {
            builder.clinicalFeatures(clinicalFeatures.toFeatures());
        }
        if (timeSeries != null) {
            builder.timeSeries(timeSeries.toSeries());
        }
        if (caseProfile != null) {
            builder.caseProfile(caseProfile.toProfile());
        }
        return builder.build();
    }

    public String getDrug() {
        return drug;
    }

    public void setDrug(String drug) {
        this.drug = drug;
    }

    public String getEvent() {
        return event;
    }

    public void setEvent(String event) {
        this.event = event;
    }

    public TableRecord getTable() {
        return table;
    }

    public void setTable(TableRecord table) {
        this.table = table;
    }

    public ClinicalRecord getClinicalFeatures() {
        return clinicalFeatures;
    }

    public void setClinicalFeatures(ClinicalRecord clinicalFeatures) {
        this.clinicalFeatures = clinicalFeatures;
    }

    public SeriesRecord getTimeSeries() {
        return timeSeries;
    }

    public void setTimeSeries(SeriesRecord timeSeries) {
        this.timeSeries = timeSeries;
    }

    public ProfileRecord getCaseProfile() {
        return caseProfile;
    }

    public void setCaseProfile(ProfileRecord caseProfile) {
        this.caseProfile = caseProfile;
    }

    // ---------------------------------------------------------------
    // Nested records
    // ---------------------------------------------------------------

    /** The four cells of the 2x2 contingency table. */
    public static class TableRecord {
        private long a;
        private long b;
        private long c;
        private long d;

        ContingencyTable toTable() {
            return new ContingencyTable(a, b, c, d);
        }

        public long getA() {
            return a;
        }

        public void setA(long a) {
            this.a = a;
        }

        public long getB() {
            return b;
        }

        public void setB(long b) {
            this.b = b;
        }

        public long getC() {
            return c;
        }

        public void setC(long c) {
            this.c = c;
        }

        public long getD() {
            return d;
        }

        public void setD(long d) {
            this.d = d;
        }
    }

    /** Case-level clinical evidence; absent answers are unknown. */
    public static class ClinicalRecord {
        private Integer timeToOnsetDays;
        private DechallengeOutcome dechallenge = DechallengeOutcome.UNKNOWN;
        private RechallengeOutcome rechallenge = RechallengeOutcome.NOT_ATTEMPTED;
        private List<String> alternativeCauses = new ArrayList<>();
        private boolean indicationCouldCauseEvent;
        private Answer knownReaction = Answer.UNKNOWN;
        private Answer placeboReaction = Answer.UNKNOWN;
        private Answer toxicDrugLevel = Answer.UNKNOWN;
        private Answer doseResponse = Answer.UNKNOWN;
        private Answer previousSimilarReaction = Answer.UNKNOWN;
        private Answer objectiveEvidence = Answer.UNKNOWN;

        ClinicalFeatures toFeatures() {
            return ClinicalFeatures.builder()
                    .timeToOnsetDays(timeToOnsetDays)
                    .dechallenge(dechallenge)
                    .rechallenge(rechallenge)
                    .alternativeCauses(alternativeCauses == null ? null : new LinkedHashSet<>(alternativeCauses))
                    .indicationCouldCauseEvent(indicationCouldCauseEvent)
                    .knownReaction(knownReaction)
                    .placeboReaction(placeboReaction)
                    .toxicDrugLevel(toxicDrugLevel)
                    .doseResponse(doseResponse)
                    .previousSimilarReaction(previousSimilarReaction)
                    .objectiveEvidence(objectiveEvidence)
                    .build();
        }

        public Integer getTimeToOnsetDays() {
            return timeToOnsetDays;
        }

        public void setTimeToOnsetDays(Integer timeToOnsetDays) {
            this.timeToOnsetDays = timeToOnsetDays;
        }

        public DechallengeOutcome getDechallenge() {
            return dechallenge;
        }

        public void setDechallenge(DechallengeOutcome dechallenge) {
            this.dechallenge = dechallenge;
        }

        public RechallengeOutcome getRechallenge() {
            return rechallenge;
        }

        public void setRechallenge(RechallengeOutcome rechallenge) {
            this.rechallenge = rechallenge;
        }

        public List<String> getAlternativeCauses() {
            return alternativeCauses;
        }

        public void setAlternativeCauses(List<String> alternativeCauses) {
            this.alternativeCauses = alternativeCauses;
        }

        public boolean isIndicationCouldCauseEvent() {
            return indicationCouldCauseEvent;
        }

        public void setIndicationCouldCauseEvent(boolean indicationCouldCauseEvent) {
            this.indicationCouldCauseEvent = indicationCouldCauseEvent;
        }

        public Answer getKnownReaction() {
            return knownReaction;
        }

        public void setKnownReaction(Answer knownReaction) {
            this.knownReaction = knownReaction;
        }

        public Answer getPlaceboReaction() {
            return placeboReaction;
        }

        public void setPlaceboReaction(Answer placeboReaction) {
            this.placeboReaction = placeboReaction;
        }

        public Answer getToxicDrugLevel() {
            return toxicDrugLevel;
        }

        public void setToxicDrugLevel(Answer toxicDrugLevel) {
            this.toxicDrugLevel = toxicDrugLevel;
        }

        public Answer getDoseResponse() {
            return doseResponse;
        }

        public void setDoseResponse(Answer doseResponse) {
            this.doseResponse = doseResponse;
        }

        public Answer getPreviousSimilarReaction() {
            return previousSimilarReaction;
        }

        public void setPreviousSimilarReaction(Answer previousSimilarReaction) {
            this.previousSimilarReaction = previousSimilarReaction;
        }

        public Answer getObjectiveEvidence() {
            return objectiveEvidence;
        }

        public void setObjectiveEvidence(Answer objectiveEvidence) {
            this.objectiveEvidence = objectiveEvidence;
        }
    }

    /** Reporting counts per period. */
    public static class SeriesRecord {
        private ReportingGranularity granularity = ReportingGranularity.MONTH;
        private List<PointRecord> points = new ArrayList<>();

        TimeSeriesData toSeries() {
            if (granularity == null) {
                throw new IllegalArgumentException("timeSeries.granularity must not be null");
            }
            List<TimePoint> converted = new ArrayList<>();
            if (points != null) {
                for (PointRecord point : points) {
                    if (point == null || point.period == null) {
                        throw new IllegalArgumentException("timeSeries point needs a period");
                    }
                    converted.add(new TimePoint(point.period, point.count));
                }
            }
            return new TimeSeriesData(converted, granularity);
        }

        public ReportingGranularity getGranularity() {
            return granularity;
        }

        public void setGranularity(ReportingGranularity granularity) {
            this.granularity = granularity;
        }

        public List<PointRecord> getPoints() {
            return points;
        }

        public void setPoints(List<PointRecord> points) {
            this.points = points;
        }
    }

    /** One period of a time series. */
    public static class PointRecord {
        private LocalDate period;
        private long count;

        public LocalDate getPeriod() {
            return period;
        }

        public void setPeriod(LocalDate period) {
            this.period = period;
        }

        public long getCount() {
            return count;
        }

        public void setCount(long count) {
            this.count = count;
        }
    }

    /** Aggregated case facts for both composite layers. */
    public static class ProfileRecord {
        private Long totalCases;
        private long seriousCount;
        private long deathCount;
        private long hospitalizationCount;
        private long disabilityCount;
        private LocalDate latestReportDate;
        private boolean labeled;
        private int sourcesCorroborating;
        private int sourcesQueried;
        private List<EvidenceRecord> sourceEvidence = new ArrayList<>();
        private double mechanismPlausibility = 0.5;
        private Double severity;
        private List<Integer> onsetDays = new ArrayList<>();

        CaseProfile toProfile() {
            List<SourceEvidence> evidence = new ArrayList<>();
            if (sourceEvidence != null) {
                for (EvidenceRecord item : sourceEvidence) {
                    if (item == null || item.sourceType == null) {
                        throw new IllegalArgumentException("caseProfile.sourceEvidence item needs a sourceType");
                    }
                    evidence.add(new SourceEvidence(item.sourceType, item.confidence, item.strength));
                }
            }
            return CaseProfile.builder()
                    .totalCases(totalCases)
                    .seriousCount(seriousCount)
                    .deathCount(deathCount)
                    .hospitalizationCount(hospitalizationCount)
                    .disabilityCount(disabilityCount)
                    .latestReportDate(latestReportDate)
                    .labeled(labeled)
                    .sources(sourcesCorroborating, sourcesQueried)
                    .sourceEvidence(evidence)
                    .mechanismPlausibility(mechanismPlausibility)
                    .severity(severity)
                    .onsetDays(onsetDays)
                    .build();
        }

        public List<Integer> getOnsetDays() {
            return onsetDays;
        }

        public void setOnsetDays(List<Integer> onsetDays) {
            this.onsetDays = onsetDays;
        }

        public Long getTotalCases() {
            return totalCases;
        }

        public void setTotalCases(Long totalCases) {
            this.totalCases = totalCases;
        }

        public long getSeriousCount() {
            return seriousCount;
        }

        public void setSeriousCount(long seriousCount) {
            this.seriousCount = seriousCount;
        }

        public long getDeathCount() {
            return deathCount;
        }

        public void setDeathCount(long deathCount) {
            this.deathCount = deathCount;
        }

        public long getHospitalizationCount() {
            return hospitalizationCount;
        }

        public void setHospitalizationCount(long hospitalizationCount) {
            this.hospitalizationCount = hospitalizationCount;
        }

        public long getDisabilityCount() {
            return disabilityCount;
        }

        public void setDisabilityCount(long disabilityCount) {
            this.disabilityCount = disabilityCount;
        }

        public LocalDate getLatestReportDate() {
            return latestReportDate;
        }

        public void setLatestReportDate(LocalDate latestReportDate) {
            this.latestReportDate = latestReportDate;
        }

        public boolean isLabeled() {
            return labeled;
        }

        public void setLabeled(boolean labeled) {
            this.labeled = labeled;
        }

        public int getSourcesCorroborating() {
            return sourcesCorroborating;
        }

        public void setSourcesCorroborating(int sourcesCorroborating) {
            this.sourcesCorroborating = sourcesCorroborating;
        }

        public int getSourcesQueried() {
            return sourcesQueried;
        }

        public void setSourcesQueried(int sourcesQueried) {
            this.sourcesQueried = sourcesQueried;
        }

        public List<EvidenceRecord> getSourceEvidence() {
            return sourceEvidence;
        }

        public void setSourceEvidence(List<EvidenceRecord> sourceEvidence) {
            this.sourceEvidence = sourceEvidence;
        }

        public double getMechanismPlausibility() {
            return mechanismPlausibility;
        }

        public void setMechanismPlausibility(double mechanismPlausibility) {
            this.mechanismPlausibility = mechanismPlausibility;
        }

        public Double getSeverity() {
            return severity;
        }

        public void setSeverity(Double severity) {
            this.severity = severity;
        }
    }

    /** Evidence from one external source. */
    public static class EvidenceRecord {
        private String sourceType;
        private double confidence;
        private double strength;

        public String getSourceType() {
            return sourceType;
        }

        public void setSourceType(String sourceType) {
            this.sourceType = sourceType;
        }

        public double getConfidence() {
            return confidence;
        }

        public void setConfidence(double confidence) {
            this.confidence = confidence;
        }

        public double getStrength() {
            return strength;
        }

        public void setStrength(double strength) {
            this.strength = strength;
        }
    }
}
