package com.signalsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Final, explainable judgment for one drug-event pair.
 *
 * <p>
 * Carries every upstream result so that a reviewer can trace the fused score
 * back to its inputs. Each upstream result is optional: absence means the
 * component was not computed, and {@link #getNotes()} says why.
 * </p>
 *
 * <h3>Error-marked results</h3>
 * <p>
 * When a pair could not be scored, {@link #getError()} is present and the
 * result carries no scores, no tier, no rank and no percentile.
 * </p>
 *
 * <h3>Ranking</h3>
 * <p>
 * Rank, percentile and classical rank are only present on results produced
 * by a batch run; scoring a single pair leaves them empty. The classical rank
 * orders the batch by observed count alone.
 * </p>
 *
 * @since 1.0.0
 */
public final class FusionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String drug;
    private final String event;
    private final long observed;
    private final DisproportionalityResult disproportionality;
    private final BayesianResult bayesian;
    private final CausalityResult causality;
    private final TemporalResult temporal;
    private final SingleSourceComponents singleSource;
    private final MultiSourceComponents multiSource;
    private final Double evidenceScore;
    private final Double layer1Squashed;
    private final Double fusionScore;
    private final AlertTier alertTier;
    private final Integer rank;
    private final Double percentile;
    private final Integer classicalRank;
    private final List<String> notes;
    private final ScoringError error;

    private FusionResult(Builder b) {
        this.drug = Objects.requireNonNull(b.drug, "drug must not be null");
        this.event = Objects.requireNonNull(b.event, "event must not be null");
        this.observed = b.observed;
        this.disproportionality = b.disproportionality;
        this.bayesian = b.bayesian;
        this.causality = b.causality;
        this.temporal = b.temporal;
        this.singleSource = b.singleSource;
        this.multiSource = b.multiSource;
        this.evidenceScore = b.evidenceScore;
        this.layer1Squashed = b.layer1Squashed;
        this.fusionScore = b.fusionScore;
        this.alertTier = b.alertTier;
        this.rank = b.rank;
        this.percentile = b.percentile;
        this.classicalRank = b.classicalRank;
        this.notes = List.copyOf(b.notes);
        this.error = b.error;
        if (error == null && (fusionScore == null || alertTier == null)) {
            throw new IllegalStateException("A scored result needs a fusion score and an alert tier");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build an error-marked result for a pair that could not be scored.
     */
    public static FusionResult failed(DrugEventPair pair, ScoringError error) {
        Objects.requireNonNull(error, "error must not be null");
        return builder()
                .drug(pair.getDrug())
                .event(pair.getEvent())
                .observed(pair.getTable().getA())
                .error(error)
                .build();
    }

    /**
     * Copy of this result with its batch position attached.
     *
     * @throws IllegalStateException if this result is error-marked
     */
    public FusionResult withRanking(int rank, double percentile, int classicalRank) {
        if (error != null) {
            throw new IllegalStateException("Error-marked results cannot be ranked: " + drug + "/" + event);
        }
        Builder b = toBuilder();
        b.rank = rank;
        b.percentile = percentile;
        b.classicalRank = classicalRank;
        return b.build();
    }

    private Builder toBuilder() {
        Builder b = new Builder();
        b.drug = drug;
        b.event = event;
        b.observed = observed;
        b.disproportionality = disproportionality;
        b.bayesian = bayesian;
        b.causality = causality;
        b.temporal = temporal;
        b.singleSource = singleSource;
        b.multiSource = multiSource;
        b.evidenceScore = evidenceScore;
        b.layer1Squashed = layer1Squashed;
        b.fusionScore = fusionScore;
        b.alertTier = alertTier;
        b.rank = rank;
        b.percentile = percentile;
        b.classicalRank = classicalRank;
        b.notes = new ArrayList<>(notes);
        b.error = error;
        return b;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getDrug() {
        return drug;
    }

    public String getEvent() {
        return event;
    }

    /** Observed co-occurrence count {@code a}. */
    public long getObserved() {
        return observed;
    }

    public boolean isScored() {
        return error == null;
    }

    public Optional<DisproportionalityResult> getDisproportionality() {
        return Optional.ofNullable(disproportionality);
    }

    public Optional<BayesianResult> getBayesian() {
        return Optional.ofNullable(bayesian);
    }

    public Optional<CausalityResult> getCausality() {
        return Optional.ofNullable(causality);
    }

    public Optional<TemporalResult> getTemporal() {
        return Optional.ofNullable(temporal);
    }

    public Optional<SingleSourceComponents> getSingleSource() {
        return Optional.ofNullable(singleSource);
    }

    public Optional<MultiSourceComponents> getMultiSource() {
        return Optional.ofNullable(multiSource);
    }

    public OptionalDouble getEvidenceScore() {
        return optional(evidenceScore);
    }

    /** Layer-1 score after the bounded squashing transform. */
    public OptionalDouble getLayer1Squashed() {
        return optional(layer1Squashed);
    }

    public OptionalDouble getFusionScore() {
        return optional(fusionScore);
    }

    public Optional<AlertTier> getAlertTier() {
        return Optional.ofNullable(alertTier);
    }

    public OptionalInt getRank() {
        return rank == null ? OptionalInt.empty() : OptionalInt.of(rank);
    }

    public OptionalDouble getPercentile() {
        return optional(percentile);
    }

    /**
     * Position in the batch by observed count alone, for comparison with the
     * fused rank.
     */
    public OptionalInt getClassicalRank() {
        return classicalRank == null ? OptionalInt.empty() : OptionalInt.of(classicalRank);
    }

    /** Reasons for every component that was not computed. */
    public List<String> getNotes() {
        return notes;
    }

    public Optional<ScoringError> getError() {
        return Optional.ofNullable(error);
    }

    private static OptionalDouble optional(Double value) {
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FusionResult that))
            return false;
        return observed == that.observed
                && drug.equals(that.drug)
                && event.equals(that.event)
                && Objects.equals(disproportionality, that.disproportionality)
                && Objects.equals(bayesian, that.bayesian)
                && Objects.equals(causality, that.causality)
                && Objects.equals(temporal, that.temporal)
                && Objects.equals(singleSource, that.singleSource)
                && Objects.equals(multiSource, that.multiSource)
                && Objects.equals(evidenceScore, that.evidenceScore)
                && Objects.equals(layer1Squashed, that.layer1Squashed)
                && Objects.equals(fusionScore, that.fusionScore)
                && alertTier == that.alertTier
                && Objects.equals(rank, that.rank)
                && Objects.equals(percentile, that.percentile)
                && Objects.equals(classicalRank, that.classicalRank)
                && notes.equals(that.notes)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(drug, event, observed, fusionScore, alertTier, rank, percentile, classicalRank,
                error);
    }

    @Override
    public String toString() {
        if (error != null) {
            return "FusionResult{" + drug + "/" + event + ", error=" + error + '}';
        }
        return "FusionResult{" + drug + "/" + event +
                ", fusion=" + String.format("%.4f", fusionScore) +
                ", tier=" + alertTier +
                ", rank=" + rank +
                ", percentile=" + percentile +
                ", classicalRank=" + classicalRank +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link FusionResult}.
     */
    public static class Builder {
        private String drug;
        private String event;
        private long observed;
        private DisproportionalityResult disproportionality;
        private BayesianResult bayesian;
        private CausalityResult causality;
        private TemporalResult temporal;
        private SingleSourceComponents singleSource;
        private MultiSourceComponents multiSource;
        private Double evidenceScore;
        private Double layer1Squashed;
        private Double fusionScore;
        private AlertTier alertTier;
        private Integer rank;
        private Double percentile;
        private Integer classicalRank;
        private List<String> notes = new ArrayList<>();
        private ScoringError error;

        public Builder drug(String v) {
            this.drug = v;
            return this;
        }

        public Builder event(String v) {
            this.event = v;
            return this;
        }

        public Builder observed(long v) {
            this.observed = v;
            return this;
        }

        public Builder disproportionality(DisproportionalityResult v) {
            this.disproportionality = v;
            return this;
        }

        public Builder bayesian(BayesianResult v) {
            this.bayesian = v;
            return this;
        }

        public Builder causality(CausalityResult v) {
            this.causality = v;
            return this;
        }

        public Builder temporal(TemporalResult v) {
            this.temporal = v;
            return this;
        }

        public Builder singleSource(SingleSourceComponents v) {
            this.singleSource = v;
            return this;
        }

        public Builder multiSource(MultiSourceComponents v) {
            this.multiSource = v;
            return this;
        }

        public Builder evidenceScore(double v) {
            this.evidenceScore = v;
            return this;
        }

        public Builder layer1Squashed(double v) {
            this.layer1Squashed = v;
            return this;
        }

        public Builder fusionScore(double v) {
            this.fusionScore = v;
            return this;
        }

        public Builder alertTier(AlertTier v) {
            this.alertTier = v;
            return this;
        }

        public Builder notes(List<String> v) {
            this.notes = v != null ? new ArrayList<>(v) : new ArrayList<>();
            return this;
        }

        public Builder error(ScoringError v) {
            this.error = v;
            return this;
        }

        /**
         * @throws IllegalStateException if neither an error nor a full score is
         *                               present
         */
        public FusionResult build() {
            return new FusionResult(this);
        }
    }
}
