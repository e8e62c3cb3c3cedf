package com.signalsentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Case-level clinical evidence used for causality assessment.
 *
 * <p>
 * Only {@code timeToOnsetDays}, the challenge outcomes and the alternative
 * causes drive the WHO-UMC decision table. The remaining answers default to
 * {@link Answer#UNKNOWN} and only feed the Naranjo questionnaire.
 * </p>
 *
 * @since 1.0.0
 */
public final class ClinicalFeatures implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Integer timeToOnsetDays;
    private final DechallengeOutcome dechallenge;
    private final RechallengeOutcome rechallenge;
    private final Set<String> alternativeCauses;
    private final boolean indicationCouldCauseEvent;
    private final Answer knownReaction;
    private final Answer placeboReaction;
    private final Answer toxicDrugLevel;
    private final Answer doseResponse;
    private final Answer previousSimilarReaction;
    private final Answer objectiveEvidence;

    private ClinicalFeatures(Builder b) {
        this.timeToOnsetDays = b.timeToOnsetDays;
        this.dechallenge = Objects.requireNonNull(b.dechallenge, "dechallenge must not be null");
        this.rechallenge = Objects.requireNonNull(b.rechallenge, "rechallenge must not be null");
        this.alternativeCauses = Collections.unmodifiableSet(new LinkedHashSet<>(b.alternativeCauses));
        this.indicationCouldCauseEvent = b.indicationCouldCauseEvent;
        this.knownReaction = Objects.requireNonNull(b.knownReaction, "knownReaction must not be null");
        this.placeboReaction = Objects.requireNonNull(b.placeboReaction, "placeboReaction must not be null");
        this.toxicDrugLevel = Objects.requireNonNull(b.toxicDrugLevel, "toxicDrugLevel must not be null");
        this.doseResponse = Objects.requireNonNull(b.doseResponse, "doseResponse must not be null");
        this.previousSimilarReaction = Objects.requireNonNull(b.previousSimilarReaction,
                "previousSimilarReaction must not be null");
        this.objectiveEvidence = Objects.requireNonNull(b.objectiveEvidence,
                "objectiveEvidence must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return days from first exposure to onset; empty when unknown
     */
    public OptionalInt getTimeToOnsetDays() {
        return timeToOnsetDays == null ? OptionalInt.empty() : OptionalInt.of(timeToOnsetDays);
    }

    public DechallengeOutcome getDechallenge() {
        return dechallenge;
    }

    public RechallengeOutcome getRechallenge() {
        return rechallenge;
    }

    public Set<String> getAlternativeCauses() {
        return alternativeCauses;
    }

    public boolean hasAlternativeCauses() {
        return !alternativeCauses.isEmpty();
    }

    public boolean isIndicationCouldCauseEvent() {
        return indicationCouldCauseEvent;
    }

    /** Conclusive previous reports of this reaction exist. */
    public Answer getKnownReaction() {
        return knownReaction;
    }

    public Answer getPlaceboReaction() {
        return placeboReaction;
    }

    public Answer getToxicDrugLevel() {
        return toxicDrugLevel;
    }

    public Answer getDoseResponse() {
        return doseResponse;
    }

    public Answer getPreviousSimilarReaction() {
        return previousSimilarReaction;
    }

    public Answer getObjectiveEvidence() {
        return objectiveEvidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ClinicalFeatures that))
            return false;
        return Objects.equals(timeToOnsetDays, that.timeToOnsetDays)
                && dechallenge == that.dechallenge
                && rechallenge == that.rechallenge
                && alternativeCauses.equals(that.alternativeCauses)
                && indicationCouldCauseEvent == that.indicationCouldCauseEvent
                && knownReaction == that.knownReaction
                && placeboReaction == that.placeboReaction
                && toxicDrugLevel == that.toxicDrugLevel
                && doseResponse == that.doseResponse
                && previousSimilarReaction == that.previousSimilarReaction
                && objectiveEvidence == that.objectiveEvidence;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timeToOnsetDays, dechallenge, rechallenge, alternativeCauses,
                indicationCouldCauseEvent, knownReaction, placeboReaction, toxicDrugLevel,
                doseResponse, previousSimilarReaction, objectiveEvidence);
    }

    @Override
    public String toString() {
        return "ClinicalFeatures{" +
                "timeToOnsetDays=" + timeToOnsetDays +
                ", dechallenge=" + dechallenge +
                ", rechallenge=" + rechallenge +
                ", alternativeCauses=" + alternativeCauses +
                '}';
    }

    /**
     * Fluent builder for {@link ClinicalFeatures}. Everything defaults to
     * "unknown".
     */
    public static class Builder {
        private Integer timeToOnsetDays;
        private DechallengeOutcome dechallenge = DechallengeOutcome.UNKNOWN;
        private RechallengeOutcome rechallenge = RechallengeOutcome.NOT_ATTEMPTED;
        private Set<String> alternativeCauses = new LinkedHashSet<>();
        private boolean indicationCouldCauseEvent;
        private Answer knownReaction = Answer.UNKNOWN;
        private Answer placeboReaction = Answer.UNKNOWN;
        private Answer toxicDrugLevel = Answer.UNKNOWN;
        private Answer doseResponse = Answer.UNKNOWN;
        private Answer previousSimilarReaction = Answer.UNKNOWN;
        private Answer objectiveEvidence = Answer.UNKNOWN;

        public Builder timeToOnsetDays(Integer v) {
            this.timeToOnsetDays = v;
            return this;
        }

        public Builder dechallenge(DechallengeOutcome v) {
            this.dechallenge = v;
            return this;
        }

        public Builder rechallenge(RechallengeOutcome v) {
            this.rechallenge = v;
            return this;
        }

        public Builder alternativeCauses(Set<String> v) {
            this.alternativeCauses = v != null ? new LinkedHashSet<>(v) : new LinkedHashSet<>();
            return this;
        }

        public Builder alternativeCause(String cause) {
            this.alternativeCauses.add(Objects.requireNonNull(cause, "cause must not be null"));
            return this;
        }

        public Builder indicationCouldCauseEvent(boolean v) {
            this.indicationCouldCauseEvent = v;
            return this;
        }

        public Builder knownReaction(Answer v) {
            this.knownReaction = v;
            return this;
        }

        public Builder placeboReaction(Answer v) {
            this.placeboReaction = v;
            return this;
        }

        public Builder toxicDrugLevel(Answer v) {
            this.toxicDrugLevel = v;
            return this;
        }

        public Builder doseResponse(Answer v) {
            this.doseResponse = v;
            return this;
        }

        public Builder previousSimilarReaction(Answer v) {
            this.previousSimilarReaction = v;
            return this;
        }

        public Builder objectiveEvidence(Answer v) {
            this.objectiveEvidence = v;
            return this;
        }

        public ClinicalFeatures build() {
            return new ClinicalFeatures(this);
        }
    }
}
