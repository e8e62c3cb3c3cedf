package com.signalsentinel.core.causality;

import com.signalsentinel.core.model.Answer;
import com.signalsentinel.core.model.ClinicalFeatures;
import com.signalsentinel.core.model.NaranjoQuestion;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Derives answers to the ten Naranjo questions from clinical features.
 *
 * <p>
 * Scoring is {@link NaranjoQuestion#points(Answer)} summed over all questions.
 * An empty set of alternative causes counts as a "no" for question 5.
 * </p>
 *
 * @since 1.0.0
 */
public final class NaranjoScorer {

    private NaranjoScorer() {
    }

    public static Map<NaranjoQuestion, Answer> answers(ClinicalFeatures features) {
        Objects.requireNonNull(features, "ClinicalFeatures must not be null");
        Map<NaranjoQuestion, Answer> answers = new EnumMap<>(NaranjoQuestion.class);

        answers.put(NaranjoQuestion.PREVIOUS_REPORTS, features.getKnownReaction());

        answers.put(NaranjoQuestion.AFTER_DRUG, features.getTimeToOnsetDays().isPresent()
                ? (features.getTimeToOnsetDays().getAsInt() >= 0 ? Answer.YES : Answer.NO)
                : Answer.UNKNOWN);

        answers.put(NaranjoQuestion.DECHALLENGE, switch (features.getDechallenge()) {
            case IMPROVED -> Answer.YES;
            case UNCHANGED -> Answer.NO;
            case UNKNOWN -> Answer.UNKNOWN;
        });

        answers.put(NaranjoQuestion.RECHALLENGE, switch (features.getRechallenge()) {
            case RECURRED -> Answer.YES;
            case DID_NOT_RECUR -> Answer.NO;
            case NOT_ATTEMPTED -> Answer.UNKNOWN;
        });

        answers.put(NaranjoQuestion.ALTERNATIVE_CAUSES,
                features.hasAlternativeCauses() || features.isIndicationCouldCauseEvent()
                        ? Answer.YES
                        : Answer.NO);

        answers.put(NaranjoQuestion.PLACEBO, features.getPlaceboReaction());
        answers.put(NaranjoQuestion.TOXIC_LEVEL, features.getToxicDrugLevel());
        answers.put(NaranjoQuestion.DOSE_RESPONSE, features.getDoseResponse());
        answers.put(NaranjoQuestion.PREVIOUS_SIMILAR, features.getPreviousSimilarReaction());
        answers.put(NaranjoQuestion.OBJECTIVE_EVIDENCE, features.getObjectiveEvidence());
        return answers;
    }

    public static int score(Map<NaranjoQuestion, Answer> answers) {
        int total = 0;
        for (Map.Entry<NaranjoQuestion, Answer> entry : answers.entrySet()) {
            total += entry.getKey().points(entry.getValue());
        }
        return total;
    }
}
