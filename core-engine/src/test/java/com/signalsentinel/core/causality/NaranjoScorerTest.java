package com.signalsentinel.core.causality;

import com.signalsentinel.core.model.Answer;
import com.signalsentinel.core.model.ClinicalFeatures;
import com.signalsentinel.core.model.DechallengeOutcome;
import com.signalsentinel.core.model.NaranjoCategory;
import com.signalsentinel.core.model.NaranjoQuestion;
import com.signalsentinel.core.model.RechallengeOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link NaranjoScorer}.
 */
class NaranjoScorerTest {

    @Test
    @DisplayName("Should score a fully documented reaction as definite")
    void shouldScoreDefinite() {
        ClinicalFeatures features = ClinicalFeatures.builder()
                .timeToOnsetDays(5)
                .dechallenge(DechallengeOutcome.IMPROVED)
                .rechallenge(RechallengeOutcome.RECURRED)
                .knownReaction(Answer.YES)
                .doseResponse(Answer.YES)
                .objectiveEvidence(Answer.YES)
                .build();

        int score = NaranjoScorer.score(NaranjoScorer.answers(features));

        // 1 + 2 + 1 + 2 + 2 (no alternatives) + 1 + 1
        assertThat(score).isEqualTo(10);
        assertThat(NaranjoCategory.fromScore(score)).isEqualTo(NaranjoCategory.DEFINITE);
    }

    @Test
    @DisplayName("Should count an empty alternative-cause set as a NO answer")
    void shouldCountNoAlternativesAsNo() {
        Map<NaranjoQuestion, Answer> answers = NaranjoScorer.answers(ClinicalFeatures.builder().build());

        assertThat(answers).hasSize(NaranjoQuestion.values().length);
        assertThat(answers.get(NaranjoQuestion.ALTERNATIVE_CAUSES)).isEqualTo(Answer.NO);
        assertThat(answers.get(NaranjoQuestion.AFTER_DRUG)).isEqualTo(Answer.UNKNOWN);
        assertThat(NaranjoScorer.score(answers)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should penalise contradicting evidence")
    void shouldPenaliseContradictions() {
        ClinicalFeatures features = ClinicalFeatures.builder()
                .timeToOnsetDays(-1)
                .rechallenge(RechallengeOutcome.DID_NOT_RECUR)
                .indicationCouldCauseEvent(true)
                .placeboReaction(Answer.YES)
                .build();

        int score = NaranjoScorer.score(NaranjoScorer.answers(features));

        // -1 (onset before drug) - 1 (rechallenge) - 1 (alternatives) - 1 (placebo)
        assertThat(score).isEqualTo(-4);
        assertThat(NaranjoCategory.fromScore(score)).isEqualTo(NaranjoCategory.DOUBTFUL);
    }

    @Test
    @DisplayName("Should map score bands to categories")
    void shouldMapScoreBands() {
        assertThat(NaranjoCategory.fromScore(9)).isEqualTo(NaranjoCategory.DEFINITE);
        assertThat(NaranjoCategory.fromScore(5)).isEqualTo(NaranjoCategory.PROBABLE);
        assertThat(NaranjoCategory.fromScore(1)).isEqualTo(NaranjoCategory.POSSIBLE);
        assertThat(NaranjoCategory.fromScore(0)).isEqualTo(NaranjoCategory.DOUBTFUL);
    }
}
