package com.signalsentinel.core.fusion;

import com.signalsentinel.core.model.AlertTier;
import com.signalsentinel.core.model.ContingencyTable;
import com.signalsentinel.core.model.DrugEventPair;
import com.signalsentinel.core.model.FusionResult;
import com.signalsentinel.core.model.ScoringError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link BatchRanker}.
 */
class BatchRankerTest {

    @Test
    @DisplayName("Should rank by fusion score and assign percentiles")
    void shouldRankByFusionScore() {
        List<FusionResult> ranked = BatchRanker.rank(List.of(
                scored("drugB", "rash", 0.77, 10),
                scored("drugC", "nausea", 0.40, 10),
                scored("drugA", "hepatitis", 0.91, 10)));

        assertThat(ranked).extracting(FusionResult::getDrug).containsExactly("drugA", "drugB", "drugC");
        assertThat(ranked.get(0).getRank()).hasValue(1);
        assertThat(ranked.get(0).getPercentile().getAsDouble()).isCloseTo(66.67, within(0.01));
        assertThat(ranked.get(1).getPercentile().getAsDouble()).isCloseTo(33.33, within(0.01));
        assertThat(ranked.get(2).getRank()).hasValue(3);
        assertThat(ranked.get(2).getPercentile().getAsDouble()).isZero();
    }

    @Test
    @DisplayName("Should break ties by observed count, then drug, then event")
    void shouldBreakTies() {
        List<FusionResult> ranked = BatchRanker.rank(List.of(
                scored("drugB", "rash", 0.6, 5),
                scored("drugA", "rash", 0.6, 5),
                scored("drugA", "fever", 0.6, 5),
                scored("drugZ", "rash", 0.6, 50)));

        assertThat(ranked).extracting(r -> r.getDrug() + "/" + r.getEvent())
                .containsExactly("drugZ/rash", "drugA/fever", "drugA/rash", "drugB/rash");
    }

    @Test
    @DisplayName("Should assign a classical rank by observed count alone")
    void shouldAssignClassicalRank() {
        List<FusionResult> ranked = BatchRanker.rank(List.of(
                scored("drugA", "hepatitis", 0.91, 4),
                scored("drugB", "rash", 0.77, 120),
                scored("drugC", "nausea", 0.40, 35),
                scored("drugD", "fever", 0.30, 35)));

        assertThat(ranked).extracting(FusionResult::getDrug)
                .containsExactly("drugA", "drugB", "drugC", "drugD");
        assertThat(ranked).extracting(r -> r.getClassicalRank().getAsInt())
                .containsExactly(4, 1, 2, 3);
    }

    @Test
    @DisplayName("Should leave error-marked results without a classical rank")
    void shouldNotClassicallyRankFailures() {
        List<FusionResult> ranked = BatchRanker.rank(List.of(
                failed("drugX", "coma"),
                scored("drugA", "hepatitis", 0.5, 3)));

        assertThat(ranked.get(0).getClassicalRank()).hasValue(1);
        assertThat(ranked.get(1).getClassicalRank()).isEmpty();
    }

    @Test
    @DisplayName("Should append error-marked results unranked in input order")
    void shouldAppendFailedResults() {
        FusionResult firstFailure = failed("drugX", "coma");
        FusionResult secondFailure = failed("drugW", "rash");

        List<FusionResult> ranked = BatchRanker.rank(List.of(
                firstFailure,
                scored("drugA", "hepatitis", 0.5, 3),
                secondFailure));

        assertThat(ranked).hasSize(3);
        assertThat(ranked.get(0).getRank()).hasValue(1);
        assertThat(ranked.get(0).getPercentile().getAsDouble()).isZero();
        assertThat(ranked.subList(1, 3)).containsExactly(firstFailure, secondFailure);
        assertThat(ranked.get(1).getRank()).isEmpty();
        assertThat(ranked.get(2).getPercentile()).isEmpty();
    }

    @Test
    @DisplayName("Should return an empty ranking for an empty batch")
    void shouldHandleEmptyBatch() {
        assertThat(BatchRanker.rank(List.of())).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static FusionResult scored(String drug, String event, double fusion, long observed) {
        return FusionResult.builder()
                .drug(drug)
                .event(event)
                .observed(observed)
                .fusionScore(fusion)
                .alertTier(AlertTier.WATCHLIST)
                .build();
    }

    private static FusionResult failed(String drug, String event) {
        DrugEventPair pair = DrugEventPair.of(drug, event, new ContingencyTable(1, 1, 1, 1));
        return FusionResult.failed(pair, new ScoringError(ScoringError.Kind.INVALID_INPUT, "bad input"));
    }
}
