package com.signalsentinel.core.quantum;

import com.signalsentinel.core.config.Layer2Settings;
import com.signalsentinel.core.model.CaseProfile;
import com.signalsentinel.core.model.ContingencyTable;
import com.signalsentinel.core.model.DrugEventPair;
import com.signalsentinel.core.model.MultiSourceComponents;
import com.signalsentinel.core.model.NoveltyResult;
import com.signalsentinel.core.model.SourceEvidence;
import com.signalsentinel.core.model.TemporalResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link MultiSourceScorer}.
 */
class MultiSourceScorerTest {

    private static final LocalDate AS_OF = LocalDate.of(2025, 6, 30);

    private MultiSourceScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new MultiSourceScorer(new Layer2Settings());
    }

    @Test
    @DisplayName("Should combine the six components with the configured weights")
    void shouldCombineComponents() {
        CaseProfile profile = CaseProfile.builder()
                .severity(0.5)
                .latestReportDate(AS_OF)
                .build();

        MultiSourceComponents c = scorer.score(pair(20, profile), null, AS_OF);

        assertThat(c.getFrequency()).isEqualTo(0.6);
        assertThat(c.getSeverity()).isEqualTo(0.5);
        assertThat(c.getBurst()).isZero();
        assertThat(c.getNovelty()).isEqualTo(1.0);
        assertThat(c.getConsensus()).isZero();
        assertThat(c.getMechanism()).isEqualTo(0.5);
        assertThat(c.getScore()).isCloseTo(0.45, within(1e-9));
    }

    @Test
    @DisplayName("Should step the frequency score down the breakpoints")
    void shouldStepFrequency() {
        assertThat(scorer.frequency(250)).isEqualTo(1.0);
        assertThat(scorer.frequency(50)).isEqualTo(0.8);
        assertThat(scorer.frequency(4)).isEqualTo(0.2);
        assertThat(scorer.frequency(1)).isEqualTo(0.1);
        assertThat(scorer.frequency(0)).isZero();
    }

    @Test
    @DisplayName("Should derive severity from the serious fraction when not given")
    void shouldDeriveSeverity() {
        CaseProfile profile = CaseProfile.builder().seriousCount(3).build();

        assertThat(MultiSourceScorer.severity(profile, 12)).isEqualTo(0.25);
        assertThat(MultiSourceScorer.severity(profile, 0)).isZero();
        assertThat(MultiSourceScorer.severity(CaseProfile.builder().severity(0.9).build(), 12)).isEqualTo(0.9);
    }

    @Test
    @DisplayName("Should saturate burst at the configured fold")
    void shouldSaturateBurst() {
        assertThat(scorer.burst(0)).isZero();
        assertThat(scorer.burst(0.5)).isZero();
        assertThat(scorer.burst(2.5)).isCloseTo(0.5, within(1e-12));
        assertThat(scorer.burst(4.0)).isEqualTo(1.0);
        assertThat(scorer.burst(40.0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should take novelty from temporal analysis and damp it for labeled effects")
    void shouldUseTemporalNovelty() {
        TemporalResult temporal = TemporalResult.builder()
                .novelty(new NoveltyResult(10, 0.9, 0.5, 1.0, 0.8, true))
                .build();
        DrugEventPair unlabeled = pair(5, CaseProfile.empty());
        DrugEventPair labeled = pair(5, CaseProfile.builder().labeled(true).build());

        assertThat(scorer.novelty(temporal, CaseProfile.empty(), unlabeled, AS_OF)).isEqualTo(0.8);
        assertThat(scorer.novelty(temporal, labeled.getCaseProfile().orElseThrow(), labeled, AS_OF))
                .isCloseTo(0.16, within(1e-12));
    }

    @Test
    @DisplayName("Should fall back to the report-date ladder without temporal analysis")
    void shouldUseNoveltyLadder() {
        assertThat(ladderNovelty(false, 10)).isEqualTo(1.0);
        assertThat(ladderNovelty(false, 60)).isEqualTo(0.8);
        assertThat(ladderNovelty(false, 100)).isEqualTo(0.6);
        assertThat(ladderNovelty(false, 200)).isEqualTo(0.4);
        assertThat(ladderNovelty(false, 400)).isEqualTo(0.2);
        assertThat(ladderNovelty(true, 10)).isEqualTo(0.6);
        assertThat(ladderNovelty(true, 60)).isEqualTo(0.4);
        assertThat(ladderNovelty(true, 400)).isEqualTo(0.2);
    }

    @Test
    @DisplayName("Should use fixed novelty when the report date is unknown")
    void shouldUseUnknownNovelty() {
        CaseProfile labeled = CaseProfile.builder().labeled(true).build();

        assertThat(scorer.novelty(null, CaseProfile.empty(), pair(5, CaseProfile.empty()), AS_OF)).isEqualTo(0.5);
        assertThat(scorer.novelty(null, labeled, pair(5, labeled), AS_OF)).isEqualTo(0.2);
    }

    @Test
    @DisplayName("Should weight source evidence by priority and boost broad agreement")
    void shouldWeightSourceEvidence() {
        CaseProfile profile = CaseProfile.builder()
                .sourceEvidence(List.of(
                        new SourceEvidence("FAERS", 0.9, 0.9),
                        new SourceEvidence("rwe", 0.8, 0.8),
                        new SourceEvidence("PubMed", 0.9, 0.8)))
                .build();

        double expected = (0.40 / 0.75) * 0.81 + (0.25 / 0.75) * 0.64 + (0.10 / 0.75) * 0.72 + 0.2;

        assertThat(scorer.consensus(profile)).isCloseTo(expected, within(1e-9));
    }

    @Test
    @DisplayName("Should floor confidence for weak evidence")
    void shouldFloorConfidence() {
        CaseProfile profile = CaseProfile.builder()
                .sourceEvidence(List.of(new SourceEvidence("faers", 0.0, 1.0)))
                .build();

        assertThat(scorer.consensus(profile)).isCloseTo(0.1, within(1e-12));
    }

    @Test
    @DisplayName("Should fall back to the corroboration fraction for unknown sources")
    void shouldFallBackToCorroborationFraction() {
        CaseProfile unknownSources = CaseProfile.builder()
                .sourceEvidence(List.of(new SourceEvidence("forum", 0.9, 0.9)))
                .sources(2, 4)
                .build();

        assertThat(scorer.consensus(unknownSources)).isEqualTo(0.5);
        assertThat(scorer.consensus(CaseProfile.empty())).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private double ladderNovelty(boolean labeled, int daysAgo) {
        CaseProfile profile = CaseProfile.builder()
                .labeled(labeled)
                .latestReportDate(AS_OF.minusDays(daysAgo))
                .build();
        return scorer.novelty(null, profile, pair(5, profile), AS_OF);
    }

    private static DrugEventPair pair(long a, CaseProfile profile) {
        return DrugEventPair.builder()
                .drug("drugA")
                .event("eventB")
                .table(new ContingencyTable(a, 1_000 - a, 500, 98_500))
                .caseProfile(profile)
                .build();
    }
}
