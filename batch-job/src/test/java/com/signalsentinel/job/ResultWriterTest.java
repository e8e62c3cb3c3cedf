package com.signalsentinel.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalsentinel.core.model.AlertTier;
import com.signalsentinel.core.model.ContingencyTable;
import com.signalsentinel.core.model.DrugEventPair;
import com.signalsentinel.core.model.FusionResult;
import com.signalsentinel.core.model.ScoringError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ResultWriter}.
 */
class ResultWriterTest {

    private static final LocalDate SCORED_ON = LocalDate.of(2025, 6, 30);

    private final ResultWriter writer = new ResultWriter();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should write scored results with an ISO scoring date")
    void shouldWriteScoredResult() throws IOException {
        FusionResult scored = FusionResult.builder()
                .drug("drugA").event("hepatitis").observed(45)
                .evidenceScore(0.7).layer1Squashed(0.6)
                .fusionScore(0.83).alertTier(AlertTier.HIGH)
                .notes(List.of("Causality not assessed: no clinical features"))
                .build()
                .withRanking(1, 100.0, 2);

        JsonNode node = writeAndParse(List.of(scored)).get(0);

        assertThat(node.get("drug").asText()).isEqualTo("drugA");
        assertThat(node.get("observed").asLong()).isEqualTo(45);
        assertThat(node.get("scoredOn").asText()).isEqualTo("2025-06-30");
        assertThat(node.get("rank").asInt()).isEqualTo(1);
        assertThat(node.get("percentile").asDouble()).isEqualTo(100.0);
        assertThat(node.get("classicalRank").asInt()).isEqualTo(2);
        assertThat(node.get("fusionScore").asDouble()).isEqualTo(0.83);
        assertThat(node.get("alertTier").asText()).isEqualTo("HIGH");
        assertThat(node.get("notes")).hasSize(1);
    }

    @Test
    @DisplayName("Should omit absent components instead of writing nulls")
    void shouldOmitAbsentFields() throws IOException {
        FusionResult scored = FusionResult.builder()
                .drug("drugB").event("headache").observed(3)
                .fusionScore(0.1).alertTier(AlertTier.NONE)
                .build();

        JsonNode node = writeAndParse(List.of(scored)).get(0);

        assertThat(node.has("prr")).isFalse();
        assertThat(node.has("ebgm")).isFalse();
        assertThat(node.has("whoUmcCategory")).isFalse();
        assertThat(node.has("rank")).isFalse();
        assertThat(node.has("classicalRank")).isFalse();
        assertThat(node.has("notes")).isFalse();
        assertThat(node.has("errorKind")).isFalse();
    }

    @Test
    @DisplayName("Should write the error of a failed pair")
    void shouldWriteFailedResult() throws IOException {
        DrugEventPair pair = DrugEventPair.of("drugX", "rash", new ContingencyTable(1, 2, 3, 4));
        FusionResult failed = FusionResult.failed(pair,
                new ScoringError(ScoringError.Kind.NUMERIC_OVERFLOW, "fusion score is NaN"));

        JsonNode node = writeAndParse(List.of(failed)).get(0);

        assertThat(node.get("errorKind").asText()).isEqualTo("NUMERIC_OVERFLOW");
        assertThat(node.get("errorMessage").asText()).isEqualTo("fusion score is NaN");
        assertThat(node.get("observed").asLong()).isEqualTo(1);
        assertThat(node.has("fusionScore")).isFalse();
        assertThat(node.has("alertTier")).isFalse();
    }

    @Test
    @DisplayName("Should create missing parent directories")
    void shouldCreateParentDirectories(@TempDir Path tempDir) throws IOException {
        Path output = tempDir.resolve("nested/out/results.json");

        writer.write(List.of(), SCORED_ON, output);

        assertThat(output).exists();
        assertThat(mapper.readTree(Files.readAllBytes(output)).isArray()).isTrue();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private JsonNode writeAndParse(List<FusionResult> results) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writer.write(results, SCORED_ON, out);
        JsonNode root = mapper.readTree(out.toByteArray());
        assertThat(root.isArray()).isTrue();
        assertThat(root).hasSize(results.size());
        return root;
    }
}
