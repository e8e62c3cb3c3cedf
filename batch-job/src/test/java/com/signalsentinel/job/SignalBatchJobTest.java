package com.signalsentinel.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalsentinel.core.config.SignalDetectionConfig;
import com.signalsentinel.core.exception.InvalidConfigurationException;
import com.signalsentinel.core.model.FusionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SignalBatchJob}.
 */
class SignalBatchJobTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-30T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path input;
    private Path output;

    @BeforeEach
    void setUp() throws IOException {
        input = copyResource("pairs.json");
        output = tempDir.resolve("out/results.json");
    }

    @Test
    @DisplayName("Should score every input pair and write ranked results")
    void shouldScoreAndWriteBatch() throws IOException {
        List<FusionResult> results = job(new JobConfig.Builder()
                .inputPath(input.toString())
                .outputPath(output.toString())
                .build()).run();

        assertThat(results).hasSize(4);
        assertThat(results).allMatch(FusionResult::isScored);
        assertThat(results.get(0).getDrug()).isEqualTo("drugA");
        assertThat(results.get(0).getRank()).hasValue(1);

        JsonNode root = new ObjectMapper().readTree(Files.readAllBytes(output));
        assertThat(root).hasSize(4);
        assertThat(root.get(0).get("drug").asText()).isEqualTo("drugA");
        for (int i = 0; i < root.size(); i++) {
            assertThat(root.get(i).get("scoredOn").asText()).isEqualTo("2025-06-30");
            assertThat(root.get(i).get("rank").asInt()).isEqualTo(i + 1);
        }
    }

    @Test
    @DisplayName("Should write classical rank and latency distribution")
    void shouldWriteClassicalRankAndLatency() throws IOException {
        job(new JobConfig.Builder()
                .inputPath(input.toString())
                .outputPath(output.toString())
                .build()).run();

        JsonNode drugA = new ObjectMapper().readTree(Files.readAllBytes(output)).get(0);
        assertThat(drugA.get("drug").asText()).isEqualTo("drugA");
        assertThat(drugA.get("classicalRank").asInt()).isEqualTo(1);
        assertThat(drugA.get("medianLatencyDays").asDouble()).isEqualTo(13.0);
        JsonNode latency = drugA.get("latencyDistribution");
        assertThat(latency.get("IMMEDIATE").asInt()).isEqualTo(1);
        assertThat(latency.get("EARLY").asInt()).isEqualTo(1);
        assertThat(latency.get("DELAYED").asInt()).isEqualTo(2);
        assertThat(latency.get("LATE").asInt()).isEqualTo(1);
        assertThat(latency.get("VERY_LATE").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should carry per-pair notes into the output")
    void shouldWriteNotes() throws IOException {
        job(new JobConfig.Builder()
                .inputPath(input.toString())
                .outputPath(output.toString())
                .build()).run();

        JsonNode root = new ObjectMapper().readTree(Files.readAllBytes(output));
        JsonNode drugD = null;
        for (JsonNode node : root) {
            if ("drugD".equals(node.get("drug").asText())) {
                drugD = node;
            }
        }
        assertThat(drugD).isNotNull();
        assertThat(drugD.get("notes").toString()).contains("Trend omitted");
    }

    @Test
    @DisplayName("Should abort on malformed input without writing output")
    void shouldFailOnMalformedInput() throws IOException {
        Path broken = tempDir.resolve("broken.json");
        Files.write(broken, "[ { \"drug\": ".getBytes(StandardCharsets.UTF_8));

        SignalBatchJob job = job(new JobConfig.Builder()
                .inputPath(broken.toString())
                .outputPath(output.toString())
                .build());

        assertThatThrownBy(job::run).isInstanceOf(IOException.class);
        assertThat(output).doesNotExist();
    }

    @Test
    @DisplayName("Should reject an invalid detection config before reading input")
    void shouldRejectInvalidDetectionConfig() throws IOException {
        Path invalid = copyResource("invalid-fusion.yml");

        SignalBatchJob job = job(new JobConfig.Builder()
                .inputPath(input.toString())
                .outputPath(output.toString())
                .signalConfigPath(invalid.toString())
                .build());

        assertThatThrownBy(job::run).isInstanceOf(InvalidConfigurationException.class);
        assertThat(output).doesNotExist();
    }

    @Test
    @DisplayName("Should override engine parallelism only when set")
    void shouldOverrideParallelism() {
        SignalDetectionConfig overridden = SignalBatchJob.loadDetectionConfig(new JobConfig.Builder()
                .inputPath("in.json").parallelism(3).build());
        SignalDetectionConfig kept = SignalBatchJob.loadDetectionConfig(new JobConfig.Builder()
                .inputPath("in.json").build());

        assertThat(overridden.getEngine().getParallelism()).isEqualTo(3);
        assertThat(kept.getEngine().getParallelism()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static SignalBatchJob job(JobConfig config) {
        return new SignalBatchJob(config, CLOCK);
    }

    private Path copyResource(String name) throws IOException {
        Path target = tempDir.resolve(name);
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(name)) {
            assertThat(in).isNotNull();
            Files.copy(in, target);
        }
        return target;
    }
}
