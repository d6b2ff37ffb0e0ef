package com.energysentinel.job;

import com.energysentinel.core.error.ArtifactStorageException;
import com.energysentinel.core.error.ErrorKind;
import com.energysentinel.core.model.AnomalyPassResult;
import com.energysentinel.core.model.AnomalyRecord;
import com.energysentinel.core.model.AnomalyType;
import com.energysentinel.core.model.ComparisonResult;
import com.energysentinel.core.model.CycleReport;
import com.energysentinel.core.model.CycleStage;
import com.energysentinel.core.model.CycleStatus;
import com.energysentinel.core.model.DetectorKind;
import com.energysentinel.core.model.EvaluationMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonReportNotifier}.
 */
class JsonReportNotifierTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 2, 30, 15);

    @TempDir
    Path dir;

    private final ObjectMapper reader = new ObjectMapper();

    @Test
    @DisplayName("Should write a successful cycle report in snake_case")
    void shouldWriteCycleReport() throws IOException {
        Path reports = dir.resolve("reports");
        CycleReport report = CycleReport.builder("nightly")
                .status(CycleStatus.SUCCESS)
                .startedAt(NOW.minusMinutes(5))
                .finishedAt(NOW)
                .metrics(new EvaluationMetrics(0.21, 0.30, 12.5, 0.8, 168))
                .comparison(ComparisonResult.firstTraining())
                .versionId("v20240301022500")
                .build();

        notifier(reports).onCycleCompleted(report);

        Path file = reports.resolve("cycle_nightly_20240301_023015.json");
        assertThat(file).exists();
        JsonNode json = reader.readTree(file.toFile());
        assertThat(json.get("job_id").asText()).isEqualTo("nightly");
        assertThat(json.get("status").asText()).isEqualTo("SUCCESS");
        assertThat(json.get("version_id").asText()).isEqualTo("v20240301022500");
        assertThat(json.get("comparison").get("decision").asText()).isEqualTo("FIRST_TRAINING");
        assertThat(json.get("metrics").get("sample_count").asInt()).isEqualTo(168);
        assertThat(json.get("finished_at").asText()).isEqualTo("2024-03-01T02:30:15");
        assertThat(json.get("forecast").isNull()).isTrue();
    }

    @Test
    @DisplayName("Should keep report files inside the reports directory for an unsafe job id")
    void shouldSanitiseJobIdInFileName() throws IOException {
        notifier(dir).onAnomalyPass(AnomalyPassResult.insufficientData("../up/x", "too few"));

        Path file = dir.resolve("anomalies____up_x_20240301_023015.json");
        assertThat(file).exists();
        assertThat(reader.readTree(file.toFile()).get("job_id").asText()).isEqualTo("../up/x");
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    @DisplayName("Should write a failed cycle report with its stage")
    void shouldWriteFailedCycle() throws IOException {
        CycleReport report = CycleReport.builder("nightly")
                .status(CycleStatus.FAILURE)
                .startedAt(NOW)
                .finishedAt(NOW)
                .failedStage(CycleStage.FETCH)
                .errorKind(ErrorKind.DATABASE_CONNECTION)
                .detail("connection refused")
                .build();

        notifier(dir).onCycleCompleted(report);

        JsonNode json = reader.readTree(dir.resolve("cycle_nightly_20240301_023015.json").toFile());
        assertThat(json.get("failed_stage").asText()).isEqualTo("FETCH");
        assertThat(json.get("error_kind").asText()).isEqualTo("DATABASE_CONNECTION");
        assertThat(json.get("detail").asText()).isEqualTo("connection refused");
    }

    @Test
    @DisplayName("Should write the anomaly records of a pass")
    void shouldWriteAnomalyPass() throws IOException {
        AnomalyRecord record = AnomalyRecord.builder()
                .timestamp(NOW.minusHours(1))
                .value(6.2)
                .methodVotes(EnumSet.of(DetectorKind.RANGE, DetectorKind.STATISTICAL, DetectorKind.MOVING_AVERAGE))
                .type(AnomalyType.HIGH_CONSUMPTION)
                .build();
        AnomalyPassResult result = AnomalyPassResult.ok("detect", List.of(record),
                List.of(DetectorKind.RANGE, DetectorKind.STATISTICAL, DetectorKind.MOVING_AVERAGE),
                NOW.minusHours(24), NOW);

        notifier(dir).onAnomalyPass(result);

        JsonNode json = reader.readTree(dir.resolve("anomalies_detect_20240301_023015.json").toFile());
        assertThat(json.get("status").asText()).isEqualTo("SUCCESS");
        assertThat(json.get("records").size()).isEqualTo(1);
        JsonNode written = json.get("records").get(0);
        assertThat(written.get("value").asDouble()).isEqualTo(6.2);
        assertThat(written.get("type").asText()).isEqualTo("HIGH_CONSUMPTION");
        assertThat(written.get("method_votes").size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should raise a storage error when the reports directory cannot be created")
    void shouldFailOnUnwritableDirectory() throws IOException {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        JsonReportNotifier notifier = notifier(blocker.resolve("reports"));

        assertThatThrownBy(() -> notifier.onAnomalyPass(AnomalyPassResult.insufficientData("detect", "too few")))
                .isInstanceOf(ArtifactStorageException.class)
                .hasMessageContaining("anomalies_detect_20240301_023015.json");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static JsonReportNotifier notifier(Path reportsDir) {
        return new JsonReportNotifier(reportsDir, Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
    }
}
