package com.energysentinel.core.config;

import com.energysentinel.core.model.DetectorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EngineConfigLoader}.
 */
class EngineConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load test configuration from classpath and keep defaults for omitted keys")
    void shouldLoadFromClasspath() {
        EngineConfig config = EngineConfigLoader.fromClasspath("test-engine.yml");

        assertThat(config.getQuality().getMinCoverageDays()).isEqualTo(2);
        assertThat(config.getQuality().getMaxNullPercentage()).isEqualTo(5.0);
        assertThat(config.getForecast().getEvaluationDays()).isEqualTo(1);
        assertThat(config.getForecast().getConfidenceLevel()).isEqualTo(0.99);
        assertThat(config.getForecast().getEnhancedSeasonal().getChangepoints()).isEqualTo(50);
        assertThat(config.getDetection().getConsensusThreshold()).isEqualTo(2);
        assertThat(config.getDetection().getDetectors())
                .extracting(DetectorSettings::kind)
                .containsExactly(DetectorKind.RANGE, DetectorKind.STATISTICAL, DetectorKind.MOVING_AVERAGE);
        assertThat(config.getDetection().getDetectors().get(1).getThreshold()).isEqualTo(2.5);
        assertThat(config.getRegistry().getRetainVersions()).isEqualTo(3);
        assertThat(config.getPipeline().getRetryDelaysSeconds()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Should load the bundled default configuration")
    void shouldLoadBundledDefaults() {
        EngineConfig config = EngineConfigLoader.fromClasspath(EngineConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getDetection().getDetectors()).hasSize(DetectorKind.values().length);
        assertThat(config.getDetection().getConsensusThreshold()).isEqualTo(3);
        assertThat(config.getPipeline().getTrainingWindowDays()).isEqualTo(90);
        assertThat(config.getPipeline().getRetryDelaysSeconds()).containsExactly(60, 300, 900);
        assertThat(config.getForecast().getEnhancedSeasonal().isMultiplicative()).isTrue();
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when config file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> EngineConfigLoader.fromFile(tempDir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject unknown detector types")
    void shouldRejectUnknownDetectorType() throws IOException {
        Path file = write("""
                detection:
                  detectors:
                    - type: iqr
                    - type: lstm
                """);

        assertThatThrownBy(() -> EngineConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Unknown detector type")
                .hasMessageContaining("lstm");
    }

    @Test
    @DisplayName("Should reject unrecognised configuration keys")
    void shouldRejectUnknownKeys() throws IOException {
        Path file = write("""
                pipeline:
                  trainingWindowDays: 30
                  unknownOption: true
                """);

        assertThatThrownBy(() -> EngineConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Unrecognised or malformed");
    }

    @Test
    @DisplayName("Should collect every validation error at once")
    void shouldCollectAllErrors() throws IOException {
        Path file = write("""
                forecast:
                  confidenceLevel: 0.9
                registry:
                  retainVersions: 0
                """);

        assertThatThrownBy(() -> EngineConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Invalid engine configuration")
                .hasMessageContaining("confidenceLevel")
                .hasMessageContaining("retainVersions");
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() throws IOException {
        Path file = write("");

        EngineConfig config = EngineConfigLoader.fromFile(file.toString());

        assertThat(config.getQuality().getMinCoverageDays()).isEqualTo(30);
        assertThat(config.getRegistry().getRetainVersions()).isEqualTo(10);
    }

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("engine.yml");
        Files.writeString(file, yaml);
        return file;
    }
}
