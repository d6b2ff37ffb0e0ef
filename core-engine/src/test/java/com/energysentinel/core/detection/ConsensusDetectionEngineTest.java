package com.energysentinel.core.detection;

import com.energysentinel.core.config.DetectionSettings;
import com.energysentinel.core.config.DetectorSettings;
import com.energysentinel.core.error.EngineException;
import com.energysentinel.core.error.ErrorKind;
import com.energysentinel.core.error.ModelTrainingException;
import com.energysentinel.core.forecast.HourlyForecastSource;
import com.energysentinel.core.model.AnomalyRecord;
import com.energysentinel.core.model.AnomalyType;
import com.energysentinel.core.model.DetectorKind;
import com.energysentinel.core.model.EnergyReading;
import com.energysentinel.core.model.TestWindows;
import com.energysentinel.core.model.TimeSeriesWindow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ConsensusDetectionEngine}.
 */
class ConsensusDetectionEngineTest {

    private static final int SPIKE_HOUR = 40;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should drop a spike seen by two of three detectors when three must agree")
    void shouldRequireThreeVotes() {
        TimeSeriesWindow window = hourlyWithSpike();

        ConsensusResult result = engine(3, "iqr", "zscore", "forecast_residual")
                .detect(window, Optional.of(forecastEqualTo(window)));

        assertThat(result.getRecords()).isEmpty();
        assertThat(result.getActiveDetectors()).containsExactly(
                DetectorKind.RANGE, DetectorKind.STATISTICAL, DetectorKind.FORECAST_RESIDUAL);
    }

    @Test
    @DisplayName("Should report a spike seen by two of three detectors when two must agree")
    void shouldAcceptTwoVotes() {
        TimeSeriesWindow window = hourlyWithSpike();

        ConsensusResult result = engine(2, "iqr", "zscore", "forecast_residual")
                .detect(window, Optional.of(forecastEqualTo(window)));

        assertThat(result.getRecords()).hasSize(1);
        AnomalyRecord record = result.getRecords().get(0);
        assertThat(record.getTimestamp()).isEqualTo(TestWindows.START.plusHours(SPIKE_HOUR));
        assertThat(record.getValue()).isEqualTo(10.0);
        assertThat(record.getMethodVotes()).containsExactlyInAnyOrder(DetectorKind.RANGE, DetectorKind.STATISTICAL);
        assertThat(record.getType()).isEqualTo(AnomalyType.HIGH_CONSUMPTION);
    }

    @Test
    @DisplayName("Should find a minute-level spike with the default detectors and no forecast")
    void shouldDetectWithDefaultDetectors() {
        LocalDateTime start = TestWindows.START.withHour(10);
        TimeSeriesWindow window = TestWindows.minutely(start, 180,
                i -> i == 120 ? 6.0 : 1.5 + 0.05 * Math.sin(i / 7.0));
        DetectionSettings settings = new DetectionSettings();

        ConsensusResult result = new ConsensusDetectionEngine(settings, executor).detect(window, Optional.empty());

        assertThat(result.getActiveDetectors()).doesNotContain(DetectorKind.FORECAST_RESIDUAL).hasSize(4);
        assertThat(result.getRecords()).hasSize(1);
        AnomalyRecord record = result.getRecords().get(0);
        assertThat(record.getTimestamp()).isEqualTo(start.plusMinutes(120));
        assertThat(record.getMethodVotes()).contains(
                DetectorKind.RANGE, DetectorKind.STATISTICAL, DetectorKind.MOVING_AVERAGE);
        assertThat(record.getType()).isEqualTo(AnomalyType.HIGH_CONSUMPTION);
    }

    @Test
    @DisplayName("Should classify a flagged first reading without a previous difference")
    void shouldClassifyFirstReading() {
        TimeSeriesWindow window = TestWindows.hourly(TestWindows.START.withHour(12), 30,
                i -> i == 0 ? 9.0 : 1.0 + 0.01 * i);

        ConsensusResult result = engine(2, "iqr", "zscore").detect(window, Optional.empty());

        assertThat(result.getRecords()).extracting(AnomalyRecord::getTimestamp)
                .containsExactly(TestWindows.START.withHour(12));
    }

    @Test
    @DisplayName("Should propagate engine failures from a detector")
    void shouldPropagateEngineFailure() {
        AnomalyDetector failing = mock(AnomalyDetector.class);
        when(failing.getKind()).thenReturn(DetectorKind.ISOLATION);
        when(failing.detect(any())).thenThrow(new ModelTrainingException("ISOLATION", "forest failed"));

        ConsensusDetectionEngine engine = engine(1, "iqr");

        assertThatThrownBy(() -> engine.detect(hourlyWithSpike(), List.of(failing)))
                .isInstanceOf(ModelTrainingException.class);
    }

    @Test
    @DisplayName("Should wrap unexpected detector failures as internal errors")
    void shouldWrapUnexpectedFailure() {
        AnomalyDetector failing = mock(AnomalyDetector.class);
        when(failing.getKind()).thenReturn(DetectorKind.RANGE);
        when(failing.detect(any())).thenThrow(new IllegalStateException("boom"));

        ConsensusDetectionEngine engine = engine(1, "iqr");

        assertThatThrownBy(() -> engine.detect(hourlyWithSpike(), List.of(failing)))
                .isInstanceOf(EngineException.class)
                .hasMessageContaining("boom")
                .extracting(e -> ((EngineException) e).getKind())
                .isEqualTo(ErrorKind.INTERNAL);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private ConsensusDetectionEngine engine(int threshold, String... types) {
        DetectionSettings settings = new DetectionSettings();
        settings.setConsensusThreshold(threshold);
        settings.setDetectors(Arrays.stream(types).map(DetectorSettings::ofType).toList());
        return new ConsensusDetectionEngine(settings, executor);
    }

    private static TimeSeriesWindow hourlyWithSpike() {
        return TestWindows.hourly(TestWindows.START, 72,
                i -> i == SPIKE_HOUR ? 10.0 : TestWindows.dailyProfile(i));
    }

    /** A forecast that already knows every value, spike included. */
    private static HourlyForecastSource forecastEqualTo(TimeSeriesWindow window) {
        Map<LocalDateTime, Double> byHour = new HashMap<>();
        for (EnergyReading reading : window) {
            byHour.put(reading.getTimestamp(), reading.getActivePower());
        }
        return hours -> hours.stream().mapToDouble(h -> byHour.getOrDefault(h, Double.NaN)).toArray();
    }
}
