package com.energysentinel.core.detection;

import com.energysentinel.core.model.AnomalyType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnomalyClassifier}.
 */
class AnomalyClassifierTest {

    private static final LocalDateTime NIGHT = LocalDateTime.of(2024, 3, 5, 3, 0);
    private static final LocalDateTime NOON = LocalDateTime.of(2024, 3, 5, 12, 0);

    // mean 50.5, p95 95.05, p05 5.95
    private AnomalyClassifier classifier;

    @BeforeEach
    void setUp() {
        double[] values = new double[100];
        for (int i = 0; i < values.length; i++) {
            values[i] = i + 1;
        }
        classifier = new AnomalyClassifier(values);
    }

    @Test
    @DisplayName("Should classify high night-time usage as temporal before anything else")
    void shouldClassifyTemporal() {
        assertThat(classifier.classify(NIGHT, 80, 1)).isEqualTo(AnomalyType.TEMPORAL);
        assertThat(classifier.classify(NIGHT, 99, 0)).isEqualTo(AnomalyType.TEMPORAL);
    }

    @Test
    @DisplayName("Should not treat moderate night-time usage as temporal")
    void shouldNotClassifyModerateNightAsTemporal() {
        assertThat(classifier.classify(NIGHT, 70, 1)).isEqualTo(AnomalyType.HIGH_CONSUMPTION);
        assertThat(classifier.classify(NIGHT.withHour(6), 80, 1)).isEqualTo(AnomalyType.HIGH_CONSUMPTION);
    }

    @Test
    @DisplayName("Should classify by the 95th and 5th percentiles")
    void shouldClassifyByPercentiles() {
        assertThat(classifier.classify(NOON, 96, 0)).isEqualTo(AnomalyType.HIGH_CONSUMPTION);
        assertThat(classifier.classify(NOON, 5, 0)).isEqualTo(AnomalyType.LOW_CONSUMPTION);
    }

    @Test
    @DisplayName("Should classify a flat reading inside the percentiles as a sensor failure")
    void shouldClassifySensorFailure() {
        assertThat(classifier.classify(NOON, 40, 0.0)).isEqualTo(AnomalyType.SENSOR_FAILURE);
        assertThat(classifier.classify(NOON, 40, 0.0009)).isEqualTo(AnomalyType.SENSOR_FAILURE);
    }

    @Test
    @DisplayName("Should fall back to the side of the mean")
    void shouldFallBackBySideOfMean() {
        assertThat(classifier.classify(NOON, 60, 5)).isEqualTo(AnomalyType.HIGH_CONSUMPTION);
        assertThat(classifier.classify(NOON, 40, 5)).isEqualTo(AnomalyType.LOW_CONSUMPTION);
        assertThat(classifier.classify(NOON, 40, Double.NaN)).isEqualTo(AnomalyType.LOW_CONSUMPTION);
    }
}
