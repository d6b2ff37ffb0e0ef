package com.energysentinel.core.detection;

import com.energysentinel.core.config.DetectorSettings;
import com.energysentinel.core.model.EnergyReading;
import com.energysentinel.core.model.TestWindows;
import com.energysentinel.core.model.TimeSeriesWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RangeDetector}.
 */
class RangeDetectorTest {

    private static final double[] VALUES = {10, 11, 12, 10, 11, 12, 10, 11, 12, 50};

    @Test
    @DisplayName("Should flag values outside the interquartile fences")
    void shouldFlagOutsideFences() {
        TimeSeriesWindow window = TestWindows.hourly(TestWindows.START, VALUES.length, i -> VALUES[i]);

        DetectorResult result = new RangeDetector(DetectorSettings.ofType("iqr")).detect(window);

        assertThat(result.getFlagged()).containsExactly(TestWindows.START.plusHours(9));
        assertThat(result.getEvaluatedCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should honour a wider multiplier")
    void shouldHonourMultiplier() {
        TimeSeriesWindow window = TestWindows.hourly(TestWindows.START, VALUES.length, i -> VALUES[i]);
        DetectorSettings settings = DetectorSettings.ofType("iqr");
        settings.setMultiplier(30);

        DetectorResult result = new RangeDetector(settings).detect(window);

        assertThat(result.getFlagged()).isEmpty();
    }

    @Test
    @DisplayName("Should ignore readings without active power")
    void shouldIgnoreMissingValues() {
        List<EnergyReading> readings = new ArrayList<>();
        for (int i = 0; i < VALUES.length; i++) {
            readings.add(TestWindows.reading(TestWindows.START.plusHours(i), i == 3 ? null : VALUES[i]));
        }
        TimeSeriesWindow window = TimeSeriesWindow.of(readings);

        DetectorResult result = new RangeDetector(DetectorSettings.ofType("iqr")).detect(window);

        assertThat(result.getEvaluatedCount()).isEqualTo(9);
        assertThat(result.isFlagged(TestWindows.START.plusHours(9))).isTrue();
    }

    @Test
    @DisplayName("Should flag nothing on an empty window")
    void shouldHandleEmptyWindow() {
        DetectorResult result = new RangeDetector(DetectorSettings.ofType("iqr")).detect(TimeSeriesWindow.empty());

        assertThat(result.getFlagged()).isEmpty();
        assertThat(result.getEvaluatedCount()).isZero();
    }
}
