package com.energysentinel.core.preprocess;

import com.energysentinel.core.config.PreprocessingSettings;
import com.energysentinel.core.model.EnergyReading;
import com.energysentinel.core.model.Measurement;
import com.energysentinel.core.model.TestWindows;
import com.energysentinel.core.model.TimeSeriesWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static com.energysentinel.core.model.TestWindows.START;
import static com.energysentinel.core.model.TestWindows.reading;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Preprocessor}.
 */
class PreprocessorTest {

    private Preprocessor preprocessor;

    @BeforeEach
    void setUp() {
        preprocessor = new Preprocessor(new PreprocessingSettings());
    }

    @Test
    @DisplayName("Should interpolate interior gaps and fill edges with the nearest value")
    void shouldInterpolateNulls() {
        TimeSeriesWindow window = TimeSeriesWindow.of(List.of(
                reading(START, null),
                reading(START.plusMinutes(1), 1.0),
                reading(START.plusMinutes(2), null),
                reading(START.plusMinutes(3), 3.0),
                reading(START.plusMinutes(4), null)));

        TimeSeriesWindow cleaned = preprocessor.process(window);

        assertThat(cleaned.column(Measurement.ACTIVE_POWER)).containsExactly(1.0, 1.0, 2.0, 3.0, 3.0);
    }

    @Test
    @DisplayName("Should replace values beyond three standard deviations by the mean")
    void shouldReplaceOutliers() {
        List<EnergyReading> readings = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            readings.add(reading(START.plusMinutes(i), i == 25 ? 100.0 : 1.0));
        }

        TimeSeriesWindow cleaned = preprocessor.process(TimeSeriesWindow.of(readings));

        double mean = (49 * 1.0 + 100.0) / 50;
        assertThat(cleaned.get(25).getActivePower()).isCloseTo(mean, within(1e-9));
        assertThat(cleaned.get(24).getActivePower()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should resample to one-minute buckets when a gap exceeds one hour")
    void shouldResampleLargeGaps() {
        TimeSeriesWindow window = TimeSeriesWindow.of(List.of(
                reading(START, 1.0),
                reading(START.plusMinutes(1), 2.0),
                reading(START.plusMinutes(2), 3.0),
                reading(START.plusMinutes(120), 4.0),
                reading(START.plusMinutes(121), 5.0)));

        TimeSeriesWindow cleaned = preprocessor.process(window);

        assertThat(cleaned.size()).isEqualTo(122);
        assertThat(cleaned.get(61).getTimestamp()).isEqualTo(START.plusMinutes(61));
        assertThat(cleaned.get(61).getActivePower()).isCloseTo(3.5, within(1e-9));
        assertThat(cleaned.get(61).getVoltage()).isCloseTo(TestWindows.VOLTAGE, within(1e-9));
        assertThat(cleaned.maxGap().toMinutes()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should produce strictly increasing timestamps without missing power")
    void shouldProduceCleanOutput() {
        List<EnergyReading> readings = new ArrayList<>();
        for (int i = 0; i < 300; i++) {
            Double power = i % 7 == 0 ? null : TestWindows.dailyProfile(i / 60);
            readings.add(reading(START.plusMinutes(i), power));
        }

        TimeSeriesWindow cleaned = preprocessor.process(TimeSeriesWindow.of(readings));

        assertThat(cleaned.size()).isEqualTo(300);
        LocalDateTime previous = null;
        for (EnergyReading reading : cleaned) {
            assertThat(reading.getActivePower()).isNotNull();
            if (previous != null) {
                assertThat(reading.getTimestamp()).isAfter(previous);
            }
            previous = reading.getTimestamp();
        }
    }

    @Test
    @DisplayName("Should return an empty window unchanged")
    void shouldKeepEmptyWindow() {
        assertThat(preprocessor.process(TimeSeriesWindow.empty()).isEmpty()).isTrue();
    }
}
