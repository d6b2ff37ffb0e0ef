package com.energysentinel.core.quality;

import com.energysentinel.core.config.QualitySettings;
import com.energysentinel.core.model.EnergyReading;
import com.energysentinel.core.model.QualityReport;
import com.energysentinel.core.model.TestWindows;
import com.energysentinel.core.model.TimeSeriesWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.energysentinel.core.model.TestWindows.START;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DataQualityGate}.
 */
class DataQualityGateTest {

    private DataQualityGate gate;

    @BeforeEach
    void setUp() {
        gate = new DataQualityGate(new QualitySettings());
    }

    @Test
    @DisplayName("Should accept 45 days of clean hourly data")
    void shouldAcceptFortyFiveDays() {
        TimeSeriesWindow window = TestWindows.hourly(START, 45 * 24, TestWindows::dailyProfile);

        QualityReport report = gate.check(window);

        assertThat(report.isValid()).isTrue();
        assertThat(report.getCoverageDays()).isGreaterThanOrEqualTo(30);
        assertThat(report.getNullPercentage()).isZero();
        assertThat(report.isVoltageOk()).isTrue();
        assertThat(report.isPowerOk()).isTrue();
        assertThat(report.getDataPoints()).isEqualTo(45 * 24);
        assertThat(report.getMaxGapHours()).isEqualTo(1.0);
        assertThat(report.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a window covering only 10 days")
    void shouldRejectShortCoverage() {
        TimeSeriesWindow window = TestWindows.hourly(START, 10 * 24, TestWindows::dailyProfile);

        QualityReport report = gate.check(window);

        assertThat(report.isValid()).isFalse();
        assertThat(report.getCoverageDays()).isEqualTo(9);
        assertThat(report.getWarnings()).anyMatch(w -> w.contains("coverage"));
    }

    @Test
    @DisplayName("Should reject a window with too many missing power readings")
    void shouldRejectTooManyNulls() {
        TimeSeriesWindow window = TestWindows.hourly(START, 40 * 24, i -> i % 10 == 0 ? Double.NaN : 1.0);
        List<EnergyReading> readings = new ArrayList<>();
        for (EnergyReading reading : window) {
            Double power = reading.getActivePower();
            readings.add(TestWindows.reading(reading.getTimestamp(), power.isNaN() ? null : power));
        }

        QualityReport report = gate.check(TimeSeriesWindow.of(readings));

        assertThat(report.isValid()).isFalse();
        assertThat(report.getNullPercentage()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    @DisplayName("Should only warn about voltage, power and gaps")
    void shouldOnlyWarnForRanges() {
        List<EnergyReading> readings = new ArrayList<>();
        for (int i = 0; i < 40 * 24; i++) {
            if (i >= 100 && i < 110) {
                continue;
            }
            double power = i == 500 ? 12.0 : 1.0;
            readings.add(EnergyReading.of(START.plusHours(i), power, 190.0, power * 1000 / 190.0));
        }

        QualityReport report = gate.check(TimeSeriesWindow.of(readings));

        assertThat(report.isValid()).isTrue();
        assertThat(report.isVoltageOk()).isFalse();
        assertThat(report.isPowerOk()).isFalse();
        assertThat(report.getMaxGapHours()).isEqualTo(11.0);
        assertThat(report.getWarnings()).hasSize(3);
    }

    @Test
    @DisplayName("Should report an empty window as invalid without throwing")
    void shouldHandleEmptyWindow() {
        QualityReport report = gate.check(TimeSeriesWindow.empty());

        assertThat(report.isValid()).isFalse();
        assertThat(report.getDataPoints()).isZero();
        assertThat(report.getNullPercentage()).isEqualTo(100.0);
    }
}
