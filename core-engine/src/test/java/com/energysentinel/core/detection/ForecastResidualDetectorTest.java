package com.energysentinel.core.detection;

import com.energysentinel.core.config.DetectorSettings;
import com.energysentinel.core.forecast.HourlyForecastSource;
import com.energysentinel.core.model.TestWindows;
import com.energysentinel.core.model.TimeSeriesWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ForecastResidualDetector}.
 */
class ForecastResidualDetectorTest {

    private static HourlyForecastSource constant(double value) {
        return hours -> hours.stream().mapToDouble(h -> value).toArray();
    }

    @Test
    @DisplayName("Should flag readings deviating from the forecast by more than the threshold")
    void shouldFlagLargeResiduals() {
        double[] values = {2.0, 3.0, 2.5, 1.2};
        TimeSeriesWindow window = TestWindows.hourly(TestWindows.START, values.length, i -> values[i]);

        DetectorResult result = new ForecastResidualDetector(DetectorSettings.ofType("forecast_residual"),
                constant(2.0)).detect(window);

        assertThat(result.getFlagged()).containsExactly(
                TestWindows.START.plusHours(1), TestWindows.START.plusHours(3));
        assertThat(result.getEvaluatedCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should compare minute readings with the forecast of their clock hour")
    void shouldUseHourOfReading() {
        TimeSeriesWindow window = TestWindows.minutely(TestWindows.START, 120, i -> i < 60 ? 1.0 : 5.0);
        HourlyForecastSource source = hours -> hours.stream()
                .mapToDouble(h -> h.equals(TestWindows.START) ? 1.0 : 5.0).toArray();

        DetectorResult result = new ForecastResidualDetector(DetectorSettings.ofType("forecast_residual"), source)
                .detect(window);

        assertThat(result.getFlagged()).isEmpty();
        assertThat(result.getEvaluatedCount()).isEqualTo(120);
    }

    @Test
    @DisplayName("Should skip hours without a forecast")
    void shouldSkipMissingForecasts() {
        TimeSeriesWindow window = TestWindows.hourly(TestWindows.START, 3, i -> 10.0);
        LocalDateTime missing = TestWindows.START.plusHours(1);
        HourlyForecastSource source = hours -> hours.stream()
                .mapToDouble(h -> h.equals(missing) ? Double.NaN : 1.0).toArray();

        DetectorResult result = new ForecastResidualDetector(DetectorSettings.ofType("forecast_residual"), source)
                .detect(window);

        assertThat(result.getEvaluatedCount()).isEqualTo(2);
        assertThat(result.isFlagged(missing)).isFalse();
    }

    @Test
    @DisplayName("Should bound the denominator when the forecast is zero")
    void shouldBoundDenominator() {
        TimeSeriesWindow window = TestWindows.hourly(TestWindows.START, 2, i -> i == 0 ? 0.0 : 0.0005);

        DetectorResult result = new ForecastResidualDetector(DetectorSettings.ofType("forecast_residual"),
                constant(0.0)).detect(window);

        assertThat(result.getFlagged()).containsExactly(TestWindows.START.plusHours(1));
    }

    @Test
    @DisplayName("Should query each clock hour only once")
    void shouldQueryDistinctHours() {
        TimeSeriesWindow window = TestWindows.minutely(TestWindows.START, 90, i -> 1.0);
        List<List<LocalDateTime>> calls = new ArrayList<>();
        HourlyForecastSource source = hours -> {
            calls.add(hours);
            return hours.stream().mapToDouble(h -> 1.0).toArray();
        };

        new ForecastResidualDetector(DetectorSettings.ofType("forecast_residual"), source).detect(window);

        assertThat(calls).hasSize(1);
        assertThat(calls.get(0)).containsExactly(TestWindows.START, TestWindows.START.plusHours(1));
    }
}
