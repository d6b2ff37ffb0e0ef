package com.energysentinel.core.forecast;

import com.energysentinel.core.config.SeasonalTrendSettings;
import com.energysentinel.core.error.ModelTrainingException;
import com.energysentinel.core.model.ForecasterKind;
import com.energysentinel.core.model.JsonMappers;
import com.energysentinel.core.model.TestWindows;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SeasonalTrendForecaster} and {@link SeasonalTrendModel}.
 */
class SeasonalTrendForecasterTest {

    private static final int DAYS = 21;

    @Test
    @DisplayName("Should forecast the next day of a clean daily cycle closely")
    void shouldForecastDailyCycle() {
        HourlySeries series = dailySeries(DAYS * 24);
        SeasonalTrendForecaster forecaster = new SeasonalTrendForecaster(
                ForecasterKind.SEASONAL_TREND, new SeasonalTrendSettings());

        FittedForecaster fitted = forecaster.fit(series);

        assertThat(meanAbsoluteErrorNextDay(fitted, series)).isLessThan(0.1);
        assertThat(fitted.getResidualStdDev()).isLessThan(0.1);
        assertThat(fitted.getTrainingStart()).isEqualTo(TestWindows.START);
        assertThat(fitted.getTrainingEnd()).isEqualTo(series.getEnd());
    }

    @Test
    @DisplayName("Should forecast the daily cycle with multiplicative seasonality")
    void shouldForecastMultiplicative() {
        HourlySeries series = dailySeries(DAYS * 24);
        SeasonalTrendForecaster forecaster = new SeasonalTrendForecaster(
                ForecasterKind.ENHANCED_SEASONAL, SeasonalTrendSettings.enhancedDefaults());

        FittedForecaster fitted = forecaster.fit(series);

        assertThat(fitted.getKind()).isEqualTo(ForecasterKind.ENHANCED_SEASONAL);
        assertThat(((SeasonalTrendModel) fitted).isMultiplicative()).isTrue();
        assertThat(meanAbsoluteErrorNextDay(fitted, series)).isLessThan(0.1);
    }

    @Test
    @DisplayName("Should skip weekly terms on a series shorter than two weeks")
    void shouldSkipWeeklyTermsOnShortSeries() {
        SeasonalTrendForecaster forecaster = new SeasonalTrendForecaster(
                ForecasterKind.SEASONAL_TREND, new SeasonalTrendSettings());

        SeasonalTrendModel model = (SeasonalTrendModel) forecaster.fit(dailySeries(5 * 24));

        assertThat(model.getWeeklyOrder()).isZero();
        assertThat(model.getDailyOrder()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should refuse to act as the autoregressive forecaster")
    void shouldRejectAutoregressiveKind() {
        assertThatThrownBy(() -> new SeasonalTrendForecaster(ForecasterKind.AUTOREGRESSIVE,
                new SeasonalTrendSettings()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should fail training on fewer than three hours")
    void shouldFailOnTinySeries() {
        SeasonalTrendForecaster forecaster = new SeasonalTrendForecaster(
                ForecasterKind.SEASONAL_TREND, new SeasonalTrendSettings());

        assertThatThrownBy(() -> forecaster.fit(HourlySeries.of(TestWindows.START, new double[] {1, 2})))
                .isInstanceOf(ModelTrainingException.class)
                .extracting(e -> ((ModelTrainingException) e).getComponent())
                .isEqualTo("SEASONAL_TREND");
    }

    @Test
    @DisplayName("Should predict identically after a JSON round trip")
    void shouldSurviveJsonRoundTrip() throws Exception {
        HourlySeries series = dailySeries(DAYS * 24);
        FittedForecaster fitted = new SeasonalTrendForecaster(
                ForecasterKind.SEASONAL_TREND, new SeasonalTrendSettings()).fit(series);
        ObjectMapper mapper = JsonMappers.create();

        String json = mapper.writeValueAsString(fitted);
        SeasonalTrendModel restored = mapper.readValue(json, SeasonalTrendModel.class);

        List<LocalDateTime> hours = nextDay(series);
        assertThat(json).contains("\"trend_coefficients\"");
        assertThat(restored.predictAt(hours)).containsExactly(fitted.predictAt(hours));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static HourlySeries dailySeries(int hours) {
        double[] values = new double[hours];
        for (int i = 0; i < hours; i++) {
            values[i] = TestWindows.dailyProfile(i);
        }
        return HourlySeries.of(TestWindows.START, values);
    }

    private static List<LocalDateTime> nextDay(HourlySeries series) {
        List<LocalDateTime> hours = new ArrayList<>();
        for (int h = 1; h <= 24; h++) {
            hours.add(series.getEnd().plusHours(h));
        }
        return hours;
    }

    private static double meanAbsoluteErrorNextDay(FittedForecaster fitted, HourlySeries series) {
        double[] predicted = fitted.predictAt(nextDay(series));
        double sum = 0;
        for (int h = 0; h < 24; h++) {
            sum += Math.abs(predicted[h] - TestWindows.dailyProfile(series.size() + h));
        }
        return sum / 24;
    }
}
