package com.energysentinel.core.forecast;

import com.energysentinel.core.model.EvaluationMetrics;
import com.energysentinel.core.model.ForecasterKind;
import com.energysentinel.core.model.TestWindows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ForecastEnsemble}.
 */
class ForecastEnsembleTest {

    private static final LocalDateTime END = TestWindows.START.plusHours(99);

    private Map<ForecasterKind, FittedForecaster> models;
    private Map<ForecasterKind, EvaluationMetrics> componentMetrics;
    private EnsembleWeights weights;

    @BeforeEach
    void setUp() {
        models = new EnumMap<>(ForecasterKind.class);
        models.put(ForecasterKind.SEASONAL_TREND,
                new StubForecaster(ForecasterKind.SEASONAL_TREND, TestWindows.START, END, 0.5, hour -> 1.0));
        // no prediction inside the first ten hours
        models.put(ForecasterKind.AUTOREGRESSIVE, new StubForecaster(ForecasterKind.AUTOREGRESSIVE,
                TestWindows.START, END, 0.1,
                hour -> hour.isBefore(TestWindows.START.plusHours(10)) ? Double.NaN : 2.0));
        models.put(ForecasterKind.ENHANCED_SEASONAL,
                StubForecaster.constant(ForecasterKind.ENHANCED_SEASONAL, TestWindows.START, END, 4.0));

        Map<ForecasterKind, Double> raw = new EnumMap<>(ForecasterKind.class);
        raw.put(ForecasterKind.SEASONAL_TREND, 0.5);
        raw.put(ForecasterKind.AUTOREGRESSIVE, 0.3);
        raw.put(ForecasterKind.ENHANCED_SEASONAL, 0.2);
        weights = EnsembleWeights.of(raw);

        componentMetrics = new EnumMap<>(ForecasterKind.class);
        componentMetrics.put(ForecasterKind.SEASONAL_TREND, new EvaluationMetrics(0.2, 0.3, 5, 0.9, 24));
        componentMetrics.put(ForecasterKind.AUTOREGRESSIVE, new EvaluationMetrics(0.3, 0.4, 6, 0.8, 24));
    }

    @Test
    @DisplayName("Should blend component predictions by weight")
    void shouldBlendByWeight() {
        ForecastEnsemble ensemble = ensemble(new EvaluationMetrics(0.1, 0.2, 4, 0.95, 24));

        double[] blended = ensemble.predictAt(List.of(TestWindows.START.plusHours(50)));

        assertThat(blended[0]).isCloseTo(0.5 * 1.0 + 0.3 * 2.0 + 0.2 * 4.0, within(1e-12));
    }

    @Test
    @DisplayName("Should renormalise weights over components that have a prediction")
    void shouldRenormaliseOverAvailableComponents() {
        ForecastEnsemble ensemble = ensemble(new EvaluationMetrics(0.1, 0.2, 4, 0.95, 24));

        double[] blended = ensemble.predictAt(List.of(TestWindows.START.plusHours(2)));

        assertThat(blended[0]).isCloseTo((0.5 * 1.0 + 0.2 * 4.0) / 0.7, within(1e-12));
    }

    @Test
    @DisplayName("Should bound the blended forecast by z times the blended RMSE")
    void shouldUseBlendedRmseForInterval() {
        ForecastEnsemble ensemble = ensemble(new EvaluationMetrics(0.1, 0.2, 4, 0.95, 24));

        Forecast forecast = ensemble.forecast(3, 0.95);

        assertThat(forecast.getHours()).containsExactly(END.plusHours(1), END.plusHours(2), END.plusHours(3));
        assertThat(forecast.getUpper()[0] - forecast.getValues()[0]).isCloseTo(1.96 * 0.2, within(1e-12));
        assertThat(forecast.getConfidenceLevel()).isEqualTo(0.95);
    }

    @Test
    @DisplayName("Should never let the lower bound fall below zero")
    void shouldFloorLowerBound() {
        ForecastEnsemble ensemble = ensemble(new EvaluationMetrics(1, 5.0, 50, 0.1, 24));

        Forecast forecast = ensemble.forecast(24, 0.99);

        for (double lower : forecast.getLower()) {
            assertThat(lower).isZero();
        }
        assertThat(forecast.getUpper()[0]).isCloseTo(1.9 + 2.58 * 5.0, within(1e-9));
    }

    @Test
    @DisplayName("Should use residual spread for the seasonal-trend component and RMSE for the others")
    void shouldUseComponentSpecificIntervals() {
        ForecastEnsemble ensemble = ensemble(new EvaluationMetrics(0.1, 0.2, 4, 0.95, 24));

        Forecast seasonal = ensemble.forecast(ForecasterKind.SEASONAL_TREND, 1, 0.95);
        Forecast autoregressive = ensemble.forecast(ForecasterKind.AUTOREGRESSIVE, 1, 0.95);
        Forecast enhanced = ensemble.forecast(ForecasterKind.ENHANCED_SEASONAL, 1, 0.95);

        assertThat(seasonal.getUpper()[0] - 1.0).isCloseTo(1.96 * 0.5, within(1e-12));
        assertThat(autoregressive.getUpper()[0] - 2.0).isCloseTo(1.96 * 0.4, within(1e-12));
        // no holdout metrics, falls back to the residual spread
        assertThat(enhanced.getUpper()[0] - 4.0).isCloseTo(1.96 * 0.1, within(1e-12));
    }

    @Test
    @DisplayName("Should map confidence levels to z values and reject others")
    void shouldMapZScores() {
        assertThat(ForecastEnsemble.zScore(0.95)).isEqualTo(1.96);
        assertThat(ForecastEnsemble.zScore(0.99)).isEqualTo(2.58);
        assertThatThrownBy(() -> ForecastEnsemble.zScore(0.9)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject weights that do not cover the same forecasters")
    void shouldRejectMismatchedWeights() {
        models.remove(ForecasterKind.ENHANCED_SEASONAL);

        assertThatThrownBy(() -> ensemble(new EvaluationMetrics(0.1, 0.2, 4, 0.95, 24)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("do not match");
    }

    private ForecastEnsemble ensemble(EvaluationMetrics blended) {
        return ForecastEnsemble.of(models, weights, componentMetrics, blended);
    }
}
