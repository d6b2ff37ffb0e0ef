package com.energysentinel.core.forecast;

import com.energysentinel.core.model.EvaluationMetrics;
import com.energysentinel.core.model.ForecasterKind;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable per-cycle ensemble of fitted forecasters and their blending
 * weights.
 *
 * <h3>Blending</h3>
 * <p>
 * The blended prediction is {@code Σ w_i · forecast_i}. When a component has
 * no prediction for an hour (for example the autoregressive model before its
 * first fitted hour), the weights of the remaining components are
 * renormalised for that hour.
 * </p>
 *
 * <h3>Intervals</h3>
 * <ul>
 * <li>blended forecast: {@code ± z · RMSE} of the blended holdout
 * predictions</li>
 * <li>the seasonal-trend forecaster alone: its native interval,
 * {@code ± z ·} in-sample residual standard deviation</li>
 * <li>any other forecaster alone: {@code ± z ·} its holdout RMSE</li>
 * </ul>
 * <p>
 * Lower bounds are floored at zero.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastEnsemble implements HourlyForecastSource {

    private final Map<ForecasterKind, FittedForecaster> models;
    private final EnsembleWeights weights;
    private final Map<ForecasterKind, EvaluationMetrics> componentMetrics;
    private final EvaluationMetrics metrics;

    private ForecastEnsemble(Map<ForecasterKind, FittedForecaster> models, EnsembleWeights weights,
            Map<ForecasterKind, EvaluationMetrics> componentMetrics, EvaluationMetrics metrics) {
        this.models = Collections.unmodifiableMap(copyOf(models));
        this.weights = weights;
        this.componentMetrics = Collections.unmodifiableMap(copyOf(componentMetrics));
        this.metrics = metrics;
    }

    /**
     * @param models           fitted forecaster per kind; must not be empty
     * @param weights          weights covering exactly the same kinds
     * @param componentMetrics holdout metrics per kind
     * @param metrics          holdout metrics of the blended prediction
     * @throws IllegalArgumentException if the kinds of models and weights
     *                                  differ
     */
    public static ForecastEnsemble of(Map<ForecasterKind, FittedForecaster> models, EnsembleWeights weights,
            Map<ForecasterKind, EvaluationMetrics> componentMetrics, EvaluationMetrics metrics) {
        Objects.requireNonNull(models, "models must not be null");
        Objects.requireNonNull(weights, "weights must not be null");
        Objects.requireNonNull(componentMetrics, "componentMetrics must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        if (models.isEmpty() || !models.keySet().equals(weights.kinds())) {
            throw new IllegalArgumentException("Ensemble models " + models.keySet()
                    + " do not match weighted kinds " + weights.kinds());
        }
        return new ForecastEnsemble(models, weights, componentMetrics, metrics);
    }

    private static <V> Map<ForecasterKind, V> copyOf(Map<ForecasterKind, V> source) {
        Map<ForecasterKind, V> copy = new EnumMap<>(ForecasterKind.class);
        copy.putAll(source);
        return copy;
    }

    // ---------------------------------------------------------------
    // Prediction
    // ---------------------------------------------------------------

    @Override
    public double[] predictAt(List<LocalDateTime> hours) {
        double[] blended = new double[hours.size()];
        double[] weightSum = new double[hours.size()];
        for (Map.Entry<ForecasterKind, FittedForecaster> entry : models.entrySet()) {
            double w = weights.get(entry.getKey());
            double[] component = entry.getValue().predictAt(hours);
            for (int i = 0; i < component.length; i++) {
                if (Double.isFinite(component[i])) {
                    blended[i] += w * component[i];
                    weightSum[i] += w;
                }
            }
        }
        for (int i = 0; i < blended.length; i++) {
            blended[i] = weightSum[i] > 0 ? blended[i] / weightSum[i] : Double.NaN;
        }
        return blended;
    }

    /**
     * Blended forecast for the hours following the training end.
     *
     * @param horizonHours    number of hours to forecast
     * @param confidenceLevel 0.95 or 0.99
     */
    public Forecast forecast(int horizonHours, double confidenceLevel) {
        List<LocalDateTime> hours = futureHours(horizonHours);
        double margin = zScore(confidenceLevel) * metrics.getRmse();
        return withMargin(hours, predictAt(hours), margin, confidenceLevel);
    }

    /**
     * Forecast of a single component.
     *
     * @throws IllegalArgumentException if the ensemble has no such component
     */
    public Forecast forecast(ForecasterKind kind, int horizonHours, double confidenceLevel) {
        FittedForecaster model = models.get(kind);
        if (model == null) {
            throw new IllegalArgumentException("Ensemble has no " + kind + " forecaster");
        }
        List<LocalDateTime> hours = futureHours(horizonHours);
        EvaluationMetrics own = componentMetrics.get(kind);
        double spread = kind == ForecasterKind.SEASONAL_TREND || own == null
                ? model.getResidualStdDev()
                : own.getRmse();
        return withMargin(hours, model.predictAt(hours), zScore(confidenceLevel) * spread, confidenceLevel);
    }

    /**
     * Two-sided z value of a confidence level.
     *
     * @throws IllegalArgumentException for levels other than 0.95 and 0.99
     */
    public static double zScore(double confidenceLevel) {
        if (confidenceLevel == 0.95) {
            return 1.96;
        }
        if (confidenceLevel == 0.99) {
            return 2.58;
        }
        throw new IllegalArgumentException("Unsupported confidence level: " + confidenceLevel);
    }

    private List<LocalDateTime> futureHours(int horizonHours) {
        if (horizonHours < 1) {
            throw new IllegalArgumentException("horizonHours must be >= 1, got: " + horizonHours);
        }
        LocalDateTime last = getTrainingEnd();
        List<LocalDateTime> hours = new ArrayList<>(horizonHours);
        for (int h = 1; h <= horizonHours; h++) {
            hours.add(last.plusHours(h));
        }
        return hours;
    }

    private static Forecast withMargin(List<LocalDateTime> hours, double[] values, double margin,
            double confidenceLevel) {
        double safeMargin = Double.isFinite(margin) ? margin : 0.0;
        double[] lower = new double[values.length];
        double[] upper = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            lower[i] = Math.max(0.0, values[i] - safeMargin);
            upper[i] = values[i] + safeMargin;
        }
        return new Forecast(hours, values, lower, upper, confidenceLevel);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Map<ForecasterKind, FittedForecaster> getModels() {
        return models;
    }

    public EnsembleWeights getWeights() {
        return weights;
    }

    public Map<ForecasterKind, EvaluationMetrics> getComponentMetrics() {
        return componentMetrics;
    }

    /** Holdout metrics of the blended prediction. */
    public EvaluationMetrics getMetrics() {
        return metrics;
    }

    public LocalDateTime getTrainingStart() {
        return models.values().stream().map(FittedForecaster::getTrainingStart)
                .min(LocalDateTime::compareTo).orElseThrow();
    }

    public LocalDateTime getTrainingEnd() {
        return models.values().stream().map(FittedForecaster::getTrainingEnd)
                .max(LocalDateTime::compareTo).orElseThrow();
    }

    @Override
    public String toString() {
        return "ForecastEnsemble{weights=" + weights.asMap() + ", metrics=" + metrics + '}';
    }
}
