package com.energysentinel.core.forecast;

import com.energysentinel.core.config.ForecastSettings;
import com.energysentinel.core.error.EngineException;
import com.energysentinel.core.error.InsufficientDataException;
import com.energysentinel.core.error.ModelTrainingException;
import com.energysentinel.core.model.EvaluationMetrics;
import com.energysentinel.core.model.ForecasterKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Trains and evaluates the three forecasters of the ensemble.
 *
 * <h3>Training</h3>
 * <p>
 * Every forecaster is fitted on the full hourly series, concurrently on the
 * supplied worker pool. A failure of any forecaster aborts training with a
 * {@link ModelTrainingException} tagged with that forecaster's kind.
 * </p>
 *
 * <h3>Evaluation</h3>
 * <p>
 * The most recent {@code evaluationDays × 24} hours are held out. When the
 * remaining training split would be shorter than two days, the last 10% is
 * held out instead. Each forecaster is refitted on the training split (the
 * autoregressive forecaster reuses its selected order) and scored on the
 * holdout; a forecaster whose refit fails keeps no metrics and is weighted
 * with the configured default MAPE.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleTrainer {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleTrainer.class);

    /** Two days of hourly values. */
    static final int MIN_TRAINING_HOURS = 48;

    private final ForecastSettings settings;
    private final ExecutorService executor;
    private final Map<ForecasterKind, Forecaster> forecasters;

    public EnsembleTrainer(ForecastSettings settings, ExecutorService executor) {
        this.settings = Objects.requireNonNull(settings, "ForecastSettings must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        Map<ForecasterKind, Forecaster> byKind = new EnumMap<>(ForecasterKind.class);
        for (Forecaster forecaster : ForecasterFactory.createAll(settings)) {
            byKind.put(forecaster.getKind(), forecaster);
        }
        this.forecasters = byKind;
    }

    // ---------------------------------------------------------------
    // Training
    // ---------------------------------------------------------------

    /**
     * Fit every forecaster on the full series.
     *
     * @throws InsufficientDataException if the series has fewer than 48 hours
     * @throws ModelTrainingException    if any forecaster fails
     */
    public Map<ForecasterKind, FittedForecaster> fitAll(HourlySeries series) {
        Objects.requireNonNull(series, "series must not be null");
        requireMinimumLength(series);
        LOG.info("Training {} forecasters on {} hours ({} .. {})",
                forecasters.size(), series.size(), series.getStart(), series.getEnd());

        Map<ForecasterKind, CompletableFuture<FittedForecaster>> futures = new LinkedHashMap<>();
        for (Forecaster forecaster : forecasters.values()) {
            futures.put(forecaster.getKind(), CompletableFuture.supplyAsync(() -> forecaster.fit(series), executor));
        }

        Map<ForecasterKind, FittedForecaster> fitted = new EnumMap<>(ForecasterKind.class);
        for (Map.Entry<ForecasterKind, CompletableFuture<FittedForecaster>> entry : futures.entrySet()) {
            fitted.put(entry.getKey(), await(entry.getKey(), entry.getValue()));
        }
        LOG.info("Trained forecasters: {}", fitted.keySet());
        return fitted;
    }

    /**
     * Score the fitted forecasters on the holdout tail and blend them.
     *
     * @param series the series the forecasters were fitted on
     * @param fitted output of {@link #fitAll(HourlySeries)}
     */
    public ForecastEnsemble evaluate(HourlySeries series, Map<ForecasterKind, FittedForecaster> fitted) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(fitted, "fitted must not be null");
        requireMinimumLength(series);

        int holdout = holdoutHours(series.size());
        HourlySeries training = series.head(series.size() - holdout);
        HourlySeries test = series.tail(series.size() - holdout);
        List<LocalDateTime> testHours = test.hours();
        double[] actual = test.values();
        LOG.info("Evaluating on {} holdout hours after {} training hours", holdout, training.size());

        Map<ForecasterKind, CompletableFuture<double[]>> futures = new LinkedHashMap<>();
        for (Map.Entry<ForecasterKind, FittedForecaster> entry : fitted.entrySet()) {
            Forecaster forecaster = forecasters.get(entry.getKey());
            FittedForecaster template = entry.getValue();
            futures.put(entry.getKey(), CompletableFuture.supplyAsync(
                    () -> forecaster.refit(training, template).predictAt(testHours), executor));
        }

        Map<ForecasterKind, double[]> predictions = new EnumMap<>(ForecasterKind.class);
        Map<ForecasterKind, EvaluationMetrics> componentMetrics = new EnumMap<>(ForecasterKind.class);
        Map<ForecasterKind, Double> mapes = new EnumMap<>(ForecasterKind.class);
        for (Map.Entry<ForecasterKind, CompletableFuture<double[]>> entry : futures.entrySet()) {
            ForecasterKind kind = entry.getKey();
            try {
                double[] predicted = await(kind, entry.getValue());
                EvaluationMetrics metrics = ForecastMetrics.score(actual, predicted);
                predictions.put(kind, predicted);
                componentMetrics.put(kind, metrics);
                mapes.put(kind, Double.isFinite(metrics.getMape()) ? metrics.getMape() : settings.getDefaultMape());
                LOG.info("{} holdout metrics: {}", kind, metrics);
            } catch (ModelTrainingException e) {
                LOG.warn("{} holdout refit failed, assuming MAPE {}: {}",
                        kind, settings.getDefaultMape(), e.getMessage());
                mapes.put(kind, settings.getDefaultMape());
            }
        }

        EnsembleWeights weights = EnsembleWeights.fromMape(mapes, settings.getWeightFloor());
        EvaluationMetrics blended = ForecastMetrics.score(actual, blend(predictions, weights, actual.length));
        LOG.info("Ensemble weights {} with blended holdout metrics {}", weights.asMap(), blended);
        return ForecastEnsemble.of(fitted, weights, componentMetrics, blended);
    }

    /**
     * Fit and evaluate in one call.
     */
    public ForecastEnsemble train(HourlySeries series) {
        return evaluate(series, fitAll(series));
    }

    /**
     * Number of trailing hours held out for evaluation.
     */
    int holdoutHours(int seriesHours) {
        int holdout = settings.getEvaluationDays() * 24;
        if (seriesHours - holdout < MIN_TRAINING_HOURS) {
            holdout = Math.max(1, seriesHours / 10);
        }
        return holdout;
    }

    // ---------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------

    private static double[] blend(Map<ForecasterKind, double[]> predictions, EnsembleWeights weights, int length) {
        double[] blended = new double[length];
        double[] weightSum = new double[length];
        for (Map.Entry<ForecasterKind, double[]> entry : predictions.entrySet()) {
            double w = weights.get(entry.getKey());
            double[] values = entry.getValue();
            for (int i = 0; i < length; i++) {
                if (Double.isFinite(values[i])) {
                    blended[i] += w * values[i];
                    weightSum[i] += w;
                }
            }
        }
        for (int i = 0; i < length; i++) {
            blended[i] = weightSum[i] > 0 ? blended[i] / weightSum[i] : Double.NaN;
        }
        return blended;
    }

    private static void requireMinimumLength(HourlySeries series) {
        if (series.size() < MIN_TRAINING_HOURS) {
            throw new InsufficientDataException("Forecasters need at least " + MIN_TRAINING_HOURS
                    + " hourly values, got " + series.size());
        }
    }

    private static <T> T await(ForecasterKind kind, CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof EngineException engineException) {
                throw engineException;
            }
            throw new ModelTrainingException(kind.name(), kind + " failed: " + cause.getMessage(), cause);
        }
    }
}
