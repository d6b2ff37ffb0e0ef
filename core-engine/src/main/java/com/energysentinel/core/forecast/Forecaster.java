package com.energysentinel.core.forecast;

import com.energysentinel.core.model.ForecasterKind;

/**
 * Contract for the ensemble's forecaster families.
 *
 * <p>
 * Implementations hold configuration only; every call to {@link #fit}
 * returns a new independent {@link FittedForecaster}, so one instance can
 * train on several threads.
 * </p>
 */
public interface Forecaster {

    ForecasterKind getKind();

    /**
     * Train on a full hourly series.
     *
     * @throws com.energysentinel.core.error.ModelTrainingException if fitting
     *                                                              fails
     */
    FittedForecaster fit(HourlySeries series);

    /**
     * Train on a (shorter) series reusing structural choices of a model fitted
     * earlier, such as a selected model order. Used for holdout evaluation.
     */
    default FittedForecaster refit(HourlySeries series, FittedForecaster template) {
        return fit(series);
    }
}
