package com.energysentinel.core.forecast;

import com.energysentinel.core.model.ForecasterKind;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A trained forecaster, able to predict hourly active power.
 *
 * <p>
 * Implementations are immutable and serialised with Jackson as model
 * artifacts.
 * </p>
 */
public interface FittedForecaster extends HourlyForecastSource {

    ForecasterKind getKind();

    /** First hour of the training series. */
    LocalDateTime getTrainingStart();

    /** Last hour of the training series. */
    LocalDateTime getTrainingEnd();

    /** Standard deviation of the in-sample residuals, in kW. */
    double getResidualStdDev();

    /**
     * Predict active power at the given hours. Hours the model cannot cover
     * yield {@code NaN}.
     */
    @Override
    double[] predictAt(List<LocalDateTime> hours);
}
