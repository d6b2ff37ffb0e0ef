/**
 * Hourly forecasting: the seasonal-trend, autoregressive and enhanced
 * seasonal forecasters, holdout evaluation and the inverse-MAPE blended
 * {@link com.energysentinel.core.forecast.ForecastEnsemble}.
 */
package com.energysentinel.core.forecast;
