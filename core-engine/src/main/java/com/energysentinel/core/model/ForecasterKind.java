package com.energysentinel.core.model;

import java.util.Locale;

/**
 * The three forecaster families that make up the ensemble.
 */
public enum ForecasterKind {

    /** Piecewise-linear trend with additive daily and weekly seasonality. */
    SEASONAL_TREND,

    /** ARIMA(p,d,q) on the hourly series. */
    AUTOREGRESSIVE,

    /** Flexible trend with multiplicative seasonality. */
    ENHANCED_SEASONAL;

    /**
     * File name stem used for persisted artifacts, e.g. {@code seasonal_trend}.
     */
    public String fileStem() {
        return name().toLowerCase(Locale.ROOT);
    }
}
