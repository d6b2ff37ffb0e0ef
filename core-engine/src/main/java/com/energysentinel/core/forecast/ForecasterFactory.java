package com.energysentinel.core.forecast;

import com.energysentinel.core.config.ForecastSettings;
import com.energysentinel.core.model.ForecasterKind;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Creates the ensemble's {@link Forecaster}s from configuration.
 */
public final class ForecasterFactory {

    private ForecasterFactory() {
        // utility class, not instantiable
    }

    public static Forecaster create(ForecasterKind kind, ForecastSettings settings) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(settings, "ForecastSettings must not be null");
        return switch (kind) {
            case SEASONAL_TREND -> new SeasonalTrendForecaster(kind, settings.getSeasonalTrend());
            case AUTOREGRESSIVE -> new ArimaForecaster(settings.getAutoregressive());
            case ENHANCED_SEASONAL -> new SeasonalTrendForecaster(kind, settings.getEnhancedSeasonal());
        };
    }

    /**
     * @return one forecaster per {@link ForecasterKind}, in declaration order
     */
    public static List<Forecaster> createAll(ForecastSettings settings) {
        return Arrays.stream(ForecasterKind.values())
                .map(kind -> create(kind, settings))
                .toList();
    }
}
