package com.energysentinel.core.detection;

import com.energysentinel.core.config.DetectorSettings;
import com.energysentinel.core.forecast.HourlyForecastSource;
import com.energysentinel.core.model.DetectorKind;
import com.energysentinel.core.model.TimeSeriesWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Forecast-residual detector.
 *
 * <p>
 * Each reading is compared with the forecast of its clock hour and flagged
 * when {@code |actual − forecast| / max(|forecast|, 0.001)} exceeds the
 * threshold (default 0.30). Readings whose hour has no finite forecast are
 * not evaluated.
 * </p>
 *
 * @since 1.0.0
 */
public class ForecastResidualDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastResidualDetector.class);

    static final double DEFAULT_THRESHOLD = 0.30;
    static final double MIN_DENOMINATOR = 0.001;

    private final double threshold;
    private final HourlyForecastSource forecastSource;

    /**
     * @param settings       detector configuration
     * @param forecastSource hourly forecast to compare against
     */
    public ForecastResidualDetector(DetectorSettings settings, HourlyForecastSource forecastSource) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        this.forecastSource = Objects.requireNonNull(forecastSource, "forecastSource must not be null");
        this.threshold = settings.getThreshold() > 0 ? settings.getThreshold() : DEFAULT_THRESHOLD;
    }

    @Override
    public DetectorResult detect(TimeSeriesWindow window) {
        PrimaryValues primary = PrimaryValues.of(window);
        if (primary.size() == 0) {
            return DetectorResult.none(getKind(), 0);
        }

        Set<LocalDateTime> distinctHours = new LinkedHashSet<>();
        for (LocalDateTime ts : primary.timestamps) {
            distinctHours.add(ts.truncatedTo(ChronoUnit.HOURS));
        }
        List<LocalDateTime> hours = new ArrayList<>(distinctHours);
        double[] predicted = forecastSource.predictAt(hours);
        Map<LocalDateTime, Double> forecastByHour = new HashMap<>();
        for (int i = 0; i < hours.size(); i++) {
            forecastByHour.put(hours.get(i), predicted[i]);
        }

        int evaluated = 0;
        List<LocalDateTime> flagged = new ArrayList<>();
        for (int i = 0; i < primary.size(); i++) {
            LocalDateTime ts = primary.timestamps.get(i);
            double forecast = forecastByHour.get(ts.truncatedTo(ChronoUnit.HOURS));
            if (!Double.isFinite(forecast)) {
                continue;
            }
            evaluated++;
            double residual = Math.abs(primary.values[i] - forecast) / Math.max(Math.abs(forecast), MIN_DENOMINATOR);
            if (residual > threshold) {
                flagged.add(ts);
            }
        }
        LOG.debug("Forecast residual flagged {} of {} evaluated", flagged.size(), evaluated);
        return DetectorResult.of(getKind(), flagged, evaluated);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.FORECAST_RESIDUAL;
    }
}
