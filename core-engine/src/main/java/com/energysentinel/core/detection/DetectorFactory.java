package com.energysentinel.core.detection;

import com.energysentinel.core.config.DetectorSettings;
import com.energysentinel.core.forecast.HourlyForecastSource;
import com.energysentinel.core.model.DetectorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances from
 * {@link DetectorSettings}.
 *
 * <p>
 * This is the single point of extension when adding new detector types:
 * register the new {@link DetectorKind} and create the corresponding
 * detector here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create a detector for the given settings.
     *
     * @param settings       the detector configuration; must not be {@code null}
     * @param forecastSource forecast for the residual detector; may be
     *                       {@code null} for every other type
     * @return an appropriate {@link AnomalyDetector} instance
     * @throws IllegalArgumentException if the type is unknown, or a residual
     *                                  detector is requested without a
     *                                  forecast
     */
    public static AnomalyDetector create(DetectorSettings settings, HourlyForecastSource forecastSource) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        Objects.requireNonNull(settings.getType(), "Detector type must not be null");

        return switch (settings.kind()) {
            case RANGE -> new RangeDetector(settings);
            case STATISTICAL -> new StatisticalDeviationDetector(settings);
            case ISOLATION -> new IsolationDetector(settings);
            case MOVING_AVERAGE -> new MovingAverageDetector(settings);
            case FORECAST_RESIDUAL -> {
                if (forecastSource == null) {
                    throw new IllegalArgumentException("Detector '" + settings.getType() + "' requires a forecast");
                }
                yield new ForecastResidualDetector(settings, forecastSource);
            }
        };
    }

    /**
     * Create detectors for every entry in the supplied list.
     *
     * <p>
     * A forecast-residual entry is skipped with a warning when no forecast is
     * available. The returned list is <strong>unmodifiable</strong>.
     * </p>
     *
     * @param settings       detector configurations; must not be {@code null}
     * @param forecastSource forecast for the residual detector, or {@code null}
     * @return unmodifiable list of detectors
     */
    public static List<AnomalyDetector> createAll(List<DetectorSettings> settings,
            HourlyForecastSource forecastSource) {
        Objects.requireNonNull(settings, "Detector settings list must not be null");
        List<AnomalyDetector> detectors = new ArrayList<>(settings.size());
        for (DetectorSettings entry : settings) {
            if (entry.kind() == DetectorKind.FORECAST_RESIDUAL && forecastSource == null) {
                LOG.warn("No forecast available, skipping detector '{}'", entry.getType());
                continue;
            }
            detectors.add(create(entry, forecastSource));
        }
        LOG.info("Created {} detector(s) from configuration", detectors.size());
        return Collections.unmodifiableList(detectors);
    }
}
