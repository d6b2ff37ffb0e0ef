package com.energysentinel.core.detection;

import com.energysentinel.core.config.DetectorSettings;
import com.energysentinel.core.model.DetectorKind;
import com.energysentinel.core.model.TimeSeriesWindow;
import com.energysentinel.core.stats.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Interquartile-range detector.
 *
 * <p>
 * Flags active-power values outside
 * {@code [Q1 − m·IQR, Q3 + m·IQR]} where the quartiles are computed over the
 * window with linear interpolation and {@code m} defaults to 1.5.
 * </p>
 *
 * @since 1.0.0
 */
public class RangeDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RangeDetector.class);

    static final double DEFAULT_MULTIPLIER = 1.5;

    private final double multiplier;

    public RangeDetector(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        this.multiplier = settings.getMultiplier() > 0 ? settings.getMultiplier() : DEFAULT_MULTIPLIER;
    }

    @Override
    public DetectorResult detect(TimeSeriesWindow window) {
        PrimaryValues primary = PrimaryValues.of(window);
        if (primary.size() == 0) {
            return DetectorResult.none(getKind(), 0);
        }
        double q1 = Stats.quantile(primary.values, 0.25);
        double q3 = Stats.quantile(primary.values, 0.75);
        double iqr = q3 - q1;
        double lower = q1 - multiplier * iqr;
        double upper = q3 + multiplier * iqr;

        List<LocalDateTime> flagged = new ArrayList<>();
        for (int i = 0; i < primary.size(); i++) {
            double value = primary.values[i];
            if (value < lower || value > upper) {
                flagged.add(primary.timestamps.get(i));
            }
        }
        LOG.debug("Range bounds [{}, {}] flagged {} of {}", lower, upper, flagged.size(), primary.size());
        return DetectorResult.of(getKind(), flagged, primary.size());
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.RANGE;
    }
}
