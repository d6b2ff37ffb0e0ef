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
 * z-score detector.
 *
 * <p>
 * A value is an outlier when {@code |x − mean| / σ} exceeds the threshold
 * (default 3.0), with σ the sample standard deviation of the whole window.
 * A window of identical values, or with fewer than two values, flags
 * nothing.
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticalDeviationDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalDeviationDetector.class);

    static final double DEFAULT_THRESHOLD = 3.0;

    private final double threshold;

    public StatisticalDeviationDetector(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        this.threshold = settings.getThreshold() > 0 ? settings.getThreshold() : DEFAULT_THRESHOLD;
    }

    @Override
    public DetectorResult detect(TimeSeriesWindow window) {
        PrimaryValues primary = PrimaryValues.of(window);
        double mean = Stats.mean(primary.values);
        double stddev = Stats.sampleStdDev(primary.values);
        if (!(stddev > 0)) {
            LOG.debug("Standard deviation is {} over {} values, nothing to flag", stddev, primary.size());
            return DetectorResult.none(getKind(), primary.size());
        }

        List<LocalDateTime> flagged = new ArrayList<>();
        for (int i = 0; i < primary.size(); i++) {
            double z = Math.abs(primary.values[i] - mean) / stddev;
            if (z > threshold) {
                flagged.add(primary.timestamps.get(i));
            }
        }
        LOG.debug("z-score mean={} stddev={} flagged {} of {}", mean, stddev, flagged.size(), primary.size());
        return DetectorResult.of(getKind(), flagged, primary.size());
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.STATISTICAL;
    }
}
