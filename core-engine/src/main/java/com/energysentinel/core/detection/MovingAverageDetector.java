package com.energysentinel.core.detection;

import com.energysentinel.core.config.DetectorSettings;
import com.energysentinel.core.model.DetectorKind;
import com.energysentinel.core.model.TimeSeriesWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Moving-average deviation detector.
 *
 * <p>
 * Compares each value with the trailing mean of the last <i>N</i> values
 * (default 60) <strong>including the value itself</strong>, and flags it when
 * {@code |x − ma| / ma} exceeds the threshold (default 0.30).
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * The first {@code N − 1} values are not evaluated because their window is
 * incomplete. A moving average of exactly zero flags any non-zero value.
 * </p>
 *
 * @since 1.0.0
 */
public class MovingAverageDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(MovingAverageDetector.class);

    static final int DEFAULT_WINDOW_SIZE = 60;
    static final double DEFAULT_THRESHOLD = 0.30;

    private final int windowSize;
    private final double threshold;

    public MovingAverageDetector(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        this.windowSize = settings.getWindowSize() > 0 ? settings.getWindowSize() : DEFAULT_WINDOW_SIZE;
        this.threshold = settings.getThreshold() > 0 ? settings.getThreshold() : DEFAULT_THRESHOLD;
        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize must be >= 2, got: " + windowSize);
        }
    }

    @Override
    public DetectorResult detect(TimeSeriesWindow window) {
        PrimaryValues primary = PrimaryValues.of(window);

        Deque<Double> trailing = new ArrayDeque<>(windowSize + 1);
        double sum = 0;
        int evaluated = 0;
        List<LocalDateTime> flagged = new ArrayList<>();
        for (int i = 0; i < primary.size(); i++) {
            double value = primary.values[i];
            trailing.addLast(value);
            sum += value;
            if (trailing.size() > windowSize) {
                sum -= trailing.pollFirst();
            }
            if (trailing.size() < windowSize) {
                continue;
            }

            evaluated++;
            double ma = sum / windowSize;
            if (ma == 0) {
                if (value != 0) {
                    flagged.add(primary.timestamps.get(i));
                }
            } else if (Math.abs(value - ma) / Math.abs(ma) > threshold) {
                flagged.add(primary.timestamps.get(i));
            }
        }
        LOG.debug("Moving average (window {}) flagged {} of {} evaluated", windowSize, flagged.size(), evaluated);
        return DetectorResult.of(getKind(), flagged, evaluated);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.MOVING_AVERAGE;
    }
}
