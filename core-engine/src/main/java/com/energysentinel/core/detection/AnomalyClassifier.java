package com.energysentinel.core.detection;

import com.energysentinel.core.model.AnomalyType;
import com.energysentinel.core.stats.Stats;

import java.time.LocalDateTime;

/**
 * Assigns exactly one {@link AnomalyType} to a consensus anomaly.
 *
 * <p>
 * Rules are tried in order and the first match wins:
 * </p>
 * <ol>
 * <li>TEMPORAL: hour 02 to 05 inclusive and value above 1.5 × window mean</li>
 * <li>HIGH_CONSUMPTION: value at or above the window's 95th percentile</li>
 * <li>LOW_CONSUMPTION: value at or below the window's 5th percentile</li>
 * <li>SENSOR_FAILURE: absolute first difference below 0.001</li>
 * </ol>
 * <p>
 * A value matching none of them is HIGH_CONSUMPTION when at or above the
 * mean and LOW_CONSUMPTION otherwise.
 * </p>
 */
public class AnomalyClassifier {

    static final double TEMPORAL_FACTOR = 1.5;
    static final double FLAT_DIFFERENCE = 0.001;

    private final double mean;
    private final double p95;
    private final double p05;

    /**
     * @param windowValues active-power values of the whole window
     */
    public AnomalyClassifier(double[] windowValues) {
        this.mean = Stats.mean(windowValues);
        this.p95 = Stats.quantile(windowValues, 0.95);
        this.p05 = Stats.quantile(windowValues, 0.05);
    }

    /**
     * @param timestamp       time of the reading
     * @param value           active power of the reading
     * @param firstDifference value minus the previous value, {@code NaN} for
     *                        the first reading
     */
    public AnomalyType classify(LocalDateTime timestamp, double value, double firstDifference) {
        int hour = timestamp.getHour();
        if (hour >= 2 && hour <= 5 && value > TEMPORAL_FACTOR * mean) {
            return AnomalyType.TEMPORAL;
        }
        if (value >= p95) {
            return AnomalyType.HIGH_CONSUMPTION;
        }
        if (value <= p05) {
            return AnomalyType.LOW_CONSUMPTION;
        }
        if (Math.abs(firstDifference) < FLAT_DIFFERENCE) {
            return AnomalyType.SENSOR_FAILURE;
        }
        return value >= mean ? AnomalyType.HIGH_CONSUMPTION : AnomalyType.LOW_CONSUMPTION;
    }
}
