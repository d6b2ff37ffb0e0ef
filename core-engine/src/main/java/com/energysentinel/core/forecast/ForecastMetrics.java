package com.energysentinel.core.forecast;

import com.energysentinel.core.model.EvaluationMetrics;

/**
 * Computes {@link EvaluationMetrics} from actual and predicted values.
 *
 * <p>
 * Pairs whose prediction is not finite are ignored and excluded from the
 * sample count.
 * </p>
 */
public final class ForecastMetrics {

    /** Guards the MAPE denominator against zero readings. */
    static final double MAPE_EPSILON = 1e-8;

    private ForecastMetrics() {
        // utility class, not instantiable
    }

    public static EvaluationMetrics score(double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException("actual has " + actual.length
                    + " values but predicted has " + predicted.length);
        }
        int count = 0;
        double absSum = 0;
        double squaredSum = 0;
        double percentSum = 0;
        double actualSum = 0;
        for (int i = 0; i < actual.length; i++) {
            if (!Double.isFinite(predicted[i])) {
                continue;
            }
            double error = actual[i] - predicted[i];
            absSum += Math.abs(error);
            squaredSum += error * error;
            percentSum += Math.abs(error) / (Math.abs(actual[i]) + MAPE_EPSILON);
            actualSum += actual[i];
            count++;
        }
        if (count == 0) {
            return new EvaluationMetrics(Double.NaN, Double.NaN, Double.NaN, Double.NaN, 0);
        }

        double actualMean = actualSum / count;
        double totalSum = 0;
        for (int i = 0; i < actual.length; i++) {
            if (Double.isFinite(predicted[i])) {
                double diff = actual[i] - actualMean;
                totalSum += diff * diff;
            }
        }
        double r2 = totalSum == 0 ? (squaredSum == 0 ? 1.0 : 0.0) : 1.0 - squaredSum / totalSum;

        return new EvaluationMetrics(absSum / count, Math.sqrt(squaredSum / count),
                100.0 * percentSum / count, r2, count);
    }
}
