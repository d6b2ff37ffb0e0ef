package com.energysentinel.core.forecast;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Hourly forecast with a prediction interval.
 *
 * <p>
 * The lower bound is never negative: consumption cannot be below zero.
 * </p>
 */
public final class Forecast {

    private final List<LocalDateTime> hours;
    private final double[] values;
    private final double[] lower;
    private final double[] upper;
    private final double confidenceLevel;

    Forecast(List<LocalDateTime> hours, double[] values, double[] lower, double[] upper, double confidenceLevel) {
        this.hours = List.copyOf(Objects.requireNonNull(hours, "hours must not be null"));
        if (values.length != hours.size() || lower.length != hours.size() || upper.length != hours.size()) {
            throw new IllegalArgumentException("Forecast arrays must match the number of hours");
        }
        this.values = values.clone();
        this.lower = lower.clone();
        this.upper = upper.clone();
        this.confidenceLevel = confidenceLevel;
    }

    public List<LocalDateTime> getHours() {
        return hours;
    }

    public double[] getValues() {
        return values.clone();
    }

    public double[] getLower() {
        return lower.clone();
    }

    public double[] getUpper() {
        return upper.clone();
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    public int size() {
        return hours.size();
    }

    @Override
    public String toString() {
        return "Forecast{hours=" + hours.size()
                + (hours.isEmpty() ? "" : ", from=" + hours.get(0) + ", to=" + hours.get(hours.size() - 1))
                + ", confidenceLevel=" + confidenceLevel + '}';
    }
}
