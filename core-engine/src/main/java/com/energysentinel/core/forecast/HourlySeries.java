package com.energysentinel.core.forecast;

import com.energysentinel.core.error.InsufficientDataException;
import com.energysentinel.core.model.EnergyReading;
import com.energysentinel.core.model.TimeSeriesWindow;
import com.energysentinel.core.stats.Stats;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Contiguous hourly active-power series used to train the forecasters.
 *
 * <p>
 * Built by averaging readings per clock hour; hours without readings are
 * filled by linear interpolation so every index {@code i} corresponds to
 * {@code start + i hours}.
 * </p>
 *
 * @since 1.0.0
 */
public final class HourlySeries {

    private final LocalDateTime start;
    private final double[] values;

    private HourlySeries(LocalDateTime start, double[] values) {
        this.start = start;
        this.values = values;
    }

    /**
     * @param start   first hour; truncated to the hour
     * @param values  one value per hour, no {@code NaN}
     */
    public static HourlySeries of(LocalDateTime start, double[] values) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("HourlySeries must contain at least one value");
        }
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("HourlySeries values must be finite");
            }
        }
        return new HourlySeries(start.truncatedTo(ChronoUnit.HOURS), values.clone());
    }

    /**
     * Resample a window's active power to hourly means.
     *
     * @throws InsufficientDataException if the window has no active-power
     *                                   readings
     */
    public static HourlySeries from(TimeSeriesWindow window) {
        List<EnergyReading> readings = window.withActivePower();
        if (readings.isEmpty()) {
            throw new InsufficientDataException("Window has no active power readings to resample");
        }
        LocalDateTime first = readings.get(0).getTimestamp().truncatedTo(ChronoUnit.HOURS);
        LocalDateTime last = readings.get(readings.size() - 1).getTimestamp().truncatedTo(ChronoUnit.HOURS);
        int hours = (int) ChronoUnit.HOURS.between(first, last) + 1;

        double[] sums = new double[hours];
        int[] counts = new int[hours];
        for (EnergyReading reading : readings) {
            int index = (int) ChronoUnit.HOURS.between(first, reading.getTimestamp().truncatedTo(ChronoUnit.HOURS));
            sums[index] += reading.getActivePower();
            counts[index]++;
        }
        double[] means = new double[hours];
        for (int i = 0; i < hours; i++) {
            means[i] = counts[i] == 0 ? Double.NaN : sums[i] / counts[i];
        }
        return new HourlySeries(first, Stats.interpolate(means));
    }

    public LocalDateTime getStart() {
        return start;
    }

    public LocalDateTime getEnd() {
        return hourAt(values.length - 1);
    }

    public int size() {
        return values.length;
    }

    public double value(int index) {
        return values[index];
    }

    public double[] values() {
        return values.clone();
    }

    public LocalDateTime hourAt(int index) {
        return start.plusHours(index);
    }

    public List<LocalDateTime> hours() {
        List<LocalDateTime> hours = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            hours.add(hourAt(i));
        }
        return hours;
    }

    /**
     * First {@code count} hours.
     */
    public HourlySeries head(int count) {
        return new HourlySeries(start, Arrays.copyOf(values, count));
    }

    /**
     * Hours from {@code fromIndex} to the end.
     */
    public HourlySeries tail(int fromIndex) {
        return new HourlySeries(hourAt(fromIndex), Arrays.copyOfRange(values, fromIndex, values.length));
    }

    @Override
    public String toString() {
        return "HourlySeries{start=" + start + ", hours=" + values.length + '}';
    }
}
