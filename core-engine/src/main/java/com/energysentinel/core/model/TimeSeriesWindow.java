package com.energysentinel.core.model;

import com.energysentinel.core.error.DataValidationException;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, strictly time-ordered sequence of {@link EnergyReading}s.
 *
 * <p>
 * Construction rejects out-of-order and duplicate timestamps with a
 * {@link DataValidationException}. Gaps between readings are kept as they are;
 * nothing is filled in or dropped silently.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeriesWindow implements Iterable<EnergyReading> {

    private static final TimeSeriesWindow EMPTY = new TimeSeriesWindow(List.of());

    private final List<EnergyReading> readings;

    private TimeSeriesWindow(List<EnergyReading> readings) {
        this.readings = readings;
    }

    /**
     * Create a window from readings that are already in time order.
     *
     * @param readings readings in strictly increasing timestamp order
     * @return a new window
     * @throws NullPointerException    if {@code readings} or an element is
     *                                 {@code null}
     * @throws DataValidationException if timestamps are not strictly increasing
     */
    public static TimeSeriesWindow of(List<EnergyReading> readings) {
        Objects.requireNonNull(readings, "readings must not be null");
        List<EnergyReading> copy = new ArrayList<>(readings.size());
        LocalDateTime previous = null;
        for (EnergyReading reading : readings) {
            Objects.requireNonNull(reading, "reading must not be null");
            LocalDateTime ts = reading.getTimestamp();
            if (previous != null && !ts.isAfter(previous)) {
                throw new DataValidationException(ts.equals(previous)
                        ? "Duplicate timestamp in window: " + ts
                        : "Timestamps out of order: " + ts + " follows " + previous);
            }
            copy.add(reading);
            previous = ts;
        }
        return new TimeSeriesWindow(Collections.unmodifiableList(copy));
    }

    public static TimeSeriesWindow empty() {
        return EMPTY;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public List<EnergyReading> getReadings() {
        return readings;
    }

    public int size() {
        return readings.size();
    }

    public boolean isEmpty() {
        return readings.isEmpty();
    }

    public EnergyReading get(int index) {
        return readings.get(index);
    }

    public LocalDateTime getStart() {
        return isEmpty() ? null : readings.get(0).getTimestamp();
    }

    public LocalDateTime getEnd() {
        return isEmpty() ? null : readings.get(readings.size() - 1).getTimestamp();
    }

    /**
     * @return time between the first and the last reading, zero when empty
     */
    public Duration span() {
        return isEmpty() ? Duration.ZERO : Duration.between(getStart(), getEnd());
    }

    /**
     * Largest interval between two consecutive readings.
     */
    public Duration maxGap() {
        Duration max = Duration.ZERO;
        for (int i = 1; i < readings.size(); i++) {
            Duration gap = Duration.between(readings.get(i - 1).getTimestamp(), readings.get(i).getTimestamp());
            if (gap.compareTo(max) > 0) {
                max = gap;
            }
        }
        return max;
    }

    /**
     * Values of one column; missing readings are {@code null}.
     */
    public Double[] column(Measurement measurement) {
        Double[] out = new Double[readings.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = readings.get(i).get(measurement);
        }
        return out;
    }

    /**
     * Readings that carry a primary (active power) value.
     */
    public List<EnergyReading> withActivePower() {
        return readings.stream().filter(EnergyReading::hasActivePower).toList();
    }

    @Override
    public Iterator<EnergyReading> iterator() {
        return readings.iterator();
    }

    @Override
    public String toString() {
        return "TimeSeriesWindow{size=" + size() + ", start=" + getStart() + ", end=" + getEnd() + '}';
    }
}
