package com.energysentinel.core.model;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Objects;

/**
 * A single timestamped household energy measurement.
 *
 * <p>
 * Every measurement is optional: a {@code null} value marks a missing reading.
 * Instances are immutable; use {@link #builder(LocalDateTime)} or
 * {@link #with(Measurement, Double)} to derive new readings.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnergyReading {

    private static final Measurement[] COLUMNS = Measurement.values();

    private final LocalDateTime timestamp;
    private final Double[] values;

    private EnergyReading(LocalDateTime timestamp, Double[] values) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.values = values;
    }

    public static Builder builder(LocalDateTime timestamp) {
        return new Builder(timestamp);
    }

    /**
     * Convenience factory for a reading with only the three electrical
     * measurements used by the detectors.
     */
    public static EnergyReading of(LocalDateTime timestamp, Double activePower, Double voltage, Double current) {
        return builder(timestamp)
                .activePower(activePower)
                .voltage(voltage)
                .current(current)
                .build();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    /**
     * @param measurement column to read
     * @return the value, or {@code null} if the reading is missing
     */
    public Double get(Measurement measurement) {
        return values[measurement.ordinal()];
    }

    public Double getActivePower() {
        return get(Measurement.ACTIVE_POWER);
    }

    public Double getVoltage() {
        return get(Measurement.VOLTAGE);
    }

    public Double getCurrent() {
        return get(Measurement.CURRENT);
    }

    public boolean hasActivePower() {
        return getActivePower() != null;
    }

    /**
     * Return a copy of this reading with one column replaced.
     */
    public EnergyReading with(Measurement measurement, Double value) {
        Double[] copy = values.clone();
        copy[measurement.ordinal()] = value;
        return new EnergyReading(timestamp, copy);
    }

    /**
     * Return a copy of this reading moved to another timestamp.
     */
    public EnergyReading at(LocalDateTime newTimestamp) {
        return new EnergyReading(newTimestamp, values.clone());
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static final class Builder {
        private final LocalDateTime timestamp;
        private final Double[] values = new Double[COLUMNS.length];

        private Builder(LocalDateTime timestamp) {
            this.timestamp = timestamp;
        }

        public Builder set(Measurement measurement, Double value) {
            values[measurement.ordinal()] = value;
            return this;
        }

        public Builder activePower(Double v) {
            return set(Measurement.ACTIVE_POWER, v);
        }

        public Builder reactivePower(Double v) {
            return set(Measurement.REACTIVE_POWER, v);
        }

        public Builder voltage(Double v) {
            return set(Measurement.VOLTAGE, v);
        }

        public Builder current(Double v) {
            return set(Measurement.CURRENT, v);
        }

        public Builder subMeter1(Double v) {
            return set(Measurement.SUB_METER_1, v);
        }

        public Builder subMeter2(Double v) {
            return set(Measurement.SUB_METER_2, v);
        }

        public Builder subMeter3(Double v) {
            return set(Measurement.SUB_METER_3, v);
        }

        /**
         * @throws NullPointerException if the timestamp is {@code null}
         */
        public EnergyReading build() {
            return new EnergyReading(timestamp, values.clone());
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EnergyReading that))
            return false;
        return timestamp.equals(that.timestamp) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * timestamp.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "EnergyReading{" +
                "timestamp=" + timestamp +
                ", activePower=" + getActivePower() +
                ", voltage=" + getVoltage() +
                ", current=" + getCurrent() +
                '}';
    }
}
