package com.energysentinel.core.detection;

import com.energysentinel.core.model.EnergyReading;
import com.energysentinel.core.model.TimeSeriesWindow;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Active-power values of a window with their timestamps, skipping readings
 * that have no active power.
 */
final class PrimaryValues {

    final List<LocalDateTime> timestamps;
    final double[] values;

    private PrimaryValues(List<LocalDateTime> timestamps, double[] values) {
        this.timestamps = timestamps;
        this.values = values;
    }

    static PrimaryValues of(TimeSeriesWindow window) {
        List<EnergyReading> readings = window.withActivePower();
        double[] values = new double[readings.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = readings.get(i).getActivePower();
        }
        return new PrimaryValues(readings.stream().map(EnergyReading::getTimestamp).toList(), values);
    }

    int size() {
        return values.length;
    }
}
