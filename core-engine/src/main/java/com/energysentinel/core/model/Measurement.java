package com.energysentinel.core.model;

/**
 * Measurement columns carried by an {@link EnergyReading}.
 *
 * @since 1.0.0
 */
public enum Measurement {

    /** Primary column: household global active power in kW. */
    ACTIVE_POWER,
    REACTIVE_POWER,
    VOLTAGE,
    /** Global current intensity in A. */
    CURRENT,
    SUB_METER_1,
    SUB_METER_2,
    SUB_METER_3
}
