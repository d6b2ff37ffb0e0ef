package com.energysentinel.core.model;

/**
 * Terminal status of a retraining cycle or anomaly pass.
 */
public enum CycleStatus {

    SUCCESS,

    /** The new model degraded and the incumbent was kept. */
    DEGRADATION,

    /** Not enough data yet; retried on the next scheduled run. */
    INSUFFICIENT_DATA,

    FAILURE
}
