package com.energysentinel.core.model;

/**
 * Anomaly severity, ordered from most to least urgent.
 */
public enum Severity {
    CRITICAL,
    MEDIUM,
    LOW
}
