package com.energysentinel.core.model;

/**
 * Classification of a consensus anomaly.
 *
 * <p>
 * Each type maps to a fixed {@link Severity}, a short description and the
 * notification action recommended to the reporting layer.
 * </p>
 *
 * @since 1.0.0
 */
public enum AnomalyType {

    HIGH_CONSUMPTION(Severity.CRITICAL, "Unusually high energy consumption", "email_immediate"),
    LOW_CONSUMPTION(Severity.MEDIUM, "Unusually low energy consumption", "email_daily"),
    TEMPORAL(Severity.CRITICAL, "High consumption during night valley hours", "email_immediate"),
    SENSOR_FAILURE(Severity.LOW, "Flat-lined readings, possible sensor malfunction", "log_only");

    private final Severity severity;
    private final String description;
    private final String action;

    AnomalyType(Severity severity, String description, String action) {
        this.severity = severity;
        this.description = description;
        this.action = action;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    public String getAction() {
        return action;
    }
}
