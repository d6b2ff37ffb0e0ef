package com.energysentinel.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The independent single-method anomaly detectors that vote on consensus.
 *
 * @since 1.0.0
 */
public enum DetectorKind {

    RANGE("iqr"),
    STATISTICAL("zscore"),
    ISOLATION("isolation_forest"),
    MOVING_AVERAGE("moving_average"),
    FORECAST_RESIDUAL("forecast_residual");

    private final String configName;

    DetectorKind(String configName) {
        this.configName = configName;
    }

    /**
     * Name used for this detector in the engine configuration.
     */
    public String getConfigName() {
        return configName;
    }

    /**
     * Resolve a configuration type string.
     *
     * @param type configuration name, case-insensitive
     * @return matching kind
     * @throws IllegalArgumentException if the type is unknown
     */
    public static DetectorKind fromConfigName(String type) {
        String normalized = type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
        for (DetectorKind kind : values()) {
            if (kind.configName.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown detector type: '" + type
                + "'. Supported types: " + supportedNames());
    }

    public static String supportedNames() {
        return Arrays.stream(values()).map(DetectorKind::getConfigName).collect(Collectors.joining(", "));
    }
}
