package com.energysentinel.core.error;

import java.util.Objects;

/**
 * Raised when a forecaster or detector cannot be fitted.
 *
 * <p>
 * The originating component is attached so that the notification layer can
 * report which part of the ensemble degraded.
 * </p>
 */
public class ModelTrainingException extends EngineException {

    private static final long serialVersionUID = 1L;

    private final String component;

    public ModelTrainingException(String component, String message) {
        super(ErrorKind.MODEL_TRAINING, message);
        this.component = Objects.requireNonNull(component, "component must not be null");
    }

    public ModelTrainingException(String component, String message, Throwable cause) {
        super(ErrorKind.MODEL_TRAINING, message, cause);
        this.component = Objects.requireNonNull(component, "component must not be null");
    }

    @Override
    public String getComponent() {
        return component;
    }
}
