package com.energysentinel.core.error;

/**
 * Raised when a window is malformed: out-of-order or duplicate timestamps,
 * unparseable values, or missing required columns.
 */
public class DataValidationException extends EngineException {

    private static final long serialVersionUID = 1L;

    public DataValidationException(String message) {
        super(ErrorKind.DATA_VALIDATION, message);
    }

    public DataValidationException(String message, Throwable cause) {
        super(ErrorKind.DATA_VALIDATION, message, cause);
    }
}
