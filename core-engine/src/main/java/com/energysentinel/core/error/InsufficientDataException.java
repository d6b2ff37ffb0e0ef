package com.energysentinel.core.error;

/**
 * Raised when there is not yet enough data to train or detect.
 */
public class InsufficientDataException extends EngineException {

    private static final long serialVersionUID = 1L;

    public InsufficientDataException(String message) {
        super(ErrorKind.INSUFFICIENT_DATA, message);
    }
}
