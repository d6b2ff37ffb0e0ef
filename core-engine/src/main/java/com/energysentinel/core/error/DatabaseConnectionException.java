package com.energysentinel.core.error;

/**
 * Raised by {@link com.energysentinel.core.store.TimeSeriesStore}
 * implementations when the backing store cannot be reached.
 */
public class DatabaseConnectionException extends EngineException {

    private static final long serialVersionUID = 1L;

    public DatabaseConnectionException(String message) {
        super(ErrorKind.DATABASE_CONNECTION, message);
    }

    public DatabaseConnectionException(String message, Throwable cause) {
        super(ErrorKind.DATABASE_CONNECTION, message, cause);
    }
}
