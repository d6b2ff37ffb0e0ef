package com.energysentinel.core.error;

/**
 * Stable error categories reported with every failed cycle or detection pass.
 *
 * <p>
 * The names are part of the contract with the notification layer and must not
 * be renamed.
 * </p>
 *
 * @since 1.0.0
 */
public enum ErrorKind {

    /** Malformed window or missing required columns. Never retried. */
    DATA_VALIDATION(false),

    /** Not enough data yet. Retried on the next scheduled cadence only. */
    INSUFFICIENT_DATA(false),

    /** Time-series store unreachable. Retried with backoff. */
    DATABASE_CONNECTION(true),

    /** A forecaster or detector failed to fit. */
    MODEL_TRAINING(false),

    /** Reading or writing model artifacts or the training history failed. */
    ARTIFACT_STORAGE(false),

    /** Any failure that does not belong to one of the categories above. */
    INTERNAL(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * @return {@code true} if calls failing with this kind may be retried
     *         within the same cycle
     */
    public boolean isRetryable() {
        return retryable;
    }
}
