package com.energysentinel.core.model;

/**
 * Outcome of comparing a newly trained ensemble with the incumbent.
 *
 * <p>
 * Persisted in the training history; the constant names are part of the
 * on-disk format.
 * </p>
 */
public enum Decision {

    /** No previous training exists; the new model is always promoted. */
    FIRST_TRAINING,

    /** Both MAE and RMSE improved; the new model becomes current best. */
    KEEP_NEW,

    /** The new model is not better but within degradation limits. */
    KEEP_OLD,

    /** The new model degraded beyond the configured limits. */
    ROLLBACK_OLD;

    /**
     * @return {@code true} if the new model should replace the current best
     */
    public boolean promotesNewModel() {
        return this == FIRST_TRAINING || this == KEEP_NEW;
    }
}
