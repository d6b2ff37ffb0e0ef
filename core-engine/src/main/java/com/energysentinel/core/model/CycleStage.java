package com.energysentinel.core.model;

/**
 * Stages of a retraining cycle, in execution order.
 */
public enum CycleStage {
    FETCH,
    VALIDATE,
    PREPROCESS,
    TRAIN,
    EVALUATE,
    COMPARE,
    PERSIST,
    CLEANUP,
    NOTIFY
}
