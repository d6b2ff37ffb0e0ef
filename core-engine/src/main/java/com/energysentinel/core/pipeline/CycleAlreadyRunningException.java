package com.energysentinel.core.pipeline;

/**
 * Thrown when a run is requested for a job id that is already running.
 */
public class CycleAlreadyRunningException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public CycleAlreadyRunningException(String jobId) {
        super("A run for job '" + jobId + "' is already in progress");
    }
}
