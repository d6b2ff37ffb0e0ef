package com.energysentinel.core.pipeline;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Allows at most one in-flight run per job id.
 */
public class SingleFlightGuard {

    private final Set<String> running = ConcurrentHashMap.newKeySet();

    /**
     * @throws CycleAlreadyRunningException if the job id is already held
     */
    public void acquire(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        if (!running.add(jobId)) {
            throw new CycleAlreadyRunningException(jobId);
        }
    }

    public void release(String jobId) {
        running.remove(jobId);
    }

    public boolean isRunning(String jobId) {
        return running.contains(jobId);
    }
}
