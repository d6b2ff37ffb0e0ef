package com.energysentinel.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the retraining orchestrator.
 */
public class PipelineSettings {

    /** Rolling window fetched for each retraining cycle. */
    private int trainingWindowDays = 90;

    /** Threads shared by parallel forecaster training and detector runs. */
    private int workerThreads = 4;

    /** Delays between retries of store and notifier calls, in seconds. */
    private List<Integer> retryDelaysSeconds = new ArrayList<>(List.of(60, 300, 900));

    void collectErrors(List<String> errors) {
        if (trainingWindowDays < 1) {
            errors.add("pipeline.trainingWindowDays must be >= 1");
        }
        if (workerThreads < 1) {
            errors.add("pipeline.workerThreads must be >= 1");
        }
        if (retryDelaysSeconds == null) {
            errors.add("pipeline.retryDelaysSeconds must not be null");
        } else if (retryDelaysSeconds.stream().anyMatch(d -> d == null || d < 0)) {
            errors.add("pipeline.retryDelaysSeconds must contain only non-negative values");
        }
    }

    public int getTrainingWindowDays() {
        return trainingWindowDays;
    }

    public void setTrainingWindowDays(int trainingWindowDays) {
        this.trainingWindowDays = trainingWindowDays;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public List<Integer> getRetryDelaysSeconds() {
        return retryDelaysSeconds;
    }

    public void setRetryDelaysSeconds(List<Integer> retryDelaysSeconds) {
        this.retryDelaysSeconds = retryDelaysSeconds;
    }
}
