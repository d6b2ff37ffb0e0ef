package com.energysentinel.core.config;

import java.util.List;

/**
 * Promotion and retention rules of the model version registry.
 */
public class RegistrySettings {

    /** Versioned artifacts kept per forecaster kind. */
    private int retainVersions = 10;

    /** MAE degradation (percent) beyond which the new model is rolled back. */
    private double maeDegradationPct = 10.0;

    /** RMSE degradation (percent) beyond which the new model is rolled back. */
    private double rmseDegradationPct = 15.0;

    void collectErrors(List<String> errors) {
        if (retainVersions < 1) {
            errors.add("registry.retainVersions must be >= 1");
        }
        if (maeDegradationPct < 0 || rmseDegradationPct < 0) {
            errors.add("registry degradation thresholds must be >= 0");
        }
    }

    public int getRetainVersions() {
        return retainVersions;
    }

    public void setRetainVersions(int retainVersions) {
        this.retainVersions = retainVersions;
    }

    public double getMaeDegradationPct() {
        return maeDegradationPct;
    }

    public void setMaeDegradationPct(double maeDegradationPct) {
        this.maeDegradationPct = maeDegradationPct;
    }

    public double getRmseDegradationPct() {
        return rmseDegradationPct;
    }

    public void setRmseDegradationPct(double rmseDegradationPct) {
        this.rmseDegradationPct = rmseDegradationPct;
    }
}
