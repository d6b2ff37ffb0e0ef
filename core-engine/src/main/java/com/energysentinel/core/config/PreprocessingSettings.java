package com.energysentinel.core.config;

import java.util.List;

/**
 * Parameters of the preprocessor.
 */
public class PreprocessingSettings {

    /** Values further than this many standard deviations from the mean are replaced by the mean. */
    private double outlierStdDevs = 3.0;

    /** Gaps longer than this trigger resampling of the whole window. */
    private double resampleGapHours = 1.0;

    /** Bucket size used when resampling. */
    private int resampleMinutes = 1;

    void collectErrors(List<String> errors) {
        if (outlierStdDevs <= 0) {
            errors.add("preprocessing.outlierStdDevs must be > 0");
        }
        if (resampleGapHours <= 0) {
            errors.add("preprocessing.resampleGapHours must be > 0");
        }
        if (resampleMinutes < 1) {
            errors.add("preprocessing.resampleMinutes must be >= 1");
        }
    }

    public double getOutlierStdDevs() {
        return outlierStdDevs;
    }

    public void setOutlierStdDevs(double outlierStdDevs) {
        this.outlierStdDevs = outlierStdDevs;
    }

    public double getResampleGapHours() {
        return resampleGapHours;
    }

    public void setResampleGapHours(double resampleGapHours) {
        this.resampleGapHours = resampleGapHours;
    }

    public int getResampleMinutes() {
        return resampleMinutes;
    }

    public void setResampleMinutes(int resampleMinutes) {
        this.resampleMinutes = resampleMinutes;
    }
}
