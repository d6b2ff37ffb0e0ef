package com.energysentinel.core.config;

import java.util.List;

/**
 * Thresholds of the data quality gate.
 */
public class QualitySettings {

    private int minCoverageDays = 30;
    private double maxNullPercentage = 5.0;
    private double minVoltage = 200.0;
    private double maxVoltage = 250.0;
    private double minPower = 0.0;
    private double maxPower = 10.0;
    private double gapWarningHours = 6.0;

    void collectErrors(List<String> errors) {
        if (minCoverageDays < 0) {
            errors.add("quality.minCoverageDays must be >= 0");
        }
        if (maxNullPercentage < 0 || maxNullPercentage > 100) {
            errors.add("quality.maxNullPercentage must be in [0, 100]");
        }
        if (minVoltage > maxVoltage) {
            errors.add("quality.minVoltage must not exceed quality.maxVoltage");
        }
        if (minPower > maxPower) {
            errors.add("quality.minPower must not exceed quality.maxPower");
        }
        if (gapWarningHours <= 0) {
            errors.add("quality.gapWarningHours must be > 0");
        }
    }

    public int getMinCoverageDays() {
        return minCoverageDays;
    }

    public void setMinCoverageDays(int minCoverageDays) {
        this.minCoverageDays = minCoverageDays;
    }

    public double getMaxNullPercentage() {
        return maxNullPercentage;
    }

    public void setMaxNullPercentage(double maxNullPercentage) {
        this.maxNullPercentage = maxNullPercentage;
    }

    public double getMinVoltage() {
        return minVoltage;
    }

    public void setMinVoltage(double minVoltage) {
        this.minVoltage = minVoltage;
    }

    public double getMaxVoltage() {
        return maxVoltage;
    }

    public void setMaxVoltage(double maxVoltage) {
        this.maxVoltage = maxVoltage;
    }

    public double getMinPower() {
        return minPower;
    }

    public void setMinPower(double minPower) {
        this.minPower = minPower;
    }

    public double getMaxPower() {
        return maxPower;
    }

    public void setMaxPower(double maxPower) {
        this.maxPower = maxPower;
    }

    public double getGapWarningHours() {
        return gapWarningHours;
    }

    public void setGapWarningHours(double gapWarningHours) {
        this.gapWarningHours = gapWarningHours;
    }
}
