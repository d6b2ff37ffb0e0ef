package com.energysentinel.core.config;

import java.util.List;

/**
 * Settings of the forecast ensemble.
 */
public class ForecastSettings {

    /** Length of the held-out evaluation tail. */
    private int evaluationDays = 7;

    /** Default forecast horizon. */
    private int horizonDays = 7;

    /** Confidence level of prediction intervals (0.95 or 0.99). */
    private double confidenceLevel = 0.95;

    /** Minimum blending weight per forecaster. */
    private double weightFloor = 0.2;

    /** MAPE assumed for a forecaster without evaluation metrics. */
    private double defaultMape = 20.0;

    private SeasonalTrendSettings seasonalTrend = new SeasonalTrendSettings();
    private SeasonalTrendSettings enhancedSeasonal = SeasonalTrendSettings.enhancedDefaults();
    private ArimaSettings autoregressive = new ArimaSettings();

    void collectErrors(List<String> errors) {
        if (evaluationDays < 1) {
            errors.add("forecast.evaluationDays must be >= 1");
        }
        if (horizonDays < 1) {
            errors.add("forecast.horizonDays must be >= 1");
        }
        if (confidenceLevel != 0.95 && confidenceLevel != 0.99) {
            errors.add("forecast.confidenceLevel must be 0.95 or 0.99, got: " + confidenceLevel);
        }
        if (weightFloor < 0 || weightFloor * 3 > 1) {
            errors.add("forecast.weightFloor must be in [0, 1/3] for three forecasters");
        }
        if (defaultMape <= 0) {
            errors.add("forecast.defaultMape must be > 0");
        }
        if (seasonalTrend == null || enhancedSeasonal == null || autoregressive == null) {
            errors.add("forecast sections 'seasonalTrend', 'enhancedSeasonal' and 'autoregressive' must not be null");
            return;
        }
        seasonalTrend.collectErrors("forecast.seasonalTrend", errors);
        enhancedSeasonal.collectErrors("forecast.enhancedSeasonal", errors);
        autoregressive.collectErrors(errors);
    }

    public int getEvaluationDays() {
        return evaluationDays;
    }

    public void setEvaluationDays(int evaluationDays) {
        this.evaluationDays = evaluationDays;
    }

    public int getHorizonDays() {
        return horizonDays;
    }

    public void setHorizonDays(int horizonDays) {
        this.horizonDays = horizonDays;
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    public void setConfidenceLevel(double confidenceLevel) {
        this.confidenceLevel = confidenceLevel;
    }

    public double getWeightFloor() {
        return weightFloor;
    }

    public void setWeightFloor(double weightFloor) {
        this.weightFloor = weightFloor;
    }

    public double getDefaultMape() {
        return defaultMape;
    }

    public void setDefaultMape(double defaultMape) {
        this.defaultMape = defaultMape;
    }

    public SeasonalTrendSettings getSeasonalTrend() {
        return seasonalTrend;
    }

    public void setSeasonalTrend(SeasonalTrendSettings seasonalTrend) {
        this.seasonalTrend = seasonalTrend;
    }

    public SeasonalTrendSettings getEnhancedSeasonal() {
        return enhancedSeasonal;
    }

    public void setEnhancedSeasonal(SeasonalTrendSettings enhancedSeasonal) {
        this.enhancedSeasonal = enhancedSeasonal;
    }

    public ArimaSettings getAutoregressive() {
        return autoregressive;
    }

    public void setAutoregressive(ArimaSettings autoregressive) {
        this.autoregressive = autoregressive;
    }
}
