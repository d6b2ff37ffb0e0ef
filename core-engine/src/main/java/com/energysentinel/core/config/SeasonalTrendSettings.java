package com.energysentinel.core.config;

import java.util.List;
import java.util.Locale;

/**
 * Hyper-parameters of a seasonal-trend forecaster.
 *
 * <p>
 * Prior scales follow the usual convention: a larger scale means a weaker
 * penalty and therefore a more flexible fit.
 * </p>
 */
public class SeasonalTrendSettings {

    private int changepoints = 25;
    private double changepointPriorScale = 0.05;
    private double changepointRange = 0.8;
    private double seasonalityPriorScale = 10.0;
    private String seasonalityMode = "additive";
    private int dailyOrder = 4;
    private int weeklyOrder = 3;

    public SeasonalTrendSettings() {
    }

    /**
     * Defaults for the enhanced variant: more changepoints, a looser trend
     * and multiplicative seasonality.
     */
    public static SeasonalTrendSettings enhancedDefaults() {
        SeasonalTrendSettings s = new SeasonalTrendSettings();
        s.setChangepoints(50);
        s.setChangepointPriorScale(0.1);
        s.setSeasonalityPriorScale(15.0);
        s.setSeasonalityMode("multiplicative");
        return s;
    }

    void collectErrors(String prefix, List<String> errors) {
        if (changepoints < 0) {
            errors.add(prefix + ".changepoints must be >= 0");
        }
        if (changepointPriorScale <= 0 || seasonalityPriorScale <= 0) {
            errors.add(prefix + " prior scales must be > 0");
        }
        if (changepointRange <= 0 || changepointRange > 1) {
            errors.add(prefix + ".changepointRange must be in (0, 1]");
        }
        if (!"additive".equals(seasonalityMode) && !"multiplicative".equals(seasonalityMode)) {
            errors.add(prefix + ".seasonalityMode must be 'additive' or 'multiplicative', got: '"
                    + seasonalityMode + "'");
        }
        if (dailyOrder < 0 || weeklyOrder < 0) {
            errors.add(prefix + " Fourier orders must be >= 0");
        }
    }

    public boolean isMultiplicative() {
        return "multiplicative".equals(seasonalityMode);
    }

    public int getChangepoints() {
        return changepoints;
    }

    public void setChangepoints(int changepoints) {
        this.changepoints = changepoints;
    }

    public double getChangepointPriorScale() {
        return changepointPriorScale;
    }

    public void setChangepointPriorScale(double changepointPriorScale) {
        this.changepointPriorScale = changepointPriorScale;
    }

    public double getChangepointRange() {
        return changepointRange;
    }

    public void setChangepointRange(double changepointRange) {
        this.changepointRange = changepointRange;
    }

    public double getSeasonalityPriorScale() {
        return seasonalityPriorScale;
    }

    public void setSeasonalityPriorScale(double seasonalityPriorScale) {
        this.seasonalityPriorScale = seasonalityPriorScale;
    }

    public String getSeasonalityMode() {
        return seasonalityMode;
    }

    public void setSeasonalityMode(String seasonalityMode) {
        this.seasonalityMode = seasonalityMode != null ? seasonalityMode.toLowerCase(Locale.ROOT) : null;
    }

    public int getDailyOrder() {
        return dailyOrder;
    }

    public void setDailyOrder(int dailyOrder) {
        this.dailyOrder = dailyOrder;
    }

    public int getWeeklyOrder() {
        return weeklyOrder;
    }

    public void setWeeklyOrder(int weeklyOrder) {
        this.weeklyOrder = weeklyOrder;
    }
}
