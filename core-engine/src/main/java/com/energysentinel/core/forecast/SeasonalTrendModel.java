package com.energysentinel.core.forecast;

import com.energysentinel.core.model.ForecasterKind;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * Fitted seasonal-trend model: a piecewise-linear trend plus Fourier daily and
 * weekly seasonality, combined additively or multiplicatively.
 *
 * <p>
 * Time is scaled so that the training series spans {@code t ∈ [0, 1]}; the
 * trend extrapolates linearly beyond the last changepoint. Values are fitted
 * on {@code y / scale} and rescaled on prediction.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeasonalTrendModel implements FittedForecaster {

    /** Monday 00:00, the phase origin of the weekly terms. */
    private static final LocalDateTime PHASE_ORIGIN = LocalDateTime.of(2000, 1, 3, 0, 0);
    private static final double DAY_HOURS = 24.0;
    private static final double WEEK_HOURS = 168.0;

    private final ForecasterKind kind;
    private final LocalDateTime trainingStart;
    private final LocalDateTime trainingEnd;
    private final double spanHours;
    private final double scale;
    private final boolean multiplicative;
    private final double[] changepoints;
    private final int dailyOrder;
    private final int weeklyOrder;
    private final double[] trendCoefficients;
    private final double[] seasonalCoefficients;
    private final double residualStdDev;

    @JsonCreator
    public SeasonalTrendModel(
            @JsonProperty("kind") ForecasterKind kind,
            @JsonProperty("training_start") LocalDateTime trainingStart,
            @JsonProperty("training_end") LocalDateTime trainingEnd,
            @JsonProperty("span_hours") double spanHours,
            @JsonProperty("scale") double scale,
            @JsonProperty("multiplicative") boolean multiplicative,
            @JsonProperty("changepoints") double[] changepoints,
            @JsonProperty("daily_order") int dailyOrder,
            @JsonProperty("weekly_order") int weeklyOrder,
            @JsonProperty("trend_coefficients") double[] trendCoefficients,
            @JsonProperty("seasonal_coefficients") double[] seasonalCoefficients,
            @JsonProperty("residual_std_dev") double residualStdDev) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.trainingStart = Objects.requireNonNull(trainingStart, "trainingStart must not be null");
        this.trainingEnd = Objects.requireNonNull(trainingEnd, "trainingEnd must not be null");
        this.spanHours = spanHours;
        this.scale = scale;
        this.multiplicative = multiplicative;
        this.changepoints = Objects.requireNonNull(changepoints, "changepoints must not be null").clone();
        this.dailyOrder = dailyOrder;
        this.weeklyOrder = weeklyOrder;
        this.trendCoefficients = trendCoefficients.clone();
        this.seasonalCoefficients = seasonalCoefficients.clone();
        this.residualStdDev = residualStdDev;
        if (this.trendCoefficients.length != 2 + this.changepoints.length) {
            throw new IllegalArgumentException("Expected " + (2 + this.changepoints.length)
                    + " trend coefficients, got " + this.trendCoefficients.length);
        }
        if (this.seasonalCoefficients.length != 2 * (dailyOrder + weeklyOrder)) {
            throw new IllegalArgumentException("Expected " + 2 * (dailyOrder + weeklyOrder)
                    + " seasonal coefficients, got " + this.seasonalCoefficients.length);
        }
    }

    // ---------------------------------------------------------------
    // Prediction
    // ---------------------------------------------------------------

    @Override
    public double[] predictAt(List<LocalDateTime> hours) {
        double[] out = new double[hours.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = predict(hours.get(i));
        }
        return out;
    }

    double predict(LocalDateTime ts) {
        double trend = dot(trendRow(scaledTime(ts), changepoints), trendCoefficients);
        double seasonal = dot(seasonalRow(ts, dailyOrder, weeklyOrder), seasonalCoefficients);
        double scaled = multiplicative ? trend * (1 + seasonal) : trend + seasonal;
        return scaled * scale;
    }

    double scaledTime(LocalDateTime ts) {
        return ChronoUnit.MINUTES.between(trainingStart, ts) / 60.0 / spanHours;
    }

    // ---------------------------------------------------------------
    // Design rows, shared with the forecaster
    // ---------------------------------------------------------------

    static double[] trendRow(double t, double[] changepoints) {
        double[] row = new double[2 + changepoints.length];
        row[0] = 1.0;
        row[1] = t;
        for (int j = 0; j < changepoints.length; j++) {
            row[2 + j] = Math.max(0.0, t - changepoints[j]);
        }
        return row;
    }

    static double[] seasonalRow(LocalDateTime ts, int dailyOrder, int weeklyOrder) {
        double hours = ChronoUnit.MINUTES.between(PHASE_ORIGIN, ts) / 60.0;
        double[] row = new double[2 * (dailyOrder + weeklyOrder)];
        int c = 0;
        for (int k = 1; k <= dailyOrder; k++) {
            double angle = 2 * Math.PI * k * hours / DAY_HOURS;
            row[c++] = Math.sin(angle);
            row[c++] = Math.cos(angle);
        }
        for (int k = 1; k <= weeklyOrder; k++) {
            double angle = 2 * Math.PI * k * hours / WEEK_HOURS;
            row[c++] = Math.sin(angle);
            row[c++] = Math.cos(angle);
        }
        return row;
    }

    static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @Override
    @JsonProperty("kind")
    public ForecasterKind getKind() {
        return kind;
    }

    @Override
    @JsonProperty("training_start")
    public LocalDateTime getTrainingStart() {
        return trainingStart;
    }

    @Override
    @JsonProperty("training_end")
    public LocalDateTime getTrainingEnd() {
        return trainingEnd;
    }

    @JsonProperty("span_hours")
    public double getSpanHours() {
        return spanHours;
    }

    @JsonProperty("scale")
    public double getScale() {
        return scale;
    }

    @JsonProperty("multiplicative")
    public boolean isMultiplicative() {
        return multiplicative;
    }

    @JsonProperty("changepoints")
    public double[] getChangepoints() {
        return changepoints.clone();
    }

    @JsonProperty("daily_order")
    public int getDailyOrder() {
        return dailyOrder;
    }

    @JsonProperty("weekly_order")
    public int getWeeklyOrder() {
        return weeklyOrder;
    }

    @JsonProperty("trend_coefficients")
    public double[] getTrendCoefficients() {
        return trendCoefficients.clone();
    }

    @JsonProperty("seasonal_coefficients")
    public double[] getSeasonalCoefficients() {
        return seasonalCoefficients.clone();
    }

    @Override
    @JsonProperty("residual_std_dev")
    public double getResidualStdDev() {
        return residualStdDev;
    }

    @Override
    public String toString() {
        return "SeasonalTrendModel{" +
                "kind=" + kind +
                ", changepoints=" + changepoints.length +
                ", dailyOrder=" + dailyOrder +
                ", weeklyOrder=" + weeklyOrder +
                ", multiplicative=" + multiplicative +
                ", residualStdDev=" + String.format("%.4f", residualStdDev) +
                '}';
    }
}
