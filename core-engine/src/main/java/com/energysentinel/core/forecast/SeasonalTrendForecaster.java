package com.energysentinel.core.forecast;

import com.energysentinel.core.config.SeasonalTrendSettings;
import com.energysentinel.core.error.ModelTrainingException;
import com.energysentinel.core.model.ForecasterKind;
import com.energysentinel.core.stats.LinearAlgebra;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Seasonal-trend forecaster.
 *
 * <h3>Model</h3>
 * <p>
 * {@code y(t) = g(t) + s(t)} (additive) or {@code y(t) = g(t) · (1 + s(t))}
 * (multiplicative), where {@code g} is a piecewise-linear trend with
 * changepoints spread uniformly over the first part of the history and
 * {@code s} is a sum of Fourier terms with daily and weekly periods. Weekly
 * terms are only used once the series covers two weeks.
 * </p>
 *
 * <h3>Fitting</h3>
 * <p>
 * Coefficients are estimated by penalised least squares. Each prior scale
 * {@code τ} becomes a ridge penalty {@code σ² / τ²} on its coefficients, with
 * {@code σ²} a fixed noise variance on the scaled series, so a small
 * changepoint prior keeps the trend stiff. The multiplicative mode fits the
 * trend first and then the seasonal factor on the detrended ratio.
 * </p>
 *
 * <p>
 * The same class backs both the stable {@link ForecasterKind#SEASONAL_TREND}
 * and the {@link ForecasterKind#ENHANCED_SEASONAL} variant; only the settings
 * differ.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalTrendForecaster implements Forecaster {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalTrendForecaster.class);

    /** Assumed residual variance of the series scaled to max |y| = 1. */
    static final double NOISE_VARIANCE = 0.01;

    /** Near-zero penalty keeping intercept and slope identifiable. */
    private static final double BASE_PENALTY = 1e-8;

    private static final int MIN_HOURS_DAILY = 48;
    private static final int MIN_HOURS_WEEKLY = 14 * 24;

    private final ForecasterKind kind;
    private final SeasonalTrendSettings settings;

    public SeasonalTrendForecaster(ForecasterKind kind, SeasonalTrendSettings settings) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.settings = Objects.requireNonNull(settings, "SeasonalTrendSettings must not be null");
        if (kind == ForecasterKind.AUTOREGRESSIVE) {
            throw new IllegalArgumentException("SeasonalTrendForecaster cannot act as " + kind);
        }
    }

    @Override
    public ForecasterKind getKind() {
        return kind;
    }

    @Override
    public FittedForecaster fit(HourlySeries series) {
        Objects.requireNonNull(series, "series must not be null");
        int n = series.size();
        if (n < 3) {
            throw new ModelTrainingException(kind.name(), "Seasonal-trend fit needs at least 3 hourly points, got " + n);
        }

        double[] y = series.values();
        double scale = 0;
        for (double v : y) {
            scale = Math.max(scale, Math.abs(v));
        }
        if (scale == 0) {
            scale = 1.0;
        }
        double[] ys = new double[n];
        for (int i = 0; i < n; i++) {
            ys[i] = y[i] / scale;
        }

        double spanHours = n - 1;
        double[] t = new double[n];
        for (int i = 0; i < n; i++) {
            t[i] = i / spanHours;
        }
        double[] changepoints = placeChangepoints(t);
        int dailyOrder = n >= MIN_HOURS_DAILY ? settings.getDailyOrder() : 0;
        int weeklyOrder = n >= MIN_HOURS_WEEKLY ? settings.getWeeklyOrder() : 0;

        double[][] trendRows = new double[n][];
        double[][] seasonalRows = new double[n][];
        for (int i = 0; i < n; i++) {
            trendRows[i] = SeasonalTrendModel.trendRow(t[i], changepoints);
            seasonalRows[i] = SeasonalTrendModel.seasonalRow(series.hourAt(i), dailyOrder, weeklyOrder);
        }

        double changepointPenalty = NOISE_VARIANCE / square(settings.getChangepointPriorScale());
        double seasonalPenalty = NOISE_VARIANCE / square(settings.getSeasonalityPriorScale());
        int trendCols = 2 + changepoints.length;
        int seasonalCols = seasonalRows[0].length;

        double[] trendCoefficients;
        double[] seasonalCoefficients;
        try {
            if (settings.isMultiplicative()) {
                trendCoefficients = LinearAlgebra.ridge(trendRows, ys, trendPenalties(trendCols, changepointPenalty));
                seasonalCoefficients = fitSeasonalRatio(ys, trendRows, trendCoefficients, seasonalRows,
                        seasonalPenalty);
            } else {
                double[][] design = new double[n][];
                for (int i = 0; i < n; i++) {
                    design[i] = concat(trendRows[i], seasonalRows[i]);
                }
                double[] penalties = concat(trendPenalties(trendCols, changepointPenalty),
                        constant(seasonalCols, seasonalPenalty));
                double[] coefficients = LinearAlgebra.ridge(design, ys, penalties);
                trendCoefficients = slice(coefficients, 0, trendCols);
                seasonalCoefficients = slice(coefficients, trendCols, trendCols + seasonalCols);
            }
        } catch (ArithmeticException e) {
            throw new ModelTrainingException(kind.name(), "Seasonal-trend fit did not converge: " + e.getMessage(), e);
        }

        SeasonalTrendModel provisional = new SeasonalTrendModel(kind, series.getStart(), series.getEnd(),
                spanHours, scale, settings.isMultiplicative(), changepoints, dailyOrder, weeklyOrder,
                trendCoefficients, seasonalCoefficients, 0.0);
        double[] fitted = provisional.predictAt(series.hours());
        double sse = 0;
        for (int i = 0; i < n; i++) {
            double r = y[i] - fitted[i];
            sse += r * r;
        }
        double residualStdDev = Math.sqrt(sse / (n - 1));
        if (!Double.isFinite(residualStdDev)) {
            throw new ModelTrainingException(kind.name(), "Seasonal-trend fit produced non-finite residuals");
        }

        LOG.debug("{} fitted on {} hours: {} changepoints, daily order {}, weekly order {}, residual sd {}",
                kind, n, changepoints.length, dailyOrder, weeklyOrder, residualStdDev);
        return new SeasonalTrendModel(kind, series.getStart(), series.getEnd(), spanHours, scale,
                settings.isMultiplicative(), changepoints, dailyOrder, weeklyOrder,
                trendCoefficients, seasonalCoefficients, residualStdDev);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Changepoints at evenly spaced observed times within the first
     * {@code changepointRange} of the history, excluding the first point.
     */
    double[] placeChangepoints(double[] t) {
        int historySize = (int) Math.floor(t.length * settings.getChangepointRange());
        int count = Math.min(settings.getChangepoints(), historySize - 1);
        if (count <= 0) {
            return new double[0];
        }
        List<Double> points = new ArrayList<>();
        for (int j = 1; j <= count; j++) {
            int index = (int) Math.round((double) j * (historySize - 1) / count);
            double value = t[index];
            if (points.isEmpty() || points.get(points.size() - 1) < value) {
                points.add(value);
            }
        }
        return points.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static double[] fitSeasonalRatio(double[] ys, double[][] trendRows, double[] trendCoefficients,
            double[][] seasonalRows, double seasonalPenalty) {
        int seasonalCols = seasonalRows[0].length;
        if (seasonalCols == 0) {
            return new double[0];
        }
        List<double[]> rows = new ArrayList<>();
        List<Double> targets = new ArrayList<>();
        for (int i = 0; i < ys.length; i++) {
            double trend = SeasonalTrendModel.dot(trendRows[i], trendCoefficients);
            if (Math.abs(trend) > 1e-6) {
                rows.add(seasonalRows[i]);
                targets.add(ys[i] / trend - 1.0);
            }
        }
        if (rows.isEmpty()) {
            return new double[seasonalCols];
        }
        double[] target = targets.stream().mapToDouble(Double::doubleValue).toArray();
        return LinearAlgebra.ridge(rows.toArray(new double[0][]), target, constant(seasonalCols, seasonalPenalty));
    }

    private static double[] trendPenalties(int trendCols, double changepointPenalty) {
        double[] penalties = constant(trendCols, changepointPenalty);
        penalties[0] = BASE_PENALTY;
        penalties[1] = BASE_PENALTY;
        return penalties;
    }

    private static double[] constant(int length, double value) {
        double[] out = new double[length];
        Arrays.fill(out, value);
        return out;
    }

    private static double[] concat(double[] a, double[] b) {
        double[] out = new double[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    private static double[] slice(double[] values, int from, int to) {
        double[] out = new double[to - from];
        System.arraycopy(values, from, out, 0, out.length);
        return out;
    }

    private static double square(double v) {
        return v * v;
    }
}
