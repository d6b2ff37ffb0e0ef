package com.energysentinel.core.forecast;

import com.energysentinel.core.config.ArimaSettings;
import com.energysentinel.core.error.ModelTrainingException;
import com.energysentinel.core.model.ForecasterKind;
import com.energysentinel.core.stats.LinearAlgebra;
import com.energysentinel.core.stats.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Autoregressive forecaster: ARIMA(p,d,q) with the order chosen by an
 * exhaustive grid search minimising the Akaike Information Criterion.
 *
 * <h3>Estimation</h3>
 * <p>
 * Each candidate order is estimated with the two-stage Hannan-Rissanen
 * procedure: a long autoregression supplies residual estimates, then the
 * differenced series is regressed on its own lags and the lagged residuals.
 * The log-likelihood is evaluated on the conditional residuals. Orders whose
 * estimation is singular or whose residual recursion diverges are skipped.
 * </p>
 *
 * <h3>Fallback</h3>
 * <p>
 * If no order in the grid can be estimated, ARIMA(1,1,1) is tried; if that
 * fails too a {@link ModelTrainingException} is raised.
 * </p>
 *
 * @since 1.0.0
 */
public class ArimaForecaster implements Forecaster {

    private static final Logger LOG = LoggerFactory.getLogger(ArimaForecaster.class);

    private static final int[] FALLBACK_ORDER = {1, 1, 1};
    private static final int MIN_OBSERVATIONS = 20;
    private static final double DIVERGENCE_FACTOR = 1e6;
    private static final double MIN_VARIANCE = 1e-12;

    private final ArimaSettings settings;

    public ArimaForecaster(ArimaSettings settings) {
        this.settings = Objects.requireNonNull(settings, "ArimaSettings must not be null");
    }

    @Override
    public ForecasterKind getKind() {
        return ForecasterKind.AUTOREGRESSIVE;
    }

    @Override
    public FittedForecaster fit(HourlySeries series) {
        Objects.requireNonNull(series, "series must not be null");
        ArimaModel best = null;
        int attempted = 0;
        int failed = 0;
        for (int d = 0; d <= settings.getMaxD(); d++) {
            for (int p = 0; p <= settings.getMaxP(); p++) {
                for (int q = 0; q <= settings.getMaxQ(); q++) {
                    attempted++;
                    try {
                        ArimaModel candidate = estimate(series, p, d, q);
                        LOG.trace("ARIMA({},{},{}) AIC={}", p, d, q, candidate.getAic());
                        if (best == null || candidate.getAic() < best.getAic()) {
                            best = candidate;
                        }
                    } catch (ArithmeticException | IllegalStateException e) {
                        failed++;
                        LOG.trace("ARIMA({},{},{}) skipped: {}", p, d, q, e.getMessage());
                    }
                }
            }
        }

        if (best == null) {
            LOG.warn("All {} ARIMA orders failed, falling back to ({},{},{})", attempted,
                    FALLBACK_ORDER[0], FALLBACK_ORDER[1], FALLBACK_ORDER[2]);
            return estimateOrFail(series, FALLBACK_ORDER[0], FALLBACK_ORDER[1], FALLBACK_ORDER[2]);
        }
        LOG.info("Selected ARIMA({},{},{}) with AIC {} ({} of {} orders estimated)",
                best.getP(), best.getD(), best.getQ(), String.format("%.2f", best.getAic()),
                attempted - failed, attempted);
        return best;
    }

    @Override
    public FittedForecaster refit(HourlySeries series, FittedForecaster template) {
        if (template instanceof ArimaModel order) {
            return estimateOrFail(series, order.getP(), order.getD(), order.getQ());
        }
        return fit(series);
    }

    // ---------------------------------------------------------------
    // Estimation
    // ---------------------------------------------------------------

    private ArimaModel estimateOrFail(HourlySeries series, int p, int d, int q) {
        try {
            return estimate(series, p, d, q);
        } catch (ArithmeticException | IllegalStateException e) {
            throw new ModelTrainingException(getKind().name(),
                    "ARIMA(" + p + "," + d + "," + q + ") could not be estimated: " + e.getMessage(), e);
        }
    }

    /**
     * Estimate one order.
     *
     * @throws ArithmeticException   if a regression is singular
     * @throws IllegalStateException if the series is too short or the residual
     *                               recursion diverges
     */
    static ArimaModel estimate(HourlySeries series, int p, int d, int q) {
        double[] y = series.values();
        double[] x = difference(y, d);
        int m = x.length;
        if (m < p + q + MIN_OBSERVATIONS) {
            throw new IllegalStateException("series too short: " + m + " differenced points");
        }

        double mean = d == 0 ? Stats.mean(x) : 0.0;
        double[] z = new double[m];
        for (int t = 0; t < m; t++) {
            z[t] = x[t] - mean;
        }

        double[] coefficients = regressArma(z, p, q);
        double[] ar = Arrays.copyOfRange(coefficients, 0, p);
        double[] ma = Arrays.copyOfRange(coefficients, p, p + q);

        double[] residuals = conditionalResiduals(z, ar, ma);
        double sse = 0;
        double maxAbs = 0;
        for (int t = p; t < m; t++) {
            sse += residuals[t] * residuals[t];
            maxAbs = Math.max(maxAbs, Math.abs(residuals[t]));
        }
        double scaleOfSeries = Stats.sampleStdDev(z);
        if (!Double.isFinite(sse) || maxAbs > DIVERGENCE_FACTOR * (scaleOfSeries + 1e-9)) {
            throw new IllegalStateException("residual recursion diverged");
        }

        int effective = m - p;
        double sigma2 = Math.max(sse / effective, MIN_VARIANCE);
        double logLikelihood = -effective / 2.0 * (Math.log(2 * Math.PI * sigma2) + 1);
        int parameters = p + q + 1 + (d == 0 ? 1 : 0);
        double aic = 2.0 * parameters - 2.0 * logLikelihood;

        double[] fitted = new double[y.length - (p + d)];
        for (int t = p; t < m; t++) {
            fitted[t - p] = y[t + d] - residuals[t];
        }

        double[] lastLevels = new double[d];
        double[] level = y;
        for (int k = 0; k < d; k++) {
            lastLevels[k] = level[level.length - 1];
            level = difference(level, 1);
        }

        return new ArimaModel(p, d, q, ar, ma, mean, sigma2, aic, series.getStart(), p + d, fitted,
                lastLevels,
                Arrays.copyOfRange(z, m - p, m),
                Arrays.copyOfRange(residuals, m - q, m),
                Math.sqrt(sigma2));
    }

    /**
     * Hannan-Rissanen estimates of the AR and MA coefficients.
     */
    static double[] regressArma(double[] z, int p, int q) {
        int m = z.length;
        if (p == 0 && q == 0) {
            return new double[0];
        }
        double[] innovations = new double[m];
        int start = p;
        if (q > 0) {
            int longOrder = Math.max(1, Math.min(Math.max(p, q) + 10, m / 4));
            double[] longAr = LinearAlgebra.leastSquares(lagMatrix(z, longOrder, longOrder), slice(z, longOrder));
            for (int t = longOrder; t < m; t++) {
                double predicted = 0;
                for (int i = 1; i <= longOrder; i++) {
                    predicted += longAr[i - 1] * z[t - i];
                }
                innovations[t] = z[t] - predicted;
            }
            start = Math.max(p, longOrder + q);
        }
        if (m - start < p + q + 1) {
            throw new IllegalStateException("not enough observations for the second-stage regression");
        }

        double[][] design = new double[m - start][p + q];
        double[] target = new double[m - start];
        for (int t = start; t < m; t++) {
            double[] row = design[t - start];
            for (int i = 1; i <= p; i++) {
                row[i - 1] = z[t - i];
            }
            for (int j = 1; j <= q; j++) {
                row[p + j - 1] = innovations[t - j];
            }
            target[t - start] = z[t];
        }
        return LinearAlgebra.leastSquares(design, target);
    }

    /**
     * Residuals of the ARMA recursion, conditional on zero residuals before
     * index {@code p}.
     */
    static double[] conditionalResiduals(double[] z, double[] ar, double[] ma) {
        int p = ar.length;
        int q = ma.length;
        double[] e = new double[z.length];
        for (int t = p; t < z.length; t++) {
            double predicted = 0;
            for (int i = 1; i <= p; i++) {
                predicted += ar[i - 1] * z[t - i];
            }
            for (int j = 1; j <= q && t - j >= p; j++) {
                predicted += ma[j - 1] * e[t - j];
            }
            e[t] = z[t] - predicted;
        }
        return e;
    }

    static double[] difference(double[] values, int order) {
        double[] out = values;
        for (int k = 0; k < order; k++) {
            double[] next = new double[Math.max(0, out.length - 1)];
            for (int i = 1; i < out.length; i++) {
                next[i - 1] = out[i] - out[i - 1];
            }
            out = next;
        }
        return out;
    }

    private static double[][] lagMatrix(double[] z, int lags, int start) {
        double[][] rows = new double[z.length - start][lags];
        for (int t = start; t < z.length; t++) {
            for (int i = 1; i <= lags; i++) {
                rows[t - start][i - 1] = z[t - i];
            }
        }
        return rows;
    }

    private static double[] slice(double[] values, int from) {
        return Arrays.copyOfRange(values, from, values.length);
    }
}
