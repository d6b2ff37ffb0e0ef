package com.energysentinel.core.forecast;

import com.energysentinel.core.model.ForecasterKind;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Fitted ARIMA(p,d,q) model on an hourly series.
 *
 * <p>
 * Keeps the one-step-ahead in-sample predictions of the training hours and
 * the tail state needed to forecast beyond the training end: the last
 * {@code p} differenced values, the last {@code q} residuals and the last
 * value of every differencing level.
 * </p>
 *
 * @since 1.0.0
 */
public final class ArimaModel implements FittedForecaster {

    private final int p;
    private final int d;
    private final int q;
    private final double[] ar;
    private final double[] ma;
    private final double mean;
    private final double sigma2;
    private final double aic;
    private final LocalDateTime trainingStart;
    private final int fittedOffset;
    private final double[] fittedValues;
    private final double[] lastLevels;
    private final double[] recentDiffs;
    private final double[] recentResiduals;
    private final double residualStdDev;

    @JsonCreator
    public ArimaModel(
            @JsonProperty("p") int p,
            @JsonProperty("d") int d,
            @JsonProperty("q") int q,
            @JsonProperty("ar") double[] ar,
            @JsonProperty("ma") double[] ma,
            @JsonProperty("mean") double mean,
            @JsonProperty("sigma2") double sigma2,
            @JsonProperty("aic") double aic,
            @JsonProperty("training_start") LocalDateTime trainingStart,
            @JsonProperty("fitted_offset") int fittedOffset,
            @JsonProperty("fitted_values") double[] fittedValues,
            @JsonProperty("last_levels") double[] lastLevels,
            @JsonProperty("recent_diffs") double[] recentDiffs,
            @JsonProperty("recent_residuals") double[] recentResiduals,
            @JsonProperty("residual_std_dev") double residualStdDev) {
        this.p = p;
        this.d = d;
        this.q = q;
        this.ar = ar.clone();
        this.ma = ma.clone();
        this.mean = mean;
        this.sigma2 = sigma2;
        this.aic = aic;
        this.trainingStart = Objects.requireNonNull(trainingStart, "trainingStart must not be null");
        this.fittedOffset = fittedOffset;
        this.fittedValues = fittedValues.clone();
        this.lastLevels = lastLevels.clone();
        this.recentDiffs = recentDiffs.clone();
        this.recentResiduals = recentResiduals.clone();
        this.residualStdDev = residualStdDev;
        if (this.ar.length != p || this.ma.length != q || this.lastLevels.length != d
                || this.recentDiffs.length != p || this.recentResiduals.length != q) {
            throw new IllegalArgumentException("ARIMA state does not match order (" + p + "," + d + "," + q + ")");
        }
    }

    // ---------------------------------------------------------------
    // Prediction
    // ---------------------------------------------------------------

    @Override
    public double[] predictAt(List<LocalDateTime> hours) {
        int length = trainingLength();
        long maxSteps = 0;
        for (LocalDateTime hour : hours) {
            maxSteps = Math.max(maxSteps, ChronoUnit.HOURS.between(trainingStart, hour) - (length - 1));
        }
        double[] ahead = forecast((int) Math.max(0, maxSteps));

        double[] out = new double[hours.size()];
        for (int i = 0; i < out.length; i++) {
            long index = ChronoUnit.HOURS.between(trainingStart, hours.get(i));
            if (index < fittedOffset) {
                out[i] = Double.NaN;
            } else if (index < length) {
                out[i] = fittedValues[(int) index - fittedOffset];
            } else {
                out[i] = ahead[(int) (index - length)];
            }
        }
        return out;
    }

    /**
     * Forecast the next {@code steps} hours after the training end.
     */
    public double[] forecast(int steps) {
        double[] diffs = Arrays.copyOf(recentDiffs, p + steps);
        double[] residuals = Arrays.copyOf(recentResiduals, q + steps);
        double[] levels = lastLevels.clone();
        double[] out = new double[steps];
        for (int s = 0; s < steps; s++) {
            double z = 0;
            for (int i = 1; i <= p; i++) {
                z += ar[i - 1] * diffs[p + s - i];
            }
            for (int j = 1; j <= q; j++) {
                z += ma[j - 1] * residuals[q + s - j];
            }
            diffs[p + s] = z;
            residuals[q + s] = 0.0;

            double value = z + mean;
            for (int k = d - 1; k >= 0; k--) {
                value = levels[k] + value;
                levels[k] = value;
            }
            out[s] = value;
        }
        return out;
    }

    @JsonIgnore
    public int trainingLength() {
        return fittedOffset + fittedValues.length;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @Override
    @JsonIgnore
    public ForecasterKind getKind() {
        return ForecasterKind.AUTOREGRESSIVE;
    }

    @Override
    @JsonProperty("training_start")
    public LocalDateTime getTrainingStart() {
        return trainingStart;
    }

    @Override
    @JsonIgnore
    public LocalDateTime getTrainingEnd() {
        return trainingStart.plusHours(trainingLength() - 1L);
    }

    @JsonProperty("p")
    public int getP() {
        return p;
    }

    @JsonProperty("d")
    public int getD() {
        return d;
    }

    @JsonProperty("q")
    public int getQ() {
        return q;
    }

    @JsonProperty("ar")
    public double[] getAr() {
        return ar.clone();
    }

    @JsonProperty("ma")
    public double[] getMa() {
        return ma.clone();
    }

    @JsonProperty("mean")
    public double getMean() {
        return mean;
    }

    @JsonProperty("sigma2")
    public double getSigma2() {
        return sigma2;
    }

    @JsonProperty("aic")
    public double getAic() {
        return aic;
    }

    @JsonProperty("fitted_offset")
    public int getFittedOffset() {
        return fittedOffset;
    }

    @JsonProperty("fitted_values")
    public double[] getFittedValues() {
        return fittedValues.clone();
    }

    @JsonProperty("last_levels")
    public double[] getLastLevels() {
        return lastLevels.clone();
    }

    @JsonProperty("recent_diffs")
    public double[] getRecentDiffs() {
        return recentDiffs.clone();
    }

    @JsonProperty("recent_residuals")
    public double[] getRecentResiduals() {
        return recentResiduals.clone();
    }

    @Override
    @JsonProperty("residual_std_dev")
    public double getResidualStdDev() {
        return residualStdDev;
    }

    @Override
    public String toString() {
        return String.format("ArimaModel{order=(%d,%d,%d), aic=%.2f, sigma2=%.5f}", p, d, q, aic, sigma2);
    }
}
