package com.energysentinel.core.model;

import java.util.Objects;

/**
 * Forecast accuracy measured on a held-out tail of the training series.
 *
 * <p>
 * MAE, RMSE and MAPE (percent) are always non-negative; R² may be negative
 * when a forecast is worse than predicting the mean.
 * </p>
 *
 * @since 1.0.0
 */
public class EvaluationMetrics {

    private double mae;
    private double rmse;
    private double mape;
    private double r2;
    private int sampleCount;

    /** No-arg constructor required by Jackson. */
    public EvaluationMetrics() {
    }

    public EvaluationMetrics(double mae, double rmse, double mape, double r2, int sampleCount) {
        this.mae = mae;
        this.rmse = rmse;
        this.mape = mape;
        this.r2 = r2;
        this.sampleCount = sampleCount;
    }

    public double getMae() {
        return mae;
    }

    public void setMae(double mae) {
        this.mae = mae;
    }

    public double getRmse() {
        return rmse;
    }

    public void setRmse(double rmse) {
        this.rmse = rmse;
    }

    public double getMape() {
        return mape;
    }

    public void setMape(double mape) {
        this.mape = mape;
    }

    public double getR2() {
        return r2;
    }

    public void setR2(double r2) {
        this.r2 = r2;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public void setSampleCount(int sampleCount) {
        this.sampleCount = sampleCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EvaluationMetrics that))
            return false;
        return Double.compare(mae, that.mae) == 0
                && Double.compare(rmse, that.rmse) == 0
                && Double.compare(mape, that.mape) == 0
                && Double.compare(r2, that.r2) == 0
                && sampleCount == that.sampleCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mae, rmse, mape, r2, sampleCount);
    }

    @Override
    public String toString() {
        return String.format("EvaluationMetrics{mae=%.4f, rmse=%.4f, mape=%.2f%%, r2=%.4f, sampleCount=%d}",
                mae, rmse, mape, r2, sampleCount);
    }
}
