package com.energysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of comparing new {@link EvaluationMetrics} against the last training
 * history entry.
 *
 * <p>
 * Delta percentages are expressed as {@code (previous - new) / previous * 100},
 * so a positive value is an improvement and a negative value a degradation.
 * When there is no history the previous fields are {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
public class ComparisonResult {

    private boolean better;
    private double maeDeltaPct;
    private double rmseDeltaPct;
    private Decision decision;
    private String previousVersion;
    private Double previousMae;
    private Double previousRmse;

    /** No-arg constructor required by Jackson. */
    public ComparisonResult() {
    }

    private ComparisonResult(boolean better, double maeDeltaPct, double rmseDeltaPct, Decision decision,
            String previousVersion, Double previousMae, Double previousRmse) {
        this.better = better;
        this.maeDeltaPct = maeDeltaPct;
        this.rmseDeltaPct = rmseDeltaPct;
        this.decision = decision;
        this.previousVersion = previousVersion;
        this.previousMae = previousMae;
        this.previousRmse = previousRmse;
    }

    public static ComparisonResult firstTraining() {
        return new ComparisonResult(true, 0.0, 0.0, Decision.FIRST_TRAINING, null, null, null);
    }

    public static ComparisonResult of(boolean better, double maeDeltaPct, double rmseDeltaPct, Decision decision,
            String previousVersion, double previousMae, double previousRmse) {
        return new ComparisonResult(better, maeDeltaPct, rmseDeltaPct, decision,
                previousVersion, previousMae, previousRmse);
    }

    @JsonProperty("is_better")
    public boolean isBetter() {
        return better;
    }

    @JsonProperty("is_better")
    public void setBetter(boolean better) {
        this.better = better;
    }

    public double getMaeDeltaPct() {
        return maeDeltaPct;
    }

    public void setMaeDeltaPct(double maeDeltaPct) {
        this.maeDeltaPct = maeDeltaPct;
    }

    public double getRmseDeltaPct() {
        return rmseDeltaPct;
    }

    public void setRmseDeltaPct(double rmseDeltaPct) {
        this.rmseDeltaPct = rmseDeltaPct;
    }

    public Decision getDecision() {
        return decision;
    }

    public void setDecision(Decision decision) {
        this.decision = decision;
    }

    public String getPreviousVersion() {
        return previousVersion;
    }

    public void setPreviousVersion(String previousVersion) {
        this.previousVersion = previousVersion;
    }

    public Double getPreviousMae() {
        return previousMae;
    }

    public void setPreviousMae(Double previousMae) {
        this.previousMae = previousMae;
    }

    public Double getPreviousRmse() {
        return previousRmse;
    }

    public void setPreviousRmse(Double previousRmse) {
        this.previousRmse = previousRmse;
    }

    @Override
    public String toString() {
        return "ComparisonResult{" +
                "decision=" + decision +
                ", isBetter=" + better +
                ", maeDeltaPct=" + String.format("%.2f", maeDeltaPct) +
                ", rmseDeltaPct=" + String.format("%.2f", rmseDeltaPct) +
                ", previousVersion='" + previousVersion + '\'' +
                '}';
    }
}
