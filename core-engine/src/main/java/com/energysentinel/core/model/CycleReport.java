package com.energysentinel.core.model;

import com.energysentinel.core.error.ErrorKind;
import com.energysentinel.core.forecast.Forecast;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal report of one retraining cycle, handed to the notification layer.
 *
 * <p>
 * On failure, {@code failedStage}, {@code errorKind} and {@code detail}
 * identify where and why the cycle stopped; {@code component} names the
 * forecaster when training failed.
 * </p>
 *
 * @since 1.0.0
 */
public final class CycleReport {

    private final String jobId;
    private final CycleStatus status;
    private final LocalDateTime startedAt;
    private final LocalDateTime finishedAt;
    private final CycleStage failedStage;
    private final ErrorKind errorKind;
    private final String component;
    private final String detail;
    private final QualityReport qualityReport;
    private final EvaluationMetrics metrics;
    private final ComparisonResult comparison;
    private final Map<ForecasterKind, Double> weights;
    private final String versionId;
    private final Forecast forecast;

    private CycleReport(Builder b) {
        this.jobId = Objects.requireNonNull(b.jobId, "jobId must not be null");
        this.status = Objects.requireNonNull(b.status, "status must not be null");
        this.startedAt = b.startedAt;
        this.finishedAt = b.finishedAt;
        this.failedStage = b.failedStage;
        this.errorKind = b.errorKind;
        this.component = b.component;
        this.detail = b.detail;
        this.qualityReport = b.qualityReport;
        this.metrics = b.metrics;
        this.comparison = b.comparison;
        this.weights = b.weights == null || b.weights.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(b.weights));
        this.versionId = b.versionId;
        this.forecast = b.forecast;
    }

    public static Builder builder(String jobId) {
        return new Builder(jobId);
    }

    public static final class Builder {
        private final String jobId;
        private CycleStatus status;
        private LocalDateTime startedAt;
        private LocalDateTime finishedAt;
        private CycleStage failedStage;
        private ErrorKind errorKind;
        private String component;
        private String detail;
        private QualityReport qualityReport;
        private EvaluationMetrics metrics;
        private ComparisonResult comparison;
        private Map<ForecasterKind, Double> weights;
        private String versionId;
        private Forecast forecast;

        private Builder(String jobId) {
            this.jobId = jobId;
        }

        public Builder status(CycleStatus v) {
            this.status = v;
            return this;
        }

        public Builder startedAt(LocalDateTime v) {
            this.startedAt = v;
            return this;
        }

        public Builder finishedAt(LocalDateTime v) {
            this.finishedAt = v;
            return this;
        }

        public Builder failedStage(CycleStage v) {
            this.failedStage = v;
            return this;
        }

        public Builder errorKind(ErrorKind v) {
            this.errorKind = v;
            return this;
        }

        public Builder component(String v) {
            this.component = v;
            return this;
        }

        public Builder detail(String v) {
            this.detail = v;
            return this;
        }

        public Builder qualityReport(QualityReport v) {
            this.qualityReport = v;
            return this;
        }

        public Builder metrics(EvaluationMetrics v) {
            this.metrics = v;
            return this;
        }

        public Builder comparison(ComparisonResult v) {
            this.comparison = v;
            return this;
        }

        public Builder weights(Map<ForecasterKind, Double> v) {
            this.weights = v;
            return this;
        }

        public Builder versionId(String v) {
            this.versionId = v;
            return this;
        }

        public Builder forecast(Forecast v) {
            this.forecast = v;
            return this;
        }

        public CycleReport build() {
            return new CycleReport(this);
        }
    }

    public String getJobId() {
        return jobId;
    }

    public CycleStatus getStatus() {
        return status;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public LocalDateTime getFinishedAt() {
        return finishedAt;
    }

    public CycleStage getFailedStage() {
        return failedStage;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getComponent() {
        return component;
    }

    public String getDetail() {
        return detail;
    }

    public QualityReport getQualityReport() {
        return qualityReport;
    }

    public EvaluationMetrics getMetrics() {
        return metrics;
    }

    public ComparisonResult getComparison() {
        return comparison;
    }

    public Map<ForecasterKind, Double> getWeights() {
        return weights;
    }

    public String getVersionId() {
        return versionId;
    }

    /**
     * Blended hourly forecast over the configured horizon, or {@code null}
     * if the cycle stopped before evaluation.
     */
    public Forecast getForecast() {
        return forecast;
    }

    @Override
    public String toString() {
        return "CycleReport{" +
                "jobId='" + jobId + '\'' +
                ", status=" + status +
                (failedStage != null ? ", failedStage=" + failedStage + ", errorKind=" + errorKind : "") +
                (versionId != null ? ", versionId='" + versionId + '\'' : "") +
                (detail != null ? ", detail='" + detail + '\'' : "") +
                '}';
    }
}
