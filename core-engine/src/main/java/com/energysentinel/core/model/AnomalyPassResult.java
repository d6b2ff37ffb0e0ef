package com.energysentinel.core.model;

import com.energysentinel.core.error.ErrorKind;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Tagged result of one anomaly detection pass.
 *
 * <p>
 * Either {@linkplain #ok ok}, carrying the ordered consensus anomalies (which
 * may be empty), or unsuccessful, carrying an {@link ErrorKind} and a detail
 * message. "No anomalies" is an ok result, never an error.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyPassResult {

    private final String jobId;
    private final CycleStatus status;
    private final List<AnomalyRecord> records;
    private final List<DetectorKind> activeDetectors;
    private final LocalDateTime windowStart;
    private final LocalDateTime windowEnd;
    private final ErrorKind errorKind;
    private final String component;
    private final String detail;

    private AnomalyPassResult(String jobId, CycleStatus status, List<AnomalyRecord> records,
            List<DetectorKind> activeDetectors, LocalDateTime windowStart, LocalDateTime windowEnd,
            ErrorKind errorKind, String component, String detail) {
        this.jobId = Objects.requireNonNull(jobId, "jobId must not be null");
        this.status = status;
        this.records = List.copyOf(records);
        this.activeDetectors = List.copyOf(activeDetectors);
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        this.errorKind = errorKind;
        this.component = component;
        this.detail = detail;
    }

    public static AnomalyPassResult ok(String jobId, List<AnomalyRecord> records, List<DetectorKind> activeDetectors,
            LocalDateTime windowStart, LocalDateTime windowEnd) {
        return new AnomalyPassResult(jobId, CycleStatus.SUCCESS, records, activeDetectors,
                windowStart, windowEnd, null, null, null);
    }

    public static AnomalyPassResult insufficientData(String jobId, String detail) {
        return new AnomalyPassResult(jobId, CycleStatus.INSUFFICIENT_DATA, List.of(), List.of(),
                null, null, ErrorKind.INSUFFICIENT_DATA, null, detail);
    }

    public static AnomalyPassResult failed(String jobId, ErrorKind kind, String component, String detail) {
        return new AnomalyPassResult(jobId, CycleStatus.FAILURE, List.of(), List.of(),
                null, null, Objects.requireNonNull(kind, "kind must not be null"), component, detail);
    }

    @JsonIgnore
    public boolean isOk() {
        return status == CycleStatus.SUCCESS;
    }

    public String getJobId() {
        return jobId;
    }

    public CycleStatus getStatus() {
        return status;
    }

    /**
     * Consensus anomalies ordered by severity, then timestamp. Empty unless
     * {@link #isOk()}.
     */
    public List<AnomalyRecord> getRecords() {
        return records;
    }

    public List<DetectorKind> getActiveDetectors() {
        return activeDetectors;
    }

    public LocalDateTime getWindowStart() {
        return windowStart;
    }

    public LocalDateTime getWindowEnd() {
        return windowEnd;
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

    @Override
    public String toString() {
        return isOk()
                ? "AnomalyPassResult{ok, jobId='" + jobId + "', anomalies=" + records.size() + '}'
                : "AnomalyPassResult{" + status + ", jobId='" + jobId + "', kind=" + errorKind
                        + ", detail='" + detail + "'}";
    }
}
