package com.energysentinel.job;

import com.energysentinel.core.error.ArtifactStorageException;
import com.energysentinel.core.forecast.Forecast;
import com.energysentinel.core.model.AnomalyPassResult;
import com.energysentinel.core.model.AnomalyRecord;
import com.energysentinel.core.model.CycleReport;
import com.energysentinel.core.model.JsonMappers;
import com.energysentinel.core.pipeline.CycleNotifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * {@link CycleNotifier} that logs every outcome and writes it as a JSON
 * report under a directory.
 *
 * <p>
 * Files are named {@code cycle_<jobId>_<yyyyMMdd_HHmmss>.json} and
 * {@code anomalies_<jobId>_<yyyyMMdd_HHmmss>.json}; characters of the job
 * id outside {@code [A-Za-z0-9_-]} are replaced by {@code _}. A write failure is
 * raised as {@link ArtifactStorageException} so the orchestrator can retry
 * it.
 * </p>
 */
public class JsonReportNotifier implements CycleNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(JsonReportNotifier.class);

    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9_-]");

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path reportsDir;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMappers.create();

    public JsonReportNotifier(Path reportsDir, Clock clock) {
        this.reportsDir = Objects.requireNonNull(reportsDir, "reportsDir must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void onCycleCompleted(CycleReport report) {
        switch (report.getStatus()) {
            case SUCCESS -> LOG.info("[{}] Cycle succeeded: version {}, decision {}, MAE {}",
                    report.getJobId(), report.getVersionId(), report.getComparison().getDecision(),
                    report.getMetrics().getMae());
            case DEGRADATION -> LOG.warn("[{}] Model degraded: version {} kept {} as current best (MAE {}%, RMSE {}%)",
                    report.getJobId(), report.getVersionId(), report.getComparison().getPreviousVersion(),
                    String.format("%.2f", report.getComparison().getMaeDeltaPct()),
                    String.format("%.2f", report.getComparison().getRmseDeltaPct()));
            case INSUFFICIENT_DATA -> LOG.warn("[{}] Cycle skipped at {}: {}",
                    report.getJobId(), report.getFailedStage(), report.getDetail());
            case FAILURE -> LOG.error("[{}] Cycle failed at {} ({}, component {}): {}",
                    report.getJobId(), report.getFailedStage(), report.getErrorKind(),
                    report.getComponent(), report.getDetail());
        }
        Forecast forecast = report.getForecast();
        if (forecast != null && forecast.size() > 0) {
            LOG.info("[{}] {}-hour forecast from {}: peak {} kW, total {} kWh",
                    report.getJobId(), forecast.size(), forecast.getHours().get(0),
                    String.format("%.3f", Arrays.stream(forecast.getValues()).max().orElse(0.0)),
                    String.format("%.1f", Arrays.stream(forecast.getValues()).sum()));
        }
        write("cycle", report.getJobId(), report);
    }

    @Override
    public void onAnomalyPass(AnomalyPassResult result) {
        if (result.isOk()) {
            LOG.info("[{}] {} anomalies between {} and {}",
                    result.getJobId(), result.getRecords().size(), result.getWindowStart(), result.getWindowEnd());
            for (AnomalyRecord record : result.getRecords()) {
                LOG.info("[{}] {} {} {} kW: {}", result.getJobId(), record.getSeverity(), record.getTimestamp(),
                        String.format("%.3f", record.getValue()), record.getDescription());
            }
        } else {
            LOG.warn("[{}] Anomaly pass ended with {}: {}", result.getJobId(), result.getStatus(), result.getDetail());
        }
        write("anomalies", result.getJobId(), result);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void write(String prefix, String jobId, Object payload) {
        String safeId = UNSAFE_FILE_CHARS.matcher(jobId).replaceAll("_");
        Path target = reportsDir.resolve(prefix + "_" + safeId + "_" + LocalDateTime.now(clock).format(FILE_STAMP) + ".json");
        try {
            Files.createDirectories(reportsDir);
            mapper.writeValue(target.toFile(), payload);
        } catch (IOException e) {
            throw new ArtifactStorageException("Cannot write report " + target, e);
        }
        LOG.debug("Report written to {}", target);
    }

    public Path getReportsDir() {
        return reportsDir;
    }
}
