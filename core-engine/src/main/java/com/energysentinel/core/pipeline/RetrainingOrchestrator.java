package com.energysentinel.core.pipeline;

import com.energysentinel.core.config.EngineConfig;
import com.energysentinel.core.config.ForecastSettings;
import com.energysentinel.core.detection.ConsensusDetectionEngine;
import com.energysentinel.core.detection.ConsensusResult;
import com.energysentinel.core.error.DatabaseConnectionException;
import com.energysentinel.core.error.EngineException;
import com.energysentinel.core.error.ErrorKind;
import com.energysentinel.core.error.InsufficientDataException;
import com.energysentinel.core.forecast.EnsembleTrainer;
import com.energysentinel.core.forecast.FittedForecaster;
import com.energysentinel.core.forecast.ForecastEnsemble;
import com.energysentinel.core.forecast.HourlyForecastSource;
import com.energysentinel.core.forecast.HourlySeries;
import com.energysentinel.core.model.AnomalyPassResult;
import com.energysentinel.core.model.ComparisonResult;
import com.energysentinel.core.model.CycleReport;
import com.energysentinel.core.model.CycleStage;
import com.energysentinel.core.model.CycleStatus;
import com.energysentinel.core.model.Decision;
import com.energysentinel.core.model.ForecasterKind;
import com.energysentinel.core.model.QualityReport;
import com.energysentinel.core.model.TimeSeriesWindow;
import com.energysentinel.core.preprocess.Preprocessor;
import com.energysentinel.core.quality.DataQualityGate;
import com.energysentinel.core.registry.ModelRegistry;
import com.energysentinel.core.store.StoreStats;
import com.energysentinel.core.store.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Drives the model lifecycle and the anomaly passes.
 *
 * <h3>Retraining cycle</h3>
 *
 * <pre>
 *   FETCH       last trainingWindowDays of readings, ending at the newest one
 *   VALIDATE    data quality gate
 *   PREPROCESS  cleaning + hourly resampling
 *   TRAIN       three forecasters in parallel
 *   EVALUATE    holdout metrics, ensemble weights and the horizon forecast
 *   COMPARE     against the last ledger entry
 *   PERSIST     versioned artifacts, aliases, ledger
 *   CLEANUP     retention of old versions
 *   NOTIFY      CycleReport to the notifier
 * </pre>
 *
 * <p>
 * Every cycle ends in exactly one terminal {@link CycleStatus}; failures are
 * reported with the stage, {@link ErrorKind} and component that caused
 * them and are never thrown to the caller. The only exception is
 * {@link CycleAlreadyRunningException}, raised when a retraining cycle (or
 * an anomaly pass) is requested for a job id that already has one running.
 * A cycle and a pass of the same job id may overlap.
 * </p>
 *
 * <h3>Resources</h3>
 * <p>
 * The orchestrator owns the store and, unless one is supplied, a bounded
 * worker pool; both are released by {@link #close()}.
 * </p>
 *
 * @since 1.0.0
 */
public class RetrainingOrchestrator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RetrainingOrchestrator.class);

    private static final Predicate<RuntimeException> STORE_RETRYABLE =
            e -> e instanceof DatabaseConnectionException;
    private static final Predicate<RuntimeException> ANY_FAILURE = e -> true;

    private final EngineConfig config;
    private final TimeSeriesStore store;
    private final ModelRegistry registry;
    private final CycleNotifier notifier;
    private final Clock clock;
    private final RetryPolicy retryPolicy;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    private final DataQualityGate qualityGate;
    private final Preprocessor preprocessor;
    private final EnsembleTrainer trainer;
    private final ConsensusDetectionEngine detectionEngine;
    private final SingleFlightGuard cycleGuard = new SingleFlightGuard();
    private final SingleFlightGuard passGuard = new SingleFlightGuard();

    private RetrainingOrchestrator(Builder b) {
        this.config = b.config;
        this.store = b.store;
        this.registry = b.registry;
        this.notifier = b.notifier;
        this.clock = b.clock;
        this.retryPolicy = RetryPolicy.ofSeconds(config.getPipeline().getRetryDelaysSeconds(), b.sleeper);
        this.ownsExecutor = b.executor == null;
        this.executor = ownsExecutor ? newWorkerPool(config.getPipeline().getWorkerThreads()) : b.executor;

        this.qualityGate = new DataQualityGate(config.getQuality());
        this.preprocessor = new Preprocessor(config.getPreprocessing());
        this.trainer = new EnsembleTrainer(config.getForecast(), executor);
        this.detectionEngine = new ConsensusDetectionEngine(config.getDetection(), executor);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Verify the store connection (with retries) and log its contents.
     *
     * @throws DatabaseConnectionException if the store stays unreachable
     */
    public void start() {
        retryPolicy.run("Store connection test", () -> {
            if (!store.testConnection()) {
                throw new DatabaseConnectionException("Store connection test failed");
            }
        }, STORE_RETRYABLE);
        StoreStats stats = retryPolicy.execute("Store statistics", store::getStats, STORE_RETRYABLE);
        LOG.info("Store connected: {}", stats);
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        store.close();
        LOG.info("Orchestrator closed");
    }

    // ---------------------------------------------------------------
    // Retraining cycle
    // ---------------------------------------------------------------

    /**
     * Run one full retraining cycle.
     *
     * @param jobId identifies the scheduled job; concurrent cycles of the
     *              same id are rejected
     * @return the cycle report, also delivered to the notifier
     * @throws CycleAlreadyRunningException if a cycle of the job is already
     *                                      running
     */
    public CycleReport runRetrainingCycle(String jobId) {
        cycleGuard.acquire(jobId);
        try {
            CycleReport report = executeCycle(jobId);
            notifyCycle(report);
            return report;
        } finally {
            cycleGuard.release(jobId);
        }
    }

    private CycleReport executeCycle(String jobId) {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        CycleReport.Builder report = CycleReport.builder(jobId).startedAt(startedAt);
        CycleStage stage = CycleStage.FETCH;
        LOG.info("[{}] Retraining cycle started", jobId);
        try {
            TimeSeriesWindow window = fetchTrainingWindow();

            stage = CycleStage.VALIDATE;
            QualityReport quality = qualityGate.check(window);
            report.qualityReport(quality);
            if (!quality.isValid()) {
                LOG.warn("[{}] Data quality insufficient: {}", jobId, quality);
                return finish(report.status(CycleStatus.INSUFFICIENT_DATA)
                        .failedStage(stage)
                        .errorKind(ErrorKind.INSUFFICIENT_DATA)
                        .detail("Data quality check failed: " + String.join("; ", quality.getWarnings())));
            }

            stage = CycleStage.PREPROCESS;
            HourlySeries series = HourlySeries.from(preprocessor.process(window));

            stage = CycleStage.TRAIN;
            Map<ForecasterKind, FittedForecaster> fitted = trainer.fitAll(series);

            stage = CycleStage.EVALUATE;
            ForecastEnsemble ensemble = trainer.evaluate(series, fitted);
            report.metrics(ensemble.getMetrics()).weights(ensemble.getWeights().asMap());
            ForecastSettings forecastSettings = config.getForecast();
            report.forecast(ensemble.forecast(forecastSettings.getHorizonDays() * 24,
                    forecastSettings.getConfidenceLevel()));

            stage = CycleStage.COMPARE;
            ComparisonResult comparison = registry.compare(ensemble.getMetrics());
            report.comparison(comparison);

            stage = CycleStage.PERSIST;
            String version = registry.promote(ensemble, comparison, config.getPipeline().getTrainingWindowDays());
            report.versionId(version);

            stage = CycleStage.CLEANUP;
            registry.cleanup();

            CycleStatus status = comparison.getDecision() == Decision.ROLLBACK_OLD
                    ? CycleStatus.DEGRADATION
                    : CycleStatus.SUCCESS;
            if (status == CycleStatus.DEGRADATION) {
                LOG.warn("[{}] Model degraded, keeping {} as current best", jobId, comparison.getPreviousVersion());
            }
            return finish(report.status(status));
        } catch (InsufficientDataException e) {
            LOG.warn("[{}] Insufficient data at stage {}: {}", jobId, stage, e.getMessage());
            return finish(report.status(CycleStatus.INSUFFICIENT_DATA)
                    .failedStage(stage)
                    .errorKind(e.getKind())
                    .detail(e.getMessage()));
        } catch (EngineException e) {
            LOG.error("[{}] Cycle failed at stage {} ({}): {}", jobId, stage, e.getKind(), e.getMessage(), e);
            return finish(report.status(CycleStatus.FAILURE)
                    .failedStage(stage)
                    .errorKind(e.getKind())
                    .component(e.getComponent())
                    .detail(e.getMessage()));
        } catch (RuntimeException e) {
            LOG.error("[{}] Unexpected failure at stage {}", jobId, stage, e);
            return finish(report.status(CycleStatus.FAILURE)
                    .failedStage(stage)
                    .errorKind(ErrorKind.INTERNAL)
                    .detail(e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    private TimeSeriesWindow fetchTrainingWindow() {
        StoreStats stats = retryPolicy.execute("Store statistics", store::getStats, STORE_RETRYABLE);
        if (stats.isEmpty()) {
            throw new InsufficientDataException("Store holds no readings");
        }
        LocalDateTime end = stats.getLastTimestamp();
        LocalDateTime start = end.minusDays(config.getPipeline().getTrainingWindowDays());
        TimeSeriesWindow window = retryPolicy.execute("Fetch training window",
                () -> store.getWindow(start, end), STORE_RETRYABLE);
        LOG.info("Fetched {} readings between {} and {}", window.size(), start, end);
        return window;
    }

    private CycleReport finish(CycleReport.Builder report) {
        CycleReport built = report.finishedAt(LocalDateTime.now(clock)).build();
        LOG.info("[{}] Retraining cycle finished with status {}", built.getJobId(), built.getStatus());
        return built;
    }

    // ---------------------------------------------------------------
    // Anomaly pass
    // ---------------------------------------------------------------

    /**
     * Run the consensus detectors over the most recent readings.
     *
     * @param jobId identifies the scheduled job; concurrent passes of the
     *              same id are rejected
     * @return the tagged result, also delivered to the notifier
     * @throws CycleAlreadyRunningException if a pass of the job is already
     *                                      running
     */
    public AnomalyPassResult runAnomalyPass(String jobId) {
        passGuard.acquire(jobId);
        try {
            AnomalyPassResult result = executeAnomalyPass(jobId);
            notifyAnomalies(result);
            return result;
        } finally {
            passGuard.release(jobId);
        }
    }

    private AnomalyPassResult executeAnomalyPass(String jobId) {
        int lookbackHours = config.getDetection().getLookbackHours();
        LOG.info("[{}] Anomaly pass over the last {} hours", jobId, lookbackHours);
        try {
            TimeSeriesWindow window = retryPolicy.execute("Fetch recent readings",
                    () -> store.getRecent(lookbackHours), STORE_RETRYABLE);
            int usable = window.withActivePower().size();
            int minReadings = config.getDetection().getMinReadings();
            if (usable < minReadings) {
                LOG.warn("[{}] Only {} readings with active power, need {}", jobId, usable, minReadings);
                return AnomalyPassResult.insufficientData(jobId,
                        "Only " + usable + " readings available, at least " + minReadings + " required");
            }

            Optional<HourlyForecastSource> forecast = registry.loadCurrentBest().map(HourlyForecastSource.class::cast);
            ConsensusResult consensus = detectionEngine.detect(window, forecast);
            LOG.info("[{}] Anomaly pass found {} anomalies", jobId, consensus.getRecords().size());
            return AnomalyPassResult.ok(jobId, consensus.getRecords(), consensus.getActiveDetectors(),
                    window.getStart(), window.getEnd());
        } catch (InsufficientDataException e) {
            LOG.warn("[{}] Insufficient data: {}", jobId, e.getMessage());
            return AnomalyPassResult.insufficientData(jobId, e.getMessage());
        } catch (EngineException e) {
            LOG.error("[{}] Anomaly pass failed ({}): {}", jobId, e.getKind(), e.getMessage(), e);
            return AnomalyPassResult.failed(jobId, e.getKind(), e.getComponent(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("[{}] Unexpected anomaly pass failure", jobId, e);
            return AnomalyPassResult.failed(jobId, ErrorKind.INTERNAL, null,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Notification
    // ---------------------------------------------------------------

    private void notifyCycle(CycleReport report) {
        try {
            retryPolicy.run("Cycle notification", () -> notifier.onCycleCompleted(report), ANY_FAILURE);
        } catch (RuntimeException e) {
            LOG.error("[{}] Could not deliver cycle report: {}", report.getJobId(), e.getMessage(), e);
        }
    }

    private void notifyAnomalies(AnomalyPassResult result) {
        try {
            retryPolicy.run("Anomaly notification", () -> notifier.onAnomalyPass(result), ANY_FAILURE);
        } catch (RuntimeException e) {
            LOG.error("[{}] Could not deliver anomaly result: {}", result.getJobId(), e.getMessage(), e);
        }
    }

    private static ExecutorService newWorkerPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "energy-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static final class Builder {
        private EngineConfig config;
        private TimeSeriesStore store;
        private ModelRegistry registry;
        private CycleNotifier notifier;
        private Clock clock = Clock.systemDefaultZone();
        private Sleeper sleeper = Sleeper.SYSTEM;
        private ExecutorService executor;

        private Builder() {
        }

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder store(TimeSeriesStore store) {
            this.store = store;
            return this;
        }

        public Builder registry(ModelRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder notifier(CycleNotifier notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Worker pool for training and detection. When set, the caller keeps
         * ownership and {@link RetrainingOrchestrator#close()} leaves it
         * running.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public RetrainingOrchestrator build() {
            Objects.requireNonNull(config, "config must not be null");
            Objects.requireNonNull(store, "store must not be null");
            Objects.requireNonNull(registry, "registry must not be null");
            Objects.requireNonNull(notifier, "notifier must not be null");
            Objects.requireNonNull(clock, "clock must not be null");
            Objects.requireNonNull(sleeper, "sleeper must not be null");
            config.validate();
            return new RetrainingOrchestrator(this);
        }
    }
}
