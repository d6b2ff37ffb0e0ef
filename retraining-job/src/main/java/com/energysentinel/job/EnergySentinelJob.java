package com.energysentinel.job;

import com.energysentinel.core.config.EngineConfig;
import com.energysentinel.core.config.EngineConfigLoader;
import com.energysentinel.core.error.EngineException;
import com.energysentinel.core.model.AnomalyPassResult;
import com.energysentinel.core.model.CycleReport;
import com.energysentinel.core.model.CycleStatus;
import com.energysentinel.core.pipeline.CycleNotifier;
import com.energysentinel.core.pipeline.RetrainingOrchestrator;
import com.energysentinel.core.pipeline.Sleeper;
import com.energysentinel.core.registry.ModelRegistry;
import com.energysentinel.core.store.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Locale;

/**
 * Main entry point for one scheduler invocation of Energy Sentinel.
 *
 * <h3>Modes</h3>
 *
 * <pre>
 *   retrain   full retraining cycle (default)
 *   detect    consensus anomaly pass over the recent readings
 * </pre>
 *
 * <h3>Exit codes</h3>
 *
 * <pre>
 *   0   SUCCESS or DEGRADATION
 *   1   FAILURE, or the store could not be reached on start
 *   2   unknown mode or invalid configuration
 *   3   INSUFFICIENT_DATA
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job-level settings come from environment variables via {@link JobConfig};
 * engine tuning from the YAML file loaded by {@link EngineConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnergySentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(EnergySentinelJob.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INSUFFICIENT_DATA = 3;

    /** Scheduler invocation mode. */
    enum Mode {
        RETRAIN, DETECT;

        static Mode parse(String[] args) {
            if (args.length == 0) {
                return RETRAIN;
            }
            try {
                return valueOf(args[0].trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown mode '" + args[0] + "', expected retrain or detect", e);
            }
        }
    }

    private EnergySentinelJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        Mode mode;
        JobConfig jobConfig;
        EngineConfig engineConfig;
        try {
            mode = Mode.parse(args);
            jobConfig = JobConfig.fromEnvironment();
            engineConfig = loadEngineConfig(jobConfig);
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Invalid invocation: {}", e.getMessage(), e);
            System.exit(EXIT_USAGE);
            return;
        }
        LOG.info("Starting Energy Sentinel in {} mode with config: {}", mode, jobConfig);

        // 2. Wire and run
        Clock clock = Clock.systemDefaultZone();
        int exitCode = run(mode, jobConfig, engineConfig,
                new CsvTimeSeriesStore(jobConfig.getDataCsvPath()),
                new JsonReportNotifier(jobConfig.getReportsDir(), clock),
                clock, Sleeper.SYSTEM);
        LOG.info("Energy Sentinel exiting with code {}", exitCode);
        System.exit(exitCode);
    }

    // ---------------------------------------------------------------
    // Run (extracted for testability)
    // ---------------------------------------------------------------

    /**
     * Build the orchestrator, run one cycle or pass and map its status to an
     * exit code. The orchestrator, and with it the store, is always closed.
     */
    static int run(Mode mode, JobConfig jobConfig, EngineConfig engineConfig,
            TimeSeriesStore store, CycleNotifier notifier, Clock clock, Sleeper sleeper) {
        ModelRegistry registry = new ModelRegistry(jobConfig.getModelsDir(), engineConfig.getRegistry(), clock);
        try (RetrainingOrchestrator orchestrator = RetrainingOrchestrator.builder()
                .config(engineConfig)
                .store(store)
                .registry(registry)
                .notifier(notifier)
                .clock(clock)
                .sleeper(sleeper)
                .build()) {
            try {
                orchestrator.start();
            } catch (EngineException e) {
                LOG.error("Store unavailable ({}): {}", e.getKind(), e.getMessage(), e);
                return EXIT_FAILURE;
            }

            if (mode == Mode.DETECT) {
                AnomalyPassResult result = orchestrator.runAnomalyPass(jobConfig.getJobId());
                return exitCode(result.getStatus());
            }
            CycleReport report = orchestrator.runRetrainingCycle(jobConfig.getJobId());
            return exitCode(report.getStatus());
        }
    }

    static int exitCode(CycleStatus status) {
        return switch (status) {
            case SUCCESS, DEGRADATION -> EXIT_OK;
            case INSUFFICIENT_DATA -> EXIT_INSUFFICIENT_DATA;
            case FAILURE -> EXIT_FAILURE;
        };
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static EngineConfig loadEngineConfig(JobConfig config) {
        String path = config.getEngineConfigPath();
        if (path != null && !path.isBlank()) {
            return EngineConfigLoader.fromFile(path);
        }
        return EngineConfigLoader.load();
    }
}
