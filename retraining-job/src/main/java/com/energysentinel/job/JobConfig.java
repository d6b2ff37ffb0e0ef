package com.energysentinel.job;

import com.energysentinel.core.config.EngineConfigLoader;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Typed, immutable configuration of one scheduler invocation.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job is configured the same way from cron, a container or a shell.
 * Engine tuning (thresholds, detectors, retry delays) lives in the YAML file
 * named by {@value EngineConfigLoader#ENV_CONFIG_PATH}; this class only
 * carries the job's identity and file locations.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic and test scenarios. The builder validates inputs at
 * {@link Builder#build()} time. The job id ends up in report file names,
 * so it is restricted to letters, digits, {@code _} and {@code -}.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    public static final String ENV_JOB_ID = "JOB_ID";
    public static final String ENV_MODELS_DIR = "MODELS_DIR";
    public static final String ENV_DATA_CSV_PATH = "DATA_CSV_PATH";
    public static final String ENV_REPORTS_DIR = "REPORTS_DIR";

    private static final Pattern JOB_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

    private final String jobId;
    private final String engineConfigPath;
    private final Path modelsDir;
    private final Path dataCsvPath;
    private final Path reportsDir;

    private JobConfig(Builder b) {
        this.jobId = b.jobId;
        this.engineConfigPath = b.engineConfigPath;
        this.modelsDir = Paths.get(b.modelsDir);
        this.dataCsvPath = Paths.get(b.dataCsvPath);
        this.reportsDir = Paths.get(b.reportsDir);
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalArgumentException if a validated field is blank
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static JobConfig fromEnvironment(UnaryOperator<String> environment) {
        return new Builder()
                .jobId(env(environment, ENV_JOB_ID, "energy-sentinel"))
                .engineConfigPath(env(environment, EngineConfigLoader.ENV_CONFIG_PATH, ""))
                .modelsDir(env(environment, ENV_MODELS_DIR, "models"))
                .dataCsvPath(env(environment, ENV_DATA_CSV_PATH, "data/energy_readings.csv"))
                .reportsDir(env(environment, ENV_REPORTS_DIR, "reports"))
                .build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getJobId() {
        return jobId;
    }

    /**
     * @return the engine YAML path, or an empty string to use the classpath
     *         default
     */
    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    public Path getModelsDir() {
        return modelsDir;
    }

    public Path getDataCsvPath() {
        return dataCsvPath;
    }

    public Path getReportsDir() {
        return reportsDir;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}. {@link #build()} rejects blank
     * job ids and directories.
     */
    public static class Builder {
        private String jobId = "energy-sentinel";
        private String engineConfigPath = "";
        private String modelsDir = "models";
        private String dataCsvPath = "data/energy_readings.csv";
        private String reportsDir = "reports";

        public Builder jobId(String v) {
            this.jobId = v;
            return this;
        }

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        public Builder modelsDir(String v) {
            this.modelsDir = v;
            return this;
        }

        public Builder dataCsvPath(String v) {
            this.dataCsvPath = v;
            return this;
        }

        public Builder reportsDir(String v) {
            this.reportsDir = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(engineConfigPath, "engineConfigPath required");
            requireNonBlank(jobId, "jobId");
            if (!JOB_ID_PATTERN.matcher(jobId).matches()) {
                throw new IllegalArgumentException("jobId must only contain letters, digits, '_' and '-', got: " + jobId);
            }
            requireNonBlank(modelsDir, "modelsDir");
            requireNonBlank(dataCsvPath, "dataCsvPath");
            requireNonBlank(reportsDir, "reportsDir");
            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(UnaryOperator<String> environment, String name, String defaultValue) {
        String value = environment.apply(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "jobId='" + jobId + '\'' +
                ", engineConfigPath='" + engineConfigPath + '\'' +
                ", modelsDir=" + modelsDir +
                ", dataCsvPath=" + dataCsvPath +
                ", reportsDir=" + reportsDir +
                '}';
    }
}
