package com.energysentinel.core.registry;

import com.energysentinel.core.config.RegistrySettings;
import com.energysentinel.core.error.ArtifactStorageException;
import com.energysentinel.core.forecast.ArimaModel;
import com.energysentinel.core.forecast.EnsembleWeights;
import com.energysentinel.core.forecast.FittedForecaster;
import com.energysentinel.core.forecast.ForecastEnsemble;
import com.energysentinel.core.forecast.SeasonalTrendModel;
import com.energysentinel.core.model.ComparisonResult;
import com.energysentinel.core.model.Decision;
import com.energysentinel.core.model.EvaluationMetrics;
import com.energysentinel.core.model.ForecasterKind;
import com.energysentinel.core.model.JsonMappers;
import com.energysentinel.core.model.TrainedModel;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File-based model version registry.
 *
 * <h3>Layout of the models directory</h3>
 * <ul>
 * <li>{@code <kind>_<version>.json}: every trained forecaster, one file per
 * version</li>
 * <li>{@code best_<kind>.json}: alias of the currently promoted
 * forecaster</li>
 * <li>{@code training_history.json}: append-only ledger of
 * {@link TrainingHistoryEntry}s</li>
 * </ul>
 *
 * <h3>Decisions</h3>
 * <p>
 * New blended holdout metrics are compared with the last ledger entry. The
 * new ensemble is better when both MAE and RMSE are strictly lower. A drop
 * beyond the configured MAE or RMSE degradation percentage is a
 * {@link Decision#ROLLBACK_OLD}; the aliases then keep pointing at the
 * previous best.
 * </p>
 *
 * <p>
 * Every file is written to a temporary file first and moved into place, so
 * readers never observe a partially written artifact. I/O failures surface
 * as {@link ArtifactStorageException}. The registry assumes a single writer.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ModelRegistry.class);

    static final String HISTORY_FILE = "training_history.json";
    static final String BEST_PREFIX = "best_";
    private static final DateTimeFormatter VERSION_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final TypeReference<List<TrainingHistoryEntry>> HISTORY_TYPE = new TypeReference<>() {
    };

    private final Path modelsDir;
    private final RegistrySettings settings;
    private final Clock clock;
    private final ObjectMapper mapper;

    public ModelRegistry(Path modelsDir, RegistrySettings settings, Clock clock) {
        this.modelsDir = Objects.requireNonNull(modelsDir, "modelsDir must not be null");
        this.settings = Objects.requireNonNull(settings, "RegistrySettings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = JsonMappers.create();
    }

    /**
     * @return {@code v<yyyyMMddHHmmss>} from the registry clock
     */
    public String nextVersionId() {
        return "v" + VERSION_FORMAT.format(LocalDateTime.now(clock));
    }

    // ---------------------------------------------------------------
    // Comparison
    // ---------------------------------------------------------------

    /**
     * Compare new metrics against the last ledger entry.
     */
    public synchronized ComparisonResult compare(EvaluationMetrics newMetrics) {
        Objects.requireNonNull(newMetrics, "newMetrics must not be null");
        List<TrainingHistoryEntry> history = history();
        if (history.isEmpty() || history.get(history.size() - 1).getMetrics() == null) {
            LOG.info("No previous model, first training");
            return ComparisonResult.firstTraining();
        }

        TrainingHistoryEntry previous = history.get(history.size() - 1);
        double previousMae = previous.getMetrics().getMae();
        double previousRmse = previous.getMetrics().getRmse();
        double maeDelta = deltaPct(previousMae, newMetrics.getMae());
        double rmseDelta = deltaPct(previousRmse, newMetrics.getRmse());
        boolean better = newMetrics.getMae() < previousMae && newMetrics.getRmse() < previousRmse;

        Decision decision;
        if (maeDelta < -settings.getMaeDegradationPct() || rmseDelta < -settings.getRmseDegradationPct()) {
            decision = Decision.ROLLBACK_OLD;
        } else if (better) {
            decision = Decision.KEEP_NEW;
        } else {
            decision = Decision.KEEP_OLD;
        }
        LOG.info("Compared with {}: MAE {} -> {} ({}%), RMSE {} -> {} ({}%), decision {}",
                previous.getVersion(), previousMae, newMetrics.getMae(), String.format("%.2f", maeDelta),
                previousRmse, newMetrics.getRmse(), String.format("%.2f", rmseDelta), decision);
        return ComparisonResult.of(better, maeDelta, rmseDelta, decision,
                previous.getVersion(), previousMae, previousRmse);
    }

    /**
     * {@code (previous − current) / previous × 100}; a zero previous value
     * yields 0 when unchanged and −100 otherwise.
     */
    static double deltaPct(double previous, double current) {
        if (previous == 0) {
            return current == 0 ? 0.0 : -100.0;
        }
        return (previous - current) / previous * 100.0;
    }

    // ---------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------

    /**
     * Persist every forecaster of the ensemble under a new version and
     * append a ledger entry. The {@code best_*} aliases are replaced only
     * when the decision promotes the new model.
     *
     * @return the new version id
     */
    public synchronized String promote(ForecastEnsemble ensemble, ComparisonResult comparison,
            int trainingWindowDays) {
        Objects.requireNonNull(ensemble, "ensemble must not be null");
        Objects.requireNonNull(comparison, "comparison must not be null");
        createModelsDir();

        String version = nextVersionId();
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        boolean promotes = comparison.getDecision().promotesNewModel();

        List<TrainedModel> models = new ArrayList<>();
        for (Map.Entry<ForecasterKind, FittedForecaster> entry : ensemble.getModels().entrySet()) {
            ForecasterKind kind = entry.getKey();
            FittedForecaster model = entry.getValue();
            String fileName = kind.fileStem() + "_" + version + ".json";
            byte[] artifact = serialise(model, fileName);
            writeAtomically(modelsDir.resolve(fileName), artifact);
            if (promotes) {
                writeAtomically(modelsDir.resolve(bestFileName(kind)), artifact);
            }
            models.add(new TrainedModel(kind, version, now, model.getTrainingStart(), model.getTrainingEnd(),
                    fileName));
        }

        List<TrainingHistoryEntry> history = new ArrayList<>(history());
        if (promotes) {
            history.forEach(previous -> previous.setCurrentBest(false));
        }
        TrainingHistoryEntry entry = new TrainingHistoryEntry();
        entry.setVersion(version);
        entry.setTimestamp(now);
        entry.setTrainingWindowDays(trainingWindowDays);
        entry.setMetrics(ensemble.getMetrics());
        entry.setComparison(comparison);
        Map<ForecasterKind, EvaluationMetrics> forecasterMetrics = new EnumMap<>(ForecasterKind.class);
        forecasterMetrics.putAll(ensemble.getComponentMetrics());
        entry.setForecasterMetrics(forecasterMetrics);
        entry.setWeights(ensemble.getWeights().asMap());
        entry.setCurrentBest(promotes);
        entry.setModels(models);
        history.add(entry);
        writeHistory(history);

        LOG.info("Saved version {} ({} forecasters), decision {}, current best: {}",
                version, models.size(), comparison.getDecision(), promotes);
        return version;
    }

    /**
     * Keep the newest {@code retainVersions} versioned artifacts per
     * forecaster and delete the rest. {@code best_*} aliases and the ledger
     * are never touched.
     *
     * @return number of deleted files
     */
    public synchronized int cleanup() {
        if (!Files.isDirectory(modelsDir)) {
            return 0;
        }
        int deleted = 0;
        for (ForecasterKind kind : ForecasterKind.values()) {
            List<Path> versions = versionedArtifacts(kind);
            for (int i = settings.getRetainVersions(); i < versions.size(); i++) {
                try {
                    Files.deleteIfExists(versions.get(i));
                    deleted++;
                } catch (IOException e) {
                    throw new ArtifactStorageException("Cannot delete old artifact " + versions.get(i), e);
                }
            }
        }
        LOG.info("Cleanup removed {} old artifact(s), retaining {} per forecaster",
                deleted, settings.getRetainVersions());
        return deleted;
    }

    /**
     * @return the ledger, oldest first; empty when nothing has been trained
     */
    public synchronized List<TrainingHistoryEntry> history() {
        Path file = modelsDir.resolve(HISTORY_FILE);
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<TrainingHistoryEntry> entries = mapper.readValue(file.toFile(), HISTORY_TYPE);
            return entries == null ? List.of() : Collections.unmodifiableList(entries);
        } catch (IOException e) {
            throw new ArtifactStorageException("Cannot read training history " + file, e);
        }
    }

    /**
     * Rebuild the currently promoted ensemble from the {@code best_*} aliases
     * and the newest ledger entry flagged as current best.
     *
     * @return the ensemble, or empty when no model has been promoted
     */
    public synchronized Optional<ForecastEnsemble> loadCurrentBest() {
        List<TrainingHistoryEntry> history = history();
        TrainingHistoryEntry best = null;
        for (int i = history.size() - 1; i >= 0 && best == null; i--) {
            if (history.get(i).isCurrentBest()) {
                best = history.get(i);
            }
        }
        if (best == null || best.getWeights() == null || best.getWeights().isEmpty()) {
            LOG.info("No promoted model in {}", modelsDir);
            return Optional.empty();
        }

        Map<ForecasterKind, FittedForecaster> models = new EnumMap<>(ForecasterKind.class);
        for (ForecasterKind kind : best.getWeights().keySet()) {
            Path file = modelsDir.resolve(bestFileName(kind));
            try {
                models.put(kind, mapper.readValue(file.toFile(), artifactType(kind)));
            } catch (IOException e) {
                throw new ArtifactStorageException("Cannot read model artifact " + file, e);
            }
        }
        Map<ForecasterKind, EvaluationMetrics> componentMetrics = best.getForecasterMetrics() == null
                ? Map.of()
                : best.getForecasterMetrics();
        ForecastEnsemble ensemble = ForecastEnsemble.of(models, EnsembleWeights.of(best.getWeights()),
                componentMetrics, best.getMetrics());
        LOG.info("Loaded current best version {} trained until {}", best.getVersion(), ensemble.getTrainingEnd());
        return Optional.of(ensemble);
    }

    public Path getModelsDir() {
        return modelsDir;
    }

    // ---------------------------------------------------------------
    // File helpers
    // ---------------------------------------------------------------

    static String bestFileName(ForecasterKind kind) {
        return BEST_PREFIX + kind.fileStem() + ".json";
    }

    private static Class<? extends FittedForecaster> artifactType(ForecasterKind kind) {
        return switch (kind) {
            case SEASONAL_TREND, ENHANCED_SEASONAL -> SeasonalTrendModel.class;
            case AUTOREGRESSIVE -> ArimaModel.class;
        };
    }

    /** Versioned artifacts of one forecaster, newest first. */
    private List<Path> versionedArtifacts(ForecasterKind kind) {
        String prefix = kind.fileStem() + "_v";
        try (Stream<Path> files = Files.list(modelsDir)) {
            return files
                    .filter(path -> {
                        String name = path.getFileName().toString();
                        return name.startsWith(prefix) && name.endsWith(".json");
                    })
                    .sorted((a, b) -> b.getFileName().toString().compareTo(a.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new ArtifactStorageException("Cannot list models directory " + modelsDir, e);
        }
    }

    private byte[] serialise(Object value, String description) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new ArtifactStorageException("Cannot serialise " + description, e);
        }
    }

    private void writeHistory(List<TrainingHistoryEntry> history) {
        writeAtomically(modelsDir.resolve(HISTORY_FILE), serialise(history, HISTORY_FILE));
    }

    private void createModelsDir() {
        try {
            Files.createDirectories(modelsDir);
        } catch (IOException e) {
            throw new ArtifactStorageException("Cannot create models directory " + modelsDir, e);
        }
    }

    private void writeAtomically(Path target, byte[] content) {
        Path temp = null;
        try {
            temp = Files.createTempFile(modelsDir, target.getFileName().toString(), ".tmp");
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new ArtifactStorageException("Cannot write " + target, e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException suppressed) {
            LOG.warn("Could not remove temporary file {}: {}", temp, suppressed.getMessage());
        }
    }
}
