package com.energysentinel.core.detection;

import com.energysentinel.core.config.DetectionSettings;
import com.energysentinel.core.error.EngineException;
import com.energysentinel.core.error.ErrorKind;
import com.energysentinel.core.forecast.HourlyForecastSource;
import com.energysentinel.core.model.AnomalyRecord;
import com.energysentinel.core.model.DetectorKind;
import com.energysentinel.core.model.EnergyReading;
import com.energysentinel.core.model.TimeSeriesWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs the configured detectors over a window and turns their consensus into
 * classified {@link AnomalyRecord}s.
 *
 * <h3>Execution</h3>
 * <p>
 * Detectors run concurrently on the supplied worker pool. The
 * forecast-residual detector takes part only when a forecast is supplied.
 * The first detector failure aborts the run: engine errors propagate
 * unchanged, anything else is reported as {@link ErrorKind#INTERNAL}.
 * </p>
 *
 * @since 1.0.0
 */
public class ConsensusDetectionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ConsensusDetectionEngine.class);

    private final DetectionSettings settings;
    private final ExecutorService executor;
    private final ConsensusVoter voter;

    public ConsensusDetectionEngine(DetectionSettings settings, ExecutorService executor) {
        this.settings = Objects.requireNonNull(settings, "DetectionSettings must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.voter = new ConsensusVoter(settings.getConsensusThreshold());
    }

    /**
     * @param window   readings to inspect
     * @param forecast hourly forecast for the residual detector, if any
     */
    public ConsensusResult detect(TimeSeriesWindow window, Optional<HourlyForecastSource> forecast) {
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(forecast, "forecast must not be null");
        List<AnomalyDetector> detectors = DetectorFactory.createAll(settings.getDetectors(), forecast.orElse(null));
        return detect(window, detectors);
    }

    ConsensusResult detect(TimeSeriesWindow window, List<AnomalyDetector> detectors) {
        List<CompletableFuture<DetectorResult>> futures = new ArrayList<>(detectors.size());
        for (AnomalyDetector detector : detectors) {
            futures.add(CompletableFuture.supplyAsync(() -> detector.detect(window), executor));
        }

        List<DetectorResult> results = new ArrayList<>(detectors.size());
        List<DetectorKind> active = new ArrayList<>(detectors.size());
        for (int i = 0; i < futures.size(); i++) {
            DetectorResult result = await(detectors.get(i).getKind(), futures.get(i));
            LOG.info("Detector {}", result);
            results.add(result);
            active.add(result.getKind());
        }

        NavigableMap<LocalDateTime, Set<DetectorKind>> consensus = voter.vote(results);
        List<AnomalyRecord> records = classify(window, consensus);
        LOG.info("Consensus (k={}) over {} detectors found {} anomalies in {} readings",
                voter.getThreshold(), active.size(), records.size(), window.size());
        return new ConsensusResult(records, active, results);
    }

    private static List<AnomalyRecord> classify(TimeSeriesWindow window,
            NavigableMap<LocalDateTime, Set<DetectorKind>> consensus) {
        if (consensus.isEmpty()) {
            return List.of();
        }
        List<EnergyReading> readings = window.withActivePower();
        double[] values = new double[readings.size()];
        Map<LocalDateTime, Integer> indexByTime = new HashMap<>();
        for (int i = 0; i < values.length; i++) {
            values[i] = readings.get(i).getActivePower();
            indexByTime.put(readings.get(i).getTimestamp(), i);
        }

        AnomalyClassifier classifier = new AnomalyClassifier(values);
        List<AnomalyRecord> records = new ArrayList<>(consensus.size());
        for (Map.Entry<LocalDateTime, Set<DetectorKind>> entry : consensus.entrySet()) {
            int index = indexByTime.get(entry.getKey());
            double value = values[index];
            double difference = index == 0 ? Double.NaN : value - values[index - 1];
            records.add(AnomalyRecord.builder()
                    .timestamp(entry.getKey())
                    .value(value)
                    .methodVotes(entry.getValue())
                    .type(classifier.classify(entry.getKey(), value, difference))
                    .build());
        }
        records.sort(AnomalyRecord.BY_SEVERITY_THEN_TIME);
        return records;
    }

    private static DetectorResult await(DetectorKind kind, CompletableFuture<DetectorResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof EngineException engineException) {
                throw engineException;
            }
            throw new EngineException(ErrorKind.INTERNAL, "Detector " + kind + " failed: " + cause.getMessage(), cause);
        }
    }
}
