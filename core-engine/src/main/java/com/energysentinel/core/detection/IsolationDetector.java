package com.energysentinel.core.detection;

import com.amazon.randomcutforest.RandomCutForest;
import com.energysentinel.core.config.DetectorSettings;
import com.energysentinel.core.error.ModelTrainingException;
import com.energysentinel.core.model.DetectorKind;
import com.energysentinel.core.model.EnergyReading;
import com.energysentinel.core.model.TimeSeriesWindow;
import com.energysentinel.core.stats.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Isolation-based detector backed by a Random Cut Forest.
 *
 * <p>
 * Each reading becomes a point {@code [power, voltage, current]}, every
 * dimension standardised to zero mean and unit variance over the window.
 * The forest is built from all points (in a seeded shuffled order so the
 * reservoir sample is not biased towards the end of the window) and each
 * point is then scored. The top {@code contamination} fraction by anomaly
 * score is flagged.
 * </p>
 *
 * <h3>Defaults</h3>
 * <ul>
 * <li>100 trees, sample size 256, seed 42</li>
 * <li>contamination 0.05</li>
 * </ul>
 * <p>
 * Readings missing any of the three measurements are skipped. Results are
 * deterministic for a given window and seed.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationDetector.class);

    static final double DEFAULT_CONTAMINATION = 0.05;
    static final int DEFAULT_TREES = 100;
    static final int DEFAULT_SAMPLE_SIZE = 256;
    private static final int DIMENSIONS = 3;

    private final double contamination;
    private final int numberOfTrees;
    private final int sampleSize;
    private final long seed;

    public IsolationDetector(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        this.contamination = settings.getContamination() > 0 ? settings.getContamination() : DEFAULT_CONTAMINATION;
        this.numberOfTrees = settings.getNumberOfTrees() > 0 ? settings.getNumberOfTrees() : DEFAULT_TREES;
        this.sampleSize = settings.getSampleSize() > 0 ? settings.getSampleSize() : DEFAULT_SAMPLE_SIZE;
        this.seed = settings.getSeed();
    }

    @Override
    public DetectorResult detect(TimeSeriesWindow window) {
        List<EnergyReading> complete = new ArrayList<>();
        for (EnergyReading reading : window) {
            if (reading.hasActivePower() && reading.getVoltage() != null && reading.getCurrent() != null) {
                complete.add(reading);
            }
        }
        int n = complete.size();
        int toFlag = (int) Math.floor(contamination * n);
        if (toFlag == 0) {
            LOG.debug("Isolation forest: {} complete readings, nothing to flag", n);
            return DetectorResult.none(getKind(), n);
        }

        double[][] points = standardise(complete);
        double[] scores;
        try {
            scores = score(points);
        } catch (RuntimeException e) {
            throw new ModelTrainingException(getKind().name(),
                    "Random cut forest failed on " + n + " points: " + e.getMessage(), e);
        }

        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble((Integer i) -> scores[i]).reversed());

        List<LocalDateTime> flagged = new ArrayList<>(toFlag);
        for (int i = 0; i < toFlag; i++) {
            flagged.add(complete.get(order.get(i)).getTimestamp());
        }
        LOG.debug("Isolation forest flagged {} of {} (contamination {})", toFlag, n, contamination);
        return DetectorResult.of(getKind(), flagged, n);
    }

    private double[] score(double[][] points) {
        RandomCutForest forest = RandomCutForest
                .builder()
                .dimensions(DIMENSIONS)
                .numberOfTrees(numberOfTrees)
                .sampleSize(sampleSize)
                .randomSeed(seed)
                .timeDecay(0.0)
                .outputAfter(1)
                .parallelExecutionEnabled(false)
                .build();

        List<Integer> feedOrder = new ArrayList<>(points.length);
        for (int i = 0; i < points.length; i++) {
            feedOrder.add(i);
        }
        Collections.shuffle(feedOrder, new Random(seed));
        for (int index : feedOrder) {
            forest.update(points[index]);
        }

        double[] scores = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            scores[i] = forest.getAnomalyScore(points[i]);
        }
        return scores;
    }

    static double[][] standardise(List<EnergyReading> readings) {
        int n = readings.size();
        double[][] columns = new double[DIMENSIONS][n];
        for (int i = 0; i < n; i++) {
            EnergyReading reading = readings.get(i);
            columns[0][i] = reading.getActivePower();
            columns[1][i] = reading.getVoltage();
            columns[2][i] = reading.getCurrent();
        }
        double[][] points = new double[n][DIMENSIONS];
        for (int d = 0; d < DIMENSIONS; d++) {
            double mean = Stats.mean(columns[d]);
            double stddev = Stats.sampleStdDev(columns[d]);
            for (int i = 0; i < n; i++) {
                // constant columns carry no information
                points[i][d] = stddev > 0 ? (columns[d][i] - mean) / stddev : 0.0;
            }
        }
        return points;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.ISOLATION;
    }
}
