package com.energysentinel.core.preprocess;

import com.energysentinel.core.config.PreprocessingSettings;
import com.energysentinel.core.model.EnergyReading;
import com.energysentinel.core.model.Measurement;
import com.energysentinel.core.model.TimeSeriesWindow;
import com.energysentinel.core.stats.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Cleans a validated window before training.
 *
 * <h3>Steps</h3>
 * <ol>
 * <li>linear interpolation of missing active-power readings, extended to both
 * ends of the window</li>
 * <li>active-power values further than N standard deviations from the mean are
 * replaced by the mean, preserving the row count</li>
 * <li>time ordering is re-checked</li>
 * <li>if the largest gap exceeds the configured limit, the whole window is
 * resampled to fixed buckets by mean aggregation and every column is
 * re-interpolated</li>
 * <li>rows still missing an active-power value are dropped</li>
 * </ol>
 *
 * <p>
 * The input window is never modified. The result is deterministic for a given
 * input.
 * </p>
 *
 * @since 1.0.0
 */
public class Preprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(Preprocessor.class);

    private static final Measurement[] COLUMNS = Measurement.values();

    private final PreprocessingSettings settings;

    public Preprocessor(PreprocessingSettings settings) {
        this.settings = Objects.requireNonNull(settings, "PreprocessingSettings must not be null");
    }

    /**
     * Produce a cleaned copy of {@code window}.
     *
     * @param window raw window; must not be {@code null}
     * @return a new window with no missing active-power readings
     */
    public TimeSeriesWindow process(TimeSeriesWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        if (window.isEmpty()) {
            return window;
        }

        double[] power = toArray(window.column(Measurement.ACTIVE_POWER));
        double[] filled = Stats.interpolate(power);
        int replaced = clipOutliers(filled);

        List<EnergyReading> cleaned = new ArrayList<>(window.size());
        for (int i = 0; i < window.size(); i++) {
            Double value = Double.isNaN(filled[i]) ? null : filled[i];
            cleaned.add(window.get(i).with(Measurement.ACTIVE_POWER, value));
        }
        cleaned.sort((a, b) -> a.getTimestamp().compareTo(b.getTimestamp()));
        TimeSeriesWindow result = TimeSeriesWindow.of(cleaned);

        Duration maxGap = result.maxGap();
        boolean resampled = false;
        if (maxGap.toSeconds() > settings.getResampleGapHours() * 3600) {
            LOG.info("Largest gap {} exceeds {} h, resampling to {}-minute buckets",
                    maxGap, settings.getResampleGapHours(), settings.getResampleMinutes());
            result = resample(result);
            resampled = true;
        }

        List<EnergyReading> complete = result.withActivePower();
        int dropped = result.size() - complete.size();
        LOG.info("Preprocessed {} readings into {} (interpolated {}, outliers replaced {}, resampled {}, dropped {})",
                window.size(), complete.size(), countNaN(power), replaced, resampled, dropped);
        return dropped == 0 ? result : TimeSeriesWindow.of(complete);
    }

    // ---------------------------------------------------------------
    // Steps
    // ---------------------------------------------------------------

    private int clipOutliers(double[] values) {
        double[] valid = Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
        double mean = Stats.mean(valid);
        double stdDev = Stats.sampleStdDev(valid);
        if (Double.isNaN(stdDev) || stdDev == 0) {
            return 0;
        }
        double limit = settings.getOutlierStdDevs() * stdDev;
        int replaced = 0;
        for (int i = 0; i < values.length; i++) {
            if (Math.abs(values[i] - mean) > limit) {
                values[i] = mean;
                replaced++;
            }
        }
        return replaced;
    }

    TimeSeriesWindow resample(TimeSeriesWindow window) {
        int bucketMinutes = settings.getResampleMinutes();
        LocalDateTime origin = bucketStart(window.getStart(), bucketMinutes);
        LocalDateTime last = bucketStart(window.getEnd(), bucketMinutes);
        int buckets = (int) (ChronoUnit.MINUTES.between(origin, last) / bucketMinutes) + 1;

        double[][] sums = new double[COLUMNS.length][buckets];
        int[][] counts = new int[COLUMNS.length][buckets];
        for (EnergyReading reading : window) {
            int bucket = (int) (ChronoUnit.MINUTES.between(origin,
                    bucketStart(reading.getTimestamp(), bucketMinutes)) / bucketMinutes);
            for (Measurement column : COLUMNS) {
                Double value = reading.get(column);
                if (value != null) {
                    sums[column.ordinal()][bucket] += value;
                    counts[column.ordinal()][bucket]++;
                }
            }
        }

        double[][] series = new double[COLUMNS.length][];
        for (Measurement column : COLUMNS) {
            int c = column.ordinal();
            double[] means = new double[buckets];
            for (int b = 0; b < buckets; b++) {
                means[b] = counts[c][b] == 0 ? Double.NaN : sums[c][b] / counts[c][b];
            }
            series[c] = Stats.interpolate(means);
        }

        List<EnergyReading> readings = new ArrayList<>(buckets);
        for (int b = 0; b < buckets; b++) {
            EnergyReading.Builder builder = EnergyReading.builder(origin.plusMinutes((long) b * bucketMinutes));
            for (Measurement column : COLUMNS) {
                double value = series[column.ordinal()][b];
                builder.set(column, Double.isNaN(value) ? null : value);
            }
            readings.add(builder.build());
        }
        return TimeSeriesWindow.of(readings);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static LocalDateTime bucketStart(LocalDateTime ts, int bucketMinutes) {
        LocalDateTime minute = ts.truncatedTo(ChronoUnit.MINUTES);
        long offset = Math.floorMod(minute.getHour() * 60L + minute.getMinute(), bucketMinutes);
        return minute.minusMinutes(offset);
    }

    private static double[] toArray(Double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] == null ? Double.NaN : values[i];
        }
        return out;
    }

    private static int countNaN(double[] values) {
        int n = 0;
        for (double v : values) {
            if (Double.isNaN(v)) {
                n++;
            }
        }
        return n;
    }
}
