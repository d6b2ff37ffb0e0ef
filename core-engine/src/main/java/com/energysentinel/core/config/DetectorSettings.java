package com.energysentinel.core.config;

import com.energysentinel.core.model.DetectorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Configuration of a single anomaly detector.
 *
 * <p>
 * Supported types: {@code iqr}, {@code zscore}, {@code isolation_forest},
 * {@code moving_average}, {@code forecast_residual}. Numeric fields left at
 * zero fall back to the detector's default.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorSettings {

    /** Detector type, see {@link DetectorKind#getConfigName()}. */
    private String type;

    /** IQR multiplier for the range detector. */
    private double multiplier;

    /** z-score limit, or relative deviation for moving-average and residual detectors. */
    private double threshold;

    /** Rolling window length for the moving-average detector. */
    private int windowSize;

    // --- Isolation forest ---
    private double contamination;
    private int numberOfTrees;
    private int sampleSize;
    private long seed = 42L;

    public DetectorSettings() {
    }

    public static DetectorSettings ofType(String type) {
        DetectorSettings settings = new DetectorSettings();
        settings.setType(type);
        return settings;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException if the settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        collectErrors(errors);
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid DetectorSettings: " + String.join("; ", errors));
        }
    }

    void collectErrors(List<String> errors) {
        if (type == null || type.isBlank()) {
            errors.add("Detector 'type' is required");
            return;
        }
        DetectorKind kind;
        try {
            kind = DetectorKind.fromConfigName(type);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
            return;
        }
        if (multiplier < 0 || threshold < 0 || windowSize < 0) {
            errors.add("Detector '" + type + "' has negative multiplier, threshold or windowSize");
        }
        switch (kind) {
            case MOVING_AVERAGE -> {
                if (windowSize == 1) {
                    errors.add("Detector 'moving_average' requires 'windowSize' >= 2");
                }
            }
            case ISOLATION -> {
                if (contamination < 0 || contamination >= 0.5) {
                    errors.add("Detector 'isolation_forest' requires 'contamination' in [0, 0.5)");
                }
                if (numberOfTrees < 0 || sampleSize < 0) {
                    errors.add("Detector 'isolation_forest' has negative numberOfTrees or sampleSize");
                }
            }
            default -> {
                // no type-specific fields
            }
        }
    }

    /**
     * @return the resolved kind
     * @throws IllegalArgumentException if the type is unknown
     */
    public DetectorKind kind() {
        return DetectorKind.fromConfigName(type);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getType() {
        return type;
    }

    /**
     * Set the detector type, normalised to lowercase.
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public void setMultiplier(double multiplier) {
        this.multiplier = multiplier;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public void setNumberOfTrees(int numberOfTrees) {
        this.numberOfTrees = numberOfTrees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorSettings that))
            return false;
        return Objects.equals(type, that.type)
                && Double.compare(multiplier, that.multiplier) == 0
                && Double.compare(threshold, that.threshold) == 0
                && windowSize == that.windowSize;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, multiplier, threshold, windowSize);
    }

    @Override
    public String toString() {
        return "DetectorSettings{" +
                "type='" + type + '\'' +
                ", multiplier=" + multiplier +
                ", threshold=" + threshold +
                ", windowSize=" + windowSize +
                ", contamination=" + contamination +
                ", numberOfTrees=" + numberOfTrees +
                ", sampleSize=" + sampleSize +
                ", seed=" + seed +
                '}';
    }
}
