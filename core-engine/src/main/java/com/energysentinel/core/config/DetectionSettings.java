package com.energysentinel.core.config;

import com.energysentinel.core.model.DetectorKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Settings of the anomaly consensus engine.
 */
public class DetectionSettings {

    /** Minimum number of detectors that must jointly flag a point. */
    private int consensusThreshold = 3;

    /** Length of the window fetched for an anomaly pass. */
    private int lookbackHours = 24;

    /** Minimum number of readings required to run an anomaly pass. */
    private int minReadings = 30;

    private List<DetectorSettings> detectors = defaultDetectors();

    static List<DetectorSettings> defaultDetectors() {
        List<DetectorSettings> defaults = new ArrayList<>();
        for (DetectorKind kind : DetectorKind.values()) {
            defaults.add(DetectorSettings.ofType(kind.getConfigName()));
        }
        return defaults;
    }

    void collectErrors(List<String> errors) {
        if (consensusThreshold < 1) {
            errors.add("detection.consensusThreshold must be >= 1");
        }
        if (lookbackHours < 1) {
            errors.add("detection.lookbackHours must be >= 1");
        }
        if (minReadings < 1) {
            errors.add("detection.minReadings must be >= 1");
        }
        if (detectors == null || detectors.isEmpty()) {
            errors.add("detection.detectors must list at least one detector");
            return;
        }
        Set<DetectorKind> seen = EnumSet.noneOf(DetectorKind.class);
        for (DetectorSettings detector : detectors) {
            int before = errors.size();
            detector.collectErrors(errors);
            if (errors.size() == before && !seen.add(detector.kind())) {
                errors.add("Detector '" + detector.getType() + "' is configured more than once");
            }
        }
    }

    public int getConsensusThreshold() {
        return consensusThreshold;
    }

    public void setConsensusThreshold(int consensusThreshold) {
        this.consensusThreshold = consensusThreshold;
    }

    public int getLookbackHours() {
        return lookbackHours;
    }

    public void setLookbackHours(int lookbackHours) {
        this.lookbackHours = lookbackHours;
    }

    public int getMinReadings() {
        return minReadings;
    }

    public void setMinReadings(int minReadings) {
        this.minReadings = minReadings;
    }

    public List<DetectorSettings> getDetectors() {
        return detectors;
    }

    public void setDetectors(List<DetectorSettings> detectors) {
        this.detectors = detectors;
    }
}
