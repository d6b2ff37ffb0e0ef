package com.energysentinel.core.detection;

import com.energysentinel.core.model.AnomalyRecord;
import com.energysentinel.core.model.DetectorKind;

import java.util.List;

/**
 * Output of one consensus detection run.
 */
public final class ConsensusResult {

    private final List<AnomalyRecord> records;
    private final List<DetectorKind> activeDetectors;
    private final List<DetectorResult> detectorResults;

    ConsensusResult(List<AnomalyRecord> records, List<DetectorKind> activeDetectors,
            List<DetectorResult> detectorResults) {
        this.records = List.copyOf(records);
        this.activeDetectors = List.copyOf(activeDetectors);
        this.detectorResults = List.copyOf(detectorResults);
    }

    /** Classified anomalies, ordered by severity then time. */
    public List<AnomalyRecord> getRecords() {
        return records;
    }

    /** Detectors that actually ran. */
    public List<DetectorKind> getActiveDetectors() {
        return activeDetectors;
    }

    public List<DetectorResult> getDetectorResults() {
        return detectorResults;
    }

    @Override
    public String toString() {
        return "ConsensusResult{records=" + records.size() + ", activeDetectors=" + activeDetectors + '}';
    }
}
