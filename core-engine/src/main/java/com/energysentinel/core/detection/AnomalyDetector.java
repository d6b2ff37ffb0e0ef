package com.energysentinel.core.detection;

import com.energysentinel.core.model.DetectorKind;
import com.energysentinel.core.model.TimeSeriesWindow;

/**
 * Contract for the single-method anomaly detectors that vote on consensus.
 * <p>
 * Implementations are <strong>stateless</strong> between calls: every call
 * to {@link #detect(TimeSeriesWindow)} looks at one complete window, so one
 * instance may be shared by concurrent anomaly passes.
 * </p>
 * <p>
 * Readings without an active-power value are never evaluated.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Evaluate every reading of the window.
     *
     * @param window the readings to inspect
     * @return the timestamps this detector flags
     */
    DetectorResult detect(TimeSeriesWindow window);

    /**
     * Return the kind of method this detector implements.
     *
     * @return detector kind
     */
    DetectorKind getKind();
}
