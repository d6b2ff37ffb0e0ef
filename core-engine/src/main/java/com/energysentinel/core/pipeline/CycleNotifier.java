package com.energysentinel.core.pipeline;

import com.energysentinel.core.model.AnomalyPassResult;
import com.energysentinel.core.model.CycleReport;

/**
 * Receives the outcome of every retraining cycle and anomaly pass.
 *
 * <p>
 * Implementations may throw; the orchestrator retries failed notifications
 * and logs the final failure without changing the reported status.
 * </p>
 */
public interface CycleNotifier {

    void onCycleCompleted(CycleReport report);

    void onAnomalyPass(AnomalyPassResult result);
}
