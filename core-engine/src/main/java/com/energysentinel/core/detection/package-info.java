/**
 * Anomaly detection: five independent single-method detectors, the
 * k-of-n {@link com.energysentinel.core.detection.ConsensusVoter} and the
 * classification of consensus points into typed anomaly records.
 */
package com.energysentinel.core.detection;
