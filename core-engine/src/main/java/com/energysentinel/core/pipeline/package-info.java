/**
 * Orchestration of retraining cycles and anomaly passes, with retry,
 * single-flight protection per job id and outcome notification.
 */
package com.energysentinel.core.pipeline;
