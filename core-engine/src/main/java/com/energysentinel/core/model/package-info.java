/**
 * Domain model shared by every engine component.
 *
 * <p>
 * {@link com.energysentinel.core.model.TimeSeriesWindow} is the unit of work
 * consumed by the quality gate, preprocessor, forecasters and detectors.
 * {@link com.energysentinel.core.model.CycleReport} and
 * {@link com.energysentinel.core.model.AnomalyPassResult} are the only objects
 * handed to the notification layer.
 * </p>
 *
 * @since 1.0.0
 */
package com.energysentinel.core.model;
