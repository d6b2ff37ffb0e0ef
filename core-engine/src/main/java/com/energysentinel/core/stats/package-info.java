/**
 * Numeric helpers shared by the detectors and forecasters: descriptive
 * statistics and the small least-squares solver.
 */
package com.energysentinel.core.stats;
