/**
 * Port to the time-series storage holding historical readings.
 */
package com.energysentinel.core.store;
