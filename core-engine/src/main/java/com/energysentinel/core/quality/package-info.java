/**
 * Data quality gate applied to every raw window before training.
 */
package com.energysentinel.core.quality;
