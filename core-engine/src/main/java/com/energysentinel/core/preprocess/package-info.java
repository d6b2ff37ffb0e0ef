/**
 * Window cleaning: interpolation, outlier replacement and gap resampling.
 */
package com.energysentinel.core.preprocess;
