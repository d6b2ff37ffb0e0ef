package com.energysentinel.core.forecast;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Anything that can produce an active-power forecast for given clock hours.
 */
@FunctionalInterface
public interface HourlyForecastSource {

    /**
     * @param hours hour-aligned timestamps
     * @return one prediction per hour; {@code NaN} where no prediction exists
     */
    double[] predictAt(List<LocalDateTime> hours);
}
