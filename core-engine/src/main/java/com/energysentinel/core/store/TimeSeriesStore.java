package com.energysentinel.core.store;

import com.energysentinel.core.error.DatabaseConnectionException;
import com.energysentinel.core.model.TimeSeriesWindow;

import java.time.LocalDateTime;

/**
 * Source of historical energy readings.
 *
 * <p>
 * Implementations signal transient connectivity problems with
 * {@link DatabaseConnectionException}; callers retry only those.
 * </p>
 */
public interface TimeSeriesStore extends AutoCloseable {

    /**
     * Readings with {@code start <= timestamp <= end}, ascending.
     */
    TimeSeriesWindow getWindow(LocalDateTime start, LocalDateTime end);

    /**
     * Readings of the last {@code hours} hours.
     */
    TimeSeriesWindow getRecent(int hours);

    StoreStats getStats();

    /**
     * Cheap round trip to the store.
     *
     * @return {@code true} if the store answered, {@code false} if it could
     *         not be reached
     */
    boolean testConnection();

    @Override
    default void close() {
        // nothing to release by default
    }
}
