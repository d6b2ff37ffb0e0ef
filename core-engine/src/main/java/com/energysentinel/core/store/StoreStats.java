package com.energysentinel.core.store;

import java.time.LocalDateTime;

/**
 * Summary of the readings held by a {@link TimeSeriesStore}.
 *
 * <p>
 * Timestamps are {@code null} for an empty store.
 * </p>
 */
public final class StoreStats {

    private final long totalRecords;
    private final LocalDateTime firstTimestamp;
    private final LocalDateTime lastTimestamp;

    public StoreStats(long totalRecords, LocalDateTime firstTimestamp, LocalDateTime lastTimestamp) {
        this.totalRecords = totalRecords;
        this.firstTimestamp = firstTimestamp;
        this.lastTimestamp = lastTimestamp;
    }

    public static StoreStats empty() {
        return new StoreStats(0, null, null);
    }

    public long getTotalRecords() {
        return totalRecords;
    }

    public LocalDateTime getFirstTimestamp() {
        return firstTimestamp;
    }

    public LocalDateTime getLastTimestamp() {
        return lastTimestamp;
    }

    public boolean isEmpty() {
        return totalRecords == 0 || lastTimestamp == null;
    }

    @Override
    public String toString() {
        return "StoreStats{totalRecords=" + totalRecords + ", first=" + firstTimestamp + ", last=" + lastTimestamp + '}';
    }
}
