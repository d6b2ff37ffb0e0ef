package com.energysentinel.core.detection;

import com.energysentinel.core.model.DetectorKind;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Timestamps flagged by a single detector over one window.
 *
 * @since 1.0.0
 */
public final class DetectorResult {

    private final DetectorKind kind;
    private final NavigableSet<LocalDateTime> flagged;
    private final int evaluatedCount;

    private DetectorResult(DetectorKind kind, NavigableSet<LocalDateTime> flagged, int evaluatedCount) {
        this.kind = kind;
        this.flagged = flagged;
        this.evaluatedCount = evaluatedCount;
    }

    /**
     * @param kind           detector that produced the result
     * @param flagged        flagged timestamps, in any order
     * @param evaluatedCount number of readings the detector actually judged
     */
    public static DetectorResult of(DetectorKind kind, Collection<LocalDateTime> flagged, int evaluatedCount) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(flagged, "flagged must not be null");
        return new DetectorResult(kind, Collections.unmodifiableNavigableSet(new TreeSet<>(flagged)), evaluatedCount);
    }

    public static DetectorResult none(DetectorKind kind, int evaluatedCount) {
        return of(kind, Collections.emptySet(), evaluatedCount);
    }

    public DetectorKind getKind() {
        return kind;
    }

    /** Flagged timestamps in ascending order. */
    public NavigableSet<LocalDateTime> getFlagged() {
        return flagged;
    }

    public int getEvaluatedCount() {
        return evaluatedCount;
    }

    public boolean isFlagged(LocalDateTime timestamp) {
        return flagged.contains(timestamp);
    }

    @Override
    public String toString() {
        return kind + ": " + flagged.size() + " of " + evaluatedCount + " flagged";
    }
}
