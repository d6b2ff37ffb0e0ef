package com.energysentinel.core.detection;

import com.energysentinel.core.model.DetectorKind;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Combines detector results into consensus anomalies.
 *
 * <p>
 * A timestamp is a consensus anomaly when it lies in the intersection of the
 * flagged sets of at least one subset of {@code k} detectors; the consensus
 * set is the union over all such {@code k}-subsets. With fewer than
 * {@code k} detectors the consensus is empty.
 * </p>
 *
 * @since 1.0.0
 */
public class ConsensusVoter {

    private final int threshold;

    /**
     * @param threshold number of detectors that must agree; {@code >= 1}
     */
    public ConsensusVoter(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Consensus threshold must be >= 1, got: " + threshold);
        }
        this.threshold = threshold;
    }

    /**
     * @param results one result per active detector
     * @return consensus timestamps in ascending order, each mapped to every
     *         detector that flagged it
     */
    public NavigableMap<LocalDateTime, Set<DetectorKind>> vote(List<DetectorResult> results) {
        Objects.requireNonNull(results, "results must not be null");
        NavigableMap<LocalDateTime, Set<DetectorKind>> consensus = new TreeMap<>();
        if (results.size() < threshold) {
            return consensus;
        }

        NavigableSet<LocalDateTime> union = new TreeSet<>();
        for (List<DetectorResult> subset : combinations(results, threshold)) {
            union.addAll(intersection(subset));
        }

        for (LocalDateTime ts : union) {
            Set<DetectorKind> votes = EnumSet.noneOf(DetectorKind.class);
            for (DetectorResult result : results) {
                if (result.isFlagged(ts)) {
                    votes.add(result.getKind());
                }
            }
            consensus.put(ts, Collections.unmodifiableSet(votes));
        }
        return consensus;
    }

    public int getThreshold() {
        return threshold;
    }

    // ---------------------------------------------------------------
    // Set helpers
    // ---------------------------------------------------------------

    private static Set<LocalDateTime> intersection(List<DetectorResult> subset) {
        Set<LocalDateTime> common = new TreeSet<>(subset.get(0).getFlagged());
        for (int i = 1; i < subset.size() && !common.isEmpty(); i++) {
            common.retainAll(subset.get(i).getFlagged());
        }
        return common;
    }

    static <T> List<List<T>> combinations(List<T> items, int k) {
        List<List<T>> out = new ArrayList<>();
        collect(items, k, 0, new ArrayList<>(k), out);
        return out;
    }

    private static <T> void collect(List<T> items, int k, int from, List<T> current, List<List<T>> out) {
        if (current.size() == k) {
            out.add(List.copyOf(current));
            return;
        }
        for (int i = from; i <= items.size() - (k - current.size()); i++) {
            current.add(items.get(i));
            collect(items, k, i + 1, current, out);
            current.remove(current.size() - 1);
        }
    }
}
