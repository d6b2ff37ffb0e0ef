package com.energysentinel.core.forecast;

import com.energysentinel.core.model.ForecasterKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Blending weights of the forecast ensemble.
 *
 * <h3>Inverse-MAPE rule</h3>
 * <p>
 * {@code w_i = (1 / mape_i) / Σ (1 / mape_j)}. Any forecaster whose weight
 * would fall below the floor is pinned to the floor and the remaining mass is
 * shared among the others in proportion to their inverse MAPE, repeating
 * until no weight is below the floor. Weights always sum to one.
 * </p>
 *
 * <p>
 * A non-finite MAPE contributes no inverse weight; a MAPE of zero is treated
 * as a very small positive value.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnsembleWeights {

    private static final double MIN_MAPE = 1e-9;
    private static final double SUM_TOLERANCE = 1e-6;

    private final Map<ForecasterKind, Double> weights;

    private EnsembleWeights(Map<ForecasterKind, Double> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    /**
     * Compute weights from per-forecaster MAPE values.
     *
     * @param mapeByKind MAPE (percent) per forecaster; must not be empty
     * @param floor      minimum weight per forecaster
     * @return weights covering exactly the keys of {@code mapeByKind}
     * @throws IllegalArgumentException if the floor cannot be honoured
     */
    public static EnsembleWeights fromMape(Map<ForecasterKind, Double> mapeByKind, double floor) {
        Objects.requireNonNull(mapeByKind, "mapeByKind must not be null");
        if (mapeByKind.isEmpty()) {
            throw new IllegalArgumentException("At least one forecaster is required");
        }
        if (floor < 0 || floor * mapeByKind.size() > 1 + SUM_TOLERANCE) {
            throw new IllegalArgumentException("Weight floor " + floor + " cannot be honoured for "
                    + mapeByKind.size() + " forecasters");
        }

        List<ForecasterKind> kinds = new ArrayList<>(mapeByKind.keySet());
        int n = kinds.size();
        double[] inverse = new double[n];
        double inverseSum = 0;
        for (int i = 0; i < n; i++) {
            Double mape = mapeByKind.get(kinds.get(i));
            if (mape != null && Double.isFinite(mape)) {
                inverse[i] = 1.0 / Math.max(mape, MIN_MAPE);
            }
            inverseSum += inverse[i];
        }
        if (inverseSum == 0) {
            Arrays.fill(inverse, 1.0);
        }

        double[] w = new double[n];
        boolean[] pinned = new boolean[n];
        int pinnedCount = 0;
        boolean changed = true;
        while (changed && pinnedCount < n) {
            double remaining = 1.0 - floor * pinnedCount;
            double freeSum = 0;
            for (int i = 0; i < n; i++) {
                if (!pinned[i]) {
                    freeSum += inverse[i];
                }
            }
            changed = false;
            for (int i = 0; i < n; i++) {
                if (pinned[i]) {
                    continue;
                }
                w[i] = freeSum > 0 ? remaining * inverse[i] / freeSum : remaining / (n - pinnedCount);
            }
            for (int i = 0; i < n; i++) {
                if (!pinned[i] && w[i] < floor) {
                    pinned[i] = true;
                    w[i] = floor;
                    pinnedCount++;
                    changed = true;
                }
            }
        }

        Map<ForecasterKind, Double> result = new EnumMap<>(ForecasterKind.class);
        for (int i = 0; i < n; i++) {
            result.put(kinds.get(i), w[i]);
        }
        return new EnsembleWeights(result);
    }

    /**
     * Restore previously computed weights.
     *
     * @throws IllegalArgumentException if the weights do not sum to one
     */
    public static EnsembleWeights of(Map<ForecasterKind, Double> weights) {
        Objects.requireNonNull(weights, "weights must not be null");
        double sum = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        if (weights.isEmpty() || Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Ensemble weights must sum to 1, got " + sum);
        }
        return new EnsembleWeights(new EnumMap<>(weights));
    }

    public double get(ForecasterKind kind) {
        return weights.getOrDefault(kind, 0.0);
    }

    public Set<ForecasterKind> kinds() {
        return weights.keySet();
    }

    public Map<ForecasterKind, Double> asMap() {
        return weights;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EnsembleWeights that))
            return false;
        return weights.equals(that.weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "EnsembleWeights" + weights;
    }
}
