package com.energysentinel.core.registry;

import com.energysentinel.core.model.ComparisonResult;
import com.energysentinel.core.model.EvaluationMetrics;
import com.energysentinel.core.model.ForecasterKind;
import com.energysentinel.core.model.TrainedModel;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One entry of the append-only training history ledger
 * ({@code training_history.json}).
 *
 * <p>
 * Field names are persisted in snake_case and form part of the artifact
 * compatibility contract.
 * </p>
 *
 * @since 1.0.0
 */
public class TrainingHistoryEntry {

    private String version;
    private LocalDateTime timestamp;
    private int trainingWindowDays;
    private EvaluationMetrics metrics;
    private ComparisonResult comparison;
    private Map<ForecasterKind, EvaluationMetrics> forecasterMetrics = new EnumMap<>(ForecasterKind.class);
    private Map<ForecasterKind, Double> weights = new EnumMap<>(ForecasterKind.class);
    private boolean currentBest;
    private List<TrainedModel> models = new ArrayList<>();

    /** No-arg constructor required by Jackson. */
    public TrainingHistoryEntry() {
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(LocalDateTime timestamp) {
        this.timestamp = timestamp;
    }

    public int getTrainingWindowDays() {
        return trainingWindowDays;
    }

    public void setTrainingWindowDays(int trainingWindowDays) {
        this.trainingWindowDays = trainingWindowDays;
    }

    /** Holdout metrics of the blended ensemble. */
    public EvaluationMetrics getMetrics() {
        return metrics;
    }

    public void setMetrics(EvaluationMetrics metrics) {
        this.metrics = metrics;
    }

    public ComparisonResult getComparison() {
        return comparison;
    }

    public void setComparison(ComparisonResult comparison) {
        this.comparison = comparison;
    }

    public Map<ForecasterKind, EvaluationMetrics> getForecasterMetrics() {
        return forecasterMetrics;
    }

    public void setForecasterMetrics(Map<ForecasterKind, EvaluationMetrics> forecasterMetrics) {
        this.forecasterMetrics = forecasterMetrics;
    }

    public Map<ForecasterKind, Double> getWeights() {
        return weights;
    }

    public void setWeights(Map<ForecasterKind, Double> weights) {
        this.weights = weights;
    }

    @JsonProperty("is_current_best")
    public boolean isCurrentBest() {
        return currentBest;
    }

    @JsonProperty("is_current_best")
    public void setCurrentBest(boolean currentBest) {
        this.currentBest = currentBest;
    }

    public List<TrainedModel> getModels() {
        return models;
    }

    public void setModels(List<TrainedModel> models) {
        this.models = models;
    }

    @Override
    public String toString() {
        return "TrainingHistoryEntry{version='" + version + "', currentBest=" + currentBest
                + ", metrics=" + metrics + '}';
    }
}
