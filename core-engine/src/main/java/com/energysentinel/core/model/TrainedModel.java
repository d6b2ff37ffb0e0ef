package com.energysentinel.core.model;

import java.time.LocalDateTime;

/**
 * Metadata of one persisted forecaster artifact.
 *
 * @since 1.0.0
 */
public class TrainedModel {

    private ForecasterKind kind;
    private String versionId;
    private LocalDateTime trainedAt;
    private LocalDateTime trainingStart;
    private LocalDateTime trainingEnd;
    private String artifact;

    /** No-arg constructor required by Jackson. */
    public TrainedModel() {
    }

    public TrainedModel(ForecasterKind kind, String versionId, LocalDateTime trainedAt,
            LocalDateTime trainingStart, LocalDateTime trainingEnd, String artifact) {
        this.kind = kind;
        this.versionId = versionId;
        this.trainedAt = trainedAt;
        this.trainingStart = trainingStart;
        this.trainingEnd = trainingEnd;
        this.artifact = artifact;
    }

    public ForecasterKind getKind() {
        return kind;
    }

    public void setKind(ForecasterKind kind) {
        this.kind = kind;
    }

    public String getVersionId() {
        return versionId;
    }

    public void setVersionId(String versionId) {
        this.versionId = versionId;
    }

    public LocalDateTime getTrainedAt() {
        return trainedAt;
    }

    public void setTrainedAt(LocalDateTime trainedAt) {
        this.trainedAt = trainedAt;
    }

    public LocalDateTime getTrainingStart() {
        return trainingStart;
    }

    public void setTrainingStart(LocalDateTime trainingStart) {
        this.trainingStart = trainingStart;
    }

    public LocalDateTime getTrainingEnd() {
        return trainingEnd;
    }

    public void setTrainingEnd(LocalDateTime trainingEnd) {
        this.trainingEnd = trainingEnd;
    }

    /** File name of the versioned artifact inside the models directory. */
    public String getArtifact() {
        return artifact;
    }

    public void setArtifact(String artifact) {
        this.artifact = artifact;
    }

    @Override
    public String toString() {
        return "TrainedModel{" + kind + " " + versionId + ", artifact='" + artifact + "'}";
    }
}
