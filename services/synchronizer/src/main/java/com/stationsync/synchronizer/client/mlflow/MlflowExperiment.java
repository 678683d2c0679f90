package com.stationsync.synchronizer.client.mlflow;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MlflowExperiment(
    @JsonProperty("experiment_id")
    String experimentId,

    @JsonProperty("name")
    String name,

    @JsonProperty("lifecycle_stage")
    String lifecycleStage
) {
    public boolean isActive() {
        return lifecycleStage == null || "active".equals(lifecycleStage);
    }
}
