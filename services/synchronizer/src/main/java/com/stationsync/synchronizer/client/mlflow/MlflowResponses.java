package com.stationsync.synchronizer.client.mlflow;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response envelopes of the MLflow 2.0 REST API.
 */
public final class MlflowResponses {

    private MlflowResponses() {}

    public record GetExperiment(
        @JsonProperty("experiment")
        MlflowExperiment experiment
    ) {
    }

    public record SearchExperiments(
        @JsonProperty("experiments")
        List<MlflowExperiment> experiments,

        @JsonProperty("next_page_token")
        String nextPageToken
    ) {
        List<MlflowExperiment> experimentsOrEmpty() {
            return experiments != null ? experiments : List.of();
        }
    }

    public record SearchRuns(
        @JsonProperty("runs")
        List<MlflowRun> runs
    ) {
        List<MlflowRun> runsOrEmpty() {
            return runs != null ? runs : List.of();
        }
    }
}
