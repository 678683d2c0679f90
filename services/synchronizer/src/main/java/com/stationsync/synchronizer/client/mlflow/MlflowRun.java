package com.stationsync.synchronizer.client.mlflow;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stationsync.common.model.RunRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A run as returned by {@code runs/search}. Tags and params arrive as key/value lists.
 */
public record MlflowRun(
    @JsonProperty("info")
    Info info,

    @JsonProperty("data")
    Data data
) {
    /** Tag MLflow uses for the run name on servers older than 1.30. */
    static final String RUN_NAME_TAG = "mlflow.runName";

    public record Info(
        @JsonProperty("run_id")
        String runId,

        @JsonProperty("run_name")
        String runName,

        @JsonProperty("start_time")
        Long startTime
    ) {
    }

    public record Data(
        @JsonProperty("tags")
        List<KeyValue> tags,

        @JsonProperty("params")
        List<KeyValue> params
    ) {
    }

    public record KeyValue(
        @JsonProperty("key")
        String key,

        @JsonProperty("value")
        String value
    ) {
    }

    public RunRecord toRunRecord() {
        Map<String, String> tags = toMap(data != null ? data.tags() : null);
        Map<String, String> params = toMap(data != null ? data.params() : null);
        String runName = info.runName() != null ? info.runName() : tags.get(RUN_NAME_TAG);
        long startTime = info.startTime() != null ? info.startTime() : 0L;
        return new RunRecord(info.runId(), runName, startTime, tags, params);
    }

    private static Map<String, String> toMap(List<KeyValue> entries) {
        Map<String, String> map = new LinkedHashMap<>();
        if (entries != null) {
            for (KeyValue entry : entries) {
                if (entry.key() != null) {
                    map.put(entry.key(), entry.value());
                }
            }
        }
        return map;
    }
}
