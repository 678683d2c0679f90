package com.stationsync.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Per-record counts of a chunked delivery. {@code total} is always {@code success + failed}.
 */
public record BatchResult(
    @PositiveOrZero
    @JsonProperty("success")
    int success,

    @PositiveOrZero
    @JsonProperty("failed")
    int failed
) {
    private static final BatchResult EMPTY = new BatchResult(0, 0);

    public BatchResult {
        if (success < 0 || failed < 0) {
            throw new IllegalArgumentException("Counts cannot be negative: success=" + success + ", failed=" + failed);
        }
    }

    public static BatchResult empty() {
        return EMPTY;
    }

    public static BatchResult succeeded(int count) {
        return new BatchResult(count, 0);
    }

    public static BatchResult failed(int count) {
        return new BatchResult(0, count);
    }

    @JsonProperty("total")
    public int total() {
        return success + failed;
    }

    public BatchResult plus(BatchResult other) {
        return new BatchResult(success + other.success, failed + other.failed);
    }

    public boolean hasFailures() {
        return failed > 0;
    }
}
