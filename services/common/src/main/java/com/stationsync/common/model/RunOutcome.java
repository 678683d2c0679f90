package com.stationsync.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of pushing one experiment run through the synchronization pipeline.
 *
 * <p>{@code success} is {@code recordsSent > 0}: a run with some failed chunks still
 * counts as successful. {@code complete} additionally requires that no chunk failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunOutcome(
    @JsonProperty("runId")
    String runId,

    @JsonProperty("runName")
    String runName,

    @JsonProperty("stationName")
    String stationName,

    @JsonProperty("deviceFound")
    boolean deviceFound,

    @JsonProperty("dataFound")
    boolean dataFound,

    @JsonProperty("recordsSent")
    int recordsSent,

    @JsonProperty("recordsFailed")
    int recordsFailed,

    @JsonProperty("failure")
    FailureKind failure,

    @JsonProperty("error")
    String error
) {
    @JsonProperty("success")
    public boolean success() {
        return recordsSent > 0;
    }

    @JsonProperty("complete")
    public boolean complete() {
        return success() && recordsFailed == 0;
    }

    public static RunOutcome delivered(RunRecord run, String stationName, BatchResult result) {
        if (result.success() == 0) {
            return new RunOutcome(run.runId(), run.runName(), stationName, true, true,
                    0, result.failed(), FailureKind.DELIVERY_FAILED,
                    "No records delivered (" + result.failed() + " failed)");
        }
        return new RunOutcome(run.runId(), run.runName(), stationName, true, true,
                result.success(), result.failed(),
                result.hasFailures() ? FailureKind.DELIVERY_FAILED : null,
                result.hasFailures() ? result.failed() + " of " + result.total() + " records failed" : null);
    }

    public static RunOutcome unresolvable(RunRecord run) {
        return new RunOutcome(run.runId(), run.runName(), null, false, false, 0, 0,
                FailureKind.UNRESOLVABLE, "Could not resolve station name from run metadata");
    }

    public static RunOutcome deviceUnavailable(RunRecord run, String stationName, String message) {
        return new RunOutcome(run.runId(), run.runName(), stationName, false, false, 0, 0,
                FailureKind.DEVICE_UNAVAILABLE, message);
    }

    public static RunOutcome dataNotFound(RunRecord run, String stationName) {
        return new RunOutcome(run.runId(), run.runName(), stationName, true, false, 0, 0,
                FailureKind.DATA_NOT_FOUND, "No processed dataset found for station " + stationName);
    }

    public static RunOutcome dataUnreadable(RunRecord run, String stationName, String message) {
        return new RunOutcome(run.runId(), run.runName(), stationName, true, true, 0, 0,
                FailureKind.DATA_UNREADABLE, message);
    }

    public static RunOutcome stopped(RunRecord run) {
        return new RunOutcome(run.runId(), run.runName(), null, false, false, 0, 0,
                FailureKind.STOPPED, "Sync stopped before the run was processed");
    }

    public static RunOutcome unexpected(RunRecord run, String stationName, boolean deviceFound,
                                        boolean dataFound, String message) {
        return new RunOutcome(run.runId(), run.runName(), stationName, deviceFound, dataFound, 0, 0,
                FailureKind.UNEXPECTED, message);
    }
}
