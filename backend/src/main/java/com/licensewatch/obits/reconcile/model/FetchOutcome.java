package com.licensewatch.obits.reconcile.model;

import java.util.List;

/**
 * Result of one obituary search. A {@link Status#SOFT_FAILURE} is read as an empty result
 * set; a {@link Status#HARD_FAILURE} stops the run.
 */
public record FetchOutcome(
    Status status,
    Candidate candidate,
    List<ObituaryEntry> entries,
    FetchFailureKind failureKind,
    String reason
) {
    public enum Status {
        SUCCESS,
        SOFT_FAILURE,
        HARD_FAILURE
    }

    public FetchOutcome {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static FetchOutcome success(Candidate candidate, List<ObituaryEntry> entries) {
        return new FetchOutcome(Status.SUCCESS, candidate, entries, null, null);
    }

    public static FetchOutcome softFailure(Candidate candidate, String reason) {
        return new FetchOutcome(Status.SOFT_FAILURE, candidate, List.of(), null, reason);
    }

    public static FetchOutcome hardFailure(Candidate candidate, FetchFailureKind kind, String reason) {
        return new FetchOutcome(Status.HARD_FAILURE, candidate, List.of(), kind, reason);
    }

    public boolean isHardFailure() {
        return status == Status.HARD_FAILURE;
    }
}
