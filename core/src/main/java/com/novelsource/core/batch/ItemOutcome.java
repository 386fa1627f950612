package com.novelsource.core.batch;

public record ItemOutcome(
    int index,
    String url,
    String sourceId,    // null when unresolved or skipped before resolution
    Status status,
    String message
) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        UNRESOLVED_SOURCE,  // counted as failed
        SKIPPED             // not attempted because the batch was cancelled
    }

    public boolean isFailure() {
        return status == Status.FAILED || status == Status.UNRESOLVED_SOURCE;
    }
}
