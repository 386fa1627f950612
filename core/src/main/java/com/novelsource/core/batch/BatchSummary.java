package com.novelsource.core.batch;

import java.util.List;

public record BatchSummary(
    int succeeded,
    int failed,
    int skipped,
    boolean cancelled,
    List<ItemOutcome> outcomes
) {

    public BatchSummary {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public int total() {
        return outcomes.size();
    }

    @Override
    public String toString() {
        return String.format("succeeded=%d, failed=%d, skipped=%d%s",
                succeeded, failed, skipped, cancelled ? " (cancelled)" : "");
    }
}
