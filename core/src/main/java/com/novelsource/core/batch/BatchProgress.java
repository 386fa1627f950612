package com.novelsource.core.batch;

public record BatchProgress(
    int index,          // zero-based index of the current url
    int total,
    String currentUrl,
    double fraction,    // items finished / total
    int succeeded,
    int failed
) {

    public int percent() {
        return (int) Math.round(fraction * 100);
    }
}
