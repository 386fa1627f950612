package com.novelsource.common.model;

import java.util.List;

/**
 * Result of walking a book's catalog pages.
 * When {@code complete} is false the walk stopped early and {@code failure} says why;
 * the chapters collected before the failure are still returned.
 * {@code truncated} marks a walk that ended at the page cap with more pages left.
 */
public record ChapterList(
    List<ChapterRef> chapters,
    int pagesWalked,
    boolean complete,
    boolean truncated,  // page cap reached before the last catalog page
    Exception failure
) {

    public ChapterList {
        chapters = chapters == null ? List.of() : List.copyOf(chapters);
    }

    public boolean isPartial() {
        return !complete;
    }

    public int size() {
        return chapters.size();
    }
}
