package com.novelsource.common.model;

/**
 * A chapter link. The ordinal is zero-based across all catalog pages, in reading order.
 */
public record ChapterRef(
    String title,
    String url,
    int ordinal
) {}
