package com.novelsource.common.model;

/**
 * Text of one chapter. Not cached by the core.
 */
public record ChapterContent(
    String rawHtml,
    String cleanedText,
    String nextUrl,     // next link of the last fetched page that was not followed, may be null
    int pages
) {}
