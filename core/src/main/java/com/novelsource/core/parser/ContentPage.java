package com.novelsource.core.parser;

/**
 * One fetched page of a chapter.
 */
public record ContentPage(
    String url,
    String rawHtml,
    String cleanedText,
    String nextUrl      // absolute, null when the page has no next link
) {}
