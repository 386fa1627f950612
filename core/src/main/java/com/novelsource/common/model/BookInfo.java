package com.novelsource.common.model;

/**
 * Metadata read from a book's detail page.
 */
public record BookInfo(
    String title,
    String author,
    String description,
    String coverUrl,    // may be null
    String sourceUrl
) {}
