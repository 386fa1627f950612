package com.novelsource.services.library;

/**
 * A book row of the library database.
 */
public record StoredBook(
    long id,
    String title,
    String author,
    String description,
    String coverUrl,    // may be null
    String sourceId,
    String sourceUrl,
    int totalChapters
) {}
