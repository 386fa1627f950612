package com.novelsource.common.model;

/**
 * One hit from a source's search page.
 */
public record SearchResult(
    String title,
    String author,
    String description,
    String coverUrl,    // may be null
    String sourceUrl    // absolute book url
) {}
