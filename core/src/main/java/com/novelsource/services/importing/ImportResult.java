package com.novelsource.services.importing;

public record ImportResult(
    String message,
    String bookId,
    int chapterCount,
    boolean partial,        // chapter list walk broke off early
    boolean truncated,      // chapter list walk stopped at the page cap
    boolean alreadyExisted
) {}
