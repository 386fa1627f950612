package com.novelsource.services.importing;

import com.novelsource.common.error.SourceException;

/**
 * Error shape handed to API consumers.
 */
public record ErrorDetail(String detail) {

    public static ErrorDetail of(Exception e) {
        if (e instanceof SourceException) {
            return new ErrorDetail(((SourceException) e).describe());
        }
        return new ErrorDetail(e.getClass().getSimpleName() + ": " + e.getMessage());
    }
}
