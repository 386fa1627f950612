package com.novelsource.common.error;

/**
 * Rejected or failed import request (unknown source, invalid book url, storage failure).
 */
public class ImportException extends SourceException {

    public ImportException(String message, String sourceId, String url) {
        super(message, sourceId, url, "import");
    }

    public ImportException(String message, String sourceId, String url, Throwable cause) {
        super(message, sourceId, url, "import", cause);
    }
}
