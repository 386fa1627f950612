package com.novelsource.common.error;

/**
 * Transport failure: DNS, connect, timeout or a non-successful HTTP status.
 * Retrying is the caller's decision.
 */
public class FetchException extends SourceException {
    private final int statusCode;

    public FetchException(String message, String url, Throwable cause) {
        super(message, null, url, "fetch", cause);
        this.statusCode = -1;
    }

    public FetchException(String message, String url, int statusCode) {
        super(message, null, url, "fetch");
        this.statusCode = statusCode;
    }

    private FetchException(FetchException origin, String sourceId, String step) {
        super(origin.getMessage(), sourceId, origin.getUrl(), step, origin.getCause());
        this.statusCode = origin.statusCode;
    }

    /**
     * -1 when no HTTP response was received at all.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Same failure, annotated with the source and the step that triggered the fetch.
     */
    public FetchException withContext(String sourceId, String step) {
        FetchException annotated = new FetchException(this, sourceId, step);
        annotated.setStackTrace(getStackTrace());
        return annotated;
    }
}
