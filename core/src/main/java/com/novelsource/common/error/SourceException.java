package com.novelsource.common.error;

/**
 * Base of all errors raised by the source-parsing core.
 * Carries enough context (source, url, extraction step) for a caller to log and present it.
 */
public class SourceException extends Exception {
    private final String sourceId;
    private final String url;
    private final String step;

    public SourceException(String message, String sourceId, String url, String step) {
        this(message, sourceId, url, step, null);
    }

    public SourceException(String message, String sourceId, String url, String step, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
        this.url = url;
        this.step = step;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getUrl() {
        return url;
    }

    public String getStep() {
        return step;
    }

    /**
     * Message plus whatever context is known, e.g. "No title found [source=biquge, step=book.title, url=...]".
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(String.valueOf(getMessage()));
        StringBuilder ctx = new StringBuilder();
        if (sourceId != null) ctx.append("source=").append(sourceId);
        if (step != null) ctx.append(ctx.length() > 0 ? ", " : "").append("step=").append(step);
        if (url != null) ctx.append(ctx.length() > 0 ? ", " : "").append("url=").append(url);
        if (ctx.length() > 0) sb.append(" [").append(ctx).append(']');
        return sb.toString();
    }
}
