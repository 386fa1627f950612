package com.novelsource.common.error;

/**
 * A mandatory field's selector produced nothing. Retrying will not help, the markup does not match.
 */
public class ParseException extends SourceException {

    public ParseException(String message, String sourceId, String url, String step) {
        super(message, sourceId, url, step);
    }
}
