package com.novelsource.core.config;

/**
 * One finding of a validator.
 */
public record ValidationError(String message, Severity severity) {

    public enum Severity { ERROR, WARNING }

    public static ValidationError error(String message) {
        return new ValidationError(message, Severity.ERROR);
    }

    public static ValidationError warning(String message) {
        return new ValidationError(message, Severity.WARNING);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + message;
    }
}
