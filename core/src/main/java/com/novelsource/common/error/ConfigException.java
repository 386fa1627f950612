package com.novelsource.common.error;

import java.util.List;

/**
 * A SourceConfig (or the parser registry) is malformed. Fatal for the affected source.
 */
public class ConfigException extends SourceException {
    private final List<String> problems;

    public ConfigException(String message, String sourceId) {
        this(message, sourceId, List.of());
    }

    public ConfigException(String message, String sourceId, List<String> problems) {
        super(message, sourceId, null, "config");
        this.problems = List.copyOf(problems);
    }

    public ConfigException(String message, String sourceId, Throwable cause) {
        super(message, sourceId, null, "config", cause);
        this.problems = List.of();
    }

    public List<String> getProblems() {
        return problems;
    }
}
