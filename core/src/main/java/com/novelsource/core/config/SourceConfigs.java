package com.novelsource.core.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.novelsource.common.error.ConfigException;
import com.novelsource.core.selector.Selector;
import com.novelsource.core.selector.SelectorAdapter;

import java.io.Reader;

/**
 * JSON mapping for {@link SourceConfig}.
 */
public final class SourceConfigs {

    private static final Gson GSON = new GsonBuilder()
            .registerTypeHierarchyAdapter(Selector.class, new SelectorAdapter())
            .disableHtmlEscaping()
            .setPrettyPrinting()
            .create();

    private SourceConfigs() {
    }

    public static Gson gson() {
        return GSON;
    }

    /**
     * Parses without validating. See {@link SourceConfigValidator#requireValid(SourceConfig)}.
     *
     * @param origin file name or similar, used in the error message
     */
    public static SourceConfig parse(String json, String origin) throws ConfigException {
        try {
            SourceConfig config = GSON.fromJson(json, SourceConfig.class);
            if (config == null) throw new ConfigException("Empty source config: " + origin, null);
            return config;
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new ConfigException("Malformed source config " + origin + ": " + e.getMessage(), null, e);
        }
    }

    public static SourceConfig parse(Reader reader, String origin) throws ConfigException {
        try {
            SourceConfig config = GSON.fromJson(reader, SourceConfig.class);
            if (config == null) throw new ConfigException("Empty source config: " + origin, null);
            return config;
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new ConfigException("Malformed source config " + origin + ": " + e.getMessage(), null, e);
        }
    }

    public static String toJson(SourceConfig config) {
        return GSON.toJson(config);
    }

    /**
     * Deep copy, so a parser can own its config exclusively.
     */
    public static SourceConfig copy(SourceConfig config) {
        return GSON.fromJson(GSON.toJson(config), SourceConfig.class);
    }
}
