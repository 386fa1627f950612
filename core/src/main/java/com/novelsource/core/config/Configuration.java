package com.novelsource.core.config;

import com.novelsource.core.parser.FuzzyMatchPolicy;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

public class Configuration {
    // --- Directories (relative to the home directory) ---
    public String sourcesDir = "sources";   // one SourceConfig JSON per file
    public String databasePath = "data/library"; // H2 database of imported books, without .mv.db
    public String pluginsDir = "plugins";   // extra parser plugin jars

    // --- Fetching ---
    public String userAgent = "";           // empty = transport default
    public int fetchTimeoutMillis = 30000;
    public int maxPages = 100;              // page cap when a source sets none

    // --- Batch import ---
    public long batchDelayMillis = 1000;    // minimum pause between two imports

    // --- Parser matching ---
    public String fuzzyMatchPolicy = FuzzyMatchPolicy.DOMAIN_LABEL.name();

    // --- Plugin control ---
    // Key = plugin name, Value = enabled. Plugins not listed are enabled.
    public Map<String, Boolean> plugins = new HashMap<>();

    public Configuration() {
        plugins.put("SiteParsers", true);
    }

    public FuzzyMatchPolicy fuzzyPolicy() {
        if (fuzzyMatchPolicy == null || fuzzyMatchPolicy.isBlank()) return FuzzyMatchPolicy.DOMAIN_LABEL;
        return FuzzyMatchPolicy.valueOf(fuzzyMatchPolicy.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isPluginEnabled(String name) {
        return plugins == null || plugins.getOrDefault(name, true);
    }
}
