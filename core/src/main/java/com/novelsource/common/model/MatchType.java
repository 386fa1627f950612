package com.novelsource.common.model;

import com.google.gson.annotations.SerializedName;

/**
 * Confidence tier of a URL to source/parser match.
 */
public enum MatchType {
    @SerializedName("exact")
    EXACT,
    @SerializedName("fuzzy")
    FUZZY;

    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
