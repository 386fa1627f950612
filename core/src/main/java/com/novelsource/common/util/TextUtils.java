package com.novelsource.common.util;

import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern AUTHOR_PREFIX = Pattern.compile("^(作者[：:]?|by[：:]|by\\s)\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u3000]+");

    private TextUtils() {
    }

    /** Drops an "作者：" / "by:" label in front of an author name. */
    public static String stripAuthorPrefix(String author) {
        if (author == null) return "";
        return AUTHOR_PREFIX.matcher(author.trim()).replaceFirst("").trim();
    }

    /** Cuts to at most {@code max} code points. */
    public static String truncate(String text, int max) {
        if (text == null) return "";
        if (text.codePointCount(0, text.length()) <= max) return text;
        return text.substring(0, text.offsetByCodePoints(0, max));
    }

    public static String collapseWhitespace(String text) {
        if (text == null) return "";
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static String orEmpty(String s) {
        return s == null ? "" : s;
    }
}
