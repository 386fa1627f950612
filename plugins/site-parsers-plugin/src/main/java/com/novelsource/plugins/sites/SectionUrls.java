package com.novelsource.plugins.sites;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Chapters split into sections: {@code 123_456.html}, {@code 123_456_2.html}, {@code 123_456_3.html}.
 */
final class SectionUrls {
    private static final Pattern SECTION = Pattern.compile("^(.*)_(\\d{1,2})$");

    private SectionUrls() {
    }

    /**
     * True when {@code next} is the section directly after {@code current}.
     * The first section has no suffix, so {@code X} is followed by {@code X_2}.
     */
    static boolean isNextSection(String next, String current) {
        if (next == null || current == null) return false;
        String n = stripSuffix(next);
        String c = stripSuffix(current);

        Matcher nm = SECTION.matcher(n);
        if (!nm.matches()) return false;
        String nextBase = nm.group(1);
        int nextIndex = Integer.parseInt(nm.group(2));

        if (nextBase.equals(c)) return nextIndex == 2;

        Matcher cm = SECTION.matcher(c);
        return cm.matches() && cm.group(1).equals(nextBase) && Integer.parseInt(cm.group(2)) + 1 == nextIndex;
    }

    private static String stripSuffix(String url) {
        String s = url.trim();
        int query = s.indexOf('?');
        if (query >= 0) s = s.substring(0, query);
        return s.endsWith(".html") ? s.substring(0, s.length() - 5) : s;
    }
}
