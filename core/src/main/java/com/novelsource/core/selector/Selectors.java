package com.novelsource.core.selector;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Factory for {@link Selector} values.
 */
public final class Selectors {
    private static final Pattern ATTRIBUTE_NAME = Pattern.compile("[A-Za-z_][-A-Za-z0-9_:.]*");

    private Selectors() {
    }

    /**
     * {@code "div.title"} is a path, {@code "a.cover@href"} an attribute path,
     * {@code "@href"} the context element's own attribute.
     */
    public static Selector parse(String expression) {
        if (expression == null || expression.isBlank()) return Selector.NONE;
        String expr = expression.trim();
        int at = attributeSeparator(expr);
        if (at >= 0) {
            return new AttributeSelector(expr.substring(0, at), expr.substring(at + 1));
        }
        return new PathSelector(expr);
    }

    public static Selector firstOf(List<Selector> alternatives) {
        List<Selector> flat = new ArrayList<>();
        for (Selector s : alternatives) {
            if (s != null && !s.isEmpty()) flat.add(s);
        }
        if (flat.size() == 1) return flat.get(0);
        return new FallbackSelector(flat);
    }

    public static Selector firstOf(String... expressions) {
        List<Selector> parsed = new ArrayList<>();
        for (String e : expressions) parsed.add(parse(e));
        return firstOf(parsed);
    }

    // An '@' inside an attribute condition like a[href*=@] is not a separator.
    private static int attributeSeparator(String expr) {
        int at = expr.lastIndexOf('@');
        if (at < 0) return -1;
        if (!ATTRIBUTE_NAME.matcher(expr.substring(at + 1)).matches()) return -1;
        int depth = 0;
        for (int i = 0; i < at; i++) {
            char c = expr.charAt(i);
            if (c == '[' || c == '(') depth++;
            else if (c == ']' || c == ')') depth--;
        }
        return depth == 0 ? at : -1;
    }
}
