package com.novelsource.core.selector;

/**
 * CSS path plus attribute name, written {@code css@attr}.
 * jsoup's {@code abs:} prefix works here too, e.g. {@code a.next@abs:href}.
 */
public record AttributeSelector(String css, String attribute) implements Selector {

    public AttributeSelector {
        css = css == null ? "" : css.trim();
        if (attribute == null || attribute.isBlank()) {
            throw new IllegalArgumentException("Attribute selector without attribute: " + css);
        }
        attribute = attribute.trim();
    }

    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public String toString() {
        return css + "@" + attribute;
    }
}
