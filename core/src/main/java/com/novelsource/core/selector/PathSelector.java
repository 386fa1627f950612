package com.novelsource.core.selector;

/**
 * CSS path. Yields the trimmed text of every matching element.
 * An empty path addresses the context element itself.
 */
public record PathSelector(String css) implements Selector {

    public PathSelector {
        css = css == null ? "" : css.trim();
    }

    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public String toString() {
        return css;
    }
}
