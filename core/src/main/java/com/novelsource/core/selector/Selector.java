package com.novelsource.core.selector;

import java.util.List;

/**
 * A declarative locator evaluated by {@link SelectorEngine}.
 * <p>
 * Three kinds exist: a CSS path ({@link PathSelector}), a CSS path plus attribute
 * ({@link AttributeSelector}) and an ordered list of alternatives ({@link FallbackSelector}).
 * An empty fallback list means "field not available on this source".
 * The compact textual form used in source configs is parsed by {@link Selectors#parse(String)}.
 */
public interface Selector {

    Selector NONE = new FallbackSelector(List.of());

    boolean isEmpty();
}
