package com.novelsource.core.parser;

import com.novelsource.api.Transport;
import com.novelsource.core.selector.SelectorEngine;

/**
 * Shared, stateless collaborators every parser instance receives.
 */
public record ParserContext(
    Transport transport,
    SelectorEngine engine,
    int defaultMaxPages     // page cap for sources that set none
) {

    public ParserContext {
        if (transport == null) throw new IllegalArgumentException("transport is required");
        if (engine == null) engine = new SelectorEngine();
        if (defaultMaxPages <= 0) defaultMaxPages = 100;
    }

    public ParserContext(Transport transport) {
        this(transport, new SelectorEngine(), 100);
    }

    int capOr(int configured) {
        return configured > 0 ? configured : defaultMaxPages;
    }
}
