package com.novelsource.core.parser;

import com.novelsource.api.SourceParser;

/**
 * Builds a specialized parser around the generic parser of the chosen source.
 */
@FunctionalInterface
public interface ParserFactory {
    SourceParser create(BaseParser base);
}
