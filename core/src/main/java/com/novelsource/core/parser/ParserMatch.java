package com.novelsource.core.parser;

import com.novelsource.api.SourceParser;
import com.novelsource.common.model.MatchType;

/**
 * A parser chosen for a URL, with the tier that selected it.
 */
public record ParserMatch(
    ParserDescriptor descriptor,
    SourceParser parser,
    MatchType matchType
) {}
