package com.novelsource.services.detect;

import com.novelsource.common.model.MatchType;

public record SourceDetection(
    String sourceId,
    String sourceName,
    MatchType matchType
) {}
