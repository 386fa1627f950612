package com.novelsource.services.importing;

public record SourceProbeResult(
    boolean success,
    String message,
    int statusCode,     // -1 without response
    int responseSize    // bytes
) {}
