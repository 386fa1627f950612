package com.novelsource.core.batch;

import java.util.ArrayList;
import java.util.List;

public record BatchRequest(
    List<String> urls,
    String fixedSourceId,   // null = per url
    boolean autoDetect      // detect the source when none is fixed
) {

    public BatchRequest {
        urls = urls == null ? List.of() : List.copyOf(urls);
    }

    /**
     * One url per line; blank lines and lines starting with '#' are ignored.
     */
    public static List<String> parseLines(String text) {
        List<String> urls = new ArrayList<>();
        if (text == null) return urls;
        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) urls.add(trimmed);
        }
        return urls;
    }

    public boolean hasFixedSource() {
        return fixedSourceId != null && !fixedSourceId.isBlank();
    }
}
