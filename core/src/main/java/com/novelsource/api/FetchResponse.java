package com.novelsource.api;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;

public record FetchResponse(
    int status,
    byte[] body,
    String contentType // may be null
) {

    public FetchResponse {
        body = body == null ? new byte[0] : body;
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    /**
     * Decodes the body with the charset named in the content type, or {@code fallback} when none is given.
     */
    public String text(Charset fallback) {
        return new String(body, charsetOr(fallback));
    }

    public Charset charsetOr(Charset fallback) {
        if (contentType == null) return fallback;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = p.substring(8).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                    return fallback;
                }
            }
        }
        return fallback;
    }

    public int size() {
        return body.length;
    }
}
