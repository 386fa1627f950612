package com.novelsource.plugins.sites;

import com.novelsource.api.FetchResponse;
import com.novelsource.api.Transport;
import com.novelsource.common.error.FetchException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves canned pages by url and remembers what was requested.
 */
class PageStub implements Transport {
    private final Map<String, String> pages = new HashMap<>();
    private final List<String> requested = new ArrayList<>();

    PageStub page(String url, String html) {
        pages.put(url, html);
        return this;
    }

    @Override
    public FetchResponse fetch(String url, Map<String, String> headers) throws FetchException {
        requested.add(url);
        String html = pages.get(url);
        if (html == null) {
            throw new FetchException("Unknown host", url, new java.net.UnknownHostException(url));
        }
        return new FetchResponse(200, html.getBytes(StandardCharsets.UTF_8), "text/html; charset=utf-8");
    }

    List<String> getRequested() {
        return new ArrayList<>(requested);
    }
}
