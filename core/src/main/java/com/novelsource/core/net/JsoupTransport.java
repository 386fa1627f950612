package com.novelsource.core.net;

import com.novelsource.api.FetchResponse;
import com.novelsource.api.Transport;
import com.novelsource.common.error.FetchException;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Default {@link Transport}: a plain GET through {@code Jsoup.connect}.
 * HTTP error statuses are returned, not thrown, so parsers decide how to report them.
 */
public class JsoupTransport implements Transport {
    private static final Logger logger = LoggerFactory.getLogger(JsoupTransport.class);
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0 Safari/537.36";

    private final String userAgent;
    private final int timeoutMillis;

    public JsoupTransport() {
        this(DEFAULT_USER_AGENT, 30000);
    }

    public JsoupTransport(String userAgent, int timeoutMillis) {
        this.userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public FetchResponse fetch(String url, Map<String, String> headers) throws FetchException {
        try {
            Connection conn = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .timeout(timeoutMillis)
                    .ignoreContentType(true)
                    .ignoreHttpErrors(true)
                    .followRedirects(true)
                    .maxBodySize(0)
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "zh-CN,zh;q=0.9,en;q=0.8");

            if (headers != null) {
                for (Map.Entry<String, String> h : headers.entrySet()) {
                    // A per-source User-Agent header wins over the configured default
                    if ("user-agent".equalsIgnoreCase(h.getKey())) conn.userAgent(h.getValue());
                    else conn.header(h.getKey(), h.getValue());
                }
            }

            Connection.Response response = conn.execute();
            logger.debug("GET {} -> {} ({} bytes)", url, response.statusCode(), response.bodyAsBytes().length);
            return new FetchResponse(response.statusCode(), response.bodyAsBytes(), response.contentType());
        } catch (IOException e) {
            throw new FetchException("Request failed: " + e.getMessage(), url, e);
        } catch (IllegalArgumentException e) {
            // Jsoup rejects malformed urls before connecting
            throw new FetchException("Invalid url: " + e.getMessage(), url, e);
        }
    }

    public int getTimeoutMillis() {
        return timeoutMillis;
    }
}
