package com.novelsource.common.util;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.Charset;
import java.util.Locale;

/**
 * URL templating and resolution helpers used by the parsers.
 */
public final class UrlUtils {

    public static final String KEYWORD = "{keyword}";
    public static final String BOOK_URL = "{book_url}";
    public static final String PAGE = "{page}";

    private UrlUtils() {
    }

    /**
     * Substitutes {@code {keyword}} with the keyword percent-encoded in the source's charset.
     * Spaces become {@code %20}, not {@code +}.
     */
    public static String searchUrl(String template, String keyword, Charset charset) {
        String encoded = URLEncoder.encode(keyword == null ? "" : keyword, charset).replace("+", "%20");
        return template.replace(KEYWORD, encoded);
    }

    public static String catalogUrl(String template, String bookUrl) {
        if (template == null || template.isBlank()) return bookUrl;
        return template.replace(BOOK_URL, bookUrl);
    }

    /**
     * Builds the url of catalog page {@code page} (first page = 1).
     * {@code skipEnding} is trimmed once from the end of the book url before substitution,
     * so {@code {book_url}/index_{page}.html} works for book urls with a trailing slash.
     */
    public static String pageUrl(String fmt, String bookUrl, String skipEnding, int page) {
        String base = bookUrl == null ? "" : bookUrl;
        if (skipEnding != null && !skipEnding.isEmpty() && base.endsWith(skipEnding)) {
            base = base.substring(0, base.length() - skipEnding.length());
        }
        return fmt.replace(BOOK_URL, base).replace(PAGE, String.valueOf(page));
    }

    /**
     * Resolves {@code href} against {@code base}. Absolute hrefs are returned unchanged;
     * anything that cannot be resolved is returned as given.
     */
    public static String resolve(String base, String href) {
        if (href == null || href.isBlank()) return "";
        String trimmed = href.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) return trimmed;
        if (base == null || base.isBlank()) return trimmed;
        try {
            return new URL(new URL(base), trimmed).toExternalForm();
        } catch (MalformedURLException e) {
            return trimmed;
        }
    }

    /**
     * Lower-cased host of an http(s) url, or null when there is none.
     */
    public static String host(String url) {
        if (url == null || url.isBlank()) return null;
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return null;
            }
            String host = uri.getHost();
            return host == null || host.isEmpty() ? null : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public static boolean isHttpUrl(String url) {
        return host(url) != null;
    }

    /**
     * Same scheme-less location: equal ignoring a trailing slash and the fragment.
     */
    public static boolean sameLocation(String a, String b) {
        if (a == null || b == null) return false;
        return stripForCompare(a).equals(stripForCompare(b));
    }

    private static String stripForCompare(String url) {
        String s = url.trim();
        int hash = s.indexOf('#');
        if (hash >= 0) s = s.substring(0, hash);
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        return s;
    }
}
