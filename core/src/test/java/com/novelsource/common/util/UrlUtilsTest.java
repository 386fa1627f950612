package com.novelsource.common.util;

import com.novelsource.test.TestBase;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class UrlUtilsTest extends TestBase {

    @Test
    void testSearchUrlSubstitutesKeyword() {
        String url = UrlUtils.searchUrl("https://x.test/s?q={keyword}", "dune", StandardCharsets.UTF_8);
        assertEquals("https://x.test/s?q=dune", url);
    }

    @Test
    void testSearchUrlEncodesInSourceCharset() {
        assertEquals("https://x.test/s?q=%E6%96%97%E7%A0%B4",
                UrlUtils.searchUrl("https://x.test/s?q={keyword}", "斗破", StandardCharsets.UTF_8));
        assertEquals("https://x.test/s?q=%B6%B7%C6%C6",
                UrlUtils.searchUrl("https://x.test/s?q={keyword}", "斗破", Charset.forName("GBK")),
                "GBK sources expect GBK-encoded keywords");
    }

    @Test
    void testSearchUrlEncodesSpaceAsPercent20() {
        String url = UrlUtils.searchUrl("https://x.test/s?q={keyword}", "dune messiah", StandardCharsets.UTF_8);
        assertEquals("https://x.test/s?q=dune%20messiah", url);
    }

    @Test
    void testPageUrlTrimsSkipEnding() {
        String url = UrlUtils.pageUrl("{book_url}/index_{page}.html", "https://x.test/b/1/", "/", 2);
        assertEquals("https://x.test/b/1/index_2.html", url);
    }

    @Test
    void testPageUrlWithoutSkipEnding() {
        String url = UrlUtils.pageUrl("{book_url}index_{page}.html", "https://x.test/b/1/", "", 3);
        assertEquals("https://x.test/b/1/index_3.html", url);
    }

    @Test
    void testCatalogUrlDefaultsToBookUrl() {
        assertEquals("https://x.test/b/1/", UrlUtils.catalogUrl(null, "https://x.test/b/1/"));
        assertEquals("https://x.test/b/1/all.html", UrlUtils.catalogUrl("{book_url}all.html", "https://x.test/b/1/"));
    }

    @Test
    void testResolve() {
        assertEquals("https://x.test/b/1/2.html", UrlUtils.resolve("https://x.test/b/1/", "2.html"));
        assertEquals("https://x.test/c/9.html", UrlUtils.resolve("https://x.test/b/1/", "/c/9.html"));
        assertEquals("https://y.test/a", UrlUtils.resolve("https://x.test/b/1/", "https://y.test/a"),
                "Absolute hrefs are kept");
        assertEquals("", UrlUtils.resolve("https://x.test/", "  "));
    }

    @Test
    void testHost() {
        assertEquals("www.x.test", UrlUtils.host("https://WWW.X.test/book/1"));
        assertNull(UrlUtils.host("ftp://x.test/file"), "Only http(s) urls have a host here");
        assertNull(UrlUtils.host("not a url"));
        assertNull(UrlUtils.host(null));
        assertTrue(UrlUtils.isHttpUrl("http://x.test"));
        assertFalse(UrlUtils.isHttpUrl("x.test/book"));
    }

    @Test
    void testSameLocation() {
        assertTrue(UrlUtils.sameLocation("https://x.test/b/1/", "https://x.test/b/1#top"));
        assertFalse(UrlUtils.sameLocation("https://x.test/b/1/", "https://x.test/b/2/"));
    }
}
