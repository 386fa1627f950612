package com.novelsource.core.parser;

import com.novelsource.common.error.FetchException;
import com.novelsource.common.error.SourceException;
import com.novelsource.common.model.ChapterList;
import com.novelsource.common.model.ChapterRef;
import com.novelsource.core.config.SourceConfig;
import com.novelsource.core.selector.SelectorEngine;
import com.novelsource.core.selector.Selectors;
import com.novelsource.test.TestBase;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PaginationWalkerTest extends TestBase {

    private static final String BOOK = "https://x.test/b/1/";

    private final Map<String, String> pages = new HashMap<>();
    private final List<String> fetched = new ArrayList<>();
    private SourceConfig.ChapterListRule rule;

    @BeforeEach
    void setUpRule() {
        rule = new SourceConfig.ChapterListRule();
        rule.item = Selectors.parse("a.ch");
        rule.pager = Selectors.parse("a.next");
    }

    private Document fetch(String url) throws SourceException {
        fetched.add(url);
        String html = pages.get(url);
        if (html == null) throw new FetchException("Not found", url, 404);
        return Jsoup.parse(html, url);
    }

    private ChapterList walk(int maxPages, ChapterLinkFilter filter) throws SourceException {
        return new PaginationWalker("test", rule, new SelectorEngine(), this::fetch, maxPages, filter).walk(BOOK);
    }

    private static String page(String next, String... chapters) {
        StringBuilder html = new StringBuilder("<html><body>");
        for (String c : chapters) {
            html.append("<a class=\"ch\" href=\"").append(c).append(".html\">第").append(c).append("章</a>");
        }
        if (next != null) html.append("<a class=\"next\" href=\"").append(next).append("\">下一页</a>");
        return html.append("</body></html>").toString();
    }

    private static List<String> urls(ChapterList list) {
        return list.chapters().stream().map(ChapterRef::url).collect(Collectors.toList());
    }

    @Test
    void testDeduplicatesAndNumbersAcrossPages() throws SourceException {
        pages.put(BOOK, page("p2.html", "1", "2"));
        pages.put("https://x.test/b/1/p2.html", page(null, "2", "3"));

        ChapterList list = walk(10, null);

        assertEquals(List.of("https://x.test/b/1/1.html", "https://x.test/b/1/2.html", "https://x.test/b/1/3.html"),
                urls(list));
        assertEquals(List.of(0, 1, 2), list.chapters().stream().map(ChapterRef::ordinal).collect(Collectors.toList()));
        assertTrue(list.complete());
        assertNull(list.failure());
    }

    @Test
    void testDescendingOrderIsReversed() throws SourceException {
        rule.order = "desc";
        pages.put(BOOK, page(null, "3", "2", "1"));

        ChapterList list = walk(10, null);

        assertEquals("https://x.test/b/1/1.html", list.chapters().get(0).url());
        assertEquals(0, list.chapters().get(0).ordinal(), "Ordinals follow reading order");
        assertEquals(2, list.chapters().get(2).ordinal());
    }

    @Test
    void testPagerCycleStops() throws SourceException {
        pages.put(BOOK, page("p2.html", "1"));
        // Links back to the first page without the trailing slash
        pages.put("https://x.test/b/1/p2.html", page("https://x.test/b/1", "2"));

        ChapterList list = walk(10, null);

        assertEquals(2, list.pagesWalked());
        assertEquals(2, list.size());
        assertTrue(list.complete());
        assertFalse(list.truncated());
    }

    @Test
    void testPageCapEndsWalk() throws SourceException {
        rule.pageUrl = new SourceConfig.PageUrlRule();
        rule.pageUrl.fmt = "{book_url}/index_{page}.html";
        rule.pageUrl.skipEnding = "/";
        for (int i = 2; i <= 5; i++) {
            pages.put("https://x.test/b/1/index_" + i + ".html", page("#", "c" + i));
        }
        pages.put(BOOK, page("#", "c1"));

        ChapterList list = walk(3, null);

        assertEquals(List.of(BOOK, "https://x.test/b/1/index_2.html", "https://x.test/b/1/index_3.html"), fetched);
        assertEquals(3, list.pagesWalked());
        assertEquals(3, list.size());
        assertTrue(list.complete(), "Reaching the cap is a normal end");
        assertTrue(list.truncated(), "Pages beyond the cap were left out");
    }

    @Test
    void testLaterFailureGivesPartialList() throws SourceException {
        pages.put(BOOK, page("p2.html", "1", "2"));

        ChapterList list = walk(10, null);

        assertTrue(list.isPartial());
        assertEquals(2, list.size(), "Chapters of the first page are kept");
        assertEquals(1, list.pagesWalked());
        assertTrue(list.failure() instanceof FetchException);
    }

    @Test
    void testFirstPageFailureIsThrown() {
        assertThrows(FetchException.class, () -> walk(10, null));
    }

    @Test
    void testCatalogUrlTemplate() throws SourceException {
        rule.url = "{book_url}catalog.html";
        pages.put("https://x.test/b/1/catalog.html", page(null, "1"));

        assertEquals(1, walk(10, null).size());
        assertEquals(List.of("https://x.test/b/1/catalog.html"), fetched);
    }

    @Test
    void testHeuristicFilterDropsNavigation() throws SourceException {
        rule.item = Selectors.parse("a");
        rule.pager = Selectors.parse("a.none");
        pages.put(BOOK, "<a href=\"/\">首页</a><a href=\"1.html\">第一章 开始</a>"
                + "<a href=\"shelf.html\">我的书架</a><a href=\"2.html\">Chapter 2</a><a href=\"x.html\">x</a>");

        ChapterList filtered = walk(10, ChapterLinkFilter.HEURISTIC);
        assertEquals(List.of("https://x.test/b/1/1.html", "https://x.test/b/1/2.html"), urls(filtered));

        assertEquals(5, walk(10, ChapterLinkFilter.ACCEPT_ALL).size());
    }

    @Test
    void testListContainerAndRelativeSelectors() throws SourceException {
        rule.list = Selectors.parse("dl.volume");
        rule.item = Selectors.parse("dd");
        rule.title = Selectors.parse("span.name");
        rule.link = Selectors.parse("a@href");
        pages.put(BOOK, "<dl class=\"latest\"><dd><span class=\"name\">Latest</span><a href=\"9.html\">go</a></dd></dl>"
                + "<dl class=\"volume\"><dd><span class=\"name\">One</span><a href=\"1.html\">go</a></dd>"
                + "<dd><span class=\"name\">Two</span></dd></dl>");

        ChapterList list = walk(10, null);

        assertEquals(1, list.size(), "Only items inside the container with title and link count");
        assertEquals("One", list.chapters().get(0).title());
    }
}
