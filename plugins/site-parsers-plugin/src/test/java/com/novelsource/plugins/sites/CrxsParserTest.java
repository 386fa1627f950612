package com.novelsource.plugins.sites;

import com.novelsource.common.model.BookInfo;
import com.novelsource.core.config.SourceConfigs;
import com.novelsource.core.parser.BaseParser;
import com.novelsource.core.parser.ParserContext;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CrxsParserTest extends PluginTestBase {
    private static final String BOOK = "https://crxs.me/fiction/42";

    private static final String SOURCE = """
            {
              "id": "crxs",
              "name": "crxs",
              "url": "https://crxs.me",
              "encoding": "utf-8",
              "search": {"url": "https://crxs.me/search?q={keyword}", "item": ".result"},
              "chapter_list": {"item": ".chapters a"},
              "book": {"title": "h1", "author": ".author", "cover": ".book-cover img@src"},
              "content": {"selector": "#content"}
            }
            """;

    private CrxsParser parser(String bookHtml) throws Exception {
        PageStub transport = new PageStub().page(BOOK, bookHtml);
        return new CrxsParser(new BaseParser(SourceConfigs.parse(SOURCE, "crxs"), new ParserContext(transport)));
    }

    @Test
    void testBackgroundImageCoverIsUsed() throws Exception {
        BookInfo info = parser("""
                <html><body>
                  <div class="book-cover" style="background-image: url('/covers/42.jpg')"></div>
                  <h1>Night Road</h1><span class="author">Lin</span>
                </body></html>
                """).getBookInfo(BOOK);

        assertEquals("Night Road", info.title());
        assertEquals("https://crxs.me/covers/42.jpg", info.coverUrl(), "Cover should come from the CSS background");
    }

    @Test
    void testImageCoverIsKept() throws Exception {
        BookInfo info = parser("""
                <html><body>
                  <div class="book-cover"><img src="/img/42.png"></div>
                  <div class="cover" style="background-image: url('/covers/other.jpg')"></div>
                  <h1>Night Road</h1>
                </body></html>
                """).getBookInfo(BOOK);

        assertEquals("https://crxs.me/img/42.png", info.coverUrl());
    }

    @Test
    void testNoCoverAtAll() throws Exception {
        BookInfo info = parser("<html><body><h1>Night Road</h1></body></html>").getBookInfo(BOOK);

        assertNull(info.coverUrl());
        assertEquals(BOOK, info.sourceUrl());
    }

    @Test
    void testBackgroundImageWithQuotes() {
        String html = "<div class=\"cover\" style='background-image:url(\"a/b.jpg\")'></div>";
        assertEquals("a/b.jpg", CrxsParser.backgroundImage(Jsoup.parse(html)));
        assertNull(CrxsParser.backgroundImage(Jsoup.parse("<div class=\"cover\"></div>")));
    }
}
