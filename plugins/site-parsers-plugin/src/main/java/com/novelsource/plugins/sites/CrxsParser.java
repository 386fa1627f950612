package com.novelsource.plugins.sites;

import com.novelsource.common.error.SourceException;
import com.novelsource.common.model.BookInfo;
import com.novelsource.common.util.UrlUtils;
import com.novelsource.core.parser.BaseParser;
import com.novelsource.core.parser.ForwardingParser;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * crxs.me shows covers as CSS backgrounds, not {@code <img>} tags.
 */
public class CrxsParser extends ForwardingParser {
    private static final Pattern BACKGROUND_IMAGE =
            Pattern.compile("background-image:\\s*url\\([\"']?(.*?)[\"']?\\)");
    static final String COVER_ELEMENTS = ".book-cover, .cover, [style*=background-image]";

    public CrxsParser(BaseParser base) {
        super(base);
    }

    @Override
    public BookInfo getBookInfo(String bookUrl) throws SourceException {
        Document doc = base.fetchDocument(bookUrl, "book");
        BookInfo info = base.parseBookInfo(doc, bookUrl);
        if (info.coverUrl() != null) return info;

        String cover = backgroundImage(doc);
        if (cover == null) return info;
        return new BookInfo(info.title(), info.author(), info.description(),
                UrlUtils.resolve(bookUrl, cover), info.sourceUrl());
    }

    static String backgroundImage(Element root) {
        for (Element el : root.select(COVER_ELEMENTS)) {
            Matcher m = BACKGROUND_IMAGE.matcher(el.attr("style"));
            if (m.find() && !m.group(1).isBlank()) return m.group(1).trim();
        }
        return null;
    }
}
