package com.novelsource.core.parser;

import com.novelsource.api.SourceParser;
import com.novelsource.common.error.SourceException;
import com.novelsource.common.model.BookInfo;
import com.novelsource.common.model.ChapterContent;
import com.novelsource.common.model.ChapterList;
import com.novelsource.common.model.SearchResult;

import java.util.List;

/**
 * Base for site-specific parsers. Every operation delegates to the bound {@link BaseParser};
 * subclasses override only what their site does differently.
 */
public abstract class ForwardingParser implements SourceParser {

    protected final BaseParser base;

    protected ForwardingParser(BaseParser base) {
        this.base = base;
    }

    @Override
    public String getSourceId() {
        return base.getSourceId();
    }

    @Override
    public List<SearchResult> search(String keyword, int limit) throws SourceException {
        return base.search(keyword, limit);
    }

    @Override
    public BookInfo getBookInfo(String bookUrl) throws SourceException {
        return base.getBookInfo(bookUrl);
    }

    @Override
    public ChapterList getChapterList(String bookUrl) throws SourceException {
        return base.getChapterList(bookUrl);
    }

    @Override
    public ChapterContent getChapterContent(String chapterUrl, boolean assemblePages) throws SourceException {
        return base.getChapterContent(chapterUrl, assemblePages);
    }
}
