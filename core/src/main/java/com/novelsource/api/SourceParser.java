package com.novelsource.api;

import com.novelsource.common.error.SourceException;
import com.novelsource.common.model.BookInfo;
import com.novelsource.common.model.ChapterContent;
import com.novelsource.common.model.ChapterList;
import com.novelsource.common.model.SearchResult;

import java.util.List;

/**
 * The four extraction operations every parser offers for its source.
 * Calls block on network I/O; run them on a worker thread.
 */
public interface SourceParser {

    String getSourceId();

    /**
     * @param limit maximum number of results, {@code <= 0} for no limit
     * @return matching books, empty when the site has none
     */
    List<SearchResult> search(String keyword, int limit) throws SourceException;

    BookInfo getBookInfo(String bookUrl) throws SourceException;

    /**
     * Chapters across all catalog pages. A walk that broke off after the first page
     * comes back with {@code complete == false}.
     */
    ChapterList getChapterList(String bookUrl) throws SourceException;

    /**
     * @param assemblePages follow the in-chapter "next page" links and join the pages
     */
    ChapterContent getChapterContent(String chapterUrl, boolean assemblePages) throws SourceException;
}
