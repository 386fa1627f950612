package com.novelsource.api;

import com.novelsource.common.error.ImportException;
import com.novelsource.common.model.BookInfo;
import com.novelsource.common.model.ChapterRef;

import java.util.List;
import java.util.Optional;

/**
 * Where imported books end up.
 */
public interface BookSink {

    // Id of an already imported book with this source url
    Optional<String> findBySourceUrl(String sourceUrl);

    // Stores the book with its chapter index (no chapter text), returns the new book id
    String save(String sourceId, BookInfo book, List<ChapterRef> chapters) throws ImportException;
}
