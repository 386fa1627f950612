package com.novelsource.core.batch;

import com.novelsource.common.error.SourceException;

/**
 * Imports one book. Supplied by the caller of the batch.
 */
@FunctionalInterface
public interface BookImporter {

    /**
     * @return human readable status message
     */
    String importBook(String sourceId, String bookUrl) throws SourceException;
}
