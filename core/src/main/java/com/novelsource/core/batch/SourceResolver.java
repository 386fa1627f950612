package com.novelsource.core.batch;

import java.util.Optional;

/**
 * Picks the source for a book url when the batch has no fixed source.
 */
@FunctionalInterface
public interface SourceResolver {

    SourceResolver NONE = url -> Optional.empty();

    Optional<String> resolve(String bookUrl);
}
