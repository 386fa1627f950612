package com.novelsource.core.selector;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered alternatives. The first one producing a non-empty result wins.
 */
public record FallbackSelector(List<Selector> alternatives) implements Selector {

    public FallbackSelector {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    @Override
    public boolean isEmpty() {
        return alternatives.stream().allMatch(Selector::isEmpty);
    }

    @Override
    public String toString() {
        return alternatives.stream().map(Object::toString).collect(Collectors.joining(" | ", "[", "]"));
    }
}
