package com.novelsource.core.selector;

import com.novelsource.test.TestBase;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SelectorsTest extends TestBase {

    @Test
    void testParsePath() {
        assertEquals(new PathSelector("div.title"), Selectors.parse(" div.title "));
    }

    @Test
    void testParseAttributePath() {
        assertEquals(new AttributeSelector("a.cover", "href"), Selectors.parse("a.cover@href"));
        assertEquals(new AttributeSelector("", "href"), Selectors.parse("@href"), "Bare attribute reads the context element");
        assertEquals(new AttributeSelector("a.next", "abs:href"), Selectors.parse("a.next@abs:href"));
    }

    @Test
    void testAtSignInsideConditionIsNotASeparator() {
        assertEquals(new PathSelector("a[href*=@]"), Selectors.parse("a[href*=@]"));
        assertEquals(new AttributeSelector("a[title=x@y]", "href"), Selectors.parse("a[title=x@y]@href"));
    }

    @Test
    void testBlankIsNone() {
        assertTrue(Selectors.parse("").isEmpty());
        assertTrue(Selectors.parse(null).isEmpty());
        assertSame(Selector.NONE, Selectors.parse("   "));
    }

    @Test
    void testFirstOf() {
        assertEquals(new PathSelector("h1"), Selectors.firstOf("h1", ""), "A single alternative is not wrapped");

        Selector fallback = Selectors.firstOf("h1.title", "title");
        assertTrue(fallback instanceof FallbackSelector);
        assertEquals(2, ((FallbackSelector) fallback).alternatives().size());
        assertFalse(fallback.isEmpty());
    }
}
