package com.novelsource.core.config;

import com.novelsource.common.error.ConfigException;
import com.novelsource.core.selector.Selector;
import com.novelsource.core.selector.Selectors;
import com.novelsource.test.Fixtures;
import com.novelsource.test.TestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceConfigValidatorTest extends TestBase {

    private final SourceConfigValidator validator = new SourceConfigValidator();
    private SourceConfig config;

    @BeforeEach
    void loadFixture() throws ConfigException {
        config = Fixtures.source("testsite");
    }

    private List<String> errors() {
        return validator.validate(config).stream()
                .filter(ValidationError::isError)
                .map(ValidationError::message)
                .toList();
    }

    @Test
    void testFixtureIsValid() {
        assertTrue(validator.validate(config).isEmpty(), "Fixture should have neither errors nor warnings");
        assertDoesNotThrow(() -> validator.requireValid(config));
    }

    @Test
    void testMissingIdentity() {
        config.name = null;
        config.url = "";

        ConfigException e = assertThrows(ConfigException.class, () -> validator.requireValid(config));
        assertTrue(e.getProblems().contains("Missing required key 'name'"));
        assertTrue(e.getProblems().contains("Missing required key 'url'"));
        assertEquals("config", e.getStep());
    }

    @Test
    void testMissingEncodingIsRejected() throws ConfigException {
        SourceConfig parsed = SourceConfigs.parse("""
                {
                  "name": "No Charset",
                  "url": "https://x.test",
                  "search": {"url": "https://x.test/s?q={keyword}", "item": ".item"},
                  "chapter_list": {"item": "#list a"},
                  "book": {"title": "h1"},
                  "content": {"selector": "#content"}
                }
                """, "nocharset.json");

        assertNull(parsed.encoding, "A missing encoding must not be filled in");
        ConfigException e = assertThrows(ConfigException.class, () -> validator.requireValid(parsed));
        assertTrue(e.getProblems().contains("Missing required key 'encoding'"));
    }

    @Test
    void testMissingSections() {
        config.search = null;
        config.content = null;

        List<String> errors = errors();
        assertTrue(errors.contains("Missing required key 'search'"));
        assertTrue(errors.contains("Missing required key 'content'"));
    }

    @Test
    void testTemplatesNeedPlaceholders() {
        config.search.url = "https://www.testsite.com/search";
        config.chapterList.url = "https://www.testsite.com/catalog";
        config.chapterList.pageUrl = new SourceConfig.PageUrlRule();
        config.chapterList.pageUrl.fmt = "{book_url}/index.html";

        List<String> errors = errors();
        assertEquals(3, errors.size(), "Errors: " + errors);
        assertTrue(errors.get(0).contains("{keyword}"));
    }

    @Test
    void testInvalidCssAndRegex() {
        config.book.author = Selectors.parse("div[");
        config.content.removePatterns = List.of("(unclosed");

        List<String> errors = errors();
        assertTrue(errors.stream().anyMatch(m -> m.startsWith("Invalid CSS selector in 'book'")), "Errors: " + errors);
        assertTrue(errors.stream().anyMatch(m -> m.contains("invalid regex")), "Errors: " + errors);
    }

    @Test
    void testOrderAndLimits() {
        config.chapterList.order = "random";
        config.content.maxPages = -1;

        assertEquals(2, errors().size());
    }

    @Test
    void testUnsupportedEncoding() {
        config.encoding = "klingon-8";
        assertTrue(errors().contains("Unsupported encoding: klingon-8"));
    }

    @Test
    void testEmptyRequiredSelectorsAreWarnings() {
        config.search.item = Selector.NONE;
        config.content.selector = Selector.NONE;

        List<ValidationError> findings = validator.validate(config);
        assertEquals(2, findings.size());
        assertTrue(findings.stream().noneMatch(ValidationError::isError), "Empty selectors only warn");
        assertDoesNotThrow(() -> validator.requireValid(config));
    }
}
