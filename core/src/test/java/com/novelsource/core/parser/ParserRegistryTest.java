package com.novelsource.core.parser;

import com.novelsource.api.SourceParser;
import com.novelsource.common.error.ConfigException;
import com.novelsource.common.model.BookInfo;
import com.novelsource.common.model.MatchType;
import com.novelsource.core.config.SourceConfig;
import com.novelsource.test.Fixtures;
import com.novelsource.test.StubTransport;
import com.novelsource.test.TestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ParserRegistryTest extends TestBase {

    /**
     * Marks its results so tests can tell which parser produced them.
     */
    static class TaggingParser extends ForwardingParser {
        final String tag;

        TaggingParser(BaseParser base, String tag) {
            super(base);
            this.tag = tag;
        }

        @Override
        public BookInfo getBookInfo(String bookUrl) {
            return new BookInfo(tag, "", "", null, bookUrl);
        }
    }

    private static ParserDescriptor descriptor(String name, String... domains) {
        return ParserDescriptor.builder(name)
                .domain(domains)
                .factory(base -> new TaggingParser(base, name))
                .build();
    }

    private ParserContext context;
    private SourceConfig config;

    @BeforeEach
    void setUpContext() throws ConfigException {
        context = new ParserContext(new StubTransport());
        config = Fixtures.source("testsite");
    }

    private ParserRegistry registry(FuzzyMatchPolicy policy, ParserDescriptor... descriptors) throws ConfigException {
        ParserRegistry.Builder builder = ParserRegistry.builder(context).policy(policy);
        for (ParserDescriptor d : descriptors) builder.register(d);
        return builder.build();
    }

    private static String tagOf(Optional<ParserMatch> match) throws Exception {
        return match.orElseThrow().parser().getBookInfo("https://any.test/").title();
    }

    @Test
    void testDuplicateNameIsRejected() throws ConfigException {
        ParserRegistry.Builder builder = ParserRegistry.builder(context).register(descriptor("ddyueshu", "ddyueshu.cc"));

        ConfigException e = assertThrows(ConfigException.class,
                () -> builder.register(descriptor("DD-Yue_Shu", "other.cc")));
        assertTrue(e.getMessage().contains("Duplicate parser name"));
        assertTrue(builder.isRegistered("ddyueshu"));
    }

    @Test
    void testRollbackDropsLaterRegistrations() throws ConfigException {
        ParserRegistry.Builder builder = ParserRegistry.builder(context).register(descriptor("keep", "keep.test"));
        int checkpoint = builder.checkpoint();
        builder.register(descriptor("drop", "drop.test")).register(descriptor("gone", "gone.test"));

        builder.rollbackTo(checkpoint);

        assertTrue(builder.isRegistered("keep"));
        assertFalse(builder.isRegistered("drop"));
        assertFalse(builder.isRegistered("gone"));
        assertDoesNotThrow(() -> builder.register(descriptor("drop", "drop.test")), "A dropped name can be reused");
    }

    @Test
    void testGenericNameIsReserved() {
        assertThrows(ConfigException.class,
                () -> ParserRegistry.builder(context).register(descriptor("Base", "x.test")));
    }

    @Test
    void testParserForSource() throws Exception {
        ParserRegistry registry = registry(FuzzyMatchPolicy.DOMAIN_LABEL, descriptor("testsite", "www.testsite.com"));

        SourceParser specialized = registry.getParserForSource("TestSite", config);
        assertTrue(specialized instanceof TaggingParser, "Lookup by normalized name");
        assertEquals("testsite", specialized.getSourceId());

        SourceParser generic = registry.getParserForSource("unknown", config);
        assertTrue(generic instanceof BaseParser, "Unknown names get the generic parser");
    }

    @Test
    void testParserForSourceValidatesConfig() throws ConfigException {
        ParserRegistry registry = registry(FuzzyMatchPolicy.DOMAIN_LABEL);
        config.search = null;

        assertThrows(ConfigException.class, () -> registry.getParserForSource("testsite", config));
    }

    @Test
    void testExactMatchBeatsEarlierFuzzyMatch() throws Exception {
        ParserRegistry registry = registry(FuzzyMatchPolicy.DOMAIN_LABEL,
                descriptor("desktop", "www.novel.test"),
                descriptor("mobile", "m.novel.test"));

        Optional<ParserMatch> match = registry.getParserForUrl("https://m.novel.test/book/1", config);

        assertEquals(MatchType.EXACT, match.orElseThrow().matchType());
        assertEquals("mobile", tagOf(match));
    }

    @Test
    void testFuzzyMatchUsesRegistrationOrder() throws Exception {
        ParserRegistry registry = registry(FuzzyMatchPolicy.DOMAIN_LABEL,
                descriptor("first", "www.novel.test"),
                descriptor("second", "novel.example"));

        for (int i = 0; i < 3; i++) {
            Optional<ParserMatch> match = registry.getParserForUrl("https://wap.novel.org/book/1", config);
            assertEquals(MatchType.FUZZY, match.orElseThrow().matchType());
            assertEquals("first", tagOf(match), "Same url, same parser, every time");
        }
    }

    @Test
    void testUrlPatternMatchesUnderEveryPolicy() throws Exception {
        ParserDescriptor pattern = ParserDescriptor.builder("crxs")
                .domain("crxs.me")
                .urlPattern("^https?://([a-z0-9-]+\\.)?crxs\\.me/fiction/")
                .factory(base -> new TaggingParser(base, "crxs"))
                .build();

        for (FuzzyMatchPolicy policy : FuzzyMatchPolicy.values()) {
            ParserRegistry registry = registry(policy, pattern);
            Optional<ParserMatch> match = registry.getParserForUrl("https://cdn.crxs.me/fiction/12", config);
            assertTrue(match.isPresent(), "Pattern should match under " + policy);
            assertEquals(MatchType.FUZZY, match.get().matchType());
        }
    }

    @Test
    void testNoMatchIsEmpty() throws ConfigException {
        ParserRegistry registry = registry(FuzzyMatchPolicy.DOMAIN_LABEL, descriptor("ddyueshu", "www.ddyueshu.cc"));

        assertTrue(registry.getParserForUrl("https://www.example.org/book/1", config).isEmpty());
        assertTrue(registry.getParserForUrl("not a url", config).isEmpty());
        assertTrue(registry.findDescriptor(null).isEmpty());
    }

    @Test
    void testHostSuffixPolicyIgnoresNames() throws ConfigException {
        ParserRegistry labels = registry(FuzzyMatchPolicy.DOMAIN_LABEL, descriptor("novelhub", "nh.test"));
        ParserRegistry suffix = registry(FuzzyMatchPolicy.HOST_SUFFIX, descriptor("novelhub", "nh.test"));

        assertTrue(labels.findDescriptor("https://novelhub.org/b/1").isPresent(), "Name counts as a label");
        assertTrue(suffix.findDescriptor("https://novelhub.org/b/1").isEmpty());
        assertTrue(suffix.findDescriptor("https://cdn.nh.test/b/1").isPresent());
    }

    @Test
    void testListParsers() throws ConfigException {
        ParserRegistry registry = registry(FuzzyMatchPolicy.DOMAIN_LABEL,
                descriptor("zeta", "z.test"), descriptor("alpha", "a.test"));

        List<String> names = registry.listParsers().stream().map(ParserDescriptor::getName).collect(Collectors.toList());
        assertEquals(List.of("zeta", "alpha"), names, "Registration order is kept");
        assertEquals(2, registry.size());
        assertEquals(FuzzyMatchPolicy.DOMAIN_LABEL, registry.getPolicy());
        assertTrue(registry.getDescriptor("ALPHA").isPresent());
    }

    @Test
    void testDescriptorNeedsFactory() {
        assertThrows(IllegalStateException.class, () -> ParserDescriptor.builder("x").domain("x.test").build());
        assertThrows(IllegalArgumentException.class, () -> ParserDescriptor.builder(" "));
    }
}
