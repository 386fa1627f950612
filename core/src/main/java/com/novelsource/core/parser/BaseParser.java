package com.novelsource.core.parser;

import com.novelsource.api.FetchResponse;
import com.novelsource.api.SourceParser;
import com.novelsource.common.error.ConfigException;
import com.novelsource.common.error.FetchException;
import com.novelsource.common.error.ParseException;
import com.novelsource.common.error.SourceException;
import com.novelsource.common.model.BookInfo;
import com.novelsource.common.model.ChapterContent;
import com.novelsource.common.model.ChapterList;
import com.novelsource.common.model.SearchResult;
import com.novelsource.common.util.TextUtils;
import com.novelsource.common.util.UrlUtils;
import com.novelsource.core.config.SourceConfig;
import com.novelsource.core.config.SourceConfigValidator;
import com.novelsource.core.config.SourceConfigs;
import com.novelsource.core.selector.ContentCleaner;
import com.novelsource.core.selector.PathSelector;
import com.novelsource.core.selector.Selector;
import com.novelsource.core.selector.SelectorEngine;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Generic parser driven entirely by a {@link SourceConfig}.
 * <p>
 * Every source gets one of these; specialized parsers wrap it (see {@link ForwardingParser})
 * and replace only the operations their site needs. The config is copied on construction,
 * so an instance never shares mutable state with other parsers.
 */
public class BaseParser implements SourceParser {
    private static final Logger logger = LoggerFactory.getLogger(BaseParser.class);

    public static final int SEARCH_DESCRIPTION_LIMIT = 200;
    public static final int BOOK_DESCRIPTION_LIMIT = 500;
    private static final Selector SELF = new PathSelector("");

    private final SourceConfig config;
    private final ParserContext context;
    private final SelectorEngine engine;
    private final ContentCleaner cleaner;
    private final ChapterLinkFilter linkFilter;

    public BaseParser(SourceConfig config, ParserContext context) throws ConfigException {
        new SourceConfigValidator().requireValid(config);
        this.config = SourceConfigs.copy(config);
        this.context = context;
        this.engine = context.engine();

        SourceConfig.ContentRule content = this.config.content;
        this.cleaner = ContentCleaner.of(content.removeTags, content.removePatterns, content.defaultPatterns);
        this.linkFilter = this.config.chapterList.filterLinks ? ChapterLinkFilter.HEURISTIC : ChapterLinkFilter.ACCEPT_ALL;
    }

    @Override
    public String getSourceId() {
        return config.getId();
    }

    /**
     * Copy of the bound config.
     */
    public SourceConfig getConfig() {
        return SourceConfigs.copy(config);
    }

    public SelectorEngine getEngine() {
        return engine;
    }

    public ContentCleaner getCleaner() {
        return cleaner;
    }

    // ─── FETCH ────────────────────────────────────────────────────────────

    /**
     * Fetches and parses a page of this source. Non-2xx answers are a {@link FetchException}.
     *
     * @param step extraction step reported with errors, e.g. "search" or "content"
     */
    public Document fetchDocument(String url, String step) throws FetchException {
        FetchResponse response;
        try {
            response = context.transport().fetch(url, requestHeaders());
        } catch (FetchException e) {
            throw e.withContext(getSourceId(), step);
        }
        if (!response.isSuccessful()) {
            throw new FetchException("HTTP " + response.status(), url, response.status())
                    .withContext(getSourceId(), step);
        }
        return Jsoup.parse(response.text(config.charset()), url);
    }

    protected Map<String, String> requestHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        if (config.headers != null) headers.putAll(config.headers);
        if (config.userAgent != null && !config.userAgent.isBlank()) {
            headers.put("User-Agent", config.userAgent);
        }
        return headers;
    }

    // ─── SEARCH ───────────────────────────────────────────────────────────

    @Override
    public List<SearchResult> search(String keyword, int limit) throws SourceException {
        SourceConfig.SearchRule rule = config.search;
        if (rule.item == null || rule.item.isEmpty()) {
            throw new ParseException("Source has no search.item selector", getSourceId(), rule.url, "search.item");
        }

        String url = UrlUtils.searchUrl(rule.url, keyword, config.charset());
        List<SearchResult> results = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        int cap = context.capOr(0);
        int page = 0;

        while (url != null && page < cap && visited.add(url)) {
            Document doc;
            try {
                doc = fetchDocument(url, "search");
            } catch (FetchException e) {
                if (page == 0) throw e;
                logger.warn("[{}] Search results page {} failed, keeping {} result(s): {}",
                        getSourceId(), page + 1, results.size(), e.getMessage());
                break;
            }
            page++;

            for (Element item : engine.select(doc, rule.item)) {
                Optional<SearchResult> result = toSearchResult(item, rule, doc.location());
                if (result.isPresent()) results.add(result.get());
                if (limit > 0 && results.size() >= limit) return results;
            }

            url = rule.next == null || rule.next.isEmpty()
                    ? null
                    : engine.extractOneLink(doc, rule.next).map(href -> UrlUtils.resolve(doc.location(), href)).orElse(null);
        }

        logger.debug("[{}] Search '{}' -> {} result(s)", getSourceId(), keyword, results.size());
        return results;
    }

    /**
     * Maps one result item. Items without title or link are skipped.
     */
    protected Optional<SearchResult> toSearchResult(Element item, SourceConfig.SearchRule rule, String pageUrl) {
        String title = engine.extractOne(item, orSelf(rule.title)).orElse("");
        String link = engine.extractOneLink(item, orSelf(rule.link)).orElse("");
        if (title.isEmpty() || link.isEmpty()) return Optional.empty();

        String base = pageUrl == null || pageUrl.isEmpty() ? config.url : pageUrl;
        String author = TextUtils.stripAuthorPrefix(engine.extractOne(item, rule.author).orElse(""));
        String description = TextUtils.truncate(engine.extractOne(item, rule.description).orElse(""),
                SEARCH_DESCRIPTION_LIMIT);
        String cover = engine.extractOneLink(item, rule.cover).map(src -> UrlUtils.resolve(base, src)).orElse(null);

        return Optional.of(new SearchResult(title, author, description, cover, UrlUtils.resolve(base, link)));
    }

    // ─── BOOK INFO ────────────────────────────────────────────────────────

    @Override
    public BookInfo getBookInfo(String bookUrl) throws SourceException {
        Document doc = fetchDocument(bookUrl, "book");
        return parseBookInfo(doc, bookUrl);
    }

    public BookInfo parseBookInfo(Document doc, String bookUrl) throws ParseException {
        SourceConfig.BookRule rule = config.book;
        String title = engine.extractOne(doc, rule.title).orElse("");
        if (title.isEmpty()) {
            throw new ParseException("No book title found", getSourceId(), bookUrl, "book.title");
        }
        String author = TextUtils.stripAuthorPrefix(engine.extractOne(doc, rule.author).orElse(""));
        String description = TextUtils.truncate(engine.extractOne(doc, rule.description).orElse(""),
                BOOK_DESCRIPTION_LIMIT);
        String cover = engine.extractOneLink(doc, rule.cover).map(src -> UrlUtils.resolve(bookUrl, src)).orElse(null);

        return new BookInfo(title, author, description, cover, bookUrl);
    }

    // ─── CHAPTER LIST ─────────────────────────────────────────────────────

    @Override
    public ChapterList getChapterList(String bookUrl) throws SourceException {
        SourceConfig.ChapterListRule rule = config.chapterList;
        PaginationWalker walker = new PaginationWalker(getSourceId(), rule, engine,
                url -> fetchDocument(url, "chapter_list"), context.capOr(rule.maxPages), linkFilter);

        ChapterList list = walker.walk(bookUrl);
        if (list.isPartial()) {
            logger.warn("[{}] Chapter list of {} is partial: {} chapter(s) from {} page(s)",
                    getSourceId(), bookUrl, list.size(), list.pagesWalked());
        } else {
            logger.debug("[{}] {} chapter(s) from {} page(s)", getSourceId(), list.size(), list.pagesWalked());
        }
        return list;
    }

    // ─── CONTENT ──────────────────────────────────────────────────────────

    /**
     * Fetches one page of a chapter and cleans its body.
     */
    public ContentPage extractContentPage(String url) throws SourceException {
        Document doc = fetchDocument(url, "content");
        SourceConfig.ContentRule rule = config.content;

        Element body = engine.selectFirst(doc, rule.selector).orElse(null);
        if (body == null) {
            throw new ParseException("No chapter body found", getSourceId(), url, "content.selector");
        }

        String next = null;
        if (rule.next != null && !rule.next.isEmpty()) {
            next = engine.extractOneLink(doc, rule.next)
                    .filter(href -> !href.startsWith("javascript:") && !href.equals("#"))
                    .map(href -> UrlUtils.resolve(url, href))
                    .orElse(null);
        }
        return new ContentPage(url, body.outerHtml(), cleaner.clean(body), next);
    }

    @Override
    public ChapterContent getChapterContent(String chapterUrl, boolean assemblePages) throws SourceException {
        ContentPage first = extractContentPage(chapterUrl);
        if (!assemblePages) {
            return new ChapterContent(first.rawHtml(), first.cleanedText(), first.nextUrl(), 1);
        }
        return assemble(first, (next, current) -> true);
    }

    /**
     * Follows next links from {@code first} while {@code follow} accepts them, bounded by the
     * page cap and never revisiting a page.
     */
    public ChapterContent assemble(ContentPage first, NextPagePolicy follow) throws SourceException {
        StringBuilder raw = new StringBuilder(first.rawHtml());
        List<String> texts = new ArrayList<>();
        if (!first.cleanedText().isEmpty()) texts.add(first.cleanedText());

        Set<String> visited = new HashSet<>();
        visited.add(first.url());
        int cap = context.capOr(config.content.maxPages);
        int pages = 1;
        ContentPage current = first;

        while (current.nextUrl() != null && pages < cap
                && !visited.contains(current.nextUrl())
                && follow.follow(current.nextUrl(), current.url())) {
            String nextUrl = current.nextUrl();
            visited.add(nextUrl);
            current = extractContentPage(nextUrl);
            pages++;
            raw.append('\n').append(current.rawHtml());
            if (!current.cleanedText().isEmpty()) texts.add(current.cleanedText());
        }

        String unfollowed = current.nextUrl();
        return new ChapterContent(raw.toString(), String.join("\n\n", texts), unfollowed, pages);
    }

    /**
     * Whether a chapter's "next" link continues the same chapter.
     */
    @FunctionalInterface
    public interface NextPagePolicy {
        boolean follow(String nextUrl, String currentUrl);
    }

    private static Selector orSelf(Selector selector) {
        return selector == null || selector.isEmpty() ? SELF : selector;
    }

    public boolean canHandleUrl(String url) {
        String host = UrlUtils.host(url);
        if (host == null) return false;
        if (host.equals(config.host())) return true;
        return config.domains != null && config.domains.stream().anyMatch(d -> d.equalsIgnoreCase(host));
    }
}
