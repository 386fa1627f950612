package com.novelsource.core.parser;

import com.novelsource.common.error.SourceException;
import com.novelsource.common.model.ChapterList;
import com.novelsource.common.model.ChapterRef;
import com.novelsource.common.util.UrlUtils;
import com.novelsource.core.config.SourceConfig;
import com.novelsource.core.selector.PathSelector;
import com.novelsource.core.selector.Selector;
import com.novelsource.core.selector.SelectorEngine;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks a book's catalog pages and assembles the chapter list.
 * <p>
 * Chapters are deduplicated by url in first-seen order and numbered once the walk ends.
 * The walk stops when the pager finds nothing, when the next page was already visited,
 * or at the page cap. If the first page cannot be fetched the error is thrown; a failure
 * on a later page ends the walk with a partial list.
 */
public class PaginationWalker {
    private static final Logger logger = LoggerFactory.getLogger(PaginationWalker.class);
    private static final Selector SELF = new PathSelector("");

    enum State { FETCHING_PAGE, HAVE_PAGE, DONE, FAILED }

    /**
     * Fetches and parses one catalog page.
     */
    @FunctionalInterface
    public interface PageSource {
        Document fetch(String url) throws SourceException;
    }

    private final String sourceId;
    private final SourceConfig.ChapterListRule rule;
    private final SelectorEngine engine;
    private final PageSource pages;
    private final int maxPages;
    private final ChapterLinkFilter filter;

    public PaginationWalker(String sourceId, SourceConfig.ChapterListRule rule, SelectorEngine engine,
                            PageSource pages, int maxPages, ChapterLinkFilter filter) {
        this.sourceId = sourceId;
        this.rule = rule;
        this.engine = engine;
        this.pages = pages;
        this.maxPages = Math.max(1, maxPages);
        this.filter = filter == null ? ChapterLinkFilter.ACCEPT_ALL : filter;
    }

    public ChapterList walk(String bookUrl) throws SourceException {
        Map<String, String> chapters = new LinkedHashMap<>(); // url -> title
        Set<String> visited = new HashSet<>();

        State state = State.FETCHING_PAGE;
        String current = UrlUtils.catalogUrl(rule.url, bookUrl);
        Document page = null;
        int pageNumber = 1;
        int walked = 0;
        Exception failure = null;
        boolean truncated = false;

        while (state != State.DONE && state != State.FAILED) {
            switch (state) {
                case FETCHING_PAGE:
                    if (walked >= maxPages) {
                        logger.warn("[{}] Catalog page cap of {} reached, {} not walked", sourceId, maxPages, current);
                        truncated = true;
                        state = State.DONE;
                        break;
                    }
                    visited.add(normalize(current));
                    try {
                        page = pages.fetch(current);
                        walked++;
                        state = State.HAVE_PAGE;
                    } catch (SourceException e) {
                        if (walked == 0) throw e;
                        logger.warn("[{}] Catalog walk stopped at page {} ({}): {}",
                                sourceId, pageNumber, current, e.getMessage());
                        failure = e;
                        state = State.FAILED;
                    }
                    break;

                case HAVE_PAGE:
                    int before = chapters.size();
                    collect(page, chapters);
                    logger.debug("[{}] Page {} added {} chapter(s)", sourceId, pageNumber, chapters.size() - before);

                    String next = nextPageUrl(page, bookUrl, current, pageNumber + 1);
                    if (next == null || visited.contains(normalize(next))) {
                        state = State.DONE;
                    } else {
                        current = next;
                        pageNumber++;
                        state = State.FETCHING_PAGE;
                    }
                    break;

                default:
                    throw new IllegalStateException("Unexpected walker state " + state);
            }
        }

        List<ChapterRef> refs = number(chapters);
        return new ChapterList(refs, walked, state == State.DONE, truncated, failure);
    }

    private void collect(Document page, Map<String, String> chapters) {
        Elements containers = rule.list == null || rule.list.isEmpty()
                ? new Elements(page)
                : engine.select(page, rule.list);

        for (Element container : containers) {
            for (Element item : engine.select(container, rule.item)) {
                String title = engine.extractOne(item, orSelf(rule.title)).orElse("");
                String href = engine.extractOneLink(item, orSelf(rule.link)).orElse("");
                if (title.isEmpty() || href.isEmpty()) continue;
                if (!filter.accept(title, href)) continue;

                String url = UrlUtils.resolve(page.location(), href);
                chapters.putIfAbsent(url, title);
            }
        }
    }

    /**
     * Next catalog url, or null when the pager selector matches nothing.
     */
    String nextPageUrl(Document page, String bookUrl, String currentUrl, int nextPage) {
        if (rule.pager == null || rule.pager.isEmpty()) return null;
        if (engine.select(page, rule.pager).isEmpty()) return null;

        if (rule.pageUrl != null && rule.pageUrl.fmt != null && !rule.pageUrl.fmt.isBlank()) {
            return UrlUtils.pageUrl(rule.pageUrl.fmt, bookUrl, rule.pageUrl.skipEnding, nextPage);
        }

        String href = engine.extractOneLink(page, rule.pager).orElse("");
        if (href.isEmpty() || href.startsWith("javascript:") || href.equals("#")) return null;
        String base = page.location() == null || page.location().isEmpty() ? currentUrl : page.location();
        return UrlUtils.resolve(base, href);
    }

    private List<ChapterRef> number(Map<String, String> chapters) {
        List<Map.Entry<String, String>> entries = new ArrayList<>(chapters.entrySet());
        if (rule.order != null && rule.order.equalsIgnoreCase("desc")) {
            // Site lists newest first
            Collections.reverse(entries);
        }
        List<ChapterRef> refs = new ArrayList<>(entries.size());
        for (Map.Entry<String, String> e : entries) {
            refs.add(new ChapterRef(e.getValue(), e.getKey(), refs.size()));
        }
        return refs;
    }

    private static Selector orSelf(Selector selector) {
        return selector == null || selector.isEmpty() ? SELF : selector;
    }

    private static String normalize(String url) {
        String s = url.trim();
        int hash = s.indexOf('#');
        if (hash >= 0) s = s.substring(0, hash);
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        return s;
    }
}
