package com.novelsource.core.config;

import com.google.gson.annotations.SerializedName;
import com.novelsource.common.util.UrlUtils;
import com.novelsource.core.parser.ParserRegistry;
import com.novelsource.core.selector.Selector;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative description of one source: where its pages live and how to read them.
 * Loaded from JSON by {@link SourceConfigs}; checked by {@link SourceConfigValidator}.
 * <p>
 * Selector fields never hold null: a field the site does not offer is {@link Selector#NONE}.
 * A missing section stays null and is reported by the validator.
 */
public class SourceConfig {
    // --- Identity ---
    public String id;           // stable key, defaults to the normalized name
    public String name;         // display name
    public String url;          // base url, e.g. https://www.example.com
    public String encoding;     // required charset name; charset() falls back to UTF-8

    // Extra host names owned by the source (mobile mirror etc.)
    public List<String> domains = new ArrayList<>();

    // Extra request headers sent with every fetch
    public Map<String, String> headers = new LinkedHashMap<>();

    @SerializedName("user_agent")
    public String userAgent;

    // --- Behavior sections ---
    public SearchRule search;

    @SerializedName("chapter_list")
    public ChapterListRule chapterList;

    public BookRule book;
    public ContentRule content;

    public static class SearchRule {
        public String url;                      // must contain {keyword}
        public Selector item = Selector.NONE;
        public Selector title = Selector.NONE;
        public Selector author = Selector.NONE;
        public Selector description = Selector.NONE;
        public Selector cover = Selector.NONE;
        public Selector link = Selector.NONE;   // default: item href or its first link
        public Selector next = Selector.NONE;
    }

    public static class ChapterListRule {
        public String url;                      // optional, must contain {book_url}
        public Selector list = Selector.NONE;   // container, default: whole page
        public Selector item = Selector.NONE;
        public Selector title = Selector.NONE;  // relative to item, default: item text
        public Selector link = Selector.NONE;   // relative to item, default: item href
        public Selector pager = Selector.NONE;

        @SerializedName("page_url")
        public PageUrlRule pageUrl;

        @SerializedName("max_pages")
        public int maxPages;                    // 0 = use Configuration.maxPages

        public String order = "asc";            // asc | desc

        @SerializedName("filter_links")
        public boolean filterLinks;
    }

    public static class PageUrlRule {
        public String fmt;                      // {book_url} and {page}

        // Suffix trimmed from the book url before substitution. The key keeps the
        // historical spelling used by existing source files.
        @SerializedName(value = "skip_endding", alternate = {"skip_ending"})
        public String skipEnding = "";
    }

    public static class BookRule {
        public Selector title = Selector.NONE;
        public Selector author = Selector.NONE;
        public Selector description = Selector.NONE;
        public Selector cover = Selector.NONE;
    }

    public static class ContentRule {
        public Selector selector = Selector.NONE;

        @SerializedName("remove_tags")
        public List<String> removeTags = new ArrayList<>();

        @SerializedName("remove_patterns")
        public List<String> removePatterns = new ArrayList<>();

        public Selector next = Selector.NONE;

        @SerializedName("max_pages")
        public int maxPages;                    // 0 = use Configuration.maxPages

        @SerializedName("default_patterns")
        public boolean defaultPatterns;
    }

    public String getId() {
        if (id != null && !id.isBlank()) return id.trim();
        return name == null ? "" : ParserRegistry.normalizeKey(name);
    }

    /**
     * Charset of the source's pages and search keyword encoding. Unknown names fall back to UTF-8.
     */
    public Charset charset() {
        if (encoding == null || encoding.isBlank()) return StandardCharsets.UTF_8;
        try {
            return Charset.forName(encoding.trim());
        } catch (IllegalArgumentException e) {
            return StandardCharsets.UTF_8;
        }
    }

    public String host() {
        return UrlUtils.host(url);
    }

    public boolean isDescending() {
        return chapterList != null && "desc".equalsIgnoreCase(chapterList.order);
    }

    @Override
    public String toString() {
        return "SourceConfig{" + getId() + ", " + url + "}";
    }
}
