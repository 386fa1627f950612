package com.novelsource.core.config;

import com.novelsource.common.error.ConfigException;
import com.novelsource.common.util.UrlUtils;
import com.novelsource.core.selector.AttributeSelector;
import com.novelsource.core.selector.FallbackSelector;
import com.novelsource.core.selector.PathSelector;
import com.novelsource.core.selector.Selector;
import org.jsoup.select.QueryParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks a {@link SourceConfig} before a parser is built from it.
 * Errors make the source unusable; warnings mark operations that will come back empty.
 */
public class SourceConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(SourceConfigValidator.class);

    public List<ValidationError> validate(SourceConfig config) {
        List<ValidationError> errors = new ArrayList<>();
        if (config == null) {
            errors.add(ValidationError.error("Source config is missing"));
            return errors;
        }

        // 1. Identity
        validateIdentity(config, errors);

        // 2. Sections and their templates
        validateSearch(config.search, errors);
        validateChapterList(config.chapterList, errors);
        validateBook(config.book, errors);
        validateContent(config.content, errors);

        return errors;
    }

    /**
     * Throws when the config has errors, logs warnings otherwise.
     */
    public void requireValid(SourceConfig config) throws ConfigException {
        List<ValidationError> findings = validate(config);
        List<String> problems = new ArrayList<>();
        String id = config == null ? null : config.getId();

        for (ValidationError finding : findings) {
            if (finding.isError()) {
                problems.add(finding.message());
            } else {
                logger.warn("⚠️ Source '{}': {}", id, finding.message());
            }
        }

        if (!problems.isEmpty()) {
            throw new ConfigException("Invalid source config '" + id + "': " + String.join("; ", problems),
                    id, problems);
        }
    }

    private void validateIdentity(SourceConfig config, List<ValidationError> errors) {
        if (isBlank(config.name)) {
            errors.add(ValidationError.error("Missing required key 'name'"));
        }
        if (isBlank(config.url)) {
            errors.add(ValidationError.error("Missing required key 'url'"));
        } else if (!UrlUtils.isHttpUrl(config.url)) {
            errors.add(ValidationError.error("'url' is not an http(s) url: " + config.url));
        }
        if (isBlank(config.encoding)) {
            errors.add(ValidationError.error("Missing required key 'encoding'"));
        } else if (!Charset.isSupported(safeCharsetName(config.encoding))) {
            errors.add(ValidationError.error("Unsupported encoding: " + config.encoding));
        }
        if (config.domains != null) {
            for (String domain : config.domains) {
                if (isBlank(domain) || domain.contains("/")) {
                    errors.add(ValidationError.error("'domains' entries must be plain host names: " + domain));
                }
            }
        }
    }

    private void validateSearch(SourceConfig.SearchRule search, List<ValidationError> errors) {
        if (search == null) {
            errors.add(ValidationError.error("Missing required key 'search'"));
            return;
        }
        if (isBlank(search.url)) {
            errors.add(ValidationError.error("Missing 'search.url'"));
        } else if (!search.url.contains(UrlUtils.KEYWORD)) {
            errors.add(ValidationError.error("'search.url' must contain " + UrlUtils.KEYWORD));
        }
        if (search.item == null || search.item.isEmpty()) {
            errors.add(ValidationError.warning("'search.item' is empty, search will fail"));
        }
        checkSelectors(errors, "search",
                search.item, search.title, search.author, search.description, search.cover, search.link, search.next);
    }

    private void validateChapterList(SourceConfig.ChapterListRule rule, List<ValidationError> errors) {
        if (rule == null) {
            errors.add(ValidationError.error("Missing required key 'chapter_list'"));
            return;
        }
        if (!isBlank(rule.url) && !rule.url.contains(UrlUtils.BOOK_URL)) {
            errors.add(ValidationError.error("'chapter_list.url' must contain " + UrlUtils.BOOK_URL));
        }
        if (rule.pageUrl != null && !isBlank(rule.pageUrl.fmt) && !rule.pageUrl.fmt.contains(UrlUtils.PAGE)) {
            errors.add(ValidationError.error("'chapter_list.page_url.fmt' must contain " + UrlUtils.PAGE));
        }
        if (rule.order != null && !rule.order.equalsIgnoreCase("asc") && !rule.order.equalsIgnoreCase("desc")) {
            errors.add(ValidationError.error("'chapter_list.order' must be asc or desc: " + rule.order));
        }
        if (rule.maxPages < 0) {
            errors.add(ValidationError.error("'chapter_list.max_pages' must not be negative"));
        }
        if (rule.item == null || rule.item.isEmpty()) {
            errors.add(ValidationError.warning("'chapter_list.item' is empty, no chapters will be found"));
        }
        checkSelectors(errors, "chapter_list", rule.list, rule.item, rule.title, rule.link, rule.pager);
    }

    private void validateBook(SourceConfig.BookRule book, List<ValidationError> errors) {
        if (book == null) {
            errors.add(ValidationError.error("Missing required key 'book'"));
            return;
        }
        if (book.title == null || book.title.isEmpty()) {
            errors.add(ValidationError.warning("'book.title' is empty, book info will fail"));
        }
        checkSelectors(errors, "book", book.title, book.author, book.description, book.cover);
    }

    private void validateContent(SourceConfig.ContentRule content, List<ValidationError> errors) {
        if (content == null) {
            errors.add(ValidationError.error("Missing required key 'content'"));
            return;
        }
        if (content.selector == null || content.selector.isEmpty()) {
            errors.add(ValidationError.warning("'content.selector' is empty, chapter text will fail"));
        }
        if (content.maxPages < 0) {
            errors.add(ValidationError.error("'content.max_pages' must not be negative"));
        }
        checkSelectors(errors, "content", content.selector, content.next);

        if (content.removeTags != null) {
            for (String tag : content.removeTags) {
                checkCss(errors, "content.remove_tags", tag);
            }
        }
        if (content.removePatterns != null) {
            for (String pattern : content.removePatterns) {
                try {
                    Pattern.compile(pattern, Pattern.MULTILINE);
                } catch (PatternSyntaxException | NullPointerException e) {
                    errors.add(ValidationError.error("'content.remove_patterns' has an invalid regex: " + pattern));
                }
            }
        }
    }

    private void checkSelectors(List<ValidationError> errors, String section, Selector... selectors) {
        for (Selector selector : selectors) {
            checkSelector(errors, section, selector);
        }
    }

    private void checkSelector(List<ValidationError> errors, String section, Selector selector) {
        if (selector instanceof PathSelector) {
            checkCss(errors, section, ((PathSelector) selector).css());
        } else if (selector instanceof AttributeSelector) {
            checkCss(errors, section, ((AttributeSelector) selector).css());
        } else if (selector instanceof FallbackSelector) {
            for (Selector alternative : ((FallbackSelector) selector).alternatives()) {
                checkSelector(errors, section, alternative);
            }
        }
    }

    private void checkCss(List<ValidationError> errors, String section, String css) {
        if (css == null || css.isBlank()) return;
        try {
            QueryParser.parse(css);
        } catch (IllegalArgumentException | IllegalStateException e) {
            errors.add(ValidationError.error("Invalid CSS selector in '" + section + "': " + css));
        }
    }

    private static String safeCharsetName(String name) {
        String trimmed = name.trim();
        // Charset.isSupported throws for illegal names instead of returning false
        return trimmed.matches("[A-Za-z0-9][A-Za-z0-9.:_+-]*") ? trimmed : "x-invalid-charset";
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
