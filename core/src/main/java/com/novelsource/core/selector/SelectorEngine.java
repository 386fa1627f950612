package com.novelsource.core.selector;

import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates {@link Selector}s against parsed pages.
 * <p>
 * Never throws on bad input: a selector jsoup cannot parse, a missing element or an empty
 * attribute all produce an empty result so callers can apply their defaults.
 * Stateless and safe to share between threads.
 */
public class SelectorEngine {
    private static final Logger logger = LoggerFactory.getLogger(SelectorEngine.class);

    /**
     * Elements addressed by the selector. For a fallback list, the first alternative that matches anything.
     */
    public Elements select(Element root, Selector selector) {
        if (root == null || selector == null || selector.isEmpty()) return new Elements();

        if (selector instanceof PathSelector) {
            return query(root, ((PathSelector) selector).css());
        }
        if (selector instanceof AttributeSelector) {
            AttributeSelector attr = (AttributeSelector) selector;
            Elements matches = new Elements();
            for (Element el : query(root, attr.css())) {
                if (el.hasAttr(stripAbs(attr.attribute()))) matches.add(el);
            }
            return matches;
        }
        if (selector instanceof FallbackSelector) {
            for (Selector alternative : ((FallbackSelector) selector).alternatives()) {
                Elements found = select(root, alternative);
                if (!found.isEmpty()) return found;
            }
        }
        return new Elements();
    }

    /**
     * All non-blank values: element text for paths, attribute values for attribute paths.
     */
    public List<String> extract(Element root, Selector selector) {
        List<String> values = new ArrayList<>();
        if (root == null || selector == null || selector.isEmpty()) return values;

        if (selector instanceof PathSelector) {
            for (Element el : query(root, ((PathSelector) selector).css())) {
                addIfPresent(values, el.text());
            }
        } else if (selector instanceof AttributeSelector) {
            AttributeSelector attr = (AttributeSelector) selector;
            for (Element el : query(root, attr.css())) {
                addIfPresent(values, el.attr(attr.attribute()));
            }
        } else if (selector instanceof FallbackSelector) {
            for (Selector alternative : ((FallbackSelector) selector).alternatives()) {
                List<String> found = extract(root, alternative);
                if (!found.isEmpty()) return found;
            }
        }
        return values;
    }

    /**
     * Link targets, unresolved. Attribute paths yield their attribute; a plain path yields each
     * element's {@code href} or {@code src}, or the {@code href} of its first link.
     */
    public List<String> extractLinks(Element root, Selector selector) {
        List<String> links = new ArrayList<>();
        if (root == null || selector == null || selector.isEmpty()) return links;

        if (selector instanceof AttributeSelector) {
            return extract(root, selector);
        }
        if (selector instanceof PathSelector) {
            for (Element el : query(root, ((PathSelector) selector).css())) {
                if (el.hasAttr("href")) {
                    addIfPresent(links, el.attr("href"));
                } else if (el.hasAttr("src")) {
                    addIfPresent(links, el.attr("src"));
                } else {
                    Element anchor = el.selectFirst("a[href]");
                    if (anchor != null) addIfPresent(links, anchor.attr("href"));
                }
            }
        } else if (selector instanceof FallbackSelector) {
            for (Selector alternative : ((FallbackSelector) selector).alternatives()) {
                List<String> found = extractLinks(root, alternative);
                if (!found.isEmpty()) return found;
            }
        }
        return links;
    }

    public Optional<String> extractOneLink(Element root, Selector selector) {
        List<String> links = extractLinks(root, selector);
        return links.isEmpty() ? Optional.empty() : Optional.of(links.get(0));
    }

    public Optional<String> extractOne(Element root, Selector selector) {
        List<String> values = extract(root, selector);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public Optional<Element> selectFirst(Element root, Selector selector) {
        Elements found = select(root, selector);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.first());
    }

    private Elements query(Element root, String css) {
        if (css.isEmpty()) return new Elements(root);
        try {
            return root.select(css);
        } catch (IllegalArgumentException | IllegalStateException e) {
            // jsoup reports bad queries as either
            logger.debug("Unusable selector '{}': {}", css, e.getMessage());
            return new Elements();
        }
    }

    private static void addIfPresent(List<String> values, String value) {
        if (value == null) return;
        String trimmed = value.trim();
        if (!trimmed.isEmpty()) values.add(trimmed);
    }

    private static String stripAbs(String attribute) {
        return attribute.startsWith("abs:") ? attribute.substring(4) : attribute;
    }
}
