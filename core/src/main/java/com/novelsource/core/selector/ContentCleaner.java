package com.novelsource.core.selector;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns a chapter body into plain reading text.
 * <ol>
 *   <li>removes configured tags (tag names or CSS selectors) from a copy of the body,</li>
 *   <li>renders the rest as text, one paragraph per block or {@code <br>} line,</li>
 *   <li>removes configured regex patterns, leftmost-longest and non-overlapping across all patterns,</li>
 *   <li>normalizes whitespace; paragraphs are separated by one blank line.</li>
 * </ol>
 * Steps 3 and 4 repeat until nothing changes, so cleaning clean text is a no-op.
 * Patterns are compiled MULTILINE: {@code ^} and {@code $} anchor per line.
 */
public class ContentCleaner {
    private static final Logger logger = LoggerFactory.getLogger(ContentCleaner.class);
    private static final int MAX_PASSES = 8;
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\u00A0\\u3000\\u200B]+");

    /**
     * Boilerplate lines common on novel mirrors ("to be continued", "click to read more", ...).
     */
    public static final List<String> DEFAULT_PATTERNS = List.of(
            "^\\s*广告\\s*$",
            "^\\s*推荐\\s*$",
            "^\\s*VIP\\s*$",
            "^\\s*订阅\\s*$",
            "^\\s*本章未完，请翻页继续阅读.*$",
            "^\\s*未完待续.*$",
            "^\\s*点击进入.*$",
            "^\\s*更多免费章节.*$");

    private final List<String> removeSelectors;
    private final List<Pattern> patterns;

    public ContentCleaner(List<String> removeSelectors, List<Pattern> patterns) {
        this.removeSelectors = removeSelectors == null ? List.of() : List.copyOf(removeSelectors);
        this.patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    public static ContentCleaner none() {
        return new ContentCleaner(List.of(), List.of());
    }

    /**
     * @throws PatternSyntaxException if one of the expressions is not a valid regex
     */
    public static ContentCleaner of(List<String> removeTags, List<String> removePatterns, boolean withDefaults) {
        List<Pattern> compiled = new ArrayList<>();
        if (removePatterns != null) {
            for (String p : removePatterns) {
                compiled.add(Pattern.compile(p, Pattern.MULTILINE));
            }
        }
        if (withDefaults) {
            for (String p : DEFAULT_PATTERNS) {
                compiled.add(Pattern.compile(p, Pattern.MULTILINE | Pattern.CASE_INSENSITIVE));
            }
        }
        return new ContentCleaner(removeTags, compiled);
    }

    public List<Pattern> getPatterns() {
        return Collections.unmodifiableList(patterns);
    }

    public String clean(Element body) {
        if (body == null) return "";
        Element copy = body.clone();
        for (String selector : removeSelectors) {
            try {
                copy.select(selector).remove();
            } catch (IllegalArgumentException | IllegalStateException e) {
                logger.debug("Skipping unusable remove selector '{}': {}", selector, e.getMessage());
            }
        }
        return cleanText(toText(copy));
    }

    public String cleanHtml(String html) {
        if (html == null || html.isEmpty()) return "";
        return clean(Jsoup.parseBodyFragment(html).body());
    }

    /**
     * Pattern removal plus whitespace normalization, repeated to a fixpoint.
     */
    public String cleanText(String text) {
        if (text == null || text.isEmpty()) return "";
        String current = normalize(text);
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = normalize(removePatterns(current));
            if (next.equals(current)) return current;
            current = next;
        }
        logger.debug("Content did not settle after {} cleaning passes", MAX_PASSES);
        return current;
    }

    String removePatterns(String text) {
        if (patterns.isEmpty() || text.isEmpty()) return text;

        List<Matcher> matchers = new ArrayList<>(patterns.size());
        for (Pattern p : patterns) matchers.add(p.matcher(text));

        StringBuilder out = new StringBuilder(text.length());
        int pos = 0;
        while (pos < text.length()) {
            int bestStart = -1;
            int bestEnd = -1;
            for (Matcher m : matchers) {
                int from = pos;
                while (from <= text.length() && m.find(from)) {
                    if (m.end() == m.start()) {
                        from = m.start() + 1;
                        continue;
                    }
                    if (bestStart < 0 || m.start() < bestStart
                            || (m.start() == bestStart && m.end() > bestEnd)) {
                        bestStart = m.start();
                        bestEnd = m.end();
                    }
                    break;
                }
            }
            if (bestStart < 0) break;
            out.append(text, pos, bestStart);
            pos = bestEnd;
        }
        out.append(text, pos, text.length());
        return out.toString();
    }

    static String normalize(String text) {
        String[] lines = text.replace("\r\n", "\n").replace('\r', '\n').split("\n");
        StringBuilder out = new StringBuilder(text.length());
        for (String line : lines) {
            String clean = HORIZONTAL_SPACE.matcher(line).replaceAll(" ").trim();
            if (clean.isEmpty()) continue;
            if (out.length() > 0) out.append("\n\n");
            out.append(clean);
        }
        return out.toString();
    }

    static String toText(Element root) {
        StringBuilder sb = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode) {
                    sb.append(((TextNode) node).text());
                } else if (node instanceof Element) {
                    Element el = (Element) node;
                    if ("br".equals(el.normalName()) || el.isBlock()) sb.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element && ((Element) node).isBlock()) sb.append('\n');
            }
        }, root);
        return sb.toString();
    }
}
