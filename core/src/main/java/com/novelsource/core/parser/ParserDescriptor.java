package com.novelsource.core.parser;

import com.novelsource.common.util.UrlUtils;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Registration entry of a specialized parser: its identity, the hosts it owns and how to build it.
 */
public final class ParserDescriptor {
    private final String name;
    private final String displayName;
    private final Set<String> domains;
    private final Pattern urlPattern;
    private final ParserFactory factory;

    private ParserDescriptor(Builder b) {
        this.name = b.name;
        this.displayName = b.displayName == null ? b.name : b.displayName;
        this.domains = Collections.unmodifiableSet(new LinkedHashSet<>(b.domains));
        this.urlPattern = b.urlPattern;
        this.factory = b.factory;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Lower-cased host names claimed exactly.
     */
    public Set<String> getDomains() {
        return domains;
    }

    public Pattern getUrlPattern() {
        return urlPattern;
    }

    public ParserFactory getFactory() {
        return factory;
    }

    public boolean ownsHost(String host) {
        return host != null && domains.contains(host.toLowerCase(Locale.ROOT));
    }

    /**
     * Fuzzy ownership test under the given policy.
     */
    public boolean canHandleUrl(String url, FuzzyMatchPolicy policy) {
        return policy.matches(url, UrlUtils.host(url), this);
    }

    @Override
    public String toString() {
        return name + domains;
    }

    public static final class Builder {
        private final String name;
        private String displayName;
        private final Set<String> domains = new LinkedHashSet<>();
        private Pattern urlPattern;
        private ParserFactory factory;

        private Builder(String name) {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("Parser name is required");
            this.name = name.trim();
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder domain(String... hosts) {
            for (String host : hosts) {
                if (host != null && !host.isBlank()) domains.add(host.trim().toLowerCase(Locale.ROOT));
            }
            return this;
        }

        public Builder urlPattern(String regex) {
            this.urlPattern = regex == null ? null : Pattern.compile(regex);
            return this;
        }

        public Builder factory(ParserFactory factory) {
            this.factory = factory;
            return this;
        }

        public ParserDescriptor build() {
            if (factory == null) throw new IllegalStateException("Parser " + name + " has no factory");
            return new ParserDescriptor(this);
        }
    }
}
