package com.novelsource.core.parser;

import com.novelsource.api.SourceParser;
import com.novelsource.common.error.ConfigException;
import com.novelsource.common.model.MatchType;
import com.novelsource.common.util.UrlUtils;
import com.novelsource.core.config.SourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only table of specialized parsers, built once by {@link Builder}.
 * <p>
 * Resolves a source id or a book url to a parser bound to a {@link SourceConfig}. When no
 * specialized parser applies, {@link #getParserForSource} falls back to a {@link BaseParser}.
 * Lookups take no locks.
 */
public final class ParserRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ParserRegistry.class);

    public static final String GENERIC_PARSER = "base";

    private final Map<String, ParserDescriptor> descriptors; // normalized name -> descriptor, registration order
    private final ParserContext context;
    private final FuzzyMatchPolicy policy;

    private ParserRegistry(Builder builder) {
        this.descriptors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.descriptors));
        this.context = builder.context;
        this.policy = builder.policy;
    }

    public static Builder builder(ParserContext context) {
        return new Builder(context);
    }

    /**
     * Lower case without spaces, dashes and underscores: "Dd-Yue_Shu" and "ddyueshu" are the same parser.
     */
    public static String normalizeKey(String name) {
        if (name == null) return "";
        return name.toLowerCase(Locale.ROOT).replaceAll("[\\s_-]", "");
    }

    public ParserContext getContext() {
        return context;
    }

    public FuzzyMatchPolicy getPolicy() {
        return policy;
    }

    /**
     * The specialized parser registered under {@code nameOrId}, else the generic parser, bound to {@code config}.
     */
    public SourceParser getParserForSource(String nameOrId, SourceConfig config) throws ConfigException {
        BaseParser base = new BaseParser(config, context);
        ParserDescriptor descriptor = descriptors.get(normalizeKey(nameOrId));
        if (descriptor == null) {
            logger.debug("No specialized parser for '{}', using generic parser", nameOrId);
            return base;
        }
        return descriptor.getFactory().create(base);
    }

    /**
     * Finds the parser owning {@code url}: exact host match first, then the first fuzzy match in
     * registration order. Empty when nothing matches, which is a normal outcome.
     */
    public Optional<ParserMatch> getParserForUrl(String url, SourceConfig config) throws ConfigException {
        Optional<ParserDescriptor> found = findDescriptor(url);
        if (found.isEmpty()) return Optional.empty();

        ParserDescriptor descriptor = found.get();
        MatchType type = descriptor.ownsHost(UrlUtils.host(url)) ? MatchType.EXACT : MatchType.FUZZY;
        SourceParser parser = descriptor.getFactory().create(new BaseParser(config, context));
        return Optional.of(new ParserMatch(descriptor, parser, type));
    }

    /**
     * Matching without building a parser.
     */
    public Optional<ParserDescriptor> findDescriptor(String url) {
        String host = UrlUtils.host(url);
        if (host != null) {
            for (ParserDescriptor d : descriptors.values()) {
                if (d.ownsHost(host)) return Optional.of(d);
            }
        }
        for (ParserDescriptor d : descriptors.values()) {
            if (d.canHandleUrl(url, policy)) return Optional.of(d);
        }
        return Optional.empty();
    }

    public Optional<ParserDescriptor> getDescriptor(String nameOrId) {
        return Optional.ofNullable(descriptors.get(normalizeKey(nameOrId)));
    }

    /**
     * Registered parsers in registration order.
     */
    public List<ParserDescriptor> listParsers() {
        return new ArrayList<>(descriptors.values());
    }

    public int size() {
        return descriptors.size();
    }

    public static final class Builder {
        private final Map<String, ParserDescriptor> descriptors = new LinkedHashMap<>();
        private final ParserContext context;
        private FuzzyMatchPolicy policy = FuzzyMatchPolicy.DOMAIN_LABEL;

        private Builder(ParserContext context) {
            this.context = context;
        }

        public Builder policy(FuzzyMatchPolicy policy) {
            this.policy = policy == null ? FuzzyMatchPolicy.DOMAIN_LABEL : policy;
            return this;
        }

        /**
         * @throws ConfigException if a parser with the same normalized name is already registered
         */
        public Builder register(ParserDescriptor descriptor) throws ConfigException {
            String key = normalizeKey(descriptor.getName());
            if (key.equals(GENERIC_PARSER)) {
                throw new ConfigException("Parser name '" + descriptor.getName() + "' is reserved", descriptor.getName());
            }
            ParserDescriptor existing = descriptors.get(key);
            if (existing != null) {
                throw new ConfigException("Duplicate parser name '" + descriptor.getName()
                        + "' (already registered as '" + existing.getName() + "')", descriptor.getName());
            }
            descriptors.put(key, descriptor);
            logger.debug("Registered parser {} for {}", descriptor.getName(), descriptor.getDomains());
            return this;
        }

        public boolean isRegistered(String name) {
            return descriptors.containsKey(normalizeKey(name));
        }

        /**
         * Number of parsers registered so far, for {@link #rollbackTo(int)}.
         */
        public int checkpoint() {
            return descriptors.size();
        }

        /**
         * Drops every parser registered after {@code checkpoint}.
         */
        public void rollbackTo(int checkpoint) {
            List<String> keys = new ArrayList<>(descriptors.keySet());
            for (String key : keys.subList(Math.max(0, Math.min(checkpoint, keys.size())), keys.size())) {
                ParserDescriptor dropped = descriptors.remove(key);
                logger.debug("Dropped parser {} for {}", dropped.getName(), dropped.getDomains());
            }
        }

        public ParserRegistry build() {
            return new ParserRegistry(this);
        }
    }
}
