package com.novelsource.services.detect;

import com.novelsource.common.model.MatchType;
import com.novelsource.common.util.UrlUtils;
import com.novelsource.core.config.SourceCatalog;
import com.novelsource.core.config.SourceConfig;
import com.novelsource.core.parser.FuzzyMatchPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the configured source a book url belongs to.
 * <p>
 * Exact: the url's host is the source's host or one of its {@code domains}.
 * Fuzzy: first source, in catalog order, accepted by the {@link FuzzyMatchPolicy}
 * against its host, domains, id and name.
 */
public class SourceDetector {
    private static final Logger logger = LoggerFactory.getLogger(SourceDetector.class);

    private final SourceCatalog catalog;
    private final FuzzyMatchPolicy policy;

    public SourceDetector(SourceCatalog catalog, FuzzyMatchPolicy policy) {
        this.catalog = catalog;
        this.policy = policy == null ? FuzzyMatchPolicy.DOMAIN_LABEL : policy;
    }

    public Optional<SourceDetection> detect(String url) {
        String host = UrlUtils.host(url);
        if (host == null) {
            logger.warn("Cannot detect source, no host in url: {}", url);
            return Optional.empty();
        }

        List<SourceConfig> sources = catalog.all();

        for (SourceConfig source : sources) {
            if (host.equals(source.host()) || ownsDomain(source, host)) {
                logger.debug("🔍 {} -> {} (exact)", url, source.getId());
                return Optional.of(new SourceDetection(source.getId(), source.name, MatchType.EXACT));
            }
        }

        for (SourceConfig source : sources) {
            if (policy.anyHost(host, candidates(source))) {
                logger.debug("🔍 {} -> {} (fuzzy)", url, source.getId());
                return Optional.of(new SourceDetection(source.getId(), source.name, MatchType.FUZZY));
            }
        }

        logger.debug("🔍 No source for {}", url);
        return Optional.empty();
    }

    private static boolean ownsDomain(SourceConfig source, String host) {
        if (source.domains == null) return false;
        for (String domain : source.domains) {
            if (domain != null && domain.trim().toLowerCase(Locale.ROOT).equals(host)) return true;
        }
        return false;
    }

    private static List<String> candidates(SourceConfig source) {
        List<String> candidates = new ArrayList<>();
        if (source.host() != null) candidates.add(source.host());
        if (source.domains != null) candidates.addAll(source.domains);
        candidates.add(source.getId());
        if (source.name != null) candidates.add(source.name);
        return candidates;
    }
}
