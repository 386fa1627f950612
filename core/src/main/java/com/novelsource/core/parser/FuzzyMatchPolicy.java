package com.novelsource.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * How a URL is matched to a parser or source when no host matches exactly.
 */
public enum FuzzyMatchPolicy {

    /**
     * The host's leading label (after www./m./wap.) occurs in a candidate domain, or the
     * candidate's leading label occurs in the host. Labels shorter than 3 chars are ignored.
     */
    DOMAIN_LABEL {
        @Override
        public boolean matchesHost(String host, String candidate) {
            String label = leadingLabel(host);
            String candidateLabel = leadingLabel(candidate);
            if (label.length() >= MIN_LABEL && candidate.toLowerCase(Locale.ROOT).contains(label)) return true;
            return candidateLabel.length() >= MIN_LABEL && host.contains(candidateLabel);
        }
    },

    /**
     * Host equals a candidate domain or is one of its subdomains.
     */
    HOST_SUFFIX {
        @Override
        public boolean matchesHost(String host, String candidate) {
            String c = stripPrefix(candidate.toLowerCase(Locale.ROOT));
            return host.equals(c) || host.endsWith("." + c);
        }
    },

    /**
     * Only a parser's URL regex counts.
     */
    PATTERN {
        @Override
        public boolean matchesHost(String host, String candidate) {
            return false;
        }
    };

    private static final int MIN_LABEL = 3;

    public abstract boolean matchesHost(String host, String candidate);

    /**
     * Candidates are the descriptor's domains and its name.
     */
    public boolean matches(String url, String host, ParserDescriptor descriptor) {
        if (url == null) return false;
        if (descriptor.getUrlPattern() != null && descriptor.getUrlPattern().matcher(url).find()) return true;
        if (host == null || this == PATTERN) return false;

        List<String> candidates = new ArrayList<>(descriptor.getDomains());
        if (this == DOMAIN_LABEL) candidates.add(descriptor.getName());
        return anyHost(host, candidates);
    }

    public boolean anyHost(String host, List<String> candidates) {
        if (host == null) return false;
        String h = host.toLowerCase(Locale.ROOT);
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank() && matchesHost(h, candidate.trim())) return true;
        }
        return false;
    }

    static String leadingLabel(String host) {
        String h = stripPrefix(host.toLowerCase(Locale.ROOT));
        int dot = h.indexOf('.');
        return dot < 0 ? h : h.substring(0, dot);
    }

    private static String stripPrefix(String host) {
        for (String prefix : new String[] {"www.", "m.", "wap."}) {
            if (host.startsWith(prefix)) return host.substring(prefix.length());
        }
        return host;
    }
}
