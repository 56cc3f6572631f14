package com.scout.pipeline.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlUtils {
    private UrlUtils() {
    }

    /**
     * Returns the trimmed locator when it is an absolute http(s) URL with a host, otherwise null.
     * The fragment is dropped so that anchors on the same page do not become separate resources.
     */
    public static String normalizeResource(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        URI uri = safeUri(candidate.trim());
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme();
        if (scheme == null || (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme))) {
            return null;
        }
        if (uri.getRawFragment() == null) {
            return candidate.trim();
        }
        String raw = candidate.trim();
        int hash = raw.indexOf('#');
        return hash < 0 ? raw : raw.substring(0, hash);
    }

    public static String domainOf(String resource) {
        String normalized = normalizeResource(resource);
        if (normalized == null) {
            return null;
        }
        URI uri = safeUri(normalized);
        return uri == null || uri.getHost() == null ? null : uri.getHost().toLowerCase(Locale.ROOT);
    }

    public static boolean sameHost(String left, String right) {
        String leftDomain = domainOf(left);
        return leftDomain != null && leftDomain.equals(domainOf(right));
    }

    public static String normalizeDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            return null;
        }
        return domain.trim().toLowerCase(Locale.ROOT);
    }

    public static URI safeUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
