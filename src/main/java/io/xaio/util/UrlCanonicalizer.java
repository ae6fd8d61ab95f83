package io.xaio.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalizes source URLs into the canonical key a work item is identified by.
 */
public final class UrlCanonicalizer {
    private static final Set<String> TRACKING_PARAMS = Set.of(
            "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content", "utm_id",
            "utm_name", "utm_reader", "utm_referrer", "utm_social", "fbclid", "gclid"
    );
    private static final int ITEM_ID_HEX_CHARS = 16;

    private UrlCanonicalizer() {
    }

    public static String canonicalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("source url must not be blank");
        }
        URI uri;
        try {
            uri = new URI(raw.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Unparsable source url: " + raw, e);
        }
        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            throw new IllegalArgumentException("Source url must be absolute: " + raw);
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        if (host.isBlank()) {
            throw new IllegalArgumentException("Source url has no host: " + raw);
        }
        int port = uri.getPort();
        boolean defaultPort = port == -1
                || ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://");
        if (uri.getRawUserInfo() != null) {
            sb.append(uri.getRawUserInfo()).append('@');
        }
        sb.append(host);
        if (!defaultPort) {
            sb.append(':').append(port);
        }
        String path = uri.getRawPath();
        sb.append(path == null || path.isEmpty() ? "/" : path);
        String query = cleanQuery(uri.getRawQuery());
        if (!query.isEmpty()) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }

    /**
     * Lenient form of {@link #canonicalize} for URLs found inside captured documents: blank stays blank and
     * anything unparsable is returned trimmed.
     */
    public static String clean(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        try {
            return canonicalize(url);
        } catch (IllegalArgumentException e) {
            return url.trim();
        }
    }

    public static String itemIdFor(String canonicalKey) {
        return Hashing.sha256Hex(canonicalKey).substring(0, ITEM_ID_HEX_CHARS);
    }

    public static String domainOf(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        try {
            String host = new URI(url.trim()).getHost();
            return host == null ? "" : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return "";
        }
    }

    private static String cleanQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            if (!TRACKING_PARAMS.contains(key.toLowerCase(Locale.ROOT))) {
                kept.add(pair);
            }
        }
        return String.join("&", kept);
    }
}
