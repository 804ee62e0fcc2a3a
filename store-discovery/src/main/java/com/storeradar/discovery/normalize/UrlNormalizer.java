package com.storeradar.discovery.normalize;

import java.net.IDN;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes candidate URLs into identity URLs of the form {@code https://host[:port]}.
 *
 * Rules:
 *  - scheme is forced to https; a missing scheme is assumed
 *  - host is lower-cased, IDN hosts are converted to ASCII, trailing dots are dropped
 *  - default ports (80, 443) are dropped
 *  - path, query and fragment are dropped (a storefront is identified by its root)
 *  - www., www2. etc. prefixes are folded away
 *
 * Total and pure: anything that cannot be parsed maps to {@link #INVALID}.
 * {@code normalize(normalize(x)).equals(normalize(x))} holds for every input.
 */
public final class UrlNormalizer {

    /** Sentinel for unparseable input. Always rejected downstream. */
    public static final String INVALID = "invalid:";

    private static final String PLATFORM_SUFFIX = ".myshopify.com";

    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://");
    private static final Pattern WWW_PREFIX = Pattern.compile("^www\\d*\\.");
    private static final Pattern HOSTNAME = Pattern.compile(
            "^[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?(?:\\.[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?)+$");

    private UrlNormalizer() {
    }

    public static String normalize(String raw) {
        if (raw == null) return INVALID;
        String s = raw.trim();
        if (s.isEmpty() || INVALID.equals(s)) return INVALID;

        if (s.startsWith("//")) {
            s = "https:" + s;
        } else if (!SCHEME.matcher(s).find()) {
            s = "https://" + s;
        }

        int schemeEnd = s.indexOf("://");
        String scheme = s.substring(0, schemeEnd).toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return INVALID;

        String rest = s.substring(schemeEnd + 3);
        int authorityEnd = indexOfAny(rest, '/', '?', '#', '\\');
        String authority = authorityEnd < 0 ? rest : rest.substring(0, authorityEnd);

        int at = authority.lastIndexOf('@');
        if (at >= 0) authority = authority.substring(at + 1);

        String host = authority;
        String port = null;
        int colon = authority.lastIndexOf(':');
        if (colon >= 0) {
            host = authority.substring(0, colon);
            port = authority.substring(colon + 1);
            if (port.isEmpty()) {
                port = null;
            } else if (!port.chars().allMatch(Character::isDigit) || port.length() > 5) {
                return INVALID;
            }
        }

        host = foldHost(host);
        if (host == null) return INVALID;

        StringBuilder out = new StringBuilder("https://").append(host);
        if (port != null) {
            int p = Integer.parseInt(port);
            if (p <= 0 || p > 65535) return INVALID;
            if (p != 80 && p != 443) out.append(':').append(p);
        }
        return out.toString();
    }

    public static boolean isValid(String normalized) {
        return normalized != null && !INVALID.equals(normalized);
    }

    /**
     * Host part of an already normalized identity URL, without the port.
     */
    public static String hostOf(String normalized) {
        if (!isValid(normalized)) return "";
        String host = normalized.substring("https://".length());
        int colon = host.indexOf(':');
        return colon < 0 ? host : host.substring(0, colon);
    }

    /**
     * True for {@code <store>.myshopify.com} hosts, which are almost always freshly created stores.
     */
    public static boolean isPlatformHost(String normalized) {
        return hostOf(normalized).endsWith(PLATFORM_SUFFIX);
    }

    private static String foldHost(String rawHost) {
        String host = rawHost.toLowerCase(Locale.ROOT);
        while (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        if (host.isEmpty()) return null;

        try {
            host = IDN.toASCII(host, IDN.ALLOW_UNASSIGNED).toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }

        while (true) {
            var m = WWW_PREFIX.matcher(host);
            if (!m.find()) break;
            String stripped = host.substring(m.end());
            if (stripped.indexOf('.') < 0) break;
            host = stripped;
        }

        return HOSTNAME.matcher(host).matches() ? host : null;
    }

    private static int indexOfAny(String s, char... chars) {
        int best = -1;
        for (char c : chars) {
            int idx = s.indexOf(c);
            if (idx >= 0 && (best < 0 || idx < best)) best = idx;
        }
        return best;
    }
}
