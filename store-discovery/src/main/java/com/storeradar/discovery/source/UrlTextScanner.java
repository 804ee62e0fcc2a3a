package com.storeradar.discovery.source;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls storefront URLs out of free text (post bodies, ad copy, search snippets, certificate names).
 *
 * Shared by every adapter so "does this look like a store link" is decided in one place.
 * Returns raw URLs; canonicalization happens later in the normalizer.
 */
@Component
public class UrlTextScanner {

    private static final Pattern EXPLICIT_URL = Pattern.compile(
            "https?://[^\\s\"'<>()\\[\\]{}|\\\\^`,;]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern PLATFORM_HOST = Pattern.compile(
            "(?<![a-z0-9.-])(?:\\*\\.)?([a-z0-9][a-z0-9-]*\\.myshopify\\.com)(?![a-z0-9-])",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern BARE_DOMAIN = Pattern.compile(
            "^(?:[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]{2,24}$");

    /** Hosts that show up next to store links but are never storefronts themselves. */
    private static final List<String> EXCLUDED_HOSTS = List.of(
            "reddit.com", "redd.it", "imgur.com", "youtube.com", "youtu.be",
            "facebook.com", "fb.com", "instagram.com", "twitter.com", "x.com",
            "tiktok.com", "pinterest.com", "linkedin.com", "google.com",
            "web.archive.org", "shopify.com", "shopifycdn.com", "shopify.dev"
    );

    /** Platform-owned subdomains of the store host that are not stores. */
    private static final Set<String> EXCLUDED_PLATFORM_LABELS = Set.of(
            "admin", "partners", "help", "community", "developers", "apps", "checkout", "accounts"
    );

    /**
     * Every distinct store-looking URL in the text, in order of first appearance.
     */
    public List<String> scan(String text) {
        if (text == null || text.isBlank()) return List.of();

        Set<String> found = new LinkedHashSet<>();

        Matcher url = EXPLICIT_URL.matcher(text);
        while (url.find()) {
            String candidate = trimPunctuation(url.group());
            if (!isExcluded(hostOf(candidate))) {
                found.add(candidate);
            }
        }

        Matcher host = PLATFORM_HOST.matcher(text);
        while (host.find()) {
            String h = host.group(1).toLowerCase(Locale.ROOT);
            if (!isExcluded(h) && found.stream().noneMatch(f -> hostOf(f).equals(h))) {
                found.add("https://" + h);
            }
        }

        return new ArrayList<>(found);
    }

    /**
     * A bare domain from a structured field (ad link caption, display link) as a URL.
     * Empty when the value is not a plain host name or points at an excluded host.
     */
    public Optional<String> fromDomain(String value) {
        if (value == null) return Optional.empty();
        String host = value.trim().toLowerCase(Locale.ROOT);
        if (host.startsWith("http://") || host.startsWith("https://")) {
            host = hostOf(host);
        }
        while (host.endsWith("/") || host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        if (!BARE_DOMAIN.matcher(host).matches() || isExcluded(host)) {
            return Optional.empty();
        }
        return Optional.of("https://" + host);
    }

    /**
     * True when the host belongs to a social network, the platform itself or one of its
     * non-store subdomains.
     */
    public boolean isExcluded(String host) {
        if (host == null || host.isBlank()) return true;
        String h = host.toLowerCase(Locale.ROOT);
        if (h.startsWith("www.")) h = h.substring(4);

        if (h.endsWith(".myshopify.com")) {
            String label = h.substring(0, h.length() - ".myshopify.com".length());
            return EXCLUDED_PLATFORM_LABELS.contains(label);
        }
        for (String excluded : EXCLUDED_HOSTS) {
            if (h.equals(excluded) || h.endsWith("." + excluded)) {
                return true;
            }
        }
        return false;
    }

    private static String hostOf(String url) {
        String rest = url.replaceFirst("(?i)^https?://", "");
        int end = rest.length();
        for (char c : new char[]{'/', '?', '#', ':'}) {
            int idx = rest.indexOf(c);
            if (idx >= 0 && idx < end) end = idx;
        }
        return rest.substring(0, end).toLowerCase(Locale.ROOT);
    }

    private static String trimPunctuation(String url) {
        int end = url.length();
        while (end > 0 && ".!?:'\")".indexOf(url.charAt(end - 1)) >= 0) {
            end--;
        }
        return url.substring(0, end);
    }
}
