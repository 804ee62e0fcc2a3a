package com.storeradar.discovery.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storeradar.discovery.config.DiscoveryProperties;
import com.storeradar.discovery.error.AdapterTransportException;
import com.storeradar.discovery.error.TransientProbeException;
import com.storeradar.discovery.model.PriorityTier;
import com.storeradar.discovery.normalize.UrlNormalizer;
import com.storeradar.discovery.ratelimit.Sleeper;
import com.storeradar.discovery.validation.ProbeResponse;
import com.storeradar.discovery.validation.StorefrontHttpClient;
import com.storeradar.discovery.validation.StorefrontSignals;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Probes a feed of newly registered domains for platform fingerprints.
 *
 * The feed is plain text, one domain per line ({@code #} starts a comment). Every domain
 * costs a homepage request, hence the EXPENSIVE tier. Cursor is the line offset into the
 * feed; a feed shorter than the cursor means it rolled over and reading restarts at 0.
 */
@Component
@Slf4j
public class FingerprintProbeAdapter extends AbstractSourceAdapter {

    public static final String NAME = "fingerprint-probe";

    private static final Duration FEED_TTL = Duration.ofMinutes(30);

    private final StorefrontHttpClient storefrontClient;

    private List<String> feed;
    private Instant feedLoadedAt;

    public FingerprintProbeAdapter(RestTemplate restTemplate,
                                   ObjectMapper objectMapper,
                                   UrlTextScanner scanner,
                                   DiscoveryProperties properties,
                                   Clock clock,
                                   Sleeper sleeper,
                                   StorefrontHttpClient storefrontClient) {
        super(NAME, PriorityTier.EXPENSIVE, restTemplate, objectMapper, scanner, properties, clock, sleeper);
        this.storefrontClient = storefrontClient;
    }

    @Override
    public boolean isConfigured() {
        return settings.getFeedUrl() != null && !settings.getFeedUrl().isBlank();
    }

    @Override
    protected void fetchPage(String cursor, Page page) throws InterruptedException {
        List<String> lines = loadFeed();
        int offset = parseOffset(cursor);
        if (offset > lines.size()) {
            log.info("[{}] feed rolled over ({} lines, cursor {}), restarting", NAME, lines.size(), offset);
            offset = 0;
        }

        int end = Math.min(offset + settings.getPageSize(), lines.size());
        for (String line : lines.subList(offset, end)) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException();
            }
            String domain = line.trim().toLowerCase(Locale.ROOT);
            if (domain.isEmpty() || domain.startsWith("#")) continue;

            String url = UrlNormalizer.normalize(domain);
            if (!UrlNormalizer.isValid(url)) {
                page.dataError(line);
                continue;
            }
            if (hasFingerprint(url)) {
                page.add(url, Map.of());
            }
        }

        if (end >= lines.size()) {
            page.exhausted(null);
        } else {
            page.advance(String.valueOf(end));
        }
    }

    /**
     * Every probe is paced and counted by this adapter's rate limiter; a 429 is treated as
     * a throttle of the whole source.
     */
    private boolean hasFingerprint(String url) throws InterruptedException {
        acquirePermit();
        try {
            ProbeResponse home = storefrontClient.get(url + "/");
            return StorefrontSignals.hasShopHeader(home) || StorefrontSignals.hasPlatformAssets(home.body());
        } catch (TransientProbeException e) {
            if (e.isThrottled()) {
                throw new AdapterTransportException(e.getMessage(), true, e);
            }
            log.debug("[{}] probe of {} failed: {}", NAME, url, e.getMessage());
            return false;
        }
    }

    private List<String> loadFeed() throws InterruptedException {
        Instant now = clock.instant();
        if (feed == null || feedLoadedAt == null || !now.isBefore(feedLoadedAt.plus(FEED_TTL))) {
            feed = getText(URI.create(settings.getFeedUrl())).lines().toList();
            feedLoadedAt = now;
            log.info("[{}] loaded feed with {} lines", NAME, feed.size());
        }
        return feed;
    }

    private static int parseOffset(String cursor) {
        if (cursor == null || cursor.isBlank()) return 0;
        try {
            return Math.max(0, Integer.parseInt(cursor.trim()));
        } catch (NumberFormatException e) {
            log.warn("[{}] ignoring unreadable cursor '{}'", NAME, cursor);
            return 0;
        }
    }
}
