package com.storeradar.discovery.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storeradar.discovery.config.DiscoveryProperties;
import com.storeradar.discovery.error.AdapterTransportException;
import com.storeradar.discovery.model.PriorityTier;
import com.storeradar.discovery.model.SourceMetadataKeys;
import com.storeradar.discovery.ratelimit.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Certificates issued for {@code *.myshopify.com} names, via the crt.sh JSON endpoint.
 *
 * crt.sh answers with one unpaged list, so the response is held for a few minutes and
 * served in slices. The cursor is the highest certificate id already handed out, which
 * keeps working as a high-water mark when the list grows between runs.
 */
@Component
@Slf4j
public class CertificateTransparencyAdapter extends AbstractSourceAdapter {

    public static final String NAME = "certificate-transparency";

    private static final String DEFAULT_BASE_URL = "https://crt.sh";
    private static final Duration CACHE_TTL = Duration.ofMinutes(10);

    private List<CtLogEntry> cachedEntries;
    private Instant cachedAt;

    public CertificateTransparencyAdapter(RestTemplate restTemplate,
                                          ObjectMapper objectMapper,
                                          UrlTextScanner scanner,
                                          DiscoveryProperties properties,
                                          Clock clock,
                                          Sleeper sleeper) {
        super(NAME, PriorityTier.FREE_FAST, restTemplate, objectMapper, scanner, properties, clock, sleeper);
    }

    @Override
    protected void fetchPage(String cursor, Page page) throws InterruptedException {
        long highWater = parseHighWater(cursor);
        List<CtLogEntry> entries = loadEntries(page);

        List<CtLogEntry> pending = entries.stream()
                .filter(e -> e.id() > highWater)
                .toList();
        List<CtLogEntry> slice = pending.subList(0, Math.min(settings.getPageSize(), pending.size()));

        long lastId = highWater;
        for (CtLogEntry entry : slice) {
            for (String name : entry.nameValue().split("\\R")) {
                page.addAll(scanner.scan(name), Map.of(
                        SourceMetadataKeys.CERT_ID, String.valueOf(entry.id()),
                        SourceMetadataKeys.CAPTURED_AT, entry.notBefore()));
            }
            lastId = entry.id();
        }

        if (slice.size() == pending.size()) {
            page.exhausted(String.valueOf(lastId));
        } else {
            page.advance(String.valueOf(lastId));
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<CtLogEntry> loadEntries(Page page) throws InterruptedException {
        Instant now = clock.instant();
        if (cachedEntries != null && cachedAt != null && now.isBefore(cachedAt.plus(CACHE_TTL))) {
            return cachedEntries;
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl(DEFAULT_BASE_URL) + "/")
                .queryParam("q", "%.myshopify.com")
                .queryParam("output", "json")
                .encode()
                .build()
                .toUri();

        JsonNode root = getJson(uri);
        if (!root.isArray()) {
            throw new AdapterTransportException("crt.sh returned a non-array body", false);
        }

        List<CtLogEntry> entries = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            JsonNode id = node.get("id");
            String nameValue = node.path("name_value").asText("");
            if (id == null || !id.canConvertToLong() || nameValue.isBlank()) {
                page.dataError(node.toString());
                continue;
            }
            entries.add(new CtLogEntry(id.asLong(), nameValue, node.path("not_before").asText("")));
        }
        entries.sort(Comparator.comparingLong(CtLogEntry::id));

        log.info("[{}] loaded {} certificate entries", NAME, entries.size());
        cachedEntries = entries;
        cachedAt = now;
        return entries;
    }

    private static long parseHighWater(String cursor) {
        if (cursor == null || cursor.isBlank()) return 0L;
        try {
            return Long.parseLong(cursor.trim());
        } catch (NumberFormatException e) {
            log.warn("[{}] ignoring unreadable cursor '{}'", NAME, cursor);
            return 0L;
        }
    }

    record CtLogEntry(long id, String nameValue, String notBefore) {}
}
