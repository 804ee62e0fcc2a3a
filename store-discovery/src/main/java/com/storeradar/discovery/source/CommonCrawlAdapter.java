package com.storeradar.discovery.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storeradar.discovery.config.DiscoveryProperties;
import com.storeradar.discovery.error.AdapterDataException;
import com.storeradar.discovery.error.AdapterTransportException;
import com.storeradar.discovery.model.PriorityTier;
import com.storeradar.discovery.model.SourceMetadataKeys;
import com.storeradar.discovery.ratelimit.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Captured {@code *.myshopify.com} pages from the latest Common Crawl CDX index.
 *
 * The CDX server answers in NDJSON, one capture per line.
 * Cursor format: {@code <index-id>:<page>}, e.g. {@code CC-MAIN-2024-33:4}.
 */
@Component
@Slf4j
public class CommonCrawlAdapter extends AbstractSourceAdapter {

    public static final String NAME = "common-crawl";

    private static final String DEFAULT_BASE_URL = "https://index.commoncrawl.org";

    public CommonCrawlAdapter(RestTemplate restTemplate,
                              ObjectMapper objectMapper,
                              UrlTextScanner scanner,
                              DiscoveryProperties properties,
                              Clock clock,
                              Sleeper sleeper) {
        super(NAME, PriorityTier.FREE_SLOW, restTemplate, objectMapper, scanner, properties, clock, sleeper);
    }

    @Override
    protected void fetchPage(String cursor, Page page) throws InterruptedException {
        IndexCursor position = IndexCursor.parse(cursor);
        String indexId = position.indexId() != null ? position.indexId() : latestIndexId();

        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl(DEFAULT_BASE_URL) + "/" + indexId + "-index")
                .queryParam("url", "*.myshopify.com")
                .queryParam("output", "json")
                .queryParam("fl", "url,urlkey,timestamp")
                .queryParam("page", position.page())
                .encode()
                .build()
                .toUri();

        String body;
        try {
            body = getText(uri);
        } catch (HttpClientErrorException.NotFound | HttpClientErrorException.BadRequest e) {
            // past the last page the CDX server answers 404/400 instead of an empty body
            log.info("[{}] index {} exhausted at page {}", NAME, indexId, position.page());
            page.exhausted(null);
            return;
        }

        List<String> lines = body.lines().filter(l -> !l.isBlank()).toList();
        if (lines.isEmpty()) {
            page.exhausted(null);
            return;
        }

        Set<String> hosts = new LinkedHashSet<>();
        Map<String, String> capturedAt = new HashMap<>();
        for (String line : lines) {
            try {
                JsonNode capture = parseRecord(line);
                String url = capture.path("url").asText(null);
                List<String> found = url != null ? scanner.scan(url) : fromUrlKey(capture.path("urlkey").asText(null));
                if (found.isEmpty() && url == null) {
                    page.dataError(line);
                    continue;
                }
                for (String f : found) {
                    if (hosts.add(f)) capturedAt.put(f, capture.path("timestamp").asText(""));
                }
            } catch (AdapterDataException e) {
                page.dataError(e.getMessage());
            }
        }

        hosts.forEach(h -> page.add(h, Map.of(SourceMetadataKeys.CAPTURED_AT, capturedAt.get(h))));
        page.advance(indexId + ":" + (position.page() + 1));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String latestIndexId() throws InterruptedException {
        JsonNode indexes = getJson(URI.create(baseUrl(DEFAULT_BASE_URL) + "/collinfo.json"));
        if (!indexes.isArray() || indexes.isEmpty() || !indexes.get(0).hasNonNull("id")) {
            throw new AdapterTransportException("collinfo.json listed no crawl indexes", false);
        }
        // newest crawl first
        String id = indexes.get(0).get("id").asText();
        log.info("[{}] using crawl index {}", NAME, id);
        return id;
    }

    /**
     * SURT key to URL: {@code com,myshopify,store)/path} → {@code https://store.myshopify.com}.
     */
    private List<String> fromUrlKey(String urlKey) {
        if (urlKey == null || !urlKey.contains(")")) return List.of();
        List<String> labels = new ArrayList<>(List.of(urlKey.substring(0, urlKey.indexOf(')')).split(",")));
        Collections.reverse(labels);
        return scanner.fromDomain(String.join(".", labels)).map(List::of).orElse(List.of());
    }

    record IndexCursor(String indexId, int page) {

        static IndexCursor parse(String cursor) {
            if (cursor == null || !cursor.contains(":")) return new IndexCursor(null, 0);
            int sep = cursor.lastIndexOf(':');
            try {
                return new IndexCursor(cursor.substring(0, sep), Integer.parseInt(cursor.substring(sep + 1)));
            } catch (NumberFormatException e) {
                log.warn("[{}] ignoring unreadable cursor '{}'", NAME, cursor);
                return new IndexCursor(null, 0);
            }
        }
    }
}
