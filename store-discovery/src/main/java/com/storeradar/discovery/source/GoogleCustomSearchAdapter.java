package com.storeradar.discovery.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storeradar.discovery.config.DiscoveryProperties;
import com.storeradar.discovery.model.PriorityTier;
import com.storeradar.discovery.model.SourceMetadataKeys;
import com.storeradar.discovery.ratelimit.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Google Programmable Search (Custom Search JSON API).
 *
 * Needs an API key and a search engine id. The API pages 10 results at a time and stops
 * at start=91, so each configured query yields at most 100 results.
 * Cursor format: {@code <query-index>:<start>}.
 */
@Component
@Slf4j
public class GoogleCustomSearchAdapter extends AbstractSourceAdapter {

    public static final String NAME = "google-custom-search";

    private static final String DEFAULT_BASE_URL = "https://www.googleapis.com/customsearch/v1";
    private static final List<String> DEFAULT_QUERIES = List.of(
            "site:myshopify.com",
            "\"powered by shopify\" \"new arrivals\"");
    private static final int PAGE_SIZE = 10;
    private static final int MAX_START = 91;

    public GoogleCustomSearchAdapter(RestTemplate restTemplate,
                                     ObjectMapper objectMapper,
                                     UrlTextScanner scanner,
                                     DiscoveryProperties properties,
                                     Clock clock,
                                     Sleeper sleeper) {
        super(NAME, PriorityTier.QUOTA_LIMITED, restTemplate, objectMapper, scanner, properties, clock, sleeper);
    }

    @Override
    public boolean isConfigured() {
        return notBlank(settings.getApiKey()) && notBlank(settings.getSearchEngineId());
    }

    @Override
    protected void fetchPage(String cursor, Page page) throws InterruptedException {
        List<String> queries = settings.getQueries().isEmpty() ? DEFAULT_QUERIES : settings.getQueries();
        SearchCursor position = SearchCursor.parse(cursor, queries.size());

        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl(DEFAULT_BASE_URL))
                .queryParam("key", settings.getApiKey())
                .queryParam("cx", settings.getSearchEngineId())
                .queryParam("q", queries.get(position.queryIndex()))
                .queryParam("start", position.start())
                .queryParam("num", PAGE_SIZE)
                .encode()
                .build()
                .toUri();

        JsonNode items = getJson(uri).path("items");
        int returned = 0;
        for (JsonNode item : items) {
            returned++;
            String link = item.path("link").asText(null);
            if (link == null) {
                page.dataError(item.toString());
                continue;
            }
            List<String> urls = scanner.scan(link);
            if (urls.isEmpty()) {
                urls = scanner.fromDomain(item.path("displayLink").asText(null)).map(List::of).orElse(List.of());
            }
            page.addAll(urls, Map.of(SourceMetadataKeys.SNIPPET, item.path("snippet").asText("")));
        }

        int nextStart = position.start() + PAGE_SIZE;
        if (returned == PAGE_SIZE && nextStart <= MAX_START) {
            page.advance(position.queryIndex() + ":" + nextStart);
        } else if (position.queryIndex() + 1 < queries.size()) {
            page.advance((position.queryIndex() + 1) + ":1");
        } else {
            page.exhausted(null);
        }
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    record SearchCursor(int queryIndex, int start) {

        static SearchCursor parse(String cursor, int queryCount) {
            if (cursor == null || !cursor.contains(":")) return new SearchCursor(0, 1);
            String[] parts = cursor.split(":", 2);
            try {
                int q = Integer.parseInt(parts[0]);
                int start = Integer.parseInt(parts[1]);
                if (q < 0 || q >= queryCount || start < 1 || start > MAX_START) {
                    return new SearchCursor(0, 1);
                }
                return new SearchCursor(q, start);
            } catch (NumberFormatException e) {
                log.warn("[{}] ignoring unreadable cursor '{}'", NAME, cursor);
                return new SearchCursor(0, 1);
            }
        }
    }
}
